/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.versatile.store.search;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.PerfLogger;
import org.versatile.store.Namespace;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

import com.google.common.collect.Iterables;

/**
 * Searches the text lines of the latest revisions of a container.
 * <p>
 * The backend narrows the candidate lines with a case-insensitive regular
 * expression. A pattern that does not compile falls back to {@code .} at
 * the backend, matching every line. The exact match, with case sensitivity
 * and word boundaries, is then applied to each candidate line.
 */
public class TextSearch {

    private static final Logger LOG = LoggerFactory.getLogger(TextSearch.class);

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(TextSearch.class.getName() + ".perf"));

    static final String MATCH_ALL = ".";

    private final RDBSchema schema;
    private final int batchSize;
    private final long perfLogThreshold;

    public TextSearch(@NotNull RDBSchema schema, int batchSize, long perfLogThreshold) {
        this.schema = schema;
        this.batchSize = batchSize;
        this.perfLogThreshold = perfLogThreshold;
    }

    /**
     * @param connection the connection to use
     * @param pattern the search pattern
     * @param containerId the container to search in
     * @param options the search options
     * @return matching lines by document name, ordered by document name
     */
    @NotNull
    public Map<String, List<String>> search(@NotNull Connection connection, @NotNull String pattern,
                                            long containerId, @NotNull SearchOptions options) throws SQLException {
        long start = PERFLOG.start();
        String backendPattern = toBackendPattern(pattern, options);
        Pattern filter = toLineFilter(pattern, options);
        Map<String, List<String>> result = new LinkedHashMap<String, List<String>>();

        if (options.getDocuments() == null) {
            query(connection, containerId, backendPattern, null, filter, options, result);
        } else {
            for (List<String> chunk : Iterables.partition(options.getDocuments(), batchSize)) {
                query(connection, containerId, backendPattern, chunk, filter, options, result);
            }
        }
        PERFLOG.end(start, perfLogThreshold, "search: '{}' in container {} found {} documents",
                pattern, containerId, result.size());
        return result;
    }

    private void query(Connection connection, long containerId, String backendPattern, List<String> documents,
                       Pattern filter, SearchOptions options, Map<String, List<String>> result)
            throws SQLException {
        SqlStatement select = new SqlStatement("select n.NAME, t.VAL from " + schema.getTextLines() + " t"
                + " join " + schema.getRevisions() + " r on r.REV_ID = t.REV_ID"
                + " join " + schema.getNames() + " n on n.NID = r.NID"
                + " where r.NAMESPACE = ? and r.CONTAINER_ID = ? and t.DUCKTYPE = 0"
                + " and REGEXP_LIKE(t.VAL, ?, 'i')",
                Namespace.LATEST.getId(), containerId, backendPattern);
        if (documents != null) {
            if (documents.isEmpty()) {
                return;
            }
            List<String> terminated = new ArrayList<String>(documents.size());
            for (String d : documents) {
                terminated.add(EndOfValue.terminate(d));
            }
            select.append(" and n.NAME in ").appendIn(terminated);
        }
        select.append(" order by n.NAME, t.LNUM");
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String document = EndOfValue.strip(rs.getString(1));
                String line = rs.getString(2);
                if (!filter.matcher(line).find()) {
                    continue;
                }
                List<String> lines = result.get(document);
                if (lines == null) {
                    lines = new ArrayList<String>();
                    result.put(document, lines);
                } else if (options.isFilesWithoutMatch()) {
                    continue;
                }
                lines.add(line);
            }
        }
    }

    /**
     * Returns the pattern the backend narrows candidates with. Literal text
     * is quoted, a regular expression that does not compile is replaced by
     * a pattern matching everything.
     */
    @NotNull
    static String toBackendPattern(@NotNull String pattern, @NotNull SearchOptions options) {
        if (!options.isRegex()) {
            return Pattern.quote(pattern);
        }
        try {
            Pattern.compile(pattern);
            return pattern;
        } catch (PatternSyntaxException e) {
            LOG.warn("Malformed search pattern '{}', matching all lines at the backend: {}", pattern, e.getDescription());
            return MATCH_ALL;
        }
    }

    /**
     * Returns the pattern applied to each candidate line. A regular
     * expression that does not compile is matched as literal text.
     */
    @NotNull
    static Pattern toLineFilter(@NotNull String pattern, @NotNull SearchOptions options) {
        String regex = options.isRegex() ? pattern : Pattern.quote(pattern);
        if (options.isRegex()) {
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                regex = Pattern.quote(pattern);
            }
        }
        if (options.isWordBoundaries()) {
            regex = "\\b(?:" + regex + ")\\b";
        }
        int flags = options.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(regex, flags);
    }
}
