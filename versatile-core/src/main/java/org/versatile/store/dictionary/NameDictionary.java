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
package org.versatile.store.dictionary;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.PerfLogger;
import org.versatile.store.VersatileException;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

import com.google.common.collect.Iterables;

/**
 * Interns strings to stable ids.
 * <p>
 * Ids are never renumbered or deleted, so entries of the cache are never
 * invalidated. The cache lives as long as the dictionary, which is shared
 * by all requests of a store, and is only populated with ids that are
 * committed in the backend.
 */
public class NameDictionary {

    private static final Logger LOG = LoggerFactory.getLogger(NameDictionary.class);

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(NameDictionary.class.getName() + ".perf"));

    static final int QUERY_CHUNK = 500;

    private final String table;

    private final long perfLogThreshold;

    private final Map<String, Long> ids = new ConcurrentHashMap<String, Long>();

    private final Map<Long, String> names = new ConcurrentHashMap<Long, String>();

    private final BulkInsert<String> insert;

    public NameDictionary(@NotNull RDBSchema schema, long perfLogThreshold) {
        this.table = schema.getNames();
        this.perfLogThreshold = perfLogThreshold;
        this.insert = new BulkInsert<String>("insert into " + table + " (NAME) values (?)",
                (stmt, name) -> stmt.setString(1, EndOfValue.terminate(name)));
        for (Map.Entry<String, Long> e : WellKnownNames.getCatalog().entrySet()) {
            cache(e.getKey(), e.getValue());
        }
    }

    /**
     * Returns the ids of the given names, creating ids for names not seen
     * before.
     * <p>
     * Names are first looked up in the cache and the backend. Missing names
     * are inserted, tolerating duplicates from concurrent processes, the
     * inserts are committed and the ids are read back. The connection
     * therefore must not hold uncommitted work that must not be committed
     * yet.
     *
     * @param connection the connection to use
     * @param requested the names to resolve
     * @return a map from each requested name to its id
     * @throws SQLException if the backend fails
     */
    @NotNull
    public Map<String, Long> resolve(@NotNull Connection connection, @NotNull Collection<String> requested)
            throws SQLException {
        long start = PERFLOG.start();
        Map<String, Long> result = lookup(connection, requested);
        Set<String> missing = new LinkedHashSet<String>(requested);
        missing.removeAll(result.keySet());
        if (!missing.isEmpty()) {
            int created = insert.executeIgnoringDuplicates(connection, missing);
            connection.commit();
            LOG.debug("Created {} of {} new names", created, missing.size());
            Map<String, Long> inserted = lookup(connection, missing);
            if (inserted.size() != missing.size()) {
                missing.removeAll(inserted.keySet());
                throw new VersatileException("Failed to resolve names: " + missing);
            }
            result.putAll(inserted);
        }
        PERFLOG.end(start, perfLogThreshold, "resolve: {} names, {} created", requested.size(), missing.size());
        return result;
    }

    /**
     * Resolves a single name.
     *
     * @see #resolve(Connection, Collection)
     */
    public long resolve(@NotNull Connection connection, @NotNull String name) throws SQLException {
        return resolve(connection, Collections.singleton(name)).get(name);
    }

    /**
     * Looks up the ids of the given names without creating any.
     *
     * @return a map holding the names that have an id
     */
    @NotNull
    public Map<String, Long> lookup(@NotNull Connection connection, @NotNull Collection<String> requested)
            throws SQLException {
        Map<String, Long> result = new HashMap<String, Long>();
        Set<String> uncached = new LinkedHashSet<String>();
        for (String name : requested) {
            Long id = ids.get(name);
            if (id != null) {
                result.put(name, id);
            } else {
                uncached.add(name);
            }
        }
        for (List<String> chunk : Iterables.partition(uncached, QUERY_CHUNK)) {
            List<String> terminated = new ArrayList<String>(chunk.size());
            for (String name : chunk) {
                terminated.add(EndOfValue.terminate(name));
            }
            SqlStatement select = new SqlStatement("select NID, NAME from " + table + " where NAME in ")
                    .appendIn(terminated);
            try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String name = EndOfValue.strip(rs.getString(2));
                    long id = rs.getLong(1);
                    cache(name, id);
                    result.put(name, id);
                }
            }
        }
        return result;
    }

    /**
     * Looks up a single name without creating it.
     *
     * @return the id or {@code null} if the name has no id yet
     */
    @Nullable
    public Long lookup(@NotNull Connection connection, @NotNull String name) throws SQLException {
        return lookup(connection, Collections.singleton(name)).get(name);
    }

    /**
     * Returns the names for the given ids.
     *
     * @return a map holding the ids that exist
     */
    @NotNull
    public Map<Long, String> getNames(@NotNull Connection connection, @NotNull Collection<Long> requested)
            throws SQLException {
        Map<Long, String> result = new HashMap<Long, String>();
        Set<Long> uncached = new LinkedHashSet<Long>();
        for (Long id : requested) {
            String name = names.get(id);
            if (name != null) {
                result.put(id, name);
            } else {
                uncached.add(id);
            }
        }
        for (List<Long> chunk : Iterables.partition(uncached, QUERY_CHUNK)) {
            SqlStatement select = new SqlStatement("select NID, NAME from " + table + " where NID in ")
                    .appendIn(chunk);
            try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String name = EndOfValue.strip(rs.getString(2));
                    long id = rs.getLong(1);
                    cache(name, id);
                    result.put(id, name);
                }
            }
        }
        return result;
    }

    /**
     * Empties the cache. Only for teardown of the owning store.
     */
    public void dispose() {
        ids.clear();
        names.clear();
    }

    int getCacheSize() {
        return ids.size();
    }

    private void cache(String name, long id) {
        ids.put(name, id);
        names.put(id, name);
    }
}
