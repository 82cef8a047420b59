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
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
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
 * Interns field coordinates to stable ids, using the same
 * lookup, insert, lookup protocol as the {@link NameDictionary}.
 * <p>
 * The {@link FieldKind} of a field is assigned by
 * {@link WellKnownFields#kindOf(FieldCoordinate)} when the field is created
 * and is never updated. Writers are expected to agree with the stored kind;
 * this is not checked here.
 */
public class FieldDictionary {

    private static final Logger LOG = LoggerFactory.getLogger(FieldDictionary.class);

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(FieldDictionary.class.getName() + ".perf"));

    static final int QUERY_CHUNK = 100;

    private final String table;
    private final String namesTable;
    private final NameDictionary names;
    private final long perfLogThreshold;

    private final Map<FieldCoordinate, FieldEntry> byCoordinate = new ConcurrentHashMap<FieldCoordinate, FieldEntry>();
    private final Map<Long, FieldEntry> byId = new ConcurrentHashMap<Long, FieldEntry>();

    private final BulkInsert<Row> insert;

    public FieldDictionary(@NotNull RDBSchema schema, @NotNull NameDictionary names, long perfLogThreshold) {
        this.table = schema.getFields();
        this.namesTable = schema.getNames();
        this.names = names;
        this.perfLogThreshold = perfLogThreshold;
        this.insert = new BulkInsert<Row>("insert into " + table
                + " (NAMING, TYPE_NID, INSTANCE_NID, KEY_NID, FIELD_KIND) values (?, ?, ?, ?, ?)",
                (stmt, row) -> {
                    stmt.setInt(1, row.coordinate.getNaming().getId());
                    stmt.setLong(2, row.nids.get(1));
                    stmt.setLong(3, row.nids.get(2));
                    stmt.setLong(4, row.nids.get(3));
                    stmt.setInt(5, WellKnownFields.kindOf(row.coordinate).getId());
                });
        for (FieldEntry entry : WellKnownFields.getCatalog()) {
            cache(entry);
        }
    }

    /**
     * Returns the fields for the given coordinates, creating fields (and
     * the names they refer to) that do not exist yet. Commits the created
     * names and fields.
     *
     * @param connection the connection to use
     * @param coordinates the coordinates to resolve
     * @return a map from each coordinate to its field
     * @throws SQLException if the backend fails
     */
    @NotNull
    public Map<FieldCoordinate, FieldEntry> resolve(@NotNull Connection connection,
                                                   @NotNull Collection<FieldCoordinate> coordinates)
            throws SQLException {
        long start = PERFLOG.start();
        Map<FieldCoordinate, FieldEntry> result = new HashMap<FieldCoordinate, FieldEntry>();
        Set<FieldCoordinate> uncached = new LinkedHashSet<FieldCoordinate>();
        for (FieldCoordinate c : coordinates) {
            FieldEntry entry = byCoordinate.get(c);
            if (entry != null) {
                result.put(c, entry);
            } else {
                uncached.add(c);
            }
        }
        int created = 0;
        if (!uncached.isEmpty()) {
            Set<String> referenced = new HashSet<String>();
            for (FieldCoordinate c : uncached) {
                referenced.add(c.getType());
                referenced.add(c.getInstance());
                referenced.add(c.getKey());
            }
            Map<String, Long> nids = names.resolve(connection, referenced);
            List<Row> rows = new ArrayList<Row>(uncached.size());
            for (FieldCoordinate c : uncached) {
                rows.add(new Row(c, nids));
            }

            List<Row> missing = lookup(connection, rows, result);
            if (!missing.isEmpty()) {
                created = insert.executeIgnoringDuplicates(connection, missing);
                connection.commit();
                List<Row> unresolved = lookup(connection, missing, result);
                if (!unresolved.isEmpty()) {
                    throw new VersatileException("Failed to resolve fields: " + unresolved);
                }
                LOG.debug("Created {} of {} new fields", created, missing.size());
            }
        }
        PERFLOG.end(start, perfLogThreshold, "resolve: {} fields, {} created", coordinates.size(), created);
        return result;
    }

    /**
     * Returns the fields with the given ids.
     *
     * @return a map holding the ids that exist
     */
    @NotNull
    public Map<Long, FieldEntry> getFields(@NotNull Connection connection, @NotNull Collection<Long> fids)
            throws SQLException {
        Map<Long, FieldEntry> result = new HashMap<Long, FieldEntry>();
        Set<Long> uncached = new LinkedHashSet<Long>();
        for (Long fid : fids) {
            FieldEntry entry = byId.get(fid);
            if (entry != null) {
                result.put(fid, entry);
            } else {
                uncached.add(fid);
            }
        }
        for (List<Long> chunk : Iterables.partition(uncached, QUERY_CHUNK)) {
            SqlStatement select = new SqlStatement(
                    "select f.FID, f.NAMING, f.FIELD_KIND, t.NAME, i.NAME, k.NAME from " + table + " f"
                            + " join " + namesTable + " t on t.NID = f.TYPE_NID"
                            + " join " + namesTable + " i on i.NID = f.INSTANCE_NID"
                            + " join " + namesTable + " k on k.NID = f.KEY_NID"
                            + " where f.FID in ").appendIn(chunk);
            try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    FieldCoordinate c = new FieldCoordinate(
                            EndOfValue.strip(rs.getString(4)),
                            Naming.fromId(rs.getInt(2)),
                            EndOfValue.strip(rs.getString(5)),
                            EndOfValue.strip(rs.getString(6)));
                    FieldEntry entry = new FieldEntry(rs.getLong(1), c, FieldKind.fromId(rs.getInt(3)));
                    cache(entry);
                    result.put(entry.getId(), entry);
                }
            }
        }
        return result;
    }

    /**
     * Empties the cache. Only for teardown of the owning store.
     */
    public void dispose() {
        byCoordinate.clear();
        byId.clear();
    }

    /**
     * Looks up the given rows, adding the found fields to the result.
     *
     * @return the rows not found
     */
    private List<Row> lookup(Connection connection, List<Row> rows, Map<FieldCoordinate, FieldEntry> result)
            throws SQLException {
        Map<List<Long>, Row> pending = new HashMap<List<Long>, Row>();
        for (Row row : rows) {
            pending.put(row.nids, row);
        }
        for (List<Row> chunk : Iterables.partition(rows, QUERY_CHUNK)) {
            SqlStatement select = new SqlStatement("select FID, NAMING, TYPE_NID, INSTANCE_NID, KEY_NID, FIELD_KIND from "
                    + table + " where ");
            boolean first = true;
            for (Row row : chunk) {
                select.append(first ? "(" : " or (");
                select.append("NAMING = ? and TYPE_NID = ? and INSTANCE_NID = ? and KEY_NID = ?)",
                        row.nids.get(0), row.nids.get(1), row.nids.get(2), row.nids.get(3));
                first = false;
            }
            try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    List<Long> key = Arrays.asList((long) rs.getInt(2), rs.getLong(3), rs.getLong(4), rs.getLong(5));
                    Row row = pending.remove(key);
                    if (row != null) {
                        FieldEntry entry = new FieldEntry(rs.getLong(1), row.coordinate, FieldKind.fromId(rs.getInt(6)));
                        cache(entry);
                        result.put(row.coordinate, entry);
                    }
                }
            }
        }
        return new ArrayList<Row>(pending.values());
    }

    private void cache(FieldEntry entry) {
        byCoordinate.put(entry.getCoordinate(), entry);
        byId.put(entry.getId(), entry);
    }

    private static final class Row {

        final FieldCoordinate coordinate;

        /**
         * naming, type, instance and key as ids
         */
        final List<Long> nids;

        Row(FieldCoordinate coordinate, Map<String, Long> nids) {
            this.coordinate = coordinate;
            this.nids = Arrays.asList((long) coordinate.getNaming().getId(),
                    nids.get(coordinate.getType()),
                    nids.get(coordinate.getInstance()),
                    nids.get(coordinate.getKey()));
        }

        @Override
        public String toString() {
            return coordinate.toString();
        }
    }
}
