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
package org.versatile.store.value;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.PerfLogger;
import org.versatile.store.Record;
import org.versatile.store.StructuredDocument;
import org.versatile.store.dictionary.FieldCoordinate;
import org.versatile.store.dictionary.FieldDictionary;
import org.versatile.store.dictionary.FieldEntry;
import org.versatile.store.dictionary.Naming;
import org.versatile.store.dictionary.WellKnownFields;
import org.versatile.store.dictionary.WellKnownNames;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

import com.google.common.collect.Iterables;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decomposes documents into attribute rows and reconstructs them.
 * <p>
 * Every value is written to the string projection. Numeric and date-like
 * values are additionally written to the number and date projections. The
 * records of a named collection get sequence rows holding their names, so
 * the order of records is kept as data.
 */
public class AttributeValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(AttributeValueStore.class);

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(AttributeValueStore.class.getName() + ".perf"));

    static final int QUERY_CHUNK = 500;

    private final RDBSchema schema;
    private final FieldDictionary fields;
    private final ValueClassifier classifier;
    private final long perfLogThreshold;

    private final BulkInsert<Row> insertString;
    private final BulkInsert<Row> insertNumber;
    private final BulkInsert<Row> insertDate;

    public AttributeValueStore(@NotNull RDBSchema schema, @NotNull FieldDictionary fields,
                               @NotNull ValueClassifier classifier, long perfLogThreshold) {
        this.schema = schema;
        this.fields = fields;
        this.classifier = classifier;
        this.perfLogThreshold = perfLogThreshold;
        this.insertString = new BulkInsert<Row>(insertInto(schema.getValuesString()), (stmt, row) -> {
            bindKey(stmt, row);
            stmt.setString(4, EndOfValue.terminate(row.value.getString()));
        });
        this.insertNumber = new BulkInsert<Row>(insertInto(schema.getValuesNumber()), (stmt, row) -> {
            bindKey(stmt, row);
            stmt.setDouble(4, row.value.getNumber());
        });
        this.insertDate = new BulkInsert<Row>(insertInto(schema.getValuesDate()), (stmt, row) -> {
            bindKey(stmt, row);
            stmt.setObject(4, row.value.getDate());
        });
    }

    //-----------------------------------------------------< decomposition >

    /**
     * Decomposes a document into values at their coordinates.
     *
     * @throws IllegalArgumentException if a collection holds an unnamed
     *          record next to other records, or two records of the same name
     */
    @NotNull
    public static List<AttributeSlot> decompose(@NotNull StructuredDocument document) {
        List<AttributeSlot> slots = new ArrayList<AttributeSlot>();
        if (!document.getText().isEmpty()) {
            slots.add(new AttributeSlot(WellKnownFields.TEXT_FIELD, document.getText()));
        }
        for (String type : document.getTypes()) {
            checkArgument(!WellKnownFields.TEXT.equals(type), "Reserved collection type: %s", type);
            List<Record> records = document.getRecords(type);
            if (records.size() == 1 && records.get(0).getName() == null) {
                for (Map.Entry<String, String> e : records.get(0).getAttributes().entrySet()) {
                    slots.add(new AttributeSlot(FieldCoordinate.unnamed(type, e.getKey()), e.getValue()));
                }
                continue;
            }
            Set<String> seen = new HashSet<String>();
            for (int i = 0; i < records.size(); i++) {
                Record r = records.get(i);
                String name = r.getName();
                checkArgument(name != null, "Record %s of %s has no name", i, type);
                checkArgument(seen.add(name), "Duplicate record name %s in %s", name, type);
                slots.add(new AttributeSlot(FieldCoordinate.sequence(type, i), name));
                for (Map.Entry<String, String> e : r.getAttributes().entrySet()) {
                    if (!Record.NAME.equals(e.getKey())) {
                        slots.add(new AttributeSlot(FieldCoordinate.named(type, name, e.getKey()), e.getValue()));
                    }
                }
            }
        }
        return slots;
    }

    /**
     * @return the distinct coordinates of the given slots
     */
    @NotNull
    public static Set<FieldCoordinate> getCoordinates(@NotNull List<AttributeSlot> slots) {
        Set<FieldCoordinate> coordinates = new HashSet<FieldCoordinate>();
        for (AttributeSlot slot : slots) {
            coordinates.add(slot.getCoordinate());
        }
        return coordinates;
    }

    //---------------------------------------------------------< write path >

    /**
     * Writes the values of a revision, grouped by duck type and field.
     *
     * @param connection the connection to use
     * @param revId the revision
     * @param other whether the revision is a superseded one
     * @param slots the decomposed document
     * @param fieldMap the fields of all coordinates of the slots
     */
    public void insert(@NotNull Connection connection, long revId, boolean other,
                       @NotNull List<AttributeSlot> slots, @NotNull Map<FieldCoordinate, FieldEntry> fieldMap)
            throws SQLException {
        long start = PERFLOG.start();
        List<Row> rows = new ArrayList<Row>(slots.size());
        for (AttributeSlot slot : slots) {
            FieldEntry field = fieldMap.get(slot.getCoordinate());
            checkArgument(field != null, "Unresolved field %s", slot.getCoordinate());
            ClassifiedValue value = slot.getCoordinate().getNaming() == Naming.SEQUENCE
                    ? new ClassifiedValue(DuckType.SEQUENCE, slot.getValue(), null, null)
                    : classifier.classify(slot.getValue(), field.getKind());
            rows.add(new Row(revId, field.getId(), value, other));
        }
        Collections.sort(rows, Comparator.<Row>comparingInt(r -> r.value.getType().getCode())
                .thenComparingLong(r -> r.fid));

        List<Row> numbers = new ArrayList<Row>();
        List<Row> dates = new ArrayList<Row>();
        for (Row row : rows) {
            if (row.value.getType().hasNumber()) {
                numbers.add(row);
            }
            if (row.value.getType().hasDate()) {
                dates.add(row);
            }
        }
        insertString.execute(connection, rows);
        insertNumber.execute(connection, numbers);
        insertDate.execute(connection, dates);
        PERFLOG.end(start, perfLogThreshold, "insert: revision {}, {} values, {} numbers, {} dates",
                revId, rows.size(), numbers.size(), dates.size());
    }

    /**
     * Deletes all values of a revision.
     */
    public void delete(@NotNull Connection connection, long revId) throws SQLException {
        for (String table : valueTables()) {
            new SqlStatement("delete from " + table + " where REV_ID = ?", revId).executeUpdate(connection);
        }
    }

    /**
     * Sets or clears the other version bit of all values of a revision.
     */
    public void retag(@NotNull Connection connection, long revId, boolean other) throws SQLException {
        // codes without the other version bit are all below it
        String update = other
                ? " set DUCKTYPE = DUCKTYPE + ? where REV_ID = ? and DUCKTYPE < ?"
                : " set DUCKTYPE = DUCKTYPE - ? where REV_ID = ? and DUCKTYPE >= ?";
        int count = 0;
        for (String table : valueTables()) {
            count += new SqlStatement("update " + table + update,
                    DuckType.OTHER_VERSION_BIT, revId, DuckType.OTHER_VERSION_BIT).executeUpdate(connection);
        }
        LOG.debug("Retagged {} values of revision {} (other={})", count, revId, other);
    }

    //----------------------------------------------------------< read path >

    /**
     * Reconstructs the document of a revision.
     */
    @NotNull
    public StructuredDocument read(@NotNull Connection connection, long revId) throws SQLException {
        StructuredDocument doc = readAll(connection, Collections.singleton(revId)).get(revId);
        return doc == null ? new StructuredDocument() : doc;
    }

    /**
     * Reconstructs the documents of many revisions with one query per chunk
     * of revisions.
     *
     * @return the documents by revision id, revisions without any value
     *          map to an empty document
     */
    @NotNull
    public Map<Long, StructuredDocument> readAll(@NotNull Connection connection, @NotNull Collection<Long> revIds)
            throws SQLException {
        long start = PERFLOG.start();
        Map<Long, List<StoredValue>> values = new LinkedHashMap<Long, List<StoredValue>>();
        Set<Long> fids = new HashSet<Long>();
        for (Long revId : revIds) {
            values.put(revId, new ArrayList<StoredValue>());
        }
        for (List<Long> chunk : Iterables.partition(values.keySet(), QUERY_CHUNK)) {
            SqlStatement select = new SqlStatement("select REV_ID, FID, DUCKTYPE, VAL from "
                    + schema.getValuesString() + " where REV_ID in ").appendIn(chunk)
                    .append(" order by REV_ID, DUCKTYPE");
            try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long fid = rs.getLong(2);
                    fids.add(fid);
                    values.get(rs.getLong(1)).add(new StoredValue(fid,
                            DuckType.fromCode(rs.getInt(3)), EndOfValue.strip(rs.getString(4))));
                }
            }
        }
        Map<Long, FieldEntry> fieldMap = fields.getFields(connection, fids);
        Map<Long, StructuredDocument> result = new LinkedHashMap<Long, StructuredDocument>();
        for (Map.Entry<Long, List<StoredValue>> e : values.entrySet()) {
            result.put(e.getKey(), reconstruct(e.getValue(), fieldMap));
        }
        PERFLOG.end(start, perfLogThreshold, "readAll: {} revisions", revIds.size());
        return result;
    }

    private static StructuredDocument reconstruct(List<StoredValue> values, Map<Long, FieldEntry> fieldMap) {
        StructuredDocument doc = new StructuredDocument();
        Map<String, TreeMap<Integer, String>> sequences = new HashMap<String, TreeMap<Integer, String>>();
        Map<String, Map<String, Map<String, String>>> named = new HashMap<String, Map<String, Map<String, String>>>();
        Map<String, Map<String, String>> unnamed = new HashMap<String, Map<String, String>>();
        Set<String> types = new TreeSet<String>();

        // sequence rows first, they establish the records of each collection
        for (StoredValue v : values) {
            if (v.type == DuckType.SEQUENCE) {
                FieldCoordinate c = field(fieldMap, v.fid).getCoordinate();
                sequences.computeIfAbsent(c.getType(), k -> new TreeMap<Integer, String>())
                        .put(WellKnownNames.sequenceIndex(c.getInstance()), v.value);
                types.add(c.getType());
            }
        }
        for (StoredValue v : values) {
            if (v.type == DuckType.SEQUENCE) {
                continue;
            }
            FieldCoordinate c = field(fieldMap, v.fid).getCoordinate();
            if (c.equals(WellKnownFields.TEXT_FIELD)) {
                doc.setText(v.value);
            } else if (c.getNaming() == Naming.NAMED) {
                named.computeIfAbsent(c.getType(), k -> new HashMap<String, Map<String, String>>())
                        .computeIfAbsent(c.getInstance(), k -> new LinkedHashMap<String, String>())
                        .put(c.getKey(), v.value);
                types.add(c.getType());
            } else {
                unnamed.computeIfAbsent(c.getType(), k -> new LinkedHashMap<String, String>())
                        .put(c.getKey(), v.value);
                types.add(c.getType());
            }
        }

        for (String type : types) {
            Map<String, Map<String, String>> instances = named.containsKey(type)
                    ? new HashMap<String, Map<String, String>>(named.get(type))
                    : new HashMap<String, Map<String, String>>();
            TreeMap<Integer, String> sequence = sequences.get(type);
            if (sequence != null) {
                for (String name : sequence.values()) {
                    doc.addRecord(type, toRecord(name, instances.remove(name)));
                }
            }
            for (Map.Entry<String, Map<String, String>> orphan : instances.entrySet()) {
                LOG.warn("Record {} of {} has no sequence row", orphan.getKey(), type);
                doc.addRecord(type, toRecord(orphan.getKey(), orphan.getValue()));
            }
            Map<String, String> attributes = unnamed.get(type);
            if (attributes != null) {
                doc.addRecord(type, toRecord(null, attributes));
            }
        }
        return doc;
    }

    private static Record toRecord(String name, Map<String, String> attributes) {
        Record r = new Record(name);
        if (attributes != null) {
            for (Map.Entry<String, String> e : attributes.entrySet()) {
                r.set(e.getKey(), e.getValue());
            }
        }
        return r;
    }

    private static FieldEntry field(Map<Long, FieldEntry> fieldMap, long fid) {
        FieldEntry entry = fieldMap.get(fid);
        if (entry == null) {
            throw new IllegalStateException("Unknown field id " + fid);
        }
        return entry;
    }

    private List<String> valueTables() {
        return Arrays.asList(schema.getValuesString(), schema.getValuesNumber(), schema.getValuesDate());
    }

    private static String insertInto(String table) {
        return "insert into " + table + " (REV_ID, FID, DUCKTYPE, VAL) values (?, ?, ?, ?)";
    }

    private static void bindKey(PreparedStatement stmt, Row row) throws SQLException {
        stmt.setLong(1, row.revId);
        stmt.setLong(2, row.fid);
        stmt.setInt(3, row.value.getType().getCode(row.other));
    }

    private static final class Row {

        final long revId;
        final long fid;
        final ClassifiedValue value;
        final boolean other;

        Row(long revId, long fid, ClassifiedValue value, boolean other) {
            this.revId = revId;
            this.fid = fid;
            this.value = value;
            this.other = other;
        }
    }

    private static final class StoredValue {

        final long fid;
        final DuckType type;
        final String value;

        StoredValue(long fid, DuckType type, String value) {
            this.fid = fid;
            this.type = type;
            this.value = value;
        }
    }
}
