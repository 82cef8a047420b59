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
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.Record;
import org.versatile.store.SaveOptions;
import org.versatile.store.StructuredDocument;
import org.versatile.store.dictionary.FieldCoordinate;
import org.versatile.store.dictionary.WellKnownFields;
import org.versatile.store.rdb.RDBOptions;
import org.versatile.store.rdb.RDBSchema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AttributeValueStoreTest extends AbstractVersatileStoreTest {

    private final RDBSchema schema = new RDBSchema(new RDBOptions());

    private final DocumentIdentity doc = new DocumentIdentity("C", "D");

    @Test
    public void decomposeUnnamed() {
        StructuredDocument content = new StructuredDocument().setText("body");
        content.addRecord(StructuredDocument.TOPICINFO, new Record().set("author", "U1").set("version", "3"));

        List<AttributeSlot> slots = AttributeValueStore.decompose(content);
        assertEquals(3, slots.size());
        assertEquals(WellKnownFields.TEXT_FIELD, slots.get(0).getCoordinate());
        assertEquals("body", slots.get(0).getValue());
        assertEquals(FieldCoordinate.unnamed(StructuredDocument.TOPICINFO, "author"), slots.get(1).getCoordinate());
        assertEquals("U1", slots.get(1).getValue());
    }

    @Test
    public void decomposeNamed() {
        StructuredDocument content = new StructuredDocument();
        content.putRecord(StructuredDocument.FIELD, "B").set("value", "2");
        content.putRecord(StructuredDocument.FIELD, "A").set("value", "1");

        List<AttributeSlot> slots = AttributeValueStore.decompose(content);
        assertEquals(4, slots.size());
        assertEquals(FieldCoordinate.sequence(StructuredDocument.FIELD, 0), slots.get(0).getCoordinate());
        assertEquals("B", slots.get(0).getValue());
        assertEquals(FieldCoordinate.named(StructuredDocument.FIELD, "B", "value"), slots.get(1).getCoordinate());
        assertEquals(FieldCoordinate.sequence(StructuredDocument.FIELD, 1), slots.get(2).getCoordinate());
        assertEquals("A", slots.get(2).getValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unnamedNextToOthers() {
        StructuredDocument content = new StructuredDocument();
        content.addRecord(StructuredDocument.FIELD, new Record("A"));
        content.addRecord(StructuredDocument.FIELD, new Record().set("value", "x"));
        AttributeValueStore.decompose(content);
    }

    @Test(expected = IllegalArgumentException.class)
    public void reservedType() {
        StructuredDocument content = new StructuredDocument();
        content.addRecord(WellKnownFields.TEXT, new Record().set("x", "y"));
        AttributeValueStore.decompose(content);
    }

    @Test
    public void roundTripKeepsStrings() throws Exception {
        StructuredDocument content = new StructuredDocument().setText("line one\nline two  \n");
        content.addRecord(StructuredDocument.TOPICINFO, new Record().set("author", "U1").set("version", "3"));
        content.putRecord(StructuredDocument.FIELD, "Amount").set("value", "42  ");
        content.putRecord(StructuredDocument.FILEATTACHMENT, "a.txt").set("date", "1000000000").set("size", "12");

        store.save(doc, content, "U1", SaveOptions.defaults());
        assertEquals(content, store.read(doc).getContent());
        assertEquals("42  ", store.read(doc).getContent().getRecord(StructuredDocument.FIELD, "Amount").get("value"));

        try (Connection c = dataSource.getConnection(); Statement stmt = c.createStatement()) {
            List<Double> numbers = new ArrayList<Double>();
            try (ResultSet rs = stmt.executeQuery("select VAL from " + schema.getValuesNumber() + " order by VAL")) {
                while (rs.next()) {
                    numbers.add(rs.getDouble(1));
                }
            }
            assertEquals(3, numbers.size());
            assertEquals(12.0, numbers.get(0), 0);
            assertEquals(42.0, numbers.get(1), 0);
            assertEquals(1e9, numbers.get(2), 0);

            try (ResultSet rs = stmt.executeQuery("select VAL from " + schema.getValuesDate())) {
                assertTrue(rs.next());
                assertEquals(LocalDateTime.of(2001, 9, 9, 1, 46, 40), rs.getObject(1, LocalDateTime.class));
            }
        }
    }

    @Test
    public void recordOrderSurvives() {
        StructuredDocument content = new StructuredDocument();
        for (int i = 20; i > 0; i--) {
            content.putRecord(StructuredDocument.FIELD, "F" + i).set("value", String.valueOf(i));
        }
        store.save(doc, content, "U1", SaveOptions.defaults());

        List<Record> records = store.read(doc).getContent().getRecords(StructuredDocument.FIELD);
        assertEquals(20, records.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("F" + (20 - i), records.get(i).getName());
        }
    }

    @Test
    public void supersededValuesAreRetagged() throws Exception {
        store.save(doc, new StructuredDocument().setText("one"), "U1", SaveOptions.defaults());
        store.save(doc, new StructuredDocument().setText("two"), "U1", SaveOptions.defaults());

        try (Connection c = dataSource.getConnection(); Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery("select VAL, DUCKTYPE from " + schema.getValuesString()
                     + " order by DUCKTYPE desc")) {
            assertTrue(rs.next());
            assertEquals("one\0", rs.getString(1));
            assertEquals(DuckType.OPAQUE.getCode(true), rs.getInt(2));
            assertTrue(rs.next());
            assertEquals("two\0", rs.getString(1));
            assertEquals(DuckType.OPAQUE.getCode(), rs.getInt(2));
        }
    }
}
