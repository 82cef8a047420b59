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
package org.versatile.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The content of a document revision: a text body and ordered, named
 * collections of {@link Record}s.
 * <p>
 * Collections are keyed by type (e.g. {@code FIELD}, {@code PREFERENCE}).
 * A collection holding a single record may leave that record unnamed,
 * otherwise every record must carry a distinct name. This is checked when
 * the document is saved.
 * <p>
 * Equality compares the text, and per type the records in order. The order
 * of the types and of the attributes within a record is not significant.
 */
public final class StructuredDocument {

    public static final String TOPICINFO = "TOPICINFO";
    public static final String CREATEINFO = "CREATEINFO";
    public static final String TOPICMOVED = "TOPICMOVED";
    public static final String TOPICPARENT = "TOPICPARENT";
    public static final String FILEATTACHMENT = "FILEATTACHMENT";
    public static final String FORM = "FORM";
    public static final String FIELD = "FIELD";
    public static final String PREFERENCE = "PREFERENCE";

    private String text = "";

    private final Map<String, List<Record>> collections = new LinkedHashMap<String, List<Record>>();

    @NotNull
    public String getText() {
        return text;
    }

    @NotNull
    public StructuredDocument setText(@NotNull String text) {
        this.text = checkNotNull(text);
        return this;
    }

    /**
     * @return the types of all non-empty collections, in insertion order
     */
    @NotNull
    public Set<String> getTypes() {
        return Collections.unmodifiableSet(collections.keySet());
    }

    @NotNull
    public List<Record> getRecords(@NotNull String type) {
        List<Record> records = collections.get(type);
        return records == null ? Collections.<Record>emptyList() : Collections.unmodifiableList(records);
    }

    @NotNull
    public Record addRecord(@NotNull String type, @NotNull Record record) {
        checkNotNull(record);
        List<Record> records = collections.get(checkNotNull(type));
        if (records == null) {
            records = new ArrayList<Record>();
            collections.put(type, records);
        }
        records.add(record);
        return record;
    }

    /**
     * Returns the record with the given name, adding a new one at the end of
     * the collection if none exists.
     */
    @NotNull
    public Record putRecord(@NotNull String type, @NotNull String name) {
        Record r = getRecord(type, name);
        return r != null ? r : addRecord(type, new Record(name));
    }

    @Nullable
    public Record getRecord(@NotNull String type, @NotNull String name) {
        for (Record r : getRecords(type)) {
            if (name.equals(r.getName())) {
                return r;
            }
        }
        return null;
    }

    @Nullable
    public Record getFirst(@NotNull String type) {
        List<Record> records = getRecords(type);
        return records.isEmpty() ? null : records.get(0);
    }

    public void removeCollection(@NotNull String type) {
        collections.remove(type);
    }

    /**
     * Shortcut for the {@code value} of the named {@link #PREFERENCE} record.
     */
    @Nullable
    public String getPreference(@NotNull String name) {
        Record r = getRecord(PREFERENCE, name);
        return r == null ? null : r.get("value");
    }

    @NotNull
    public StructuredDocument setPreference(@NotNull String name, @NotNull String value) {
        putRecord(PREFERENCE, name).set("value", value);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StructuredDocument)) {
            return false;
        }
        StructuredDocument other = (StructuredDocument) o;
        return text.equals(other.text) && collections.equals(other.collections);
    }

    @Override
    public int hashCode() {
        return text.hashCode() * 31 + collections.hashCode();
    }

    @Override
    public String toString() {
        return "StructuredDocument{text=" + text.length() + " chars, collections=" + collections + "}";
    }
}
