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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import static org.versatile.store.StructuredDocument.CREATEINFO;
import static org.versatile.store.StructuredDocument.FIELD;
import static org.versatile.store.StructuredDocument.FILEATTACHMENT;
import static org.versatile.store.StructuredDocument.FORM;
import static org.versatile.store.StructuredDocument.PREFERENCE;
import static org.versatile.store.StructuredDocument.TOPICINFO;
import static org.versatile.store.StructuredDocument.TOPICMOVED;
import static org.versatile.store.StructuredDocument.TOPICPARENT;

/**
 * The catalog of fields registered at schema creation, and the kind
 * assigned to fields created at runtime.
 */
public final class WellKnownFields {

    /**
     * The type of the document body field.
     */
    public static final String TEXT = "_text";

    /**
     * The document body.
     */
    public static final FieldCoordinate TEXT_FIELD = FieldCoordinate.unnamed(TEXT, "");

    /**
     * First id handed out for fields created at runtime.
     */
    public static final long FIRST_DYNAMIC_ID = 10000L;

    private static final ImmutableSet<String> NOT_INDEXED_TYPES = ImmutableSet.of(TOPICINFO, CREATEINFO);

    private static final ImmutableSet<String> DATED_TYPES = ImmutableSet.of(TOPICMOVED, FILEATTACHMENT);

    private static final List<FieldEntry> CATALOG;

    static {
        ImmutableList.Builder<FieldEntry> builder = ImmutableList.builder();
        long id = 1;
        builder.add(new FieldEntry(id++, TEXT_FIELD, FieldKind.OPAQUE_STRING));
        for (String type : new String[] {TOPICINFO, CREATEINFO}) {
            for (String key : new String[] {"author", "version", "date", "comment", "reprev", "format", "rev", "encoding"}) {
                builder.add(new FieldEntry(id++, FieldCoordinate.unnamed(type, key), FieldKind.NOT_INDEXED));
            }
        }
        for (String key : new String[] {"from", "to", "by", "date"}) {
            FieldCoordinate c = FieldCoordinate.unnamed(TOPICMOVED, key);
            builder.add(new FieldEntry(id++, c, kindOf(c)));
        }
        for (String type : new String[] {TOPICPARENT, FILEATTACHMENT, FORM, FIELD, PREFERENCE}) {
            builder.add(new FieldEntry(id++, FieldCoordinate.sequence(type, 0), FieldKind.NUMERIC_OR_STRING));
        }
        CATALOG = builder.build();
    }

    private WellKnownFields() {
    }

    public static List<FieldEntry> getCatalog() {
        return CATALOG;
    }

    /**
     * Returns the kind assigned to a field when it is first created.
     *
     * @param coordinate the coordinate of the new field
     * @return its kind
     */
    public static FieldKind kindOf(FieldCoordinate coordinate) {
        if (TEXT.equals(coordinate.getType())) {
            return FieldKind.OPAQUE_STRING;
        }
        if (NOT_INDEXED_TYPES.contains(coordinate.getType())) {
            return FieldKind.NOT_INDEXED;
        }
        if (coordinate.getNaming() != Naming.SEQUENCE && "date".equals(coordinate.getKey())
                && DATED_TYPES.contains(coordinate.getType())) {
            return FieldKind.DATE_OR_STRING;
        }
        return FieldKind.NUMERIC_OR_STRING;
    }
}
