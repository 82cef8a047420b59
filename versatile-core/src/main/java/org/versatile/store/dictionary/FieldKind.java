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

/**
 * How the values of a field are classified. Assigned when the field is
 * created and never changed afterwards.
 */
public enum FieldKind {

    /**
     * Stored as string only, never classified.
     */
    NOT_INDEXED(0),

    /**
     * Classified as numeric or date-like, falling back to string.
     */
    NUMERIC_OR_STRING(1),

    /**
     * Like {@link #NUMERIC_OR_STRING}, and numbers are additionally
     * interpreted as seconds since the epoch.
     */
    DATE_OR_STRING(2),

    /**
     * Opaque text, e.g. the document body. Stored as string only.
     */
    OPAQUE_STRING(3);

    private final int id;

    FieldKind(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static FieldKind fromId(int id) {
        for (FieldKind kind : values()) {
            if (kind.id == id) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown field kind: " + id);
    }
}
