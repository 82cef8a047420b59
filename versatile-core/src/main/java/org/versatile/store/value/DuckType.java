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

/**
 * The projections a stored value was written to. The string projection is
 * always written, bit 2 marks a numeric and bit 4 a datetime projection.
 * <p>
 * Rows of superseded revisions additionally carry {@link #OTHER_VERSION_BIT}.
 */
public enum DuckType {

    /**
     * The name of a record at a sequence number.
     */
    SEQUENCE(0),

    OPAQUE(1),

    NUMERIC(3),

    DATE(5),

    NUMERIC_AND_DATE(7);

    public static final int OTHER_VERSION_BIT = 0x20;

    private static final int NUMBER_BIT = 2;

    private static final int DATE_BIT = 4;

    private final int code;

    DuckType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @param other whether the value belongs to a superseded revision
     * @return the code as stored
     */
    public int getCode(boolean other) {
        return other ? code | OTHER_VERSION_BIT : code;
    }

    public boolean hasNumber() {
        return (code & NUMBER_BIT) != 0;
    }

    public boolean hasDate() {
        return (code & DATE_BIT) != 0;
    }

    /**
     * @param stored a stored code, with or without the other version bit
     * @return the duck type
     */
    public static DuckType fromCode(int stored) {
        int code = stored & ~OTHER_VERSION_BIT;
        for (DuckType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown duck type: " + stored);
    }
}
