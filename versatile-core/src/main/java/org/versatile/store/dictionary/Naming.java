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
 * How the instance part of a {@link FieldCoordinate} is interpreted.
 */
public enum Naming {

    /**
     * An attribute of the single unnamed record of a collection.
     */
    UNNAMED(0),

    /**
     * An attribute of a named record; the instance is the record name.
     */
    NAMED(1),

    /**
     * The name of the record at a sequence number; the instance is the
     * sequence name.
     */
    SEQUENCE(2);

    private final int id;

    Naming(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static Naming fromId(int id) {
        for (Naming n : values()) {
            if (n.id == id) {
                return n;
            }
        }
        throw new IllegalArgumentException("Unknown naming: " + id);
    }
}
