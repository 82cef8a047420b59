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

import org.jetbrains.annotations.NotNull;

/**
 * A field as registered in the field dictionary.
 */
public final class FieldEntry {

    private final long id;
    private final FieldCoordinate coordinate;
    private final FieldKind kind;

    public FieldEntry(long id, @NotNull FieldCoordinate coordinate, @NotNull FieldKind kind) {
        this.id = id;
        this.coordinate = coordinate;
        this.kind = kind;
    }

    public long getId() {
        return id;
    }

    @NotNull
    public FieldCoordinate getCoordinate() {
        return coordinate;
    }

    @NotNull
    public FieldKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return id + ":" + coordinate + "(" + kind + ")";
    }
}
