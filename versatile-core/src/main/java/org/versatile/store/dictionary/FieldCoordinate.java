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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The coordinate of an attribute: the collection type, the naming of the
 * record, the record name (or sequence name, or blank) and the attribute
 * key.
 */
public final class FieldCoordinate {

    private final String type;
    private final Naming naming;
    private final String instance;
    private final String key;

    public FieldCoordinate(@NotNull String type, @NotNull Naming naming,
                           @NotNull String instance, @NotNull String key) {
        this.type = checkNotNull(type);
        this.naming = checkNotNull(naming);
        this.instance = checkNotNull(instance);
        this.key = checkNotNull(key);
    }

    public static FieldCoordinate unnamed(String type, String key) {
        return new FieldCoordinate(type, Naming.UNNAMED, "", key);
    }

    public static FieldCoordinate named(String type, String instance, String key) {
        return new FieldCoordinate(type, Naming.NAMED, instance, key);
    }

    public static FieldCoordinate sequence(String type, int index) {
        return new FieldCoordinate(type, Naming.SEQUENCE, WellKnownNames.sequenceName(index), "name");
    }

    @NotNull
    public String getType() {
        return type;
    }

    @NotNull
    public Naming getNaming() {
        return naming;
    }

    @NotNull
    public String getInstance() {
        return instance;
    }

    @NotNull
    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldCoordinate)) {
            return false;
        }
        FieldCoordinate other = (FieldCoordinate) o;
        return naming == other.naming && type.equals(other.type)
                && instance.equals(other.instance) && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, naming, instance, key);
    }

    @Override
    public String toString() {
        return type + "[" + naming + ":" + instance + "]." + key;
    }
}
