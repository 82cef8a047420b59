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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A record of a {@link StructuredDocument} collection: an ordered map of
 * string attributes. The {@value #NAME} attribute names the record within
 * its collection.
 */
public final class Record {

    public static final String NAME = "name";

    private final Map<String, String> attributes = new LinkedHashMap<String, String>();

    public Record() {
    }

    public Record(@Nullable String name) {
        if (name != null) {
            attributes.put(NAME, name);
        }
    }

    @Nullable
    public String getName() {
        return attributes.get(NAME);
    }

    @Nullable
    public String get(@NotNull String key) {
        return attributes.get(key);
    }

    @NotNull
    public Record set(@NotNull String key, @NotNull String value) {
        attributes.put(checkNotNull(key), checkNotNull(value));
        return this;
    }

    @NotNull
    public Record remove(@NotNull String key) {
        attributes.remove(key);
        return this;
    }

    /**
     * @return an unmodifiable view of all attributes, including the name
     */
    @NotNull
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Record && attributes.equals(((Record) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
