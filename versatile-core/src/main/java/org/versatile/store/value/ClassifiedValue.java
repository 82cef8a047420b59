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

import java.time.LocalDateTime;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A value with its projections. The string form is the original input.
 */
public final class ClassifiedValue {

    private final DuckType type;
    private final String string;
    private final Double number;
    private final LocalDateTime date;

    ClassifiedValue(@NotNull DuckType type, @NotNull String string,
                    @Nullable Double number, @Nullable LocalDateTime date) {
        this.type = type;
        this.string = string;
        this.number = number;
        this.date = date;
    }

    @NotNull
    public DuckType getType() {
        return type;
    }

    @NotNull
    public String getString() {
        return string;
    }

    /**
     * @return the numeric projection or {@code null}
     */
    @Nullable
    public Double getNumber() {
        return number;
    }

    /**
     * @return the datetime projection in UTC or {@code null}
     */
    @Nullable
    public LocalDateTime getDate() {
        return date;
    }

    @Override
    public String toString() {
        return type + "(" + string + ")";
    }
}
