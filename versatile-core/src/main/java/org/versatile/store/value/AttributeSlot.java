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

import org.jetbrains.annotations.NotNull;
import org.versatile.store.dictionary.FieldCoordinate;

/**
 * One value of a decomposed document at its field coordinate.
 */
public final class AttributeSlot {

    private final FieldCoordinate coordinate;
    private final String value;

    public AttributeSlot(@NotNull FieldCoordinate coordinate, @NotNull String value) {
        this.coordinate = coordinate;
        this.value = value;
    }

    @NotNull
    public FieldCoordinate getCoordinate() {
        return coordinate;
    }

    @NotNull
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return coordinate + "=" + value;
    }
}
