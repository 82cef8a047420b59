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
package org.versatile.store.rdb;

import org.jetbrains.annotations.NotNull;

/**
 * Names and string values are stored with a terminating {@code \0}, so that
 * comparisons in the backend never ignore trailing whitespace.
 */
public final class EndOfValue {

    public static final char TERMINATOR = '\0';

    private EndOfValue() {
    }

    @NotNull
    public static String terminate(@NotNull String value) {
        return value + TERMINATOR;
    }

    @NotNull
    public static String strip(@NotNull String stored) {
        int len = stored.length();
        if (len > 0 && stored.charAt(len - 1) == TERMINATOR) {
            return stored.substring(0, len - 1);
        }
        return stored;
    }
}
