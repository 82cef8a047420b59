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
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.versatile.store.dictionary.FieldKind;

/**
 * Classifies values by the projections they can be stored in. The order of
 * the attempts is a policy:
 * <ol>
 * <li>fields that are not indexed or hold opaque text are never classified;</li>
 * <li>a numeric parse is tried first. A number wins over a date, except that
 * in a {@link FieldKind#DATE_OR_STRING} field a number is additionally read
 * as seconds since the epoch;</li>
 * <li>a date parse is tried next;</li>
 * <li>everything else is an opaque string.</li>
 * </ol>
 * The string form is never altered, trailing whitespace included.
 */
public class ValueClassifier {

    private static final Pattern NUMBER = Pattern.compile(
            "\\s*[-+]?[0-9]*\\.?[0-9]+([eE][-+]?[0-9]+)?\\s*");

    private final DateParser dateParser;

    public ValueClassifier() {
        this(new DateParser());
    }

    public ValueClassifier(@NotNull DateParser dateParser) {
        this.dateParser = dateParser;
    }

    @NotNull
    public ClassifiedValue classify(@NotNull String value, @NotNull FieldKind kind) {
        if (kind == FieldKind.NOT_INDEXED || kind == FieldKind.OPAQUE_STRING) {
            return new ClassifiedValue(DuckType.OPAQUE, value, null, null);
        }
        if (NUMBER.matcher(value).matches()) {
            double number = Double.parseDouble(value.trim());
            if (!Double.isInfinite(number)) {
                if (kind == FieldKind.DATE_OR_STRING) {
                    LocalDateTime date = DateParser.fromEpochSeconds(number);
                    if (date != null) {
                        return new ClassifiedValue(DuckType.NUMERIC_AND_DATE, value, number, date);
                    }
                }
                return new ClassifiedValue(DuckType.NUMERIC, value, number, null);
            }
        }
        LocalDateTime date = dateParser.parse(value);
        if (date != null) {
            return new ClassifiedValue(DuckType.DATE, value, null, date);
        }
        return new ClassifiedValue(DuckType.OPAQUE, value, null, null);
    }
}
