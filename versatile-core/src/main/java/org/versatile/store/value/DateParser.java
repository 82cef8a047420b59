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

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * Recognizes the date formats found in stored documents and converts them
 * to UTC. Supported are
 * <ul>
 * <li>ISO 8601: {@code 2001-12-31}, {@code 2001-12-31T23:59:59Z},
 * {@code 2001-12-31 23:59+02:00}</li>
 * <li>numeric with slashes or dots: {@code 2001/12/31 23:59:59},
 * {@code 2001.12.31.23.59}</li>
 * <li>day, month name, year: {@code 31 Dec 2001 - 23:59},
 * {@code 31-Dec-2001}, {@code Mon, 31 Dec 2001 23:59:59 GMT}</li>
 * </ul>
 * Only the first {@value #MAX_LENGTH} characters of the input are
 * considered.
 */
public final class DateParser {

    static final int MAX_LENGTH = 70;

    private static final String TIME = "(?:(\\d{1,2})[:.](\\d{2})(?:[:.](\\d{2})(?:\\.\\d+)?)?)";

    private static final String ZONE = "\\s*(Z|GMT|UTC|[-+]\\d{2}:?\\d{2})?";

    private static final Pattern ISO = Pattern.compile(
            "(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[T\\s]+" + TIME + ")?" + ZONE,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC = Pattern.compile(
            "(\\d{4})[/.](\\d{1,2})[/.](\\d{1,2})(?:[\\s./-]+" + TIME + ")?" + ZONE,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NAMED_MONTH = Pattern.compile(
            "(?:[a-z]{3},?\\s+)?(\\d{1,2})[-\\s]+([a-z]{3})[a-z]*\\.?[-\\s]+(\\d{2}|\\d{4})(?:\\s*-?\\s*" + TIME + ")?" + ZONE,
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = ImmutableMap.<String, Integer>builder()
            .put("jan", 1).put("feb", 2).put("mar", 3).put("apr", 4).put("may", 5).put("jun", 6)
            .put("jul", 7).put("aug", 8).put("sep", 9).put("oct", 10).put("nov", 11).put("dec", 12)
            .build();

    /**
     * @param value the value to parse
     * @return the date in UTC, or {@code null} if the value is not a date
     */
    @Nullable
    public LocalDateTime parse(@NotNull String value) {
        String input = value.length() > MAX_LENGTH ? value.substring(0, MAX_LENGTH) : value;
        input = input.trim();
        if (input.isEmpty()) {
            return null;
        }
        Matcher m = ISO.matcher(input);
        if (m.matches()) {
            return toDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), m.group(4), m.group(5), m.group(6), m.group(7));
        }
        m = NUMERIC.matcher(input);
        if (m.matches()) {
            return toDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), m.group(4), m.group(5), m.group(6), m.group(7));
        }
        m = NAMED_MONTH.matcher(input);
        if (m.matches()) {
            Integer month = MONTHS.get(m.group(2).toLowerCase(Locale.ENGLISH));
            if (month == null) {
                return null;
            }
            int year = Integer.parseInt(m.group(3));
            if (m.group(3).length() == 2) {
                year += year < 50 ? 2000 : 1900;
            }
            return toDate(year, month, Integer.parseInt(m.group(1)),
                    m.group(4), m.group(5), m.group(6), m.group(7));
        }
        return null;
    }

    /**
     * Converts seconds since the epoch to a UTC date.
     *
     * @return the date or {@code null} if out of the supported range
     */
    @Nullable
    public static LocalDateTime fromEpochSeconds(double seconds) {
        if (Double.isNaN(seconds) || Math.abs(seconds) > 1e12) {
            return null;
        }
        long whole = (long) Math.floor(seconds);
        int nanos = (int) Math.round((seconds - whole) * 1e9);
        if (nanos >= 1000000000) {
            whole++;
            nanos = 0;
        }
        try {
            return LocalDateTime.ofEpochSecond(whole, nanos, ZoneOffset.UTC);
        } catch (DateTimeException e) {
            return null;
        }
    }

    @Nullable
    private static LocalDateTime toDate(int year, int month, int day,
                                        String hour, String minute, String second, String zone) {
        try {
            LocalDateTime date = LocalDateTime.of(year, month, day,
                    hour == null ? 0 : Integer.parseInt(hour),
                    minute == null ? 0 : Integer.parseInt(minute),
                    second == null ? 0 : Integer.parseInt(second));
            if (zone != null && (zone.startsWith("+") || zone.startsWith("-"))) {
                ZoneOffset offset = ZoneOffset.of(zone.length() == 5
                        ? zone.substring(0, 3) + ":" + zone.substring(3) : zone);
                date = date.atOffset(offset).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return date;
        } catch (DateTimeException e) {
            return null;
        }
    }
}
