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

import org.junit.Test;

import com.google.common.base.Strings;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class DateParserTest {

    private final DateParser parser = new DateParser();

    @Test
    public void iso() {
        assertEquals(LocalDateTime.of(2001, 12, 31, 0, 0), parser.parse("2001-12-31"));
        assertEquals(LocalDateTime.of(2001, 12, 31, 23, 59, 58), parser.parse("2001-12-31T23:59:58Z"));
        assertEquals(LocalDateTime.of(2001, 12, 31, 21, 59), parser.parse("2001-12-31 23:59+02:00"));
    }

    @Test
    public void numeric() {
        assertEquals(LocalDateTime.of(2001, 12, 31, 23, 59, 59), parser.parse("2001/12/31 23:59:59"));
        assertEquals(LocalDateTime.of(2001, 12, 31, 23, 59), parser.parse("2001.12.31.23.59"));
    }

    @Test
    public void namedMonth() {
        assertEquals(LocalDateTime.of(2001, 12, 31, 23, 59), parser.parse("31 Dec 2001 - 23:59"));
        assertEquals(LocalDateTime.of(2001, 12, 31, 0, 0), parser.parse("31-Dec-2001"));
        assertEquals(LocalDateTime.of(2001, 12, 31, 23, 59, 59), parser.parse("Mon, 31 Dec 2001 23:59:59 GMT"));
        assertEquals(LocalDateTime.of(2049, 1, 2, 0, 0), parser.parse("2 Jan 49"));
        assertEquals(LocalDateTime.of(1950, 1, 2, 0, 0), parser.parse("2 Jan 50"));
    }

    @Test
    public void notDates() {
        assertNull(parser.parse(""));
        assertNull(parser.parse("hello"));
        assertNull(parser.parse("2001-13-45"));
        assertNull(parser.parse("31 Foo 2001"));
    }

    @Test
    public void onlyLeadingCharactersCount() {
        String padded = "2001-12-31" + Strings.repeat(" ", DateParser.MAX_LENGTH);
        assertEquals(LocalDateTime.of(2001, 12, 31, 0, 0), parser.parse(padded + "garbage"));
    }

    @Test
    public void epochSeconds() {
        assertEquals(LocalDateTime.of(1970, 1, 1, 0, 0), DateParser.fromEpochSeconds(0));
        assertEquals(LocalDateTime.of(2001, 9, 9, 1, 46, 40), DateParser.fromEpochSeconds(1e9));
        assertNull(DateParser.fromEpochSeconds(1e13));
        assertNull(DateParser.fromEpochSeconds(Double.NaN));
    }
}
