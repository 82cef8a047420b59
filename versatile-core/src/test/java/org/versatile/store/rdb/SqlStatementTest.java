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

import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class SqlStatementTest {

    @Test
    public void appendCollectsParameters() {
        SqlStatement stmt = new SqlStatement("select * from T where A = ?", 1)
                .append(" and B in ").appendIn(Arrays.asList("x", "y", "z"))
                .append(" and C > ?", 2L);
        assertEquals("select * from T where A = ? and B in (?, ?, ?) and C > ?", stmt.getSql());
        assertEquals(Arrays.<Object>asList(1, "x", "y", "z", 2L), stmt.getParameters());
    }

    @Test(expected = IllegalArgumentException.class)
    public void placeholderMismatch() {
        new SqlStatement("select * from T where A = ? and B = ?", 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyInList() {
        new SqlStatement("select * from T where A in ").appendIn(Arrays.asList());
    }

    @Test
    public void endOfValue() {
        assertEquals("abc \0", EndOfValue.terminate("abc "));
        assertEquals("abc ", EndOfValue.strip("abc \0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidTablePrefix() {
        new RDBOptions().tablePrefix("bad;prefix");
    }
}
