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
package org.versatile.commons;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ClockTest {

    @Test
    public void simpleClockFollowsSystemTime() {
        long before = System.currentTimeMillis();
        long now = Clock.SIMPLE.getTime();
        assertTrue(now >= before);
        assertTrue(now <= System.currentTimeMillis());
    }

    @Test
    public void virtualClockOnlyMovesWhenTold() {
        Clock.Virtual clock = new Clock.Virtual(1000);
        assertEquals(1000, clock.getTime());
        assertEquals(1000, clock.getTime());

        clock.advance(2, TimeUnit.SECONDS);
        assertEquals(3000, clock.getTime());
        assertEquals(3, clock.getTimeInSeconds());

        clock.setTime(42);
        assertEquals(42, clock.getDate().getTime());
    }
}
