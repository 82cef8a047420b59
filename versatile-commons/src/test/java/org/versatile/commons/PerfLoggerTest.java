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

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PerfLoggerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private PerfLogger perfLogger;

    @Before
    public void setup() {
        logger = (Logger) LoggerFactory.getLogger("perf." + PerfLoggerTest.class.getName());
        appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        perfLogger = new PerfLogger(logger);
    }

    @After
    public void after() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    public void nothingMeasuredAtInfo() {
        logger.setLevel(Level.INFO);
        long start = perfLogger.start("starting");
        assertEquals(-1, start);
        perfLogger.end(start, -1, "message {}", "argument");
        assertTrue(appender.list.isEmpty());
    }

    @Test
    public void debugLogsOnlySlowOperations() {
        logger.setLevel(Level.DEBUG);
        long start = perfLogger.start("starting");
        assertTrue(start >= 0);
        perfLogger.end(start, Long.MAX_VALUE, "fast {}", "argument");
        assertTrue(appender.list.isEmpty());

        perfLogger.end(perfLogger.start(), -1, "slow {}", "argument");
        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        assertEquals(Level.DEBUG, events.get(0).getLevel());
        assertTrue(events.get(0).getFormattedMessage().startsWith("slow argument [took "));
    }

    @Test
    public void traceAlwaysLogsStartAndEnd() {
        logger.setLevel(Level.TRACE);
        long start = perfLogger.start("starting");
        perfLogger.end(start, Long.MAX_VALUE, "done {}", 1);
        List<ILoggingEvent> events = appender.list;
        assertEquals(2, events.size());
        assertEquals("starting", events.get(0).getFormattedMessage());
        assertEquals(Level.TRACE, events.get(1).getLevel());
        assertTrue(events.get(1).getFormattedMessage().startsWith("done 1"));
    }
}
