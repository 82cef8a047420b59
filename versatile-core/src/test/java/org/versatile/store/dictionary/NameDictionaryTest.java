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
package org.versatile.store.dictionary;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.h2.jdbcx.JdbcConnectionPool;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;
import org.versatile.store.rdb.RDBOptions;
import org.versatile.store.rdb.RDBSchema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class NameDictionaryTest {

    private JdbcConnectionPool dataSource;
    private Connection connection;
    private RDBSchema schema;
    private NameDictionary names;

    @Before
    public void before() throws Exception {
        dataSource = AbstractVersatileStoreTest.createDataSource();
        connection = dataSource.getConnection();
        connection.setAutoCommit(false);
        schema = new RDBSchema(new RDBOptions());
        schema.initialize(connection);
        names = new NameDictionary(schema, 100);
    }

    @After
    public void after() throws Exception {
        connection.close();
        dataSource.dispose();
    }

    @Test
    public void catalogIds() throws Exception {
        assertEquals(WellKnownNames.EMPTY_ID, names.resolve(connection, ""));
        assertEquals(1, names.resolve(connection, WellKnownNames.sequenceName(0)));
        assertEquals(300, names.resolve(connection, "00000299"));
        assertEquals(WellKnownNames.getCatalog().get("value").longValue(), names.resolve(connection, "value"));
    }

    @Test
    public void resolveIsStable() throws Exception {
        Map<String, Long> first = names.resolve(connection, Arrays.asList("Alpha", "Beta"));
        assertEquals(2, first.size());
        assertTrue(first.get("Alpha") >= WellKnownNames.FIRST_DYNAMIC_ID);
        assertTrue(first.get("Beta") >= WellKnownNames.FIRST_DYNAMIC_ID);
        assertTrue(!first.get("Alpha").equals(first.get("Beta")));
        assertEquals(first, names.resolve(connection, Arrays.asList("Beta", "Alpha")));
    }

    @Test
    public void namesAreExact() throws Exception {
        Map<String, Long> ids = names.resolve(connection, Arrays.asList("a", "A", "a ", " a"));
        assertEquals(4, new HashSet<Long>(ids.values()).size());

        NameDictionary fresh = new NameDictionary(schema, 100);
        Map<Long, String> back = fresh.getNames(connection, ids.values());
        for (Map.Entry<String, Long> e : ids.entrySet()) {
            assertEquals(e.getKey(), back.get(e.getValue()));
        }
    }

    @Test
    public void lookupDoesNotCreate() throws Exception {
        assertNull(names.lookup(connection, "Gamma"));
        long id = names.resolve(connection, "Gamma");
        assertEquals(Long.valueOf(id), names.lookup(connection, "Gamma"));
    }

    @Test
    public void separateCachesConverge() throws Exception {
        NameDictionary other = new NameDictionary(schema, 100);
        try (Connection second = dataSource.getConnection()) {
            second.setAutoCommit(false);
            long id = names.resolve(connection, "Shared");
            assertEquals(id, other.resolve(second, "Shared"));
            assertEquals(Long.valueOf(id), other.lookup(second, "Shared"));
        }
    }

    @Test
    public void concurrentResolversConverge() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                final List<String> requested = Arrays.asList("race-" + round, "race-" + round + "-b", "Shared");
                final CyclicBarrier barrier = new CyclicBarrier(2);
                List<Future<Map<String, Long>>> futures = new ArrayList<Future<Map<String, Long>>>();
                for (int t = 0; t < 2; t++) {
                    futures.add(executor.submit(new Callable<Map<String, Long>>() {
                        @Override
                        public Map<String, Long> call() throws Exception {
                            NameDictionary dictionary = new NameDictionary(schema, 100);
                            try (Connection c = dataSource.getConnection()) {
                                c.setAutoCommit(false);
                                barrier.await(10, TimeUnit.SECONDS);
                                Map<String, Long> ids = dictionary.resolve(c, requested);
                                c.commit();
                                return ids;
                            }
                        }
                    }));
                }
                Map<String, Long> first = futures.get(0).get(30, TimeUnit.SECONDS);
                assertEquals(3, first.size());
                assertEquals(first, futures.get(1).get(30, TimeUnit.SECONDS));
                assertEquals(first, names.lookup(connection, requested));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void manyNames() throws Exception {
        List<String> requested = new ArrayList<String>();
        for (int i = 0; i < 1200; i++) {
            requested.add("name-" + i);
        }
        Map<String, Long> ids = names.resolve(connection, requested);
        assertEquals(1200, ids.size());
        assertEquals(1200, new HashSet<Long>(ids.values()).size());
        assertEquals(ids, new NameDictionary(schema, 100).lookup(connection, requested));
    }

    @Test
    public void disposeClearsCache() throws Exception {
        names.resolve(connection, "Delta");
        assertTrue(names.getCacheSize() > WellKnownNames.SEQUENCE_NAMES);
        names.dispose();
        assertEquals(0, names.getCacheSize());
        assertNotNull(names.lookup(connection, "Delta"));
        assertEquals(Long.valueOf(WellKnownNames.EMPTY_ID), names.lookup(connection, ""));
    }
}
