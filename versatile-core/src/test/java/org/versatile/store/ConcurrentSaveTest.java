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
package org.versatile.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

/**
 * Saves from two threads at the same time.
 */
public class ConcurrentSaveTest extends AbstractVersatileStoreTest {

    private static final int ROUNDS = 25;

    private ExecutorService executor;

    @Before
    public void before() {
        executor = Executors.newFixedThreadPool(2);
    }

    @After
    public void after() throws Exception {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    public void sameDocumentGetsConsecutiveVersions() throws Exception {
        for (int i = 0; i < ROUNDS; i++) {
            DocumentIdentity id = new DocumentIdentity("Web", "Topic" + i);
            List<Integer> versions = saveConcurrently(id, id);
            assertEquals(new HashSet<Integer>(Arrays.asList(1, 2)), new HashSet<Integer>(versions));
            assertEquals(Arrays.asList(2, 1), store.getRevisionHistory(id));
        }
        assertEquals(0, count("select count(*) from (select CONTAINER_ID, NID from REVISIONS"
                + " where NAMESPACE = 0 group by CONTAINER_ID, NID having count(*) > 1) d"));
        assertEquals(ROUNDS, store.enumerateDocuments("Web").size());
    }

    @Test
    public void newContainerIsCreatedOnce() throws Exception {
        for (int i = 0; i < ROUNDS; i++) {
            String container = "Web" + i;
            List<Integer> versions = saveConcurrently(new DocumentIdentity(container, "First"),
                    new DocumentIdentity(container, "Second"));
            assertEquals(Arrays.asList(1, 1), versions);
            assertEquals(Arrays.asList("First", "Second"), store.enumerateDocuments(container));
        }
        assertEquals(0, count("select count(*) from (select NID from REVISIONS"
                + " where NAMESPACE = 3 group by NID having count(*) > 1) d"));
        assertEquals(ROUNDS, store.enumerateContainers(null, false).size());
    }

    @Test
    public void existingContainer() throws Exception {
        store.save(new DocumentIdentity("Web", "Home"), text("home"), "U", SaveOptions.defaults());
        List<Integer> versions = saveConcurrently(new DocumentIdentity("Web", "Home"),
                new DocumentIdentity("Web", "Other"));
        assertEquals(Arrays.asList(2, 1), versions);
        assertEquals(Arrays.asList("Home", "Other"), store.enumerateDocuments("Web"));
    }

    private List<Integer> saveConcurrently(DocumentIdentity... ids) throws Exception {
        final CyclicBarrier barrier = new CyclicBarrier(ids.length);
        List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
        for (int t = 0; t < ids.length; t++) {
            final DocumentIdentity id = ids[t];
            final String author = "U" + t;
            futures.add(executor.submit(new Callable<Integer>() {
                @Override
                public Integer call() throws Exception {
                    barrier.await(10, TimeUnit.SECONDS);
                    return store.save(id, text("by " + author), author, SaveOptions.defaults());
                }
            }));
        }
        List<Integer> versions = new ArrayList<Integer>();
        for (Future<Integer> f : futures) {
            versions.add(f.get(30, TimeUnit.SECONDS));
        }
        return versions;
    }

    private long count(String sql) throws Exception {
        try (Connection c = dataSource.getConnection();
             PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
