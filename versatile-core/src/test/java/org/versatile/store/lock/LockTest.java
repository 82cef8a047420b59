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
package org.versatile.store.lock;

import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;
import org.versatile.store.DocumentIdentity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class LockTest extends AbstractVersatileStoreTest {

    private final DocumentIdentity doc = new DocumentIdentity("C", "D");

    @Test
    public void acquireAndRelease() {
        assertNull(store.getLock(doc));
        LockResult result = store.acquireLock(doc, "U1");
        assertTrue(result.isAcquired());
        assertEquals("U1", result.getLock().getHolder());
        assertEquals(clock.getTime(), result.getLock().getTime());

        Lock lock = store.getLock(doc);
        assertEquals("U1", lock.getHolder());

        assertTrue(store.releaseLock(doc, "U1"));
        assertNull(store.getLock(doc));
        assertFalse(store.releaseLock(doc, "U1"));
    }

    @Test
    public void conflictIsReturned() {
        store.acquireLock(doc, "U1");
        LockResult result = store.acquireLock(doc, "U2");
        assertFalse(result.isAcquired());
        assertEquals("U1", result.getLock().getHolder());

        assertFalse(store.releaseLock(doc, "U2"));
        assertEquals("U1", store.getLock(doc).getHolder());
    }

    @Test
    public void holderRefreshes() {
        store.acquireLock(doc, "U1");
        clock.advance(5, TimeUnit.MINUTES);
        LockResult result = store.acquireLock(doc, "U1");
        assertTrue(result.isAcquired());
        assertEquals(clock.getTime(), store.getLock(doc).getTime());
    }

    @Test
    public void releaseByUnknownHolder() {
        store.acquireLock(doc, "U1");
        assertFalse(store.releaseLock(doc, "NeverSeen"));
        assertFalse(store.releaseLock(new DocumentIdentity("C", "Other"), "U1"));
    }
}
