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

public class LeaseTest extends AbstractVersatileStoreTest {

    private final DocumentIdentity doc = new DocumentIdentity("C", "D");

    @Test
    public void sweepRemovesExpired() {
        long expires = clock.getTime() + TimeUnit.MINUTES.toMillis(10);
        store.setLease(doc, new Lease("U1", clock.getTime(), expires));
        assertEquals(new Lease("U1", clock.getTime(), expires), store.getLease(doc));

        clock.setTime(expires + 1);
        assertEquals(1, store.sweepExpiredLeases());
        assertNull(store.getLease(doc));
    }

    @Test
    public void sweepKeepsCurrent() {
        DocumentIdentity other = new DocumentIdentity("C", "E");
        long now = clock.getTime();
        store.setLease(doc, new Lease("U1", now, now + 1000));
        store.setLease(other, new Lease("U2", now, now + 5000));

        clock.setTime(now + 1000);
        assertEquals(0, store.sweepExpiredLeases());
        clock.setTime(now + 2000);
        new LeaseSweeper(store).run();
        assertNull(store.getLease(doc));
        assertEquals("U2", store.getLease(other).getHolder());
    }

    @Test
    public void setReplacesAndClears() {
        store.setLease(doc, new Lease("U1", 0, 100));
        store.setLease(doc, new Lease("U2", 50, 200));
        Lease lease = store.getLease(doc);
        assertEquals("U2", lease.getHolder());
        assertEquals(50, lease.getTaken());
        assertEquals(200, lease.getExpires());

        store.setLease(doc, null);
        assertNull(store.getLease(doc));
        assertNull(store.getLease(new DocumentIdentity("Nowhere", "X")));
    }

    @Test
    public void expiry() {
        Lease lease = new Lease("U1", 0, 100);
        assertFalse(lease.isExpired(100));
        assertTrue(lease.isExpired(101));
        assertTrue(lease.isHeldBy("U1"));
        assertFalse(lease.isHeldBy("U2"));
    }
}
