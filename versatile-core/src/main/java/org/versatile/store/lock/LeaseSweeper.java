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

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.store.VersatileException;
import org.versatile.store.VersatileStore;

/**
 * Removes expired leases when run. The host schedules it, e.g. with a
 * {@link java.util.concurrent.ScheduledExecutorService}.
 */
public class LeaseSweeper implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(LeaseSweeper.class);

    private final VersatileStore store;

    public LeaseSweeper(@NotNull VersatileStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        try {
            int count = store.sweepExpiredLeases();
            LOG.debug("Lease sweep removed {} leases", count);
        } catch (VersatileException e) {
            // keep the schedule alive, the next run retries
            LOG.warn("Lease sweep failed", e);
        }
    }
}
