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

/**
 * The outcome of an attempt to acquire a lock. A conflict is not an error:
 * the caller may retry later.
 */
public final class LockResult {

    private final boolean acquired;
    private final Lock lock;

    private LockResult(boolean acquired, Lock lock) {
        this.acquired = acquired;
        this.lock = lock;
    }

    static LockResult acquired(Lock lock) {
        return new LockResult(true, lock);
    }

    static LockResult conflict(Lock current) {
        return new LockResult(false, current);
    }

    public boolean isAcquired() {
        return acquired;
    }

    /**
     * @return the lock now in place: the caller's own if acquired, the
     *          other holder's otherwise
     */
    @NotNull
    public Lock getLock() {
        return lock;
    }

    @Override
    public String toString() {
        return (acquired ? "acquired " : "conflict ") + lock;
    }
}
