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
 * An advisory lock on a document.
 */
public final class Lock {

    private final String holder;
    private final long time;

    public Lock(@NotNull String holder, long time) {
        this.holder = holder;
        this.time = time;
    }

    @NotNull
    public String getHolder() {
        return holder;
    }

    /**
     * @return the time the lock was taken, in milliseconds since the epoch
     */
    public long getTime() {
        return time;
    }

    @Override
    public String toString() {
        return "Lock{holder=" + holder + ", time=" + time + "}";
    }
}
