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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An informational reservation of a document for editing. Leases are not
 * enforced: detecting a conflicting lease and reacting to it is up to the
 * caller.
 */
public final class Lease {

    private final String holder;
    private final long taken;
    private final long expires;

    /**
     * @param holder the principal holding the lease
     * @param taken the time the lease was taken, in milliseconds
     * @param expires the expiry time, in milliseconds
     */
    public Lease(@NotNull String holder, long taken, long expires) {
        checkArgument(expires >= taken, "lease expires before it is taken");
        this.holder = checkNotNull(holder);
        this.taken = taken;
        this.expires = expires;
    }

    @NotNull
    public String getHolder() {
        return holder;
    }

    public long getTaken() {
        return taken;
    }

    public long getExpires() {
        return expires;
    }

    public boolean isExpired(long now) {
        return expires < now;
    }

    public boolean isHeldBy(@NotNull String principal) {
        return holder.equals(principal);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Lease)) {
            return false;
        }
        Lease other = (Lease) o;
        return holder.equals(other.holder) && taken == other.taken && expires == other.expires;
    }

    @Override
    public int hashCode() {
        return holder.hashCode() ^ Long.hashCode(taken) ^ Long.hashCode(expires);
    }

    @Override
    public String toString() {
        return "Lease{holder=" + holder + ", taken=" + taken + ", expires=" + expires + "}";
    }
}
