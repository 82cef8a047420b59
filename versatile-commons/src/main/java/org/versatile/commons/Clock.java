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

import java.util.Date;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mechanism for keeping track of time at millisecond accuracy.
 * <p>
 * Revision timestamps, lock and lease times and the lease sweep all read
 * the time through a clock, so tests can move time forward explicitly.
 */
public abstract class Clock {

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @return current time in milliseconds since the epoch
     */
    public abstract long getTime();

    /**
     * Convenience method that returns the {@link #getTime()} value
     * as a {@link Date} instance.
     *
     * @return current time
     */
    public Date getDate() {
        return new Date(getTime());
    }

    /**
     * Returns the current time in seconds since the epoch, the unit used
     * for numeric date values.
     *
     * @return current time in seconds since the epoch
     */
    public long getTimeInSeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(getTime());
    }

    /**
     * Simple clock implementation based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A virtual clock that has no connection to the actual system time. The
     * time only changes when it is explicitly moved with
     * {@link #setTime(long)} or {@link #advance(long, TimeUnit)}.
     */
    public static class Virtual extends Clock {

        private final AtomicLong time;

        public Virtual() {
            this(0);
        }

        public Virtual(long time) {
            this.time = new AtomicLong(time);
        }

        @Override
        public long getTime() {
            return time.get();
        }

        public void setTime(long timestamp) {
            time.set(timestamp);
        }

        public long advance(long duration, TimeUnit unit) {
            return time.addAndGet(unit.toMillis(duration));
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }
}
