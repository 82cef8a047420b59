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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * PerfLogger is a thin wrapper around a slf4j Logger for timing bulk
 * operations.
 * <p>
 * Usage:
 * <ul>
 * <li>final long start = perfLogger.start();</li>
 * <li>.. some code ..</li>
 * <li>perfLogger.end(start, 10, "resolve: {} names", count);</li>
 * </ul>
 * <p>
 * Nothing is measured unless the delegate logs at DEBUG or TRACE. At DEBUG
 * the end message is only logged when the operation took longer than the
 * given threshold, at TRACE it is always logged.
 */
public final class PerfLogger {

    private final Logger delegate;

    public PerfLogger(Logger delegate) {
        this.delegate = checkNotNull(delegate, "delegate must not be null");
    }

    /**
     * @return a start marker for {@link #end(long, long, String, Object...)},
     *          or -1 if neither DEBUG nor TRACE is enabled
     */
    public long start() {
        return start(null);
    }

    /**
     * Same as {@link #start()} but logs the given message at TRACE.
     */
    public long start(String traceMessage) {
        if (!delegate.isDebugEnabled()) {
            return -1;
        }
        if (traceMessage != null && delegate.isTraceEnabled()) {
            delegate.trace(traceMessage);
        }
        return System.nanoTime();
    }

    /**
     * Logs the given message with the elapsed time appended.
     *
     * @param start the value returned by {@link #start()}
     * @param debugThresholdMs log at DEBUG only if the operation took
     *          longer than this
     * @param message the message, may contain slf4j placeholders
     * @param arguments the placeholder arguments
     */
    public void end(long start, long debugThresholdMs, String message, Object... arguments) {
        if (start < 0) {
            return;
        }
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (delegate.isTraceEnabled()) {
            delegate.trace(message + " [took " + millis + "ms]", arguments);
        } else if (millis > debugThresholdMs && delegate.isDebugEnabled()) {
            delegate.debug(message + " [took " + millis + "ms]", arguments);
        }
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    public boolean isTraceEnabled() {
        return delegate.isTraceEnabled();
    }
}
