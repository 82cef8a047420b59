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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * <code>VersatileException</code> is a runtime exception for the store. It
 * wraps failures of the relational backend and reports fatal protocol
 * violations like a rollback without a prior revision.
 */
public class VersatileException extends RuntimeException {

    private static final long serialVersionUID = 7311248932412340271L;

    public VersatileException(String message) {
        super(message);
    }

    public VersatileException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Converts the given {@code Throwable} into a {@link VersatileException}.
     * If the {@code Throwable} is already a {@code VersatileException} it is
     * returned as is.
     *
     * @param t the throwable
     * @param msg a message describing the failed operation
     * @return a {@code VersatileException}
     */
    @NotNull
    public static VersatileException convert(@NotNull Throwable t, @Nullable String msg) {
        if (t instanceof VersatileException) {
            return (VersatileException) t;
        }
        String message = msg == null ? t.getMessage() : msg + ": " + t.getMessage();
        return new VersatileException(message, t);
    }
}
