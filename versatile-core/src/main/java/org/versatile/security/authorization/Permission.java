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
package org.versatile.security.authorization;

/**
 * The kinds of access rules.
 */
public enum Permission {

    DENY(1),

    ALLOW(2),

    /**
     * Denies everyone not explicitly allowed. Stored for the everyone group
     * when a scope has a non-empty allow list.
     */
    SYNTHESIZED_DENY(3);

    private final int id;

    Permission(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static Permission fromId(int id) {
        for (Permission p : values()) {
            if (p.id == id) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown permission: " + id);
    }
}
