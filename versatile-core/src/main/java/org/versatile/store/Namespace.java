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

/**
 * The namespaces of the revision table.
 */
public enum Namespace {

    /**
     * The current, visible revision of a document. At most one per document.
     */
    LATEST(0),

    /**
     * Superseded revisions, kept for history.
     */
    OTHER(1),

    /**
     * Placeholders without content, e.g. a reserved document identity.
     */
    DANGLING(2),

    /**
     * Container rows. The id of a container row is the container id of the
     * documents it holds.
     */
    CONTAINER(3),

    /**
     * The single sentinel row anchoring the container hierarchy.
     */
    ROOT(99);

    private final int id;

    Namespace(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static Namespace fromId(int id) {
        for (Namespace ns : values()) {
            if (ns.id == id) {
                return ns;
            }
        }
        throw new IllegalArgumentException("Unknown namespace: " + id);
    }
}
