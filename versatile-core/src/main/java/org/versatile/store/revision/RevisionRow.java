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
package org.versatile.store.revision;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.versatile.store.Namespace;

/**
 * A row of the revision table, with author and comment resolved to names.
 */
public final class RevisionRow {

    private final long id;
    private final Namespace namespace;
    private final long containerId;
    private final long nid;
    private final String name;
    private final int version;
    private final long time;
    private final String author;
    private final String comment;
    private final Integer reprev;

    RevisionRow(long id, @NotNull Namespace namespace, long containerId, long nid, @NotNull String name,
                int version, long time, @NotNull String author, @NotNull String comment,
                @Nullable Integer reprev) {
        this.id = id;
        this.namespace = namespace;
        this.containerId = containerId;
        this.nid = nid;
        this.name = name;
        this.version = version;
        this.time = time;
        this.author = author;
        this.comment = comment;
        this.reprev = reprev;
    }

    public long getId() {
        return id;
    }

    @NotNull
    public Namespace getNamespace() {
        return namespace;
    }

    public long getContainerId() {
        return containerId;
    }

    public long getNid() {
        return nid;
    }

    /**
     * @return the document name, or the container name of a container row
     */
    @NotNull
    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public long getTime() {
        return time;
    }

    @NotNull
    public String getAuthor() {
        return author;
    }

    @NotNull
    public String getComment() {
        return comment;
    }

    @Nullable
    public Integer getReprev() {
        return reprev;
    }

    @Override
    public String toString() {
        return "RevisionRow{id=" + id + ", " + namespace + ", container=" + containerId
                + ", name=" + name + ", version=" + version + "}";
    }
}
