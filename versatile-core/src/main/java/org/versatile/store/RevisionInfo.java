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
 * Metadata of a document revision.
 */
public final class RevisionInfo {

    private final int version;
    private final long time;
    private final String author;
    private final String comment;
    private final Integer supersedes;
    private final boolean latest;

    public RevisionInfo(int version, long time, @NotNull String author, @NotNull String comment,
                        @Nullable Integer supersedes, boolean latest) {
        this.version = version;
        this.time = time;
        this.author = author;
        this.comment = comment;
        this.supersedes = supersedes;
        this.latest = latest;
    }

    public int getVersion() {
        return version;
    }

    /**
     * @return the revision time in milliseconds since the epoch
     */
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

    /**
     * @return the version an amend in place overwrote, or {@code null}
     */
    @Nullable
    public Integer getSupersedes() {
        return supersedes;
    }

    public boolean isLatest() {
        return latest;
    }

    @Override
    public String toString() {
        return "RevisionInfo{version=" + version + ", time=" + time + ", author=" + author
                + ", latest=" + latest + "}";
    }
}
