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

/**
 * A revision of a document as returned by a read: its metadata and content.
 */
public final class DocumentRevision {

    private final DocumentIdentity identity;
    private final RevisionInfo info;
    private final StructuredDocument content;

    public DocumentRevision(@NotNull DocumentIdentity identity, @NotNull RevisionInfo info,
                            @NotNull StructuredDocument content) {
        this.identity = identity;
        this.info = info;
        this.content = content;
    }

    @NotNull
    public DocumentIdentity getIdentity() {
        return identity;
    }

    @NotNull
    public RevisionInfo getInfo() {
        return info;
    }

    @NotNull
    public StructuredDocument getContent() {
        return content;
    }

    public int getVersion() {
        return info.getVersion();
    }

    public boolean isLatest() {
        return info.isLatest();
    }
}
