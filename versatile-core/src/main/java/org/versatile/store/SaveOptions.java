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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Options of {@link VersatileStore#save(DocumentIdentity, StructuredDocument, String, SaveOptions)}.
 */
public final class SaveOptions {

    private String comment = "";
    private Long forceTimestamp;
    private boolean amendInPlace;
    private Integer explicitVersion;
    private boolean latest = true;

    public static SaveOptions defaults() {
        return new SaveOptions();
    }

    @NotNull
    public String getComment() {
        return comment;
    }

    public SaveOptions setComment(@NotNull String comment) {
        this.comment = checkNotNull(comment);
        return this;
    }

    /**
     * @return the explicit revision time in milliseconds, or {@code null}
     *          to use the store's clock
     */
    @Nullable
    public Long getForceTimestamp() {
        return forceTimestamp;
    }

    public SaveOptions setForceTimestamp(@Nullable Long forceTimestamp) {
        this.forceTimestamp = forceTimestamp;
        return this;
    }

    /**
     * If set, the current latest revision is overwritten instead of creating
     * a new version.
     */
    public boolean isAmendInPlace() {
        return amendInPlace;
    }

    public SaveOptions setAmendInPlace(boolean amendInPlace) {
        this.amendInPlace = amendInPlace;
        return this;
    }

    /**
     * @return the version to store the revision under, or {@code null} to
     *          use the next version. Used to import historic revisions.
     */
    @Nullable
    public Integer getExplicitVersion() {
        return explicitVersion;
    }

    public SaveOptions setExplicitVersion(@Nullable Integer explicitVersion) {
        checkArgument(explicitVersion == null || explicitVersion > 0, "version must be positive: %s", explicitVersion);
        this.explicitVersion = explicitVersion;
        return this;
    }

    /**
     * Only relevant with an explicit version: {@code false} stores the
     * revision as a historic one without touching the current latest.
     */
    public boolean isLatest() {
        return latest;
    }

    public SaveOptions setLatest(boolean latest) {
        this.latest = latest;
        return this;
    }
}
