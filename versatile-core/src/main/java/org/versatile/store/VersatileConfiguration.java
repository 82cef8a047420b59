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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.properties.SystemPropertySupplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tunables of a {@link VersatileStore}. Every value defaults from a system
 * property and can be overridden through the {@link Builder}.
 */
public final class VersatileConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(VersatileConfiguration.class);

    private final String containerPreferences;
    private final DocumentIdentity rootPreferences;
    private final String usersContainer;
    private final String adminGroup;
    private final String adminUser;
    private final String unknownAuthor;
    private final int searchBatchSize;
    private final long perfLogThreshold;

    private VersatileConfiguration(Builder builder) {
        this.containerPreferences = builder.containerPreferences;
        this.rootPreferences = DocumentIdentity.fromPath(builder.rootPreferences);
        this.usersContainer = builder.usersContainer;
        this.adminGroup = builder.adminGroup;
        this.adminUser = builder.adminUser;
        this.unknownAuthor = builder.unknownAuthor;
        this.searchBatchSize = builder.searchBatchSize;
        this.perfLogThreshold = builder.perfLogThreshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with all values taken from system properties
     *          or their defaults
     */
    public static VersatileConfiguration fromSystemProperties() {
        return builder().build();
    }

    /**
     * @return the name of the document in each container holding the
     *          container scope access rules
     */
    @NotNull
    public String getContainerPreferences() {
        return containerPreferences;
    }

    /**
     * @return the document holding the root scope access rules
     */
    @NotNull
    public DocumentIdentity getRootPreferences() {
        return rootPreferences;
    }

    /**
     * @return the container of user and group documents. Its name is
     *          stripped as a prefix from principals in access rules.
     */
    @NotNull
    public String getUsersContainer() {
        return usersContainer;
    }

    @NotNull
    public String getAdminGroup() {
        return adminGroup;
    }

    @NotNull
    public String getAdminUser() {
        return adminUser;
    }

    @NotNull
    public String getUnknownAuthor() {
        return unknownAuthor;
    }

    public int getSearchBatchSize() {
        return searchBatchSize;
    }

    public long getPerfLogThreshold() {
        return perfLogThreshold;
    }

    public static final class Builder {

        private String containerPreferences = SystemPropertySupplier
                .create("versatile.containerPreferences", "WebPreferences").loggingTo(LOG).get();
        private String rootPreferences = SystemPropertySupplier
                .create("versatile.rootPreferences", "System.SitePreferences").loggingTo(LOG)
                .validateWith(v -> v.lastIndexOf('.') > 0).get();
        private String usersContainer = SystemPropertySupplier
                .create("versatile.usersContainer", "Main").loggingTo(LOG).get();
        private String adminGroup = SystemPropertySupplier
                .create("versatile.adminGroup", "AdminGroup").loggingTo(LOG).get();
        private String adminUser = SystemPropertySupplier
                .create("versatile.adminUser", "AdminUser").loggingTo(LOG).get();
        private String unknownAuthor = SystemPropertySupplier
                .create("versatile.unknownAuthor", "UnknownUser").loggingTo(LOG).get();
        private int searchBatchSize = SystemPropertySupplier
                .create("versatile.searchBatchSize", 10000).loggingTo(LOG).validateWith(v -> v > 0).get();
        private long perfLogThreshold = SystemPropertySupplier
                .create("versatile.perfLogThreshold", 100L).loggingTo(LOG).get();

        private Builder() {
        }

        public Builder setContainerPreferences(@NotNull String containerPreferences) {
            this.containerPreferences = checkNotNull(containerPreferences);
            return this;
        }

        public Builder setRootPreferences(@NotNull String rootPreferences) {
            this.rootPreferences = checkNotNull(rootPreferences);
            return this;
        }

        public Builder setUsersContainer(@NotNull String usersContainer) {
            this.usersContainer = checkNotNull(usersContainer);
            return this;
        }

        public Builder setAdminGroup(@NotNull String adminGroup) {
            this.adminGroup = checkNotNull(adminGroup);
            return this;
        }

        public Builder setAdminUser(@NotNull String adminUser) {
            this.adminUser = checkNotNull(adminUser);
            return this;
        }

        public Builder setUnknownAuthor(@NotNull String unknownAuthor) {
            this.unknownAuthor = checkNotNull(unknownAuthor);
            return this;
        }

        public Builder setSearchBatchSize(int searchBatchSize) {
            checkArgument(searchBatchSize > 0, "searchBatchSize must be positive");
            this.searchBatchSize = searchBatchSize;
            return this;
        }

        public Builder setPerfLogThreshold(long perfLogThreshold) {
            this.perfLogThreshold = perfLogThreshold;
            return this;
        }

        public VersatileConfiguration build() {
            return new VersatileConfiguration(this);
        }
    }
}
