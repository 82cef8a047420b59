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

import java.util.Set;

import org.jetbrains.annotations.NotNull;

import com.google.common.collect.ImmutableSetMultimap;

/**
 * A {@link PrincipalProvider} with a fixed membership.
 */
public final class StaticPrincipalProvider implements PrincipalProvider {

    private final ImmutableSetMultimap<String, String> groupsByMember;

    private StaticPrincipalProvider(ImmutableSetMultimap<String, String> groupsByMember) {
        this.groupsByMember = groupsByMember;
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    @Override
    public Set<String> getGroups(@NotNull String principal) {
        return groupsByMember.get(principal);
    }

    public static final class Builder {

        private final ImmutableSetMultimap.Builder<String, String> groupsByMember = ImmutableSetMultimap.builder();

        private Builder() {
        }

        public Builder addMember(@NotNull String group, @NotNull String member) {
            groupsByMember.put(member, group);
            return this;
        }

        public StaticPrincipalProvider build() {
            return new StaticPrincipalProvider(groupsByMember.build());
        }
    }
}
