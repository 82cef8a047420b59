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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.DocumentRevision;
import org.versatile.store.VersatileStore;

import com.google.common.collect.ImmutableSetMultimap;

/**
 * A {@link PrincipalProvider} that reads group membership from the group
 * documents of the users container. A group document is named with the
 * suffix {@code Group} and lists its members in the {@code GROUP}
 * preference.
 * <p>
 * Membership is loaded on first use and kept until {@link #refresh()}.
 */
public class GroupDocumentPrincipalProvider implements PrincipalProvider {

    private static final Logger LOG = LoggerFactory.getLogger(GroupDocumentPrincipalProvider.class);

    static final String GROUP_SUFFIX = "Group";

    static final String GROUP_PREFERENCE = "GROUP";

    private final VersatileStore store;

    private final AccessRuleExtractor parser;

    private ImmutableSetMultimap<String, String> groupsByMember;

    public GroupDocumentPrincipalProvider(@NotNull VersatileStore store) {
        this.store = store;
        this.parser = new AccessRuleExtractor(store.getConfiguration().getUsersContainer());
    }

    @NotNull
    @Override
    public synchronized Set<String> getGroups(@NotNull String principal) {
        if (groupsByMember == null) {
            groupsByMember = load();
        }
        return groupsByMember.get(principal);
    }

    /**
     * Discards the loaded membership.
     */
    public synchronized void refresh() {
        groupsByMember = null;
    }

    private ImmutableSetMultimap<String, String> load() {
        String container = store.getConfiguration().getUsersContainer();
        List<DocumentIdentity> groups = new ArrayList<DocumentIdentity>();
        for (String name : store.enumerateDocuments(container)) {
            if (name.endsWith(GROUP_SUFFIX)) {
                groups.add(new DocumentIdentity(container, name));
            }
        }
        ImmutableSetMultimap.Builder<String, String> builder = ImmutableSetMultimap.builder();
        for (Map.Entry<DocumentIdentity, DocumentRevision> e : store.readAll(groups).entrySet()) {
            String members = e.getValue().getContent().getPreference(GROUP_PREFERENCE);
            if (members == null) {
                continue;
            }
            for (String member : parser.parsePrincipals(members)) {
                builder.put(member, e.getKey().getDocument());
            }
        }
        ImmutableSetMultimap<String, String> result = builder.build();
        LOG.debug("Loaded {} memberships from {} groups in {}", result.size(), groups.size(), container);
        return result;
    }
}
