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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.VersatileConfiguration;
import org.versatile.store.VersatileException;
import org.versatile.store.dictionary.NameDictionary;
import org.versatile.store.rdb.RDBConnectionHandler;
import org.versatile.store.revision.RevisionStore;

import com.google.common.collect.ImmutableSet;

/**
 * Evaluates access rules through the scopes, broadest first. The first
 * decisive rule wins:
 * <ol>
 * <li>administrators are always permitted;</li>
 * <li>root scope rules of the root preferences document;</li>
 * <li>container scope rules of the container preferences document;</li>
 * <li>document scope rules of the document itself;</li>
 * <li>without any decisive rule access is permitted.</li>
 * </ol>
 * Within a scope a deny wins over an allow, and an allow wins over the
 * synthesized deny of everyone not listed.
 * <p>
 * A resolver is meant to serve one request. It memoizes memberships and
 * loaded rules for its lifetime and is not thread-safe.
 */
public class AccessResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AccessResolver.class);

    private final RDBConnectionHandler connectionHandler;
    private final NameDictionary names;
    private final RevisionStore revisions;
    private final AccessRuleStore rules;
    private final VersatileConfiguration configuration;
    private final PrincipalProvider principalProvider;

    private final Map<String, Set<String>> identities = new HashMap<String, Set<String>>();
    private final Map<String, List<Permission>> rootRules = new HashMap<String, List<Permission>>();
    private final Map<String, List<Permission>> containerRules = new HashMap<String, List<Permission>>();
    private final Map<String, Map<String, List<Permission>>> documentRules =
            new HashMap<String, Map<String, List<Permission>>>();

    private String failure;

    public AccessResolver(@NotNull RDBConnectionHandler connectionHandler, @NotNull NameDictionary names,
                          @NotNull RevisionStore revisions, @NotNull AccessRuleStore rules,
                          @NotNull VersatileConfiguration configuration,
                          @NotNull PrincipalProvider principalProvider) {
        this.connectionHandler = connectionHandler;
        this.names = names;
        this.revisions = revisions;
        this.rules = rules;
        this.configuration = configuration;
        this.principalProvider = principalProvider;
    }

    /**
     * Checks whether a principal has access in the given mode. The scope of
     * the check is the scope of the target.
     *
     * @param principal the user
     * @param mode the access mode, e.g. {@code VIEW} or {@code CHANGE}
     * @param target the root, a container or a document
     * @return {@code true} if access is permitted, otherwise
     *          {@link #getFailure()} tells why not
     */
    public boolean checkAccess(@NotNull String principal, @NotNull String mode, @NotNull AccessTarget target) {
        failure = null;
        if (isAdmin(principal)) {
            return true;
        }
        String m = mode.toUpperCase(Locale.ENGLISH);
        Connection connection = null;
        try {
            connection = connectionHandler.getRWConnection();
            Set<Long> ids = getIdentityIds(connection, principal);

            String key = principal + '\n' + m;
            List<Permission> root = rootRules.get(key);
            if (root == null) {
                DocumentIdentity prefs = configuration.getRootPreferences();
                root = loadRules(connection, Scope.ROOT, m, prefs.getContainer(), prefs.getDocument(), ids);
                rootRules.put(key, root);
            }
            if (!evaluate(root, "root")) {
                return false;
            }
            if (target.getScope() == Scope.ROOT) {
                return true;
            }

            String container = target.getContainer();
            key = container + '\n' + principal + '\n' + m;
            List<Permission> web = containerRules.get(key);
            if (web == null) {
                web = loadRules(connection, Scope.CONTAINER, m, container,
                        configuration.getContainerPreferences(), ids);
                containerRules.put(key, web);
            }
            if (!evaluate(web, "container " + container)) {
                return false;
            }
            if (target.getScope() == Scope.CONTAINER) {
                return true;
            }

            Map<String, List<Permission>> docs = documentRules.get(key);
            if (docs == null) {
                docs = loadDocumentRules(connection, m, container, ids);
                documentRules.put(key, docs);
            }
            List<Permission> doc = docs.get(target.getDocument());
            return evaluate(doc == null ? Collections.<Permission>emptyList() : doc,
                    "document " + container + "." + target.getDocument());
        } catch (SQLException ex) {
            throw VersatileException.convert(ex, "Access check of " + principal + " on " + target + " failed");
        } finally {
            connectionHandler.rollbackConnection(connection);
            connectionHandler.closeConnection(connection);
        }
    }

    /**
     * @return the reason the last check failed, or {@code null} if it
     *          succeeded
     */
    @Nullable
    public String getFailure() {
        return failure;
    }

    /**
     * Returns the principal, all groups it is a member of, directly or
     * through other groups, and the everyone group.
     */
    @NotNull
    public Set<String> getIdentities(@NotNull String principal) {
        Set<String> result = identities.get(principal);
        if (result == null) {
            Set<String> all = new LinkedHashSet<String>();
            all.add(principal);
            Deque<String> pending = new ArrayDeque<String>();
            pending.add(principal);
            while (!pending.isEmpty()) {
                for (String group : principalProvider.getGroups(pending.poll())) {
                    if (all.add(group)) {
                        pending.add(group);
                    }
                }
            }
            all.add(AccessRuleExtractor.EVERYONE);
            result = ImmutableSet.copyOf(all);
            identities.put(principal, result);
        }
        return result;
    }

    public boolean isAdmin(@NotNull String principal) {
        return configuration.getAdminUser().equals(principal)
                || getIdentities(principal).contains(configuration.getAdminGroup());
    }

    private boolean evaluate(List<Permission> permissions, String scope) {
        if (permissions.contains(Permission.DENY)) {
            failure = "access denied on " + scope;
        } else if (permissions.contains(Permission.ALLOW)) {
            return true;
        } else if (permissions.contains(Permission.SYNTHESIZED_DENY)) {
            failure = "access not allowed on " + scope;
        } else {
            return true;
        }
        LOG.debug("{}", failure);
        return false;
    }

    private Set<Long> getIdentityIds(Connection connection, String principal) throws SQLException {
        // identities without a name id cannot be named by any rule
        return new LinkedHashSet<Long>(names.lookup(connection, getIdentities(principal)).values());
    }

    private List<Permission> loadRules(Connection connection, Scope scope, String mode,
                                       String container, String document, Set<Long> ids) throws SQLException {
        Map<String, Long> nids = names.lookup(connection, ImmutableSet.of(container, document));
        Long containerNid = nids.get(container);
        Long docNid = nids.get(document);
        if (containerNid == null || docNid == null) {
            return Collections.emptyList();
        }
        Long containerId = revisions.getContainerId(connection, containerNid);
        if (containerId == null) {
            return Collections.emptyList();
        }
        return rules.load(connection, scope, mode, containerId, docNid, ids);
    }

    private Map<String, List<Permission>> loadDocumentRules(Connection connection, String mode,
                                                            String container, Set<Long> ids) throws SQLException {
        Long containerNid = names.lookup(connection, container);
        Long containerId = containerNid == null ? null : revisions.getContainerId(connection, containerNid);
        if (containerId == null) {
            return Collections.emptyMap();
        }
        return rules.loadDocuments(connection, mode, containerId, ids);
    }
}
