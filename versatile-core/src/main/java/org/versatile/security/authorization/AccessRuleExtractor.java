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
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.versatile.store.Record;
import org.versatile.store.StructuredDocument;

/**
 * Extracts the access rules of a document from its preferences named
 * {@code (ALLOW|DENY)(ROOT|WEB|TOPIC)<MODE>}.
 * <p>
 * Two normalizations apply:
 * <ul>
 * <li>an empty deny list at document scope allows everyone at that scope,
 * replacing any allow list;</li>
 * <li>a non-empty allow list denies everyone not in it, stored as a
 * {@link Permission#SYNTHESIZED_DENY} rule for the everyone group.</li>
 * </ul>
 */
public class AccessRuleExtractor {

    /**
     * The principal standing for everyone.
     */
    public static final String EVERYONE = "";

    private static final Pattern RULE = Pattern.compile("^(ALLOW|DENY)(ROOT|WEB|TOPIC)([A-Z]+)$");

    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    private final Pattern prefix;

    /**
     * @param usersContainer the container of user documents, stripped as a
     *          prefix from listed principals
     */
    public AccessRuleExtractor(@NotNull String usersContainer) {
        this.prefix = Pattern.compile("^(?:" + Pattern.quote(usersContainer) + "|%USERSWEB%|%MAINWEB%)\\.");
    }

    @NotNull
    public List<AccessRule> extract(@NotNull StructuredDocument document) {
        // scope -> mode -> deny/allow -> principals
        Map<Scope, Map<String, Map<Boolean, List<String>>>> lists =
                new EnumMap<Scope, Map<String, Map<Boolean, List<String>>>>(Scope.class);
        for (Record r : document.getRecords(StructuredDocument.PREFERENCE)) {
            String name = r.getName();
            if (name == null) {
                continue;
            }
            Matcher m = RULE.matcher(name);
            if (!m.matches()) {
                continue;
            }
            String value = r.get("value");
            lists.computeIfAbsent(Scope.fromToken(m.group(2)), k -> new TreeMap<String, Map<Boolean, List<String>>>())
                    .computeIfAbsent(m.group(3), k -> new TreeMap<Boolean, List<String>>())
                    .put("ALLOW".equals(m.group(1)), parsePrincipals(value == null ? "" : value));
        }

        List<AccessRule> rules = new ArrayList<AccessRule>();
        for (Map.Entry<Scope, Map<String, Map<Boolean, List<String>>>> byScope : lists.entrySet()) {
            Scope scope = byScope.getKey();
            for (Map.Entry<String, Map<Boolean, List<String>>> byMode : byScope.getValue().entrySet()) {
                String mode = byMode.getKey();
                List<String> deny = byMode.getValue().get(Boolean.FALSE);
                List<String> allow = byMode.getValue().get(Boolean.TRUE);
                boolean synthesize = false;
                if (scope == Scope.DOCUMENT && deny != null && deny.isEmpty()) {
                    allow = Collections.singletonList(EVERYONE);
                    deny = null;
                } else if (allow != null && !allow.isEmpty()) {
                    synthesize = true;
                }
                if (deny != null) {
                    for (String p : deny) {
                        rules.add(new AccessRule(scope, Permission.DENY, mode, p));
                    }
                }
                if (allow != null) {
                    for (String p : allow) {
                        rules.add(new AccessRule(scope, Permission.ALLOW, mode, p));
                    }
                }
                if (synthesize) {
                    rules.add(new AccessRule(scope, Permission.SYNTHESIZED_DENY, mode, EVERYONE));
                }
            }
        }
        return rules;
    }

    /**
     * Splits a principal list on commas and whitespace, strips the users
     * container prefix and drops entries that are empty or start with
     * {@code %}.
     */
    @NotNull
    public List<String> parsePrincipals(@NotNull String list) {
        Set<String> principals = new LinkedHashSet<String>();
        for (String entry : SEPARATOR.split(list)) {
            String p = prefix.matcher(entry).replaceFirst("");
            if (!p.isEmpty() && !p.startsWith("%")) {
                principals.add(p);
            }
        }
        return new ArrayList<String>(principals);
    }
}
