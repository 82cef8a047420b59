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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;
import org.versatile.commons.PerfLogger;
import org.versatile.store.Namespace;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

/**
 * Persists the access rules captured from a revision and loads the rules
 * of latest revisions for access checks.
 */
public class AccessRuleStore {

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(AccessRuleStore.class.getName() + ".perf"));

    private final RDBSchema schema;
    private final long perfLogThreshold;

    public AccessRuleStore(@NotNull RDBSchema schema, long perfLogThreshold) {
        this.schema = schema;
        this.perfLogThreshold = perfLogThreshold;
    }

    /**
     * Writes the rules of a revision.
     *
     * @param principalNids the ids of all principals named by the rules
     */
    public void insert(@NotNull Connection connection, final long revId, @NotNull List<AccessRule> rules,
                       @NotNull final Map<String, Long> principalNids) throws SQLException {
        new BulkInsert<AccessRule>("insert into " + schema.getAccessRules()
                + " (REV_ID, SCOPE, PERMISSION, ACCESS_MODE, PRINCIPAL_NID) values (?, ?, ?, ?, ?)",
                (stmt, rule) -> {
                    stmt.setLong(1, revId);
                    stmt.setString(2, String.valueOf(rule.getScope().getCode()));
                    stmt.setInt(3, rule.getPermission().getId());
                    stmt.setString(4, rule.getMode());
                    stmt.setLong(5, principalNids.get(rule.getPrincipal()));
                }).execute(connection, rules);
    }

    public void delete(@NotNull Connection connection, long revId) throws SQLException {
        new SqlStatement("delete from " + schema.getAccessRules() + " where REV_ID = ?", revId)
                .executeUpdate(connection);
    }

    /**
     * Loads the permissions of the given principals for one mode and scope,
     * from the latest revision of one document.
     */
    @NotNull
    public List<Permission> load(@NotNull Connection connection, @NotNull Scope scope, @NotNull String mode,
                                 long containerId, long docNid, @NotNull Collection<Long> principalNids)
            throws SQLException {
        SqlStatement select = new SqlStatement("select a.PERMISSION from " + schema.getAccessRules() + " a"
                + " join " + schema.getRevisions() + " r on r.REV_ID = a.REV_ID"
                + " where r.NAMESPACE = ? and r.CONTAINER_ID = ? and r.NID = ?"
                + " and a.SCOPE = ? and a.ACCESS_MODE = ? and a.PRINCIPAL_NID in ",
                Namespace.LATEST.getId(), containerId, docNid, String.valueOf(scope.getCode()), mode)
                .appendIn(principalNids);
        List<Permission> permissions = new ArrayList<Permission>();
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                permissions.add(Permission.fromId(rs.getInt(1)));
            }
        }
        return permissions;
    }

    /**
     * Loads the document scope permissions of the given principals for one
     * mode, for every document of a container in one query.
     *
     * @return the permissions by document name; documents without matching
     *          rules are absent
     */
    @NotNull
    public Map<String, List<Permission>> loadDocuments(@NotNull Connection connection, @NotNull String mode,
                                                       long containerId, @NotNull Collection<Long> principalNids)
            throws SQLException {
        long start = PERFLOG.start();
        SqlStatement select = new SqlStatement("select n.NAME, a.PERMISSION from " + schema.getAccessRules() + " a"
                + " join " + schema.getRevisions() + " r on r.REV_ID = a.REV_ID"
                + " join " + schema.getNames() + " n on n.NID = r.NID"
                + " where r.NAMESPACE = ? and r.CONTAINER_ID = ? and a.SCOPE = ? and a.ACCESS_MODE = ?"
                + " and a.PRINCIPAL_NID in ",
                Namespace.LATEST.getId(), containerId, String.valueOf(Scope.DOCUMENT.getCode()), mode)
                .appendIn(principalNids);
        Map<String, List<Permission>> result = new HashMap<String, List<Permission>>();
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.computeIfAbsent(EndOfValue.strip(rs.getString(1)), k -> new ArrayList<Permission>())
                        .add(Permission.fromId(rs.getInt(2)));
            }
        }
        PERFLOG.end(start, perfLogThreshold, "loadDocuments: container {}, mode {}, {} documents with rules",
                containerId, mode, result.size());
        return result;
    }
}
