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
package org.versatile.store.lock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.Clock;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.dictionary.NameDictionary;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

/**
 * Non-blocking advisory locks, at most one per document. Acquisition never
 * waits: a lock held by someone else is reported back as a conflict.
 * <p>
 * Every method commits its own work.
 */
public class LockManager {

    private static final Logger LOG = LoggerFactory.getLogger(LockManager.class);

    private final String table;
    private final String namesTable;
    private final NameDictionary names;
    private final Clock clock;

    public LockManager(@NotNull RDBSchema schema, @NotNull NameDictionary names, @NotNull Clock clock) {
        this.table = schema.getLocks();
        this.namesTable = schema.getNames();
        this.names = names;
        this.clock = clock;
    }

    /**
     * Acquires the lock of a document, or refreshes it if the holder already
     * holds it.
     *
     * @return the result, a conflict if another holder has the lock
     */
    @NotNull
    public LockResult acquire(@NotNull Connection connection, @NotNull DocumentIdentity identity,
                              @NotNull String holder) throws SQLException {
        Map<String, Long> nids = names.resolve(connection,
                Arrays.asList(identity.getContainer(), identity.getDocument(), holder));
        long containerNid = nids.get(identity.getContainer());
        long docNid = nids.get(identity.getDocument());
        long now = clock.getTime();

        Lock current = get(connection, containerNid, docNid);
        if (current == null) {
            try {
                new SqlStatement("insert into " + table + " (CONTAINER_NID, DOC_NID, HOLDER_NID, LOCK_TIME)"
                        + " values (?, ?, ?, ?)", containerNid, docNid, nids.get(holder), now)
                        .executeUpdate(connection);
                connection.commit();
                LOG.debug("{} locked {}", holder, identity);
                return LockResult.acquired(new Lock(holder, now));
            } catch (SQLException ex) {
                if (!BulkInsert.isDuplicateKey(ex)) {
                    throw ex;
                }
                connection.rollback();
                current = get(connection, containerNid, docNid);
                if (current == null) {
                    throw ex;
                }
            }
        }
        if (current.getHolder().equals(holder)) {
            new SqlStatement("update " + table + " set LOCK_TIME = ? where CONTAINER_NID = ? and DOC_NID = ?",
                    now, containerNid, docNid).executeUpdate(connection);
            connection.commit();
            return LockResult.acquired(new Lock(holder, now));
        }
        LOG.debug("{} failed to lock {}, held by {}", holder, identity, current.getHolder());
        return LockResult.conflict(current);
    }

    /**
     * Releases the lock of a document if it is held by the given holder.
     *
     * @return {@code true} if a lock was released
     */
    public boolean release(@NotNull Connection connection, @NotNull DocumentIdentity identity,
                           @NotNull String holder) throws SQLException {
        Map<String, Long> nids = names.lookup(connection,
                Arrays.asList(identity.getContainer(), identity.getDocument(), holder));
        if (!allPresent(nids, identity, holder)) {
            return false;
        }
        int count = new SqlStatement("delete from " + table
                + " where CONTAINER_NID = ? and DOC_NID = ? and HOLDER_NID = ?",
                nids.get(identity.getContainer()), nids.get(identity.getDocument()), nids.get(holder))
                .executeUpdate(connection);
        connection.commit();
        LOG.debug("{} released lock of {}: {}", holder, identity, count > 0);
        return count > 0;
    }

    /**
     * @return the current lock of a document, or {@code null}
     */
    @Nullable
    public Lock get(@NotNull Connection connection, @NotNull DocumentIdentity identity) throws SQLException {
        Map<String, Long> nids = names.lookup(connection,
                Arrays.asList(identity.getContainer(), identity.getDocument()));
        Long containerNid = nids.get(identity.getContainer());
        Long docNid = nids.get(identity.getDocument());
        return containerNid == null || docNid == null ? null : get(connection, containerNid, docNid);
    }

    /**
     * Removes any lock of a document, regardless of its holder.
     */
    public void remove(@NotNull Connection connection, long containerNid, long docNid) throws SQLException {
        new SqlStatement("delete from " + table + " where CONTAINER_NID = ? and DOC_NID = ?",
                containerNid, docNid).executeUpdate(connection);
    }

    @Nullable
    private Lock get(Connection connection, long containerNid, long docNid) throws SQLException {
        SqlStatement select = new SqlStatement("select n.NAME, l.LOCK_TIME from " + table + " l"
                + " join " + namesTable + " n on n.NID = l.HOLDER_NID"
                + " where l.CONTAINER_NID = ? and l.DOC_NID = ?", containerNid, docNid);
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? new Lock(EndOfValue.strip(rs.getString(1)), rs.getLong(2)) : null;
        }
    }

    private static boolean allPresent(Map<String, Long> nids, DocumentIdentity identity, String holder) {
        return nids.containsKey(identity.getContainer()) && nids.containsKey(identity.getDocument())
                && nids.containsKey(holder);
    }
}
