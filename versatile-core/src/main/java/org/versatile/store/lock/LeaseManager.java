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
import org.versatile.store.DocumentIdentity;
import org.versatile.store.dictionary.NameDictionary;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

/**
 * Stores at most one {@link Lease} per document. Expired leases stay in
 * place until {@link #sweep(Connection, long)} removes them.
 * <p>
 * Transaction boundaries are the caller's responsibility.
 */
public class LeaseManager {

    private static final Logger LOG = LoggerFactory.getLogger(LeaseManager.class);

    private final String table;
    private final String namesTable;
    private final NameDictionary names;

    public LeaseManager(@NotNull RDBSchema schema, @NotNull NameDictionary names) {
        this.table = schema.getLeases();
        this.namesTable = schema.getNames();
        this.names = names;
    }

    /**
     * @return the lease of a document, or {@code null}
     */
    @Nullable
    public Lease get(@NotNull Connection connection, @NotNull DocumentIdentity identity) throws SQLException {
        Map<String, Long> nids = names.lookup(connection,
                Arrays.asList(identity.getContainer(), identity.getDocument()));
        Long containerNid = nids.get(identity.getContainer());
        Long docNid = nids.get(identity.getDocument());
        if (containerNid == null || docNid == null) {
            return null;
        }
        SqlStatement select = new SqlStatement("select n.NAME, l.TAKEN, l.EXPIRES from " + table + " l"
                + " join " + namesTable + " n on n.NID = l.HOLDER_NID"
                + " where l.CONTAINER_NID = ? and l.DOC_NID = ?", containerNid, docNid);
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? new Lease(EndOfValue.strip(rs.getString(1)), rs.getLong(2), rs.getLong(3)) : null;
        }
    }

    /**
     * Sets the lease of a document, replacing any existing one. A
     * {@code null} lease deletes the lease.
     */
    public void set(@NotNull Connection connection, @NotNull DocumentIdentity identity, @Nullable Lease lease)
            throws SQLException {
        if (lease == null) {
            Map<String, Long> nids = names.lookup(connection,
                    Arrays.asList(identity.getContainer(), identity.getDocument()));
            Long containerNid = nids.get(identity.getContainer());
            Long docNid = nids.get(identity.getDocument());
            if (containerNid != null && docNid != null) {
                remove(connection, containerNid, docNid);
            }
            LOG.debug("Cleared lease of {}", identity);
            return;
        }
        Map<String, Long> nids = names.resolve(connection,
                Arrays.asList(identity.getContainer(), identity.getDocument(), lease.getHolder()));
        new SqlStatement("merge into " + table + " (CONTAINER_NID, DOC_NID, HOLDER_NID, TAKEN, EXPIRES)"
                + " key (CONTAINER_NID, DOC_NID) values (?, ?, ?, ?, ?)",
                nids.get(identity.getContainer()), nids.get(identity.getDocument()), nids.get(lease.getHolder()),
                lease.getTaken(), lease.getExpires()).executeUpdate(connection);
        LOG.debug("Set lease of {} to {}", identity, lease);
    }

    /**
     * Moves the lease of a document to another identity, unless that
     * identity has a lease of its own.
     *
     * @return {@code true} if a lease was moved
     */
    public boolean move(@NotNull Connection connection, long fromContainerNid, long fromDocNid,
                        long toContainerNid, long toDocNid) throws SQLException {
        int count = new SqlStatement("update " + table + " set CONTAINER_NID = ?, DOC_NID = ?"
                + " where CONTAINER_NID = ? and DOC_NID = ? and not exists (select 1 from " + table
                + " where CONTAINER_NID = ? and DOC_NID = ?)",
                toContainerNid, toDocNid, fromContainerNid, fromDocNid, toContainerNid, toDocNid)
                .executeUpdate(connection);
        return count > 0;
    }

    public void remove(@NotNull Connection connection, long containerNid, long docNid) throws SQLException {
        new SqlStatement("delete from " + table + " where CONTAINER_NID = ? and DOC_NID = ?",
                containerNid, docNid).executeUpdate(connection);
    }

    /**
     * Deletes all leases that expired before the given time.
     *
     * @return the number of deleted leases
     */
    public int sweep(@NotNull Connection connection, long now) throws SQLException {
        int count = new SqlStatement("delete from " + table + " where EXPIRES < ?", now).executeUpdate(connection);
        if (count > 0) {
            LOG.debug("Swept {} expired leases", count);
        }
        return count;
    }
}
