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
package org.versatile.store.revision;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.store.Namespace;
import org.versatile.store.VersatileException;
import org.versatile.store.rdb.EndOfValue;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

/**
 * Access to the revision table.
 * <p>
 * Each document has at most one {@link Namespace#LATEST} row. Saving
 * retags the previous latest row to {@link Namespace#OTHER}, a rollback
 * promotes the newest other row back. Container rows live in
 * {@link Namespace#CONTAINER} below the root row, and their row id is the
 * container id of their documents.
 * <p>
 * This class only executes statements. Transaction boundaries are the
 * caller's responsibility.
 */
public class RevisionStore {

    private static final Logger LOG = LoggerFactory.getLogger(RevisionStore.class);

    private final String table;
    private final String select;

    public RevisionStore(@NotNull RDBSchema schema) {
        this.table = schema.getRevisions();
        String names = schema.getNames();
        this.select = "select r.REV_ID, r.NAMESPACE, r.CONTAINER_ID, r.NID, n.NAME, r.VERSION, r.REV_TIME, "
                + "a.NAME, c.NAME, r.REPREV from " + table + " r"
                + " join " + names + " n on n.NID = r.NID"
                + " join " + names + " a on a.NID = r.AUTHOR_NID"
                + " join " + names + " c on c.NID = r.COMMENT_NID";
    }

    //---------------------------------------------------------< containers >

    /**
     * @return the id of the container with the given name id, or
     *          {@code null} if it does not exist
     */
    @Nullable
    public Long getContainerId(@NotNull Connection connection, long containerNid) throws SQLException {
        RevisionRow row = querySingle(connection, new SqlStatement(select
                + " where r.NAMESPACE = ? and r.CONTAINER_ID = ? and r.NID = ?",
                Namespace.CONTAINER.getId(), RDBSchema.ROOT_ID, containerNid));
        return row == null ? null : row.getId();
    }

    /**
     * Returns the id of a container, creating the container row if needed.
     * Creation happens under the container's identity lock, whose row must
     * exist already.
     */
    public long getOrCreateContainer(@NotNull Connection connection, @NotNull IdentityGuard guard,
                                     long containerNid, long authorNid, long time) throws SQLException {
        Long id = getContainerId(connection, containerNid);
        if (id == null) {
            guard.lockContainer(connection, containerNid);
            id = getContainerId(connection, containerNid);
        }
        if (id == null) {
            id = insert(connection, Namespace.CONTAINER, RDBSchema.ROOT_ID, containerNid, 1, time,
                    authorNid, authorNid, null);
            LOG.debug("Created container {} with id {}", containerNid, id);
        }
        return id;
    }

    /**
     * @return all container rows, ordered by name
     */
    @NotNull
    public List<RevisionRow> getContainers(@NotNull Connection connection) throws SQLException {
        return query(connection, new SqlStatement(select + " where r.NAMESPACE = ? and r.CONTAINER_ID = ?"
                + " order by n.NAME", Namespace.CONTAINER.getId(), RDBSchema.ROOT_ID));
    }

    //----------------------------------------------------------< documents >

    @Nullable
    public RevisionRow getLatest(@NotNull Connection connection, long containerId, long nid) throws SQLException {
        return getSingle(connection, Namespace.LATEST, containerId, nid);
    }

    @Nullable
    public RevisionRow getDangling(@NotNull Connection connection, long containerId, long nid) throws SQLException {
        return getSingle(connection, Namespace.DANGLING, containerId, nid);
    }

    /**
     * @return the newest superseded revision, or {@code null}
     */
    @Nullable
    public RevisionRow getNewestOther(@NotNull Connection connection, long containerId, long nid)
            throws SQLException {
        return querySingle(connection, new SqlStatement(select
                + " where r.CONTAINER_ID = ? and r.NID = ? and r.NAMESPACE = ?"
                + " order by r.VERSION desc, r.REV_ID desc limit 1",
                containerId, nid, Namespace.OTHER.getId()));
    }

    /**
     * Finds the revision with the smallest version not below the requested
     * one, among the latest and superseded revisions.
     */
    @Nullable
    public RevisionRow find(@NotNull Connection connection, long containerId, long nid, int version)
            throws SQLException {
        return querySingle(connection, new SqlStatement(select
                + " where r.CONTAINER_ID = ? and r.NID = ? and r.NAMESPACE in (?, ?) and r.VERSION >= ?"
                + " order by r.VERSION, r.NAMESPACE, r.REV_ID desc limit 1",
                containerId, nid, Namespace.LATEST.getId(), Namespace.OTHER.getId(), version));
    }

    /**
     * @return the revision that was current at the given time, or
     *          {@code null} if the document did not exist yet
     */
    @Nullable
    public RevisionRow findAtTime(@NotNull Connection connection, long containerId, long nid, long time)
            throws SQLException {
        return querySingle(connection, new SqlStatement(select
                + " where r.CONTAINER_ID = ? and r.NID = ? and r.NAMESPACE in (?, ?) and r.REV_TIME <= ?"
                + " order by r.VERSION desc, r.REV_ID desc limit 1",
                containerId, nid, Namespace.LATEST.getId(), Namespace.OTHER.getId(), time));
    }

    /**
     * @return the latest and superseded revisions, newest first
     */
    @NotNull
    public List<RevisionRow> getHistory(@NotNull Connection connection, long containerId, long nid)
            throws SQLException {
        return query(connection, new SqlStatement(select
                + " where r.CONTAINER_ID = ? and r.NID = ? and r.NAMESPACE in (?, ?)"
                + " order by r.VERSION desc, r.NAMESPACE, r.REV_ID desc",
                containerId, nid, Namespace.LATEST.getId(), Namespace.OTHER.getId()));
    }

    /**
     * @return the rows of all namespaces of a document
     */
    @NotNull
    public List<RevisionRow> getAllRevisions(@NotNull Connection connection, long containerId, long nid)
            throws SQLException {
        return query(connection, new SqlStatement(select + " where r.CONTAINER_ID = ? and r.NID = ?",
                containerId, nid));
    }

    /**
     * @return the rows of all documents and namespaces of a container
     */
    @NotNull
    public List<RevisionRow> getAllRevisions(@NotNull Connection connection, long containerId)
            throws SQLException {
        return query(connection, new SqlStatement(select + " where r.CONTAINER_ID = ?", containerId));
    }

    /**
     * @return the latest rows of a container, ordered by document name
     */
    @NotNull
    public List<RevisionRow> getLatestRevisions(@NotNull Connection connection, long containerId)
            throws SQLException {
        return query(connection, new SqlStatement(select + " where r.NAMESPACE = ? and r.CONTAINER_ID = ?"
                + " order by n.NAME", Namespace.LATEST.getId(), containerId));
    }

    //-----------------------------------------------------------< mutation >

    /**
     * Inserts a row.
     *
     * @return the id of the new row
     */
    public long insert(@NotNull Connection connection, @NotNull Namespace namespace, long containerId, long nid,
                       int version, long time, long authorNid, long commentNid, @Nullable Integer reprev)
            throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement("insert into " + table
                + " (NAMESPACE, CONTAINER_ID, NID, VERSION, REV_TIME, AUTHOR_NID, COMMENT_NID, REPREV)"
                + " values (?, ?, ?, ?, ?, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS)) {
            stmt.setInt(1, namespace.getId());
            stmt.setLong(2, containerId);
            stmt.setLong(3, nid);
            stmt.setInt(4, version);
            stmt.setLong(5, time);
            stmt.setLong(6, authorNid);
            stmt.setLong(7, commentNid);
            if (reprev == null) {
                stmt.setNull(8, Types.INTEGER);
            } else {
                stmt.setInt(8, reprev);
            }
            stmt.executeUpdate();
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new VersatileException("No id generated for revision of " + nid);
                }
                return keys.getLong(1);
            }
        }
    }

    /**
     * Overwrites the metadata of a row, and its namespace and version.
     */
    public void update(@NotNull Connection connection, long revId, @NotNull Namespace namespace, int version,
                       long time, long authorNid, long commentNid, @Nullable Integer reprev) throws SQLException {
        new SqlStatement("update " + table + " set NAMESPACE = ?, VERSION = ?, REV_TIME = ?, AUTHOR_NID = ?,"
                + " COMMENT_NID = ?, REPREV = ? where REV_ID = ?",
                namespace.getId(), version, time, authorNid, commentNid, reprev, revId).executeUpdate(connection);
    }

    public void setNamespace(@NotNull Connection connection, long revId, @NotNull Namespace namespace)
            throws SQLException {
        new SqlStatement("update " + table + " set NAMESPACE = ? where REV_ID = ?", namespace.getId(), revId)
                .executeUpdate(connection);
    }

    /**
     * Changes the identity of a single row.
     */
    public void move(@NotNull Connection connection, long revId, long containerId, long nid) throws SQLException {
        new SqlStatement("update " + table + " set CONTAINER_ID = ?, NID = ? where REV_ID = ?",
                containerId, nid, revId).executeUpdate(connection);
    }

    public void delete(@NotNull Connection connection, long revId) throws SQLException {
        new SqlStatement("delete from " + table + " where REV_ID = ?", revId).executeUpdate(connection);
    }

    //------------------------------------------------------------< internal >

    @Nullable
    private RevisionRow getSingle(Connection connection, Namespace namespace, long containerId, long nid)
            throws SQLException {
        return querySingle(connection, new SqlStatement(select
                + " where r.NAMESPACE = ? and r.CONTAINER_ID = ? and r.NID = ?"
                + " order by r.REV_ID desc limit 1",
                namespace.getId(), containerId, nid));
    }

    @Nullable
    private RevisionRow querySingle(Connection connection, SqlStatement statement) throws SQLException {
        List<RevisionRow> rows = query(connection, statement);
        return rows.isEmpty() ? null : rows.get(0);
    }

    private List<RevisionRow> query(Connection connection, SqlStatement statement) throws SQLException {
        List<RevisionRow> rows = new ArrayList<RevisionRow>();
        try (PreparedStatement stmt = statement.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                int reprev = rs.getInt(10);
                Integer supersedes = rs.wasNull() ? null : reprev;
                rows.add(new RevisionRow(
                        rs.getLong(1),
                        Namespace.fromId(rs.getInt(2)),
                        rs.getLong(3),
                        rs.getLong(4),
                        EndOfValue.strip(rs.getString(5)),
                        rs.getInt(6),
                        rs.getLong(7),
                        EndOfValue.strip(rs.getString(8)),
                        EndOfValue.strip(rs.getString(9)),
                        supersedes));
            }
        }
        return rows;
    }
}
