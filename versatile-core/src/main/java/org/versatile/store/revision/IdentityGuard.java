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
import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;
import org.versatile.store.VersatileException;
import org.versatile.store.dictionary.WellKnownNames;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;

/**
 * Serializes writers of the same document identity.
 * <p>
 * The identity table holds one row per (container name, document name)
 * ever written, and one row per container name with the empty name as
 * document. A writer locks the rows of its identities with
 * {@code select ... for update} before it reads the latest revision, so a
 * concurrent writer of the same identity waits until the first one commits
 * and then sees its revision.
 * <p>
 * Document rows are always locked before container rows, and rows of the
 * same kind in key order.
 */
public class IdentityGuard {

    private final String table;
    private final BulkInsert<Key> insert;

    public IdentityGuard(@NotNull RDBSchema schema) {
        this.table = schema.getIdentities();
        this.insert = new BulkInsert<Key>("insert into " + table + " (CONTAINER_NID, DOC_NID) values (?, ?)",
                (stmt, key) -> {
                    stmt.setLong(1, key.containerNid);
                    stmt.setLong(2, key.docNid);
                });
    }

    /**
     * Locks the given identities. Missing rows are created first, together
     * with the rows of their containers, and committed. The connection
     * therefore must not hold work that must not be committed yet.
     */
    public void lock(@NotNull Connection connection, @NotNull Key... keys) throws SQLException {
        SortedSet<Key> rows = new TreeSet<Key>(Arrays.asList(keys));
        for (Key key : keys) {
            rows.add(Key.container(key.containerNid));
        }
        insert.executeIgnoringDuplicates(connection, rows);
        connection.commit();
        for (Key key : new TreeSet<Key>(Arrays.asList(keys))) {
            lockRow(connection, key);
        }
    }

    /**
     * Locks the row of a container. The row must have been created by
     * {@link #lock(Connection, Key...)} before.
     */
    public void lockContainer(@NotNull Connection connection, long containerNid) throws SQLException {
        lockRow(connection, Key.container(containerNid));
    }

    private void lockRow(Connection connection, Key key) throws SQLException {
        SqlStatement select = new SqlStatement("select CONTAINER_NID from " + table
                + " where CONTAINER_NID = ? and DOC_NID = ? for update", key.containerNid, key.docNid);
        try (PreparedStatement stmt = select.prepare(connection); ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new VersatileException("No identity row to lock for " + key);
            }
        }
    }

    /**
     * The name ids of a document identity, or of a container.
     */
    public static final class Key implements Comparable<Key> {

        private final long containerNid;
        private final long docNid;

        private Key(long containerNid, long docNid) {
            this.containerNid = containerNid;
            this.docNid = docNid;
        }

        public static Key document(long containerNid, long docNid) {
            return new Key(containerNid, docNid);
        }

        public static Key container(long containerNid) {
            return new Key(containerNid, WellKnownNames.EMPTY_ID);
        }

        @Override
        public int compareTo(@NotNull Key o) {
            boolean container = docNid == WellKnownNames.EMPTY_ID;
            boolean otherContainer = o.docNid == WellKnownNames.EMPTY_ID;
            if (container != otherContainer) {
                return container ? 1 : -1;
            }
            int c = Long.compare(containerNid, o.containerNid);
            return c != 0 ? c : Long.compare(docNid, o.docNid);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return containerNid == other.containerNid && docNid == other.docNid;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(containerNid) * 31 + Long.hashCode(docNid);
        }

        @Override
        public String toString() {
            return containerNid + "/" + docNid;
        }
    }
}
