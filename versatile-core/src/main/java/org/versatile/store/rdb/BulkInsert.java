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
package org.versatile.store.rdb;

import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import org.jetbrains.annotations.NotNull;

/**
 * A precompiled insert statement that writes many rows as JDBC batches.
 * A {@link Binder} sets the parameters of one row.
 *
 * @param <T> the row type
 */
public final class BulkInsert<T> {

    /**
     * SQLState reported for a unique constraint violation.
     */
    public static final String DUPLICATE_KEY = "23505";

    static final int BATCH_SIZE = 500;

    public interface Binder<T> {
        void bind(PreparedStatement stmt, T row) throws SQLException;
    }

    private final String sql;
    private final Binder<T> binder;

    public BulkInsert(@NotNull String sql, @NotNull Binder<T> binder) {
        this.sql = sql;
        this.binder = binder;
    }

    /**
     * Inserts all rows.
     *
     * @return the number of rows written
     */
    public int execute(@NotNull Connection connection, @NotNull Iterable<T> rows) throws SQLException {
        int count = 0;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            for (T row : rows) {
                binder.bind(stmt, row);
                stmt.addBatch();
                if (++count % BATCH_SIZE == 0) {
                    stmt.executeBatch();
                }
            }
            if (count % BATCH_SIZE != 0) {
                stmt.executeBatch();
            }
        }
        return count;
    }

    /**
     * Inserts all rows, ignoring rows that already exist. A batch failing
     * on a duplicate key is replayed row by row, so rows inserted
     * concurrently by another process do not fail the operation.
     *
     * @return the number of rows written by this call
     */
    public int executeIgnoringDuplicates(@NotNull Connection connection, @NotNull Iterable<T> rows)
            throws SQLException {
        try {
            return execute(connection, rows);
        } catch (BatchUpdateException ex) {
            int count = 0;
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                for (T row : rows) {
                    binder.bind(stmt, row);
                    try {
                        count += stmt.executeUpdate();
                    } catch (SQLException e) {
                        if (!isDuplicateKey(e)) {
                            throw e;
                        }
                        // already exists - ok
                    }
                }
            }
            return count;
        }
    }

    public static boolean isDuplicateKey(SQLException ex) {
        for (SQLException e = ex; e != null; e = e.getNextException()) {
            if (DUPLICATE_KEY.equals(e.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
