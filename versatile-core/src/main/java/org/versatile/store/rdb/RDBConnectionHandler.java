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

import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Utility functions for connection handling. Connections are handed out
 * with auto commit disabled, so every caller commits at its own
 * checkpoints.
 */
public class RDBConnectionHandler implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RDBConnectionHandler.class);

    private DataSource ds;

    public RDBConnectionHandler(@NotNull DataSource ds) {
        this.ds = checkNotNull(ds);
    }

    /**
     * Obtain a {@link Connection} with auto-commit disabled.
     */
    @NotNull
    public Connection getRWConnection() throws SQLException {
        Connection c = getDataSource().getConnection();
        c.setAutoCommit(false);
        return c;
    }

    /**
     * Aborts the open transaction of the given connection, if any. A failure
     * to roll back is logged, the caller is already handling the original
     * failure.
     */
    public void rollbackConnection(@Nullable Connection c) {
        if (c != null) {
            try {
                c.rollback();
            } catch (SQLException ex) {
                LOG.warn("Failed to roll back connection", ex);
            }
        }
    }

    /**
     * Closes a {@link Connection}, logging potential problems.
     */
    public void closeConnection(@Nullable Connection c) {
        if (c != null) {
            try {
                c.close();
            } catch (SQLException ex) {
                LOG.debug("Failed to close connection", ex);
            }
        }
    }

    @Override
    public void close() {
        this.ds = null;
    }

    @NotNull
    private DataSource getDataSource() {
        DataSource result = this.ds;
        if (result == null) {
            throw new IllegalStateException("Connection handler is already closed");
        }
        return result;
    }
}
