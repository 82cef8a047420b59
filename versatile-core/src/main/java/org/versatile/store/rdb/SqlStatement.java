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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds a SQL statement together with its parameters. Every fragment
 * declares the parameters for its own placeholders, so statements with a
 * variable number of placeholders never need manual position counting.
 *
 * <pre>
 * SqlStatement stmt = new SqlStatement("select NID, NAME from NAMES where NAME in ")
 *         .appendIn(names);
 * try (PreparedStatement ps = stmt.prepare(connection)) { ... }
 * </pre>
 */
public final class SqlStatement {

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> parameters = new ArrayList<Object>();

    public SqlStatement() {
    }

    public SqlStatement(@NotNull String fragment, Object... params) {
        append(fragment, params);
    }

    /**
     * Appends a fragment and the values for the placeholders it contains.
     *
     * @throws IllegalArgumentException if the number of placeholders does
     *          not match the number of parameters
     */
    @NotNull
    public SqlStatement append(@NotNull String fragment, Object... params) {
        int placeholders = 0;
        for (int i = 0; i < fragment.length(); i++) {
            if (fragment.charAt(i) == '?') {
                placeholders++;
            }
        }
        checkArgument(placeholders == params.length,
                "%s placeholders in '%s' but %s parameters", placeholders, fragment, params.length);
        sql.append(fragment);
        Collections.addAll(parameters, params);
        return this;
    }

    /**
     * Appends a parenthesized list of placeholders, one for each value.
     */
    @NotNull
    public SqlStatement appendIn(@NotNull Collection<?> values) {
        checkArgument(!values.isEmpty(), "in-list must not be empty");
        sql.append('(');
        boolean first = true;
        for (Object v : values) {
            sql.append(first ? "?" : ", ?");
            parameters.add(checkNotNull(v));
            first = false;
        }
        sql.append(')');
        return this;
    }

    @NotNull
    public PreparedStatement prepare(@NotNull Connection connection) throws SQLException {
        PreparedStatement stmt = connection.prepareStatement(sql.toString());
        try {
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            return stmt;
        } catch (SQLException ex) {
            stmt.close();
            throw ex;
        }
    }

    public int executeUpdate(@NotNull Connection connection) throws SQLException {
        try (PreparedStatement stmt = prepare(connection)) {
            return stmt.executeUpdate();
        }
    }

    @NotNull
    public String getSql() {
        return sql.toString();
    }

    @NotNull
    public List<Object> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
