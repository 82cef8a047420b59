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
package org.versatile.store.search;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.versatile.store.StructuredDocument;
import org.versatile.store.rdb.BulkInsert;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.rdb.SqlStatement;
import org.versatile.store.value.DuckType;

/**
 * Maintains the numbered text lines of each revision. Lines of superseded
 * revisions carry the other version bit like attribute values do.
 */
public class TextLineIndex {

    private final String table;

    private final BulkInsert<Line> insert;

    public TextLineIndex(@NotNull RDBSchema schema) {
        this.table = schema.getTextLines();
        this.insert = new BulkInsert<Line>("insert into " + table + " (REV_ID, DUCKTYPE, LNUM, VAL) values (?, ?, ?, ?)",
                (stmt, line) -> {
                    stmt.setLong(1, line.revId);
                    stmt.setInt(2, line.other ? DuckType.OTHER_VERSION_BIT : 0);
                    stmt.setInt(3, line.number);
                    stmt.setString(4, line.text);
                });
    }

    /**
     * Writes the lines of a revision.
     *
     * @return the number of lines written
     */
    public int insert(@NotNull Connection connection, long revId, boolean other,
                      @NotNull StructuredDocument document) throws SQLException {
        List<String> lines = EmbeddedStoreForm.toLines(document);
        List<Line> rows = new ArrayList<Line>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            rows.add(new Line(revId, other, i, lines.get(i)));
        }
        return insert.execute(connection, rows);
    }

    public void delete(@NotNull Connection connection, long revId) throws SQLException {
        new SqlStatement("delete from " + table + " where REV_ID = ?", revId).executeUpdate(connection);
    }

    public void retag(@NotNull Connection connection, long revId, boolean other) throws SQLException {
        new SqlStatement("update " + table + " set DUCKTYPE = ? where REV_ID = ?",
                other ? DuckType.OTHER_VERSION_BIT : 0, revId).executeUpdate(connection);
    }

    private static final class Line {

        final long revId;
        final boolean other;
        final int number;
        final String text;

        Line(long revId, boolean other, int number, String text) {
            this.revId = revId;
            this.other = other;
            this.number = number;
            this.text = text;
        }
    }
}
