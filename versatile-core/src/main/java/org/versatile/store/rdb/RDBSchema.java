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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.store.Namespace;
import org.versatile.store.dictionary.FieldEntry;
import org.versatile.store.dictionary.WellKnownFields;
import org.versatile.store.dictionary.WellKnownNames;

import com.google.common.collect.ImmutableList;

/**
 * Table names and table creation of the store.
 * <p>
 * All tables are created if they do not exist yet. The name and field
 * catalogs are seeded once, together with the root row of the revision
 * table.
 */
public class RDBSchema {

    private static final Logger LOG = LoggerFactory.getLogger(RDBSchema.class);

    /**
     * Id of the root row of the revision table, the parent of all containers.
     */
    public static final long ROOT_ID = 1;

    private final String names;
    private final String fields;
    private final String revisions;
    private final String valuesString;
    private final String valuesNumber;
    private final String valuesDate;
    private final String textLines;
    private final String accessRules;
    private final String locks;
    private final String leases;
    private final String identities;

    public RDBSchema(@NotNull RDBOptions options) {
        String prefix = options.getTablePrefix();
        this.names = prefix + "NAMES";
        this.fields = prefix + "FIELDS";
        this.revisions = prefix + "REVISIONS";
        this.valuesString = prefix + "VALUES_STRING";
        this.valuesNumber = prefix + "VALUES_NUMBER";
        this.valuesDate = prefix + "VALUES_DATE";
        this.textLines = prefix + "TEXT_LINES";
        this.accessRules = prefix + "ACCESS_RULES";
        this.locks = prefix + "LOCKS";
        this.leases = prefix + "LEASES";
        this.identities = prefix + "IDENTITIES";
    }

    public String getNames() {
        return names;
    }

    public String getFields() {
        return fields;
    }

    public String getRevisions() {
        return revisions;
    }

    public String getValuesString() {
        return valuesString;
    }

    public String getValuesNumber() {
        return valuesNumber;
    }

    public String getValuesDate() {
        return valuesDate;
    }

    public String getTextLines() {
        return textLines;
    }

    public String getAccessRules() {
        return accessRules;
    }

    public String getLocks() {
        return locks;
    }

    public String getLeases() {
        return leases;
    }

    public String getIdentities() {
        return identities;
    }

    public List<String> getTables() {
        return ImmutableList.of(names, fields, revisions, valuesString, valuesNumber, valuesDate,
                textLines, accessRules, locks, leases, identities);
    }

    //-----------------------------------------------------------< creation >

    /**
     * Creates missing tables and seeds the catalogs. Commits.
     */
    public void initialize(@NotNull Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String ddl : getDDL()) {
                stmt.execute(ddl);
            }
        }
        connection.commit();
        if (!isSeeded(connection)) {
            try {
                seed(connection);
                connection.commit();
                LOG.info("Created tables with prefix '{}' and seeded catalogs", names.substring(0, names.length() - 5));
            } catch (SQLException ex) {
                connection.rollback();
                if (!BulkInsert.isDuplicateKey(ex)) {
                    throw ex;
                }
                LOG.debug("Catalogs concurrently seeded by another process");
            }
        }
    }

    public void dropTables(@NotNull Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String table : getTables()) {
                stmt.execute("drop table if exists " + table);
            }
        }
        connection.commit();
        LOG.debug("Dropped tables {}", getTables());
    }

    List<String> getDDL() {
        return ImmutableList.of(
                "create table if not exists " + names + " ("
                        + "NID bigint generated by default as identity (start with " + WellKnownNames.FIRST_DYNAMIC_ID + ") primary key, "
                        + "NAME varchar(4000) not null unique)",
                "create table if not exists " + fields + " ("
                        + "FID bigint generated by default as identity (start with " + WellKnownFields.FIRST_DYNAMIC_ID + ") primary key, "
                        + "NAMING smallint not null, TYPE_NID bigint not null, INSTANCE_NID bigint not null, "
                        + "KEY_NID bigint not null, FIELD_KIND smallint not null, "
                        + "unique (NAMING, TYPE_NID, INSTANCE_NID, KEY_NID))",
                // not unique: revisions keep their identity across a rename of the latest one
                "create table if not exists " + revisions + " ("
                        + "REV_ID bigint generated by default as identity (start with 100) primary key, "
                        + "NAMESPACE smallint not null, CONTAINER_ID bigint not null, NID bigint not null, "
                        + "VERSION int not null, REV_TIME bigint not null, AUTHOR_NID bigint not null, "
                        + "COMMENT_NID bigint not null, REPREV int)",
                "create index if not exists " + revisions + "_IDENTITY on " + revisions
                        + " (CONTAINER_ID, NID, NAMESPACE, VERSION)",
                "create table if not exists " + valuesString + " ("
                        + "REV_ID bigint not null, FID bigint not null, DUCKTYPE smallint not null, "
                        + "VAL clob not null, primary key (REV_ID, FID))",
                "create table if not exists " + valuesNumber + " ("
                        + "REV_ID bigint not null, FID bigint not null, DUCKTYPE smallint not null, "
                        + "VAL double precision not null, primary key (REV_ID, FID))",
                "create table if not exists " + valuesDate + " ("
                        + "REV_ID bigint not null, FID bigint not null, DUCKTYPE smallint not null, "
                        + "VAL timestamp not null, primary key (REV_ID, FID))",
                "create table if not exists " + textLines + " ("
                        + "REV_ID bigint not null, DUCKTYPE smallint not null, LNUM int not null, "
                        + "VAL varchar(1000000) not null, primary key (REV_ID, LNUM))",
                "create table if not exists " + accessRules + " ("
                        + "REV_ID bigint not null, SCOPE char(1) not null, PERMISSION smallint not null, "
                        + "ACCESS_MODE varchar(64) not null, PRINCIPAL_NID bigint not null)",
                "create index if not exists " + accessRules + "_REV on " + accessRules + " (REV_ID)",
                "create table if not exists " + locks + " ("
                        + "CONTAINER_NID bigint not null, DOC_NID bigint not null, HOLDER_NID bigint not null, "
                        + "LOCK_TIME bigint not null, primary key (CONTAINER_NID, DOC_NID))",
                "create table if not exists " + leases + " ("
                        + "CONTAINER_NID bigint not null, DOC_NID bigint not null, HOLDER_NID bigint not null, "
                        + "TAKEN bigint not null, EXPIRES bigint not null, primary key (CONTAINER_NID, DOC_NID))",
                "create table if not exists " + identities + " ("
                        + "CONTAINER_NID bigint not null, DOC_NID bigint not null, "
                        + "primary key (CONTAINER_NID, DOC_NID))");
    }

    private boolean isSeeded(Connection connection) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "select count(*) from " + revisions + " where REV_ID = ?")) {
            stmt.setLong(1, ROOT_ID);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    private void seed(Connection connection) throws SQLException {
        new BulkInsert<Map.Entry<String, Long>>(
                "insert into " + names + " (NID, NAME) values (?, ?)",
                (stmt, e) -> {
                    stmt.setLong(1, e.getValue());
                    stmt.setString(2, EndOfValue.terminate(e.getKey()));
                }).execute(connection, WellKnownNames.getCatalog().entrySet());

        final Map<String, Long> nids = WellKnownNames.getCatalog();
        new BulkInsert<FieldEntry>(
                "insert into " + fields + " (FID, NAMING, TYPE_NID, INSTANCE_NID, KEY_NID, FIELD_KIND) "
                        + "values (?, ?, ?, ?, ?, ?)",
                (stmt, f) -> {
                    stmt.setLong(1, f.getId());
                    stmt.setInt(2, f.getCoordinate().getNaming().getId());
                    stmt.setLong(3, nids.get(f.getCoordinate().getType()));
                    stmt.setLong(4, nids.get(f.getCoordinate().getInstance()));
                    stmt.setLong(5, nids.get(f.getCoordinate().getKey()));
                    stmt.setInt(6, f.getKind().getId());
                }).execute(connection, WellKnownFields.getCatalog());

        try (PreparedStatement stmt = connection.prepareStatement("insert into " + revisions
                + " (REV_ID, NAMESPACE, CONTAINER_ID, NID, VERSION, REV_TIME, AUTHOR_NID, COMMENT_NID) "
                + "values (?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setLong(1, ROOT_ID);
            stmt.setInt(2, Namespace.ROOT.getId());
            stmt.setLong(3, 0);
            stmt.setLong(4, WellKnownNames.EMPTY_ID);
            stmt.setInt(5, 1);
            stmt.setLong(6, 0);
            stmt.setLong(7, WellKnownNames.EMPTY_ID);
            stmt.setLong(8, WellKnownNames.EMPTY_ID);
            stmt.executeUpdate();
        }
    }
}
