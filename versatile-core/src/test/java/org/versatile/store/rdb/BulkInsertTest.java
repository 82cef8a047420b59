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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.h2.jdbcx.JdbcConnectionPool;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BulkInsertTest {

    private JdbcConnectionPool dataSource;
    private Connection connection;
    private BulkInsert<String> insert;

    @Before
    public void before() throws Exception {
        dataSource = AbstractVersatileStoreTest.createDataSource();
        connection = dataSource.getConnection();
        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("create table WORDS (WORD varchar(100) primary key)");
        }
        connection.commit();
        insert = new BulkInsert<String>("insert into WORDS (WORD) values (?)", (stmt, w) -> stmt.setString(1, w));
    }

    @After
    public void after() throws Exception {
        connection.close();
        dataSource.dispose();
    }

    @Test
    public void spansBatches() throws Exception {
        List<String> words = new ArrayList<String>();
        for (int i = 0; i < BulkInsert.BATCH_SIZE * 2 + 7; i++) {
            words.add("w" + i);
        }
        assertEquals(words.size(), insert.execute(connection, words));
        connection.commit();
        assertEquals(words.size(), count());
    }

    @Test
    public void duplicatesFail() throws Exception {
        insert.execute(connection, Arrays.asList("a"));
        connection.commit();
        try {
            insert.execute(connection, Arrays.asList("b", "a"));
            fail("duplicate must fail");
        } catch (SQLException e) {
            assertTrue(BulkInsert.isDuplicateKey(e));
        }
    }

    @Test
    public void duplicatesIgnored() throws Exception {
        insert.execute(connection, Arrays.asList("a", "c"));
        connection.commit();
        insert.executeIgnoringDuplicates(connection, Arrays.asList("a", "b", "c", "d"));
        connection.commit();
        assertEquals(4, count());
    }

    private int count() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("select count(*) from WORDS")) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
