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
package org.versatile.store;

import java.util.concurrent.atomic.AtomicInteger;

import org.h2.jdbcx.JdbcConnectionPool;
import org.junit.After;
import org.junit.Before;
import org.versatile.commons.Clock;
import org.versatile.store.rdb.RDBOptions;

/**
 * Base class for tests running against a store on a private in-memory H2
 * database.
 */
public abstract class AbstractVersatileStoreTest {

    private static final AtomicInteger DB_COUNTER = new AtomicInteger();

    protected JdbcConnectionPool dataSource;

    protected Clock.Virtual clock;

    protected VersatileStore store;

    @Before
    public void setUpStore() throws Exception {
        dataSource = createDataSource();
        clock = new Clock.Virtual(1000000000L);
        store = VersatileStore.builder()
                .setDataSource(dataSource)
                .setClock(clock)
                .setRDBOptions(new RDBOptions().dropTablesOnClose(true))
                .setConfiguration(configure(VersatileConfiguration.builder()).build())
                .build();
    }

    @After
    public void tearDownStore() {
        if (store != null) {
            store.dispose();
        }
        if (dataSource != null) {
            dataSource.dispose();
        }
    }

    protected VersatileConfiguration.Builder configure(VersatileConfiguration.Builder builder) {
        return builder;
    }

    public static JdbcConnectionPool createDataSource() {
        return JdbcConnectionPool.create("jdbc:h2:mem:versatile" + DB_COUNTER.incrementAndGet()
                + ";LOCK_TIMEOUT=10000", "sa", "");
    }

    static StructuredDocument text(String text) {
        return new StructuredDocument().setText(text);
    }
}
