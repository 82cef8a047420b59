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

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class VersatileConfigurationTest {

    @After
    public void clearProperties() {
        System.clearProperty("versatile.usersContainer");
        System.clearProperty("versatile.searchBatchSize");
        System.clearProperty("versatile.rootPreferences");
    }

    @Test
    public void defaults() {
        VersatileConfiguration config = VersatileConfiguration.builder().build();
        assertEquals("WebPreferences", config.getContainerPreferences());
        assertEquals(new DocumentIdentity("System", "SitePreferences"), config.getRootPreferences());
        assertEquals("Main", config.getUsersContainer());
        assertEquals("AdminGroup", config.getAdminGroup());
        assertEquals("AdminUser", config.getAdminUser());
        assertEquals("UnknownUser", config.getUnknownAuthor());
        assertEquals(10000, config.getSearchBatchSize());
        assertEquals(100L, config.getPerfLogThreshold());
    }

    @Test
    public void systemProperties() {
        System.setProperty("versatile.usersContainer", "People");
        System.setProperty("versatile.searchBatchSize", " 50 ");
        VersatileConfiguration config = VersatileConfiguration.fromSystemProperties();
        assertEquals("People", config.getUsersContainer());
        assertEquals(50, config.getSearchBatchSize());
    }

    @Test
    public void invalidPropertiesFallBack() {
        System.setProperty("versatile.searchBatchSize", "-1");
        System.setProperty("versatile.rootPreferences", "NoDot");
        VersatileConfiguration config = VersatileConfiguration.builder().build();
        assertEquals(10000, config.getSearchBatchSize());
        assertEquals(new DocumentIdentity("System", "SitePreferences"), config.getRootPreferences());
    }

    @Test
    public void explicitValues() {
        VersatileConfiguration config = VersatileConfiguration.builder()
                .setUsersContainer("People")
                .setRootPreferences("Site.Prefs")
                .build();
        assertEquals("People", config.getUsersContainer());
        assertEquals(new DocumentIdentity("Site", "Prefs"), config.getRootPreferences());
    }
}
