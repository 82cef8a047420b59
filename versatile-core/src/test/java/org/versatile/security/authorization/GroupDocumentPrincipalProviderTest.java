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
package org.versatile.security.authorization;

import java.util.Collections;

import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.SaveOptions;
import org.versatile.store.StructuredDocument;

import com.google.common.collect.ImmutableSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GroupDocumentPrincipalProviderTest extends AbstractVersatileStoreTest {

    private void saveGroup(String name, String members) {
        store.save(new DocumentIdentity("Main", name),
                new StructuredDocument().setPreference("GROUP", members), "U1", SaveOptions.defaults());
    }

    @Test
    public void membershipFromGroupDocuments() {
        saveGroup("TeamGroup", "Main.A, B");
        saveGroup("AdminGroup", "C, TeamGroup");
        saveGroup("NotAGroupPage", "D");

        GroupDocumentPrincipalProvider provider = new GroupDocumentPrincipalProvider(store);
        assertEquals(ImmutableSet.of("TeamGroup"), provider.getGroups("A"));
        assertEquals(ImmutableSet.of("AdminGroup"), provider.getGroups("TeamGroup"));
        assertEquals(Collections.emptySet(), provider.getGroups("D"));

        AccessResolver resolver = store.newAccessResolver(provider);
        assertTrue(resolver.isAdmin("A"));
        assertFalse(resolver.isAdmin("D"));
    }

    @Test
    public void refresh() {
        GroupDocumentPrincipalProvider provider = new GroupDocumentPrincipalProvider(store);
        assertTrue(provider.getGroups("A").isEmpty());

        saveGroup("TeamGroup", "A");
        assertTrue(provider.getGroups("A").isEmpty());
        provider.refresh();
        assertEquals(ImmutableSet.of("TeamGroup"), provider.getGroups("A"));
    }
}
