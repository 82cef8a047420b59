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

import org.junit.Before;
import org.junit.Test;
import org.versatile.store.AbstractVersatileStoreTest;
import org.versatile.store.DocumentIdentity;
import org.versatile.store.SaveOptions;
import org.versatile.store.StructuredDocument;

import com.google.common.collect.ImmutableSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AccessResolverTest extends AbstractVersatileStoreTest {

    private final DocumentIdentity doc = new DocumentIdentity("C", "D");

    private PrincipalProvider principals;

    @Before
    public void before() {
        principals = mock(PrincipalProvider.class);
        when(principals.getGroups(anyString())).thenReturn(Collections.<String>emptySet());
    }

    private void savePreferences(DocumentIdentity identity, String... preferences) {
        StructuredDocument content = new StructuredDocument().setText("preferences");
        for (int i = 0; i < preferences.length; i += 2) {
            content.setPreference(preferences[i], preferences[i + 1]);
        }
        store.save(identity, content, "U1", SaveOptions.defaults());
    }

    private AccessResolver resolver() {
        return store.newAccessResolver(principals);
    }

    @Test
    public void permittedWithoutRules() {
        AccessResolver resolver = resolver();
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.root()));
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.container("C")));
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.document(doc)));
        assertNull(resolver.getFailure());
    }

    @Test
    public void emptyDocumentDenyPermits() {
        savePreferences(new DocumentIdentity("C", "WebPreferences"), "DENYWEBVIEW", "B");
        savePreferences(doc, "DENYTOPICVIEW", "");
        AccessResolver resolver = resolver();
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.document(doc)));
        assertFalse(resolver.checkAccess("B", "VIEW", AccessTarget.document(doc)));
        assertEquals("access denied on container C", resolver.getFailure());
    }

    @Test
    public void containerAllowListDeniesOthers() {
        savePreferences(new DocumentIdentity("C", "WebPreferences"), "ALLOWWEBVIEW", "Main.A");
        AccessResolver resolver = resolver();
        assertTrue(resolver.checkAccess("A", "view", AccessTarget.container("C")));
        assertNull(resolver.getFailure());
        assertFalse(resolver.checkAccess("B", "view", AccessTarget.container("C")));
        assertEquals("access not allowed on container C", resolver.getFailure());
        assertFalse(resolver.checkAccess("B", "VIEW", AccessTarget.document(doc)));
        assertTrue(resolver.checkAccess("B", "CHANGE", AccessTarget.container("C")));
        assertTrue(resolver.checkAccess("B", "VIEW", AccessTarget.container("Other")));
    }

    @Test
    public void administratorsBypass() {
        savePreferences(new DocumentIdentity("C", "WebPreferences"), "DENYWEBVIEW", "AdminUser, X");
        when(principals.getGroups("X")).thenReturn(ImmutableSet.of("AdminGroup"));
        AccessResolver resolver = resolver();
        assertTrue(resolver.checkAccess("AdminUser", "VIEW", AccessTarget.container("C")));
        assertTrue(resolver.checkAccess("X", "VIEW", AccessTarget.container("C")));
        assertTrue(resolver.isAdmin("X"));
        assertFalse(resolver.isAdmin("B"));
    }

    @Test
    public void documentDeny() {
        savePreferences(doc, "DENYTOPICCHANGE", "Main.B");
        AccessResolver resolver = resolver();
        assertFalse(resolver.checkAccess("B", "CHANGE", AccessTarget.document(doc)));
        assertEquals("access denied on document C.D", resolver.getFailure());
        assertTrue(resolver.checkAccess("B", "VIEW", AccessTarget.document(doc)));
        assertTrue(resolver.checkAccess("A", "CHANGE", AccessTarget.document(doc)));
        assertTrue(resolver.checkAccess("B", "CHANGE", AccessTarget.document(new DocumentIdentity("C", "E"))));
    }

    @Test
    public void documentAllowList() {
        savePreferences(doc, "ALLOWTOPICCHANGE", "A");
        AccessResolver resolver = resolver();
        assertTrue(resolver.checkAccess("A", "CHANGE", AccessTarget.document(doc)));
        assertFalse(resolver.checkAccess("B", "CHANGE", AccessTarget.document(doc)));
        assertEquals("access not allowed on document C.D", resolver.getFailure());
    }

    @Test
    public void rootRules() {
        savePreferences(new DocumentIdentity("System", "SitePreferences"), "DENYROOTVIEW", "B");
        AccessResolver resolver = resolver();
        assertFalse(resolver.checkAccess("B", "VIEW", AccessTarget.root()));
        assertEquals("access denied on root", resolver.getFailure());
        assertFalse(resolver.checkAccess("B", "VIEW", AccessTarget.document(doc)));
        assertEquals("access denied on root", resolver.getFailure());
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.document(doc)));
    }

    @Test
    public void nestedGroups() {
        savePreferences(new DocumentIdentity("C", "WebPreferences"), "ALLOWWEBVIEW", "TeamGroup");
        when(principals.getGroups("A")).thenReturn(ImmutableSet.of("SubGroup"));
        when(principals.getGroups("SubGroup")).thenReturn(ImmutableSet.of("TeamGroup"));
        AccessResolver resolver = resolver();
        assertEquals(ImmutableSet.of("A", "SubGroup", "TeamGroup", ""), resolver.getIdentities("A"));
        assertTrue(resolver.checkAccess("A", "VIEW", AccessTarget.container("C")));
        assertFalse(resolver.checkAccess("B", "VIEW", AccessTarget.container("C")));
        resolver.getIdentities("A");
        verify(principals, times(1)).getGroups("A");
    }

    @Test
    public void onlyLatestRevisionCounts() {
        savePreferences(doc, "DENYTOPICVIEW", "B");
        assertFalse(resolver().checkAccess("B", "VIEW", AccessTarget.document(doc)));

        savePreferences(doc, "SKIN", "plain");
        assertTrue(resolver().checkAccess("B", "VIEW", AccessTarget.document(doc)));

        store.rollback(doc, "U1");
        assertFalse(resolver().checkAccess("B", "VIEW", AccessTarget.document(doc)));
    }
}
