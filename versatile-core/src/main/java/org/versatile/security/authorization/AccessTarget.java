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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.versatile.store.DocumentIdentity;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What an access check is about: the root, a container or a document. The
 * kind of target determines the {@link Scope} the check stops at.
 */
public final class AccessTarget {

    private static final AccessTarget ROOT = new AccessTarget(Scope.ROOT, null, null);

    private final Scope scope;
    private final String container;
    private final String document;

    private AccessTarget(Scope scope, String container, String document) {
        this.scope = scope;
        this.container = container;
        this.document = document;
    }

    public static AccessTarget root() {
        return ROOT;
    }

    public static AccessTarget container(@NotNull String container) {
        return new AccessTarget(Scope.CONTAINER, checkNotNull(container), null);
    }

    public static AccessTarget document(@NotNull DocumentIdentity identity) {
        return new AccessTarget(Scope.DOCUMENT, identity.getContainer(), identity.getDocument());
    }

    @NotNull
    public Scope getScope() {
        return scope;
    }

    @Nullable
    public String getContainer() {
        return container;
    }

    @Nullable
    public String getDocument() {
        return document;
    }

    @Override
    public String toString() {
        switch (scope) {
            case ROOT:
                return "root";
            case CONTAINER:
                return "container " + container;
            default:
                return "document " + container + "." + document;
        }
    }
}
