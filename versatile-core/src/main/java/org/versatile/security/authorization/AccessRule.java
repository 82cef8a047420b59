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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A single access rule: a permission of a principal for a mode at a scope.
 * The empty principal stands for everyone.
 */
public final class AccessRule {

    private final Scope scope;
    private final Permission permission;
    private final String mode;
    private final String principal;

    public AccessRule(@NotNull Scope scope, @NotNull Permission permission,
                      @NotNull String mode, @NotNull String principal) {
        this.scope = scope;
        this.permission = permission;
        this.mode = mode;
        this.principal = principal;
    }

    @NotNull
    public Scope getScope() {
        return scope;
    }

    @NotNull
    public Permission getPermission() {
        return permission;
    }

    @NotNull
    public String getMode() {
        return mode;
    }

    @NotNull
    public String getPrincipal() {
        return principal;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AccessRule)) {
            return false;
        }
        AccessRule other = (AccessRule) o;
        return scope == other.scope && permission == other.permission
                && mode.equals(other.mode) && principal.equals(other.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, permission, mode, principal);
    }

    @Override
    public String toString() {
        return permission + " " + scope + " " + mode + " '" + principal + "'";
    }
}
