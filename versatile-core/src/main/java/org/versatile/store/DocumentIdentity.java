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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifies a document by the name of its container and its own name.
 * Containers are slash separated paths, e.g. {@code Sandbox/Sub}.
 * <p>
 * An identity with an empty container or document name can be constructed,
 * but it is not {@link #isValid() valid} and saving it is a no-op.
 */
public final class DocumentIdentity {

    private final String container;
    private final String document;

    public DocumentIdentity(@NotNull String container, @NotNull String document) {
        this.container = checkNotNull(container);
        this.document = checkNotNull(document);
    }

    /**
     * Parses an identity in the form {@code Container.Document}. The last dot
     * separates the document name.
     *
     * @param path the path to parse
     * @return the identity
     * @throws IllegalArgumentException if the path does not contain a dot
     */
    @NotNull
    public static DocumentIdentity fromPath(@NotNull String path) {
        int idx = path.lastIndexOf('.');
        if (idx < 0) {
            throw new IllegalArgumentException("Not a document path: " + path);
        }
        return new DocumentIdentity(path.substring(0, idx), path.substring(idx + 1));
    }

    @NotNull
    public String getContainer() {
        return container;
    }

    @NotNull
    public String getDocument() {
        return document;
    }

    public boolean isValid() {
        return !container.isEmpty() && !document.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentIdentity)) {
            return false;
        }
        DocumentIdentity other = (DocumentIdentity) o;
        return container.equals(other.container) && document.equals(other.document);
    }

    @Override
    public int hashCode() {
        return Objects.hash(container, document);
    }

    @Override
    public String toString() {
        return container + "." + document;
    }
}
