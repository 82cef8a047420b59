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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Options of a text search.
 */
public final class SearchOptions {

    private boolean regex;
    private boolean caseSensitive;
    private boolean wordBoundaries;
    private boolean filesWithoutMatch;
    private Set<String> documents;

    public static SearchOptions defaults() {
        return new SearchOptions();
    }

    /**
     * @return {@code true} if the pattern is a regular expression,
     *          {@code false} if it is literal text
     */
    public boolean isRegex() {
        return regex;
    }

    public SearchOptions setRegex(boolean regex) {
        this.regex = regex;
        return this;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public SearchOptions setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        return this;
    }

    /**
     * @return {@code true} if the pattern must match whole words only
     */
    public boolean isWordBoundaries() {
        return wordBoundaries;
    }

    public SearchOptions setWordBoundaries(boolean wordBoundaries) {
        this.wordBoundaries = wordBoundaries;
        return this;
    }

    /**
     * @return {@code true} if only the first matching line of each document
     *          is of interest
     */
    public boolean isFilesWithoutMatch() {
        return filesWithoutMatch;
    }

    public SearchOptions setFilesWithoutMatch(boolean filesWithoutMatch) {
        this.filesWithoutMatch = filesWithoutMatch;
        return this;
    }

    /**
     * @return the documents to restrict the search to, or {@code null} for
     *          all documents of the container
     */
    @Nullable
    public Set<String> getDocuments() {
        return documents == null ? null : Collections.unmodifiableSet(documents);
    }

    public SearchOptions setDocuments(@Nullable Collection<String> documents) {
        this.documents = documents == null ? null : new LinkedHashSet<String>(documents);
        return this;
    }

    @NotNull
    @Override
    public String toString() {
        return "SearchOptions{regex=" + regex + ", caseSensitive=" + caseSensitive
                + ", wordBoundaries=" + wordBoundaries + ", filesWithoutMatch=" + filesWithoutMatch + "}";
    }
}
