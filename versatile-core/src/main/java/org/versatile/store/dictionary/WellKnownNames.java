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
package org.versatile.store.dictionary;

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The catalog of names registered at schema creation. Ids of this catalog
 * are part of the persisted format: entries may be appended, never
 * reordered or removed.
 */
public final class WellKnownNames {

    /**
     * Id of the empty name, which stands for "no value" and for the
     * implicit everyone group in access rules.
     */
    public static final long EMPTY_ID = 100000000L;

    /**
     * First id handed out for names created at runtime.
     */
    public static final long FIRST_DYNAMIC_ID = 100010000L;

    /**
     * Number of sequence names registered up front.
     */
    public static final int SEQUENCE_NAMES = 300;

    static final ImmutableList<String> CATALOG = ImmutableList.of(
            "", "_acl", "_local", "_PREF_SET", "_PREF_LOCAL", "_set", "_text", "_web",
            "attachment", "attr", "attributes", "author", "autoattached", "by", "comment",
            "CREATEINFO", "date", "definingTopic", "encoding", "FIELD", "FILEATTACHMENT", "FORM",
            "format", "from", "mandatory", "moveby", "movedto", "movedwhen", "movefrom", "name",
            "path", "PREFERENCE", "reprev", "rev", "size", "stream", "title", "tmpFilename", "to",
            "tooltip", "TOPICINFO", "TOPICMOVED", "TOPICPARENT", "type", "user", "value", "version",
            "WORKFLOW", "WORKFLOWHISTORY", "DENYWEBVIEW", "ALLOWWEBVIEW", "DENYTOPICVIEW",
            "ALLOWTOPICVIEW", "DENYWEBCHANGE", "ALLOWWEBCHANGE", "DENYTOPICCHANGE", "ALLOWTOPICCHANGE");

    private WellKnownNames() {
    }

    /**
     * @param index the sequence number of a record in its collection
     * @return the fixed width name of that sequence number
     */
    public static String sequenceName(int index) {
        return String.format("%08d", index);
    }

    /**
     * @param name a sequence name
     * @return its sequence number
     */
    public static int sequenceIndex(String name) {
        return Integer.parseInt(name);
    }

    /**
     * @return all pre-registered names with their fixed ids
     */
    public static Map<String, Long> getCatalog() {
        ImmutableMap.Builder<String, Long> builder = ImmutableMap.builder();
        for (int i = 0; i < SEQUENCE_NAMES; i++) {
            builder.put(sequenceName(i), (long) i + 1);
        }
        for (int i = 0; i < CATALOG.size(); i++) {
            builder.put(CATALOG.get(i), EMPTY_ID + i);
        }
        return builder.build();
    }
}
