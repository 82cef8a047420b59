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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.versatile.store.Record;
import org.versatile.store.StructuredDocument;

/**
 * Renders a document as the lines that text search runs against: the lines
 * of the body followed by one {@code %META:TYPE{key="value" ...}%} line per
 * record.
 */
public final class EmbeddedStoreForm {

    private EmbeddedStoreForm() {
    }

    @NotNull
    public static List<String> toLines(@NotNull StructuredDocument document) {
        List<String> lines = new ArrayList<String>();
        String text = document.getText();
        if (!text.isEmpty()) {
            String[] split = text.split("\r?\n", -1);
            int count = split.length;
            if (text.endsWith("\n")) {
                count--;
            }
            for (int i = 0; i < count; i++) {
                lines.add(split[i]);
            }
        }
        for (String type : document.getTypes()) {
            for (Record r : document.getRecords(type)) {
                lines.add(toMetaLine(type, r));
            }
        }
        return lines;
    }

    static String toMetaLine(String type, Record record) {
        StringBuilder sb = new StringBuilder("%META:").append(type).append('{');
        boolean first = true;
        String name = record.getName();
        if (name != null) {
            sb.append(Record.NAME).append("=\"").append(encode(name)).append('"');
            first = false;
        }
        for (Map.Entry<String, String> e : record.getAttributes().entrySet()) {
            if (Record.NAME.equals(e.getKey())) {
                continue;
            }
            if (!first) {
                sb.append(' ');
            }
            sb.append(e.getKey()).append("=\"").append(encode(e.getValue())).append('"');
            first = false;
        }
        return sb.append("}%").toString();
    }

    static String encode(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '%':
                    sb.append("%25");
                    break;
                case '"':
                    sb.append("%_Q_%");
                    break;
                case '\n':
                    sb.append("%_N_%");
                    break;
                case '\r':
                    sb.append("%_R_%");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
