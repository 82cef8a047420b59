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

/**
 * The scopes access rules apply to, from broadest to narrowest.
 */
public enum Scope {

    ROOT('R', "ROOT"),

    CONTAINER('W', "WEB"),

    DOCUMENT('T', "TOPIC");

    private final char code;
    private final String token;

    Scope(char code, String token) {
        this.code = code;
        this.token = token;
    }

    /**
     * @return the code stored in the access rule table
     */
    public char getCode() {
        return code;
    }

    /**
     * @return the token naming this scope in preference names, e.g. the
     *          {@code WEB} of {@code ALLOWWEBVIEW}
     */
    public String getToken() {
        return token;
    }

    public static Scope fromCode(char code) {
        for (Scope s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown scope code: " + code);
    }

    public static Scope fromToken(String token) {
        for (Scope s : values()) {
            if (s.token.equals(token)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown scope token: " + token);
    }
}
