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
package org.versatile.commons.properties;

import java.util.Collections;
import java.util.Map;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SystemPropertySupplierTest {

    private static <T> SystemPropertySupplier<T> supplier(String name, T defaultValue, Map<String, String> props) {
        return SystemPropertySupplier.create(name, defaultValue).usingPropertyReader(props::get);
    }

    @Test
    public void defaultWhenUnset() {
        assertEquals("WebPreferences",
                supplier("versatile.x", "WebPreferences", Collections.<String, String>emptyMap()).get());
        assertEquals(Integer.valueOf(10000),
                supplier("versatile.x", 10000, Collections.<String, String>emptyMap()).get());
    }

    @Test
    public void parsesTypes() {
        Map<String, String> props = Map.of("s", "Other", "i", " 25 ", "l", "123456789012", "b", "true");
        assertEquals("Other", supplier("s", "x", props).get());
        assertEquals(Integer.valueOf(25), supplier("i", 1, props).get());
        assertEquals(Long.valueOf(123456789012L), supplier("l", 1L, props).get());
        assertTrue(supplier("b", false, props).get());
    }

    @Test
    public void malformedAndInvalidValuesAreIgnored() {
        Map<String, String> props = Map.of("i", "abc", "j", "-5", "b", "nope");
        assertEquals(Integer.valueOf(7), supplier("i", 7, props).get());
        assertEquals(Integer.valueOf(7), supplier("j", 7, props).validateWith(v -> v > 0).get());
        assertFalse(supplier("b", false, props).get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedType() {
        SystemPropertySupplier.create("d", 1.5d);
    }
}
