/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.generictrie.tries;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class BooleanKeyMapTest
{
    private static List<String> values(KeyMap<Boolean, String> map)
    {
        List<String> values = new ArrayList<>();
        map.forEachValue(values::add);
        return values;
    }

    @Test
    public void testTwoSlotsRegardlessOfInsertOrder()
    {
        KeyMap<Boolean, String> a = BooleanKeyMap.KEY.newMap();
        a.put(true, "t");
        a.put(false, "f");
        KeyMap<Boolean, String> b = BooleanKeyMap.KEY.newMap();
        b.put(false, "f");
        b.put(true, "t");

        assertEquals(asList("f", "t"), values(a));
        assertEquals(asList("f", "t"), values(b));
        assertEquals(2, a.size());
        assertEquals(a, b);
    }

    @Test
    public void testNotEmptyAfterEitherInsert()
    {
        KeyMap<Boolean, String> map = BooleanKeyMap.KEY.newMap();
        assertTrue(map.isEmpty());
        map.put(true, "t");
        assertFalse(map.isEmpty());
        map.remove(true);
        assertTrue(map.isEmpty());
        map.put(false, "f");
        assertFalse(map.isEmpty());
        assertNull(map.get(true));
    }

    @Test
    public void testReverseEntries()
    {
        KeyMap<Boolean, String> map = BooleanKeyMap.KEY.newMap();
        map.put(false, "f");
        map.put(true, "t");
        List<Boolean> keys = new ArrayList<>();
        map.forEachEntry((k, v) -> keys.add(k), Direction.REVERSE);
        assertEquals(asList(true, false), keys);
    }

    @Test
    public void testMerge()
    {
        KeyMap<Boolean, String> left = BooleanKeyMap.KEY.newMap();
        left.put(false, "a");
        KeyMap<Boolean, String> right = BooleanKeyMap.KEY.newMap();
        right.put(false, "b");
        right.put(true, "c");

        KeyMap<Boolean, String> merged = left.mergeWith(right, String::concat);
        assertEquals("ab", merged.get(false));
        assertEquals("c", merged.get(true));
        assertNull(left.get(true));
    }
}
