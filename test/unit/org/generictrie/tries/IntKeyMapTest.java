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
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class IntKeyMapTest
{
    private static final TrieKey<Integer> KEY = IntKeyMap.key("Integer", Integer::intValue, Integer::valueOf);

    Random rand = new Random(1);

    @Test
    public void testPutGetRemove()
    {
        KeyMap<Integer, String> map = KEY.newMap();
        assertTrue(map.isEmpty());

        map.put(5, "five");
        map.put(-3, "minus three");
        map.put(5, "FIVE");
        assertFalse(map.isEmpty());
        assertEquals("FIVE", map.get(5));
        assertEquals("minus three", map.get(-3));
        assertNull(map.get(4));
        assertEquals(2, map.size());

        map.remove(5);
        map.remove(100);
        assertNull(map.get(5));
        assertEquals(1, map.size());

        map.remove(-3);
        assertTrue(map.isEmpty());
    }

    @Test
    public void testAscendingTraversal()
    {
        KeyMap<Integer, Integer> map = KEY.newMap();
        TreeSet<Integer> keys = new TreeSet<>();
        for (int i = 0; i < 1000; ++i)
        {
            int k = rand.nextInt();
            keys.add(k);
            map.put(k, k);
        }
        keys.add(Integer.MIN_VALUE);
        map.put(Integer.MIN_VALUE, Integer.MIN_VALUE);
        keys.add(Integer.MAX_VALUE);
        map.put(Integer.MAX_VALUE, Integer.MAX_VALUE);

        List<Integer> forward = new ArrayList<>();
        map.forEachEntry((k, v) -> {
            assertEquals(k, v);
            forward.add(k);
        });
        assertEquals(new ArrayList<>(keys), forward);

        List<Integer> reverse = map.fold(new ArrayList<>(), (list, v) -> {
            list.add(v);
            return list;
        }, Direction.REVERSE);
        List<Integer> expected = new ArrayList<>(keys);
        Collections.reverse(expected);
        assertEquals(expected, reverse);
    }

    @Test
    public void testMapValuesCreatesNewMap()
    {
        KeyMap<Integer, String> map = KEY.newMap();
        map.put(1, "a");
        map.put(2, "b");

        KeyMap<Integer, String> mapped = map.mapValues(s -> s + s);
        assertEquals("aa", mapped.get(1));
        assertEquals("bb", mapped.get(2));

        mapped.remove(1);
        assertEquals("a", map.get(1));
    }

    @Test
    public void testMergeWith()
    {
        KeyMap<Integer, String> left = KEY.newMap();
        left.put(1, "a");
        left.put(2, "b");
        KeyMap<Integer, String> right = KEY.newMap();
        right.put(2, "c");
        right.put(3, "d");

        KeyMap<Integer, String> merged = left.mergeWith(right, (x, y) -> x + y);
        assertEquals(3, merged.size());
        assertEquals("a", merged.get(1));
        assertEquals("bc", merged.get(2));
        assertEquals("d", merged.get(3));

        assertEquals(2, left.size());
        assertEquals("b", left.get(2));
        assertEquals(2, right.size());
    }

    @Test(expected = NullPointerException.class)
    public void testNullValueRejected()
    {
        KeyMap<Integer, String> map = KEY.newMap();
        map.put(1, null);
    }

    @Test
    public void testEquals()
    {
        KeyMap<Integer, String> a = KEY.newMap();
        KeyMap<Integer, String> b = KEY.newMap();
        for (int i = 0; i < 100; ++i)
        {
            a.put(i, "v" + i);
            b.put(99 - i, "v" + (99 - i));
        }
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        b.put(50, "other");
        assertNotEquals(a, b);
    }
}
