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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import org.junit.After;
import org.junit.Test;

import org.generictrie.keys.TrieKeys;
import org.generictrie.utils.Either;
import org.generictrie.utils.Unit;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TrieMapTest
{
    private static final DerivedKey<List<Integer>, ?> LIST_KEY = TrieKeys.list(TrieKeys.INTEGER);

    @After
    public void resetProperties()
    {
        TrieProperties.MAX_KEY_NESTING.reset();
    }

    private static List<Integer> list(Integer... elements)
    {
        return ImmutableList.copyOf(elements);
    }

    private static <K, V> Map.Entry<K, V> entry(K key, V value)
    {
        return Maps.immutableEntry(key, value);
    }

    private static TrieMap<List<Integer>, String> sample()
    {
        return TrieMap.fromPairs(LIST_KEY, asList(entry(list(1, 2), "a"),
                                                  entry(list(1), "b"),
                                                  entry(list(), "c"),
                                                  entry(list(2), "d")));
    }

    private static <K, V> List<K> keys(TrieMap<K, V> map, Direction direction)
    {
        List<K> keys = new ArrayList<>();
        map.forEachEntry((k, v) -> keys.add(k), direction);
        return keys;
    }

    private static SumShape.Form rootForm(TrieMap<?, ?> map)
    {
        ShapeTrie<?, ?> root = map.root();
        return ((SumShape.Node<?, ?, ?>) root).form();
    }

    @Test
    public void testEmpty()
    {
        TrieMap<List<Integer>, String> map = TrieMap.empty(LIST_KEY);
        assertTrue(map.isEmpty());
        assertNull(map.root());
        assertNull(map.get(list(1)));
        assertEquals(0, map.size());
        assertEquals("init", map.fold("init", (acc, v) -> acc + v));
        assertTrue(Iterables.isEmpty(map.entrySet()));

        map.remove(list(1));
        assertTrue(map.isEmpty());
    }

    @Test
    public void testPutGet()
    {
        TrieMap<List<Integer>, String> map = sample();
        assertEquals("a", map.get(list(1, 2)));
        assertEquals("b", map.get(list(1)));
        assertEquals("c", map.get(list()));
        assertEquals("d", map.get(list(2)));
        assertNull(map.get(list(1, 2, 3)));
        assertNull(map.get(list(3)));
        assertTrue(map.containsKey(list(1)));
        assertFalse(map.containsKey(list(2, 1)));
        assertEquals(4, map.size());

        map.put(list(1), "B");
        assertEquals("B", map.get(list(1)));
        assertEquals(4, map.size());
    }

    @Test
    public void testFromPairsKeepsLast()
    {
        TrieMap<List<Integer>, String> map = TrieMap.fromPairs(LIST_KEY, asList(entry(list(1), "first"),
                                                                                entry(list(1), "second")));
        assertEquals("second", map.get(list(1)));
        assertEquals(1, map.size());
    }

    @Test
    public void testFromMap()
    {
        Map<List<Integer>, String> source = new LinkedHashMap<>();
        source.put(list(3, 1), "x");
        source.put(list(), "y");
        TrieMap<List<Integer>, String> map = TrieMap.fromMap(LIST_KEY, source);
        assertEquals(asList(list(), list(3, 1)), keys(map, Direction.FORWARD));
    }

    @Test
    public void testRemoveUndoesPut()
    {
        TrieMap<List<Integer>, String> map = sample();
        TrieMap<List<Integer>, String> original = map.copy();
        assertEquals(original, map);

        for (List<Integer> key : asList(list(1, 2, 3), list(3), list(2, 2), list(1, 2, 3, 4), list(5, 6, 7)))
        {
            map.put(key, "x");
            assertNotEquals(original, map);
            map.remove(key);
            map.checkInvariants();
            assertEquals(original, map);
            assertEquals(original.hashCode(), map.hashCode());
        }
    }

    @Test
    public void testRemoveAllLeavesNoRoot()
    {
        TrieMap<List<Integer>, String> map = sample();
        for (List<Integer> key : asList(list(2), list(1, 2), list(), list(1)))
        {
            assertFalse(map.isEmpty());
            map.remove(key);
            map.checkInvariants();
        }
        assertTrue(map.isEmpty());
        assertNull(map.root());
        assertEquals(TrieMap.empty(LIST_KEY), map);
    }

    @Test
    public void testOrder()
    {
        TrieMap<List<Integer>, String> map = sample();
        assertEquals(asList(list(), list(1), list(1, 2), list(2)), keys(map, Direction.FORWARD));
        assertEquals(asList(list(2), list(1, 2), list(1), list()), keys(map, Direction.REVERSE));
        assertEquals(asList("c", "b", "a", "d"), ImmutableList.copyOf(map.values()));
        assertEquals(asList("d", "a", "b", "c"), ImmutableList.copyOf(map.values(Direction.REVERSE)));
        assertEquals("cbad", map.fold("", String::concat));
        assertEquals(entry(list(2), "d"), map.entryIterator(Direction.REVERSE).next());
    }

    @Test
    public void testRootForm()
    {
        TrieMap<List<Integer>, String> map = TrieMap.empty(LIST_KEY);
        map.put(list(1, 2, 3), "a");
        map.put(list(1, 2, 4), "b");
        assertSame(Shape.Kind.SUM, LIST_KEY.shape().kind());
        assertEquals(SumShape.Form.RIGHT, rootForm(map));

        map.put(list(), "empty");
        assertEquals(SumShape.Form.BOTH, rootForm(map));

        map.remove(list(1, 2, 3));
        map.remove(list(1, 2, 4));
        assertEquals(SumShape.Form.LEFT, rootForm(map));
    }

    @Test
    public void testMapValues()
    {
        TrieMap<List<Integer>, String> map = sample();
        TrieMap<List<Integer>, Integer> lengths = map.mapValues(String::length);
        assertEquals(keys(map, Direction.FORWARD), keys(lengths, Direction.FORWARD));
        assertEquals(Integer.valueOf(1), lengths.get(list(1, 2)));

        lengths.remove(list(1, 2));
        assertEquals("a", map.get(list(1, 2)));
    }

    @Test
    public void testMergeWith()
    {
        TrieMap<List<Integer>, String> left = sample();
        TrieMap<List<Integer>, String> right = TrieMap.fromPairs(LIST_KEY, asList(entry(list(1), "B"),
                                                                                  entry(list(1, 2, 3), "e")));
        TrieMap<List<Integer>, String> leftCopy = left.copy();
        TrieMap<List<Integer>, String> rightCopy = right.copy();

        TrieMap<List<Integer>, String> merged = left.mergeWith(right, (l, r) -> l + "+" + r);
        merged.checkInvariants();
        assertEquals(5, merged.size());
        assertEquals("b+B", merged.get(list(1)));
        assertEquals("a", merged.get(list(1, 2)));
        assertEquals("e", merged.get(list(1, 2, 3)));

        // the merge result shares no nodes with its sources
        merged.put(list(1, 2, 3, 4), "f");
        merged.remove(list(1, 2));
        merged.remove(list(2));
        assertEquals(leftCopy, left);
        assertEquals(rightCopy, right);

        left.put(list(7), "g");
        assertNull(merged.get(list(7)));
    }

    @Test
    public void testMergeWithEmpty()
    {
        TrieMap<List<Integer>, String> map = sample();
        TrieMap<List<Integer>, String> empty = TrieMap.empty(LIST_KEY);
        assertEquals(map, map.mergeWith(empty, MergeResolver.throwing()));
        assertEquals(map, empty.mergeWith(map, MergeResolver.throwing()));
        assertTrue(empty.mergeWith(TrieMap.empty(LIST_KEY), MergeResolver.throwing()).isEmpty());

        TrieMap<List<Integer>, String> merged = empty.mergeWith(map, MergeResolver.throwing());
        merged.remove(list(1));
        assertEquals("b", map.get(list(1)));
    }

    @Test(expected = AssertionError.class)
    public void testThrowingResolver()
    {
        sample().mergeWith(sample(), MergeResolver.throwing());
    }

    @Test
    public void testResolverExceptionPropagates()
    {
        TrieMap<List<Integer>, String> map = sample();
        TrieMap<List<Integer>, String> original = map.copy();
        try
        {
            map.mergeWith(sample(), (l, r) -> {
                throw new IllegalStateException("conflict");
            });
            fail("Expected the resolver exception");
        }
        catch (IllegalStateException e)
        {
            assertEquals("conflict", e.getMessage());
        }
        assertEquals(original, map);
    }

    @Test
    public void testMergeCollection()
    {
        TrieMap<List<Integer>, String> a = TrieMap.fromPairs(LIST_KEY, asList(entry(list(1), "a1"), entry(list(2), "a2")));
        TrieMap<List<Integer>, String> b = TrieMap.fromPairs(LIST_KEY, asList(entry(list(1), "b1")));
        TrieMap<List<Integer>, String> c = TrieMap.fromPairs(LIST_KEY, asList(entry(list(1), "c1"), entry(list(3), "c3")));

        TrieMap<List<Integer>, String> merged = TrieMap.merge(LIST_KEY, asList(a, b, c), String::concat);
        assertEquals("a1b1c1", merged.get(list(1)));
        assertEquals("a2", merged.get(list(2)));
        assertEquals("c3", merged.get(list(3)));

        assertTrue(TrieMap.merge(LIST_KEY, ImmutableList.<TrieMap<List<Integer>, String>>of(), String::concat).isEmpty());

        TrieMap<List<Integer>, String> single = TrieMap.merge(LIST_KEY, asList(a), String::concat);
        assertEquals(a, single);
        single.remove(list(1));
        assertEquals("a1", a.get(list(1)));
    }

    @Test
    public void testCopySharesValues()
    {
        TrieMap<List<Integer>, List<String>> map = TrieMap.empty(LIST_KEY);
        List<String> value = new ArrayList<>();
        map.put(list(1), value);
        TrieMap<List<Integer>, List<String>> copy = map.copy();
        assertSame(value, copy.get(list(1)));

        copy.put(list(2), new ArrayList<>());
        assertNull(map.get(list(2)));
    }

    @Test(expected = NullPointerException.class)
    public void testNullValue()
    {
        TrieMap.empty(LIST_KEY).put(list(1), null);
    }

    @Test(expected = NullPointerException.class)
    public void testNullKey()
    {
        sample().get(null);
    }

    @Test
    public void testNestingLimit()
    {
        TrieProperties.MAX_KEY_NESTING.setInt(8);
        TrieMap<List<Integer>, String> map = sample();
        TrieMap<List<Integer>, String> original = map.copy();

        List<Integer> longest = list(1, 2, 3, 4, 5, 6, 7, 8);
        map.put(longest, "deep");
        assertEquals("deep", map.get(longest));
        map.remove(longest);

        try
        {
            map.put(list(1, 2, 3, 4, 5, 6, 7, 8, 9), "too deep");
            fail("Expected KeyNestingException");
        }
        catch (KeyNestingException e)
        {
            // expected
        }
        map.checkInvariants();
        assertEquals(original, map);

        // lookups of long keys simply fail to find them
        assertNull(map.get(list(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)));
        map.remove(list(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));
        assertEquals(original, map);
    }

    @Test(expected = AssertionError.class)
    public void testNestingLimitMustBePositive()
    {
        TrieProperties.MAX_KEY_NESTING.setInt(0);
        TrieMap.empty(LIST_KEY);
    }

    @Test
    public void testUnitRootKey()
    {
        DerivedKey<Unit, Unit> key = DerivedKey.of("Unit", Shape.unit(), u -> u, s -> s);
        TrieMap<Unit, String> map = TrieMap.empty(key);
        map.put(Unit.UNIT, "one");
        assertEquals("one", map.get(Unit.UNIT));
        assertEquals(1, map.size());
        map.remove(Unit.UNIT);
        assertTrue(map.isEmpty());
    }

    @Test
    public void testVoidKey()
    {
        DerivedKey<Object, Void> key = DerivedKey.of("Nothing", Shape.voidShape(), k -> null, s -> s);
        TrieMap<Object, String> map = TrieMap.empty(key);
        assertNull(map.get("anything"));
        map.remove("anything");
        assertTrue(map.isEmpty());
        try
        {
            map.put("anything", "x");
            fail("Expected AssertionError");
        }
        catch (AssertionError e)
        {
            // no key can reach a void position
        }
        assertTrue(map.isEmpty());
    }

    @Test
    public void testUserDefinedKey()
    {
        // Demo = A(int) | B(int, boolean)
        DerivedKey<Either<Integer, List<Object>>, ?> demo =
            TrieKeys.either(TrieKeys.INTEGER, TrieKeys.tuple(TrieKeys.INTEGER, TrieKeys.BOOLEAN));
        TrieMap<Either<Integer, List<Object>>, String> map = TrieMap.empty(demo);
        map.put(Either.left(5), "A 5");
        map.put(Either.right(ImmutableList.of(5, true)), "B 5 true");
        map.put(Either.right(ImmutableList.of(5, false)), "B 5 false");

        assertEquals("A 5", map.get(Either.left(5)));
        assertEquals("B 5 true", map.get(Either.right(asList(5, true))));
        assertEquals(asList("A 5", "B 5 false", "B 5 true"), ImmutableList.copyOf(map.values()));
    }
}
