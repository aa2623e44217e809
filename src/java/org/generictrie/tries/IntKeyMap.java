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

import java.util.Arrays;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

import org.agrona.collections.Int2ObjectHashMap;

/**
 * Leaf map for key types that fit in an int: bounded integral types, characters and code points.
 * <p>
 * Entries are held in a sparse open-addressing {@link Int2ObjectHashMap}, which gives O(1) amortized access.
 * Traversals list the entries in ascending order of the int encoding of the key; the keys are sorted at the start
 * of each traversal.
 */
public class IntKeyMap<K, V> implements KeyMap<K, V>
{
    private final Key<K> key;
    private final Int2ObjectHashMap<V> map;

    private IntKeyMap(Key<K> key)
    {
        this.key = key;
        this.map = new Int2ObjectHashMap<>();
    }

    /**
     * Returns a key descriptor for a type with the given int encoding. The encoding must be a bijection, and its
     * order defines the traversal order.
     */
    public static <K> TrieKey<K> key(String name, ToIntFunction<? super K> toInt, IntFunction<? extends K> fromInt)
    {
        return new Key<>(name, toInt, fromInt);
    }

    private int encode(K k)
    {
        return key.toInt.applyAsInt(Preconditions.checkNotNull(k));
    }

    @Override
    public V get(K k)
    {
        return map.get(encode(k));
    }

    @Override
    public void put(K k, V value)
    {
        map.put(encode(k), Preconditions.checkNotNull(value));
    }

    @Override
    public void remove(K k)
    {
        map.remove(encode(k));
    }

    @Override
    public boolean isEmpty()
    {
        return map.isEmpty();
    }

    @Override
    public int size()
    {
        return map.size();
    }

    private int[] sortedKeys()
    {
        int[] keys = new int[map.size()];
        int i = 0;
        for (int k : map.keySet())
            keys[i++] = k;
        Arrays.sort(keys);
        return keys;
    }

    @Override
    public <W> IntKeyMap<K, W> mapValues(Function<? super V, ? extends W> mapper)
    {
        IntKeyMap<K, W> result = new IntKeyMap<>(key);
        for (int k : map.keySet())
            result.map.put(k, Preconditions.checkNotNull(mapper.apply(map.get(k))));
        return result;
    }

    @Override
    public <R> R fold(R initial, BiFunction<R, ? super V, R> folder, Direction direction)
    {
        int[] keys = sortedKeys();
        R acc = initial;
        int last = keys.length - 1;
        for (int i = direction.start(0, last); direction.le(i, direction.end(0, last)); i += direction.increase)
            acc = folder.apply(acc, map.get(keys[i]));
        return acc;
    }

    @Override
    public void forEachEntry(BiConsumer<? super K, ? super V> consumer, Direction direction)
    {
        int[] keys = sortedKeys();
        int last = keys.length - 1;
        for (int i = direction.start(0, last); direction.le(i, direction.end(0, last)); i += direction.increase)
            consumer.accept(key.fromInt.apply(keys[i]), map.get(keys[i]));
    }

    @Override
    public IntKeyMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
    {
        IntKeyMap<K, V> that = (IntKeyMap<K, V>) other;
        IntKeyMap<K, V> result = new IntKeyMap<>(key);
        for (int k : map.keySet())
        {
            V mine = map.get(k);
            V theirs = that.map.get(k);
            result.map.put(k, theirs == null ? copier.apply(mine)
                                             : Preconditions.checkNotNull(resolver.resolve(mine, theirs)));
        }
        for (int k : that.map.keySet())
        {
            if (!map.containsKey(k))
                result.map.put(k, copier.apply(that.map.get(k)));
        }
        return result;
    }

    @Override
    public IntKeyMap<K, V> copy()
    {
        return mapValues(Function.identity());
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof IntKeyMap))
            return false;
        IntKeyMap<?, ?> that = (IntKeyMap<?, ?>) o;
        if (map.size() != that.map.size())
            return false;
        for (int k : map.keySet())
        {
            if (!map.get(k).equals(that.map.get(k)))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode()
    {
        int hash = 0;
        for (int k : map.keySet())
            hash += k ^ map.get(k).hashCode();
        return hash;
    }

    static final class Key<K> implements TrieKey<K>
    {
        private final String name;
        private final ToIntFunction<? super K> toInt;
        private final IntFunction<? extends K> fromInt;

        Key(String name, ToIntFunction<? super K> toInt, IntFunction<? extends K> fromInt)
        {
            this.name = name;
            this.toInt = toInt;
            this.fromInt = fromInt;
        }

        @Override
        public <V> IntKeyMap<K, V> newMap(int nesting)
        {
            return new IntKeyMap<>(this);
        }

        @Override
        public String toString()
        {
            return name;
        }
    }
}
