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

import java.util.Comparator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

/**
 * Leaf map for unbounded or ordered key types, e.g. longs, big integers or any type with a total order.
 * Backed by a red-black tree, giving O(log n) access and traversal in the order of the comparator.
 */
public class OrderedKeyMap<K, V> implements KeyMap<K, V>
{
    private final Key<K> key;
    private final TreeMap<K, V> map;

    private OrderedKeyMap(Key<K> key)
    {
        this.key = key;
        this.map = new TreeMap<>(key.comparator);
    }

    /**
     * Returns a key descriptor for a type ordered by the given comparator, which must be consistent with equals.
     */
    public static <K> TrieKey<K> key(String name, Comparator<? super K> comparator)
    {
        return new Key<>(name, comparator);
    }

    @Override
    public V get(K k)
    {
        return map.get(Preconditions.checkNotNull(k));
    }

    @Override
    public void put(K k, V value)
    {
        map.put(Preconditions.checkNotNull(k), Preconditions.checkNotNull(value));
    }

    @Override
    public void remove(K k)
    {
        map.remove(Preconditions.checkNotNull(k));
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

    private NavigableMap<K, V> ordered(Direction direction)
    {
        return direction.isForward() ? map : map.descendingMap();
    }

    @Override
    public <W> OrderedKeyMap<K, W> mapValues(Function<? super V, ? extends W> mapper)
    {
        OrderedKeyMap<K, W> result = new OrderedKeyMap<>(key);
        for (Map.Entry<K, V> entry : map.entrySet())
            result.map.put(entry.getKey(), Preconditions.checkNotNull(mapper.apply(entry.getValue())));
        return result;
    }

    @Override
    public <R> R fold(R initial, BiFunction<R, ? super V, R> folder, Direction direction)
    {
        R acc = initial;
        for (V value : ordered(direction).values())
            acc = folder.apply(acc, value);
        return acc;
    }

    @Override
    public void forEachEntry(BiConsumer<? super K, ? super V> consumer, Direction direction)
    {
        for (Map.Entry<K, V> entry : ordered(direction).entrySet())
            consumer.accept(entry.getKey(), entry.getValue());
    }

    @Override
    public OrderedKeyMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
    {
        OrderedKeyMap<K, V> that = (OrderedKeyMap<K, V>) other;
        OrderedKeyMap<K, V> result = new OrderedKeyMap<>(key);
        for (Map.Entry<K, V> entry : map.entrySet())
        {
            V theirs = that.map.get(entry.getKey());
            result.map.put(entry.getKey(), theirs == null ? copier.apply(entry.getValue())
                                                          : Preconditions.checkNotNull(resolver.resolve(entry.getValue(), theirs)));
        }
        for (Map.Entry<K, V> entry : that.map.entrySet())
        {
            if (!map.containsKey(entry.getKey()))
                result.map.put(entry.getKey(), copier.apply(entry.getValue()));
        }
        return result;
    }

    @Override
    public OrderedKeyMap<K, V> copy()
    {
        return mapValues(Function.identity());
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof OrderedKeyMap && map.equals(((OrderedKeyMap<?, ?>) o).map);
    }

    @Override
    public int hashCode()
    {
        return map.hashCode();
    }

    static final class Key<K> implements TrieKey<K>
    {
        private final String name;
        private final Comparator<? super K> comparator;

        Key(String name, Comparator<? super K> comparator)
        {
            this.name = name;
            this.comparator = Preconditions.checkNotNull(comparator);
        }

        @Override
        public <V> OrderedKeyMap<K, V> newMap(int nesting)
        {
            return new OrderedKeyMap<>(this);
        }

        @Override
        public String toString()
        {
            return name;
        }
    }
}
