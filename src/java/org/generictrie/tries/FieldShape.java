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

import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

/**
 * Shape of a position holding a value of another key type {@code T}. Its node owns a map created by the key type's
 * {@link TrieKey}: a leaf map for primitive types, or a nested {@link TrieMap} for derived ones (including the
 * enclosing type itself, for recursive types such as sequences).
 */
public final class FieldShape<T> extends Shape<T>
{
    private final TrieKey<T> key;

    FieldShape(TrieKey<T> key)
    {
        this.key = Preconditions.checkNotNull(key);
    }

    public TrieKey<T> key()
    {
        return key;
    }

    @Override
    public Kind kind()
    {
        return Kind.FIELD;
    }

    @Override
    <V> Node<T, V> singleton(T k, V value, int nesting)
    {
        KeyMap<T, V> map = key.newMap(nesting + 1);
        map.put(k, value);
        return new Node<>(map);
    }

    @Override
    public String toString()
    {
        return "Field(" + key + ")";
    }

    static final class Node<T, V> extends ShapeTrie<T, V>
    {
        private final KeyMap<T, V> map;

        Node(KeyMap<T, V> map)
        {
            this.map = map;
        }

        @Override
        V get(T key)
        {
            return map.get(key);
        }

        @Override
        Node<T, V> put(T key, V value)
        {
            map.put(key, value);
            return this;
        }

        @Override
        Node<T, V> remove(T key)
        {
            map.remove(key);
            return map.isEmpty() ? null : this;
        }

        @Override
        <W> Node<T, W> mapValues(Function<? super V, ? extends W> mapper)
        {
            return new Node<>(map.mapValues(mapper));
        }

        @Override
        <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction)
        {
            return map.fold(initial, folder, direction);
        }

        @Override
        void forEachEntry(BiConsumer<? super T, ? super V> consumer, Direction direction)
        {
            map.forEachEntry(consumer, direction);
        }

        @Override
        Node<T, V> mergeWith(ShapeTrie<T, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
        {
            Node<T, V> that = sameShape(other, Node.class);
            return new Node<>(map.mergeWith(that.map, resolver, copier));
        }

        @Override
        void checkInvariants()
        {
            if (map.isEmpty())
                throw new AssertionError("Field node with an empty map");
            map.checkInvariants();
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Node && map.equals(((Node<?, ?>) o).map);
        }

        @Override
        public int hashCode()
        {
            return map.hashCode();
        }
    }
}
