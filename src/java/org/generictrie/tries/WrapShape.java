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
 * Transparent wrapper around another shape, naming it (e.g. with a constructor or field name). The name is only
 * used in descriptions; the node stores exactly what the inner shape's node stores.
 */
public final class WrapShape<S> extends Shape<S>
{
    private final String name;
    private final Shape<S> inner;

    WrapShape(String name, Shape<S> inner)
    {
        this.name = Preconditions.checkNotNull(name);
        this.inner = Preconditions.checkNotNull(inner);
    }

    public String name()
    {
        return name;
    }

    public Shape<S> inner()
    {
        return inner;
    }

    @Override
    public Kind kind()
    {
        return Kind.WRAP;
    }

    @Override
    <V> Node<S, V> singleton(S key, V value, int nesting)
    {
        return new Node<>(inner.singleton(key, value, nesting));
    }

    @Override
    public String toString()
    {
        return name + ":" + inner;
    }

    static final class Node<S, V> extends ShapeTrie<S, V>
    {
        private ShapeTrie<S, V> inner;

        Node(ShapeTrie<S, V> inner)
        {
            this.inner = inner;
        }

        @Override
        V get(S key)
        {
            return inner.get(key);
        }

        @Override
        Node<S, V> put(S key, V value)
        {
            inner = inner.put(key, value);
            return this;
        }

        @Override
        Node<S, V> remove(S key)
        {
            inner = inner.remove(key);
            return inner == null ? null : this;
        }

        @Override
        <W> Node<S, W> mapValues(Function<? super V, ? extends W> mapper)
        {
            return new Node<>(inner.mapValues(mapper));
        }

        @Override
        <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction)
        {
            return inner.fold(initial, folder, direction);
        }

        @Override
        void forEachEntry(BiConsumer<? super S, ? super V> consumer, Direction direction)
        {
            inner.forEachEntry(consumer, direction);
        }

        @Override
        Node<S, V> mergeWith(ShapeTrie<S, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
        {
            Node<S, V> that = sameShape(other, Node.class);
            return new Node<>(inner.mergeWith(that.inner, resolver, copier));
        }

        @Override
        void checkInvariants()
        {
            if (inner == null)
                throw new AssertionError("Wrap node without content");
            inner.checkInvariants();
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Node && inner.equals(((Node<?, ?>) o).inner);
        }

        @Override
        public int hashCode()
        {
            return inner.hashCode();
        }
    }
}
