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

import org.generictrie.utils.Pair;

/**
 * Shape of a position holding both a left and a right value. Its node is a trie of tries: an outer node over the
 * left shape whose values are inner nodes over the right shape.
 * <p>
 * An inner node is only ever created as a singleton, and an inner node emptied by a removal is removed from the
 * outer one, so no inner node is ever empty.
 */
public final class ProductShape<L, R> extends Shape<Pair<L, R>>
{
    private final Shape<L> left;
    private final Shape<R> right;

    ProductShape(Shape<L> left, Shape<R> right)
    {
        this.left = Preconditions.checkNotNull(left);
        this.right = Preconditions.checkNotNull(right);
    }

    public Shape<L> left()
    {
        return left;
    }

    public Shape<R> right()
    {
        return right;
    }

    @Override
    public Kind kind()
    {
        return Kind.PRODUCT;
    }

    @Override
    <V> Node<L, R, V> singleton(Pair<L, R> key, V value, int nesting)
    {
        return new Node<>(this, nesting, left.singleton(key.left, right.singleton(key.right, value, nesting), nesting));
    }

    @Override
    public String toString()
    {
        return "Product(" + left + ", " + right + ")";
    }

    static final class Node<L, R, V> extends ShapeTrie<Pair<L, R>, V>
    {
        private final ProductShape<L, R> shape;
        private final int nesting;
        private ShapeTrie<L, ShapeTrie<R, V>> outer;

        Node(ProductShape<L, R> shape, int nesting, ShapeTrie<L, ShapeTrie<R, V>> outer)
        {
            this.shape = shape;
            this.nesting = nesting;
            this.outer = outer;
        }

        @Override
        V get(Pair<L, R> key)
        {
            ShapeTrie<R, V> inner = outer.get(key.left);
            return inner == null ? null : inner.get(key.right);
        }

        @Override
        Node<L, R, V> put(Pair<L, R> key, V value)
        {
            ShapeTrie<R, V> inner = outer.get(key.left);
            if (inner == null)
            {
                outer = outer.put(key.left, shape.right.singleton(key.right, value, nesting));
            }
            else
            {
                ShapeTrie<R, V> updated = inner.put(key.right, value);
                if (updated != inner)
                    outer = outer.put(key.left, updated);
            }
            return this;
        }

        @Override
        Node<L, R, V> remove(Pair<L, R> key)
        {
            ShapeTrie<R, V> inner = outer.get(key.left);
            if (inner == null)
                return this;

            ShapeTrie<R, V> updated = inner.remove(key.right);
            if (updated == null)
            {
                outer = outer.remove(key.left);
                return outer == null ? null : this;
            }
            if (updated != inner)
                outer = outer.put(key.left, updated);
            return this;
        }

        @Override
        <W> Node<L, R, W> mapValues(Function<? super V, ? extends W> mapper)
        {
            ShapeTrie<L, ShapeTrie<R, W>> mapped = outer.mapValues(inner -> inner.mapValues(mapper));
            return new Node<>(shape, nesting, mapped);
        }

        @Override
        <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction)
        {
            return outer.fold(initial, (acc, inner) -> inner.fold(acc, folder, direction), direction);
        }

        @Override
        void forEachEntry(BiConsumer<? super Pair<L, R>, ? super V> consumer, Direction direction)
        {
            outer.forEachEntry((l, inner) -> inner.forEachEntry((r, value) -> consumer.accept(Pair.create(l, r), value),
                                                                direction),
                               direction);
        }

        @Override
        Node<L, R, V> mergeWith(ShapeTrie<Pair<L, R>, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
        {
            Node<L, R, V> that = sameShape(other, Node.class);
            MergeResolver<ShapeTrie<R, V>> innerResolver = (i1, i2) -> i1.mergeWith(i2, resolver, copier);
            ShapeTrie<L, ShapeTrie<R, V>> merged = outer.mergeWith(that.outer, innerResolver, inner -> inner.mapValues(copier));
            return new Node<>(shape, nesting, merged);
        }

        @Override
        void checkInvariants()
        {
            if (outer == null)
                throw new AssertionError("Product node without an outer trie");
            outer.checkInvariants();
            outer.fold(null, (unused, inner) -> {
                inner.checkInvariants();
                return null;
            }, Direction.FORWARD);
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Node && outer.equals(((Node<?, ?, ?>) o).outer);
        }

        @Override
        public int hashCode()
        {
            return outer.hashCode();
        }
    }
}
