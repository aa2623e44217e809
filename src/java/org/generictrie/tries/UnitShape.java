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

import org.generictrie.utils.Unit;

/**
 * Shape of a position with exactly one possible value. Its node holds the single stored value.
 */
public final class UnitShape extends Shape<Unit>
{
    static final UnitShape INSTANCE = new UnitShape();

    private UnitShape()
    {
    }

    @Override
    public Kind kind()
    {
        return Kind.UNIT;
    }

    @Override
    <V> Node<V> singleton(Unit key, V value, int nesting)
    {
        return new Node<>(value);
    }

    @Override
    public String toString()
    {
        return "Unit";
    }

    static final class Node<V> extends ShapeTrie<Unit, V>
    {
        private V value;

        Node(V value)
        {
            this.value = Preconditions.checkNotNull(value);
        }

        @Override
        V get(Unit key)
        {
            return value;
        }

        @Override
        Node<V> put(Unit key, V value)
        {
            this.value = Preconditions.checkNotNull(value);
            return this;
        }

        @Override
        Node<V> remove(Unit key)
        {
            return null;
        }

        @Override
        <W> Node<W> mapValues(Function<? super V, ? extends W> mapper)
        {
            return new Node<>(mapper.apply(value));
        }

        @Override
        <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction)
        {
            return folder.apply(initial, value);
        }

        @Override
        void forEachEntry(BiConsumer<? super Unit, ? super V> consumer, Direction direction)
        {
            consumer.accept(Unit.UNIT, value);
        }

        @Override
        Node<V> mergeWith(ShapeTrie<Unit, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
        {
            Node<V> that = sameShape(other, Node.class);
            return new Node<>(resolver.resolve(value, that.value));
        }

        @Override
        void checkInvariants()
        {
            if (value == null)
                throw new AssertionError("Unit node without a value");
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Node && value.equals(((Node<?>) o).value);
        }

        @Override
        public int hashCode()
        {
            return value.hashCode();
        }
    }
}
