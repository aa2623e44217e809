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

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

/**
 * Leaf map for boolean keys: one slot for each of the two values, {@code false} ordered before {@code true}.
 */
public class BooleanKeyMap<V> implements KeyMap<Boolean, V>
{
    public static final TrieKey<Boolean> KEY = new TrieKey<Boolean>()
    {
        @Override
        public <V> BooleanKeyMap<V> newMap(int nesting)
        {
            return new BooleanKeyMap<>();
        }

        @Override
        public String toString()
        {
            return "Boolean";
        }
    };

    private V whenFalse;
    private V whenTrue;

    private BooleanKeyMap()
    {
    }

    private BooleanKeyMap(V whenFalse, V whenTrue)
    {
        this.whenFalse = whenFalse;
        this.whenTrue = whenTrue;
    }

    @Override
    public V get(Boolean key)
    {
        return Preconditions.checkNotNull(key) ? whenTrue : whenFalse;
    }

    @Override
    public void put(Boolean key, V value)
    {
        Preconditions.checkNotNull(value);
        if (Preconditions.checkNotNull(key))
            whenTrue = value;
        else
            whenFalse = value;
    }

    @Override
    public void remove(Boolean key)
    {
        if (Preconditions.checkNotNull(key))
            whenTrue = null;
        else
            whenFalse = null;
    }

    @Override
    public boolean isEmpty()
    {
        return whenFalse == null && whenTrue == null;
    }

    @Override
    public int size()
    {
        return (whenFalse != null ? 1 : 0) + (whenTrue != null ? 1 : 0);
    }

    private static <V, W> W apply(Function<? super V, ? extends W> mapper, V value)
    {
        return value == null ? null : Preconditions.checkNotNull(mapper.apply(value));
    }

    @Override
    public <W> BooleanKeyMap<W> mapValues(Function<? super V, ? extends W> mapper)
    {
        return new BooleanKeyMap<>(apply(mapper, whenFalse), apply(mapper, whenTrue));
    }

    @Override
    public <R> R fold(R initial, BiFunction<R, ? super V, R> folder, Direction direction)
    {
        R acc = initial;
        V first = direction.first(whenFalse, whenTrue);
        V second = direction.second(whenFalse, whenTrue);
        if (first != null)
            acc = folder.apply(acc, first);
        if (second != null)
            acc = folder.apply(acc, second);
        return acc;
    }

    @Override
    public void forEachEntry(BiConsumer<? super Boolean, ? super V> consumer, Direction direction)
    {
        boolean firstKey = !direction.isForward();
        V first = direction.first(whenFalse, whenTrue);
        V second = direction.second(whenFalse, whenTrue);
        if (first != null)
            consumer.accept(firstKey, first);
        if (second != null)
            consumer.accept(!firstKey, second);
    }

    private static <V> V merge(V mine, V theirs, MergeResolver<V> resolver, UnaryOperator<V> copier)
    {
        if (mine == null)
            return theirs == null ? null : copier.apply(theirs);
        if (theirs == null)
            return copier.apply(mine);
        return Preconditions.checkNotNull(resolver.resolve(mine, theirs));
    }

    @Override
    public BooleanKeyMap<V> mergeWith(KeyMap<Boolean, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
    {
        BooleanKeyMap<V> that = (BooleanKeyMap<V>) other;
        return new BooleanKeyMap<>(merge(whenFalse, that.whenFalse, resolver, copier),
                                   merge(whenTrue, that.whenTrue, resolver, copier));
    }

    @Override
    public BooleanKeyMap<V> copy()
    {
        return new BooleanKeyMap<>(whenFalse, whenTrue);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof BooleanKeyMap))
            return false;
        BooleanKeyMap<?> that = (BooleanKeyMap<?>) o;
        return Objects.equals(whenFalse, that.whenFalse) && Objects.equals(whenTrue, that.whenTrue);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(whenFalse, whenTrue);
    }
}
