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

import org.generictrie.utils.Either;
import org.generictrie.utils.Pair;

/**
 * Structural description of a key type, built from a closed vocabulary of combinators:
 * <ul>
 * <li>{@link VoidShape void}: a type with no values,</li>
 * <li>{@link UnitShape unit}: a type with a single value and no payload (e.g. a constructor without fields),</li>
 * <li>{@link FieldShape field}: a single value of another key type, mapped by that type's own {@link TrieKey},</li>
 * <li>{@link ProductShape product}: both a left and a right value (e.g. a constructor with two or more fields),
 *     represented by a {@link Pair},</li>
 * <li>{@link SumShape sum}: either a left or a right value (e.g. a choice between constructors), represented by an
 *     {@link Either},</li>
 * <li>{@link WrapShape wrap}: a transparent, named wrapper that carries diagnostic information only.</li>
 * </ul>
 * A key type is mapped to its shape by a {@link DerivedKey}, which supplies the shape together with a bijection
 * between the key type and the shape's value type {@code S}.
 * <p>
 * Every shape knows how to create the trie node that stores values at its position ({@link ShapeTrie}); the
 * generic trie is the composition of these nodes.
 *
 * @param <S> The type of the values of the shape.
 */
public abstract class Shape<S>
{
    public enum Kind
    {
        VOID, UNIT, FIELD, PRODUCT, SUM, WRAP
    }

    Shape()
    {
    }

    public abstract Kind kind();

    /**
     * Create a node holding only the given key and value. Nodes are never created empty.
     *
     * @param nesting the nesting level of the derived map the node belongs to.
     */
    abstract <V> ShapeTrie<S, V> singleton(S key, V value, int nesting);

    public static VoidShape voidShape()
    {
        return VoidShape.INSTANCE;
    }

    public static UnitShape unit()
    {
        return UnitShape.INSTANCE;
    }

    public static <T> FieldShape<T> field(TrieKey<T> key)
    {
        return new FieldShape<>(key);
    }

    public static <L, R> ProductShape<L, R> product(Shape<L> left, Shape<R> right)
    {
        return new ProductShape<>(left, right);
    }

    public static <L, R> SumShape<L, R> sum(Shape<L> left, Shape<R> right)
    {
        return new SumShape<>(left, right);
    }

    public static <S> WrapShape<S> wrap(String name, Shape<S> inner)
    {
        return new WrapShape<>(name, inner);
    }
}
