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

import java.util.function.Function;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key descriptor for a key type {@code K} that is mapped through its {@link Shape}: holds the shape together with a
 * bijection between {@code K} and the shape's value type {@code S}. Maps for such keys are {@link TrieMap}s.
 * <p>
 * The bijection is trusted: {@code fromShape(toShape(k))} must equal {@code k} for every key, and
 * {@code toShape} must never produce a value that reaches a {@link VoidShape void} position.
 * <p>
 * Example, for a type with constructors {@code A(int)} and {@code B(int, char)}:
 * <pre>
 * DerivedKey.of("Demo",
 *               Shape.sum(Shape.wrap("A", Shape.field(TrieKeys.INTEGER)),
 *                         Shape.wrap("B", Shape.product(Shape.field(TrieKeys.INTEGER), Shape.field(TrieKeys.CHARACTER)))),
 *               demo -> demo.isA() ? Either.left(demo.x) : Either.right(Pair.create(demo.x, demo.c)),
 *               shape -> shape.fold(Demo::a, pair -> Demo.b(pair.left, pair.right)));
 * </pre>
 *
 * @param <K> The key type.
 * @param <S> The value type of the key's shape.
 */
public class DerivedKey<K, S> implements TrieKey<K>
{
    private static final Logger logger = LoggerFactory.getLogger(DerivedKey.class);

    private final String name;
    private final Shape<S> shape;
    private final Function<? super K, ? extends S> toShape;
    private final Function<? super S, ? extends K> fromShape;

    private DerivedKey(String name,
                       Function<? super DerivedKey<K, S>, ? extends Shape<S>> shapeBuilder,
                       Function<? super K, ? extends S> toShape,
                       Function<? super S, ? extends K> fromShape)
    {
        this.name = Preconditions.checkNotNull(name);
        this.toShape = Preconditions.checkNotNull(toShape);
        this.fromShape = Preconditions.checkNotNull(fromShape);
        // The builder may only store the reference, e.g. in a field shape; the key is not usable until constructed.
        this.shape = Preconditions.checkNotNull(shapeBuilder.apply(this));
    }

    public static <K, S> DerivedKey<K, S> of(String name,
                                             Shape<S> shape,
                                             Function<? super K, ? extends S> toShape,
                                             Function<? super S, ? extends K> fromShape)
    {
        Preconditions.checkNotNull(shape);
        return new DerivedKey<K, S>(name, self -> shape, toShape, fromShape);
    }

    /**
     * Create a descriptor for a recursive key type. The builder receives the descriptor being created, to be used
     * in the {@link Shape#field field} positions where the type refers to itself.
     */
    public static <K, S> DerivedKey<K, S> recursive(String name,
                                                    Function<? super DerivedKey<K, S>, ? extends Shape<S>> shapeBuilder,
                                                    Function<? super K, ? extends S> toShape,
                                                    Function<? super S, ? extends K> fromShape)
    {
        return new DerivedKey<K, S>(name, shapeBuilder, toShape, fromShape);
    }

    public String name()
    {
        return name;
    }

    public Shape<S> shape()
    {
        return shape;
    }

    public S toShape(K key)
    {
        return toShape.apply(Preconditions.checkNotNull(key));
    }

    public K fromShape(S value)
    {
        return fromShape.apply(value);
    }

    /**
     * Create an empty map. Throws {@link KeyNestingException} if the given nesting exceeds
     * {@link TrieProperties#MAX_KEY_NESTING}; this happens before any node on the path of the key being inserted is
     * modified.
     */
    @Override
    public <V> TrieMap<K, V> newMap(int nesting)
    {
        int limit = TrieProperties.MAX_KEY_NESTING.getInt();
        if (limit < 1)
            throw new AssertionError(TrieProperties.MAX_KEY_NESTING.getKey() + " must be at least 1");
        if (nesting > limit)
        {
            logger.debug("Rejecting {} key nested {} levels deep", name, nesting);
            throw new KeyNestingException(nesting, limit);
        }
        return new TrieMap<>(this, nesting);
    }

    @Override
    public <V> TrieMap<K, V> newMap()
    {
        return newMap(0);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
