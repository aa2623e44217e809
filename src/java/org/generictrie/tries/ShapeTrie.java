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

/**
 * A node of the generic trie, storing values for the keys of a {@link Shape}. Each shape defines its own node type.
 * <p>
 * Nodes are never empty: a node that would be left without values by a removal is dropped by its parent (the
 * removal returns null), and nodes are only ever created with a value ({@link Shape#singleton}). An empty trie is
 * represented by the absence of a node.
 * <p>
 * Nodes are mutable. {@link #put} and {@link #remove} modify the node and return the node that must replace it in
 * the parent (usually the same one). {@link #mapValues}, {@link #mergeWith} and {@link #copy} build new nodes that
 * share no mutable structure with the sources.
 *
 * @param <S> The value type of the shape.
 * @param <V> The type of the stored values.
 */
public abstract class ShapeTrie<S, V>
{
    ShapeTrie()
    {
    }

    /**
     * Returns the value stored for the key, or null if there is none.
     */
    abstract V get(S key);

    /**
     * Store the given value for the key, replacing any existing one.
     *
     * @return the node that takes the place of this one.
     */
    abstract ShapeTrie<S, V> put(S key, V value);

    /**
     * Remove the value for the key, if there is one.
     *
     * @return the node that takes the place of this one, or null if no values remain.
     */
    abstract ShapeTrie<S, V> remove(S key);

    abstract <W> ShapeTrie<S, W> mapValues(Function<? super V, ? extends W> mapper);

    abstract <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction);

    abstract void forEachEntry(BiConsumer<? super S, ? super V> consumer, Direction direction);

    /**
     * Returns a new node with the union of the content of this node and the given one, which must have the same
     * shape. Where both hold a value for the same key, the resolver is applied to this node's value and the other
     * node's value; values present in only one of the two are passed through {@code copier}.
     */
    abstract ShapeTrie<S, V> mergeWith(ShapeTrie<S, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier);

    /**
     * Throws {@link AssertionError} if this node or any of its descendants is empty.
     */
    abstract void checkInvariants();

    ShapeTrie<S, V> copy()
    {
        return mapValues(Function.identity());
    }

    /**
     * Cast a node received from another trie to the expected node type. A mismatch means the two tries were built
     * from different shapes, which is a fatal internal error.
     */
    @SuppressWarnings("unchecked")
    static <N extends ShapeTrie<?, ?>> N sameShape(ShapeTrie<?, ?> node, Class<?> nodeClass)
    {
        if (!nodeClass.isInstance(node))
            throw new AssertionError("Trie node mismatch: expected " + nodeClass.getName() +
                                     " but found " + node.getClass().getName());
        return (N) node;
    }
}
