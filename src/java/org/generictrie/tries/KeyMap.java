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
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Map contract shared by the leaf maps (used for primitive keys at {@link FieldShape field} positions) and the
 * derived {@link TrieMap}.
 * <p>
 * Values are never null; {@code null} is returned by {@link #get} for absent keys. {@link #put} and {@link #remove}
 * modify the map in place. {@link #mapValues}, {@link #mergeWith} and {@link #copy} return new maps that share no
 * mutable structure with their sources (stored values are shared by reference).
 * <p>
 * Maps are not thread-safe.
 *
 * @param <K> The key type.
 * @param <V> The value type.
 */
public interface KeyMap<K, V>
{
    /**
     * Returns the value mapped to the given key, or null if there is none.
     */
    V get(K key);

    default boolean containsKey(K key)
    {
        return get(key) != null;
    }

    /**
     * Map the given key to the given non-null value, replacing any existing mapping.
     */
    void put(K key, V value);

    /**
     * Remove the mapping for the given key. Does nothing if the key is not present.
     */
    void remove(K key);

    boolean isEmpty();

    default int size()
    {
        return fold(0, (count, value) -> count + 1);
    }

    /**
     * Returns a new map with the same keys, where each value is the result of applying the given function to the
     * original value. The mapper must not return null.
     */
    <W> KeyMap<K, W> mapValues(Function<? super V, ? extends W> mapper);

    /**
     * Fold all the values of the map in forward order.
     */
    default <R> R fold(R initial, BiFunction<R, ? super V, R> folder)
    {
        return fold(initial, folder, Direction.FORWARD);
    }

    <R> R fold(R initial, BiFunction<R, ? super V, R> folder, Direction direction);

    /**
     * Call the given consumer on all (key, value) pairs in forward order.
     */
    default void forEachEntry(BiConsumer<? super K, ? super V> consumer)
    {
        forEachEntry(consumer, Direction.FORWARD);
    }

    void forEachEntry(BiConsumer<? super K, ? super V> consumer, Direction direction);

    default void forEachValue(Consumer<? super V> consumer)
    {
        forEachValue(consumer, Direction.FORWARD);
    }

    default void forEachValue(Consumer<? super V> consumer, Direction direction)
    {
        fold(null, (unused, value) -> {
            consumer.accept(value);
            return null;
        }, direction);
    }

    /**
     * Returns a new map containing the union of the keys of this map and the given one. Where both contain a value
     * for the same key, the resolver is called with this map's value first.
     */
    default KeyMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver)
    {
        return mergeWith(other, resolver, UnaryOperator.identity());
    }

    /**
     * As {@link #mergeWith(KeyMap, MergeResolver)}, applying {@code copier} to the values that are taken from only
     * one of the sources. Tries whose values are themselves mutable nodes use this to avoid sharing them.
     * <p>
     * The other map must have been created by the same {@link TrieKey}.
     */
    KeyMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier);

    default KeyMap<K, V> copy()
    {
        return mapValues(Function.identity());
    }

    /**
     * Verify the structural invariants of the map, throwing {@link AssertionError} if they are violated.
     */
    default void checkInvariants()
    {
        // leaf maps have no internal structure to verify
    }
}
