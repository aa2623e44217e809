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

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map whose keys are described by a {@link DerivedKey}. Keys are converted to their shape values, and stored in a
 * generic trie composed of the nodes of the key's {@link Shape}.
 * <p>
 * The trie holds no empty nodes, so an empty map is one without a root node, and {@link #isEmpty} does not need to
 * look further. When {@link TrieProperties#TRIE_DEBUG} is set, this is verified after every modification.
 * <p>
 * {@link #put} and {@link #remove} modify the map in place. The map exclusively owns its nodes; {@link #mapValues},
 * {@link #mergeWith} and {@link #copy} build new tries and never share nodes with their sources, so a map obtained
 * from one of them is not affected by later changes to the source (and vice versa). Values are shared.
 * <p>
 * Traversals list the values in the order given by the shape: left before right in sums and products, and the
 * natural order of each leaf map. The entry and value collections are built eagerly.
 * <p>
 * Not thread-safe.
 *
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class TrieMap<K, V> implements KeyMap<K, V>
{
    private static final Logger logger = LoggerFactory.getLogger(TrieMap.class);

    static final boolean DEBUG = TrieProperties.TRIE_DEBUG.getBoolean();
    static
    {
        if (DEBUG)
            logger.info("Verifying trie invariants after every modification ({} is set)",
                        TrieProperties.TRIE_DEBUG.getKey());
    }

    private final DerivedKey<K, Object> key;
    private final int nesting;
    private ShapeTrie<Object, V> root;

    @SuppressWarnings("unchecked")
    TrieMap(DerivedKey<K, ?> key, int nesting)
    {
        this.key = (DerivedKey<K, Object>) key;
        this.nesting = nesting;
    }

    public static <K, V> TrieMap<K, V> empty(DerivedKey<K, ?> key)
    {
        return key.newMap();
    }

    /**
     * Build a map by inserting the given pairs in order. A later pair replaces an earlier one with the same key.
     */
    public static <K, V> TrieMap<K, V> fromPairs(DerivedKey<K, ?> key, Iterable<? extends Map.Entry<? extends K, ? extends V>> pairs)
    {
        TrieMap<K, V> map = key.newMap();
        for (Map.Entry<? extends K, ? extends V> pair : pairs)
            map.put(pair.getKey(), pair.getValue());
        return map;
    }

    public static <K, V> TrieMap<K, V> fromMap(DerivedKey<K, ?> key, Map<? extends K, ? extends V> source)
    {
        return fromPairs(key, source.entrySet());
    }

    /**
     * Merge multiple maps in order. Where more than one source holds a value for the same key, the values are
     * combined left to right, i.e. {@code resolve(resolve(v1, v2), v3)}. The result shares no nodes with the sources.
     */
    public static <K, V> TrieMap<K, V> merge(DerivedKey<K, ?> key,
                                             Collection<? extends TrieMap<K, V>> sources,
                                             MergeResolver<V> resolver)
    {
        switch (sources.size())
        {
        case 0:
            return key.newMap();
        case 1:
            return sources.iterator().next().copy();
        default:
            Iterator<? extends TrieMap<K, V>> it = sources.iterator();
            TrieMap<K, V> result = it.next();
            while (it.hasNext())
                result = result.mergeWith(it.next(), resolver);
            return result;
        }
    }

    public DerivedKey<K, ?> key()
    {
        return key;
    }

    @Override
    public V get(K k)
    {
        if (root == null)
            return null;
        return root.get(key.toShape(k));
    }

    @Override
    public void put(K k, V value)
    {
        Preconditions.checkNotNull(value);
        Object shapeKey = key.toShape(k);
        if (root == null)
            root = key.shape().singleton(shapeKey, value, nesting);
        else
            root = root.put(shapeKey, value);

        if (DEBUG)
            checkInvariants();
    }

    @Override
    public void remove(K k)
    {
        if (root == null)
            return;
        root = root.remove(key.toShape(k));

        if (DEBUG)
            checkInvariants();
    }

    @Override
    public boolean isEmpty()
    {
        return root == null;
    }

    @Override
    public <W> TrieMap<K, W> mapValues(Function<? super V, ? extends W> mapper)
    {
        TrieMap<K, W> result = new TrieMap<>(key, nesting);
        if (root != null)
            result.root = root.mapValues(mapper);
        return result;
    }

    @Override
    public <R> R fold(R initial, BiFunction<R, ? super V, R> folder, Direction direction)
    {
        if (root == null)
            return initial;
        return root.fold(initial, folder, direction);
    }

    @Override
    public void forEachEntry(BiConsumer<? super K, ? super V> consumer, Direction direction)
    {
        if (root != null)
            root.forEachEntry((shapeKey, value) -> consumer.accept(key.fromShape(shapeKey), value), direction);
    }

    /**
     * Returns the entries of the map in the given order.
     */
    public Iterable<Map.Entry<K, V>> entrySet(Direction direction)
    {
        ImmutableList.Builder<Map.Entry<K, V>> entries = ImmutableList.builder();
        forEachEntry((k, v) -> entries.add(Maps.immutableEntry(k, v)), direction);
        return entries.build();
    }

    public Iterable<Map.Entry<K, V>> entrySet()
    {
        return entrySet(Direction.FORWARD);
    }

    public Iterator<Map.Entry<K, V>> entryIterator(Direction direction)
    {
        return entrySet(direction).iterator();
    }

    public Iterator<Map.Entry<K, V>> entryIterator()
    {
        return entryIterator(Direction.FORWARD);
    }

    /**
     * Returns the values of the map in the given order.
     */
    public Iterable<V> values(Direction direction)
    {
        ImmutableList.Builder<V> values = ImmutableList.builder();
        forEachValue(values::add, direction);
        return values.build();
    }

    public Iterable<V> values()
    {
        return values(Direction.FORWARD);
    }

    @Override
    public TrieMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver)
    {
        return mergeWith(other, resolver, UnaryOperator.identity());
    }

    @Override
    public TrieMap<K, V> mergeWith(KeyMap<K, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
    {
        TrieMap<K, V> that = (TrieMap<K, V>) other;
        TrieMap<K, V> result = new TrieMap<>(key, nesting);
        if (root == null)
            result.root = that.root == null ? null : that.root.mapValues(copier);
        else if (that.root == null)
            result.root = root.mapValues(copier);
        else
            result.root = root.mergeWith(that.root, resolver, copier);
        return result;
    }

    @Override
    public TrieMap<K, V> copy()
    {
        return mapValues(Function.identity());
    }

    @Override
    public void checkInvariants()
    {
        if (root != null)
            root.checkInvariants();
    }

    @VisibleForTesting
    ShapeTrie<Object, V> root()
    {
        return root;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof TrieMap && Objects.equals(root, ((TrieMap<?, ?>) o).root);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(root);
    }
}
