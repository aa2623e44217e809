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

/**
 * Describes how to build maps keyed by {@code K}. Leaf key types supply one of the leaf maps ({@link IntKeyMap},
 * {@link OrderedKeyMap}, {@link BooleanKeyMap}); all other key types supply a {@link DerivedKey}, whose maps are
 * {@link TrieMap}s built from the key's {@link Shape}.
 *
 * @param <K> The key type.
 */
public interface TrieKey<K>
{
    /**
     * Create an empty map for this key type.
     *
     * @param nesting the number of derived maps this one is nested in, used to bound the recursion depth of
     *                recursive key types.
     */
    <V> KeyMap<K, V> newMap(int nesting);

    default <V> KeyMap<K, V> newMap()
    {
        return newMap(0);
    }
}
