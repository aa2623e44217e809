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
 * Resolver of values present for the same key in both sources of a merge.
 * <p>
 * The resolver is only called when both sources hold a value; a value present in one source only is carried
 * through unchanged. No default policy exists, the caller always chooses one.
 */
@FunctionalInterface
public interface MergeResolver<V>
{
    /**
     * Combine the two values. {@code left} always comes from the map whose {@code mergeWith} was called (or the
     * earlier source of a multi-way merge), {@code right} from the other one. Must not return null.
     */
    V resolve(V left, V right);

    /**
     * Returns a resolver that throws whenever both sources hold a value for the same key. Can be used to merge
     * maps that are known to have distinct keys.
     */
    @SuppressWarnings("unchecked")
    static <V> MergeResolver<V> throwing()
    {
        return (MergeResolver<V>) THROWING;
    }

    MergeResolver<Object> THROWING = (left, right) -> {
        throw new AssertionError("Distinct maps expected, but both contain a value for the same key: " +
                                 left + " and " + right);
    };
}
