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
 * Thrown when inserting a key would create a derived map nested deeper than
 * {@link TrieProperties#MAX_KEY_NESTING}, e.g. a sequence key longer than that limit. The map is left unchanged.
 */
public class KeyNestingException extends IllegalArgumentException
{
    public KeyNestingException(int nesting, int limit)
    {
        super("Key nesting " + nesting + " exceeds the limit of " + limit + " set by " +
              TrieProperties.MAX_KEY_NESTING.getKey());
    }
}
