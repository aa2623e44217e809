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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * System properties that configure the tries. Values are read from {@link System#getProperty} on each access.
 */
public enum TrieProperties
{
    /** Verify the no-dead-branch invariant after every modification of a {@link TrieMap}. */
    TRIE_DEBUG("generictrie.trie_debug", "false"),

    /**
     * Maximum nesting of derived maps, i.e. the maximum number of recursive {@link FieldShape field} steps a key can
     * take. For sequence keys this is the maximum sequence length. Bounds the recursion depth of all operations:
     * traversals take roughly a dozen stack frames per level and merges about eight, so with the default every
     * operation stays well within the default 1MiB thread stack. Higher limits need a larger stack ({@code -Xss}).
     */
    MAX_KEY_NESTING("generictrie.max_key_nesting", "128");

    private static final Logger logger = LoggerFactory.getLogger(TrieProperties.class);

    private final String key;
    private final String defaultValue;

    TrieProperties(String key, String defaultValue)
    {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey()
    {
        return key;
    }

    public String getString()
    {
        return System.getProperty(key, defaultValue);
    }

    public boolean getBoolean()
    {
        String value = getString().trim();
        if ("true".equalsIgnoreCase(value))
            return true;
        if ("false".equalsIgnoreCase(value))
            return false;
        logger.warn("Invalid value {} for {}, using the default {}", value, key, defaultValue);
        return Boolean.parseBoolean(defaultValue);
    }

    public int getInt()
    {
        String value = getString();
        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e)
        {
            logger.warn("Invalid value {} for {}, using the default {}", value, key, defaultValue);
            return Integer.parseInt(defaultValue);
        }
    }

    public void setString(String value)
    {
        System.setProperty(key, value);
    }

    public void setInt(int value)
    {
        setString(Integer.toString(value));
    }

    public void setBoolean(boolean value)
    {
        setString(Boolean.toString(value));
    }

    public void reset()
    {
        System.clearProperty(key);
    }
}
