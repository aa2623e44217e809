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
 * Shape of a type without values. No key can reach a void position, so no value can ever be stored there and no node
 * type exists for it; a request to create one means the key's shape bijection is broken.
 */
public final class VoidShape extends Shape<Void>
{
    static final VoidShape INSTANCE = new VoidShape();

    private VoidShape()
    {
    }

    @Override
    public Kind kind()
    {
        return Kind.VOID;
    }

    @Override
    <V> ShapeTrie<Void, V> singleton(Void key, V value, int nesting)
    {
        throw new AssertionError("Attempted to store a value at a void shape position");
    }

    @Override
    public String toString()
    {
        return "Void";
    }
}
