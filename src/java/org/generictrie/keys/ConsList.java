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
package org.generictrie.keys;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable list made of a head element and a tail list, used to rebuild sequence keys during traversals. Each
 * level of a sequence trie adds its element in constant time; the elements are copied into a flat list the first
 * time the list is accessed.
 */
final class ConsList<E> extends AbstractList<E> implements RandomAccess
{
    private E head;
    private List<E> tail;
    private ImmutableList<E> flat;

    ConsList(E head, List<E> tail)
    {
        this.head = Preconditions.checkNotNull(head);
        this.tail = Preconditions.checkNotNull(tail);
    }

    private ImmutableList<E> flat()
    {
        if (flat == null)
        {
            ImmutableList.Builder<E> elements = ImmutableList.builder();
            ConsList<E> current = this;
            while (true)
            {
                elements.add(current.head);
                if (!(current.tail instanceof ConsList) || ((ConsList<E>) current.tail).flat != null)
                {
                    elements.addAll(current.tail);
                    break;
                }
                current = (ConsList<E>) current.tail;
            }
            flat = elements.build();
            head = null;
            tail = null;
        }
        return flat;
    }

    @Override
    public E get(int index)
    {
        return flat().get(index);
    }

    @Override
    public int size()
    {
        return flat().size();
    }
}
