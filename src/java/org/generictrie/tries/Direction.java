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
 * The direction of a traversal. Forward traversals list left sides of sums and products first, and leaf map
 * entries in ascending key order; reverse traversals list everything in the opposite order.
 */
public enum Direction
{
    FORWARD(1)
    {
        public int start(int left, int right)
        {
            return left;
        }

        public int end(int left, int right)
        {
            return right;
        }

        public boolean le(int left, int right)
        {
            return left <= right;
        }

        public <T> T first(T left, T right)
        {
            return left;
        }

        public boolean isForward()
        {
            return true;
        }

        public Direction opposite()
        {
            return REVERSE;
        }
    },
    REVERSE(-1)
    {
        public int start(int left, int right)
        {
            return right;
        }

        public int end(int left, int right)
        {
            return left;
        }

        public boolean le(int left, int right)
        {
            return left >= right;
        }

        public <T> T first(T left, T right)
        {
            return right;
        }

        public boolean isForward()
        {
            return false;
        }

        public Direction opposite()
        {
            return FORWARD;
        }
    };

    /** Value that needs to be added to advance the iteration, i.e. value corresponding to 1 */
    public final int increase;

    Direction(int increase)
    {
        this.increase = increase;
    }

    /** Returns the value to start iteration with, i.e. the bound corresponding to l for the forward direction */
    public abstract int start(int l, int r);
    /** Returns the value to end iteration with, i.e. the bound corresponding to r for the forward direction */
    public abstract int end(int l, int r);
    /** Returns the result of the operation corresponding to a<=b for the forward direction */
    public abstract boolean le(int a, int b);
    /** Returns the alternative to visit first: the left one for the forward direction */
    public abstract <T> T first(T left, T right);

    /** Returns the alternative to visit second: the right one for the forward direction */
    public <T> T second(T left, T right)
    {
        return opposite().first(left, right);
    }

    public abstract boolean isForward();

    public abstract Direction opposite();
}
