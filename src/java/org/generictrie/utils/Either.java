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
package org.generictrie.utils;

import java.util.function.Function;

import com.google.common.base.Preconditions;

/**
 * A value that is exactly one of a left or a right alternative. Used both as a key type (tagged union) and as
 * the value of a sum shape.
 */
public final class Either<L, R>
{
    private final Object value;
    private final boolean isLeft;

    private Either(Object value, boolean isLeft)
    {
        this.value = Preconditions.checkNotNull(value);
        this.isLeft = isLeft;
    }

    public static <L, R> Either<L, R> left(L value)
    {
        return new Either<>(value, true);
    }

    public static <L, R> Either<L, R> right(R value)
    {
        return new Either<>(value, false);
    }

    public boolean isLeft()
    {
        return isLeft;
    }

    public boolean isRight()
    {
        return !isLeft;
    }

    @SuppressWarnings("unchecked")
    public L getLeft()
    {
        Preconditions.checkState(isLeft, "getLeft called on a right value");
        return (L) value;
    }

    @SuppressWarnings("unchecked")
    public R getRight()
    {
        Preconditions.checkState(!isLeft, "getRight called on a left value");
        return (R) value;
    }

    @SuppressWarnings("unchecked")
    public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight)
    {
        return isLeft ? onLeft.apply((L) value) : onRight.apply((R) value);
    }

    @Override
    public int hashCode()
    {
        return isLeft ? value.hashCode() : ~value.hashCode();
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof Either))
            return false;
        Either<?, ?> that = (Either<?, ?>) o;
        return isLeft == that.isLeft && value.equals(that.value);
    }

    @Override
    public String toString()
    {
        return (isLeft ? "Left(" : "Right(") + value + ")";
    }
}
