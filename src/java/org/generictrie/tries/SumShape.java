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

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.base.Preconditions;

import org.generictrie.utils.Either;

/**
 * Shape of a position holding either a left or a right value. Its node holds a node for each side that has values;
 * a side without values is not represented at all.
 */
public final class SumShape<L, R> extends Shape<Either<L, R>>
{
    /**
     * The sides that are present in a sum node.
     */
    public enum Form
    {
        LEFT, RIGHT, BOTH
    }

    private final Shape<L> left;
    private final Shape<R> right;

    SumShape(Shape<L> left, Shape<R> right)
    {
        this.left = Preconditions.checkNotNull(left);
        this.right = Preconditions.checkNotNull(right);
    }

    public Shape<L> left()
    {
        return left;
    }

    public Shape<R> right()
    {
        return right;
    }

    @Override
    public Kind kind()
    {
        return Kind.SUM;
    }

    @Override
    <V> Node<L, R, V> singleton(Either<L, R> key, V value, int nesting)
    {
        if (key.isLeft())
            return new Node<>(this, nesting, left.singleton(key.getLeft(), value, nesting), null);
        else
            return new Node<>(this, nesting, null, right.singleton(key.getRight(), value, nesting));
    }

    @Override
    public String toString()
    {
        return "Sum(" + left + ", " + right + ")";
    }

    static final class Node<L, R, V> extends ShapeTrie<Either<L, R>, V>
    {
        private final SumShape<L, R> shape;
        private final int nesting;
        private ShapeTrie<L, V> left;
        private ShapeTrie<R, V> right;

        Node(SumShape<L, R> shape, int nesting, ShapeTrie<L, V> left, ShapeTrie<R, V> right)
        {
            assert left != null || right != null : "Sum node must have at least one side";
            this.shape = shape;
            this.nesting = nesting;
            this.left = left;
            this.right = right;
        }

        Form form()
        {
            if (left == null)
                return Form.RIGHT;
            return right == null ? Form.LEFT : Form.BOTH;
        }

        @Override
        V get(Either<L, R> key)
        {
            if (key.isLeft())
                return left == null ? null : left.get(key.getLeft());
            else
                return right == null ? null : right.get(key.getRight());
        }

        @Override
        Node<L, R, V> put(Either<L, R> key, V value)
        {
            if (key.isLeft())
                left = left == null ? shape.left.singleton(key.getLeft(), value, nesting)
                                    : left.put(key.getLeft(), value);
            else
                right = right == null ? shape.right.singleton(key.getRight(), value, nesting)
                                      : right.put(key.getRight(), value);
            return this;
        }

        @Override
        Node<L, R, V> remove(Either<L, R> key)
        {
            if (key.isLeft())
            {
                if (left == null)
                    return this;
                left = left.remove(key.getLeft());
            }
            else
            {
                if (right == null)
                    return this;
                right = right.remove(key.getRight());
            }
            return left == null && right == null ? null : this;
        }

        @Override
        <W> Node<L, R, W> mapValues(Function<? super V, ? extends W> mapper)
        {
            return new Node<>(shape,
                              nesting,
                              left == null ? null : left.mapValues(mapper),
                              right == null ? null : right.mapValues(mapper));
        }

        @Override
        <A> A fold(A initial, BiFunction<A, ? super V, A> folder, Direction direction)
        {
            ShapeTrie<?, V> first = direction.first(left, right);
            ShapeTrie<?, V> second = direction.second(left, right);
            A acc = initial;
            if (first != null)
                acc = first.fold(acc, folder, direction);
            if (second != null)
                acc = second.fold(acc, folder, direction);
            return acc;
        }

        @Override
        void forEachEntry(BiConsumer<? super Either<L, R>, ? super V> consumer, Direction direction)
        {
            if (direction.isForward())
            {
                forEachLeft(consumer, direction);
                forEachRight(consumer, direction);
            }
            else
            {
                forEachRight(consumer, direction);
                forEachLeft(consumer, direction);
            }
        }

        private void forEachLeft(BiConsumer<? super Either<L, R>, ? super V> consumer, Direction direction)
        {
            if (left != null)
                left.forEachEntry((key, value) -> consumer.accept(Either.left(key), value), direction);
        }

        private void forEachRight(BiConsumer<? super Either<L, R>, ? super V> consumer, Direction direction)
        {
            if (right != null)
                right.forEachEntry((key, value) -> consumer.accept(Either.right(key), value), direction);
        }

        @Override
        Node<L, R, V> mergeWith(ShapeTrie<Either<L, R>, V> other, MergeResolver<V> resolver, UnaryOperator<V> copier)
        {
            Node<L, R, V> that = sameShape(other, Node.class);
            return new Node<>(shape,
                              nesting,
                              mergeSide(left, that.left, resolver, copier),
                              mergeSide(right, that.right, resolver, copier));
        }

        private static <S, V> ShapeTrie<S, V> mergeSide(ShapeTrie<S, V> mine,
                                                       ShapeTrie<S, V> theirs,
                                                       MergeResolver<V> resolver,
                                                       UnaryOperator<V> copier)
        {
            if (mine == null)
                return theirs == null ? null : theirs.mapValues(copier);
            if (theirs == null)
                return mine.mapValues(copier);
            return mine.mergeWith(theirs, resolver, copier);
        }

        @Override
        void checkInvariants()
        {
            if (left == null && right == null)
                throw new AssertionError("Sum node without a left or right side");
            if (left != null)
                left.checkInvariants();
            if (right != null)
                right.checkInvariants();
        }

        @Override
        public boolean equals(Object o)
        {
            if (!(o instanceof Node))
                return false;
            Node<?, ?, ?> that = (Node<?, ?, ?>) o;
            return Objects.equals(left, that.left) && Objects.equals(right, that.right);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(left, right);
        }
    }
}
