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

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.RandomAccess;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.generictrie.tries.BooleanKeyMap;
import org.generictrie.tries.DerivedKey;
import org.generictrie.tries.IntKeyMap;
import org.generictrie.tries.OrderedKeyMap;
import org.generictrie.tries.Shape;
import org.generictrie.tries.TrieKey;
import org.generictrie.utils.Either;
import org.generictrie.utils.Pair;
import org.generictrie.utils.Unit;

/**
 * Key descriptors for common key types.
 * <p>
 * Primitive types map directly to one of the leaf maps. Composite types are described by their shapes only, and
 * get their maps from the generic trie:
 * <ul>
 * <li>{@link #optional}: {@code Sum(Unit, Field(E))},</li>
 * <li>{@link #either}: {@code Sum(Field(L), Field(R))},</li>
 * <li>{@link #pair} and {@link #tuple}: a right-nested chain of {@code Product}s of {@code Field}s,</li>
 * <li>{@link #list} and {@link #string}: {@code Sum(Unit, Product(Field(E), Field(List<E>)))}, i.e. empty or
 *     (head, tail), which turns the trie into a prefix trie,</li>
 * <li>{@link #enumKey}: a balanced tree of {@code Sum}s with a {@code Unit} for each constant.</li>
 * </ul>
 */
public final class TrieKeys
{
    public static final TrieKey<Byte> BYTE = IntKeyMap.key("Byte", Byte::intValue, i -> (byte) i);
    public static final TrieKey<Short> SHORT = IntKeyMap.key("Short", Short::intValue, i -> (short) i);
    public static final TrieKey<Byte> UNSIGNED_BYTE = IntKeyMap.key("UnsignedByte", Byte::toUnsignedInt, i -> (byte) i);
    public static final TrieKey<Short> UNSIGNED_SHORT = IntKeyMap.key("UnsignedShort", Short::toUnsignedInt, i -> (short) i);
    public static final TrieKey<Integer> INTEGER = IntKeyMap.key("Integer", Integer::intValue, Integer::valueOf);
    public static final TrieKey<Character> CHARACTER = IntKeyMap.key("Character", Character::charValue, i -> (char) i);
    public static final TrieKey<Integer> CODE_POINT = IntKeyMap.key("CodePoint", TrieKeys::checkCodePoint, Integer::valueOf);

    public static final TrieKey<Long> LONG = OrderedKeyMap.key("Long", Comparator.<Long>naturalOrder());
    public static final TrieKey<BigInteger> BIG_INTEGER = OrderedKeyMap.key("BigInteger", Comparator.<BigInteger>naturalOrder());
    public static final TrieKey<Integer> UNSIGNED_INTEGER = OrderedKeyMap.key("UnsignedInteger", Integer::compareUnsigned);
    public static final TrieKey<Long> UNSIGNED_LONG = OrderedKeyMap.key("UnsignedLong", Long::compareUnsigned);

    public static final TrieKey<Boolean> BOOLEAN = BooleanKeyMap.KEY;

    private static final int MAX_TUPLE_ARITY = 7;

    private TrieKeys()
    {
    }

    private static int checkCodePoint(Integer codePoint)
    {
        Preconditions.checkArgument(Character.isValidCodePoint(codePoint), "Invalid code point %s", codePoint);
        return codePoint;
    }

    /**
     * Keys of a type with a natural order, stored in an ordered leaf map.
     */
    public static <K extends Comparable<? super K>> TrieKey<K> natural()
    {
        return OrderedKeyMap.key("Comparable", Comparator.<K>naturalOrder());
    }

    /**
     * Keys of any type with a total order given by the comparator, which must be consistent with equals.
     */
    public static <K> TrieKey<K> ordered(Comparator<? super K> comparator)
    {
        return OrderedKeyMap.key("Ordered", comparator);
    }

    public static DerivedKey<Unit, Unit> unit()
    {
        return DerivedKey.of("Unit", Shape.wrap("()", Shape.unit()), u -> u, s -> s);
    }

    public static <E> DerivedKey<Optional<E>, Either<Unit, E>> optional(TrieKey<E> element)
    {
        return DerivedKey.of("Optional<" + element + ">",
                             Shape.sum(Shape.wrap("Empty", Shape.unit()),
                                       Shape.wrap("Present", Shape.field(element))),
                             (Optional<E> value) -> value.isPresent() ? Either.<Unit, E>right(value.get())
                                                                      : Either.<Unit, E>left(Unit.UNIT),
                             (Either<Unit, E> shape) -> shape.fold(unit -> Optional.<E>empty(), Optional::of));
    }

    public static <L, R> DerivedKey<Either<L, R>, Either<L, R>> either(TrieKey<L> left, TrieKey<R> right)
    {
        return DerivedKey.of("Either<" + left + ", " + right + ">",
                             Shape.sum(Shape.wrap("Left", Shape.field(left)),
                                       Shape.wrap("Right", Shape.field(right))),
                             (Either<L, R> value) -> value,
                             (Either<L, R> shape) -> shape);
    }

    public static <A, B> DerivedKey<Pair<A, B>, Pair<A, B>> pair(TrieKey<A> first, TrieKey<B> second)
    {
        return DerivedKey.of("Pair<" + first + ", " + second + ">",
                             Shape.product(Shape.field(first), Shape.field(second)),
                             (Pair<A, B> value) -> value,
                             (Pair<A, B> shape) -> shape);
    }

    /**
     * Keys that are fixed-size lists of 2 to 7 components, each described by the key at the same position. The
     * shape is {@code Product(Field(k1), Product(Field(k2), ... Field(kn)))}.
     */
    public static DerivedKey<List<Object>, Object> tuple(TrieKey<?>... components)
    {
        Preconditions.checkArgument(components.length >= 2 && components.length <= MAX_TUPLE_ARITY,
                                    "Tuples must have between 2 and %s components, got %s",
                                    MAX_TUPLE_ARITY, components.length);
        List<TrieKey<?>> keys = ImmutableList.copyOf(components);
        return DerivedKey.of("Tuple" + keys,
                             tupleShape(keys, 0),
                             (List<Object> tuple) -> {
                                 Preconditions.checkArgument(tuple.size() == keys.size(),
                                                             "Expected a tuple of %s components, got %s",
                                                             keys.size(), tuple.size());
                                 return toTupleShape(tuple, 0);
                             },
                             (Object shape) -> fromTupleShape(shape, keys.size()));
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Shape<Object> tupleShape(List<TrieKey<?>> keys, int from)
    {
        Shape<Object> field = (Shape) Shape.field(keys.get(from));
        if (from == keys.size() - 1)
            return field;
        return (Shape) Shape.product(field, tupleShape(keys, from + 1));
    }

    private static Object toTupleShape(List<?> tuple, int from)
    {
        if (from == tuple.size() - 1)
            return tuple.get(from);
        return Pair.create(tuple.get(from), toTupleShape(tuple, from + 1));
    }

    private static List<Object> fromTupleShape(Object shape, int arity)
    {
        ImmutableList.Builder<Object> components = ImmutableList.builder();
        Object rest = shape;
        for (int i = 0; i < arity - 1; ++i)
        {
            Pair<?, ?> pair = (Pair<?, ?>) rest;
            components.add(pair.left);
            rest = pair.right;
        }
        return components.add(rest).build();
    }

    /**
     * Sequence keys. Keys sharing a prefix share the path through the trie down to the point where they diverge.
     * Sequences are limited in length by {@link org.generictrie.tries.TrieProperties#MAX_KEY_NESTING}.
     */
    public static <E> DerivedKey<List<E>, Either<Unit, Pair<E, List<E>>>> list(TrieKey<E> element)
    {
        return DerivedKey.<List<E>, Either<Unit, Pair<E, List<E>>>>recursive(
            "List<" + element + ">",
            self -> Shape.sum(Shape.wrap("Nil", Shape.unit()),
                              Shape.wrap("Cons", Shape.product(Shape.field(element), Shape.field(self)))),
            TrieKeys::uncons,
            shape -> shape.<List<E>>fold(unit -> ImmutableList.of(), cons -> new ConsList<E>(cons.left, cons.right)));
    }

    private static <E> Either<Unit, Pair<E, List<E>>> uncons(List<E> list)
    {
        if (list.isEmpty())
            return Either.left(Unit.UNIT);
        List<E> indexed = list instanceof RandomAccess ? list : ImmutableList.copyOf(list);
        return Either.right(Pair.create(indexed.get(0), indexed.subList(1, indexed.size())));
    }

    /**
     * String keys, as sequences of characters. Maps of strings share the shape, and the nested maps, of
     * {@code list(CHARACTER)}; a string is only built once its characters have all been collected.
     */
    public static DerivedKey<String, Either<Unit, Pair<Character, List<Character>>>> string()
    {
        DerivedKey<List<Character>, Either<Unit, Pair<Character, List<Character>>>> characters = list(CHARACTER);
        return DerivedKey.of("String",
                             characters.shape(),
                             (String value) -> characters.toShape(Lists.charactersOf(value)),
                             (Either<Unit, Pair<Character, List<Character>>> shape) -> join(characters.fromShape(shape)));
    }

    private static String join(List<Character> characters)
    {
        StringBuilder builder = new StringBuilder(characters.size());
        for (char c : characters)
            builder.append(c);
        return builder.toString();
    }

    /**
     * Keys of an enum type. Each constant is a unit constructor; the constructors are arranged in a balanced tree of
     * sums, so that a key takes a logarithmic number of steps. An enum without constants has the void shape.
     */
    public static <E extends Enum<E>> DerivedKey<E, Object> enumKey(Class<E> type)
    {
        E[] constants = type.getEnumConstants();
        return DerivedKey.of(type.getSimpleName(),
                             enumShape(constants, 0, constants.length),
                             (E value) -> encodeOrdinal(value.ordinal(), 0, constants.length),
                             (Object shape) -> constants[decodeOrdinal(shape, 0, constants.length)]);
    }

    public static DerivedKey<Ordering, Object> ordering()
    {
        return enumKey(Ordering.class);
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Shape<Object> enumShape(Enum<?>[] constants, int from, int to)
    {
        if (from == to)
            return (Shape) Shape.voidShape();
        if (to - from == 1)
            return (Shape) Shape.wrap(constants[from].name(), Shape.unit());
        int mid = (from + to) >>> 1;
        return (Shape) Shape.sum(enumShape(constants, from, mid), enumShape(constants, mid, to));
    }

    private static Object encodeOrdinal(int ordinal, int from, int to)
    {
        if (to - from == 1)
            return Unit.UNIT;
        int mid = (from + to) >>> 1;
        return ordinal < mid ? Either.left(encodeOrdinal(ordinal, from, mid))
                             : Either.right(encodeOrdinal(ordinal, mid, to));
    }

    private static int decodeOrdinal(Object shape, int from, int to)
    {
        if (to - from == 1)
            return from;
        int mid = (from + to) >>> 1;
        Either<?, ?> choice = (Either<?, ?>) shape;
        return choice.isLeft() ? decodeOrdinal(choice.getLeft(), from, mid)
                               : decodeOrdinal(choice.getRight(), mid, to);
    }
}
