/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.asserting.expectation;

import io.asserting.spec.Expectation;
import io.asserting.spec.Invertible;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Factory methods for expectations, meant to be statically imported:
 * <pre>
 * assertThat(answer).expecting(all(
 *         rec(isPositive()),
 *         rec(not(isEqualTo(41)))));
 * </pre>
 */
public final class Expectations {

    private Expectations() {
        // only static methods
    }

    // ========== Combinators ==========

    public static <S, E extends Expectation<S> & Invertible> Not<S> not(E expectation) {
        return new Not<S>(expectation);
    }

    public static <S> Rec<S> rec(Expectation<? super S> expectation) {
        return new Rec<>(expectation);
    }

    @SafeVarargs
    public static <S> All<S> all(Rec<S>... legs) {
        return new All<>(Arrays.asList(legs));
    }

    public static <S> All<S> all(List<Rec<S>> legs) {
        return new All<>(legs);
    }

    @SafeVarargs
    public static <S> Any<S> any(Rec<S>... legs) {
        return new Any<>(Arrays.asList(legs));
    }

    public static <S> Any<S> any(List<Rec<S>> legs) {
        return new Any<>(legs);
    }

    // ========== General ==========

    public static IsEqualTo isEqualTo(Object expected) {
        return new IsEqualTo(expected);
    }

    public static <S> Satisfies<S> satisfies(Predicate<? super S> predicate) {
        return new Satisfies<>(predicate);
    }

    // ========== Numbers ==========

    public static IsZero isZero() {
        return new IsZero();
    }

    public static IsOne isOne() {
        return new IsOne();
    }

    public static IsPositive isPositive() {
        return new IsPositive();
    }

    public static IsNegative isNegative() {
        return new IsNegative();
    }

    public static <S extends Comparable<? super S>> IsGreaterThan<S> isGreaterThan(S expected) {
        return new IsGreaterThan<>(expected);
    }

    public static <S extends Comparable<? super S>> IsLessThan<S> isLessThan(S expected) {
        return new IsLessThan<>(expected);
    }

    public static <S extends Comparable<? super S>> IsBetween<S> isBetween(S min, S max) {
        return new IsBetween<>(min, max);
    }

    // ========== Strings and collections ==========

    public static StringContains stringContains(String expected) {
        return new StringContains(expected);
    }

    public static IteratorContains iteratorContains(Object expected) {
        return new IteratorContains(expected);
    }

    public static IteratorContainsExactlyInAnyOrder iteratorContainsExactlyInAnyOrder(Object... expected) {
        return new IteratorContainsExactlyInAnyOrder(Arrays.asList(expected));
    }

    public static IteratorContainsExactlyInAnyOrder iteratorContainsExactlyInAnyOrder(Iterable<?> expected) {
        return new IteratorContainsExactlyInAnyOrder(toList(expected));
    }

    public static IteratorContainsExactly iteratorContainsExactly(Object... expected) {
        return new IteratorContainsExactly(Arrays.asList(expected));
    }

    public static IteratorContainsExactly iteratorContainsExactly(Iterable<?> expected) {
        return new IteratorContainsExactly(toList(expected));
    }

    private static List<Object> toList(Iterable<?> iterable) {
        List<Object> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }

}
