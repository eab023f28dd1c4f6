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

import io.asserting.output.Debug;
import io.asserting.output.DiffFormat;
import io.asserting.output.Marker;
import io.asserting.spec.Expectation;
import io.asserting.spec.Expression;

public class IsGreaterThan<S extends Comparable<? super S>> implements Expectation<S> {

    private final S expected;

    public IsGreaterThan(S expected) {
        this.expected = expected;
    }

    @Override
    public boolean test(S subject) {
        return subject != null && subject.compareTo(expected) > 0;
    }

    @Override
    public String message(Expression expression, S actual, boolean inverted, DiffFormat format) {
        return "expected " + expression + " to be greater than " + Debug.format(expected)
                + "\n   but was: " + Marker.markUnexpected(actual, format)
                + "\n  expected: > " + Marker.markMissing(expected, format);
    }

}
