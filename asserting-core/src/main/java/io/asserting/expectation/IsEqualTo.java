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
import io.asserting.spec.Invertible;

import java.util.Objects;

/**
 * Equality by {@link Objects#deepEquals(Object, Object)}, so arrays compare by
 * content. Differences between the rendered values are highlighted.
 */
public class IsEqualTo implements Expectation<Object>, Invertible {

    private final Object expected;

    public IsEqualTo(Object expected) {
        this.expected = expected;
    }

    public Object expected() {
        return expected;
    }

    @Override
    public boolean test(Object subject) {
        return Objects.deepEquals(subject, expected);
    }

    @Override
    public String message(Expression expression, Object actual, boolean inverted, DiffFormat format) {
        String not = inverted ? "not " : "";
        String markedActual;
        String markedExpected;
        if (inverted) {
            markedActual = Marker.markUnexpected(actual, format);
            markedExpected = Marker.markMissing(expected, format);
        } else {
            Marker.Marked marked = Marker.markDiff(actual, expected, format);
            markedActual = marked.actual();
            markedExpected = marked.expected();
        }
        return "expected " + expression + " to be " + not + "equal to " + Debug.format(expected)
                + "\n   but was: " + markedActual
                + "\n  expected: " + not + markedExpected;
    }

}
