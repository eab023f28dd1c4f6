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

import io.asserting.output.DiffFormat;
import io.asserting.output.Marker;
import io.asserting.spec.Expectation;
import io.asserting.spec.Expression;
import io.asserting.spec.Invertible;

public class IsNegative implements Expectation<Number>, Invertible {

    @Override
    public boolean test(Number subject) {
        return subject != null && Numbers.isNegative(subject);
    }

    @Override
    public String message(Expression expression, Number actual, boolean inverted, DiffFormat format) {
        String not = inverted ? "not " : "";
        String expected = inverted ? ">= 0" : "< 0";
        return "expected " + expression + " to be " + not + "negative"
                + "\n   but was: " + Marker.markUnexpected(actual, format)
                + "\n  expected: " + Marker.markMissingSubstr(expected, format);
    }

}
