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
import io.asserting.spec.Expectation;
import io.asserting.spec.Expression;

import java.util.List;

/**
 * Passes if at least one leg passes. Like {@link All} every leg is tested.
 */
public class Any<S> implements Expectation<S> {

    private final List<Rec<S>> legs;

    public Any(List<Rec<S>> legs) {
        this.legs = List.copyOf(legs);
    }

    @Override
    public boolean test(S subject) {
        boolean passed = false;
        for (Rec<S> leg : legs) {
            passed |= leg.test(subject);
        }
        return passed;
    }

    @Override
    public String message(Expression expression, S actual, boolean inverted, DiffFormat format) {
        StringBuilder sb = new StringBuilder();
        for (Rec<S> leg : legs) {
            sb.append(leg.message(expression, actual, inverted, format));
        }
        return sb.toString();
    }

}
