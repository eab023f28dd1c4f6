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

/**
 * Records the outcome of the wrapped expectation. The message is empty unless the
 * last test failed, so combinators can concatenate the messages of all legs and
 * only failing legs show up.
 */
public class Rec<S> implements Expectation<S> {

    private final Expectation<? super S> expectation;
    private Boolean result;

    public Rec(Expectation<? super S> expectation) {
        this.expectation = expectation;
    }

    @Override
    public boolean test(S subject) {
        boolean passed = expectation.test(subject);
        result = passed;
        return passed;
    }

    public boolean isSuccess() {
        return Boolean.TRUE.equals(result);
    }

    public boolean isFailure() {
        return Boolean.FALSE.equals(result);
    }

    @Override
    public String message(Expression expression, S actual, boolean inverted, DiffFormat format) {
        if (result == null) {
            throw new IllegalStateException("message requested before the expectation has been tested");
        }
        if (result) {
            return "";
        }
        return expectation.message(expression, actual, inverted, format) + "\n";
    }

}
