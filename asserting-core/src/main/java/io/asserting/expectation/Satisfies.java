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
import io.asserting.spec.Invertible;

import java.util.Objects;
import java.util.function.Predicate;

public class Satisfies<S> implements Expectation<S>, Invertible {

    private final Predicate<? super S> predicate;
    private final String message;

    public Satisfies(Predicate<? super S> predicate) {
        this(predicate, null);
    }

    private Satisfies(Predicate<? super S> predicate, String message) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.message = message;
    }

    /**
     * Returns a copy that fails with the given message instead of the generic one.
     */
    public Satisfies<S> withMessage(String message) {
        return new Satisfies<>(predicate, message);
    }

    @Override
    public boolean test(S subject) {
        return predicate.test(subject);
    }

    @Override
    public String message(Expression expression, S actual, boolean inverted, DiffFormat format) {
        if (message != null) {
            return message;
        }
        return "expected " + expression + " to satisfy the given predicate, but returned " + inverted;
    }

}
