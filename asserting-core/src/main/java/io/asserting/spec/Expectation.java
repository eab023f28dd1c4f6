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
package io.asserting.spec;

import io.asserting.output.DiffFormat;

/**
 * Defines a test for a property of the asserted subject.
 * <p>
 * {@link #test(Object)} is always called before {@link #message}. Implementations
 * may record details about the subject in {@code test} (for example the positions
 * of missing items) and read them back when the message is formed.
 *
 * @param <S> type of the subject
 */
public interface Expectation<S> {

    /**
     * Verifies whether the actual subject fulfills the expected property.
     */
    boolean test(S subject);

    /**
     * Forms the failure message for this expectation.
     *
     * @param expression name of the subject
     * @param actual     the subject that has been tested
     * @param inverted   true if the expectation has been negated
     * @param format     highlighting of differences between actual and expected
     */
    String message(Expression expression, S actual, boolean inverted, DiffFormat format);

}
