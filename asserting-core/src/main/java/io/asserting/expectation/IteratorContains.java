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

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Element membership in an {@link Iterable} or array subject. When inverted the
 * message highlights the elements equal to the unexpected one.
 */
public class IteratorContains implements Expectation<Object>, Invertible {

    private final Object expected;

    private List<Object> items;

    public IteratorContains(Object expected) {
        this.expected = expected;
    }

    @Override
    public boolean test(Object subject) {
        items = Items.items(subject);
        if (items == null) {
            return false;
        }
        for (Object item : items) {
            if (Objects.deepEquals(item, expected)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String message(Expression expression, Object actual, boolean inverted, DiffFormat format) {
        String not = inverted ? "not " : "";
        String markedActual;
        if (items == null) {
            markedActual = Marker.markUnexpected(null, format);
        } else if (inverted) {
            Set<Integer> found = new TreeSet<>();
            for (int i = 0; i < items.size(); i++) {
                if (Objects.deepEquals(items.get(i), expected)) {
                    found.add(i);
                }
            }
            markedActual = Marker.markSelectedItems(items, found, format.actual());
        } else {
            markedActual = Marker.markAllItems(items, format.actual());
        }
        return "expected " + expression + " to " + not + "contain " + Debug.format(expected)
                + "\n   but was: " + markedActual
                + "\n  expected: " + not + Marker.markMissing(expected, format);
    }

}
