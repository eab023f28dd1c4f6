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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The subject contains exactly the expected elements, each as often as expected,
 * in any order.
 */
public class IteratorContainsExactlyInAnyOrder implements Expectation<Object> {

    private final List<Object> expected;

    private List<Object> items;

    private final Set<Integer> missing = new TreeSet<>();
    private final Set<Integer> extra = new TreeSet<>();

    public IteratorContainsExactlyInAnyOrder(List<?> expected) {
        this.expected = new ArrayList<>(expected);
    }

    @Override
    public boolean test(Object subject) {
        items = Items.items(subject);
        missing.clear();
        extra.clear();
        if (items == null) {
            for (int i = 0; i < expected.size(); i++) {
                missing.add(i);
            }
            return false;
        }
        List<Integer> unmatched = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            unmatched.add(i);
            extra.add(i);
        }
        for (int expectedIndex = 0; expectedIndex < expected.size(); expectedIndex++) {
            Object value = expected.get(expectedIndex);
            Integer found = null;
            for (Integer index : unmatched) {
                if (Objects.deepEquals(items.get(index), value)) {
                    found = index;
                    break;
                }
            }
            if (found != null) {
                unmatched.remove(found);
                extra.remove(found);
            } else {
                missing.add(expectedIndex);
            }
        }
        return missing.isEmpty() && extra.isEmpty();
    }

    @Override
    public String message(Expression expression, Object actual, boolean inverted, DiffFormat format) {
        String markedActual = items == null
                ? Marker.markUnexpected(null, format)
                : Marker.markSelectedItems(items, extra, format.actual());
        return "expected " + expression + " to contain exactly in any order " + Debug.format(expected)
                + "\n   but was: " + markedActual
                + "\n  expected: " + Marker.markSelectedItems(expected, missing, format.expected())
                + "\n   missing: " + Debug.format(Items.selected(missing, expected))
                + "\n     extra: " + Debug.format(Items.selected(extra, items));
    }

}
