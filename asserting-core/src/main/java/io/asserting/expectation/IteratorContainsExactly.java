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
 * The subject contains exactly the expected elements in the expected order.
 * Elements that are present but at another position are reported as out of order
 * rather than as missing and extra.
 */
public class IteratorContainsExactly implements Expectation<Object> {

    private final List<Object> expected;

    private List<Object> items;

    private final Set<Integer> missing = new TreeSet<>();
    private final Set<Integer> extra = new TreeSet<>();
    private final Set<Integer> outOfOrder = new TreeSet<>();

    public IteratorContainsExactly(List<?> expected) {
        this.expected = new ArrayList<>(expected);
    }

    @Override
    public boolean test(Object subject) {
        items = Items.items(subject);
        missing.clear();
        extra.clear();
        outOfOrder.clear();
        if (items == null) {
            for (int i = 0; i < expected.size(); i++) {
                missing.add(i);
            }
            return false;
        }
        List<Integer> maybeMissing = new ArrayList<>();
        List<Integer> maybeExtra = new ArrayList<>();
        int size = Math.max(items.size(), expected.size());
        for (int i = 0; i < size; i++) {
            if (i >= items.size()) {
                maybeMissing.add(i);
            } else if (i >= expected.size()) {
                maybeExtra.add(i);
            } else if (!Objects.deepEquals(items.get(i), expected.get(i))) {
                maybeMissing.add(i);
                maybeExtra.add(i);
            }
        }
        for (int expectedIndex : maybeMissing) {
            Object value = expected.get(expectedIndex);
            Integer found = null;
            for (Integer index : maybeExtra) {
                if (Objects.deepEquals(items.get(index), value)) {
                    found = index;
                    break;
                }
            }
            if (found != null) {
                maybeExtra.remove(found);
                outOfOrder.add(found);
            } else {
                missing.add(expectedIndex);
            }
        }
        extra.addAll(maybeExtra);
        return missing.isEmpty() && extra.isEmpty() && outOfOrder.isEmpty();
    }

    @Override
    public String message(Expression expression, Object actual, boolean inverted, DiffFormat format) {
        if (items == null) {
            return "expected " + expression + " to contain exactly in order " + Debug.format(expected)
                    + "\n       but was: " + Marker.markUnexpected(null, format)
                    + "\n      expected: " + Marker.markAllItems(expected, format.expected())
                    + "\n       missing: " + Debug.format(expected)
                    + "\n         extra: []"
                    + "\n  out-of-order: []";
        }
        List<Object> outOfOrderValues = Items.selected(outOfOrder, items);
        Set<Integer> expectedMarks = new TreeSet<>(missing);
        for (int i = 0; i < expected.size(); i++) {
            if (Items.indexOf(outOfOrderValues, expected.get(i)) >= 0) {
                expectedMarks.add(i);
            }
        }
        Set<Integer> actualMarks = new TreeSet<>(extra);
        actualMarks.addAll(outOfOrder);
        return "expected " + expression + " to contain exactly in order " + Debug.format(expected)
                + "\n       but was: " + Marker.markSelectedItems(items, actualMarks, format.actual())
                + "\n      expected: " + Marker.markSelectedItems(expected, expectedMarks, format.expected())
                + "\n       missing: " + Debug.format(Items.selected(missing, expected))
                + "\n         extra: " + Debug.format(Items.selected(extra, items))
                + "\n  out-of-order: " + Debug.format(outOfOrderValues);
    }

}
