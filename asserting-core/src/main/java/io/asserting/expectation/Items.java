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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

final class Items {

    private Items() {
        // only static methods
    }

    /**
     * Collects the elements of an iterable or array subject once, so a single-use
     * iterable can still be rendered after the test. Returns null for a null subject.
     */
    static List<Object> items(Object subject) {
        if (subject == null) {
            return null;
        }
        List<Object> items = Debug.toList(subject);
        if (items == null) {
            throw new IllegalArgumentException("not an iterable or array: " + Debug.format(subject));
        }
        return items;
    }

    static List<Object> selected(Set<Integer> indices, List<Object> items) {
        List<Object> values = new ArrayList<>(indices.size());
        for (int index : indices) {
            values.add(items.get(index));
        }
        return values;
    }

    static int indexOf(List<Object> items, Object value) {
        for (int i = 0; i < items.size(); i++) {
            if (Objects.deepEquals(items.get(i), value)) {
                return i;
            }
        }
        return -1;
    }

}
