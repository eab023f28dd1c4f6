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
package io.asserting.output;

/**
 * A pair of highlight styles, one for parts present only in the actual value
 * (unexpected) and one for parts present only in the expected value (missing).
 */
public record DiffFormat(Highlight actual, Highlight expected) {

    /**
     * Switches highlighting off entirely.
     */
    public static final DiffFormat NO_HIGHLIGHT = new DiffFormat(Highlight.NONE, Highlight.NONE);

    /**
     * Unexpected parts in red, missing parts in green.
     */
    public static final DiffFormat RED_GREEN = new DiffFormat(Highlight.ansi(Highlight.RED), Highlight.ansi(Highlight.GREEN));

    /**
     * Unexpected parts in red, missing parts in blue. Friendly to color vision deficiencies.
     */
    public static final DiffFormat RED_BLUE = new DiffFormat(Highlight.ansi(Highlight.RED), Highlight.ansi(Highlight.BLUE));

    public static final DiffFormat RED_YELLOW = new DiffFormat(Highlight.ansi(Highlight.RED), Highlight.ansi(Highlight.YELLOW));

    /**
     * Unexpected parts in bold, missing parts not highlighted. Uses no color.
     */
    public static final DiffFormat BOLD = new DiffFormat(Highlight.ansi(Highlight.BOLD), Highlight.NONE);

    public static final DiffFormat DEFAULT = RED_GREEN;

    public boolean isNoHighlight() {
        return actual.isEmpty() && expected.isEmpty();
    }

}
