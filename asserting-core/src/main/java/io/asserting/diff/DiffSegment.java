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
package io.asserting.diff;

/**
 * One run of a diff between a left (actual) and a right (expected) sequence.
 * <p>
 * For {@link Kind#ONLY_LEFT} only {@code leftIndex} is meaningful, for
 * {@link Kind#ONLY_RIGHT} only {@code rightIndex}, the unused index is -1.
 */
public record DiffSegment(Kind kind, int leftIndex, int rightIndex, int length) {

    public enum Kind {

        ONLY_LEFT,
        COMMON,
        ONLY_RIGHT

    }

    public static DiffSegment onlyLeft(int index, int length) {
        return new DiffSegment(Kind.ONLY_LEFT, index, -1, length);
    }

    public static DiffSegment common(int leftIndex, int rightIndex, int length) {
        return new DiffSegment(Kind.COMMON, leftIndex, rightIndex, length);
    }

    public static DiffSegment onlyRight(int index, int length) {
        return new DiffSegment(Kind.ONLY_RIGHT, -1, index, length);
    }

    public boolean isOnlyLeft() {
        return kind == Kind.ONLY_LEFT;
    }

    public boolean isCommon() {
        return kind == Kind.COMMON;
    }

    public boolean isOnlyRight() {
        return kind == Kind.ONLY_RIGHT;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ONLY_LEFT -> "OnlyLeft{index=" + leftIndex + ", length=" + length + "}";
            case COMMON -> "Common{leftIndex=" + leftIndex + ", rightIndex=" + rightIndex + ", length=" + length + "}";
            case ONLY_RIGHT -> "OnlyRight{index=" + rightIndex + ", length=" + length + "}";
        };
    }

}
