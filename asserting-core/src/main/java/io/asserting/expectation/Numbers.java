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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Sign and unit checks over the boxed number types. Floating point NaN is neither
 * zero, one, positive nor negative.
 */
final class Numbers {

    private Numbers() {
        // only static methods
    }

    static boolean isFloatingPoint(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    static boolean isZero(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.signum() == 0;
        }
        if (n instanceof BigInteger bi) {
            return bi.signum() == 0;
        }
        return isFloatingPoint(n) ? n.doubleValue() == 0.0 : n.longValue() == 0;
    }

    static boolean isOne(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.compareTo(BigDecimal.ONE) == 0;
        }
        if (n instanceof BigInteger bi) {
            return bi.equals(BigInteger.ONE);
        }
        return isFloatingPoint(n) ? n.doubleValue() == 1.0 : n.longValue() == 1;
    }

    static boolean isPositive(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.signum() > 0;
        }
        if (n instanceof BigInteger bi) {
            return bi.signum() > 0;
        }
        return isFloatingPoint(n) ? n.doubleValue() > 0.0 : n.longValue() > 0;
    }

    static boolean isNegative(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.signum() < 0;
        }
        if (n instanceof BigInteger bi) {
            return bi.signum() < 0;
        }
        return isFloatingPoint(n) ? n.doubleValue() < 0.0 : n.longValue() < 0;
    }

}
