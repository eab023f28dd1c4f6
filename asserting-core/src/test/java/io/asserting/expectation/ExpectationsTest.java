package io.asserting.expectation;

import io.asserting.output.DiffFormat;
import io.asserting.output.Highlight;
import io.asserting.spec.Expression;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;

import static io.asserting.expectation.Expectations.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpectationsTest {

    static final Expression EXPR = Expression.of("value");
    static final DiffFormat PLAIN = DiffFormat.NO_HIGHLIGHT;
    static final DiffFormat MARKED = new DiffFormat(new Highlight("<<", ">>"), new Highlight(">>", "<<"));

    @Test
    void testIsEqualTo() {
        IsEqualTo e = isEqualTo("Hello World!");
        assertTrue(e.test("Hello World!"));
        assertFalse(e.test("Hello Welt!"));
        assertEquals("expected value to be equal to \"Hello World!\"\n"
                        + "   but was: \"Hello W<<e>>l<<t>>!\"\n"
                        + "  expected: \"Hello W>>or<<l>>d<<!\"",
                e.message(EXPR, "Hello Welt!", false, MARKED));
    }

    @Test
    void testIsEqualToArrays() {
        assertTrue(isEqualTo(new int[]{1, 2}).test(new int[]{1, 2}));
        assertFalse(isEqualTo(new int[]{1, 2}).test(new int[]{2, 1}));
        assertTrue(isEqualTo(null).test(null));
    }

    @Test
    void testIsNotEqualToMessage() {
        assertEquals("expected value to be not equal to 7\n   but was: <<7>>\n  expected: not >>7<<",
                isEqualTo(7).message(EXPR, 7, true, MARKED));
    }

    @Test
    void testSatisfies() {
        Satisfies<Integer> odd = satisfies(n -> n % 2 == 1);
        assertTrue(odd.test(37));
        assertFalse(odd.test(22));
        assertEquals("expected value to satisfy the given predicate, but returned false",
                odd.message(EXPR, 22, false, PLAIN));
        assertEquals("expected value to satisfy the given predicate, but returned true",
                odd.message(EXPR, 37, true, PLAIN));
        assertEquals("expected my number to be odd",
                odd.withMessage("expected my number to be odd").message(EXPR, 22, false, PLAIN));
    }

    @ParameterizedTest
    @CsvSource({
            "0,true,false,false,false",
            "1,false,true,true,false",
            "-3,false,false,false,true",
            "42,false,false,true,false"})
    void testNumberChecks(long value, boolean zero, boolean one, boolean positive, boolean negative) {
        for (Number n : List.<Number>of(value, (int) value, (double) value, BigDecimal.valueOf(value), BigInteger.valueOf(value))) {
            assertEquals(zero, isZero().test(n), "zero " + n);
            assertEquals(one, isOne().test(n), "one " + n);
            assertEquals(positive, isPositive().test(n), "positive " + n);
            assertEquals(negative, isNegative().test(n), "negative " + n);
        }
    }

    @Test
    void testNaN() {
        assertFalse(isZero().test(Double.NaN));
        assertFalse(isPositive().test(Double.NaN));
        assertFalse(isNegative().test(Double.NaN));
        assertTrue(isOne().test(new BigDecimal("1.00")));
    }

    @Test
    void testNumberMessages() {
        assertEquals("expected value to be zero\n   but was: 5\n  expected: 0",
                isZero().message(EXPR, 5, false, PLAIN));
        assertEquals("expected value to be not zero\n   but was: 0\n  expected: not 0",
                isZero().message(EXPR, 0, true, PLAIN));
        assertEquals("expected value to be one\n   but was: 2\n  expected: 1",
                isOne().message(EXPR, 2, false, PLAIN));
        assertEquals("expected value to be positive\n   but was: -1\n  expected: > 0",
                isPositive().message(EXPR, -1, false, PLAIN));
        assertEquals("expected value to be not negative\n   but was: <<-1>>\n  expected: >>>= 0<<",
                isNegative().message(EXPR, -1, true, MARKED));
    }

    @Test
    void testOrdering() {
        assertTrue(isGreaterThan(2).test(3));
        assertFalse(isGreaterThan(2).test(2));
        assertTrue(isLessThan("b").test("a"));
        assertFalse(isLessThan("b").test("b"));
        assertEquals("expected value to be greater than 2\n   but was: 2\n  expected: > 2",
                isGreaterThan(2).message(EXPR, 2, false, PLAIN));
        assertEquals("expected value to be less than 7\n   but was: 8\n  expected: < 7",
                isLessThan(7).message(EXPR, 8, false, PLAIN));
    }

    @Test
    void testIsBetween() {
        IsBetween<Integer> between = isBetween(41, 43);
        assertTrue(between.test(41));
        assertTrue(between.test(43));
        assertFalse(between.test(40));
        assertFalse(between.test(44));
        assertEquals("expected value to be between 41 and 43\n   but was: 40\n  expected: 41 <= x <= 43",
                between.message(EXPR, 40, false, PLAIN));
        assertEquals("expected value to be between 41 and 43\n   but was: <<40>>\n  expected: >>41<< <= x <= 43",
                between.message(EXPR, 40, false, MARKED));
        assertEquals("expected value to be between 41 and 43\n   but was: <<44>>\n  expected: 41 <= x <= >>43<<",
                between.message(EXPR, 44, false, MARKED));
    }

    @Test
    void testStringContains() {
        StringContains e = stringContains("an");
        assertTrue(e.test("banana"));
        assertFalse(e.test("berry"));
        assertEquals("expected value to contain \"an\"\n   but was: \"<<berry>>\"\n  expected: \">>an<<\"",
                e.message(EXPR, "berry", false, MARKED));
        assertEquals("expected value to not contain \"an\"\n   but was: \"b<<anan>>a\"\n  expected: not \">>an<<\"",
                e.message(EXPR, "banana", true, MARKED));
        assertEquals("expected value to not contain \"an\"\n   but was: \"banana\"\n  expected: not \"an\"",
                e.message(EXPR, "banana", true, PLAIN));
    }

    @Test
    void testIteratorContains() {
        IteratorContains e = iteratorContains(2);
        assertTrue(e.test(List.of(1, 2, 3)));
        assertTrue(e.test(new int[]{2}));
        assertFalse(e.test(List.of()));
        IteratorContains containsFour = iteratorContains(4);
        assertFalse(containsFour.test(List.of(1, 2)));
        assertEquals("expected value to contain 4\n   but was: [<<1, 2>>]\n  expected: >>4<<",
                containsFour.message(EXPR, List.of(1, 2), false, MARKED));
        assertTrue(e.test(List.of(1, 2, 2, 3)));
        assertEquals("expected value to not contain 2\n   but was: [1, <<2, 2>>, 3]\n  expected: not >>2<<",
                e.message(EXPR, List.of(1, 2, 2, 3), true, MARKED));
        assertThrows(IllegalArgumentException.class, () -> e.test("not a collection"));
    }

    @Test
    void testContainsExactlyInAnyOrder() {
        IteratorContainsExactlyInAnyOrder e = iteratorContainsExactlyInAnyOrder(1, 2, 4);
        assertFalse(e.test(List.of(1, 2, 3)));
        assertEquals("expected value to contain exactly in any order [1, 2, 4]\n"
                        + "   but was: [1, 2, 3]\n"
                        + "  expected: [1, 2, 4]\n"
                        + "   missing: [4]\n"
                        + "     extra: [3]",
                e.message(EXPR, List.of(1, 2, 3), false, PLAIN));
        assertEquals("expected value to contain exactly in any order [1, 2, 4]\n"
                        + "   but was: [1, 2, <<3>>]\n"
                        + "  expected: [1, 2, >>4<<]\n"
                        + "   missing: [4]\n"
                        + "     extra: [3]",
                e.message(EXPR, List.of(1, 2, 3), false, MARKED));
    }

    @Test
    void testContainsExactlyInAnyOrderPasses() {
        IteratorContainsExactlyInAnyOrder e = iteratorContainsExactlyInAnyOrder(List.of(3, 1, 2, 1));
        assertTrue(e.test(List.of(1, 1, 2, 3)));
        assertFalse(e.test(List.of(1, 2, 3)));
        assertTrue(e.test(new Integer[]{2, 1, 3, 1}));
    }

    @Test
    void testContainsExactly() {
        IteratorContainsExactly e = iteratorContainsExactly(1, 2, 3, 4);
        assertTrue(e.test(List.of(1, 2, 3, 4)));
        assertFalse(e.test(List.of(1, 3, 2, 5)));
        assertEquals("expected value to contain exactly in order [1, 2, 3, 4]\n"
                        + "       but was: [1, <<3, 2, 5>>]\n"
                        + "      expected: [1, >>2, 3, 4<<]\n"
                        + "       missing: [4]\n"
                        + "         extra: [5]\n"
                        + "  out-of-order: [3, 2]",
                e.message(EXPR, List.of(1, 3, 2, 5), false, MARKED));
    }

    @Test
    void testContainsExactlyDifferentLength() {
        IteratorContainsExactly e = iteratorContainsExactly(List.of("a", "b"));
        assertFalse(e.test(List.of("a", "b", "c")));
        assertEquals("expected value to contain exactly in order [\"a\", \"b\"]\n"
                        + "       but was: [\"a\", \"b\", \"c\"]\n"
                        + "      expected: [\"a\", \"b\"]\n"
                        + "       missing: []\n"
                        + "         extra: [\"c\"]\n"
                        + "  out-of-order: []",
                e.message(EXPR, List.of("a", "b", "c"), false, PLAIN));
    }

    @Test
    void testNullCollectionFails() {
        IteratorContains contains = iteratorContains(1);
        assertFalse(contains.test(null));
        assertEquals("expected value to contain 1\n   but was: <<null>>\n  expected: >>1<<",
                contains.message(EXPR, null, false, MARKED));
        IteratorContainsExactlyInAnyOrder anyOrder = iteratorContainsExactlyInAnyOrder(1, 2);
        assertFalse(anyOrder.test(null));
        assertEquals("expected value to contain exactly in any order [1, 2]\n"
                        + "   but was: null\n"
                        + "  expected: [1, 2]\n"
                        + "   missing: [1, 2]\n"
                        + "     extra: []",
                anyOrder.message(EXPR, null, false, PLAIN));
        IteratorContainsExactly inOrder = iteratorContainsExactly(1, 2);
        assertFalse(inOrder.test(null));
        assertEquals("expected value to contain exactly in order [1, 2]\n"
                        + "       but was: <<null>>\n"
                        + "      expected: [>>1, 2<<]\n"
                        + "       missing: [1, 2]\n"
                        + "         extra: []\n"
                        + "  out-of-order: []",
                inOrder.message(EXPR, null, false, MARKED));
    }

    @Test
    void testSingleUseIterable() {
        Iterable<Integer> once = Stream.of(1, 2, 3)::iterator;
        IteratorContainsExactlyInAnyOrder anyOrder = iteratorContainsExactlyInAnyOrder(1, 2, 4);
        assertFalse(anyOrder.test(once));
        assertEquals("expected value to contain exactly in any order [1, 2, 4]\n"
                        + "   but was: [1, 2, 3]\n"
                        + "  expected: [1, 2, 4]\n"
                        + "   missing: [4]\n"
                        + "     extra: [3]",
                anyOrder.message(EXPR, once, false, PLAIN));
        Iterable<Integer> onceMore = Stream.of(1, 3, 2)::iterator;
        IteratorContainsExactly inOrder = iteratorContainsExactly(1, 2, 3);
        assertFalse(inOrder.test(onceMore));
        assertTrue(inOrder.message(EXPR, onceMore, false, PLAIN).endsWith("  out-of-order: [3, 2]"));
        Iterable<Integer> third = Stream.of(5, 6)::iterator;
        IteratorContains contains = iteratorContains(7);
        assertFalse(contains.test(third));
        assertEquals("expected value to contain 7\n   but was: [5, 6]\n  expected: 7",
                contains.message(EXPR, third, false, PLAIN));
    }

}
