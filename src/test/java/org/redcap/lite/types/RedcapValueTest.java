package org.redcap.lite.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RedcapValue - REDCap's context-dependent equality, ordering and
 * arithmetic of response values.
 */
class RedcapValueTest {

    private final RedcapValues values = new RedcapValues(ValueConfig.defaults().withMissingCodes(List.of("NA-2")));

    private RedcapValue v(String raw) {
        return values.value(raw);
    }

    // ========================================
    // Equality
    // ========================================

    @Nested
    class MissingEquality {
        @Test
        void equalsEmptyZeroAndMissing() {
            RedcapValue missing = v("");
            assertTrue(missing.eq(""));
            assertTrue(missing.eq(0));
            assertTrue(missing.eq(0.0));
            assertTrue(missing.eq(v("")));
        }

        @Test
        @DisplayName("MISSING is not equal to the string \"0\"")
        void notEqualToZeroString() {
            assertFalse(v("").eq("0"));
            assertTrue(v("").ne("0"));
        }

        @Test
        void equalsValueWithZeroNumericValue() {
            assertTrue(v("").eq(v("0")));
            assertTrue(v("").eq(v("0.0")));
            assertFalse(v("").eq(v("1")));
        }

        @Test
        void notEqualToOtherNumbersOrText() {
            assertFalse(v("").eq(1));
            assertFalse(v("").eq("x"));
        }
    }

    @Nested
    class NumberEquality {
        @ParameterizedTest(name = "\"{0}\" = {1} -> {2}")
        @CsvSource({
                "1, 1, true",
                "1, 1.0, true",
                "1.0, 1, true",
                "1.0, 1.0, true",
                "25, 26, false"
        })
        void numericOperandComparesNumerically(String raw, double number, boolean expected) {
            assertEquals(expected, v(raw).eq(number));
        }

        @ParameterizedTest(name = "\"{0}\" = \"{1}\" -> {2}")
        @CsvSource({
                "1, 1, true",
                "1, 1.0, false",
                "1.0, 1.0, true",
                "1.0, 1, false"
        })
        void stringOperandComparesExactly(String raw, String text, boolean expected) {
            assertEquals(expected, v(raw).eq(text));
        }

        @Test
        void valueOperandComparesRawStrings() {
            assertTrue(v("1.0").eq(v("1.0")));
            assertFalse(v("1.0").eq(v("1")));
        }

        @Test
        void integerAndBigDecimalOperandsAreNumbers() {
            assertTrue(v("2").eq(2L));
            assertTrue(v("2.50").eq(new BigDecimal("2.5")));
        }
    }

    @Nested
    class TextEquality {
        @Test
        void comparesRawStrings() {
            assertTrue(v("Healthy").eq("Healthy"));
            assertFalse(v("Healthy").eq("healthy"));
            assertTrue(v("Healthy").eq(v("Healthy")));
        }

        @Test
        void neverEqualsANumber() {
            assertFalse(v("Healthy").eq(0));
            assertFalse(v("NA-2").eq(0));
            assertFalse(v("2024-01-01").eq(2024));
            assertTrue(v("Healthy").ne(0));
        }

        @Test
        void missingCodeEqualsItsOwnString() {
            assertEquals(Category.CODE, v("NA-2").category());
            assertTrue(v("NA-2").eq("NA-2"));
        }
    }

    // ========================================
    // Ordering
    // ========================================

    @Nested
    class Ordering {
        @Test
        void stringOperandOrdersLexicographically() {
            assertTrue(v("12").lt("13"));
            assertFalse(v("2").lt("13"));
            assertTrue(v("13").le("13"));
            assertTrue(v("13").gt("12"));
            assertFalse(v("13").gt("2"));
        }

        @Test
        @DisplayName("\"13\" < \"13.0\" by prefix although 13 == 13.0")
        void prefixRule() {
            assertTrue(v("13").lt("13.0"));
            assertFalse(v("13").gt("13.0"));
            assertTrue(v("13").eq(13.0));
        }

        @Test
        void valueOperandOrdersLexicographically() {
            assertFalse(v("2").lt(v("13")));
            assertTrue(v("13").lt(v("2")));
        }

        @Test
        void numericOperandOrdersNumerically() {
            assertTrue(v("2").lt(13));
            assertTrue(v("13").gt(2));
            assertTrue(v("12").le(13));
            assertTrue(v("13.0").ge(13));
        }

        @Test
        void missingOrdersAsZeroAgainstNumbers() {
            assertTrue(v("").lt(1));
            assertTrue(v("").ge(0));
            assertFalse(v("").gt(0));
        }

        @Test
        void textIsNeverOrderedAgainstNumbers() {
            assertFalse(v("Healthy").lt(5));
            assertFalse(v("Healthy").gt(5));
            assertFalse(v("2024-01-01").ge(0));
            assertFalse(v("NA-2").le(100));
        }

        @ParameterizedTest(name = "\"{0}\" vs \"{1}\"")
        @CsvSource({
                "a, b", "b, a", "10, 9", "abc, ab", "'', x", "Z, a", "1.5, 1.50"
        })
        void lexicographicLaw(String a, String b) {
            assertEquals(a.compareTo(b) < 0, v(a).lt(b));
            assertEquals(a.compareTo(b) > 0, v(a).gt(b));
        }
    }

    // ========================================
    // Arithmetic
    // ========================================

    @Nested
    class Arithmetic {
        @Test
        void numbersMatchDoubleArithmetic() {
            assertEquals(1.5 + 2, v("1.5").add(2));
            assertEquals(1.5 - 2, v("1.5").sub(2.0));
            assertEquals(1.5 * 4, v("1.5").mul(v("4")));
            assertEquals(1.5 / 0.5, v("1.5").div("0.5"));
        }

        @Test
        void missingParticipatesAsZero() {
            assertEquals(3.0, v("").add(3));
            assertEquals(3.0, v("3").add(v("")));
            assertEquals(0.0, v("").mul(v("")));
        }

        @Test
        void divisionByZeroIsNaN() {
            assertTrue(Double.isNaN(v("4").div(0)));
            assertTrue(Double.isNaN(v("4").div("0")));
            assertTrue(Double.isNaN(v("4").div(v(""))));
            assertTrue(Double.isNaN(v("").div(0)));
        }

        @Test
        void textPropagatesNaN() {
            assertTrue(Double.isNaN(v("Healthy").add(1)));
            assertTrue(Double.isNaN(v("1").add(v("Healthy"))));
            assertTrue(Double.isNaN(v("1").add(v("2024-01-01"))));
        }

        @Test
        void unparsableStringOperandIsNaN() {
            assertTrue(Double.isNaN(v("1").add("abc")));
            assertTrue(Double.isNaN(v("1").add("")));
            assertEquals(3.0, v("1").add("2"));
        }

        @Test
        void calculateDispatchesByOperator() {
            assertEquals(6.0, v("2").calculate(ArithmeticOperator.MULTIPLY, 3));
        }
    }

    // ========================================
    // Operand types and identity
    // ========================================

    @Nested
    class OperandTypes {
        @Test
        void unsupportedOperandsRaise() {
            assertThrows(InputTypeException.class, () -> v("1").eq(List.of("1")));
            assertThrows(InputTypeException.class, () -> v("1").lt(new Object()));
            assertThrows(InputTypeException.class, () -> v("1").add(true));
            assertThrows(InputTypeException.class, () -> v("1").eq(null));
        }
    }

    @Test
    void accessorsExposeTheClassification() {
        RedcapValue value = v("42.0");
        assertEquals("42.0", value.rawString());
        assertEquals(42.0, value.numericValue());
        assertEquals(Category.NUMBER, value.category());
        assertEquals("42.0", value.toString());
    }

    @Test
    void javaEqualityIsByValue() {
        RedcapValues uninterned = new RedcapValues(ValueConfig.defaults(), false);
        RedcapValue a = uninterned.value("7");
        RedcapValue b = uninterned.value("7");
        assertNotSame(a, b);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(uninterned.value("7.0"), a);
    }

    @Test
    void missingConstantMatchesClassifiedEmptyString() {
        assertEquals(RedcapValue.MISSING, v(""));
        assertTrue(RedcapValue.MISSING.isMissing());
    }

    @Test
    void rebuildingRejectsNonEmptyMissing() {
        assertThrows(IllegalArgumentException.class, () -> RedcapValue.of("x",
                new ValueClassifier.Classification(Category.MISSING, 0.0)));
    }
}
