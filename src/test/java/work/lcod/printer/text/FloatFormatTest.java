package work.lcod.printer.text;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FloatFormatTest {
    @Test
    void usesShortestRoundTripDigits() {
        assertEquals("1.5", FloatFormat.format(1.5));
        assertEquals("0.1", FloatFormat.format(0.1));
        assertEquals("0.30000000000000004", FloatFormat.format(0.1 + 0.2));
        assertEquals("123456.789", FloatFormat.format(123456.789));
        assertEquals("-2.5", FloatFormat.format(-2.5));
    }

    @Test
    void dropsFractionOfIntegralValues() {
        assertEquals("2", FloatFormat.format(2.0));
        assertEquals("100", FloatFormat.format(100.0));
        assertEquals("0", FloatFormat.format(0.0));
        assertEquals("0", FloatFormat.format(-0.0));
    }

    @Test
    void switchesToExponentOutsidePlainRange() {
        assertEquals("100000000000000000000", FloatFormat.format(1e20));
        assertEquals("1e+21", FloatFormat.format(1e21));
        assertEquals("0.000001", FloatFormat.format(1e-6));
        assertEquals("1e-7", FloatFormat.format(1e-7));
        assertEquals("1.234e-8", FloatFormat.format(1.234e-8));
        assertEquals("-1.5e+300", FloatFormat.format(-1.5e300));
        assertEquals("5e-324", FloatFormat.format(Double.MIN_VALUE));
    }

    @Test
    void picksShortestDigitsThatParseBack() {
        assertEquals("1e+23", FloatFormat.format(1e23));
        assertEquals("282879384806159000", FloatFormat.format(2.82879384806159E17));
        assertEquals("1.7976931348623157e+308", FloatFormat.format(Double.MAX_VALUE));
        assertEquals("1e-323", FloatFormat.format(2 * Double.MIN_VALUE));
    }

    @Test
    void namesNonFiniteValues() {
        assertEquals("nan", FloatFormat.format(Double.NaN));
        assertEquals("inf", FloatFormat.format(Double.POSITIVE_INFINITY));
        assertEquals("-inf", FloatFormat.format(Double.NEGATIVE_INFINITY));
    }
}
