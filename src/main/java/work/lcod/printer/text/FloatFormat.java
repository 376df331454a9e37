package work.lcod.printer.text;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts doubles to text.
 *
 * <p>Digits are the shortest ones that parse back to the same double. Values whose
 * decimal exponent lies in {@code [-6, 20]} print in plain notation, others as {@code d.ddde+N} or
 * {@code d.ddde-N}. Integral values carry no fractional part, negative zero prints as {@code 0},
 * and the non-finite values print as {@code nan}, {@code inf} and {@code -inf}.
 */
public final class FloatFormat {
    private static final int MIN_PLAIN_EXPONENT = -6;
    private static final int MAX_PLAIN_EXPONENT = 20;
    private static final int MAX_DIGITS = 17;

    private FloatFormat() {}

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return "0";
        }
        var decimal = shortestDigits(value);
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= MIN_PLAIN_EXPONENT && exponent <= MAX_PLAIN_EXPONENT) {
            return decimal.toPlainString();
        }
        String digits = decimal.unscaledValue().abs().toString();
        var out = new StringBuilder();
        if (decimal.signum() < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        out.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        return out.toString();
    }

    /**
     * Rounds the exact binary value to the fewest significant digits that still identify it.
     * Seventeen digits always suffice for a double.
     */
    static BigDecimal shortestDigits(double value) {
        var exact = new BigDecimal(value);
        for (int precision = 1; precision < MAX_DIGITS; precision++) {
            var rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (Double.parseDouble(rounded.toString()) == value) {
                return rounded.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(MAX_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }
}
