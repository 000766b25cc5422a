package json.writer;

import com.fasterxml.jackson.core.io.NumberOutput;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/// Renders numbers as JSON number tokens.
///
/// Only finite floating-point values are accepted here; the writer decides
/// what to do with NaN and the infinities and uses {@link #nonFiniteText(double)}
/// when they are written as strings.
public final class NumberFormatter {

    /// `SHORTEST` switches to exponent notation outside `[1e-6, 1e21)`.
    private static final int SHORTEST_MIN_PLAIN_EXPONENT = -6;
    private static final int SHORTEST_MAX_PLAIN_EXPONENT = 21;

    /// `SIGNIFICANT_DIGITS` follows `%g`: exponent notation below `1e-4`.
    private static final int SIGNIFICANT_MIN_PLAIN_EXPONENT = -4;

    private static final RoundingMode[] ONE_DIGIT_NEIGHBOURS = {RoundingMode.FLOOR, RoundingMode.CEILING};

    private NumberFormatter() {
        throw new AssertionError("NumberFormatter cannot be instantiated");
    }

    /// {@return the decimal text of `value` read as an unsigned 64-bit integer}
    public static String formatUnsigned(long value) {
        return Long.toUnsignedString(value);
    }

    /// {@return `value` rendered under `format`}
    ///
    /// @throws IllegalArgumentException if `value` is not finite or `ndigits`
    ///         is out of range for `format`
    public static String formatDouble(double value, FloatFormat format, int ndigits) {
        requireFinite(value);
        final BigDecimal shortest = format == FloatFormat.SHORTEST
                ? shortest(NumberOutput.toString(value, true), value, false)
                : null;
        return format(value, shortest, format, ndigits);
    }

    /// {@return `value` rendered under `format`}
    ///
    /// `SHORTEST` uses the shortest text that reads back as the same `float`,
    /// so `0.1f` renders as `0.1`.
    ///
    /// @throws IllegalArgumentException if `value` is not finite or `ndigits`
    ///         is out of range for `format`
    public static String formatFloat(float value, FloatFormat format, int ndigits) {
        requireFinite(value);
        final BigDecimal shortest = format == FloatFormat.SHORTEST
                ? shortest(NumberOutput.toString(value, true), value, true)
                : null;
        return format(value, shortest, format, ndigits);
    }

    /// {@return `nan`, `inf` or `-inf` for a non-finite `value`}
    ///
    /// @throws IllegalArgumentException if `value` is finite
    public static String nonFiniteText(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (value == Double.POSITIVE_INFINITY) {
            return "inf";
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return "-inf";
        }
        throw new IllegalArgumentException("Not a special floating-point value: " + value);
    }

    private static String format(double exact, BigDecimal shortest, FloatFormat format, int ndigits) {
        Objects.requireNonNull(format, "format");
        switch (format) {
            case SIGNIFICANT_DIGITS -> {
                if (ndigits < 1) {
                    throw new IllegalArgumentException("Significant digit count must be positive: " + ndigits);
                }
            }
            case FRACTION_DIGITS, FRACTION_DIGITS_STRIP_ZEROS -> {
                if (ndigits < 0) {
                    throw new IllegalArgumentException("Fraction digit count must not be negative: " + ndigits);
                }
            }
            case SHORTEST -> {
            }
        }
        if (exact == 0.0) {
            return zero(Double.doubleToRawLongBits(exact) < 0, format, ndigits);
        }
        return switch (format) {
            case SHORTEST -> render(shortest,
                    SHORTEST_MIN_PLAIN_EXPONENT, SHORTEST_MAX_PLAIN_EXPONENT);
            case SIGNIFICANT_DIGITS -> render(new BigDecimal(exact)
                            .round(new MathContext(ndigits, RoundingMode.HALF_EVEN))
                            .stripTrailingZeros(),
                    SIGNIFICANT_MIN_PLAIN_EXPONENT, ndigits);
            case FRACTION_DIGITS -> new BigDecimal(exact)
                    .setScale(ndigits, RoundingMode.HALF_EVEN)
                    .toPlainString();
            case FRACTION_DIGITS_STRIP_ZEROS -> stripFractionZeros(new BigDecimal(exact)
                    .setScale(ndigits, RoundingMode.HALF_EVEN)
                    .toPlainString());
        };
    }

    /// The Schubfach text from Jackson is the shortest decimal that reads back
    /// as `exact`, except that it never has fewer than two digits. When it has
    /// exactly two, the nearest one-digit neighbour that also reads back wins.
    private static BigDecimal shortest(String text, double exact, boolean single) {
        final BigDecimal decimal = new BigDecimal(text).stripTrailingZeros();
        if (decimal.precision() != 2) {
            return decimal;
        }
        final BigDecimal target = new BigDecimal(exact);
        BigDecimal best = null;
        for (RoundingMode mode : ONE_DIGIT_NEIGHBOURS) {
            final BigDecimal candidate = decimal.round(new MathContext(1, mode));
            final boolean readsBack = single
                    ? Float.parseFloat(candidate.toString()) == (float) exact
                    : Double.parseDouble(candidate.toString()) == exact;
            if (readsBack && (best == null
                    || candidate.subtract(target).abs().compareTo(best.subtract(target).abs()) < 0)) {
                best = candidate;
            }
        }
        return best != null ? best.stripTrailingZeros() : decimal;
    }

    private static String zero(boolean negative, FloatFormat format, int ndigits) {
        final String sign = negative ? "-" : "";
        if (format == FloatFormat.FRACTION_DIGITS && ndigits > 0) {
            return sign + "0." + "0".repeat(ndigits);
        }
        return sign + "0";
    }

    /// Plain notation when the decimal exponent lies in `[minPlain, maxPlain)`,
    /// otherwise `d.ddde+X`.
    private static String render(BigDecimal value, int minPlain, int maxPlain) {
        final int exponent = value.precision() - value.scale() - 1;
        if (exponent >= minPlain && exponent < maxPlain) {
            return value.toPlainString();
        }
        final String digits = value.unscaledValue().abs().toString();
        final var sb = new StringBuilder(digits.length() + 8);
        if (value.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
        return sb.toString();
    }

    private static String stripFractionZeros(String plain) {
        if (plain.indexOf('.') < 0) {
            return plain;
        }
        int end = plain.length();
        while (plain.charAt(end - 1) == '0') {
            end--;
        }
        if (plain.charAt(end - 1) == '.') {
            end--;
        }
        final String stripped = plain.substring(0, end);
        return "-0".equals(stripped) ? "0" : stripped;
    }

    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite value: " + value);
        }
    }
}
