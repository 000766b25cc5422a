package json.writer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumberFormatterTest extends JsonWriterTestBase {

    @Test
    void unsignedUsesFullRange() {
        assertThat(NumberFormatter.formatUnsigned(0L)).isEqualTo("0");
        assertThat(NumberFormatter.formatUnsigned(-1L)).isEqualTo("18446744073709551615");
        assertThat(NumberFormatter.formatUnsigned(Long.MIN_VALUE)).isEqualTo("9223372036854775808");
    }

    @Test
    void significantDigitsFollowsPercentG() {
        assertThat(NumberFormatter.formatDouble(0.1, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("0.1");
        assertThat(NumberFormatter.formatDouble(1.0 / 3, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("0.3333333333");
        assertThat(NumberFormatter.formatDouble(100.0, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("100");
        assertThat(NumberFormatter.formatDouble(-2.5, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("-2.5");
        assertThat(NumberFormatter.formatDouble(1e20, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("1e+20");
        assertThat(NumberFormatter.formatDouble(123456789012.0, FloatFormat.SIGNIFICANT_DIGITS, 10))
                .isEqualTo("1.23456789e+11");
        assertThat(NumberFormatter.formatDouble(1234567.0, FloatFormat.SIGNIFICANT_DIGITS, 6)).isEqualTo("1.23457e+6");
        assertThat(NumberFormatter.formatDouble(0.00001234, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("1.234e-5");
        assertThat(NumberFormatter.formatDouble(0.0001234, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("0.0001234");
    }

    @Test
    void floatsRoundFromTheirExactValue() {
        assertThat(NumberFormatter.formatFloat(0.1f, FloatFormat.SIGNIFICANT_DIGITS, 6)).isEqualTo("0.1");
        assertThat(NumberFormatter.formatFloat(3.14159265f, FloatFormat.SIGNIFICANT_DIGITS, 6)).isEqualTo("3.14159");
        assertThat(NumberFormatter.formatFloat(0.1f, FloatFormat.SHORTEST, 0)).isEqualTo("0.1");
    }

    @Test
    void shortestRoundTripsAndSwitchesToExponentAtTheEdges() {
        assertThat(NumberFormatter.formatDouble(123.456, FloatFormat.SHORTEST, 0)).isEqualTo("123.456");
        assertThat(NumberFormatter.formatDouble(1e20, FloatFormat.SHORTEST, 0)).isEqualTo("100000000000000000000");
        assertThat(NumberFormatter.formatDouble(1e21, FloatFormat.SHORTEST, 0)).isEqualTo("1e+21");
        assertThat(NumberFormatter.formatDouble(1e-6, FloatFormat.SHORTEST, 0)).isEqualTo("0.000001");
        assertThat(NumberFormatter.formatDouble(1.5e-7, FloatFormat.SHORTEST, 0)).isEqualTo("1.5e-7");
        final double awkward = 0.1 + 0.2;
        assertThat(Double.parseDouble(NumberFormatter.formatDouble(awkward, FloatFormat.SHORTEST, 0)))
                .isEqualTo(awkward);
    }

    @Test
    void shortestIsShortestEvenWhereDoubleToStringIsNot() {
        assertThat(NumberFormatter.formatDouble(1e23, FloatFormat.SHORTEST, 0)).isEqualTo("1e+23");
        assertThat(NumberFormatter.formatDouble(2.82879384806159E17, FloatFormat.SHORTEST, 0))
                .isEqualTo("282879384806159000");
        assertThat(NumberFormatter.formatDouble(Double.MIN_VALUE, FloatFormat.SHORTEST, 0)).isEqualTo("5e-324");
        assertThat(NumberFormatter.formatDouble(-Double.MIN_VALUE, FloatFormat.SHORTEST, 0)).isEqualTo("-5e-324");
        assertThat(NumberFormatter.formatFloat(Float.MIN_VALUE, FloatFormat.SHORTEST, 0)).isEqualTo("1e-45");
        assertThat(NumberFormatter.formatDouble(Double.MAX_VALUE, FloatFormat.SHORTEST, 0))
                .isEqualTo("1.7976931348623157e+308");
        assertThat(NumberFormatter.formatDouble(4.9, FloatFormat.SHORTEST, 0)).isEqualTo("4.9");
    }

    @Test
    void fractionDigitsRoundsTheExactBinaryValue() {
        assertThat(NumberFormatter.formatDouble(2.675, FloatFormat.FRACTION_DIGITS, 2)).isEqualTo("2.67");
        assertThat(NumberFormatter.formatDouble(1.5, FloatFormat.FRACTION_DIGITS, 3)).isEqualTo("1.500");
        assertThat(NumberFormatter.formatDouble(1.5, FloatFormat.FRACTION_DIGITS, 0)).isEqualTo("2");
    }

    @Test
    void fractionDigitsStripZerosDropsTrailingZerosAndPoint() {
        assertThat(NumberFormatter.formatDouble(2.0, FloatFormat.FRACTION_DIGITS_STRIP_ZEROS, 3)).isEqualTo("2");
        assertThat(NumberFormatter.formatDouble(2.50, FloatFormat.FRACTION_DIGITS_STRIP_ZEROS, 3)).isEqualTo("2.5");
        assertThat(NumberFormatter.formatDouble(0.0001, FloatFormat.FRACTION_DIGITS_STRIP_ZEROS, 2)).isEqualTo("0");
        assertThat(NumberFormatter.formatDouble(-0.0001, FloatFormat.FRACTION_DIGITS_STRIP_ZEROS, 2)).isEqualTo("0");
    }

    @Test
    void zeroKeepsItsSign() {
        assertThat(NumberFormatter.formatDouble(0.0, FloatFormat.SHORTEST, 0)).isEqualTo("0");
        assertThat(NumberFormatter.formatDouble(-0.0, FloatFormat.SHORTEST, 0)).isEqualTo("-0");
        assertThat(NumberFormatter.formatDouble(-0.0, FloatFormat.SIGNIFICANT_DIGITS, 10)).isEqualTo("-0");
        assertThat(NumberFormatter.formatDouble(0.0, FloatFormat.FRACTION_DIGITS, 2)).isEqualTo("0.00");
    }

    @Test
    void rejectsBadDigitCountsAndNonFiniteValues() {
        assertThatThrownBy(() -> NumberFormatter.formatDouble(1.0, FloatFormat.SIGNIFICANT_DIGITS, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NumberFormatter.formatDouble(1.0, FloatFormat.FRACTION_DIGITS, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NumberFormatter.formatDouble(Double.NaN, FloatFormat.SHORTEST, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NumberFormatter.formatFloat(Float.POSITIVE_INFINITY, FloatFormat.SHORTEST, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonFiniteTexts() {
        assertThat(NumberFormatter.nonFiniteText(Double.NaN)).isEqualTo("nan");
        assertThat(NumberFormatter.nonFiniteText(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(NumberFormatter.nonFiniteText(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
        assertThatThrownBy(() -> NumberFormatter.nonFiniteText(1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
