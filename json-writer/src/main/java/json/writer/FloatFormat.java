package json.writer;

/// Rendering mode for `float` and `double` values.
///
/// The digit count passed alongside the mode is interpreted per mode.
public enum FloatFormat {
    /// Shortest text that reads back to the same value; the digit count is ignored.
    SHORTEST,
    /// At most `ndigits` significant digits, trailing zeros dropped.
    SIGNIFICANT_DIGITS,
    /// Exactly `ndigits` digits after the decimal point.
    FRACTION_DIGITS,
    /// At most `ndigits` digits after the decimal point, trailing zeros dropped.
    FRACTION_DIGITS_STRIP_ZEROS
}
