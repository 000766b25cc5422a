package json.writer;

/// How `<`, `>`, `&` and `/` are rendered inside string literals.
///
/// Quote, backslash and control characters are escaped in every mode.
public enum EscapeMode {
    /// HTML entities: `&lt;` `&gt;` `&amp;` and `\/`.
    ESCAPE_HTML("escape-html"),
    /// JSON unicode escapes for `<` `>` `&`, and `\/` for slash.
    DONT_ESCAPE_HTML("dont-escape-html"),
    /// JSON unicode escapes for `<` `>` `&`, slash left as is.
    RELAXED("relaxed"),
    /// None of the four characters are escaped.
    UNSAFE("unsafe");

    private final String propertyValue;

    EscapeMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /// {@return the spelling of this mode in configuration properties}
    public String propertyValue() {
        return propertyValue;
    }
}
