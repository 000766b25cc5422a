package json.writer;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// Per-writer settings.
///
/// Settings are read only when asked for; a writer never consults system
/// properties on its own.
///
/// | Property                   | Values                                                 | Default            |
/// |----------------------------|--------------------------------------------------------|--------------------|
/// | `json.writer.escapeMode`   | `escape-html`, `dont-escape-html`, `relaxed`, `unsafe` | `dont-escape-html` |
/// | `json.writer.indentSpaces` | non-negative integer                                   | `0`                |
/// | `json.writer.nanAsString`  | `true`, `false`                                        | `false`            |
///
/// @param escapeMode       default escape mode for strings and keys
/// @param indentSpaces     spaces per nesting level; 0 writes compact JSON
/// @param writeNanAsString write NaN and infinities as strings instead of failing
public record JsonWriterConfig(EscapeMode escapeMode, int indentSpaces, boolean writeNanAsString) {

    private static final Logger LOG = Logger.getLogger(JsonWriterConfig.class.getName());

    public static final String ESCAPE_MODE_PROPERTY = "json.writer.escapeMode";
    public static final String INDENT_SPACES_PROPERTY = "json.writer.indentSpaces";
    public static final String NAN_AS_STRING_PROPERTY = "json.writer.nanAsString";

    private static final JsonWriterConfig DEFAULTS =
            new JsonWriterConfig(EscapeMode.DONT_ESCAPE_HTML, 0, false);

    public JsonWriterConfig {
        Objects.requireNonNull(escapeMode, "escapeMode");
        if (indentSpaces < 0) {
            throw new IllegalArgumentException("indentSpaces is negative: " + indentSpaces);
        }
    }

    /// {@return compact output, `DONT_ESCAPE_HTML`, non-finite values rejected}
    public static JsonWriterConfig defaults() {
        return DEFAULTS;
    }

    public JsonWriterConfig withEscapeMode(EscapeMode mode) {
        return new JsonWriterConfig(mode, indentSpaces, writeNanAsString);
    }

    public JsonWriterConfig withIndentSpaces(int spaces) {
        return new JsonWriterConfig(escapeMode, spaces, writeNanAsString);
    }

    public JsonWriterConfig withWriteNanAsString(boolean nanAsString) {
        return new JsonWriterConfig(escapeMode, indentSpaces, nanAsString);
    }

    /// {@return the configuration described by the `json.writer.*` system properties}
    public static JsonWriterConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// {@return the configuration described by the `json.writer.*` entries of `props`}
    ///
    /// Missing entries take their default. Unrecognized values are logged at
    /// `WARNING` and also take their default.
    public static JsonWriterConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        return new JsonWriterConfig(
                parseEscapeMode(props.getProperty(ESCAPE_MODE_PROPERTY)),
                parseIndentSpaces(props.getProperty(INDENT_SPACES_PROPERTY)),
                parseNanAsString(props.getProperty(NAN_AS_STRING_PROPERTY)));
    }

    private static EscapeMode parseEscapeMode(String value) {
        if (value == null) {
            return DEFAULTS.escapeMode();
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EscapeMode mode : EscapeMode.values()) {
            if (mode.propertyValue().equals(normalized)) {
                LOG.fine(() -> "Escape mode set to " + mode + " via " + ESCAPE_MODE_PROPERTY);
                return mode;
            }
        }
        LOG.warning(() -> "Invalid escape mode: " + value + ". Using default mode: " + DEFAULTS.escapeMode());
        return DEFAULTS.escapeMode();
    }

    private static int parseIndentSpaces(String value) {
        if (value == null) {
            return DEFAULTS.indentSpaces();
        }
        try {
            final int spaces = Integer.parseInt(value.trim());
            if (spaces >= 0) {
                return spaces;
            }
        } catch (NumberFormatException ex) {
            LOG.finer(() -> "Indent spaces not a number: " + ex.getMessage());
        }
        LOG.warning(() -> "Invalid indent spaces: " + value + ". Using default: " + DEFAULTS.indentSpaces());
        return DEFAULTS.indentSpaces();
    }

    private static boolean parseNanAsString(String value) {
        if (value == null) {
            return DEFAULTS.writeNanAsString();
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        LOG.warning(() -> "Invalid NaN-as-string flag: " + value + ". Using default: " + DEFAULTS.writeNanAsString());
        return DEFAULTS.writeNanAsString();
    }
}
