package json.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/// Produces the body of a JSON string literal (without the surrounding quotes).
///
/// Quote and backslash become `\"` and `\\`. Control characters below 0x20 use
/// the short forms `\b` `\t` `\n` `\f` `\r` where JSON has one, otherwise a
/// six-character unicode escape with uppercase hex digits. The characters
/// `<` `>` `&` `/` follow the {@link EscapeMode}. Everything else, including
/// non-ASCII characters and lone surrogates, is copied unchanged.
public final class JsonEscaper {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static final String[] CONTROL = new String[0x20];

    static {
        for (int c = 0; c < CONTROL.length; c++) {
            CONTROL[c] = unicodeEscape((char) c);
        }
        CONTROL['\b'] = "\\b";
        CONTROL['\t'] = "\\t";
        CONTROL['\n'] = "\\n";
        CONTROL['\f'] = "\\f";
        CONTROL['\r'] = "\\r";
    }

    private JsonEscaper() {
        throw new AssertionError("JsonEscaper cannot be instantiated");
    }

    /// {@return the escaped literal body of `s` under `mode`}
    public static String escape(CharSequence s, EscapeMode mode) {
        var sb = new StringBuilder(s.length() + 16);
        try {
            escape(s, mode, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /// Appends the escaped literal body of `s` to `out`.
    ///
    /// Runs of characters that need no escaping are appended in one call.
    ///
    /// @throws IOException if `out` fails
    public static void escape(CharSequence s, EscapeMode mode, Appendable out) throws IOException {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(mode, "mode");
        int start = 0;
        final int len = s.length();
        for (int i = 0; i < len; i++) {
            final String replacement = replacementFor(s.charAt(i), mode);
            if (replacement != null) {
                out.append(s, start, i);
                out.append(replacement);
                start = i + 1;
            }
        }
        out.append(s, start, len);
    }

    /// {@return true if `c` is written differently from itself under `mode`}
    public static boolean needsEscape(char c, EscapeMode mode) {
        return replacementFor(c, mode) != null;
    }

    /// {@return the replacement text for `c`, or `null` when it is copied as is}
    static String replacementFor(char c, EscapeMode mode) {
        if (c < 0x20) {
            return CONTROL[c];
        }
        return switch (c) {
            case '"' -> "\\\"";
            case '\\' -> "\\\\";
            case '<' -> mode == EscapeMode.ESCAPE_HTML ? "&lt;" : jsonEscape(c, mode);
            case '>' -> mode == EscapeMode.ESCAPE_HTML ? "&gt;" : jsonEscape(c, mode);
            case '&' -> mode == EscapeMode.ESCAPE_HTML ? "&amp;" : jsonEscape(c, mode);
            case '/' -> mode == EscapeMode.ESCAPE_HTML || mode == EscapeMode.DONT_ESCAPE_HTML ? "\\/" : null;
            default -> null;
        };
    }

    private static String jsonEscape(char c, EscapeMode mode) {
        return mode == EscapeMode.UNSAFE ? null : unicodeEscape(c);
    }

    private static String unicodeEscape(char c) {
        return "\\u00" + HEX[(c >> 4) & 0xF] + HEX[c & 0xF];
    }
}
