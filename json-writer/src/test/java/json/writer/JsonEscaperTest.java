package json.writer;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class JsonEscaperTest extends JsonWriterTestBase {

    @Test
    void htmlModeUsesEntities() {
        assertThat(JsonEscaper.escape("<a>&\"b\"", EscapeMode.ESCAPE_HTML))
                .isEqualTo("&lt;a&gt;&amp;\\\"b\\\"");
        assertThat(JsonEscaper.escape("</p>", EscapeMode.ESCAPE_HTML))
                .isEqualTo("&lt;\\/p&gt;");
    }

    @Test
    void defaultModeUsesUnicodeEscapesAndEscapesSlash() {
        assertThat(JsonEscaper.escape("</script>&", EscapeMode.DONT_ESCAPE_HTML))
                .isEqualTo("\\u003C\\/script\\u003E\\u0026");
    }

    @Test
    void relaxedModeLeavesSlash() {
        assertThat(JsonEscaper.escape("a/b<c>&", EscapeMode.RELAXED))
                .isEqualTo("a/b\\u003Cc\\u003E\\u0026");
    }

    @Test
    void unsafeModeOnlyEscapesMandatoryCharacters() {
        assertThat(JsonEscaper.escape("</a>&\"\\", EscapeMode.UNSAFE))
                .isEqualTo("</a>&\\\"\\\\");
    }

    @Test
    void controlCharactersUseShortFormsWhereAvailable() {
        for (EscapeMode mode : EscapeMode.values()) {
            assertThat(JsonEscaper.escape("\b\f\n\r\t", mode)).isEqualTo("\\b\\f\\n\\r\\t");
            assertThat(JsonEscaper.escape(String.valueOf((char) 0x01), mode)).isEqualTo("\\u0001");
            assertThat(JsonEscaper.escape(String.valueOf((char) 0x1F), mode)).isEqualTo("\\u001F");
            assertThat(JsonEscaper.escape(String.valueOf((char) 0x00), mode)).isEqualTo("\\u0000");
        }
    }

    @Test
    void everythingElsePassesThrough() {
        final String text = "plain text 123 " + (char) 0x7F + " café € " + new String(Character.toChars(0x1F600));
        for (EscapeMode mode : EscapeMode.values()) {
            assertThat(JsonEscaper.escape(text, mode)).isEqualTo(text);
        }
    }

    @Test
    void appendsToGivenAppendable() throws IOException {
        final var sb = new StringBuilder("prefix:");
        JsonEscaper.escape("x\"y", EscapeMode.DONT_ESCAPE_HTML, sb);
        assertThat(sb).hasToString("prefix:x\\\"y");
    }

    @Test
    void needsEscapeFollowsMode() {
        assertThat(JsonEscaper.needsEscape('/', EscapeMode.DONT_ESCAPE_HTML)).isTrue();
        assertThat(JsonEscaper.needsEscape('/', EscapeMode.RELAXED)).isFalse();
        assertThat(JsonEscaper.needsEscape('<', EscapeMode.UNSAFE)).isFalse();
        assertThat(JsonEscaper.needsEscape('"', EscapeMode.UNSAFE)).isTrue();
        assertThat(JsonEscaper.needsEscape('a', EscapeMode.ESCAPE_HTML)).isFalse();
    }

    @Test
    void escapedBodyParsesBackInEveryMode() throws Exception {
        final String text = "<tag attr=\"v\">a & b / c\\d" + (char) 0x02 + "\n</tag>";
        for (EscapeMode mode : EscapeMode.values()) {
            String body = JsonEscaper.escape(text, mode);
            if (mode == EscapeMode.ESCAPE_HTML) {
                body = decodeHtmlEntities(body);
            }
            assertThat(MAPPER.readValue("\"" + body + "\"", String.class))
                    .as("mode %s", mode)
                    .isEqualTo(text);
        }
    }

    static String decodeHtmlEntities(String body) {
        // &amp; last: every '&' in the input was written as &amp;
        return body.replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
    }
}
