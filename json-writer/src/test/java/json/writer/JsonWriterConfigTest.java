package json.writer;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonWriterConfigTest extends JsonWriterTestBase {

    @Test
    void defaultsAreCompactAndStrict() {
        final JsonWriterConfig config = JsonWriterConfig.defaults();
        assertThat(config.escapeMode()).isEqualTo(EscapeMode.DONT_ESCAPE_HTML);
        assertThat(config.indentSpaces()).isZero();
        assertThat(config.writeNanAsString()).isFalse();
        assertThat(new JsonWriter().config()).isEqualTo(config);
    }

    @Test
    void readsAllProperties() {
        final var props = new Properties();
        props.setProperty(JsonWriterConfig.ESCAPE_MODE_PROPERTY, " Escape-HTML ");
        props.setProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY, "4");
        props.setProperty(JsonWriterConfig.NAN_AS_STRING_PROPERTY, "TRUE");
        assertThat(JsonWriterConfig.fromProperties(props))
                .isEqualTo(new JsonWriterConfig(EscapeMode.ESCAPE_HTML, 4, true));
    }

    @Test
    void missingPropertiesTakeDefaults() {
        assertThat(JsonWriterConfig.fromProperties(new Properties())).isEqualTo(JsonWriterConfig.defaults());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        final var props = new Properties();
        props.setProperty(JsonWriterConfig.ESCAPE_MODE_PROPERTY, "loose");
        props.setProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY, "-2");
        props.setProperty(JsonWriterConfig.NAN_AS_STRING_PROPERTY, "yes");
        assertThat(JsonWriterConfig.fromProperties(props)).isEqualTo(JsonWriterConfig.defaults());

        props.setProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY, "two");
        assertThat(JsonWriterConfig.fromProperties(props).indentSpaces()).isZero();
    }

    @Test
    void everyModeHasAPropertyValue() {
        for (EscapeMode mode : EscapeMode.values()) {
            final var props = new Properties();
            props.setProperty(JsonWriterConfig.ESCAPE_MODE_PROPERTY, mode.propertyValue());
            assertThat(JsonWriterConfig.fromProperties(props).escapeMode()).isEqualTo(mode);
        }
    }

    @Test
    void systemPropertiesAreRead() {
        final String previous = System.getProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY);
        System.setProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY, "3");
        try {
            assertThat(JsonWriterConfig.fromSystemProperties().indentSpaces()).isEqualTo(3);
        } finally {
            if (previous == null) {
                System.clearProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY);
            } else {
                System.setProperty(JsonWriterConfig.INDENT_SPACES_PROPERTY, previous);
            }
        }
    }

    @Test
    void withersAndValidation() {
        final JsonWriterConfig config = JsonWriterConfig.defaults()
                .withEscapeMode(EscapeMode.RELAXED)
                .withIndentSpaces(2)
                .withWriteNanAsString(true);
        assertThat(config).isEqualTo(new JsonWriterConfig(EscapeMode.RELAXED, 2, true));
        assertThatThrownBy(() -> new JsonWriterConfig(EscapeMode.RELAXED, -1, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JsonWriterConfig(null, 0, false))
                .isInstanceOf(NullPointerException.class);
    }
}
