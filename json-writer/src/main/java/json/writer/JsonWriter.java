package json.writer;

import json.value.JsonArray;
import json.value.JsonBoolean;
import json.value.JsonNull;
import json.value.JsonNumber;
import json.value.JsonObject;
import json.value.JsonString;
import json.value.JsonValue;

import java.io.Flushable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes JSON text token by token while enforcing the JSON grammar.
///
/// A stack of {@link EntityKind}s tracks the open constructs. Value writes are
/// accepted at the top level, inside a list, or right after a key; keys are
/// accepted only inside an object with no key pending. A call that breaks the
/// grammar throws {@link JsonWriterException} before writing anything, and
/// the writer stays usable.
///
/// Every operation returns a handle ({@link ValueContext}, {@link PairContext}
/// or {@link AfterColonContext}) that exposes only the calls legal next, so
/// chained call sites are checked by the compiler too:
/// ```java
/// var w = new JsonWriter();
/// w.beginObject()
///     .writeKey("a").writeInt(1)
///     .writeKey("b").beginList().writeInt(1).writeInt(2).writeInt(3).endList()
///     .endObject();
/// w.str(); // {"a":1,"b":[1,2,3]}
/// ```
///
/// Output goes either to an internal buffer, read with {@link #str()} or drained
/// with {@link #flushTo(Appendable)}, or to an `Appendable` given at
/// construction. The choice is fixed for the life of the writer. An
/// `IOException` from the sink is rethrown as `UncheckedIOException`.
///
/// Instances are not thread safe.
public final class JsonWriter {

    private static final Logger LOG = Logger.getLogger(JsonWriter.class.getName());

    /// Unicode code point order, which is also the order of the keys' UTF-8 bytes.
    /// `String.compareTo` differs for supplementary characters.
    static final Comparator<String> KEY_ORDER = (a, b) -> {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            final int ca = a.codePointAt(i);
            final int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    };

    private final Appendable out;
    private final StringBuilder buffer;

    private final List<EntityKind> stack = new ArrayList<>();
    /// Open lists and objects; `PAIR` markers do not add a level.
    private int depth;
    private boolean needComma;
    private boolean needNewline;

    private final EscapeMode escapeMode;
    private int indentSpaces;
    private boolean writeNanAsString;

    private final ValueContext valueContext = new ValueContext(this);
    private final PairContext pairContext = new PairContext(this);
    private final AfterColonContext afterColonContext = new AfterColonContext(this);

    /// Writer with default settings and an internal buffer.
    public JsonWriter() {
        this(JsonWriterConfig.defaults(), null);
    }

    /// Writer with the given escape mode and an internal buffer.
    public JsonWriter(EscapeMode mode) {
        this(JsonWriterConfig.defaults().withEscapeMode(mode), null);
    }

    /// Writer with the given escape mode writing to `sink`.
    ///
    /// @param sink destination, or `null` for an internal buffer
    public JsonWriter(EscapeMode mode, Appendable sink) {
        this(JsonWriterConfig.defaults().withEscapeMode(mode), sink);
    }

    /// Writer with the given settings and an internal buffer.
    public JsonWriter(JsonWriterConfig config) {
        this(config, null);
    }

    /// Writer with the given settings writing to `sink`.
    ///
    /// @param sink destination, or `null` for an internal buffer
    public JsonWriter(JsonWriterConfig config, Appendable sink) {
        Objects.requireNonNull(config, "config");
        this.escapeMode = config.escapeMode();
        this.indentSpaces = config.indentSpaces();
        this.writeNanAsString = config.writeNanAsString();
        if (sink == null) {
            this.buffer = new StringBuilder();
            this.out = buffer;
        } else {
            this.buffer = null;
            this.out = sink;
        }
        stack.add(EntityKind.OUTER_SPACE);
        LOG.fine(() -> "Created JsonWriter " + config + " writing to "
                + (buffer != null ? "internal buffer" : sink.getClass().getName()));
    }

    /// {@return the JSON text of `value` written with the given settings}
    public static String toJson(JsonValue value, JsonWriterConfig config, boolean sortKeys) {
        final var writer = new JsonWriter(config);
        writer.writeJsonValue(value, sortKeys);
        return writer.str();
    }

    // ---- settings ----

    /// Sets the number of spaces per nesting level; 0 writes compact JSON.
    ///
    /// @throws IllegalArgumentException if `spaces` is negative
    public void setIndentSpaces(int spaces) {
        if (spaces < 0) {
            throw new IllegalArgumentException("indentSpaces is negative: " + spaces);
        }
        this.indentSpaces = spaces;
    }

    /// NaN and infinities are not valid JSON numbers. With this set they are
    /// written as the strings `"nan"`, `"inf"` and `"-inf"`; otherwise writing
    /// one throws.
    public void setWriteNanAsString(boolean writeNanAsString) {
        this.writeNanAsString = writeNanAsString;
    }

    /// Same as `setWriteNanAsString(true)`.
    public void setWriteNanAsString() {
        setWriteNanAsString(true);
    }

    /// {@return the settings currently in effect}
    public JsonWriterConfig config() {
        return new JsonWriterConfig(escapeMode, indentSpaces, writeNanAsString);
    }

    // ---- values ----

    public ValueContext writeString(CharSequence s) {
        return writeString(s, escapeMode);
    }

    public ValueContext writeString(CharSequence s, EscapeMode mode) {
        Objects.requireNonNull(s, "s");
        Objects.requireNonNull(mode, "mode");
        beginValue();
        writeQuoted(s, mode);
        endValue();
        return valueContext;
    }

    public ValueContext writeInt(int i) {
        return writeLiteral(Integer.toString(i));
    }

    public ValueContext writeLong(long l) {
        return writeLiteral(Long.toString(l));
    }

    /// Writes `l` read as an unsigned 64-bit integer.
    public ValueContext writeUnsignedLong(long l) {
        return writeLiteral(NumberFormatter.formatUnsigned(l));
    }

    /// Writes `f` with 6 significant digits.
    public ValueContext writeFloat(float f) {
        return writeFloat(f, FloatFormat.SIGNIFICANT_DIGITS, 6);
    }

    public ValueContext writeFloat(float f, FloatFormat format, int ndigits) {
        if (!Float.isFinite(f)) {
            return writeNonFinite(f);
        }
        return writeLiteral(NumberFormatter.formatFloat(f, format, ndigits));
    }

    /// Writes `d` with 10 significant digits.
    public ValueContext writeDouble(double d) {
        return writeDouble(d, FloatFormat.SIGNIFICANT_DIGITS, 10);
    }

    public ValueContext writeDouble(double d, FloatFormat format, int ndigits) {
        if (!Double.isFinite(d)) {
            return writeNonFinite(d);
        }
        return writeLiteral(NumberFormatter.formatDouble(d, format, ndigits));
    }

    public ValueContext writeBool(boolean b) {
        return writeLiteral(b ? "true" : "false");
    }

    public ValueContext writeNull() {
        return writeLiteral("null");
    }

    /// Writes the tree rooted at `value`, keeping object member order.
    public ValueContext writeJsonValue(JsonValue value) {
        return writeJsonValue(value, false);
    }

    /// Writes the tree rooted at `value`.
    ///
    /// The whole tree is checked first, so a tree that cannot be written
    /// (a `null` node, or a number whose text is not JSON) fails without
    /// writing anything.
    ///
    /// @param sortKeys sort the members of every object in the tree by the
    ///                 Unicode code points of their keys instead of keeping
    ///                 their order
    /// @throws JsonWriterException if a key is expected or the tree is not writable
    public ValueContext writeJsonValue(JsonValue value, boolean sortKeys) {
        Objects.requireNonNull(value, "value");
        if (keyExpected()) {
            throw valueWhereKeyExpected();
        }
        checkTree(value);
        LOG.fine(() -> "Writing JsonValue tree, sortKeys=" + sortKeys);
        dump(value, sortKeys);
        return valueContext;
    }

    private static void checkTree(JsonValue value) {
        if (value == null) {
            throw new JsonWriterException("JSON writer: JsonValue tree contains null");
        }
        if (value instanceof JsonObject obj) {
            final Map<String, JsonValue> members = obj.members();
            if (members == null) {
                throw new JsonWriterException("JSON writer: JsonObject without members");
            }
            for (Map.Entry<String, JsonValue> member : members.entrySet()) {
                if (member.getKey() == null) {
                    throw new JsonWriterException("JSON writer: JsonObject member with null name");
                }
                checkTree(member.getValue());
            }
        } else if (value instanceof JsonArray arr) {
            final List<JsonValue> elements = arr.elements();
            if (elements == null) {
                throw new JsonWriterException("JSON writer: JsonArray without elements");
            }
            for (JsonValue element : elements) {
                checkTree(element);
            }
        } else if (value instanceof JsonString str) {
            if (str.string() == null) {
                throw new JsonWriterException("JSON writer: JsonString with null value");
            }
        } else if (value instanceof JsonNumber num) {
            final String text = num.toString();
            if (text == null || !JsonNumber.GRAMMAR.matcher(text).matches()) {
                throw new JsonWriterException("JSON writer: not a JSON number: " + text);
            }
        }
    }

    private void dump(JsonValue value, boolean sortKeys) {
        if (value instanceof JsonObject obj) {
            beginObject();
            List<Map.Entry<String, JsonValue>> members = new ArrayList<>(obj.members().entrySet());
            if (sortKeys) {
                members.sort(Map.Entry.comparingByKey(KEY_ORDER));
            }
            for (Map.Entry<String, JsonValue> member : members) {
                writeKey(member.getKey());
                dump(member.getValue(), sortKeys);
            }
            endObject();
        } else if (value instanceof JsonArray arr) {
            beginList();
            for (JsonValue element : arr.elements()) {
                dump(element, sortKeys);
            }
            endList();
        } else if (value instanceof JsonString str) {
            writeString(str.string());
        } else if (value instanceof JsonNumber num) {
            writeLiteral(num.toString());
        } else if (value instanceof JsonBoolean bool) {
            writeBool(bool.bool());
        } else if (value instanceof JsonNull) {
            writeNull();
        } else {
            throw new JsonWriterException("JSON writer: unsupported JsonValue " + value.getClass().getName());
        }
    }

    // ---- structure ----

    public ValueContext beginList() {
        beginValue();
        rawWrite('[');
        stack.add(EntityKind.LIST);
        depth++;
        needComma = false;
        needNewline = true;
        return valueContext;
    }

    /// @throws JsonWriterException if the innermost open construct is not a list
    public JsonWriter endList() {
        if (top() != EntityKind.LIST) {
            throw new JsonWriterException("JSON writer: endList() called, but the innermost open construct is " + top());
        }
        closeConstruct(']');
        return this;
    }

    public PairContext beginObject() {
        beginValue();
        rawWrite('{');
        stack.add(EntityKind.OBJECT);
        depth++;
        needComma = false;
        needNewline = true;
        return pairContext;
    }

    /// @throws JsonWriterException if the innermost open construct is not an
    ///         object, or a key was written without its value
    public JsonWriter endObject() {
        if (top() == EntityKind.PAIR) {
            throw new JsonWriterException("JSON writer: endObject() called after a key without a value");
        }
        if (top() != EntityKind.OBJECT) {
            throw new JsonWriterException("JSON writer: endObject() called, but the innermost open construct is " + top());
        }
        closeConstruct('}');
        return this;
    }

    public AfterColonContext writeKey(CharSequence key) {
        return writeKey(key, escapeMode);
    }

    public AfterColonContext writeKey(CharSequence key, EscapeMode mode) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(mode, "mode");
        beginKey();
        writeQuoted(key, mode);
        rawWrite(':');
        stack.add(EntityKind.PAIR);
        return afterColonContext;
    }

    /// {@return true if the next token must be a key}
    public boolean keyExpected() {
        return top() == EntityKind.OBJECT;
    }

    // ---- escape hatches: no escaping, no validation of the text ----

    /// Writes `key` in quotes without escaping it. Invalid JSON results if `key`
    /// contains characters that need escaping.
    public AfterColonContext unsafeWriteKey(CharSequence key) {
        Objects.requireNonNull(key, "key");
        beginKey();
        rawWrite('"');
        rawWrite(key);
        rawWrite('"');
        rawWrite(':');
        stack.add(EntityKind.PAIR);
        return afterColonContext;
    }

    /// Writes `key` as is, without quotes, followed by `:`. The result is not JSON
    /// unless `key` carries its own quotes.
    ///
    /// @deprecated kept for callers producing JavaScript object literals
    @Deprecated
    public AfterColonContext compatWriteKeyWithoutQuotes(CharSequence key) {
        Objects.requireNonNull(key, "key");
        beginKey();
        rawWrite(key);
        rawWrite(':');
        stack.add(EntityKind.PAIR);
        return afterColonContext;
    }

    /// Writes `s` where a value is expected, e.g.
    /// `w.unsafeWriteValue("[1, 2, 3, \"o'clock\"]")`. The text is not checked.
    public ValueContext unsafeWriteValue(CharSequence s) {
        Objects.requireNonNull(s, "s");
        beginValue();
        rawWrite(s);
        endValue();
        return valueContext;
    }

    /// Writes `s` where a `key:value` pair is expected, e.g.
    /// `w.unsafeWritePair("\"adam\": \"male\", \"eve\": \"female\"")`.
    /// The text is not checked.
    public PairContext unsafeWritePair(CharSequence s) {
        Objects.requireNonNull(s, "s");
        beginKey();
        rawWrite(s);
        return pairContext;
    }

    /// Copies `s` to the output with no separators and no state change.
    public JsonWriter unsafeWriteRawBytes(CharSequence s) {
        Objects.requireNonNull(s, "s");
        rawWrite(s);
        return this;
    }

    /// Copies `len` characters of `c` starting at `off` to the output with no
    /// separators and no state change.
    public JsonWriter unsafeWriteRawBytes(char[] c, int off, int len) {
        Objects.checkFromIndexSize(off, len, c.length);
        try {
            out.append(CharBuffer.wrap(c, off, len));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    // ---- output ----

    /// {@return the text accumulated in the internal buffer}
    ///
    /// @throws JsonWriterException if the writer was given an external sink
    public String str() {
        return requireBuffer("str()").toString();
    }

    /// Moves the text accumulated in the internal buffer to `sink` and empties
    /// the buffer. Protocol state is kept, so writing can continue.
    ///
    /// @throws JsonWriterException if the writer was given an external sink
    public void flushTo(Appendable sink) {
        final StringBuilder buf = requireBuffer("flushTo()");
        Objects.requireNonNull(sink, "sink");
        final int length = buf.length();
        try {
            sink.append(buf);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        buf.setLength(0);
        LOG.fine(() -> "Flushed " + length + " chars to " + sink.getClass().getName());
    }

    /// Flushes the external sink if it is `Flushable`; nothing to do for the
    /// internal buffer.
    public void flush() {
        if (out instanceof Flushable flushable) {
            try {
                flushable.flush();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    // ---- snapshots ----

    /// {@return a copy of the protocol state, independent of this writer}
    public WriterState state() {
        return new WriterState(needComma, needNewline, stack);
    }

    /// Replaces the protocol state with `from`. Text already written is not
    /// touched.
    public void reset(WriterState from) {
        Objects.requireNonNull(from, "from");
        stack.clear();
        stack.addAll(from.stack());
        depth = from.depth();
        needComma = from.needComma();
        needNewline = from.needNewline();
        LOG.finer(() -> "Writer state reset to " + from);
    }

    // ---- bookkeeping ----

    PairContext pairContext() {
        return pairContext;
    }

    private ValueContext writeLiteral(String text) {
        beginValue();
        rawWrite(text);
        endValue();
        return valueContext;
    }

    private ValueContext writeNonFinite(double value) {
        if (!writeNanAsString) {
            throw new JsonWriterException("JSON writer: " + value
                    + " is not a valid JSON number; enable writeNanAsString to write it as a string");
        }
        return writeString(NumberFormatter.nonFiniteText(value));
    }

    private void beginValue() {
        if (keyExpected()) {
            throw valueWhereKeyExpected();
        }
        if (top() != EntityKind.PAIR) {
            writeComma();
        }
    }

    private void endValue() {
        if (top() == EntityKind.PAIR) {
            stack.remove(stack.size() - 1);
        }
    }

    private void beginKey() {
        if (top() == EntityKind.PAIR) {
            throw new JsonWriterException("JSON writer: key written, but expected a value for the previous key");
        }
        if (top() != EntityKind.OBJECT) {
            throw new JsonWriterException("JSON writer: key written outside of an object, innermost construct is " + top());
        }
        writeComma();
    }

    private void closeConstruct(char bracket) {
        stack.remove(stack.size() - 1);
        depth--;
        // needComma is still false when nothing was written inside
        if (needComma) {
            printIndentation(true);
        }
        rawWrite(bracket);
        needComma = true;
        needNewline = true;
        endValue();
    }

    private void writeComma() {
        if (needComma) {
            rawWrite(',');
        }
        needComma = true;
        if (needNewline) {
            printIndentation(false);
        }
        needNewline = true;
    }

    private void printIndentation(boolean closing) {
        if (indentSpaces == 0) {
            return;
        }
        if (depth == 0 && !closing) {
            return;
        }
        rawWrite('\n');
        rawWrite(" ".repeat(depth * indentSpaces));
    }

    private EntityKind top() {
        return stack.get(stack.size() - 1);
    }

    private JsonWriterException valueWhereKeyExpected() {
        return new JsonWriterException("JSON writer: value written, but expected a key:value pair");
    }

    private StringBuilder requireBuffer(String operation) {
        if (buffer == null) {
            throw new JsonWriterException("JSON writer: " + operation
                    + " is only available when the writer owns its buffer, but an external sink was given");
        }
        return buffer;
    }

    private void writeQuoted(CharSequence s, EscapeMode mode) {
        try {
            out.append('"');
            JsonEscaper.escape(s, mode, out);
            out.append('"');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void rawWrite(char c) {
        try {
            out.append(c);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void rawWrite(CharSequence s) {
        try {
            out.append(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
