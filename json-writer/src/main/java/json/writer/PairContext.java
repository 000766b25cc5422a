package json.writer;

/// Handle returned inside an object when a key is expected: after
/// `beginObject()` and after each complete `key:value` pair.
public final class PairContext {

    private final JsonWriter writer;

    PairContext(JsonWriter writer) {
        this.writer = writer;
    }

    public AfterColonContext writeKey(CharSequence key) {
        return writer.writeKey(key);
    }

    public AfterColonContext writeKey(CharSequence key, EscapeMode mode) {
        return writer.writeKey(key, mode);
    }

    /// See {@link JsonWriter#unsafeWriteKey(CharSequence)}.
    public AfterColonContext unsafeWriteKey(CharSequence key) {
        return writer.unsafeWriteKey(key);
    }

    /// See {@link JsonWriter#compatWriteKeyWithoutQuotes(CharSequence)}.
    ///
    /// @deprecated kept for callers producing JavaScript object literals
    @Deprecated
    public AfterColonContext compatWriteKeyWithoutQuotes(CharSequence key) {
        return writer.compatWriteKeyWithoutQuotes(key);
    }

    /// See {@link JsonWriter#unsafeWritePair(CharSequence)}.
    public PairContext unsafeWritePair(CharSequence s) {
        return writer.unsafeWritePair(s);
    }

    public JsonWriter endObject() {
        return writer.endObject();
    }
}
