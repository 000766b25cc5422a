package json.writer;

/// Handle returned after a value at the top level or inside a list: more
/// values may follow, or the list may be closed. Keys are not offered.
public final class ValueContext extends ValueWriter<ValueContext> {

    ValueContext(JsonWriter writer) {
        super(writer);
    }

    @Override
    ValueContext next() {
        return this;
    }

    public JsonWriter endList() {
        return writer.endList();
    }

    /// See {@link JsonWriter#str()}.
    public String str() {
        return writer.str();
    }
}
