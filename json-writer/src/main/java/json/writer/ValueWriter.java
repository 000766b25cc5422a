package json.writer;

import json.value.JsonValue;

/// The value-writing calls shared by {@link ValueContext} and
/// {@link AfterColonContext}.
///
/// `C` is the handle returned once the value is complete: `ValueContext` for
/// list elements and top-level values, `PairContext` for the value of a key.
///
/// @param <C> the handle returned after a value is written
public abstract sealed class ValueWriter<C> permits ValueContext, AfterColonContext {

    final JsonWriter writer;

    ValueWriter(JsonWriter writer) {
        this.writer = writer;
    }

    /// The handle to return after a complete value.
    abstract C next();

    public C writeString(CharSequence s) {
        writer.writeString(s);
        return next();
    }

    public C writeString(CharSequence s, EscapeMode mode) {
        writer.writeString(s, mode);
        return next();
    }

    public C writeInt(int i) {
        writer.writeInt(i);
        return next();
    }

    public C writeLong(long l) {
        writer.writeLong(l);
        return next();
    }

    public C writeUnsignedLong(long l) {
        writer.writeUnsignedLong(l);
        return next();
    }

    public C writeFloat(float f) {
        writer.writeFloat(f);
        return next();
    }

    public C writeFloat(float f, FloatFormat format, int ndigits) {
        writer.writeFloat(f, format, ndigits);
        return next();
    }

    public C writeDouble(double d) {
        writer.writeDouble(d);
        return next();
    }

    public C writeDouble(double d, FloatFormat format, int ndigits) {
        writer.writeDouble(d, format, ndigits);
        return next();
    }

    public C writeBool(boolean b) {
        writer.writeBool(b);
        return next();
    }

    public C writeNull() {
        writer.writeNull();
        return next();
    }

    public C writeJsonValue(JsonValue value) {
        writer.writeJsonValue(value);
        return next();
    }

    public C writeJsonValue(JsonValue value, boolean sortKeys) {
        writer.writeJsonValue(value, sortKeys);
        return next();
    }

    /// See {@link JsonWriter#unsafeWriteValue(CharSequence)}.
    public C unsafeWriteValue(CharSequence s) {
        writer.unsafeWriteValue(s);
        return next();
    }

    public ValueContext beginList() {
        return writer.beginList();
    }

    public PairContext beginObject() {
        return writer.beginObject();
    }
}
