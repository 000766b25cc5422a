package json.writer;

/// Handle returned after a key: exactly one value must follow, after which
/// the object continues with a {@link PairContext}.
public final class AfterColonContext extends ValueWriter<PairContext> {

    AfterColonContext(JsonWriter writer) {
        super(writer);
    }

    @Override
    PairContext next() {
        return writer.pairContext();
    }
}
