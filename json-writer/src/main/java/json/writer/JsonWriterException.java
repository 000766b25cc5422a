package json.writer;

/// Thrown when a call would break the JSON grammar or misuse the writer's buffer.
///
/// The failing call leaves the writer as it was, so the caller may carry on
/// with a different call.
public final class JsonWriterException extends RuntimeException {
    public JsonWriterException(String message) {
        super(message);
    }

    public JsonWriterException(String message, Throwable cause) {
        super(message, cause);
    }
}
