package json.writer;

/// Kind of construct open at one level of the writer's context stack.
public enum EntityKind {
    /// Nothing open: the bottom of every stack.
    OUTER_SPACE,
    /// Inside `[` ... `]`.
    LIST,
    /// Inside `{` ... `}` with a key expected next.
    OBJECT,
    /// After `"key":`, waiting for exactly one value.
    PAIR
}
