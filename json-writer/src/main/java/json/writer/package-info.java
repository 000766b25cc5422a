/// Incremental JSON writer.
///
/// `JsonWriter` emits JSON text token by token and rejects any call that would
/// break the grammar. Its calls return handles whose methods are exactly the
/// calls allowed next:
///
/// | Handle              | Returned after                              | Offers                                  |
/// |---------------------|---------------------------------------------|-----------------------------------------|
/// | `ValueContext`      | a top-level value, a list element, `beginList()` | values, `beginList`/`beginObject`, `endList`, `str` |
/// | `PairContext`       | `beginObject()`, a complete `key:value`     | keys, `unsafeWritePair`, `endObject`    |
/// | `AfterColonContext` | a key                                       | exactly one value                       |
///
/// Strings are escaped by `JsonEscaper` under an `EscapeMode`; floating-point
/// values are rendered by `NumberFormatter` under a `FloatFormat`. Protocol
/// state can be saved with `JsonWriter.state()` and restored with
/// `JsonWriter.reset(WriterState)`.
package json.writer;
