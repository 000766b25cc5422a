package json.writer;

import java.util.List;
import java.util.Objects;

/// Snapshot of a writer's protocol state: the context stack and the two
/// pending-separator flags.
///
/// A snapshot says nothing about text already written. It is only meaningful
/// when restored against the same writer at the same output position it was
/// taken at; rolling back text as well needs a sink that can be truncated.
///
/// @param needComma   the next token in the current construct is preceded by a comma
/// @param needNewline the next token starts a new indented line (pretty printing only)
/// @param stack       the context stack, bottom first; always starts with `OUTER_SPACE`
public record WriterState(boolean needComma, boolean needNewline, List<EntityKind> stack) {

    /// @throws IllegalArgumentException if no writer can reach `stack`: it must
    ///         start with `OUTER_SPACE`, hold no other `OUTER_SPACE`, and have
    ///         each `PAIR` directly above an `OBJECT`
    public WriterState {
        stack = List.copyOf(Objects.requireNonNull(stack, "stack"));
        if (stack.isEmpty() || stack.get(0) != EntityKind.OUTER_SPACE) {
            throw new IllegalArgumentException("Context stack must start with OUTER_SPACE: " + stack);
        }
        for (int i = 1; i < stack.size(); i++) {
            final EntityKind kind = stack.get(i);
            if (kind == EntityKind.OUTER_SPACE) {
                throw new IllegalArgumentException("OUTER_SPACE above the bottom of the context stack: " + stack);
            }
            if (kind == EntityKind.PAIR && stack.get(i - 1) != EntityKind.OBJECT) {
                throw new IllegalArgumentException("PAIR not directly above OBJECT: " + stack);
            }
        }
    }

    /// {@return the innermost open construct}
    public EntityKind top() {
        return stack.get(stack.size() - 1);
    }

    /// {@return the number of open lists and objects}
    public int depth() {
        int depth = 0;
        for (EntityKind kind : stack) {
            if (kind == EntityKind.LIST || kind == EntityKind.OBJECT) {
                depth++;
            }
        }
        return depth;
    }
}
