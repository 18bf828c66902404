package io.github.cyfko.formulalint.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Colon-syntax operator call: {@code name:arg1:arg2...}, optionally followed by a nested formula
 * body for operators declaring a {@code formula} argument ({@code min:5:c:HP}).
 *
 * @param name     operator name as written (possibly an alias)
 * @param callee   span of the name token
 * @param args     positional arguments, body excluded
 * @param body     nested formula, or {@code null}
 * @param position span of the whole call
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionCall(String name, FunctionName callee, List<FunctionArg> args, AstNode body,
                           SourcePosition position) implements AstNode {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callee, "callee");
        args = List.copyOf(args);
        Objects.requireNonNull(position, "position");
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Explicit arguments plus one for the body, if any.
     */
    public int effectiveArgumentCount() {
        return args.size() + (hasBody() ? 1 : 0);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
