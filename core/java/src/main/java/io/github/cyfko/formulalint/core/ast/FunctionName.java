package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Callee token of a {@link FunctionCall}. It only exists to give diagnostics about the operator
 * name a span that excludes the arguments.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionName(String value, SourcePosition position) implements AstNode {

    public FunctionName {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionName(this);
    }
}
