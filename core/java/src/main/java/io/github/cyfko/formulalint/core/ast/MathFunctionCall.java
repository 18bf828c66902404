package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Parenthesized call of a function-style operator: {@code distance(5)}.
 *
 * @param name     operator name as written
 * @param argument argument formula, or {@code null} for {@code name()}
 * @param position span of the call
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record MathFunctionCall(String name, AstNode argument, SourcePosition position) implements AstNode {

    public MathFunctionCall {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMathFunctionCall(this);
    }
}
