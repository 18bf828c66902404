package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Numeric constant.
 *
 * @param value    parsed value
 * @param text     the literal exactly as written, e.g. {@code 5.} or {@code 2E3}
 * @param position span of the literal
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Literal(double value, String text, SourcePosition position) implements AstNode {

    public Literal {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
