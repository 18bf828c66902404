package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Negation of an operand. A unary plus is rejected while tokenizing, so {@code operator} is
 * always {@link UnaryOperator#MINUS}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UnaryOp(UnaryOperator operator, AstNode operand, SourcePosition position) implements AstNode {

    public UnaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
        Objects.requireNonNull(position, "position");
        if (operator == UnaryOperator.PLUS) {
            throw new IllegalArgumentException("Unary '+' is not a valid formula operator");
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
