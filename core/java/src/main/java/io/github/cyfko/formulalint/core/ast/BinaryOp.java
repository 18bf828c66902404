package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Arithmetic between two operands.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BinaryOp(BinaryOperator operator, AstNode left, AstNode right, SourcePosition position)
        implements AstNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Builds the node spanning from {@code left} to {@code right}.
     */
    public static BinaryOp of(BinaryOperator operator, AstNode left, AstNode right) {
        return new BinaryOp(operator, left, right, SourcePosition.covering(left.position(), right.position()));
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
