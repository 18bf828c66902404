package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * The formula parameter, written {@code x} or {@code X}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(String name, SourcePosition position) implements AstNode {

    public Variable {
        if (!isVariableName(name)) {
            throw new IllegalArgumentException("Variable name must be 'x' or 'X', got: " + name);
        }
        Objects.requireNonNull(position, "position");
    }

    public static boolean isVariableName(String text) {
        return "x".equals(text) || "X".equals(text);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
