package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Bare identifier naming a global formula (or a runtime value) such as {@code gswordDmg}.
 *
 * @param name     the identifier
 * @param argument parenthesized argument, or {@code null}
 * @param position span of the reference
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record GlobalReference(String name, AstNode argument, SourcePosition position) implements AstNode {

    public GlobalReference {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGlobalReference(this);
    }
}
