package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.AstNode;

/**
 * Parses a formula embedded in an operand: the body of {@code min:5:c:HP} or the argument of
 * {@code distance(1+2)}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface NestedFormulaParser {

    /**
     * @param source nested formula text
     * @param depth  nesting level of {@code source}, the top-level formula being 0
     * @return the parsed formula
     */
    AstNode parse(SourceText source, int depth);
}
