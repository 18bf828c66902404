package io.github.cyfko.formulalint.core.ast;

/**
 * Anything produced by the parser that maps back to a span of the formula text.
 * Diagnostics point at a {@code SyntaxElement} so tooling can highlight or replace it.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SyntaxElement {

    /**
     * @return the span of formula text this element was parsed from
     */
    SourcePosition position();
}
