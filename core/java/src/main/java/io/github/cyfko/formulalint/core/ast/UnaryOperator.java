package io.github.cyfko.formulalint.core.ast;

/**
 * Prefix operators. {@link #PLUS} is only named so the tokenizer can report it.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum UnaryOperator {
    MINUS("-"),
    PLUS("+");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
