package io.github.cyfko.formulalint.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary arithmetic operators, in two precedence levels.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperator {
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", true),
    DIVIDE("/", true),
    MODULO("%", true);

    private final String symbol;
    private final boolean multiplicative;

    BinaryOperator(String symbol, boolean multiplicative) {
        this.symbol = symbol;
        this.multiplicative = multiplicative;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * {@code *}, {@code /} and {@code %} bind before {@code +} and {@code -}.
     */
    public boolean isMultiplicative() {
        return multiplicative;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    public static boolean isOperatorChar(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '%';
    }
}
