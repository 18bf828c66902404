package io.github.cyfko.formulalint.core.utils;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Recognizes numeric literals the way the game's number conversion accepts them:
 * {@code 5}, {@code 5.0}, {@code 5.}, {@code .5}, {@code 1e5}, {@code 2.5E-3}, {@code 1e+3}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NumericLiterals {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\d*\\.\\d+)([eE][+-]?\\d+)?");

    /** A mantissa immediately followed by the exponent marker, e.g. {@code 1.5e} in {@code 1.5e-3}. */
    private static final Pattern EXPONENT_PREFIX = Pattern.compile("-?(\\d+\\.?\\d*|\\d*\\.\\d+)[eE]");

    private NumericLiterals() {}

    public static boolean isNumeric(String text) {
        return text != null && NUMBER.matcher(text).matches();
    }

    /**
     * @param text candidate literal
     * @return its value, or empty if {@code text} is not a numeric literal
     */
    public static OptionalDouble parse(String text) {
        if (!isNumeric(text)) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(text);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * Tells whether a sign following {@code operandSoFar} belongs to a scientific-notation exponent
     * rather than being an arithmetic operator.
     *
     * @param operandSoFar the operand text collected before the sign
     * @param next         the character after the sign
     * @return {@code true} if the sign is part of the literal
     */
    public static boolean continuesExponent(CharSequence operandSoFar, char next) {
        return Character.isDigit(next) && EXPONENT_PREFIX.matcher(operandSoFar).matches();
    }
}
