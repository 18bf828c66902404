package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.BinaryOperator;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;

/**
 * Rejects an argument-separating colon that is not followed by a letter or digit.
 * <p>
 * {@code c:HP}, {@code m:distance(32)} and {@code d:gswordDmg} pass; {@code abs:(1-2)},
 * {@code abs:-2}, {@code min:+5}, {@code min: d:foo}, {@code c:_foo} and {@code abs:&} fail.
 * The check is purely lexical: it runs on the raw formula, whitespace included, before tokenizing.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ColonSyntaxChecker {

    private ColonSyntaxChecker() {}

    /**
     * @param source raw formula
     * @throws FormulaSyntaxException at the first character illegally following a colon
     */
    public static void check(SourceText source) {
        for (int i = 1; i + 1 < source.length(); i++) {
            if (source.charAt(i) != ':' || !isWordChar(source.charAt(i - 1))) {
                continue;
            }
            char next = source.charAt(i + 1);
            if (isLetterOrDigit(next)) {
                continue;
            }

            String operatorName = wordEndingAt(source, i - 1);
            String message = "Invalid syntax: '" + operatorName + ":" + next + "' - ";
            if (next == '(') {
                message += "parentheses cannot appear immediately after colon.";
            } else if (BinaryOperator.isOperatorChar(next)) {
                message += "math operator cannot appear immediately after colon.";
            } else if (Character.isWhitespace(next)) {
                message += "whitespace cannot appear after colon. Remove the whitespace.";
            } else if (next == '_') {
                message += "underscore cannot appear after colon. Colon must be followed by a letter or digit.";
            } else {
                message += "colon must be followed by a letter or digit, not '" + next + "'.";
            }
            throw new FormulaSyntaxException(message, source.positionAt(i + 1));
        }
    }

    private static String wordEndingAt(SourceText source, int lastIndex) {
        int start = lastIndex;
        while (start > 0 && isWordChar(source.charAt(start - 1))) {
            start--;
        }
        return source.subSequence(start, lastIndex + 1).toString();
    }

    private static boolean isWordChar(char c) {
        return isLetterOrDigit(c) || c == '_';
    }

    private static boolean isLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
