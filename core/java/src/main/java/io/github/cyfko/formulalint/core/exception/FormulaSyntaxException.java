package io.github.cyfko.formulalint.core.exception;

import io.github.cyfko.formulalint.core.api.FormulaParser;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.impl.BasicFormulaParser;

/**
 * Exception thrown when a formula is structurally malformed.
 * <p>
 * Parsing fails fast: the first structural problem aborts the whole parse, no partial tree is
 * returned, and the exception carries the position parsing had reached so that editors can put a
 * marker on the offending character. Whether the identifiers used in the formula actually exist is
 * not a syntax concern; that is reported later by the semantic validator.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Unary plus:</strong> {@code 5*+2} crashes the game and is always rejected</li>
 *   <li><strong>Unmatched Parentheses:</strong> {@code distance(5} or {@code c:HP)}</li>
 *   <li><strong>Bad colon usage:</strong> {@code abs:(1-2)}, {@code abs:-2}, {@code min: d:foo}, {@code abs:&}</li>
 *   <li><strong>Illegal parenthesized call:</strong> {@code min(5)} where {@code min} uses colon syntax</li>
 *   <li><strong>Arithmetic in a function-style parameter:</strong> {@code d:foo(1+2)}</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     AstNode ast = parser.parse(formula, valueStart);
 * } catch (FormulaSyntaxException e) {
 *     TextPosition where = e.getPosition();
 *     report(where.line(), where.column(), e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaParser
 * @see BasicFormulaParser
 */
public class FormulaSyntaxException extends RuntimeException {

    private final transient TextPosition position;

    /**
     * Constructor with an explanatory message and the position parsing reached.
     *
     * @param message  the message describing the problem, naming the offending character or operator
     * @param position where the problem was detected, {@code null} when it is not tied to a character
     */
    public FormulaSyntaxException(String message, TextPosition position) {
        super(message);
        this.position = position;
    }

    /**
     * Constructor for failures not tied to a position, such as an empty formula.
     *
     * @param message the message describing the problem
     */
    public FormulaSyntaxException(String message) {
        this(message, null);
    }

    /**
     * @return the position parsing reached, or {@code null} if the failure concerns the whole formula
     */
    public TextPosition getPosition() {
        return position;
    }
}
