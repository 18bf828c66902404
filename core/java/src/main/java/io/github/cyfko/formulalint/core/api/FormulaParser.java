package io.github.cyfko.formulalint.core.api;

import io.github.cyfko.formulalint.core.ast.AstNode;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;

/**
 * Parser turning a game formula into an {@link AstNode} tree.
 *
 * <h2>Formula Grammar</h2>
 * <table border="1">
 * <caption>Formula Element Reference</caption>
 * <thead>
 * <tr><th>Element</th><th>Example</th><th>Node</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Number</td><td>5, .5, 1e-3</td><td>Literal</td></tr>
 * <tr><td>Parameter</td><td>x, X</td><td>Variable</td></tr>
 * <tr><td>Colon call</td><td>c:HP, min:5:c:HP</td><td>FunctionCall</td></tr>
 * <tr><td>Function-style argument</td><td>m:distance(32), d:gswordDmg(3)</td><td>FunctionCall with FunctionStyleArg</td></tr>
 * <tr><td>Parenthesized call</td><td>distance(5)</td><td>MathFunctionCall</td></tr>
 * <tr><td>Global formula</td><td>gswordDmg</td><td>GlobalReference</td></tr>
 * <tr><td>Arithmetic</td><td>a + b, a * b, a % b</td><td>BinaryOp</td></tr>
 * <tr><td>Negation</td><td>-c:HP</td><td>UnaryOp</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Precedence</h2>
 * <p>
 * Negation binds tightest, then {@code * / %}, then {@code + -}; equal precedence associates left.
 * Parentheses never group arithmetic: they only enclose call arguments.
 * </p>
 *
 * <h2>Invalid Formula Examples</h2>
 * <pre>{@code
 * parser.parse("");            // FormulaSyntaxException: empty formula
 * parser.parse("abs:(1-2)");   // FormulaSyntaxException: parenthesis right after a colon
 * parser.parse("min:+5");      // FormulaSyntaxException: operator right after a colon
 * parser.parse("5*+2");        // FormulaSyntaxException: unary '+'
 * parser.parse("distance(5");  // FormulaSyntaxException: unmatched '('
 * }</pre>
 * <p>
 * The parser checks structure only. Whether operator names exist and arguments fit their declared
 * types is the job of {@link io.github.cyfko.formulalint.core.validation.FormulaAstValidator}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses a formula whose first character is at line 0, column 0.
     *
     * @param formula formula text, must not be blank
     * @return the root node
     * @throws FormulaSyntaxException on the first structural error
     */
    AstNode parse(String formula) throws FormulaSyntaxException;

    /**
     * Parses a formula embedded in a larger document.
     *
     * @param formula formula text, must not be blank
     * @param base    document position of the first formula character; every node position and
     *                error position is expressed in document coordinates
     * @return the root node
     * @throws FormulaSyntaxException on the first structural error
     */
    AstNode parse(String formula, TextPosition base) throws FormulaSyntaxException;
}
