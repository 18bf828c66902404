package io.github.cyfko.formulalint.core.ast;

/**
 * Node of a parsed formula.
 * <p>
 * The hierarchy is closed: every node kind is a record listed in {@code permits}, and
 * {@link AstVisitor} has one method per kind, so adding a kind breaks every visitor at compile time.
 * Nodes are immutable, never shared between trees and hold no reference to their parent.
 * </p>
 *
 * <table border="1">
 * <caption>Node kinds</caption>
 * <tr><th>Kind</th><th>Source form</th></tr>
 * <tr><td>{@link Literal}</td><td>{@code 5}, {@code .5}, {@code 1.5e-3}</td></tr>
 * <tr><td>{@link Variable}</td><td>{@code x}, {@code X}</td></tr>
 * <tr><td>{@link FunctionCall}</td><td>{@code c:HP}, {@code min:5:c:HP}, {@code m:distance(32)}</td></tr>
 * <tr><td>{@link GlobalReference}</td><td>{@code gswordDmg}</td></tr>
 * <tr><td>{@link FunctionName}</td><td>the {@code min} in {@code min:5:c:HP}</td></tr>
 * <tr><td>{@link MathFunctionCall}</td><td>{@code distance(5)}</td></tr>
 * <tr><td>{@link BinaryOp}</td><td>{@code a+b}, {@code a*b}</td></tr>
 * <tr><td>{@link UnaryOp}</td><td>{@code -a}</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface AstNode extends SyntaxElement
        permits Literal, Variable, FunctionCall, GlobalReference, FunctionName,
                MathFunctionCall, BinaryOp, UnaryOp {

    <R> R accept(AstVisitor<R> visitor);
}
