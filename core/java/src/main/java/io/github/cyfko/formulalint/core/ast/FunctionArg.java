package io.github.cyfko.formulalint.core.ast;

/**
 * Positional argument of a {@link FunctionCall}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FunctionArg extends SyntaxElement permits StringArg, FunctionStyleArg {
}
