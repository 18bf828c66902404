package io.github.cyfko.formulalint.core.ast;

/**
 * Exhaustive dispatch over {@link AstNode} kinds.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AstVisitor<R> {

    R visitLiteral(Literal node);

    R visitVariable(Variable node);

    R visitFunctionCall(FunctionCall node);

    R visitGlobalReference(GlobalReference node);

    R visitFunctionName(FunctionName node);

    R visitMathFunctionCall(MathFunctionCall node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);
}
