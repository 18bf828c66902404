package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds a flat operand/operator sequence into a precedence-correct expression tree.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * 1. Wrap every operand that has a recorded '-' sign into a UnaryOp
 *    and drop the "unary-" entries from the operator list.
 * 2. While a '*', '/' or '%' remains: combine the leftmost one with its two
 *    neighbours into a BinaryOp and continue on the shortened sequence.
 * 3. Combine what is left, '+' and '-' only, from left to right.
 * </pre>
 * <p>
 * Negation therefore binds tighter than any binary operator ({@code -5*2} is {@code (-5)*2}),
 * multiplicative operators bind tighter than additive ones, and operators of equal precedence
 * associate to the left ({@code 10-2-3} is {@code (10-2)-3}).
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless; the input lists are never modified.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperationTreeBuilder {

    private OperationTreeBuilder() {}

    /**
     * @param operands       classified operands
     * @param operators      operator symbols, {@link FormulaTokenizer#UNARY_MINUS} entries included
     * @param unaryOperators position of the sign negating an operand, keyed by operand index
     * @return the root of the expression
     * @throws IllegalStateException if operands and binary operators do not alternate
     */
    public static AstNode build(List<AstNode> operands, List<String> operators,
                                Map<Integer, SourcePosition> unaryOperators) {
        if (operands.isEmpty()) {
            throw new IllegalStateException("Cannot build an expression without operands");
        }

        List<AstNode> signed = new ArrayList<>(operands.size());
        for (int i = 0; i < operands.size(); i++) {
            AstNode operand = operands.get(i);
            SourcePosition sign = unaryOperators.get(i);
            signed.add(sign == null
                    ? operand
                    : new UnaryOp(UnaryOperator.MINUS, operand, SourcePosition.covering(sign, operand.position())));
        }

        List<BinaryOperator> binary = new ArrayList<>(operators.size());
        for (String symbol : operators) {
            if (FormulaTokenizer.UNARY_MINUS.equals(symbol)) {
                continue;
            }
            binary.add(BinaryOperator.fromSymbol(symbol)
                    .orElseThrow(() -> new IllegalStateException("Unknown arithmetic operator: " + symbol)));
        }

        if (binary.size() != signed.size() - 1) {
            throw new IllegalStateException(String.format(
                    "Expected %d binary operators between %d operands, got %d",
                    signed.size() - 1, signed.size(), binary.size()));
        }

        return fold(signed, binary);
    }

    private static AstNode fold(List<AstNode> operands, List<BinaryOperator> operators) {
        if (operators.isEmpty()) {
            return operands.get(0);
        }

        int index = firstMultiplicative(operators);
        if (index < 0) {
            AstNode result = operands.get(0);
            for (int i = 0; i < operators.size(); i++) {
                result = BinaryOp.of(operators.get(i), result, operands.get(i + 1));
            }
            return result;
        }

        List<AstNode> reducedOperands = new ArrayList<>(operands.size() - 1);
        reducedOperands.addAll(operands.subList(0, index));
        reducedOperands.add(BinaryOp.of(operators.get(index), operands.get(index), operands.get(index + 1)));
        reducedOperands.addAll(operands.subList(index + 2, operands.size()));

        List<BinaryOperator> reducedOperators = new ArrayList<>(operators.size() - 1);
        reducedOperators.addAll(operators.subList(0, index));
        reducedOperators.addAll(operators.subList(index + 1, operators.size()));

        return fold(reducedOperands, reducedOperators);
    }

    private static int firstMultiplicative(List<BinaryOperator> operators) {
        for (int i = 0; i < operators.size(); i++) {
            if (operators.get(i).isMultiplicative()) {
                return i;
            }
        }
        return -1;
    }
}
