package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.SourcePosition;

import java.util.List;
import java.util.Map;

/**
 * Flat result of tokenizing one formula level.
 *
 * @param operands       operand texts, whitespace removed, in order
 * @param operators      operator symbols in order; a negation is recorded as
 *                       {@link FormulaTokenizer#UNARY_MINUS}
 * @param positions      span of each operand, same indexes as {@code operands}
 * @param unaryOperators position of the {@code -} sign, keyed by the index of the operand it negates
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TokenizedFormula(List<SourceText> operands,
                               List<String> operators,
                               List<SourcePosition> positions,
                               Map<Integer, SourcePosition> unaryOperators) {

    public TokenizedFormula {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        positions = List.copyOf(positions);
        unaryOperators = Map.copyOf(unaryOperators);
    }

    public long binaryOperatorCount() {
        return operators.stream().filter(op -> !FormulaTokenizer.UNARY_MINUS.equals(op)).count();
    }
}
