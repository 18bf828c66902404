package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.BinaryOperator;
import io.github.cyfko.formulalint.core.ast.SourcePosition;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.utils.NumericLiterals;

import java.util.*;

/**
 * Single-pass splitter of one formula level into operands and arithmetic operators.
 * <p>
 * Only the top level is split: an operator between parentheses belongs to the operand that
 * contains it ({@code distance(1+2)} is one operand). Whitespace is dropped from operands but still
 * counted for positions.
 * </p>
 *
 * <p><strong>Operator roles:</strong></p>
 * <ul>
 *   <li>an operator right after an operand is binary</li>
 *   <li>a {@code -} at the start or after another operator negates the next operand</li>
 *   <li>a {@code +} in that place is rejected: the game has no unary plus</li>
 *   <li>a sign inside scientific notation ({@code 1e-3}) stays in the literal</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TokenizedFormula tokens = FormulaTokenizer.tokenize(SourceText.of("-c:HP * 2", TextPosition.ORIGIN));
 * // operands:       ["c:HP", "2"]
 * // operators:      ["unary-", "*"]
 * // unaryOperators: {0 -> 0:0-0:1}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaTokenizer {

    /** Operator entry marking a negation of the following operand. */
    public static final String UNARY_MINUS = "unary-";

    static final String UNARY_PLUS_NOT_SUPPORTED =
            "Invalid syntax: unary '+' is not supported by the game. Use '-' for negation or remove the '+'.";

    private FormulaTokenizer() {}

    /**
     * @param source formula text of one level
     * @return operands, operators and positions of that level
     * @throws FormulaSyntaxException on unbalanced parentheses, unary plus, or a misplaced operator
     */
    public static TokenizedFormula tokenize(SourceText source) {
        List<SourceText> operands = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        List<SourcePosition> positions = new ArrayList<>();
        Map<Integer, SourcePosition> unaryOperators = new HashMap<>();

        SourceText.Builder current = new SourceText.Builder();
        Deque<TextPosition> openParentheses = new ArrayDeque<>();
        TextPosition lastOperator = null;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);

            if (Character.isWhitespace(c)) {
                continue;
            }

            if (c == '(') {
                openParentheses.push(source.positionAt(i));
                current.append(source, i);
                continue;
            }

            if (c == ')') {
                if (openParentheses.isEmpty()) {
                    throw new FormulaSyntaxException("Mismatched parentheses: unmatched ')'", source.positionAt(i));
                }
                openParentheses.pop();
                current.append(source, i);
                continue;
            }

            if (!openParentheses.isEmpty() || !BinaryOperator.isOperatorChar(c)) {
                current.append(source, i);
                continue;
            }

            if ((c == '+' || c == '-') && !current.isEmpty() && i + 1 < source.length()
                    && NumericLiterals.continuesExponent(current.chars(), source.charAt(i + 1))) {
                current.append(source, i);
                continue;
            }

            lastOperator = source.positionAt(i);
            if (!current.isEmpty()) {
                flush(current, operands, positions);
                operators.add(String.valueOf(c));
            } else if (c == '-') {
                int negated = operands.size();
                if (unaryOperators.containsKey(negated)) {
                    throw new FormulaSyntaxException(
                            "Invalid syntax: consecutive '-' signs are not supported. Use a single '-' for negation.",
                            lastOperator);
                }
                unaryOperators.put(negated, source.span(i, i + 1));
                operators.add(UNARY_MINUS);
            } else if (c == '+') {
                throw new FormulaSyntaxException(UNARY_PLUS_NOT_SUPPORTED, lastOperator);
            } else {
                throw new FormulaSyntaxException(
                        "Operator '" + c + "' is missing its left operand", lastOperator);
            }
        }

        if (!openParentheses.isEmpty()) {
            throw new FormulaSyntaxException("Mismatched parentheses: unmatched '('", openParentheses.peek());
        }

        if (!current.isEmpty()) {
            flush(current, operands, positions);
        } else if (lastOperator != null) {
            throw new FormulaSyntaxException("Formula ends with an operator, expected an operand", lastOperator);
        } else {
            throw new FormulaSyntaxException("Formula cannot be empty", source.start());
        }

        checkConsistency(operands, operators, unaryOperators);
        return new TokenizedFormula(operands, operators, positions, unaryOperators);
    }

    private static void flush(SourceText.Builder current, List<SourceText> operands, List<SourcePosition> positions) {
        SourceText operand = current.build();
        operands.add(operand);
        positions.add(operand.span());
        current.clear();
    }

    private static void checkConsistency(List<SourceText> operands, List<String> operators,
                                         Map<Integer, SourcePosition> unaryOperators) {
        long unaryCount = operators.stream().filter(UNARY_MINUS::equals).count();
        if (unaryCount != unaryOperators.size()) {
            throw new IllegalStateException(String.format(
                    "Tokenizer recorded %d negations but %d unary positions", unaryCount, unaryOperators.size()));
        }
        for (Integer index : unaryOperators.keySet()) {
            if (index < 0 || index >= operands.size()) {
                throw new IllegalStateException("Negation recorded for missing operand #" + index);
            }
        }
        long binaryCount = operators.size() - unaryCount;
        if (binaryCount != operands.size() - 1) {
            throw new IllegalStateException(String.format(
                    "Tokenizer produced %d operands for %d binary operators", operands.size(), binaryCount));
        }
    }
}
