package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.SourcePosition;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link FormulaTokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("FormulaTokenizer Tests")
class FormulaTokenizerTest {

    private static TokenizedFormula tokenize(String formula) {
        return FormulaTokenizer.tokenize(SourceText.of(formula, TextPosition.ORIGIN));
    }

    private static List<String> operandTexts(TokenizedFormula tokens) {
        return tokens.operands().stream().map(SourceText::toString).toList();
    }

    @Nested
    @DisplayName("Operand and operator splitting")
    class SplittingTests {

        @Test
        @DisplayName("Binary operators split operands")
        void testBinaryOperators() {
            TokenizedFormula tokens = tokenize("c:STR*2+5");
            assertEquals(List.of("c:STR", "2", "5"), operandTexts(tokens));
            assertEquals(List.of("*", "+"), tokens.operators());
            assertTrue(tokens.unaryOperators().isEmpty());
            assertEquals(2, tokens.binaryOperatorCount());
        }

        @Test
        @DisplayName("Whitespace is dropped from operands")
        void testWhitespaceDropped() {
            TokenizedFormula tokens = tokenize("  c:H P  %  t : STR ");
            assertEquals(List.of("c:HP", "t:STR"), operandTexts(tokens));
            assertEquals(List.of("%"), tokens.operators());
        }

        @Test
        @DisplayName("Operators inside parentheses stay in the operand")
        void testParenthesesKeepOperators() {
            TokenizedFormula tokens = tokenize("distance(1+2)*3");
            assertEquals(List.of("distance(1+2)", "3"), operandTexts(tokens));
            assertEquals(List.of("*"), tokens.operators());
        }

        @ParameterizedTest
        @CsvSource({
                "1e-3+2, 1e-3",
                "2.5E+3*x, 2.5E+3",
                ".5e-1-1, .5e-1",
                "5.e+2/4, 5.e+2"
        })
        @DisplayName("Scientific notation sign stays in the literal")
        void testScientificNotation(String formula, String literal) {
            TokenizedFormula tokens = tokenize(formula);
            assertEquals(literal, tokens.operands().get(0).toString());
            assertEquals(2, tokens.operands().size());
            assertEquals(1, tokens.operators().size());
        }

        @Test
        @DisplayName("Exponent marker not followed by a digit is an operator boundary")
        void testExponentWithoutDigit() {
            TokenizedFormula tokens = tokenize("2e-x");
            assertEquals(List.of("2e", "x"), operandTexts(tokens));
            assertEquals(List.of("-"), tokens.operators());
        }
    }

    @Nested
    @DisplayName("Unary minus")
    class UnaryTests {

        @Test
        @DisplayName("Leading minus negates the first operand")
        void testLeadingMinus() {
            TokenizedFormula tokens = tokenize("-c:HP * 2");
            assertEquals(List.of("c:HP", "2"), operandTexts(tokens));
            assertEquals(List.of(FormulaTokenizer.UNARY_MINUS, "*"), tokens.operators());
            SourcePosition sign = tokens.unaryOperators().get(0);
            assertEquals(new TextPosition(0, 0, 0), sign.start());
            assertEquals(new TextPosition(0, 1, 1), sign.end());
        }

        @Test
        @DisplayName("Minus after an operator negates the next operand")
        void testMinusAfterOperator() {
            TokenizedFormula tokens = tokenize("10+-3");
            assertEquals(List.of("+", FormulaTokenizer.UNARY_MINUS), tokens.operators());
            assertEquals(1, tokens.unaryOperators().size());
            assertTrue(tokens.unaryOperators().containsKey(1));
        }

        @Test
        @DisplayName("Binary minus followed by a negation")
        void testBinaryThenUnaryMinus() {
            TokenizedFormula tokens = tokenize("5--3");
            assertEquals(List.of("-", FormulaTokenizer.UNARY_MINUS), tokens.operators());
            assertTrue(tokens.unaryOperators().containsKey(1));
        }
    }

    @Nested
    @DisplayName("Positions")
    class PositionTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "c:STR*2+5",
                "  min:5:c:HP  +  t:STR",
                "c:H P+1",
                "-52 + c:MagAtk * 2",
                "c:HP +\n  t:STR\n*\tx",
                "distance( 1 + 2 ) % 3"
        })
        @DisplayName("Operand end is its start advanced over its source text")
        void testPositionRoundTrip(String formula) {
            TokenizedFormula tokens = tokenize(formula);
            assertEquals(tokens.operands().size(), tokens.positions().size());
            for (SourcePosition position : tokens.positions()) {
                String raw = formula.substring(position.start().offset(), position.end().offset());
                assertEquals(position.end(), position.start().advance(raw), "operand '" + raw + "'");
            }
        }

        @Test
        @DisplayName("Newlines move operands to the next line")
        void testMultiLinePositions() {
            TokenizedFormula tokens = tokenize("c:HP +\n  t:STR");
            SourcePosition second = tokens.positions().get(1);
            assertEquals(new TextPosition(1, 2, 9), second.start());
            assertEquals(new TextPosition(1, 7, 14), second.end());
        }

        @Test
        @DisplayName("Positions are relative to the base position")
        void testBasePosition() {
            TokenizedFormula tokens = FormulaTokenizer.tokenize(SourceText.of("1+c:HP", new TextPosition(4, 10, 120)));
            assertEquals(new TextPosition(4, 12, 122), tokens.positions().get(1).start());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrorTests {

        @ParameterizedTest
        @CsvSource({
                "'5*+2', 2, unary '+'",
                "'+5', 0, unary '+'",
                "'(5', 0, unmatched '('",
                "'distance((5)', 8, unmatched '('",
                "'5)', 1, unmatched ')'",
                "'--5', 1, consecutive '-'",
                "'5*', 1, ends with an operator",
                "'5 - ', 2, ends with an operator",
                "'*5', 0, missing its left operand",
                "'5**2', 2, missing its left operand",
                "'   ', 0, cannot be empty"
        })
        @DisplayName("Structural errors report the offending character")
        void testSyntaxErrors(String formula, int offset, String fragment) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> tokenize(formula));
            assertTrue(e.getMessage().contains(fragment), e.getMessage());
            assertEquals(offset, e.getPosition().offset());
        }
    }
}
