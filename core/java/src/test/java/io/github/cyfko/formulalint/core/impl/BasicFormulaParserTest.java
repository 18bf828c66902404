package io.github.cyfko.formulalint.core.impl;

import io.github.cyfko.formulalint.core.api.FormulaParser;
import io.github.cyfko.formulalint.core.ast.*;
import io.github.cyfko.formulalint.core.config.FormulaPolicy;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.metadata.OperatorCatalogLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link BasicFormulaParser}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicFormulaParser Tests")
class BasicFormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicFormulaParser();
    }

    @Nested
    @DisplayName("Accepted formulas")
    class ValidFormulaTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "5", "x", "X", "gswordDmg", "5abc", "abc", "-.1", "1e-3", "2.5E+3*2",
                "c:HP", "c:STR*2+5", "min:0:t:HP-c:ATK", "floor:c:critChance/100*c:ATK",
                "m:distance(32)", "m:rand(100)", "m:distance", "d:gswordDmg", "d:fireDmg(foo)", "d:gswordDmg(3)",
                "itemAt:10:20:chest", "-5", "1*-3", "10+-3", "-c:HP", "-52 + c:MagAtk * 2", "52 + c:MagAtk * 2",
                "distance(5)", "dist(5)", "distance(distance(2))", "min:5:c:HP+2", "between:10:20:c:STR",
                "hasStatus:burning:1", "gIs:questStage,3", "swapCasterID:actor1:c:STR", "mIs0:distance(2)",
                "c:HP\n+ t:STR", "hasStatus:"
        })
        @DisplayName("Parses without syntax error")
        void testValidFormulas(String formula) {
            assertNotNull(parser.parse(formula));
        }

        @Test
        @DisplayName("Structural parse ignores whether names exist")
        void testUnknownNamesParse() {
            assertInstanceOf(FunctionCall.class, parser.parse("lesThan:5:c:HP"));
            assertInstanceOf(FunctionCall.class, parser.parse("abs:5:10"));
        }
    }

    @Nested
    @DisplayName("Rejected formulas")
    class InvalidFormulaTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "abs:(1-2)", "abs:-2", "min:+5", "min: d:foo", "abs:&", "c:_foo",
                "5*+2", "+5", "(5", "5)", "--5", "5*", "*5", "5**2",
                "c:foo(3)", "abs(5)", "foo(3)", "(1+2)*3", "d:foo(1+2)", "distance(5)x", "d:foo(bar", "distance(5",
                "1e999", "2*d:foo(1e400)"
        })
        @DisplayName("Raises a syntax error")
        void testInvalidFormulas(String formula) {
            assertThrows(FormulaSyntaxException.class, () -> parser.parse(formula));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n\t"})
        @DisplayName("Blank formula is rejected")
        void testBlankFormula(String formula) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parser.parse(formula));
            assertTrue(e.getMessage().contains("cannot be null or empty"));
        }

        @Test
        @DisplayName("Unary plus is rejected wherever it appears")
        void testUnaryPlusEverywhere() {
            for (String formula : new String[]{"+2", "5*+2", "5++2", "min:5:c:HP*+2", "distance(+2)",
                    "d:gswordDmg(+5)", "m:distance(+3)", "1 + d:foo(2, +x)"}) {
                FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> parser.parse(formula), formula);
                assertTrue(e.getMessage().contains("unary '+'"), formula + ": " + e.getMessage());
            }
        }
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShapeTests {

        @Test
        @DisplayName("10-2*3 is 10-(2*3)")
        void testPrecedence() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("10-2*3"));
            assertEquals(BinaryOperator.SUBTRACT, root.operator());
            assertEquals(10.0, assertInstanceOf(Literal.class, root.left()).value());
            BinaryOp right = assertInstanceOf(BinaryOp.class, root.right());
            assertEquals(BinaryOperator.MULTIPLY, right.operator());
        }

        @Test
        @DisplayName("-5 is a negated literal")
        void testNegation() {
            UnaryOp root = assertInstanceOf(UnaryOp.class, parser.parse("-5"));
            assertEquals(5.0, assertInstanceOf(Literal.class, root.operand()).value());
        }

        @Test
        @DisplayName("-.1 is a negated literal .1")
        void testNegatedFraction() {
            UnaryOp root = assertInstanceOf(UnaryOp.class, parser.parse("-.1"));
            Literal literal = assertInstanceOf(Literal.class, root.operand());
            assertEquals(".1", literal.text());
            assertEquals(0.1, literal.value(), 1e-12);
        }

        @Test
        @DisplayName("1*-3 negates the right operand")
        void testNegatedRightOperand() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("1*-3"));
            assertInstanceOf(UnaryOp.class, root.right());
        }

        @Test
        @DisplayName("Formula body ends at the next top-level operator")
        void testBody() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("min:5:c:HP+2"));
            assertEquals(BinaryOperator.ADD, root.operator());

            FunctionCall min = assertInstanceOf(FunctionCall.class, root.left());
            assertEquals("min", min.name());
            assertEquals("5", assertInstanceOf(StringArg.class, min.args().get(0)).value());
            FunctionCall body = assertInstanceOf(FunctionCall.class, min.body());
            assertEquals("c", body.name());
            assertEquals("HP", assertInstanceOf(StringArg.class, body.args().get(0)).value());

            assertEquals(2.0, assertInstanceOf(Literal.class, root.right()).value());
        }

        @Test
        @DisplayName("Formula body keeps its own nested call chain")
        void testNestedBody() {
            FunctionCall min = assertInstanceOf(FunctionCall.class, parser.parse("min:5:max:1:c:HP"));
            FunctionCall max = assertInstanceOf(FunctionCall.class, min.body());
            assertEquals("max", max.name());
            assertEquals("c", assertInstanceOf(FunctionCall.class, max.body()).name());
        }

        @Test
        @DisplayName("Function-style argument of m")
        void testFunctionStyleArgument() {
            FunctionCall call = assertInstanceOf(FunctionCall.class, parser.parse("m:distance(32)"));
            FunctionStyleArg arg = assertInstanceOf(FunctionStyleArg.class, call.args().get(0));
            assertEquals("distance", arg.name());
            assertEquals(32.0, assertInstanceOf(Literal.class, arg.params().get(0)).value());
        }

        @Test
        @DisplayName("Parenthesized call argument is a full formula")
        void testMathFunctionArgument() {
            MathFunctionCall call = assertInstanceOf(MathFunctionCall.class, parser.parse("distance(c:HP/2)"));
            assertInstanceOf(BinaryOp.class, call.argument());
        }

        @Test
        @DisplayName("Printed tree of a composite formula")
        void testPrintedTree() {
            assertEquals("BinaryOp(+)\n"
                    + "  UnaryOp(-)\n"
                    + "    Literal(52)\n"
                    + "  BinaryOp(*)\n"
                    + "    Function(c)\n"
                    + "      args:\n"
                    + "        [0] \"MagAtk\"\n"
                    + "    Literal(2)", AstPrinter.print(parser.parse("-52 + c:MagAtk * 2")));
        }
    }

    @Nested
    @DisplayName("Positions")
    class PositionTests {

        @Test
        @DisplayName("Nodes carry spans of their source text")
        void testSpans() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("c:HP + t:STR"));
            FunctionCall right = assertInstanceOf(FunctionCall.class, root.right());
            assertEquals(7, right.position().start().offset());
            assertEquals(12, right.position().end().offset());
            assertEquals(new TextPosition(0, 8, 8), right.callee().position().end());
            assertEquals(0, root.position().start().offset());
            assertEquals(12, root.position().end().offset());
        }

        @Test
        @DisplayName("Unary node spans from its sign")
        void testUnarySpan() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("1 * - c:HP"));
            UnaryOp negation = assertInstanceOf(UnaryOp.class, root.right());
            assertEquals(4, negation.position().start().offset());
            assertEquals(10, negation.position().end().offset());
        }

        @Test
        @DisplayName("Nested body keeps document offsets")
        void testBodySpan() {
            FunctionCall min = assertInstanceOf(FunctionCall.class, parser.parse("min : 5 : c:HP"));
            assertEquals(10, min.body().position().start().offset());
            assertEquals(14, min.body().position().end().offset());
        }

        @Test
        @DisplayName("Base position shifts node and error positions")
        void testBasePosition() {
            TextPosition base = new TextPosition(3, 10, 100);
            AstNode node = parser.parse("c:HP", base);
            assertEquals(new TextPosition(3, 10, 100), node.position().start());
            assertEquals(new TextPosition(3, 14, 104), node.position().end());

            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> parser.parse("5*+2", new TextPosition(2, 4, 50)));
            assertEquals(new TextPosition(2, 6, 52), e.getPosition());
        }

        @Test
        @DisplayName("Second line operands report their line")
        void testMultiLine() {
            BinaryOp root = assertInstanceOf(BinaryOp.class, parser.parse("c:HP\n+ t:STR"));
            assertEquals(new TextPosition(1, 2, 7), root.right().position().start());
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class PolicyTests {

        @Test
        @DisplayName("Formula longer than the policy allows is rejected")
        void testTooLong() {
            FormulaParser shortParser = new BasicFormulaParser(FormulaPolicy.builder().maxFormulaLength(10).build());
            assertDoesNotThrow(() -> shortParser.parse("c:HP+c:HP"));
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> shortParser.parse("c:HP+c:HP+c:HP"));
            assertTrue(e.getMessage().contains("too long"));
            assertTrue(e.getMessage().contains("CUSTOM_POLICY"));
        }

        @Test
        @DisplayName("Nesting deeper than the policy allows is rejected")
        void testTooDeep() {
            FormulaParser shallow = new BasicFormulaParser(FormulaPolicy.builder().maxNestingDepth(1).build());
            assertDoesNotThrow(() -> shallow.parse("distance(2)"));
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> shallow.parse("distance(distance(2))"));
            assertTrue(e.getMessage().contains("nested too deeply"));
        }

        @Test
        @DisplayName("Null collaborators are rejected")
        void testNullArguments() {
            assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(null, FormulaPolicy.defaults()));
            assertThrows(IllegalArgumentException.class,
                    () -> new BasicFormulaParser(OperatorCatalogLoader.defaults(), null));
            assertThrows(IllegalArgumentException.class, () -> parser.parse("5", null));
        }
    }
}
