package io.github.cyfko.formulalint.core;

import io.github.cyfko.formulalint.core.api.FormulaParser;
import io.github.cyfko.formulalint.core.ast.*;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.validation.FormulaAstValidator;
import io.github.cyfko.formulalint.core.validation.ValidationError;
import io.github.cyfko.formulalint.core.validation.ValidationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link FormulaLinter}, the parse-then-validate entry point.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("FormulaLinter Tests")
class FormulaLinterTest {

    @Nested
    @DisplayName("With the bundled operator table")
    class BundledTableTests {

        private FormulaLinter linter;

        @BeforeEach
        void setUp() {
            linter = new FormulaLinter();
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n\t"})
        @DisplayName("Blank formulas are valid and have no tree")
        void shouldAcceptBlankFormula(String formula) {
            LintReport report = linter.lint(formula);

            assertTrue(report.isValid());
            assertFalse(report.hasSyntaxError());
            assertNull(report.ast());
            assertEquals(LintReport.NO_ERRORS, report.format());
        }

        @Test
        void shouldReportValidFormula() {
            LintReport report = linter.lint("min:5:c:HP + 2*t:STR");

            assertTrue(report.isValid());
            assertInstanceOf(BinaryOp.class, report.ast());
            assertEquals(LintReport.NO_ERRORS, report.format());
        }

        @Test
        @DisplayName("Syntax errors stop before validation and carry their position")
        void shouldReportSyntaxError() {
            LintReport report = linter.lint("5*+2");

            assertTrue(report.hasSyntaxError());
            assertFalse(report.isValid());
            assertNull(report.ast());
            assertTrue(report.errors().isEmpty());
            assertEquals("Syntax error at 0:2: Invalid syntax: unary '+' is not supported by the game. "
                    + "Use '-' for negation or remove the '+'.", report.format());
        }

        @Test
        @DisplayName("Semantic problems are numbered with their paths")
        void shouldFormatValidationErrors() {
            LintReport report = linter.lint("mni:5:c:HP + lessThan:5");

            assertFalse(report.isValid());
            assertNotNull(report.ast());
            assertEquals(2, report.errors().size());
            assertEquals("""
                    1. [root.left] Unknown operator: 'mni'
                    2. [root.right] Operator 'lessThan' does not have a use case with 1 argument(s). \
                    Possible patterns: lessThan:threshold:formula""", report.format());
            assertTrue(report.errors().get(0).suggestions().contains("min"));
        }

        @Test
        @DisplayName("Positions are reported in the coordinates of the enclosing document")
        void shouldRebasePositions() {
            TextPosition base = new TextPosition(3, 4, 50);

            LintReport syntax = linter.lint("5*+2", base, ValidationOptions.defaults());
            assertEquals(new TextPosition(3, 6, 52), syntax.syntaxError().getPosition());

            LintReport semantic = linter.lint("1 + lesThan:5:c:HP", base, ValidationOptions.defaults());
            ValidationError error = semantic.errors().get(0);
            assertEquals(new TextPosition(3, 8, 54), error.position().start());
            assertEquals("lessThan", error.suggestions().get(0));
        }

        @Test
        @DisplayName("The formula parameter is only accepted when allowed")
        void shouldHonorValidationOptions() {
            assertFalse(linter.lint("min:x:c:HP").isValid());
            assertTrue(linter.lint("min:x:c:HP", TextPosition.ORIGIN, ValidationOptions.allowingX()).isValid());
        }
    }

    @Nested
    @DisplayName("Collaborators")
    class CollaboratorTests {

        private FormulaParser parser;
        private FormulaAstValidator validator;
        private FormulaLinter linter;

        @BeforeEach
        void setUp() {
            parser = mock(FormulaParser.class);
            validator = mock(FormulaAstValidator.class);
            linter = new FormulaLinter(parser, validator);
        }

        @Test
        void shouldNotValidateAfterSyntaxError() {
            when(parser.parse(eq("c:"), any(TextPosition.class)))
                    .thenThrow(new FormulaSyntaxException("boom", TextPosition.ORIGIN));

            LintReport report = linter.lint("c:");

            assertEquals("Syntax error at 0:0: boom", report.format());
            verifyNoInteractions(validator);
        }

        @Test
        void shouldPassTreeAndOptionsToValidator() {
            SourcePosition span = new SourcePosition(TextPosition.ORIGIN, new TextPosition(0, 1, 1));
            Literal one = new Literal(1, "1", span);
            ValidationOptions options = ValidationOptions.allowingX();
            when(parser.parse("1", TextPosition.ORIGIN)).thenReturn(one);
            when(validator.validate(one, FormulaAstValidator.ROOT_PATH, options)).thenReturn(List.of());

            LintReport report = linter.lint("1", TextPosition.ORIGIN, options);

            assertTrue(report.isValid());
            assertSame(one, report.ast());
            verify(validator).validate(one, FormulaAstValidator.ROOT_PATH, options);
        }

        @Test
        void shouldNotParseBlankFormula() {
            linter.lint("  ");

            verifyNoInteractions(parser, validator);
        }

        @Test
        void shouldRejectNullCollaborators() {
            assertThrows(IllegalArgumentException.class, () -> new FormulaLinter(null, validator));
            assertThrows(IllegalArgumentException.class, () -> new FormulaLinter(parser, null));
        }
    }
}
