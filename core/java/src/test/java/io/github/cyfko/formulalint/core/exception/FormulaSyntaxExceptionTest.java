package io.github.cyfko.formulalint.core.exception;

import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.impl.BasicFormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaSyntaxExceptionTest {

    @Test
    @DisplayName("Should create FormulaSyntaxException with message and position")
    void shouldCreateWithMessageAndPosition() {
        // Given
        TextPosition position = new TextPosition(2, 7, 31);

        // When
        FormulaSyntaxException exception = new FormulaSyntaxException("Mismatched parentheses", position);

        // Then
        assertEquals("Mismatched parentheses", exception.getMessage());
        assertSame(position, exception.getPosition());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should allow a failure not tied to a position")
    void shouldCreateWithoutPosition() {
        FormulaSyntaxException exception = new FormulaSyntaxException("Formula cannot be null or empty");

        assertNull(exception.getPosition());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeRuntimeException() {
        assertInstanceOf(RuntimeException.class, new FormulaSyntaxException("test"));
        assertInstanceOf(RuntimeException.class, new OperatorDefinitionException("test"));
    }

    @Test
    @DisplayName("Should point at the offending character when thrown by the parser")
    void shouldCarryParserPosition() {
        FormulaSyntaxException exception = assertThrows(FormulaSyntaxException.class,
                () -> new BasicFormulaParser().parse("c:HP +\n  (2"));

        assertEquals("Mismatched parentheses: unmatched '('", exception.getMessage());
        assertEquals(new TextPosition(1, 2, 9), exception.getPosition());
    }

    @Test
    @DisplayName("Should keep the cause of a definition error")
    void shouldKeepDefinitionCause() {
        Throwable cause = new IllegalStateException("root cause");

        OperatorDefinitionException exception = new OperatorDefinitionException("Invalid operator table", cause);

        assertEquals("Invalid operator table", exception.getMessage());
        assertSame(cause, exception.getCause());
    }
}
