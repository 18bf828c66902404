package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColonSyntaxChecker Tests")
class ColonSyntaxCheckerTest {

    private static void check(String formula) {
        ColonSyntaxChecker.check(SourceText.of(formula, TextPosition.ORIGIN));
    }

    @ParameterizedTest
    @ValueSource(strings = {"c:HP", "m:distance(32)", "d:gswordDmg", "min:5:c:HP", "hasStatus:", "gIs:questStage,3"})
    @DisplayName("Colon followed by a letter or digit is accepted")
    void testValidColons(String formula) {
        assertDoesNotThrow(() -> check(formula));
    }

    @ParameterizedTest
    @CsvSource({
            "'abs:(1-2)', 4, parentheses cannot appear immediately after colon",
            "'abs:-2', 4, math operator cannot appear immediately after colon",
            "'min:+5', 4, math operator cannot appear immediately after colon",
            "'min: d:foo', 4, whitespace cannot appear after colon",
            "'c:_foo', 2, underscore cannot appear after colon",
            "'abs:&', 4, 'colon must be followed by a letter or digit, not ''&'''"
    })
    @DisplayName("Invalid character after a colon is rejected at that character")
    void testInvalidColons(String formula, int offset, String fragment) {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> check(formula));
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
        assertEquals(offset, e.getPosition().offset());
    }

    @Test
    @DisplayName("Message names the operator before the colon")
    void testMessageNamesOperator() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> check("1 + between:(5)"));
        assertTrue(e.getMessage().startsWith("Invalid syntax: 'between:(' - "), e.getMessage());
    }
}
