package io.github.cyfko.formulalint.core;

import io.github.cyfko.formulalint.core.ast.AstNode;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.validation.ValidationError;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Outcome of linting one formula.
 * <p>
 * Exactly one of three shapes: blank formula (no AST, no problems), syntax error (no AST, the
 * exception set), or parsed formula (AST set, zero or more validation errors).
 * </p>
 *
 * @param formula     the linted text
 * @param ast         parsed tree, or {@code null} for a blank formula or a syntax error
 * @param syntaxError first structural error, or {@code null}
 * @param errors      semantic problems, empty unless the formula parsed
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LintReport(String formula, AstNode ast, FormulaSyntaxException syntaxError,
                         List<ValidationError> errors) {

    public static final String NO_ERRORS = "No validation errors found.";

    public LintReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (syntaxError != null && (ast != null || !errors.isEmpty())) {
            throw new IllegalArgumentException("A report with a syntax error holds neither AST nor validation errors");
        }
    }

    static LintReport blank(String formula) {
        return new LintReport(formula, null, null, List.of());
    }

    static LintReport syntaxError(String formula, FormulaSyntaxException error) {
        return new LintReport(formula, null, error, List.of());
    }

    static LintReport parsed(String formula, AstNode ast, List<ValidationError> errors) {
        return new LintReport(formula, ast, null, errors);
    }

    public boolean isValid() {
        return syntaxError == null && errors.isEmpty();
    }

    public boolean hasSyntaxError() {
        return syntaxError != null;
    }

    /**
     * @return the syntax error message with its position, or one numbered line per validation error
     */
    public String format() {
        if (syntaxError != null) {
            return syntaxError.getPosition() == null
                    ? "Syntax error: " + syntaxError.getMessage()
                    : "Syntax error at " + syntaxError.getPosition() + ": " + syntaxError.getMessage();
        }
        return formatErrors(errors);
    }

    /**
     * Renders {@code 1. [path] message} lines, or {@value #NO_ERRORS}.
     */
    public static String formatErrors(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            return NO_ERRORS;
        }
        return IntStream.range(0, errors.size())
                .mapToObj(i -> (i + 1) + ". [" + errors.get(i).path() + "] " + errors.get(i).message())
                .collect(Collectors.joining("\n"));
    }
}
