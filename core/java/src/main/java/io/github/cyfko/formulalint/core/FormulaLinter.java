package io.github.cyfko.formulalint.core;

import io.github.cyfko.formulalint.core.api.FormulaParser;
import io.github.cyfko.formulalint.core.ast.AstNode;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.config.FormulaPolicy;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.impl.BasicFormulaParser;
import io.github.cyfko.formulalint.core.metadata.OperatorCatalogLoader;
import io.github.cyfko.formulalint.core.spi.OperatorCatalog;
import io.github.cyfko.formulalint.core.validation.FormulaAstValidator;
import io.github.cyfko.formulalint.core.validation.ValidationError;
import io.github.cyfko.formulalint.core.validation.ValidationOptions;

import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point running parse then validation over a formula.
 * <p>
 * Tools embedding formulas in larger files (mod definitions, editors) call
 * {@link #lint(String, TextPosition, ValidationOptions)} with the formula substring and the
 * position it starts at, and get back positions in file coordinates.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaLinter linter = new FormulaLinter();
 *
 * LintReport report = linter.lint("mni:5:c:HP");
 * report.isValid();   // false
 * report.format();    // 1. [root] Unknown operator: 'mni'
 *
 * // Inside a global formula definition starting at line 12, column 8
 * linter.lint("x*2", new TextPosition(12, 8, 340), ValidationOptions.allowingX());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaLinter {

    private static final Logger log = Logger.getLogger(FormulaLinter.class.getName());

    private final FormulaParser parser;
    private final FormulaAstValidator validator;

    /**
     * Uses the bundled operator table and {@link FormulaPolicy#defaults()}.
     */
    public FormulaLinter() {
        this(OperatorCatalogLoader.defaults(), FormulaPolicy.defaults());
    }

    public FormulaLinter(OperatorCatalog catalog, FormulaPolicy formulaPolicy) {
        this(new BasicFormulaParser(catalog, formulaPolicy), new FormulaAstValidator(catalog, formulaPolicy));
    }

    /**
     * @throws IllegalArgumentException if an argument is null
     */
    public FormulaLinter(FormulaParser parser, FormulaAstValidator validator) {
        if (parser == null) {
            throw new IllegalArgumentException("Formula parser is required");
        }
        if (validator == null) {
            throw new IllegalArgumentException("Formula validator is required");
        }
        this.parser = parser;
        this.validator = validator;
    }

    public LintReport lint(String formula) {
        return lint(formula, TextPosition.ORIGIN, ValidationOptions.defaults());
    }

    /**
     * @param formula formula text; blank text is valid (the game reads it as 0)
     * @param base    position of the first formula character in the enclosing document
     * @param options validation context
     * @return the report; never throws for problems in the formula itself
     */
    public LintReport lint(String formula, TextPosition base, ValidationOptions options) {
        if (formula == null || formula.isBlank()) {
            log.fine("Blank formula, nothing to lint");
            return LintReport.blank(formula);
        }

        AstNode ast;
        try {
            ast = parser.parse(formula, base);
        } catch (FormulaSyntaxException e) {
            log.fine(() -> String.format("Syntax error in formula '%s' at %s: %s", formula, e.getPosition(), e.getMessage()));
            return LintReport.syntaxError(formula, e);
        }

        List<ValidationError> errors = validator.validate(ast, FormulaAstValidator.ROOT_PATH, options);
        log.fine(() -> String.format("Formula '%s' parsed with %d validation error(s)", formula, errors.size()));
        return LintReport.parsed(formula, ast, errors);
    }
}
