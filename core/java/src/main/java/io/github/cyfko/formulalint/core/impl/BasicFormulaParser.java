package io.github.cyfko.formulalint.core.impl;

import io.github.cyfko.formulalint.core.api.FormulaParser;
import io.github.cyfko.formulalint.core.ast.AstNode;
import io.github.cyfko.formulalint.core.ast.TextPosition;
import io.github.cyfko.formulalint.core.config.FormulaPolicy;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.metadata.OperatorCatalogLoader;
import io.github.cyfko.formulalint.core.parsing.*;
import io.github.cyfko.formulalint.core.spi.OperatorCatalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive formula parser.
 * <p>
 * Each formula level goes through three steps:
 * </p>
 * <ol>
 *   <li>{@link FormulaTokenizer}: split into operands and operators</li>
 *   <li>{@link OperandClassifier}: turn each operand into a node, parsing nested formulas
 *       (bodies, parenthesized arguments) one level deeper</li>
 *   <li>{@link OperationTreeBuilder}: fold operands and operators by precedence</li>
 * </ol>
 * <p>
 * Before the first level, the whole formula is checked against {@link FormulaPolicy} limits and
 * by {@link ColonSyntaxChecker}. Nesting deeper than {@link FormulaPolicy#maxNestingDepth()} is
 * rejected.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 * AstNode ast = parser.parse("min:5:c:HP * 2");
 *
 * // Custom operator table, strict limits
 * FormulaParser strict = new BasicFormulaParser(OperatorCatalogLoader.fromClasspath("mod-operators.json"),
 *                                               FormulaPolicy.strict());
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> instances hold no mutable state and can be shared.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private final OperatorCatalog catalog;
    private final FormulaPolicy formulaPolicy;
    private final OperandClassifier classifier;

    /**
     * Uses the bundled operator table and {@link FormulaPolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(OperatorCatalogLoader.defaults(), FormulaPolicy.defaults());
    }

    /**
     * @param formulaPolicy parser limits
     * @throws IllegalArgumentException if formulaPolicy is null
     */
    public BasicFormulaParser(FormulaPolicy formulaPolicy) {
        this(OperatorCatalogLoader.defaults(), formulaPolicy);
    }

    /**
     * @param catalog       operator table used to split arguments and locate formula bodies
     * @param formulaPolicy parser limits
     * @throws IllegalArgumentException if an argument is null
     */
    public BasicFormulaParser(OperatorCatalog catalog, FormulaPolicy formulaPolicy) {
        if (catalog == null) {
            throw new IllegalArgumentException("Operator catalog is required");
        }
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.catalog = catalog;
        this.formulaPolicy = formulaPolicy;
        this.classifier = new OperandClassifier(catalog, this::parseLevel);
    }

    public OperatorCatalog getCatalog() {
        return catalog;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    @Override
    public AstNode parse(String formula) throws FormulaSyntaxException {
        return parse(formula, TextPosition.ORIGIN);
    }

    @Override
    public AstNode parse(String formula, TextPosition base) throws FormulaSyntaxException {
        if (base == null) {
            throw new IllegalArgumentException("Base position is required");
        }
        if (formula == null || formula.isBlank()) {
            throw new FormulaSyntaxException("Formula cannot be null or empty", base);
        }
        if (formula.length() > formulaPolicy.maxFormulaLength()) {
            throw new FormulaSyntaxException(String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    formula.length(), formulaPolicy.maxFormulaLength(), formulaPolicy.policyName()), base);
        }

        SourceText source = SourceText.of(formula, base);
        ColonSyntaxChecker.check(source);
        return parseLevel(source, 0);
    }

    private AstNode parseLevel(SourceText source, int depth) {
        if (depth > formulaPolicy.maxNestingDepth()) {
            throw new FormulaSyntaxException(String.format(
                    "Formula nested too deeply (max depth: %d). Policy applied: %s",
                    formulaPolicy.maxNestingDepth(), formulaPolicy.policyName()), source.start());
        }

        TokenizedFormula tokens = FormulaTokenizer.tokenize(source);
        List<AstNode> operands = new ArrayList<>(tokens.operands().size());
        for (SourceText operand : tokens.operands()) {
            operands.add(classifier.classify(operand, depth));
        }
        return OperationTreeBuilder.build(operands, tokens.operators(), tokens.unaryOperators());
    }
}
