package io.github.cyfko.formulalint.core.validation;

import io.github.cyfko.formulalint.core.ast.*;
import io.github.cyfko.formulalint.core.config.FormulaPolicy;
import io.github.cyfko.formulalint.core.exception.OperatorDefinitionException;
import io.github.cyfko.formulalint.core.metadata.*;
import io.github.cyfko.formulalint.core.spi.OperatorCatalog;
import io.github.cyfko.formulalint.core.utils.NumericLiterals;
import io.github.cyfko.formulalint.core.utils.SimilarityMatch;
import io.github.cyfko.formulalint.core.utils.StringSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a parsed formula against the operator table.
 * <p>
 * Unlike parsing, validation never stops at the first problem: every issue found anywhere in the
 * tree is reported, each with the path of the offending node and, for misspelled names, ranked
 * suggestions.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li><strong>Colon call</strong>: the name must resolve (aliases included); the number of
 *       arguments, body counted as one, must match a declared use-case; each argument must fit the
 *       declared type of that use-case; function-style operators outside the {@code m}/{@code d}
 *       families must not be called with colons</li>
 *   <li><strong>Parenthesized call</strong>: the name must be a canonical function-style operator</li>
 *   <li><strong>Function-style argument</strong>: {@code m:} functions must exist; parameters are
 *       checked against the function's (or, for {@code d}, the operator's) widest use-case</li>
 * </ul>
 * <p>
 * An operator declaring {@code delegatesTo} takes its argument shapes from the delegate, while
 * messages keep the name the user wrote.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FormulaAstValidator validator = new FormulaAstValidator();
 * List<ValidationError> errors = validator.validate(parser.parse("lesThan:5:c:HP"));
 * // Unknown operator: 'lesThan'  (suggestions: [lessThan])
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> stateless apart from the immutable catalog; instances can be shared.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaAstValidator {

    public static final String ROOT_PATH = "root";

    private static final Set<String> BOOLEAN_VALUES = Set.of("true", "false", "0", "1");

    private final OperatorCatalog catalog;
    private final FormulaPolicy formulaPolicy;

    public FormulaAstValidator() {
        this(OperatorCatalogLoader.defaults(), FormulaPolicy.defaults());
    }

    /**
     * @param catalog       operator table
     * @param formulaPolicy suggestion limits
     * @throws IllegalArgumentException if an argument is null
     */
    public FormulaAstValidator(OperatorCatalog catalog, FormulaPolicy formulaPolicy) {
        if (catalog == null) {
            throw new IllegalArgumentException("Operator catalog is required");
        }
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        this.catalog = catalog;
        this.formulaPolicy = formulaPolicy;
    }

    public List<ValidationError> validate(AstNode root) {
        return validate(root, ROOT_PATH, ValidationOptions.defaults());
    }

    public List<ValidationError> validate(AstNode root, ValidationOptions options) {
        return validate(root, ROOT_PATH, options);
    }

    /**
     * @param node    tree to check
     * @param path    path of {@code node}, prefix of every reported path
     * @param options caller context
     * @return every problem found, in tree order; empty if the formula is valid
     * @throws OperatorDefinitionException if the operator table itself is inconsistent
     */
    public List<ValidationError> validate(AstNode node, String path, ValidationOptions options) {
        if (node == null) {
            throw new IllegalArgumentException("Node to validate is required");
        }
        List<ValidationError> errors = new ArrayList<>();
        visit(node, path, options == null ? ValidationOptions.defaults() : options, errors);
        return List.copyOf(errors);
    }

    private void visit(AstNode node, String path, ValidationOptions options, List<ValidationError> errors) {
        node.accept(new NodeChecker(path, options, errors));
    }

    /**
     * Per-node rules; children are visited with a new checker carrying their own path.
     */
    private final class NodeChecker implements AstVisitor<Void> {
        private final String path;
        private final ValidationOptions options;
        private final List<ValidationError> errors;

        NodeChecker(String path, ValidationOptions options, List<ValidationError> errors) {
            this.path = path;
            this.options = options;
            this.errors = errors;
        }

        @Override
        public Void visitLiteral(Literal literal) {
            return null;
        }

        @Override
        public Void visitVariable(Variable variable) {
            return null;
        }

        @Override
        public Void visitFunctionName(FunctionName functionName) {
            return null;
        }

        @Override
        public Void visitGlobalReference(GlobalReference reference) {
            if (reference.argument() != null) {
                visit(reference.argument(), path + ".argument", options, errors);
            }
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOp binaryOp) {
            visit(binaryOp.left(), path + ".left", options, errors);
            visit(binaryOp.right(), path + ".right", options, errors);
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOp unaryOp) {
            visit(unaryOp.operand(), path + ".operand", options, errors);
            return null;
        }

        @Override
        public Void visitMathFunctionCall(MathFunctionCall call) {
            OperatorMetadata operator = catalog.getOperator(call.name());
            if (operator == null) {
                String canonical = catalog.resolveAlias(call.name());
                List<String> suggestions = canonical != null
                        ? List.of(canonical)
                        : suggest(call.name(), functionStyleNames());
                errors.add(new ValidationError(
                        "Unknown function-style operator: '" + call.name() + "'", call, path, null, suggestions));
                return null;
            }

            if (!operator.functionStyle()) {
                errors.add(new ValidationError(
                        "Operator '" + call.name() + "' should use colon-separated syntax, not parentheses. Example: "
                                + operator.exampleOr(call.name() + ":..."),
                        call, path, call.name(), List.of()));
            }
            if (call.argument() != null) {
                visit(call.argument(), path + ".argument", options, errors);
            }
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall call) {
            String written = call.name();
            OperatorMetadata operator = catalog.lookup(written);
            if (operator == null) {
                errors.add(new ValidationError("Unknown operator: '" + written + "'", call.callee(), path, null,
                        suggest(written, catalog.suggestionCandidates(null))));
                return null;
            }
            operator.primaryUseCase(); // rejects operators declaring no use case

            Optional<OperatorFamily> family = OperatorFamily.of(operator);
            if (operator.functionStyle() && family.isEmpty()) {
                errors.add(new ValidationError(String.format(
                        "Operator '%s' requires function-style syntax with parentheses, not colon-separated. Example: %s",
                        written, operator.exampleOr(written + "(...)")), call, path, written, List.of()));
            }

            OperatorMetadata shapes = argumentShapesOf(operator);
            int provided = call.effectiveArgumentCount();
            Optional<UseCase> matching = shapes.uses().stream().filter(use -> use.arity() == provided).findFirst();
            if (matching.isEmpty()) {
                String patterns = shapes.uses().stream()
                        .map(use -> use.pattern(written))
                        .collect(Collectors.joining(" OR "));
                errors.add(new ValidationError(String.format(
                        "Operator '%s' does not have a use case with %d argument(s). Possible patterns: %s",
                        written, provided, patterns), call, path, written, List.of()));
                if (call.hasBody()) {
                    visit(call.body(), path + ".body", options, errors);
                }
                return null;
            }

            UseCase use = matching.get();
            for (int i = 0; i < call.args().size() && i < use.arity(); i++) {
                checkArgument(call.args().get(i), use.arguments().get(i), written, operator, path + ".args[" + i + "]");
            }

            if (call.hasBody()) {
                if (!use.hasFormulaArgument()) {
                    errors.add(new ValidationError("Operator '" + written + "' does not expect a formula body",
                            call.body(), path + ".body", written, List.of()));
                } else {
                    visit(call.body(), path + ".body", options, errors);
                }
            }
            return null;
        }

        private void checkArgument(FunctionArg arg, ArgumentSpec spec, String written, OperatorMetadata operator,
                                   String argPath) {
            if (arg instanceof StringArg stringArg) {
                checkStringArgument(stringArg, spec, written, operator, argPath);
            } else if (arg instanceof FunctionStyleArg functionStyleArg) {
                checkFunctionStyleArgument(functionStyleArg, written, operator, argPath);
            }
        }

        private void checkStringArgument(StringArg arg, ArgumentSpec spec, String written, OperatorMetadata operator,
                                         String argPath) {
            String value = arg.value();
            ArgumentType type = spec.kind();
            switch (type) {
                case INTEGER, FLOAT, BYTE -> {
                    if (NumericLiterals.isNumeric(value)) {
                        return;
                    }
                    if (Variable.isVariableName(value)) {
                        if (!options.allowXParameter()) {
                            errors.add(new ValidationError(String.format(
                                    "Argument '%s' of operator '%s' cannot use '%s' here: the formula parameter is only available inside a global formula definition",
                                    spec.name(), written, value), arg, argPath, written, List.of()));
                        }
                        return;
                    }
                    errors.add(new ValidationError(String.format(
                            "Argument '%s' of operator '%s' expects a %s, but got non-numeric value: '%s'",
                            spec.name(), written, type, value), arg, argPath, written, List.of()));
                }
                case BOOLEAN -> {
                    if (!BOOLEAN_VALUES.contains(value.toLowerCase(Locale.ROOT))) {
                        errors.add(new ValidationError(String.format(
                                "Argument '%s' of operator '%s' expects a boolean, but got: '%s'",
                                spec.name(), written, value), arg, argPath, written, List.of()));
                    }
                }
                case STRING -> {
                    if (OperatorFamily.of(operator).orElse(null) == OperatorFamily.MATH) {
                        checkMathFunctionName(arg, value, written, argPath);
                    }
                }
                case FORMULA -> errors.add(new ValidationError(String.format(
                        "Argument '%s' of operator '%s' expects a formula expression, not a simple string",
                        spec.name(), written), arg, argPath, written, List.of()));
                default -> {
                }
            }
        }

        private void checkFunctionStyleArgument(FunctionStyleArg arg, String written, OperatorMetadata operator,
                                                String argPath) {
            OperatorFamily family = OperatorFamily.of(operator).orElse(null);
            if (family == null) {
                errors.add(new ValidationError(String.format(
                        "Operator '%s' does not accept function-style arguments", written),
                        arg, argPath, written, List.of()));
                visitParams(arg, argPath);
                return;
            }

            String targetName = written;
            List<ArgumentSpec> paramSpecs;
            if (family == OperatorFamily.MATH) {
                OperatorMetadata function = checkMathFunctionName(arg, arg.name(), written, argPath);
                if (function == null) {
                    return;
                }
                targetName = function.name();
                paramSpecs = function.widestUseCase().arguments();
            } else {
                List<ArgumentSpec> all = argumentShapesOf(operator).widestUseCase().arguments();
                paramSpecs = all.isEmpty() ? List.of() : all.subList(1, all.size());
            }

            int count = arg.params().size();
            if (paramSpecs.isEmpty() && count > 0) {
                errors.add(new ValidationError(String.format(
                        "Function '%s' in operator '%s' does not accept parameters", arg.name(), targetName),
                        arg, argPath, targetName, List.of()));
            } else if (count > paramSpecs.size()) {
                errors.add(new ValidationError(String.format(
                        "Function '%s' in operator '%s' accepts at most %d parameter(s), got %d",
                        arg.name(), targetName, paramSpecs.size(), count), arg, argPath, targetName, List.of()));
            }

            for (int i = 0; i < count && i < paramSpecs.size(); i++) {
                checkParameter(arg.params().get(i), paramSpecs.get(i), targetName, argPath + ".params[" + i + "]");
            }
            visitParams(arg, argPath);
        }

        private void visitParams(FunctionStyleArg arg, String argPath) {
            for (int i = 0; i < arg.params().size(); i++) {
                visit(arg.params().get(i), argPath + ".params[" + i + "]", options, errors);
            }
        }

        private void checkParameter(AstNode param, ArgumentSpec spec, String operatorName, String paramPath) {
            ArgumentType type = spec.kind();
            boolean accepted;
            if (type.isNumeric()) {
                accepted = param instanceof Literal || (param instanceof Variable && options.allowXParameter());
            } else if (type == ArgumentType.BOOLEAN) {
                accepted = param instanceof Literal;
            } else {
                accepted = true;
            }
            if (!accepted) {
                errors.add(new ValidationError(String.format(
                        "Parameter '%s' of operator '%s' expects a %s, but got '%s'",
                        spec.name(), operatorName, type, describe(param)), param, paramPath, operatorName, List.of()));
            }
        }

        /**
         * Resolves {@code m:<function>}, reporting it as unknown if it does not exist.
         *
         * @return the function metadata, or {@code null} if unknown
         */
        private OperatorMetadata checkMathFunctionName(SyntaxElement arg, String function, String written,
                                                      String argPath) {
            String prefix = OperatorFamily.MATH.namespacePrefix();
            OperatorMetadata resolved = catalog.lookup(prefix + function);
            if (resolved == null) {
                String userPrefix = written + ":";
                List<String> suggestions = suggest(prefix + function, catalog.suggestionCandidates(prefix)).stream()
                        .map(s -> s.startsWith(prefix) ? userPrefix + s.substring(prefix.length()) : s)
                        .toList();
                errors.add(new ValidationError("Unknown operator: '" + written + ":" + function + "'",
                        arg, argPath, null, suggestions));
            }
            return resolved;
        }
    }

    /**
     * The operator whose use-cases describe the argument shapes of {@code operator}.
     */
    private OperatorMetadata argumentShapesOf(OperatorMetadata operator) {
        if (operator.delegatesTo() == null) {
            return operator;
        }
        OperatorMetadata delegate = catalog.getOperator(operator.delegatesTo());
        if (delegate == null) {
            throw new OperatorDefinitionException(String.format(
                    "Operator '%s' delegates to unknown operator '%s'", operator.name(), operator.delegatesTo()));
        }
        delegate.primaryUseCase();
        return delegate;
    }

    private List<String> functionStyleNames() {
        return catalog.operators().stream()
                .filter(OperatorMetadata::functionStyle)
                .map(OperatorMetadata::name)
                .toList();
    }

    private List<String> suggest(String query, List<String> candidates) {
        return StringSimilarity.findSimilar(query, candidates, formulaPolicy.maxSuggestionDistance()).stream()
                .limit(formulaPolicy.maxSuggestions())
                .map(SimilarityMatch::value)
                .toList();
    }

    private static String describe(AstNode node) {
        if (node instanceof Literal literal) {
            return literal.text();
        }
        if (node instanceof Variable variable) {
            return variable.name();
        }
        if (node instanceof GlobalReference reference) {
            return reference.name();
        }
        return "a formula expression";
    }
}
