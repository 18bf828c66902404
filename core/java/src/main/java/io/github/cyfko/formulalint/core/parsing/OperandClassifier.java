package io.github.cyfko.formulalint.core.parsing;

import io.github.cyfko.formulalint.core.ast.*;
import io.github.cyfko.formulalint.core.exception.FormulaSyntaxException;
import io.github.cyfko.formulalint.core.metadata.OperatorMetadata;
import io.github.cyfko.formulalint.core.spi.OperatorCatalog;
import io.github.cyfko.formulalint.core.utils.NumericLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Turns one operand into an AST node.
 *
 * <h2>Classification order</h2>
 * <ol>
 *   <li>numeric literal: {@link Literal}</li>
 *   <li>{@code x} or {@code X}: {@link Variable}</li>
 *   <li>contains {@code :} before any {@code (}: colon-syntax {@link FunctionCall}, so
 *       {@code m:distance(32)} is a colon call and {@code distance(c:HP)} is not</li>
 *   <li>contains {@code (}: {@link MathFunctionCall}, legal only for function-style operators</li>
 *   <li>anything else: {@link GlobalReference}</li>
 * </ol>
 *
 * <h2>Colon syntax</h2>
 * <p>
 * The name is the text before the first colon. Arguments are split on {@code :} and on the
 * operator's alternate delimiters, ignoring delimiters inside parentheses. When the operator
 * declares a {@code formula} argument, everything after its positional arguments is parsed as a
 * nested formula, so {@code min:5:c:HP} has one argument and the body {@code c:HP}.
 * Arguments of the {@code m} and {@code d} families may be written {@code fn(p1,p2)}; other known
 * operators reject parentheses in their arguments.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OperandClassifier {

    private final OperatorCatalog catalog;
    private final NestedFormulaParser nestedParser;

    public OperandClassifier(OperatorCatalog catalog, NestedFormulaParser nestedParser) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.nestedParser = Objects.requireNonNull(nestedParser, "nestedParser");
    }

    /**
     * @param operand operand text, whitespace removed
     * @param depth   nesting level of the formula containing the operand
     * @return the classified node
     * @throws FormulaSyntaxException on a malformed call
     */
    public AstNode classify(SourceText operand, int depth) {
        String text = operand.toString();

        if (NumericLiterals.isNumeric(text)) {
            return literal(operand);
        }
        if (Variable.isVariableName(text)) {
            return new Variable(text, operand.span());
        }
        int colon = operand.indexOf(':');
        int open = operand.indexOf('(');
        if (colon >= 0 && (open < 0 || colon < open)) {
            return classifyColonCall(operand, depth);
        }
        if (open >= 0) {
            return classifyParenthesizedCall(operand, depth);
        }
        return new GlobalReference(text, null, operand.span());
    }

    private FunctionCall classifyColonCall(SourceText operand, int depth) {
        int colon = operand.indexOf(':');
        if (colon == 0) {
            throw new FormulaSyntaxException("Missing operator name before ':'", operand.start());
        }

        String name = operand.subSequence(0, colon).toString();
        FunctionName callee = new FunctionName(name, operand.span(0, colon));
        OperatorMetadata operator = catalog.lookup(name);
        Set<Character> delimiters = operator == null ? Set.of(':') : operator.argumentDelimiters();

        List<int[]> parts = splitOutsideParentheses(operand, colon + 1, delimiters);

        AstNode body = null;
        if (operator != null && operator.hasFormulaBody()) {
            int positional = operator.positionalArgumentCount();
            if (parts.size() > positional) {
                SourceText bodyText = operand.subSequence(parts.get(positional)[0], operand.length());
                body = nestedParser.parse(bodyText, depth + 1);
                parts = parts.subList(0, positional);
            }
        }

        boolean functionStyleArgs = catalog.familyOf(name).isPresent();
        List<FunctionArg> args = new ArrayList<>(parts.size());
        for (int[] range : parts) {
            SourceText part = operand.subSequence(range[0], range[1]);
            if (operator == null || (part.indexOf('(') < 0 && part.indexOf(')') < 0)) {
                args.add(new StringArg(part.toString(), part.span()));
            } else if (functionStyleArgs) {
                args.add(classifyFunctionStyleArg(part, name));
            } else {
                throw new FormulaSyntaxException(String.format(
                        "Operator '%s' does not accept function-style arguments: '%s'", name, part),
                        part.start());
            }
        }

        return new FunctionCall(name, callee, args, body, operand.span());
    }

    private FunctionStyleArg classifyFunctionStyleArg(SourceText arg, String operatorName) {
        int open = arg.indexOf('(');
        if (open <= 0) {
            throw new FormulaSyntaxException(String.format(
                    "Argument '%s' of operator '%s' needs a function name before '('", arg, operatorName),
                    arg.start());
        }
        int last = arg.length() - 1;
        if (arg.charAt(last) != ')') {
            throw new FormulaSyntaxException(String.format(
                    "Argument '%s' of operator '%s' must end with ')'", arg, operatorName),
                    arg.positionAt(last));
        }

        String function = arg.subSequence(0, open).toString();
        List<AstNode> params = new ArrayList<>();
        for (int[] range : splitOutsideParentheses(arg.subSequence(0, last), open + 1, Set.of(','))) {
            if (range[1] == range[0]) {
                continue;
            }
            SourceText param = arg.subSequence(range[0], range[1]);
            params.add(classifyParameter(param, function));
        }
        return new FunctionStyleArg(function, params, arg.span());
    }

    private AstNode classifyParameter(SourceText param, String function) {
        String text = param.toString();
        if (text.charAt(0) == '+') {
            throw new FormulaSyntaxException(FormulaTokenizer.UNARY_PLUS_NOT_SUPPORTED, param.start());
        }
        if (NumericLiterals.isNumeric(text)) {
            return literal(param);
        }
        if (Variable.isVariableName(text)) {
            return new Variable(text, param.span());
        }
        for (int i = 0; i < param.length(); i++) {
            char c = param.charAt(i);
            if (BinaryOperator.isOperatorChar(c) || c == '(' || c == ')') {
                throw new FormulaSyntaxException(String.format(
                        "Parameter '%s' of '%s' must be a number, 'x' or a name; arithmetic and parentheses are not allowed",
                        text, function), param.positionAt(i));
            }
        }
        return new GlobalReference(text, null, param.span());
    }

    private static Literal literal(SourceText text) {
        OptionalDouble value = NumericLiterals.parse(text.toString());
        if (value.isEmpty()) {
            throw new FormulaSyntaxException(String.format(
                    "Numeric literal '%s' is out of range", text), text.start());
        }
        return new Literal(value.getAsDouble(), text.toString(), text.span());
    }

    private MathFunctionCall classifyParenthesizedCall(SourceText operand, int depth) {
        int open = operand.indexOf('(');
        if (open == 0) {
            throw new FormulaSyntaxException(
                    "Grouping parentheses are not supported; parentheses may only follow a function-style operator name",
                    operand.start());
        }
        int last = operand.length() - 1;
        if (operand.charAt(last) != ')') {
            throw new FormulaSyntaxException(String.format(
                    "Unexpected text after ')' in '%s'", operand), operand.positionAt(last));
        }

        String name = operand.subSequence(0, open).toString();
        OperatorMetadata operator = catalog.lookup(name);
        if (operator == null) {
            throw new FormulaSyntaxException(String.format(
                    "Operator '%s' cannot be called with parentheses: it is not a known function-style operator", name),
                    operand.positionAt(open));
        }
        if (!operator.functionStyle()) {
            throw new FormulaSyntaxException(String.format(
                    "Operator '%s' cannot be called with parentheses. Use colon syntax, e.g. %s",
                    name, operator.exampleOr(name + ":...")), operand.positionAt(open));
        }

        SourceText inner = operand.subSequence(open + 1, last);
        AstNode argument = inner.isEmpty() ? null : nestedParser.parse(inner, depth + 1);
        return new MathFunctionCall(name, argument, operand.span());
    }

    /**
     * Ranges {@code [start, end)} of the pieces of {@code text} from {@code from}, split on
     * {@code delimiters} at parenthesis depth 0. An empty trailing piece is dropped.
     */
    private static List<int[]> splitOutsideParentheses(SourceText text, int from, Set<Character> delimiters) {
        List<int[]> parts = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && delimiters.contains(c)) {
                parts.add(new int[]{start, i});
                start = i + 1;
            }
        }
        if (start < text.length()) {
            parts.add(new int[]{start, text.length()});
        }
        return parts;
    }
}
