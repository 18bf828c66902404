package io.github.cyfko.formulalint.core.ast;

/**
 * Renders a formula tree as indented text, one node per line, for debugging and test output.
 *
 * <pre>
 * BinaryOp(+)
 *   Function(min)
 *     args:
 *       [0] "5"
 *     body:
 *       Function(c)
 *         args:
 *           [0] "HP"
 *   Literal(2)
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AstPrinter implements AstVisitor<String> {

    private static final String STEP = "  ";

    private final String indent;

    private AstPrinter(String indent) {
        this.indent = indent;
    }

    public static String print(AstNode node) {
        return node.accept(new AstPrinter(""));
    }

    private String nested(AstNode node, String extraIndent) {
        return node.accept(new AstPrinter(indent + extraIndent));
    }

    @Override
    public String visitLiteral(Literal node) {
        return indent + "Literal(" + node.text() + ")";
    }

    @Override
    public String visitVariable(Variable node) {
        return indent + "Variable(" + node.name() + ")";
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        StringBuilder sb = new StringBuilder(indent).append("Function(").append(node.name()).append(")");

        if (!node.args().isEmpty()) {
            sb.append('\n').append(indent).append(STEP).append("args:");
            for (int i = 0; i < node.args().size(); i++) {
                FunctionArg arg = node.args().get(i);
                sb.append('\n').append(indent).append(STEP).append(STEP).append('[').append(i).append("] ");
                if (arg instanceof StringArg stringArg) {
                    sb.append('"').append(stringArg.value()).append('"');
                } else if (arg instanceof FunctionStyleArg styleArg) {
                    sb.append(styleArg.name()).append("(...)");
                    for (int j = 0; j < styleArg.params().size(); j++) {
                        String param = nested(styleArg.params().get(j), STEP.repeat(3)).stripLeading();
                        sb.append('\n').append(indent).append(STEP.repeat(3))
                                .append("param[").append(j).append("]: ").append(param);
                    }
                }
            }
        }

        if (node.hasBody()) {
            sb.append('\n').append(indent).append(STEP).append("body:");
            sb.append('\n').append(nested(node.body(), STEP + STEP));
        }
        return sb.toString();
    }

    @Override
    public String visitGlobalReference(GlobalReference node) {
        String line = indent + "GlobalFormula(" + node.name() + ")";
        return node.argument() == null ? line : line + "\n" + nested(node.argument(), STEP);
    }

    @Override
    public String visitFunctionName(FunctionName node) {
        return indent + "FunctionName(" + node.value() + ")";
    }

    @Override
    public String visitMathFunctionCall(MathFunctionCall node) {
        String line = indent + "MathFunction(" + node.name() + ")";
        return node.argument() == null ? line : line + "\n" + nested(node.argument(), STEP);
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return indent + "BinaryOp(" + node.operator().symbol() + ")\n"
                + nested(node.left(), STEP) + "\n"
                + nested(node.right(), STEP);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return indent + "UnaryOp(" + node.operator().symbol() + ")\n" + nested(node.operand(), STEP);
    }
}
