package io.github.cyfko.formulalint.core.validation;

import io.github.cyfko.formulalint.core.ast.SourcePosition;
import io.github.cyfko.formulalint.core.ast.SyntaxElement;

import java.util.List;
import java.util.Objects;

/**
 * One semantic problem found in a parsed formula.
 *
 * @param message      human readable description
 * @param node         offending node or argument, for highlighting
 * @param path         dot-path from the root, e.g. {@code root.left.args[0]}
 * @param operatorName operator the problem relates to, as written, for documentation links;
 *                     {@code null} when the operator itself is unknown
 * @param suggestions  replacement candidates, best first
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ValidationError(String message, SyntaxElement node, String path, String operatorName,
                              List<String> suggestions) {

    public ValidationError {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(path, "path");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public SourcePosition position() {
        return node.position();
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }

    @Override
    public String toString() {
        return "[" + path + "] " + message;
    }
}
