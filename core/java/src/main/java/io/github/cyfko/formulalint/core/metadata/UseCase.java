package io.github.cyfko.formulalint.core.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One declared overload of an operator: its arguments in order and an example.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UseCase(String description, String returns, String example, List<ArgumentSpec> arguments) {

    public UseCase {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public int arity() {
        return arguments.size();
    }

    public boolean hasFormulaArgument() {
        return arguments.stream().anyMatch(a -> a.kind() == ArgumentType.FORMULA);
    }

    /**
     * Renders the calling pattern under the name the user wrote, e.g. {@code between:min:max:formula}.
     */
    public String pattern(String displayName) {
        if (arguments.isEmpty()) {
            return displayName + " (no arguments)";
        }
        return displayName + ":" + arguments.stream().map(ArgumentSpec::name).collect(Collectors.joining(":"));
    }
}
