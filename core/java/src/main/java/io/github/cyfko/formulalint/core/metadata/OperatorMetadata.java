package io.github.cyfko.formulalint.core.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.cyfko.formulalint.core.exception.OperatorDefinitionException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Metadata of one formula operator, as authored in the operator table.
 *
 * <p><strong>Fields:</strong></p>
 * <ul>
 *   <li><strong>name</strong>: canonical name, the key aliases resolve to ({@code min}, {@code m:distance})</li>
 *   <li><strong>aliases</strong>: alternative spellings accepted by the game</li>
 *   <li><strong>delegatesTo</strong>: operator whose argument shapes this one reuses, or {@code null}</li>
 *   <li><strong>functionStyle</strong>: called as {@code name(arg)}; for the {@code m}/{@code d}
 *       families it instead means their arguments may be written {@code fn(params)}</li>
 *   <li><strong>alternateDelimiters</strong>: argument separators accepted besides {@code :}</li>
 *   <li><strong>uses</strong>: declared overloads, at least one</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperatorMetadata(
        String name,
        String category,
        List<String> aliases,
        String delegatesTo,
        @JsonProperty("isFunctionStyle") boolean functionStyle,
        List<String> alternateDelimiters,
        List<UseCase> uses
) {

    public OperatorMetadata {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        alternateDelimiters = alternateDelimiters == null ? List.of() : List.copyOf(alternateDelimiters);
        uses = uses == null ? List.of() : List.copyOf(uses);
    }

    /**
     * The use-case whose shape drives parsing: the first declared one.
     *
     * @throws OperatorDefinitionException if the operator declares no use-case
     */
    public UseCase primaryUseCase() {
        if (uses.isEmpty()) {
            throw new OperatorDefinitionException("Operator '" + name + "' declares no use case");
        }
        return uses.get(0);
    }

    /**
     * The use-case declaring the most arguments, first one on ties.
     *
     * @throws OperatorDefinitionException if the operator declares no use-case
     */
    public UseCase widestUseCase() {
        UseCase widest = primaryUseCase();
        for (UseCase use : uses) {
            if (use.arity() > widest.arity()) {
                widest = use;
            }
        }
        return widest;
    }

    /**
     * Number of arguments written before the formula body, i.e. the non-formula arguments of the
     * primary use-case. {@code min:5:c:HP} has one.
     */
    public int positionalArgumentCount() {
        return (int) primaryUseCase().arguments().stream()
                .filter(a -> a.kind() != ArgumentType.FORMULA)
                .count();
    }

    /**
     * Whether the text after the positional arguments is a nested formula.
     */
    public boolean hasFormulaBody() {
        return primaryUseCase().hasFormulaArgument();
    }

    /**
     * Argument separators for colon syntax: {@code :} plus the declared alternates.
     */
    public Set<Character> argumentDelimiters() {
        Set<Character> delimiters = new LinkedHashSet<>();
        delimiters.add(':');
        for (String delimiter : alternateDelimiters) {
            if (delimiter.length() != 1) {
                throw new OperatorDefinitionException(
                        "Operator '" + name + "' declares a delimiter that is not a single character: '" + delimiter + "'");
            }
            delimiters.add(delimiter.charAt(0));
        }
        return delimiters;
    }

    /**
     * Example of the first use-case, or {@code fallback} when none is authored.
     */
    public String exampleOr(String fallback) {
        if (uses.isEmpty() || uses.get(0).example() == null || uses.get(0).example().isBlank()) {
            return fallback;
        }
        return uses.get(0).example();
    }
}
