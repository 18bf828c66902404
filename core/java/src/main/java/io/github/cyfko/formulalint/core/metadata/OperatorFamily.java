package io.github.cyfko.formulalint.core.metadata;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators whose arguments may be written function-style ({@code m:distance(32)},
 * {@code d:fireDmg(foo)}): the canonical {@code m} and {@code d} operators and every operator
 * delegating to them.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorFamily {
    /** Built-in math functions, named {@code m:<function>} in the operator table. */
    MATH("m"),
    /** Global formulas defined by mods, resolved by the game at runtime. */
    DATA("d");

    private final String canonicalName;

    OperatorFamily(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String canonicalName() {
        return canonicalName;
    }

    /**
     * Prefix of the operator table entries in this family's namespace, e.g. {@code m:}.
     */
    public String namespacePrefix() {
        return canonicalName + ":";
    }

    /**
     * @param operator resolved operator
     * @return the family of the operator itself or of its delegate
     */
    public static Optional<OperatorFamily> of(OperatorMetadata operator) {
        if (operator == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.canonicalName.equals(operator.name()) || f.canonicalName.equals(operator.delegatesTo()))
                .findFirst();
    }
}
