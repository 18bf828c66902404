package io.github.cyfko.formulalint.core.metadata;

import java.util.Locale;

/**
 * Declared type of an operator argument. Types the validator has no rule for map to {@link #OTHER}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ArgumentType {
    INTEGER,
    FLOAT,
    BYTE,
    BOOLEAN,
    STRING,
    FORMULA,
    OTHER;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == BYTE;
    }

    /**
     * @param type type name as written in the metadata, e.g. {@code "integer"}
     * @return the matching constant, {@link #OTHER} for unknown or missing names
     */
    public static ArgumentType from(String type) {
        if (type == null) {
            return OTHER;
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "integer", "int" -> INTEGER;
            case "float" -> FLOAT;
            case "byte" -> BYTE;
            case "boolean", "bool" -> BOOLEAN;
            case "string" -> STRING;
            case "formula" -> FORMULA;
            default -> OTHER;
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
