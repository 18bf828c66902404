package io.github.cyfko.formulalint.core.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One declared argument of a {@link UseCase}.
 *
 * @param name        argument name, shown in arity diagnostics
 * @param type        type name as written in the metadata
 * @param description free text for documentation
 * @author Frank KOSSI
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArgumentSpec(String name, String type, String description) {

    public ArgumentType kind() {
        return ArgumentType.from(type);
    }
}
