package io.github.cyfko.formulalint.core.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root of the operator metadata document.
 *
 * @param gameVersion game version the table was extracted from
 * @param operators   operators in authoring order
 * @author Frank KOSSI
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperatorTable(String gameVersion, List<OperatorMetadata> operators) {

    public OperatorTable {
        operators = operators == null ? List.of() : List.copyOf(operators);
    }
}
