package io.github.cyfko.formulalint.core.spi;

import io.github.cyfko.formulalint.core.metadata.OperatorFamily;
import io.github.cyfko.formulalint.core.metadata.OperatorMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the operator metadata table consulted by the parser and the validator.
 * <p>
 * The table is external, versioned data. The core only relies on resolving a written name to its
 * canonical operator name and on fetching the metadata of a canonical name; everything else in this
 * interface is derived from those two lookups and the operator listing.
 * </p>
 *
 * <p><strong>Thread Safety:</strong> implementations are expected to be immutable once constructed,
 * so a single catalog can be shared by any number of parsers and validators.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * OperatorCatalog catalog = OperatorCatalogLoader.defaults();
 *
 * catalog.resolveAlias("data");        // "d"
 * catalog.getOperator("d").uses();     // declared overloads
 * catalog.lookup("minimum");           // metadata of "min", through its alias
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface OperatorCatalog {

    /**
     * Resolves a name as written in a formula to the canonical operator name.
     *
     * @param name canonical name or alias
     * @return the canonical name, or {@code null} if no operator is known under {@code name}
     */
    String resolveAlias(String name);

    /**
     * @param canonicalName canonical operator name
     * @return the operator metadata, or {@code null} if unknown
     */
    OperatorMetadata getOperator(String canonicalName);

    /**
     * @return every operator, in authoring order
     */
    Collection<OperatorMetadata> operators();

    /**
     * Resolves {@code name} through the alias table and fetches its metadata.
     *
     * @param name canonical name or alias
     * @return the metadata, or {@code null} if unknown
     */
    default OperatorMetadata lookup(String name) {
        String canonical = resolveAlias(name);
        return canonical == null ? null : getOperator(canonical);
    }

    /**
     * @param name canonical name or alias
     * @return the function-style argument family of the operator, if it belongs to one
     */
    default Optional<OperatorFamily> familyOf(String name) {
        return OperatorFamily.of(lookup(name));
    }

    /**
     * Canonical names followed by aliases, the candidate list for operator name suggestions.
     *
     * @param namespacePrefix only keep operators whose canonical name starts with this prefix, or
     *                        {@code null} to keep all
     * @return names then aliases, in authoring order
     */
    default List<String> suggestionCandidates(String namespacePrefix) {
        List<String> names = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        for (OperatorMetadata operator : operators()) {
            if (namespacePrefix != null && !operator.name().startsWith(namespacePrefix)) {
                continue;
            }
            names.add(operator.name());
            aliases.addAll(operator.aliases());
        }
        names.addAll(aliases);
        return names;
    }
}
