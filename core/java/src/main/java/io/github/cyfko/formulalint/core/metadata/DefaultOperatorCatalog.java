package io.github.cyfko.formulalint.core.metadata;

import io.github.cyfko.formulalint.core.exception.OperatorDefinitionException;
import io.github.cyfko.formulalint.core.spi.OperatorCatalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable {@link OperatorCatalog} built from an {@link OperatorTable}.
 * <p>
 * The table is checked once at construction; a catalog that exists is well formed:
 * </p>
 * <ul>
 *   <li>every operator has a non-blank name and at least one use-case</li>
 *   <li>no name or alias is claimed twice, case-sensitively</li>
 *   <li>every {@code delegatesTo} names an operator of the table</li>
 *   <li>alternate delimiters are single characters</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DefaultOperatorCatalog implements OperatorCatalog {

    private final String gameVersion;
    private final Map<String, OperatorMetadata> operators;
    private final Map<String, String> canonicalNames;

    /**
     * @param table the operator table
     * @throws OperatorDefinitionException if the table is malformed
     */
    public DefaultOperatorCatalog(OperatorTable table) {
        Objects.requireNonNull(table, "table");
        Map<String, OperatorMetadata> byName = new LinkedHashMap<>();
        Map<String, String> aliasTable = new LinkedHashMap<>();

        for (OperatorMetadata operator : table.operators()) {
            if (operator.name() == null || operator.name().isBlank()) {
                throw new OperatorDefinitionException("Operator without a name in table " + table.gameVersion());
            }
            operator.primaryUseCase();
            operator.argumentDelimiters();
            register(aliasTable, operator.name(), operator.name());
            byName.put(operator.name(), operator);
        }
        for (OperatorMetadata operator : table.operators()) {
            for (String alias : operator.aliases()) {
                register(aliasTable, alias, operator.name());
            }
            if (operator.delegatesTo() != null && !byName.containsKey(operator.delegatesTo())) {
                throw new OperatorDefinitionException("Operator '" + operator.name()
                        + "' delegates to unknown operator '" + operator.delegatesTo() + "'");
            }
        }

        this.gameVersion = table.gameVersion();
        this.operators = Collections.unmodifiableMap(byName);
        this.canonicalNames = Collections.unmodifiableMap(aliasTable);
    }

    private static void register(Map<String, String> aliasTable, String name, String canonical) {
        String previous = aliasTable.putIfAbsent(name, canonical);
        if (previous != null) {
            throw new OperatorDefinitionException(
                    "Name [" + name + "] is already registered for operator '" + previous + "'");
        }
    }

    public String getGameVersion() {
        return gameVersion;
    }

    @Override
    public String resolveAlias(String name) {
        return name == null ? null : canonicalNames.get(name);
    }

    @Override
    public OperatorMetadata getOperator(String canonicalName) {
        return canonicalName == null ? null : operators.get(canonicalName);
    }

    @Override
    public Collection<OperatorMetadata> operators() {
        return operators.values();
    }

    @Override
    public String toString() {
        return "DefaultOperatorCatalog[gameVersion=" + gameVersion + ", operators=" + operators.size() + "]";
    }
}
