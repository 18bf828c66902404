package io.github.cyfko.formulalint.core.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.formulalint.core.exception.OperatorDefinitionException;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

/**
 * Reads operator metadata documents with Jackson.
 *
 * <pre>{@code
 * // Bundled table, read once per process
 * DefaultOperatorCatalog catalog = OperatorCatalogLoader.defaults();
 *
 * // Table shipped by the caller
 * DefaultOperatorCatalog custom = OperatorCatalogLoader.fromClasspath("my-operators.json");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorCatalogLoader {

    /** Classpath resource holding the bundled operator table. */
    public static final String DEFAULT_RESOURCE = "formula-operators.json";

    private static final Logger log = Logger.getLogger(OperatorCatalogLoader.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private OperatorCatalogLoader() {}

    /**
     * @return the catalog of the bundled operator table
     * @throws OperatorDefinitionException if the bundled table is missing or malformed
     */
    public static DefaultOperatorCatalog defaults() {
        return DefaultsHolder.INSTANCE;
    }

    /**
     * @param resource classpath resource name
     * @return the catalog read from that resource
     * @throws OperatorDefinitionException if the resource is missing, unreadable or malformed
     */
    public static DefaultOperatorCatalog fromClasspath(String resource) {
        log.fine(() -> "Loading operator table from classpath resource " + resource);
        try (InputStream in = OperatorCatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new OperatorDefinitionException("Operator table resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new OperatorDefinitionException("Failed to read operator table " + resource, e);
        }
    }

    /**
     * @param in         JSON document
     * @param sourceName name used in log and error messages
     * @return the catalog read from {@code in}
     * @throws OperatorDefinitionException if the document is unreadable or malformed
     */
    public static DefaultOperatorCatalog load(InputStream in, String sourceName) {
        OperatorTable table;
        try {
            table = MAPPER.readValue(in, OperatorTable.class);
        } catch (IOException e) {
            throw new OperatorDefinitionException("Invalid operator table " + sourceName + ": " + e.getMessage(), e);
        }
        DefaultOperatorCatalog catalog = new DefaultOperatorCatalog(table);
        log.info(() -> String.format("Loaded %d formula operators (game version %s) from %s",
                table.operators().size(), table.gameVersion(), sourceName));
        return catalog;
    }

    private static final class DefaultsHolder {
        private static final DefaultOperatorCatalog INSTANCE = fromClasspath(DEFAULT_RESOURCE);
    }
}
