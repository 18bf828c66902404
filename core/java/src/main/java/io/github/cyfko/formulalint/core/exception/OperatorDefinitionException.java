package io.github.cyfko.formulalint.core.exception;

/**
 * Exception thrown when operator metadata is malformed.
 * <p>
 * Operator metadata is authored data shipped with the library, not user input. An operator without
 * any use-case, a name claimed by two operators or a delegation to an unknown operator are defects
 * of that data, so they are raised instead of being reported as formula diagnostics.
 * </p>
 *
 * <pre>{@code
 * throw new OperatorDefinitionException("Operator 'min' declares no use case");
 * throw new OperatorDefinitionException("Alias 'minimum' is already registered for operator 'min'");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OperatorDefinitionException extends RuntimeException {

    /**
     * @param message explanation of the metadata defect
     */
    public OperatorDefinitionException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the metadata defect
     * @param cause   underlying failure, typically an I/O or JSON mapping error
     */
    public OperatorDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
