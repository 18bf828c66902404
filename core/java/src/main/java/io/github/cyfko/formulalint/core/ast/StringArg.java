package io.github.cyfko.formulalint.core.ast;

import java.util.Objects;

/**
 * Plain argument such as {@code HP} in {@code c:HP}. Its meaning (number, boolean, name) depends on
 * the operator's declared argument type.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record StringArg(String value, SourcePosition position) implements FunctionArg {

    public StringArg {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }
}
