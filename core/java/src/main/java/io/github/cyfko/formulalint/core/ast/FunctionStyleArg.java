package io.github.cyfko.formulalint.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Argument written {@code name(param,...)}, only accepted by the {@code m:} and {@code d:}
 * operator families: {@code m:distance(32)}, {@code d:fireDmg(foo)}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionStyleArg(String name, List<AstNode> params, SourcePosition position) implements FunctionArg {

    public FunctionStyleArg {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        Objects.requireNonNull(position, "position");
    }
}
