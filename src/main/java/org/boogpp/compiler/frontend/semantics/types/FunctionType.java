package org.boogpp.compiler.frontend.semantics.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The signature of a function.
 *
 * @param parameters The parameter types in order.
 * @param returns    The return types; empty for void.
 */
public record FunctionType(List<Type> parameters, List<Type> returns) implements Type {

    public FunctionType {
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
    }

    /**
     * @return The type of a call's value: void, the single return type or a tuple.
     */
    public Type returnType() {
        return Type.ofReturns(returns);
    }

    @Override
    public String displayName() {
        String params = parameters.stream().map(Type::displayName).collect(Collectors.joining(", ", "(", ")"));
        return "func" + params + " -> " + returnType().displayName();
    }

    @Override
    public String irName() {
        return "ptr";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
