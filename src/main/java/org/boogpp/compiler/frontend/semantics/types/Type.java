package org.boogpp.compiler.frontend.semantics.types;

import java.util.List;

/**
 * A type of the language. Types are compared structurally; there is no nominal subtyping.
 */
public sealed interface Type
        permits PrimitiveType, ArrayType, SliceType, PointerType, TupleType, ResultType, FunctionType, VoidType, UnknownType {

    Type VOID = new VoidType();
    Type UNKNOWN = new UnknownType();

    /**
     * @return The type as it would be written in source.
     */
    String displayName();

    /**
     * @return The type as rendered in textual IR.
     */
    String irName();

    default boolean isUnknown() {
        return this instanceof UnknownType;
    }

    default boolean isVoid() {
        return this instanceof VoidType;
    }

    default boolean isInteger() {
        return this instanceof PrimitiveType p && p.kind().isInteger();
    }

    default boolean isFloat() {
        return this instanceof PrimitiveType p && p.kind().isFloat();
    }

    default boolean isNumeric() {
        return this instanceof PrimitiveType p && p.kind().isNumeric();
    }

    default boolean isBool() {
        return this instanceof PrimitiveType p && p.kind() == PrimitiveKind.BOOL;
    }

    default boolean isString() {
        return this instanceof PrimitiveType p && p.kind() == PrimitiveKind.STRING;
    }

    /**
     * @return true if this type, or a type nested in it, is still {@link UnknownType}.
     */
    default boolean containsUnknown() {
        if (this instanceof UnknownType) {
            return true;
        }
        if (this instanceof ArrayType a) {
            return a.element().containsUnknown();
        }
        if (this instanceof SliceType s) {
            return s.element().containsUnknown();
        }
        if (this instanceof PointerType p) {
            return p.target().containsUnknown();
        }
        if (this instanceof ResultType r) {
            return r.inner().containsUnknown();
        }
        if (this instanceof TupleType t) {
            return t.elements().stream().anyMatch(Type::containsUnknown);
        }
        if (this instanceof FunctionType f) {
            return f.parameters().stream().anyMatch(Type::containsUnknown)
                    || f.returns().stream().anyMatch(Type::containsUnknown);
        }
        return false;
    }

    /**
     * Builds the value type of a list of return types: void, the single type, or a tuple.
     * @param returns The declared return types.
     * @return The combined type.
     */
    static Type ofReturns(List<Type> returns) {
        if (returns.isEmpty()) {
            return VOID;
        }
        if (returns.size() == 1) {
            return returns.get(0);
        }
        return new TupleType(returns);
    }
}
