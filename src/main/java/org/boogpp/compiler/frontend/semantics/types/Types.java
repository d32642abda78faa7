package org.boogpp.compiler.frontend.semantics.types;

/**
 * Compatibility rules between types.
 */
public final class Types {

    private Types() {
        // Utility class
    }

    /**
     * Decides whether a value of type {@code source} may be stored where {@code target} is expected.
     * Besides identity this admits a {@code (status, T)} pair for {@code result[T]} and a fixed
     * array for a slice of the same element type. {@link UnknownType} is compatible with
     * everything so that an earlier error is not reported again.
     *
     * @param target The expected type.
     * @param source The actual type.
     * @return true if the assignment is allowed.
     */
    public static boolean isAssignable(Type target, Type source) {
        if (target.equals(source) || target.isUnknown() || source.isUnknown()) {
            return true;
        }
        if (target instanceof ResultType result && source instanceof TupleType tuple) {
            return tuple.elements().size() == 2
                    && tuple.elements().get(0).equals(PrimitiveType.STATUS)
                    && isAssignable(result.inner(), tuple.elements().get(1));
        }
        if (target instanceof SliceType slice && source instanceof ArrayType array) {
            return slice.element().equals(array.element());
        }
        if (target instanceof TupleType t && source instanceof TupleType s && t.elements().size() == s.elements().size()) {
            for (int i = 0; i < t.elements().size(); i++) {
                if (!isAssignable(t.elements().get(i), s.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * @param type A type.
     * @return true if values of the type can be ordered with {@code < <= > >=}.
     */
    public static boolean isOrdered(Type type) {
        return type.isNumeric() || type.equals(PrimitiveType.CHAR) || type.isUnknown();
    }

    /**
     * @param type A type.
     * @return true if values of the type can be compared with {@code == !=}.
     */
    public static boolean isEquatable(Type type) {
        return type instanceof PrimitiveType || type instanceof PointerType || type.isUnknown();
    }
}
