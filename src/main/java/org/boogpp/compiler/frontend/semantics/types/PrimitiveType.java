package org.boogpp.compiler.frontend.semantics.types;

public record PrimitiveType(PrimitiveKind kind) implements Type {

    public static final PrimitiveType I8 = new PrimitiveType(PrimitiveKind.I8);
    public static final PrimitiveType I16 = new PrimitiveType(PrimitiveKind.I16);
    public static final PrimitiveType I32 = new PrimitiveType(PrimitiveKind.I32);
    public static final PrimitiveType I64 = new PrimitiveType(PrimitiveKind.I64);
    public static final PrimitiveType U8 = new PrimitiveType(PrimitiveKind.U8);
    public static final PrimitiveType U16 = new PrimitiveType(PrimitiveKind.U16);
    public static final PrimitiveType U32 = new PrimitiveType(PrimitiveKind.U32);
    public static final PrimitiveType U64 = new PrimitiveType(PrimitiveKind.U64);
    public static final PrimitiveType F32 = new PrimitiveType(PrimitiveKind.F32);
    public static final PrimitiveType F64 = new PrimitiveType(PrimitiveKind.F64);
    public static final PrimitiveType BOOL = new PrimitiveType(PrimitiveKind.BOOL);
    public static final PrimitiveType CHAR = new PrimitiveType(PrimitiveKind.CHAR);
    public static final PrimitiveType STRING = new PrimitiveType(PrimitiveKind.STRING);

    /** The {@code status} alias. */
    public static final PrimitiveType STATUS = I32;
    /** The {@code handle} alias. */
    public static final PrimitiveType HANDLE = U64;

    @Override
    public String displayName() {
        return kind.typeName();
    }

    @Override
    public String irName() {
        return switch (kind) {
            case I8, U8 -> "i8";
            case I16, U16 -> "i16";
            case I32, U32, CHAR -> "i32";
            case I64, U64 -> "i64";
            case F32 -> "float";
            case F64 -> "double";
            case BOOL -> "i1";
            case STRING -> "ptr";
        };
    }

    @Override
    public String toString() {
        return displayName();
    }
}
