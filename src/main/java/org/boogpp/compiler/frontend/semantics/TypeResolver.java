package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.lexer.Token;
import org.boogpp.compiler.frontend.parser.Parser;
import org.boogpp.compiler.frontend.parser.ast.TypeRefNode;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.PointerType;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveKind;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.ResultType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns written type references into {@link Type}s.
 */
public class TypeResolver {

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics The engine receiving {@code UNKNOWN_TYPE} errors.
     */
    public TypeResolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a type name as written in configuration, e.g. {@code ptr[u8]} or {@code (status, string)}.
     * @param text The type text.
     * @return The type, or empty if the text is not a valid type.
     */
    public static Optional<Type> parse(String text) {
        DiagnosticsEngine local = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(text, local, "<type>").scanTokens();
        if (local.hasErrors()) {
            return Optional.empty();
        }
        Optional<TypeRefNode> reference = new Parser(tokens, local).parseStandaloneType();
        if (reference.isEmpty()) {
            return Optional.empty();
        }
        Type type = new TypeResolver(local).resolve(reference.get());
        return local.hasErrors() ? Optional.empty() : Optional.of(type);
    }

    /**
     * Resolves a type reference. Unknown names are reported and yield {@link Type#UNKNOWN}.
     * @param reference The written type.
     * @return The resolved type.
     */
    public Type resolve(TypeRefNode reference) {
        List<TypeRefNode> args = reference.typeArguments();
        switch (reference.name()) {
            case "void":
                return Type.VOID;
            case "status":
                return PrimitiveType.STATUS;
            case "handle":
                return PrimitiveType.HANDLE;
            case "ptr":
                return new PointerType(resolve(args.get(0)));
            case "slice":
                return new SliceType(resolve(args.get(0)));
            case "result":
                return new ResultType(resolve(args.get(0)));
            case "tuple":
                return new TupleType(args.stream().map(this::resolve).toList());
            case "array": {
                Type element = resolve(args.get(0));
                if (reference.size() == null || reference.size() <= 0) {
                    diagnostics.reportError(CompilerErrorCode.UNKNOWN_TYPE,
                            "Array length must be a positive integer.", reference.source());
                    return Type.UNKNOWN;
                }
                return new ArrayType(element, reference.size());
            }
            default:
                return primitive(reference.name()).orElseGet(() -> {
                    diagnostics.reportError(CompilerErrorCode.UNKNOWN_TYPE,
                            "Unknown type '" + reference.name() + "'.", reference.source());
                    return Type.UNKNOWN;
                });
        }
    }

    /**
     * @param name A primitive type name such as {@code u8}.
     * @return The primitive type, if the name is one.
     */
    public static Optional<Type> primitive(String name) {
        return Arrays.stream(PrimitiveKind.values())
                .filter(k -> k.typeName().equals(name))
                .findFirst()
                .map(PrimitiveType::new);
    }
}
