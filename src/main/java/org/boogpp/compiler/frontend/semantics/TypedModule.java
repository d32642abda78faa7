package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.semantics.types.FunctionType;
import org.boogpp.compiler.frontend.semantics.types.Type;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The output of the type checker: the unchanged AST plus side tables keyed by node identity.
 * The module-level symbols persist here for code generation.
 *
 * @param module          The checked module.
 * @param globals         The module scope: every top-level function, by name.
 * @param signatures      The signature of each function declaration.
 * @param expressionTypes The static type of each checked expression.
 * @param references      The symbol each identifier refers to.
 * @param declarations    The symbol introduced by each let/var, parameter and for loop.
 * @param callTargets     What each call resolved to.
 */
public record TypedModule(
        ModuleNode module,
        Map<String, Symbol> globals,
        Map<FunctionDeclNode, FunctionType> signatures,
        Map<AstNode, Type> expressionTypes,
        Map<IdentifierNode, Symbol> references,
        Map<AstNode, Symbol> declarations,
        Map<CallNode, CallTarget> callTargets
) {

    public TypedModule {
        globals = Collections.unmodifiableMap(new LinkedHashMap<>(globals));
        signatures = Collections.unmodifiableMap(new IdentityHashMap<>(signatures));
        expressionTypes = Collections.unmodifiableMap(new IdentityHashMap<>(expressionTypes));
        references = Collections.unmodifiableMap(new IdentityHashMap<>(references));
        declarations = Collections.unmodifiableMap(new IdentityHashMap<>(declarations));
        callTargets = Collections.unmodifiableMap(new IdentityHashMap<>(callTargets));
    }

    /**
     * @param expression A checked expression.
     * @return Its static type, or {@link Type#UNKNOWN} if it was never checked.
     */
    public Type typeOf(ExpressionNode expression) {
        return expressionTypes.getOrDefault(expression, Type.UNKNOWN);
    }

    /**
     * @param identifier An identifier expression.
     * @return The symbol it refers to.
     */
    public Optional<Symbol> symbolOf(IdentifierNode identifier) {
        return Optional.ofNullable(references.get(identifier));
    }

    /**
     * @param declaration A let/var declaration, a parameter or a for loop.
     * @return The symbol it introduced.
     */
    public Optional<Symbol> declaredBy(AstNode declaration) {
        return Optional.ofNullable(declarations.get(declaration));
    }

    /**
     * @param call A call expression.
     * @return The resolved callee.
     */
    public Optional<CallTarget> callTarget(CallNode call) {
        return Optional.ofNullable(callTargets.get(call));
    }

    /**
     * @param function A function declaration of this module.
     * @return Its signature.
     */
    public FunctionType signatureOf(FunctionDeclNode function) {
        return signatures.get(function);
    }
}
