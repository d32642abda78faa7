package org.boogpp.compiler.frontend.safety;

import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.semantics.TypedModule;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A type-checked module that passed the safety checker, annotated with the effective mode of
 * each function and the operations that must be audit-logged at run time.
 *
 * @param typed         The type-checked module.
 * @param moduleMode    The mode in effect for the whole unit.
 * @param functionModes The effective mode per function, after {@code @unsafe} overrides.
 * @param audited       Guarded nodes (calls and pointer dereferences) to the operation identifier to log.
 */
public record SafeModule(
        TypedModule typed,
        SafetyMode moduleMode,
        Map<FunctionDeclNode, SafetyMode> functionModes,
        Map<AstNode, String> audited
) {

    public SafeModule {
        functionModes = Collections.unmodifiableMap(new IdentityHashMap<>(functionModes));
        audited = Collections.unmodifiableMap(new IdentityHashMap<>(audited));
    }

    /**
     * @param function A function of the module.
     * @return The mode its body was checked under.
     */
    public SafetyMode modeOf(FunctionDeclNode function) {
        return functionModes.getOrDefault(function, moduleMode);
    }

    /**
     * @param node A call or index node.
     * @return The operation to audit-log immediately before the node executes, if any.
     */
    public Optional<String> auditedOperation(AstNode node) {
        return Optional.ofNullable(audited.get(node));
    }
}
