package org.boogpp.compiler.frontend.safety;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.api.SafetyRuleset;
import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.diagnostics.CompilerLogger;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.TreeWalker;
import org.boogpp.compiler.frontend.parser.DecoratorKind;
import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.DecoratorArgument;
import org.boogpp.compiler.frontend.parser.ast.DecoratorNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.IndexNode;
import org.boogpp.compiler.frontend.parser.ast.ParameterNode;
import org.boogpp.compiler.frontend.parser.ast.TypeRefNode;
import org.boogpp.compiler.frontend.parser.ast.VarDeclNode;
import org.boogpp.compiler.frontend.semantics.CallTarget;
import org.boogpp.compiler.frontend.semantics.TypedModule;
import org.boogpp.compiler.frontend.semantics.types.PointerType;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Decides, for every classified operation of a module, whether the active safety mode permits,
 * audit-logs or refuses it.
 * <p>
 * The mode is passed explicitly along the checking of each function: the module mode comes from
 * {@code @safety_level} (or the caller's default) and a function carrying {@code @unsafe} is
 * checked under {@link SafetyMode#UNSAFE} for its own body only. All refusals of the module are
 * reported in one run.
 */
public class SafetyChecker {

    /** Indexing through a raw pointer. */
    public static final String POINTER_DEREF = "pointer.deref";
    /** A raw pointer in a parameter, return or local annotation. */
    public static final String POINTER_DECLARE = "pointer.declare";
    /** A function carrying {@code @driver_entry}. */
    public static final String DRIVER_ENTRY = "kernel.driver_entry";

    private enum Verdict { PERMIT, LOG, REFUSE }

    private final DiagnosticsEngine diagnostics;
    private final OperationClassificationTable classifications;

    /**
     * @param diagnostics     The engine receiving safety errors and audit notes.
     * @param classifications The static operation table.
     */
    public SafetyChecker(DiagnosticsEngine diagnostics, OperationClassificationTable classifications) {
        this.diagnostics = diagnostics;
        this.classifications = classifications;
    }

    /**
     * Checks a type-checked module.
     * @param typed       The module.
     * @param defaultMode The mode used if the source declares no {@code @safety_level}.
     * @return The module annotated with effective modes and audit points.
     */
    public SafeModule check(TypedModule typed, SafetyMode defaultMode) {
        SafetyMode moduleMode = typed.module().decorator(DecoratorKind.SAFETY_LEVEL)
                .map(SafetyChecker::modeOf)
                .orElse(defaultMode);
        CompilerLogger.debug("Safety checking module under mode {}", moduleMode);

        Map<FunctionDeclNode, SafetyMode> functionModes = new IdentityHashMap<>();
        Map<AstNode, String> audited = new IdentityHashMap<>();
        for (FunctionDeclNode function : typed.module().functions()) {
            SafetyMode mode = function.hasDecorator(DecoratorKind.UNSAFE) ? SafetyMode.UNSAFE : moduleMode;
            functionModes.put(function, mode);
            checkFunction(typed, function, mode, audited);
        }
        return new SafeModule(typed, moduleMode, functionModes, audited);
    }

    /**
     * Translates a {@code @safety_level} decorator into a mode.
     * @param decorator The validated decorator.
     * @return The mode it declares; SAFE if it names none.
     */
    static SafetyMode modeOf(DecoratorNode decorator) {
        String name = decorator.argument("mode").map(DecoratorArgument::asText).orElse("SAFE");
        SafetyMode mode = SafetyMode.of(name);
        if (mode.kind() != SafetyMode.Kind.CUSTOM) {
            return mode;
        }
        String allow = decorator.argument("allow").map(DecoratorArgument::asText).orElse(null);
        String block = decorator.argument("block").map(DecoratorArgument::asText).orElse(null);
        return SafetyMode.custom(SafetyRuleset.parse(allow, block));
    }

    private void checkFunction(TypedModule typed, FunctionDeclNode function, SafetyMode mode, Map<AstNode, String> audited) {
        if (function.hasDecorator(DecoratorKind.DRIVER_ENTRY)) {
            apply(DRIVER_ENTRY, function, function.source(), mode, audited);
        }
        for (ParameterNode parameter : function.parameters()) {
            checkDeclaration(parameter.type(), function, mode, audited);
        }
        for (TypeRefNode returnType : function.returnTypes()) {
            checkDeclaration(returnType, function, mode, audited);
        }

        new TreeWalker()
                .on(VarDeclNode.class, declaration -> {
                    if (declaration.type() != null) {
                        checkDeclaration(declaration.type(), function, mode, audited);
                    }
                })
                .on(CallNode.class, call -> typed.callTarget(call)
                        .filter(target -> target.kind() == CallTarget.Kind.EXTERNAL)
                        .ifPresent(target -> apply(target.qualifiedName(), call, call.source(), mode, audited)))
                .on(IndexNode.class, index -> {
                    if (typed.typeOf(index.target()) instanceof PointerType) {
                        apply(POINTER_DEREF, index, index.source(), mode, audited);
                    }
                })
                .walk(function.body());
    }

    private void checkDeclaration(TypeRefNode type, FunctionDeclNode function, SafetyMode mode, Map<AstNode, String> audited) {
        if (type.mentionsPointer()) {
            apply(POINTER_DECLARE, function, type.source(), mode, audited);
        }
    }

    private void apply(String operation, AstNode node, SourceInfo at, SafetyMode mode, Map<AstNode, String> audited) {
        switch (decide(operation, mode)) {
            case REFUSE:
                if (POINTER_DECLARE.equals(operation)) {
                    diagnostics.reportError(CompilerErrorCode.MISSING_UNSAFE_MARKER,
                            "Raw pointers are not permitted under " + mode + " mode; mark the function @unsafe.", at);
                } else {
                    diagnostics.reportError(CompilerErrorCode.BLOCKED_OPERATION,
                            "Operation '" + operation + "' is blocked under " + mode + " mode.", at);
                }
                break;
            case LOG:
                diagnostics.reportInfo(CompilerErrorCode.LOGGED_OPERATION,
                        "Operation '" + operation + "' will be audit-logged.", at);
                if (node instanceof CallNode || node instanceof IndexNode) {
                    audited.put(node, operation);
                }
                break;
            default:
                break;
        }
    }

    private Verdict decide(String operation, SafetyMode mode) {
        OperationClass classification = classifications.classify(operation);
        switch (mode.kind()) {
            case UNSAFE:
                return Verdict.PERMIT;
            case CUSTOM:
                SafetyRuleset.Decision decision = mode.ruleset().decide(operation);
                if (decision == SafetyRuleset.Decision.BLOCK) {
                    return Verdict.REFUSE;
                }
                if (decision == SafetyRuleset.Decision.ALLOW) {
                    return classification == OperationClass.LOGGED ? Verdict.LOG : Verdict.PERMIT;
                }
                return classify(classification);
            default:
                return classify(classification);
        }
    }

    private static Verdict classify(OperationClass classification) {
        return switch (classification) {
            case BLOCKED -> Verdict.REFUSE;
            case LOGGED -> Verdict.LOG;
            case ALLOWED -> Verdict.PERMIT;
        };
    }
}
