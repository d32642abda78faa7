package org.boogpp.compiler.frontend.safety;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.api.SafetyRuleset;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.parser.Parser;
import org.boogpp.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.semantics.TypeChecker;
import org.boogpp.compiler.frontend.semantics.TypedModule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SafetyChecker} under the three safety modes.
 */
public class SafetyCheckerTest {

    private static CompilerConfig config;

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @BeforeAll
    static void loadConfig() {
        config = CompilerConfig.defaults();
    }

    private SafeModule check(SafetyMode mode, String... lines) {
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics);
        ModuleNode module = new Parser(lexer.scanTokens(), diagnostics).parse();
        TypedModule typed = new TypeChecker(diagnostics, config.externals()).check(module);
        assertThat(diagnostics.hasErrors()).as("front-end errors: %s", diagnostics.getErrors()).isFalse();
        return new SafetyChecker(diagnostics, config.classifications()).check(typed, mode);
    }

    private List<CompilerErrorCode> errorCodes() {
        return diagnostics.getErrors().stream().map(Diagnostic::code).toList();
    }

    private List<Diagnostic> infos() {
        return diagnostics.getDiagnostics().stream().filter(d -> d.type() == Diagnostic.Type.INFO).toList();
    }

    @Test
    @Tag("unit")
    void testBlockedCallIsRefusedInSafeMode() {
        check(SafetyMode.SAFE,
                "import windows.process",
                "func f(target: handle) -> status:",
                "    return windows.process.inject_dll(target, \"payload.dll\")");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BLOCKED_OPERATION);
        Diagnostic error = diagnostics.getErrors().get(0);
        assertThat(error.message()).contains("windows.process.inject_dll");
        assertThat(error.lineNumber()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testEveryRefusalIsReported() {
        check(SafetyMode.SAFE,
                "func a(n: u64):",
                "    let p = alloc(n)",
                "func b(p: ptr[u8]):",
                "    free(p)");

        assertThat(errorCodes()).containsExactlyInAnyOrder(
                CompilerErrorCode.BLOCKED_OPERATION,
                CompilerErrorCode.MISSING_UNSAFE_MARKER,
                CompilerErrorCode.BLOCKED_OPERATION);
    }

    @Test
    @Tag("unit")
    void testUnsafeFunctionOverridesModuleMode() {
        SafeModule safe = check(SafetyMode.SAFE,
                "@unsafe",
                "func raw(p: ptr[u8]) -> u8:",
                "    return p[0]",
                "func guarded(n: u64):",
                "    let p = alloc(n)");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BLOCKED_OPERATION);
        FunctionDeclNode raw = safe.typed().module().functions().get(0);
        FunctionDeclNode guarded = safe.typed().module().functions().get(1);
        assertThat(safe.modeOf(raw)).isEqualTo(SafetyMode.UNSAFE);
        assertThat(safe.modeOf(guarded)).isEqualTo(SafetyMode.SAFE);
    }

    @Test
    @Tag("unit")
    void testUnsafeModePermitsEverythingWithoutAudit() {
        SafeModule safe = check(SafetyMode.SAFE,
                "@safety_level(mode: UNSAFE)",
                "func f(pid: u32, p: ptr[u8]) -> status:",
                "    let b = p[1]",
                "    return windows.process.terminate(pid)");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(safe.moduleMode()).isEqualTo(SafetyMode.UNSAFE);
        assertThat(safe.audited()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testLoggedOperationIsAnnotatedForAudit() {
        SafeModule safe = check(SafetyMode.SAFE,
                "func f(pid: u32):",
                "    windows.process.terminate(pid)");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(infos()).singleElement()
                .satisfies(d -> assertThat(d.code()).isEqualTo(CompilerErrorCode.LOGGED_OPERATION));
        ExpressionStatementNode statement =
                (ExpressionStatementNode) safe.typed().module().functions().get(0).body().statements().get(0);
        assertThat(safe.auditedOperation(statement.expression())).contains("windows.process.terminate");
    }

    @Test
    @Tag("unit")
    void testPointerDeclarationNeedsUnsafeMarker() {
        check(SafetyMode.SAFE,
                "func f() -> ptr[u8]:",
                "    var p: ptr[u8]",
                "    return p");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.MISSING_UNSAFE_MARKER, CompilerErrorCode.MISSING_UNSAFE_MARKER);
    }

    @Test
    @Tag("unit")
    void testCustomModeFromDecorator() {
        check(SafetyMode.SAFE,
                "@safety_level(mode: CUSTOM, allow: \"alloc\", block: \"windows.file.*\")",
                "func f(n: u64) -> status:",
                "    let p = alloc(n)",
                "    return windows.file.delete(\"C:\\\\temp\\\\x\")");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BLOCKED_OPERATION);
        assertThat(diagnostics.getErrors().get(0).message()).contains("windows.file.delete");
    }

    @Test
    @Tag("unit")
    void testCustomModeFallsBackToClassification() {
        SafetyMode custom = SafetyMode.custom(new SafetyRuleset(Set.of("windows.registry.write"), Set.of()));
        SafeModule safe = check(custom,
                "func f(pid: u32) -> status:",
                "    windows.registry.write(\"HKCU\", \"k\", \"v\")",
                "    let status_code = windows.process.inject_dll(0, \"x.dll\")",
                "    return SUCCESS");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BLOCKED_OPERATION);
        // An explicitly allowed operation that is classified LOGGED is still audited.
        assertThat(safe.audited()).containsValue("windows.registry.write");
    }

    @Test
    @Tag("unit")
    void testDriverEntryIsBlockedOutsideUnsafeMode() {
        check(SafetyMode.SAFE,
                "@driver_entry",
                "func entry() -> status:",
                "    return SUCCESS");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BLOCKED_OPERATION);
    }

    @Test
    @Tag("unit")
    void testClassificationTableWildcards() {
        OperationClassificationTable table = new OperationClassificationTable(Map.of(
                "windows.*", OperationClass.LOGGED,
                "windows.process.*", OperationClass.BLOCKED,
                "windows.process.is_running", OperationClass.ALLOWED));

        assertThat(table.classify("windows.process.is_running")).isEqualTo(OperationClass.ALLOWED);
        assertThat(table.classify("windows.process.start")).isEqualTo(OperationClass.BLOCKED);
        assertThat(table.classify("windows.file.read")).isEqualTo(OperationClass.LOGGED);
        assertThat(table.classify("print")).isEqualTo(OperationClass.ALLOWED);
    }
}
