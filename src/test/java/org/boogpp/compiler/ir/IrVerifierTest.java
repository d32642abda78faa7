package org.boogpp.compiler.ir;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link IrVerifier} on hand-built modules.
 */
public class IrVerifierTest {

    private static final SourceInfo SRC = SourceInfo.UNKNOWN;

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private static IrFunction function(String name, List<IrReg> parameters, String returnType, IrBlock... blocks) {
        return new IrFunction(name, parameters, returnType, List.of(blocks), List.of(), SRC);
    }

    private static IrModule module(List<IrExternal> externals, IrFunction... functions) {
        return new IrModule("m", externals, List.of(), List.of(functions));
    }

    private static IrFunction add() {
        IrReg a = new IrReg("a", "i32");
        IrReg b = new IrReg("b", "i32");
        IrReg sum = new IrReg("t.0", "i32");
        return function("add", List.of(a, b), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Binary(sum, "add", a, b, SRC),
                new IrInstruction.Return(sum, SRC))));
    }

    @Test
    @Tag("unit")
    void testWellFormedModulePasses() {
        List<String> dead = new IrVerifier(diagnostics).verify(module(List.of(), add()));

        assertThat(dead).isEmpty();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDeadBlocksAreReportedButAllowed() {
        IrFunction f = function("f", List.of(), "void",
                new IrBlock("entry", List.of(new IrInstruction.Return(null, SRC))),
                new IrBlock("orphan", List.of(new IrInstruction.Unreachable(SRC))));

        List<String> dead = new IrVerifier(diagnostics).verify(module(List.of(), f));

        assertThat(dead).containsExactly("f:orphan");
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(module(List.of(), f).withoutDeadBlocks().function("f").orElseThrow().blocks()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testMissingTerminatorIsInternalError() {
        IrReg a = new IrReg("a", "i32");
        IrFunction f = function("f", List.of(a), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Binary(new IrReg("t.0", "i32"), "add", a, a, SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), f)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("no terminator");
    }

    @Test
    @Tag("unit")
    void testTerminatorInMiddleOfBlockIsInternalError() {
        IrFunction f = function("f", List.of(), "void", new IrBlock("entry", List.of(
                new IrInstruction.Return(null, SRC),
                new IrInstruction.Return(null, SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), f)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("Terminator in the middle");
    }

    @Test
    @Tag("unit")
    void testBranchToUnknownLabelIsInternalError() {
        IrFunction f = function("f", List.of(), "void", new IrBlock("entry", List.of(
                new IrInstruction.Branch("nowhere", SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), f)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    @Tag("unit")
    void testUndefinedAndRedefinedRegisters() {
        IrReg ghost = new IrReg("ghost", "i32");
        IrFunction useOfUndefined = function("f", List.of(), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Return(ghost, SRC))));
        IrReg a = new IrReg("a", "i32");
        IrFunction redefinition = function("g", List.of(a), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Binary(a, "add", a, a, SRC),
                new IrInstruction.Return(a, SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), useOfUndefined)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("never defined");
        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), redefinition)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("defined twice");
    }

    @Test
    @Tag("unit")
    void testReturnTypeMustMatch() {
        IrFunction f = function("f", List.of(), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Return(IrConst.integer(1, "i64"), SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), f)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("returns i32");
    }

    @Test
    @Tag("unit")
    void testCallsOfExternalsAreChecked() {
        IrGlobalRef text = new IrGlobalRef(".str.0");
        IrFunction f = function("f", List.of(), "void", new IrBlock("entry", List.of(
                new IrInstruction.Call(new IrReg("t.0", "i32"), "bpp_print", "i32", List.of(text), SRC),
                new IrInstruction.Call(null, "bpp_missing", "void", List.of(), SRC),
                new IrInstruction.Call(null, "bpp_sleep", "void", List.of(text), SRC),
                new IrInstruction.Return(null, SRC))));
        List<IrExternal> externals = List.of(
                new IrExternal("bpp_print", List.of("ptr"), "i32"),
                new IrExternal("bpp_sleep", List.of("i32"), "void"));

        new IrVerifier(diagnostics).verify(module(externals, f));

        assertThat(diagnostics.getErrors()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNKNOWN_EXTERNAL, CompilerErrorCode.UNKNOWN_EXTERNAL);
        assertThat(diagnostics.getErrors().get(0).message()).contains("bpp_missing");
        assertThat(diagnostics.getErrors().get(1).message()).contains("bpp_sleep");
    }

    @Test
    @Tag("unit")
    void testCallOfModuleFunctionMustMatchDefinition() {
        IrFunction caller = function("caller", List.of(), "i32", new IrBlock("entry", List.of(
                new IrInstruction.Call(new IrReg("t.0", "i32"), "add", "i32", List.of(IrConst.integer(1, "i32")), SRC),
                new IrInstruction.Return(new IrReg("t.0", "i32"), SRC))));

        assertThatThrownBy(() -> new IrVerifier(diagnostics).verify(module(List.of(), add(), caller)))
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("does not match its definition");
    }
}
