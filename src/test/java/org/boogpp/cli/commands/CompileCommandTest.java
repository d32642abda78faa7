package org.boogpp.cli.commands;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.boogpp.cli.CommandLineInterface;
import org.boogpp.compiler.api.CompilationResult;
import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.CompilerOptions;
import org.boogpp.compiler.api.ICompiler;
import org.boogpp.compiler.api.OutputKind;
import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.api.SafetyRuleset;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.ir.IrBlock;
import org.boogpp.compiler.ir.IrFunction;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrModule;
import org.boogpp.compiler.api.SourceInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@code compile} and {@code check} commands, run against a mocked
 * compiler so that only the command plumbing is exercised.
 */
@ExtendWith(MockitoExtension.class)
public class CompileCommandTest {

    private static final IrModule MODULE = new IrModule("prog", List.of(), List.of(), List.of(
            new IrFunction("main", List.of(), "void",
                    List.of(new IrBlock("entry", List.of(new IrInstruction.Return(null, SourceInfo.UNKNOWN)))),
                    List.of(), SourceInfo.UNKNOWN)));

    private static final Diagnostic ERROR = new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNDEFINED_SYMBOL,
            "Undefined symbol 'x'.", "prog.bpp", 3, 12);
    private static final Diagnostic NOTE = new Diagnostic(Diagnostic.Type.INFO, CompilerErrorCode.LOGGED_OPERATION,
            "Operation 'windows.file.delete' will be audit-logged.", "prog.bpp", 5, 4);

    @Mock
    private ICompiler compiler;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine(Object command) {
        CommandLine commandLine = CommandLineInterface.newCommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine;
    }

    private CommandLine compile() {
        return commandLine(new CompileCommand(config -> compiler));
    }

    private CommandLine check() {
        return commandLine(new CheckCommand(config -> compiler));
    }

    @BeforeEach
    void clearOutput() {
        out.getBuffer().setLength(0);
        err.getBuffer().setLength(0);
    }

    @Test
    @Tag("unit")
    void testSuccessfulCompilePrintsIr() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(MODULE, List.of()));

        int exitCode = compile().execute("prog.bpp");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("; ModuleID = 'prog'").contains("define void @main()");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testOutputFile(@TempDir Path directory) throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(MODULE, List.of()));
        Path output = directory.resolve("prog.ll");

        int exitCode = compile().execute("prog.bpp", "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("define void @main()");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testErrorsAreReportedWithExitCodeOne() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(null, List.of(ERROR)));

        int exitCode = compile().execute("prog.bpp");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("[ERROR] prog.bpp:3:12: Undefined symbol 'x'. (UNDEFINED_SYMBOL)");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testInfoDiagnosticsOnlyWhenVerbose() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(MODULE, List.of(NOTE)));

        compile().execute("prog.bpp");
        assertThat(err.toString()).doesNotContain("audit-logged");

        compile().execute("prog.bpp", "--verbose");
        assertThat(err.toString()).contains("audit-logged");
    }

    @Test
    @Tag("unit")
    void testJsonReport() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(null, List.of(ERROR)));

        int exitCode = compile().execute("prog.bpp", "--json");

        assertThat(exitCode).isEqualTo(1);
        JsonObject report = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(report.get("file").getAsString()).isEqualTo("prog.bpp");
        assertThat(report.get("success").getAsBoolean()).isFalse();
        JsonObject entry = report.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertThat(entry.get("severity").getAsString()).isEqualTo("ERROR");
        assertThat(entry.get("stage").getAsString()).isEqualTo("TYPE_CHECKING");
        assertThat(entry.get("code").getAsString()).isEqualTo("UNDEFINED_SYMBOL");
        assertThat(entry.get("line").getAsInt()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testOptionsArePassedToCompiler() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(MODULE, List.of()));

        compile().execute("prog.bpp", "-m", "custom", "--allow", "alloc, free", "--block", "windows.*", "-t", "dll");

        ArgumentCaptor<CompilerOptions> options = ArgumentCaptor.forClass(CompilerOptions.class);
        verify(compiler).compile(any(Path.class), options.capture());
        assertThat(options.getValue().fileName()).isEqualTo("prog.bpp");
        assertThat(options.getValue().outputKind()).isEqualTo(OutputKind.DLL);
        assertThat(options.getValue().safetyMode()).isEqualTo(
                SafetyMode.custom(new SafetyRuleset(Set.of("alloc", "free"), Set.of("windows.*"))));
    }

    @Test
    @Tag("unit")
    void testUnreadableInputExitsWithIoError() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class))).thenThrow(new IOException("no such file"));

        int exitCode = compile().execute("missing.bpp");

        assertThat(exitCode).isEqualTo(74);
        assertThat(err.toString()).contains("cannot read missing.bpp");
    }

    @Test
    @Tag("unit")
    void testInternalCompilerErrorExitsWithSoftwareError() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenThrow(new InternalCompilerError("Block 'entry' has no terminator"));

        int exitCode = compile().execute("prog.bpp");

        assertThat(exitCode).isEqualTo(70);
        assertThat(err.toString()).contains("internal compiler error");
    }

    @Test
    @Tag("unit")
    void testCheckReportsOk() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(MODULE, List.of()));

        int exitCode = check().execute("src/prog.bpp");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("prog.bpp: ok");
    }

    @Test
    @Tag("unit")
    void testCheckReportsErrors() throws IOException {
        when(compiler.compile(any(Path.class), any(CompilerOptions.class)))
                .thenReturn(new CompilationResult(null, List.of(ERROR)));

        int exitCode = check().execute("prog.bpp");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("UNDEFINED_SYMBOL");
        assertThat(out.toString()).isEmpty();
    }
}
