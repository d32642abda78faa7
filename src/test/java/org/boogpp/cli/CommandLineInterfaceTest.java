package org.boogpp.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Contains tests for the command line entry point, running the real compiler on files in a
 * temporary directory.
 */
public class CommandLineInterfaceTest {

    private static final String PROGRAM = """
            func main() -> status:
                print("hello")
                return SUCCESS
            """;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmd = CommandLineInterface.newCommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd;
    }

    @Test
    @Tag("unit")
    void testCommandStructure() {
        CommandLine cmd = commandLine();

        assertEquals("boogpp", cmd.getCommandName());
        assertNotNull(cmd.getSubcommands().get("compile"));
        assertNotNull(cmd.getSubcommands().get("check"));
        assertNotNull(cmd.getSubcommands().get("help"));
    }

    @Test
    @Tag("unit")
    void testHelpAndVersion() {
        assertEquals(0, commandLine().execute("--help"));
        assertThat(out.toString()).contains("compile").contains("check");

        out.getBuffer().setLength(0);
        assertEquals(0, commandLine().execute("--version"));
        assertThat(out.toString()).contains("Boog++ compiler");
    }

    @Test
    @Tag("unit")
    void testUnknownOptionIsUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, commandLine().execute("compile", "--no-such-option", "x.bpp"));
    }

    @Test
    @Tag("integration")
    void testMissingConfigFileIsUsageError(@TempDir Path directory) throws IOException {
        Path source = directory.resolve("hello.bpp");
        Files.writeString(source, PROGRAM);

        int exitCode = commandLine().execute("--config", directory.resolve("missing.conf").toString(),
                "check", source.toString());

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertThat(err.toString()).contains("invalid configuration").contains("missing.conf");
    }

    @Test
    @Tag("integration")
    void testCompileEndToEnd(@TempDir Path directory) throws IOException {
        Path source = directory.resolve("hello.bpp");
        Path output = directory.resolve("hello.ll");
        Files.writeString(source, PROGRAM);

        int exitCode = commandLine().execute("compile", source.toString(), "-o", output.toString());

        assertEquals(0, exitCode);
        String ir = Files.readString(output);
        assertThat(ir).contains("; ModuleID = 'hello'")
                .contains("declare i32 @bpp_print(ptr)")
                .contains("define i32 @main()");
    }

    @Test
    @Tag("integration")
    void testCheckWithConfigOverride(@TempDir Path directory) throws IOException {
        Path source = directory.resolve("danger.bpp");
        Files.writeString(source, """
                import windows.process

                func main(target: handle) -> status:
                    return windows.process.inject_dll(target, "x.dll")
                """);
        Path config = directory.resolve("boogpp.conf");
        Files.writeString(config, "boogpp.safety.default-mode = UNSAFE\n");

        assertEquals(1, commandLine().execute("check", source.toString()));
        assertThat(err.toString()).contains("BLOCKED_OPERATION");

        out.getBuffer().setLength(0);
        assertEquals(0, commandLine().execute("--config", config.toString(), "check", source.toString()));
        assertThat(out.toString().trim()).isEqualTo("danger.bpp: ok");
    }
}
