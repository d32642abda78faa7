package org.boogpp.cli.commands;

import ch.qos.logback.classic.Level;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;
import org.boogpp.cli.CommandLineInterface;
import org.boogpp.cli.LoggingConfigurator;
import org.boogpp.compiler.Compiler;
import org.boogpp.compiler.api.CompilationResult;
import org.boogpp.compiler.api.CompilerOptions;
import org.boogpp.compiler.api.ICompiler;
import org.boogpp.compiler.api.OutputKind;
import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.api.SafetyRuleset;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.diagnostics.CompilerLogger;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Options and plumbing shared by the commands that compile one source file: reading the file,
 * choosing the safety mode, running the compiler and mapping the outcome to an exit code.
 */
abstract class AbstractSourceCommand implements Callable<Integer> {

    /** Exit code for a compilation that reported errors. */
    static final int EXIT_COMPILATION_ERRORS = 1;
    /** Exit code for an internal compiler error (EX_SOFTWARE). */
    static final int EXIT_INTERNAL_ERROR = 70;
    /** Exit code for an unreadable input or unwritable output (EX_IOERR). */
    static final int EXIT_IO_ERROR = 74;

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSourceCommand.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Parameters(index = "0", paramLabel = "FILE", description = "The Boog++ source file (.bpp).")
    File file;

    @Option(names = {"-m", "--mode"}, description = "Default safety mode if the source declares none: ${COMPLETION-CANDIDATES}.")
    SafetyMode.Kind mode;

    @Option(names = "--allow", description = "Comma separated operations a CUSTOM mode allows.")
    String allow;

    @Option(names = "--block", description = "Comma separated operations a CUSTOM mode blocks.")
    String block;

    @Option(names = {"-t", "--output-kind"}, defaultValue = "EXE",
            description = "The artifact being built: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    OutputKind outputKind;

    @Option(names = "--json", description = "Report diagnostics as JSON.")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Log every compiler stage.")
    boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Log errors only.")
    boolean quiet;

    @ParentCommand
    CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Function<CompilerConfig, ICompiler> compilerFactory;

    AbstractSourceCommand() {
        this(Compiler::new);
    }

    AbstractSourceCommand(Function<CompilerConfig, ICompiler> compilerFactory) {
        this.compilerFactory = compilerFactory;
    }

    @Override
    public Integer call() {
        final CompilerConfig config;
        try {
            config = parent != null ? parent.getConfig() : CompilerConfig.load();
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("error: invalid configuration: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        ICompiler compiler = compilerFactory.apply(config);
        if (verbose) {
            LoggingConfigurator.setCompilerLevel(Level.DEBUG);
            compiler.setVerbosity(CompilerLogger.DEBUG);
        } else if (quiet) {
            LoggingConfigurator.setCompilerLevel(Level.ERROR);
            compiler.setVerbosity(CompilerLogger.ERROR);
        }

        CompilationResult result;
        try {
            CompilerOptions options = new CompilerOptions(file.getPath(), safetyMode(config), outputKind);
            result = compiler.compile(file.toPath(), options);
        } catch (IOException e) {
            LOG.debug("Cannot read {}", file, e);
            spec.commandLine().getErr().println("error: cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (InternalCompilerError e) {
            LOG.error("Internal compiler error while compiling {}", file, e);
            spec.commandLine().getErr().println("internal compiler error: " + e.getMessage());
            return EXIT_INTERNAL_ERROR;
        }

        try {
            return handle(result);
        } catch (IOException e) {
            LOG.debug("Cannot write output", e);
            spec.commandLine().getErr().println("error: cannot write output: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    /**
     * Reports the outcome of a compilation.
     * @param result The compilation result.
     * @return The exit code.
     * @throws IOException if the output cannot be written.
     */
    abstract int handle(CompilationResult result) throws IOException;

    /**
     * Prints diagnostics to stderr, or the JSON report to stdout if {@code --json} is set.
     */
    void report(CompilationResult result, String ir) {
        if (json) {
            spec.commandLine().getOut().println(GSON.toJson(Report.of(file.getPath(), result, ir)));
            return;
        }
        PrintWriter err = spec.commandLine().getErr();
        for (Diagnostic diagnostic : result.diagnostics()) {
            if (diagnostic.type() != Diagnostic.Type.INFO || verbose) {
                err.println(diagnostic);
            }
        }
    }

    static void write(File output, String text) throws IOException {
        Files.writeString(output.toPath(), text);
    }

    SafetyMode safetyMode(CompilerConfig config) {
        if (mode == null) {
            return config.defaultMode();
        }
        return switch (mode) {
            case SAFE -> SafetyMode.SAFE;
            case UNSAFE -> SafetyMode.UNSAFE;
            case CUSTOM -> SafetyMode.custom(SafetyRuleset.parse(allow, block));
        };
    }

    /**
     * The {@code --json} document.
     */
    record Report(String file, boolean success, List<Entry> diagnostics, String ir) {

        record Entry(String severity, String stage, String code, String message, String file, int line, int column) {
        }

        static Report of(String file, CompilationResult result, String ir) {
            List<Entry> entries = result.diagnostics().stream()
                    .map(d -> new Entry(d.type().name(), d.stage().name(), d.code().name(), d.message(), d.fileName(),
                            d.lineNumber(), d.columnNumber()))
                    .toList();
            return new Report(file, !result.hasErrors(), entries, ir);
        }
    }
}
