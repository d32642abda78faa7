package org.boogpp.cli.commands;

import org.boogpp.compiler.api.CompilationResult;
import org.boogpp.compiler.api.ICompiler;
import org.boogpp.compiler.config.CompilerConfig;
import picocli.CommandLine.Command;

import java.util.function.Function;

@Command(name = "check", description = "Type- and safety-checks a Boog++ source file without printing IR.")
public class CheckCommand extends AbstractSourceCommand {

    public CheckCommand() {
        super();
    }

    public CheckCommand(Function<CompilerConfig, ICompiler> compilerFactory) {
        super(compilerFactory);
    }

    @Override
    int handle(CompilationResult result) {
        report(result, null);
        if (result.hasErrors()) {
            return EXIT_COMPILATION_ERRORS;
        }
        if (!json) {
            spec.commandLine().getOut().println(file.getName() + ": ok");
        }
        return 0;
    }
}
