package org.boogpp.compiler.api;

import java.util.Objects;

/**
 * Immutable per-invocation settings passed in by the driver.
 *
 * @param fileName    The logical file name used in diagnostics.
 * @param safetyMode  The mode used when the source declares no {@code @safety_level}.
 * @param outputKind  The kind of artifact being built.
 */
public record CompilerOptions(String fileName, SafetyMode safetyMode, OutputKind outputKind) {

    public CompilerOptions {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(safetyMode, "safetyMode");
        Objects.requireNonNull(outputKind, "outputKind");
    }

    /**
     * @param fileName The logical file name.
     * @return Options for a SAFE library build of the given file.
     */
    public static CompilerOptions library(String fileName) {
        return new CompilerOptions(fileName, SafetyMode.SAFE, OutputKind.DLL);
    }

    /**
     * @param mode The new default safety mode.
     * @return A copy with the given safety mode.
     */
    public CompilerOptions withSafetyMode(SafetyMode mode) {
        return new CompilerOptions(fileName, mode, outputKind);
    }

    /**
     * @param kind The new output kind.
     * @return A copy with the given output kind.
     */
    public CompilerOptions withOutputKind(OutputKind kind) {
        return new CompilerOptions(fileName, safetyMode, kind);
    }
}
