package org.boogpp.compiler.diagnostics;

import org.boogpp.compiler.frontend.CompilerPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Stage logging of the compiler core, gated by an integer verbosity.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
 * <p>
 * Each {@link CompilerPhase} logs to its own SLF4J logger ({@code org.boogpp.compiler.parsing},
 * {@code org.boogpp.compiler.code_generation}, ...), so a logging configuration can raise a single
 * stage. The verbosity set through {@link org.boogpp.compiler.api.ICompiler#setVerbosity(int)}
 * is checked before the backend; messages use SLF4J {@code {}} placeholders.
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static final Logger LOG = LoggerFactory.getLogger("org.boogpp.compiler");
    private static final Map<CompilerPhase, Logger> STAGE_LOGGERS = new EnumMap<>(CompilerPhase.class);

    static {
        for (CompilerPhase phase : CompilerPhase.values()) {
            STAGE_LOGGERS.put(phase, LoggerFactory.getLogger("org.boogpp.compiler." + phase.name().toLowerCase()));
        }
    }

    private static volatile int level = INFO;

    private CompilerLogger() {}

    /**
     * @param newLevel The verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    public static int getLevel() {
        return level;
    }

    /**
     * Logs the completion summary of a stage at DEBUG.
     * @param phase The stage.
     * @param format An SLF4J message pattern.
     * @param args The pattern arguments.
     */
    public static void stage(CompilerPhase phase, String format, Object... args) {
        if (level >= DEBUG) {
            STAGE_LOGGERS.get(phase).debug(format, args);
        }
    }

    /**
     * Logs a detail that belongs to no single stage summary at DEBUG.
     * @param format An SLF4J message pattern.
     * @param args The pattern arguments.
     */
    public static void debug(String format, Object... args) {
        if (level >= DEBUG) {
            LOG.debug(format, args);
        }
    }

    public static void trace(String format, Object... args) {
        if (level >= TRACE) {
            LOG.trace(format, args);
        }
    }
}
