package org.boogpp.compiler.api;

import java.util.Objects;

/**
 * The compile-time safety policy of a compilation unit.
 * <p>
 * A mode is immutable configuration: it is fixed per compilation unit and threaded explicitly
 * through the safety checker, with a per-function override for {@code @unsafe} functions.
 *
 * @param kind    The policy kind.
 * @param ruleset The explicit allow/block rules; empty unless {@code kind} is {@link Kind#CUSTOM}.
 */
public record SafetyMode(Kind kind, SafetyRuleset ruleset) {

    /**
     * The policy kinds understood by the compiler.
     */
    public enum Kind {
        /** Blocked operations are errors, logged operations get an audit call. */
        SAFE,
        /** Everything is permitted, nothing is logged. */
        UNSAFE,
        /** Explicit allow/block rules decide, SAFE classification otherwise. */
        CUSTOM
    }

    /** The default mode. */
    public static final SafetyMode SAFE = new SafetyMode(Kind.SAFE, SafetyRuleset.EMPTY);
    /** The permissive mode. */
    public static final SafetyMode UNSAFE = new SafetyMode(Kind.UNSAFE, SafetyRuleset.EMPTY);

    public SafetyMode {
        Objects.requireNonNull(kind, "kind");
        if (ruleset == null) {
            ruleset = SafetyRuleset.EMPTY;
        }
    }

    /**
     * Creates a custom mode.
     * @param ruleset The rules to apply.
     * @return A CUSTOM mode carrying the given rules.
     */
    public static SafetyMode custom(SafetyRuleset ruleset) {
        return new SafetyMode(Kind.CUSTOM, ruleset);
    }

    /**
     * Parses a mode name (case-insensitive). {@code CUSTOM} yields an empty ruleset.
     * @param name SAFE, UNSAFE or CUSTOM.
     * @return The corresponding mode.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static SafetyMode of(String name) {
        Kind kind = Kind.valueOf(name.trim().toUpperCase());
        return switch (kind) {
            case SAFE -> SAFE;
            case UNSAFE -> UNSAFE;
            case CUSTOM -> custom(SafetyRuleset.EMPTY);
        };
    }

    @Override
    public String toString() {
        return kind == Kind.CUSTOM ? "CUSTOM" + ruleset : kind.name();
    }
}
