package org.boogpp.compiler.frontend;

/**
 * Defines the phases of the compilation pipeline, in execution order.
 * Every diagnostic is attributed to exactly one of these phases.
 */
public enum CompilerPhase {
    /** Phase 1: Converts source text into tokens, synthesizing INDENT/DEDENT/NEWLINE markers. */
    LEXING,

    /** Phase 2: Builds the AST from the token stream. */
    PARSING,

    /** Phase 3: Resolves symbols, infers and verifies types. */
    TYPE_CHECKING,

    /** Phase 4: Applies the safety mode to dangerous operations. */
    SAFETY_CHECKING,

    /** Phase 5: Lowers the checked AST into IR. */
    CODE_GENERATION
}
