package org.boogpp.compiler.api;

import org.boogpp.compiler.frontend.CompilerPhase;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A string, char literal or block comment was not closed. */
    UNTERMINATED(CompilerPhase.LEXING),
    /** A character that cannot start any token. */
    INVALID_CHARACTER(CompilerPhase.LEXING),
    /** A dedent to a width that matches no enclosing indentation level. */
    INCONSISTENT_INDENTATION(CompilerPhase.LEXING),
    /** A malformed numeric literal or an unknown literal suffix. */
    INVALID_NUMBER_LITERAL(CompilerPhase.LEXING),
    // endregion

    // region Parser Errors
    /** A token other than the expected one was found. */
    UNEXPECTED_TOKEN(CompilerPhase.PARSING),
    /** A try_chain without a fallback clause. */
    MISSING_FALLBACK(CompilerPhase.PARSING),
    /** An unknown decorator, an unknown option or an option of the wrong kind. */
    MALFORMED_DECORATOR(CompilerPhase.PARSING),
    // endregion

    // region Type Checker Errors
    /** An identifier that does not resolve in any enclosing scope. */
    UNDEFINED_SYMBOL(CompilerPhase.TYPE_CHECKING),
    /** Operands not acceptable for an operator. */
    OPERAND_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A return statement with the wrong number of values. */
    RETURN_ARITY_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A returned value whose type differs from the declared one. */
    RETURN_TYPE_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A literal index outside the bounds of a fixed-size array or tuple. */
    INDEX_OUT_OF_BOUNDS(CompilerPhase.TYPE_CHECKING),
    /** A name declared twice in the same scope. */
    DUPLICATE_DECLARATION(CompilerPhase.TYPE_CHECKING),
    /** A type annotation naming no known type. */
    UNKNOWN_TYPE(CompilerPhase.TYPE_CHECKING),
    /** A value whose type does not match the declared or expected type. */
    TYPE_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A call with the wrong number of arguments. */
    ARGUMENT_COUNT_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A call argument whose type differs from the parameter type. */
    ARGUMENT_TYPE_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** A call through something that is not a function. */
    NOT_CALLABLE(CompilerPhase.TYPE_CHECKING),
    /** Assignment to a let binding or a parameter. */
    IMMUTABLE_ASSIGNMENT(CompilerPhase.TYPE_CHECKING),
    /** A non-void function that can fall off its end. */
    MISSING_RETURN(CompilerPhase.TYPE_CHECKING),
    /** An if/while condition that is not bool. */
    CONDITION_NOT_BOOL(CompilerPhase.TYPE_CHECKING),
    /** An integer literal that does not fit its inferred type. */
    LITERAL_OUT_OF_RANGE(CompilerPhase.TYPE_CHECKING),
    /** A case following the catch-all case. */
    UNREACHABLE_CASE(CompilerPhase.TYPE_CHECKING),
    /** A match that does not cover every value of its subject. */
    NON_EXHAUSTIVE_MATCH(CompilerPhase.TYPE_CHECKING),
    /** A try_chain clause not assignable to the fallback type. */
    TRY_CHAIN_TYPE_MISMATCH(CompilerPhase.TYPE_CHECKING),
    /** break or continue outside of a loop. */
    BREAK_OUTSIDE_LOOP(CompilerPhase.TYPE_CHECKING),
    /** An import naming a module without supplied signatures. */
    UNKNOWN_MODULE(CompilerPhase.TYPE_CHECKING),
    /** A value used in a position its type does not support (indexing, iteration, member access). */
    INVALID_OPERATION(CompilerPhase.TYPE_CHECKING),
    // endregion

    // region Safety Errors
    /** An operation refused by the active safety mode. */
    BLOCKED_OPERATION(CompilerPhase.SAFETY_CHECKING),
    /** Raw pointers used in a function that does not permit them. */
    MISSING_UNSAFE_MARKER(CompilerPhase.SAFETY_CHECKING),
    /** Informational: an operation that will be audit-logged. */
    LOGGED_OPERATION(CompilerPhase.SAFETY_CHECKING),
    // endregion

    // region Code Generation Errors
    /** A call to an external symbol that is not declared or whose signature differs. */
    UNKNOWN_EXTERNAL(CompilerPhase.CODE_GENERATION),
    /** A match case after the catch-all case reached the generator. */
    UNREACHABLE_CASE_IN_CODEGEN(CompilerPhase.CODE_GENERATION),
    /** The output kind requires an entry point that the module does not define. */
    MISSING_ENTRY_POINT(CompilerPhase.CODE_GENERATION);
    // endregion

    private final CompilerPhase phase;

    CompilerErrorCode(CompilerPhase phase) {
        this.phase = phase;
    }

    /**
     * @return The pipeline phase that reports this error.
     */
    public CompilerPhase phase() {
        return phase;
    }
}
