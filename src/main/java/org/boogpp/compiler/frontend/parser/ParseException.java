package org.boogpp.compiler.frontend.parser;

/**
 * Thrown by the {@link Parser} to unwind from a malformed construct. The error has already
 * been reported to the diagnostics engine when this is thrown; the catcher only synchronizes.
 */
public class ParseException extends RuntimeException {

    /**
     * @param message The message that was reported.
     */
    public ParseException(String message) {
        super(message);
    }
}
