package org.boogpp.compiler.api;

import java.util.Optional;

/**
 * The status code space shared with the runtime library. Values are part of the wire contract:
 * new codes are appended, existing ones are never renumbered.
 */
public enum StatusCode {
    SUCCESS(0),
    GENERIC_ERROR(1),
    ACCESS_DENIED(2),
    TIMEOUT(3),
    NOT_FOUND(4),
    INVALID_PARAMETER(5),
    OUT_OF_MEMORY(6),
    BUFFER_TOO_SMALL(7),
    NOT_IMPLEMENTED(8);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    /**
     * @return The numeric value returned by status functions.
     */
    public int value() {
        return value;
    }

    /**
     * Looks up the code for a numeric value.
     * @param value The numeric status.
     * @return The matching code, or empty for values outside the enumeration.
     */
    public static Optional<StatusCode> fromValue(long value) {
        for (StatusCode code : values()) {
            if (code.value == value) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
