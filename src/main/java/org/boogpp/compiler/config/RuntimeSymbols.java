package org.boogpp.compiler.config;

import java.util.List;

/**
 * ABI symbols of the runtime hooks the code generator calls on its own, as opposed to the
 * functions a program calls by name.
 *
 * @param auditLog     {@code (string operation, i32 line) -> void}, called before a logged operation.
 * @param boundsCheck  {@code (i64 index, i64 length, i32 line) -> void}, aborts on a bad index.
 * @param stringConcat {@code (string, string) -> string}.
 * @param stringEquals {@code (string, string) -> bool}.
 * @param stringLength {@code (string) -> u64}.
 */
public record RuntimeSymbols(
        String auditLog,
        String boundsCheck,
        String stringConcat,
        String stringEquals,
        String stringLength
) {

    /**
     * @return Every hook symbol.
     */
    public List<String> symbols() {
        return List.of(auditLog, boundsCheck, stringConcat, stringEquals, stringLength);
    }
}
