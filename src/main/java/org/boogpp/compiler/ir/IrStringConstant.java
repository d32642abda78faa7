package org.boogpp.compiler.ir;

/**
 * A NUL-terminated string constant stored as a module global.
 *
 * @param name  The global name.
 * @param value The string contents without the terminator.
 */
public record IrStringConstant(String name, String value) {
}
