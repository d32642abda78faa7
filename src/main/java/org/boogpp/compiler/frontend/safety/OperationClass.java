package org.boogpp.compiler.frontend.safety;

/**
 * How the SAFE mode treats an operation.
 */
public enum OperationClass {
    /** Refused unless the function or the mode permits it. */
    BLOCKED,
    /** Permitted, but an audit-log call is inserted before it. */
    LOGGED,
    /** Permitted without further action. */
    ALLOWED
}
