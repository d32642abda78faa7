package org.boogpp.compiler.api;

/**
 * The kind of native artifact the external backend will produce from the IR.
 */
public enum OutputKind {
    /** An executable; requires {@code func main}. */
    EXE,
    /** A dynamic library; no entry point required. */
    DLL,
    /** A kernel driver; requires exactly one {@code @driver_entry} function. */
    DRIVER
}
