package org.boogpp.compiler.ir;

import org.boogpp.compiler.api.SourceInfo;

/**
 * Marker interface for IR elements that originate from a source construct. Every item carries
 * source information for diagnostics and debugging.
 */
public interface IrItem {
    SourceInfo source();
}
