package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;

/**
 * {@code import a.b [as c]} or {@code from a.b import x, y}.
 *
 * @param modulePath The dotted module path.
 * @param alias      The alias of a plain import, or null.
 * @param names      The names bound by a {@code from} import; empty for a plain import.
 * @param source     The position of the import keyword.
 */
public record ImportNode(String modulePath, String alias, List<String> names, SourceInfo source) implements AstNode {

    public ImportNode {
        names = List.copyOf(names);
    }

    /**
     * @return true for the {@code from ... import ...} form.
     */
    public boolean isFromImport() {
        return !names.isEmpty();
    }

    /**
     * @return The name under which a plain import is visible.
     */
    public String boundName() {
        if (alias != null) {
            return alias;
        }
        return modulePath;
    }
}
