package org.boogpp.compiler.frontend.parser.ast;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.frontend.parser.DecoratorKind;

import java.util.List;
import java.util.Optional;

/**
 * The root of the AST: one compilation unit.
 *
 * @param name       The name from a {@code module} line, or null.
 * @param decorators Module-level decorators (e.g. {@code @safety_level}).
 * @param imports    The import statements in source order.
 * @param functions  The function declarations in source order.
 * @param source     The start of the unit.
 */
public record ModuleNode(
        String name,
        List<DecoratorNode> decorators,
        List<ImportNode> imports,
        List<FunctionDeclNode> functions,
        SourceInfo source
) implements AstNode {

    public ModuleNode {
        decorators = List.copyOf(decorators);
        imports = List.copyOf(imports);
        functions = List.copyOf(functions);
    }

    /**
     * @param kind The decorator kind to look for.
     * @return The first module decorator of that kind.
     */
    public Optional<DecoratorNode> decorator(DecoratorKind kind) {
        return decorators.stream().filter(d -> d.kind() == kind).findFirst();
    }

    /**
     * @return true if the unit declares nothing usable by later stages.
     */
    public boolean isEmpty() {
        return functions.isEmpty() && imports.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(decorators, imports, functions);
    }
}
