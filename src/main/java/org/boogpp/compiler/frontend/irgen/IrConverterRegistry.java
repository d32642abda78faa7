package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.frontend.irgen.converters.ArrayLiteralNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.AssignNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.BinaryNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.BlockNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.CallNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.ForNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.FunctionDeclNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.IdentifierNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.IfNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.IndexNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.LiteralNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.MatchNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.MemberAccessNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.ReturnNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.TryChainNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.TupleNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.UnaryNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.VarDeclNodeConverter;
import org.boogpp.compiler.frontend.irgen.converters.WhileNodeConverter;
import org.boogpp.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.boogpp.compiler.frontend.parser.ast.AssignNode;
import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.BinaryNode;
import org.boogpp.compiler.frontend.parser.ast.BlockNode;
import org.boogpp.compiler.frontend.parser.ast.BreakNode;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.ContinueNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.boogpp.compiler.frontend.parser.ast.ForNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.parser.ast.IfNode;
import org.boogpp.compiler.frontend.parser.ast.IndexNode;
import org.boogpp.compiler.frontend.parser.ast.LiteralNode;
import org.boogpp.compiler.frontend.parser.ast.MatchNode;
import org.boogpp.compiler.frontend.parser.ast.MemberAccessNode;
import org.boogpp.compiler.frontend.parser.ast.PassNode;
import org.boogpp.compiler.frontend.parser.ast.ReturnNode;
import org.boogpp.compiler.frontend.parser.ast.TryChainNode;
import org.boogpp.compiler.frontend.parser.ast.TupleNode;
import org.boogpp.compiler.frontend.parser.ast.UnaryNode;
import org.boogpp.compiler.frontend.parser.ast.VarDeclNode;
import org.boogpp.compiler.frontend.parser.ast.WhileNode;
import org.boogpp.compiler.ir.IrInstruction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered converter.
 */
public final class IrConverterRegistry {

    private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> byClass = new HashMap<>();
    private final IAstNodeToIrConverter<AstNode> defaultConverter;

    private IrConverterRegistry(IAstNodeToIrConverter<AstNode> defaultConverter) {
        this.defaultConverter = defaultConverter;
    }

    /**
     * Registers a converter for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param converter The converter instance handling that class.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
        byClass.put(nodeType, converter);
    }

    /**
     * Retrieves the converter strictly registered for the given class (no hierarchy search).
     *
     * @param nodeType The AST node class to look up.
     * @return Optional converter if present.
     */
    public Optional<IAstNodeToIrConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * Resolves a converter for the given node by searching the node's concrete class,
     * then its interfaces. Falls back to the default converter.
     *
     * @param node The AST node instance to resolve a converter for.
     * @return A non-null converter to handle the node.
     */
    @SuppressWarnings("unchecked")
    public IAstNodeToIrConverter<AstNode> resolve(AstNode node) {
        Class<?> c = node.getClass();
        while (c != null && AstNode.class.isAssignableFrom(c)) {
            IAstNodeToIrConverter<?> found = byClass.get(c);
            if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
            for (Class<?> i : c.getInterfaces()) {
                if (AstNode.class.isAssignableFrom(i)) {
                    found = byClass.get(i.asSubclass(AstNode.class));
                    if (found != null) return (IAstNodeToIrConverter<AstNode>) found;
                }
            }
            c = c.getSuperclass();
        }
        return defaultConverter;
    }

    /**
     * Creates a registry with the given default converter and no other registrations.
     *
     * @param defaultConverter The fallback converter used for unknown node types.
     * @return A new registry instance.
     */
    public static IrConverterRegistry initialize(IAstNodeToIrConverter<AstNode> defaultConverter) {
        return new IrConverterRegistry(defaultConverter);
    }

    /**
     * Initializes a registry with the default converter and registers all built-in converters.
     *
     * @return A registry pre-populated with the standard converters.
     */
    public static IrConverterRegistry initializeWithDefaults() {
        IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
        reg.register(FunctionDeclNode.class, new FunctionDeclNodeConverter());

        reg.register(BlockNode.class, new BlockNodeConverter());
        reg.register(VarDeclNode.class, new VarDeclNodeConverter());
        reg.register(AssignNode.class, new AssignNodeConverter());
        reg.register(IfNode.class, new IfNodeConverter());
        reg.register(WhileNode.class, new WhileNodeConverter());
        reg.register(ForNode.class, new ForNodeConverter());
        reg.register(MatchNode.class, new MatchNodeConverter());
        reg.register(ReturnNode.class, new ReturnNodeConverter());
        reg.register(ExpressionStatementNode.class, (node, ctx) -> {
            ctx.convert(node.expression());
            return null;
        });
        reg.register(PassNode.class, (node, ctx) -> null);
        reg.register(BreakNode.class, (node, ctx) -> {
            ctx.emit(new IrInstruction.Branch(ctx.breakTarget(node.source()), node.source()));
            return null;
        });
        reg.register(ContinueNode.class, (node, ctx) -> {
            ctx.emit(new IrInstruction.Branch(ctx.continueTarget(node.source()), node.source()));
            return null;
        });

        reg.register(LiteralNode.class, new LiteralNodeConverter());
        reg.register(IdentifierNode.class, new IdentifierNodeConverter());
        reg.register(BinaryNode.class, new BinaryNodeConverter());
        reg.register(UnaryNode.class, new UnaryNodeConverter());
        reg.register(CallNode.class, new CallNodeConverter());
        reg.register(TupleNode.class, new TupleNodeConverter());
        reg.register(ArrayLiteralNode.class, new ArrayLiteralNodeConverter());
        reg.register(IndexNode.class, new IndexNodeConverter());
        reg.register(MemberAccessNode.class, new MemberAccessNodeConverter());
        reg.register(TryChainNode.class, new TryChainNodeConverter());
        return reg;
    }
}
