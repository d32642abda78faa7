package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.DecoratorArgument;
import org.boogpp.compiler.frontend.parser.ast.DecoratorNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.semantics.types.FunctionType;
import org.boogpp.compiler.ir.IrReg;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a {@link FunctionDeclNode} into an IR function. Parameters become typed registers
 * named after the parameters; decorators are carried along as annotations.
 */
public final class FunctionDeclNodeConverter implements IAstNodeToIrConverter<FunctionDeclNode> {

    @Override
    public IrValue convert(FunctionDeclNode node, IrGenContext ctx) {
        FunctionType signature = ctx.typed().signatureOf(node);
        List<IrReg> parameters = new ArrayList<>();
        for (int i = 0; i < node.parameters().size(); i++) {
            parameters.add(new IrReg(node.parameters().get(i).name(), signature.parameters().get(i).irName()));
        }

        ctx.beginFunction(node.name(), parameters, signature.returns(), annotations(node, ctx), node.source());
        for (int i = 0; i < parameters.size(); i++) {
            ctx.bind(ctx.declaredBy(node.parameters().get(i)), parameters.get(i));
        }
        ctx.statements(node.body().statements());
        ctx.endFunction();
        return null;
    }

    private static List<String> annotations(FunctionDeclNode node, IrGenContext ctx) {
        List<String> annotations = new ArrayList<>();
        annotations.add("safety " + ctx.safe().modeOf(node));
        for (DecoratorNode decorator : node.decorators()) {
            StringBuilder sb = new StringBuilder(decorator.kind().decoratorName());
            for (DecoratorArgument argument : decorator.arguments()) {
                sb.append(' ').append(argument.name()).append('=').append(argument.asText());
            }
            annotations.add(sb.toString());
        }
        return annotations;
    }
}
