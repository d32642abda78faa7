package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.ConditionalBranch;
import org.boogpp.compiler.frontend.parser.ast.IfNode;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

/**
 * Lowers {@code if/elif/else} to a chain of condition blocks, one block per branch and a
 * merge block.
 */
public final class IfNodeConverter implements IAstNodeToIrConverter<IfNode> {

    @Override
    public IrValue convert(IfNode node, IrGenContext ctx) {
        String merge = ctx.newLabel("if.end");
        for (ConditionalBranch branch : node.branches()) {
            String then = ctx.newLabel("if.then");
            String next = ctx.newLabel("if.else");
            IrValue condition = ctx.value(branch.condition());
            ctx.emit(new IrInstruction.CondBranch(condition, then, next, branch.source()));

            ctx.startBlock(then);
            ctx.statements(branch.body().statements());
            ctx.branch(merge, branch.source());
            ctx.startBlock(next);
        }
        if (node.elseBlock() != null) {
            ctx.statements(node.elseBlock().statements());
        }
        ctx.branch(merge, node.source());
        ctx.startBlock(merge);
        return null;
    }
}
