package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.WhileNode;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

/**
 * Lowers {@code while} to a header block testing the condition, a body block and a merge block.
 */
public final class WhileNodeConverter implements IAstNodeToIrConverter<WhileNode> {

    @Override
    public IrValue convert(WhileNode node, IrGenContext ctx) {
        String header = ctx.newLabel("while.cond");
        String body = ctx.newLabel("while.body");
        String end = ctx.newLabel("while.end");

        ctx.startBlock(header);
        IrValue condition = ctx.value(node.condition());
        ctx.emit(new IrInstruction.CondBranch(condition, body, end, node.source()));

        ctx.startBlock(body);
        ctx.pushLoop(end, header);
        ctx.statements(node.body().statements());
        ctx.popLoop();
        ctx.branch(header, node.source());

        ctx.startBlock(end);
        return null;
    }
}
