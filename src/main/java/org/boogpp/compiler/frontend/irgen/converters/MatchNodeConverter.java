package org.boogpp.compiler.frontend.irgen.converters;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.frontend.irgen.IAstNodeToIrConverter;
import org.boogpp.compiler.frontend.irgen.IrGenContext;
import org.boogpp.compiler.frontend.parser.ast.CaseNode;
import org.boogpp.compiler.frontend.parser.ast.MatchNode;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrValue;

/**
 * Lowers {@code match} to a compare-and-branch chain tested in case order; the first matching
 * case wins. Range patterns include both bounds. {@code case _} branches unconditionally, so a
 * case after it could never run and is reported instead of generated.
 */
public final class MatchNodeConverter implements IAstNodeToIrConverter<MatchNode> {

    @Override
    public IrValue convert(MatchNode node, IrGenContext ctx) {
        Type subjectType = ctx.typeOf(node.subject());
        IrValue subject = ctx.value(node.subject());
        boolean signed = BinaryNodeConverter.isSigned(subjectType);
        String end = ctx.newLabel("match.end");
        boolean wildcardSeen = false;

        for (CaseNode caseNode : node.cases()) {
            if (wildcardSeen) {
                ctx.diagnostics().reportError(CompilerErrorCode.UNREACHABLE_CASE_IN_CODEGEN,
                        "Case after 'case _' can never match.", caseNode.source());
                continue;
            }
            String body = ctx.newLabel("match.case");
            if (caseNode.isWildcard()) {
                wildcardSeen = true;
                ctx.branch(body, caseNode.source());
            } else {
                String next = ctx.newLabel("match.next");
                IrValue matches;
                if (caseNode.isRange()) {
                    IrValue low = ctx.value(caseNode.pattern());
                    IrValue high = ctx.value(caseNode.rangeEnd());
                    IrValue aboveLow = ctx.compare(signed ? "icmp sge" : "icmp uge", subject, low, caseNode.source());
                    IrValue belowHigh = ctx.compare(signed ? "icmp sle" : "icmp ule", subject, high, caseNode.source());
                    matches = ctx.binary("and", aboveLow, belowHigh, caseNode.source());
                } else {
                    matches = ctx.compare("icmp eq", subject, ctx.value(caseNode.pattern()), caseNode.source());
                }
                ctx.emit(new IrInstruction.CondBranch(matches, body, next, caseNode.source()));
                ctx.startBlock(body);
                ctx.statements(caseNode.body().statements());
                ctx.branch(end, caseNode.source());
                ctx.startBlock(next);
                continue;
            }
            ctx.startBlock(body);
            ctx.statements(caseNode.body().statements());
            ctx.branch(end, caseNode.source());
        }
        if (!wildcardSeen) {
            // Only a bool match covering both values gets here.
            ctx.emit(new IrInstruction.Unreachable(node.source()));
        }
        ctx.startBlock(end);
        return null;
    }
}
