package org.boogpp.compiler.ir;

import java.util.List;
import java.util.Optional;

/**
 * A basic block: a label and a straight-line instruction sequence ending in a terminator.
 *
 * @param label        The block label, unique within its function.
 * @param instructions The instructions in execution order.
 */
public record IrBlock(String label, List<IrInstruction> instructions) {

    public IrBlock {
        instructions = List.copyOf(instructions);
    }

    /**
     * @return The last instruction if it is a terminator.
     */
    public Optional<IrInstruction> terminator() {
        if (instructions.isEmpty()) {
            return Optional.empty();
        }
        IrInstruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? Optional.of(last) : Optional.empty();
    }

    /**
     * @return The labels this block may branch to.
     */
    public List<String> successors() {
        return terminator().map(IrInstruction::successors).orElse(List.of());
    }
}
