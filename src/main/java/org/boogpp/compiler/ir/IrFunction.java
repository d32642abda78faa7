package org.boogpp.compiler.ir;

import org.boogpp.compiler.api.SourceInfo;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One function of the module. The first block is the entry block.
 *
 * @param name        The function name.
 * @param parameters  The parameters as typed registers.
 * @param returnType  The IR return type; a struct type for multi-return functions.
 * @param blocks      The basic blocks, entry first.
 * @param annotations Decorator notes carried into the output, e.g. {@code resilient max_attempts=3}.
 * @param source      The declaration.
 */
public record IrFunction(
        String name,
        List<IrReg> parameters,
        String returnType,
        List<IrBlock> blocks,
        List<String> annotations,
        SourceInfo source
) implements IrItem {

    public IrFunction {
        parameters = List.copyOf(parameters);
        blocks = List.copyOf(blocks);
        annotations = List.copyOf(annotations);
    }

    /**
     * @return The entry block.
     */
    public IrBlock entry() {
        return blocks.get(0);
    }

    /**
     * @param label A block label.
     * @return The block with that label.
     */
    public Optional<IrBlock> block(String label) {
        return blocks.stream().filter(b -> b.label().equals(label)).findFirst();
    }

    /**
     * @return The parameter types in order.
     */
    public List<String> parameterTypes() {
        return parameters.stream().map(IrReg::type).toList();
    }

    /**
     * @return The labels of all blocks reachable from the entry, in discovery order.
     */
    public Set<String> reachableLabels() {
        Map<String, IrBlock> byLabel = new LinkedHashMap<>();
        for (IrBlock block : blocks) {
            byLabel.put(block.label(), block);
        }
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        if (!blocks.isEmpty()) {
            pending.push(entry().label());
        }
        while (!pending.isEmpty()) {
            String label = pending.pop();
            IrBlock block = byLabel.get(label);
            if (block == null || !reached.add(label)) {
                continue;
            }
            for (String successor : block.successors()) {
                pending.push(successor);
            }
        }
        return reached;
    }

    /**
     * @return This function without the blocks unreachable from its entry.
     */
    public IrFunction withoutDeadBlocks() {
        Set<String> reachable = reachableLabels();
        List<IrBlock> live = blocks.stream().filter(b -> reachable.contains(b.label())).toList();
        return new IrFunction(name, parameters, returnType, live, annotations, source);
    }
}
