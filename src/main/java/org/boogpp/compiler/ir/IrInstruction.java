package org.boogpp.compiler.ir;

import org.boogpp.compiler.api.SourceInfo;

import java.util.List;
import java.util.Optional;

/**
 * An instruction in a basic block. The last instruction of every block is a terminator
 * ({@link Branch}, {@link CondBranch}, {@link Return} or {@link Unreachable}) and no other
 * instruction is.
 */
public sealed interface IrInstruction extends IrItem {

    /**
     * @return The register this instruction defines, if any.
     */
    default Optional<IrReg> defines() {
        return Optional.empty();
    }

    /**
     * @return The operands read by this instruction, in order.
     */
    default List<IrValue> uses() {
        return List.of();
    }

    /**
     * @return true if the instruction ends a basic block.
     */
    default boolean isTerminator() {
        return false;
    }

    /**
     * @return The labels control may continue at after a terminator.
     */
    default List<String> successors() {
        return List.of();
    }

    /**
     * Integer or floating point arithmetic and bitwise operations.
     * @param opcode {@code add}, {@code sdiv}, {@code fmul}, {@code xor}, {@code ashr}, ...
     */
    record Binary(IrReg result, String opcode, IrValue left, IrValue right, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(left, right);
        }
    }

    /**
     * A comparison producing {@code i1}.
     * @param opcode {@code icmp slt}, {@code fcmp oeq}, ...
     */
    record Compare(IrReg result, String opcode, IrValue left, IrValue right, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(left, right);
        }
    }

    /**
     * A conversion; the target type is the type of {@code result}.
     * @param opcode {@code sext}, {@code zext}, {@code trunc}, {@code sitofp}, {@code fptosi}, ...
     */
    record Cast(IrReg result, String opcode, IrValue value, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(value);
        }
    }

    /**
     * A call of a module function or a declared external.
     * @param result     The result register, or null for a void call.
     * @param callee     The function name or external symbol.
     * @param returnType The IR return type, {@code void} if {@code result} is null.
     */
    record Call(IrReg result, String callee, String returnType, List<IrValue> arguments, SourceInfo source)
            implements IrInstruction {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Optional<IrReg> defines() {
            return Optional.ofNullable(result);
        }

        @Override
        public List<IrValue> uses() {
            return arguments;
        }
    }

    /** A stack slot for one value of {@code allocatedType}; the result is a pointer. */
    record Alloca(IrReg result, String allocatedType, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }
    }

    /** Reads a value of the result's type from memory. */
    record Load(IrReg result, IrValue address, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(address);
        }
    }

    /** Writes a value to memory. */
    record Store(IrValue value, IrValue address, SourceInfo source) implements IrInstruction {
        @Override
        public List<IrValue> uses() {
            return List.of(value, address);
        }
    }

    /** Reads one field of a struct or array value. */
    record ExtractValue(IrReg result, IrValue aggregate, int index, SourceInfo source) implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(aggregate);
        }
    }

    /** Produces a copy of a struct or array value with one field replaced. */
    record InsertValue(IrReg result, IrValue aggregate, IrValue element, int index, SourceInfo source)
            implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(aggregate, element);
        }
    }

    /** The address of element {@code index} in a sequence of {@code elementType} starting at {@code base}. */
    record ElementPtr(IrReg result, String elementType, IrValue base, IrValue index, SourceInfo source)
            implements IrInstruction {
        @Override
        public Optional<IrReg> defines() {
            return Optional.of(result);
        }

        @Override
        public List<IrValue> uses() {
            return List.of(base, index);
        }
    }

    /** Unconditional jump. */
    record Branch(String target, SourceInfo source) implements IrInstruction {
        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        public List<String> successors() {
            return List.of(target);
        }
    }

    /** Two-way jump on an {@code i1}. */
    record CondBranch(IrValue condition, String ifTrue, String ifFalse, SourceInfo source) implements IrInstruction {
        @Override
        public List<IrValue> uses() {
            return List.of(condition);
        }

        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        public List<String> successors() {
            return List.of(ifTrue, ifFalse);
        }
    }

    /** Function return; {@code value} is null in a void function. */
    record Return(IrValue value, SourceInfo source) implements IrInstruction {
        @Override
        public List<IrValue> uses() {
            return value == null ? List.of() : List.of(value);
        }

        @Override
        public boolean isTerminator() {
            return true;
        }
    }

    /** Marks a point control can never reach. */
    record Unreachable(SourceInfo source) implements IrInstruction {
        @Override
        public boolean isTerminator() {
            return true;
        }
    }
}
