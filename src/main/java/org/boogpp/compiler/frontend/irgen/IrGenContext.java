package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.config.RuntimeSymbols;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.diagnostics.InternalCompilerError;
import org.boogpp.compiler.frontend.parser.ast.AstNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.StatementNode;
import org.boogpp.compiler.frontend.safety.SafeModule;
import org.boogpp.compiler.frontend.semantics.Symbol;
import org.boogpp.compiler.frontend.semantics.TypedModule;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.ResultType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.ir.IrBlock;
import org.boogpp.compiler.ir.IrConst;
import org.boogpp.compiler.ir.IrExternal;
import org.boogpp.compiler.ir.IrFunction;
import org.boogpp.compiler.ir.IrGlobalRef;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrModule;
import org.boogpp.compiler.ir.IrReg;
import org.boogpp.compiler.ir.IrStringConstant;
import org.boogpp.compiler.ir.IrValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context passed to converters during IR generation.
 * <p>
 * Holds the module being built (functions, externals, string constants) and the state of the
 * function under construction: its blocks, the open block, register and label counters, the
 * storage of each local symbol and the targets of {@code break}/{@code continue}.
 * Instructions emitted after a terminator land in a fresh block no branch reaches, which the
 * verifier later reports as dead.
 */
public final class IrGenContext {

    /**
     * Where a local symbol lives: an SSA value, or a stack slot holding a value of {@code type}.
     */
    public record Binding(IrValue value, boolean slot, String type) {}

    private record LoopTargets(String breakLabel, String continueLabel) {}

    private final String moduleName;
    private final DiagnosticsEngine diagnostics;
    private final IrConverterRegistry registry;
    private final SafeModule safe;
    private final RuntimeSymbols runtime;
    private final Map<String, IrExternal> externals = new LinkedHashMap<>();
    private final Map<String, IrStringConstant> strings = new LinkedHashMap<>();
    private final List<IrFunction> functions = new ArrayList<>();

    private String functionName;
    private List<IrReg> parameters;
    private String returnType;
    private List<Type> returnTypes;
    private List<String> annotations;
    private SourceInfo functionSource;
    private final List<IrBlock> blocks = new ArrayList<>();
    private final List<IrInstruction> slots = new ArrayList<>();
    private String currentLabel;
    private List<IrInstruction> current;
    private int registerCounter;
    private int labelCounter;
    private final Map<Symbol, Binding> bindings = new IdentityHashMap<>();
    private final Deque<LoopTargets> loops = new ArrayDeque<>();

    /**
     * Constructs a new IR generation context.
     * @param moduleName  The name of the module being generated.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param registry    The registry for resolving AST node converters.
     * @param safe        The checked module with its safety annotations.
     * @param runtime     The runtime hooks generated code calls.
     */
    public IrGenContext(String moduleName, DiagnosticsEngine diagnostics, IrConverterRegistry registry,
                        SafeModule safe, RuntimeSymbols runtime) {
        this.moduleName = moduleName;
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.safe = safe;
        this.runtime = runtime;
    }

    // --- Conversion ---

    /**
     * Converts the given AST node by resolving and invoking the appropriate converter.
     * @param node The node to convert.
     * @return The value produced, or null.
     */
    public IrValue convert(AstNode node) {
        return registry.resolve(node).convert(node, this);
    }

    /**
     * Converts an expression that must produce a value.
     * @param expression The expression.
     * @return Its value.
     */
    public IrValue value(ExpressionNode expression) {
        IrValue value = convert(expression);
        if (value == null) {
            throw new InternalCompilerError("Expression produced no value", expression.source());
        }
        return value;
    }

    /**
     * Converts statements in order.
     * @param statements The statements.
     */
    public void statements(List<StatementNode> statements) {
        for (StatementNode statement : statements) {
            convert(statement);
        }
    }

    /**
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public SafeModule safe() {
        return safe;
    }

    public TypedModule typed() {
        return safe.typed();
    }

    public RuntimeSymbols runtime() {
        return runtime;
    }

    /**
     * @param expression A checked expression.
     * @return Its static type.
     */
    public Type typeOf(ExpressionNode expression) {
        Type type = typed().typeOf(expression);
        if (type.containsUnknown()) {
            throw new InternalCompilerError("No type was inferred for expression", expression.source());
        }
        return type;
    }

    /**
     * @param node A declaring node (let/var, parameter, for loop).
     * @return The symbol it declares.
     */
    public Symbol declaredBy(AstNode node) {
        return typed().declaredBy(node)
                .orElseThrow(() -> new InternalCompilerError("Declaration without a symbol", node.source()));
    }

    // --- Functions and blocks ---

    /**
     * Starts a new function with an open {@code entry} block.
     */
    public void beginFunction(String name, List<IrReg> parameters, List<Type> returnTypes, List<String> annotations,
                              SourceInfo source) {
        this.functionName = name;
        this.parameters = List.copyOf(parameters);
        this.returnTypes = List.copyOf(returnTypes);
        this.returnType = Type.ofReturns(returnTypes).irName();
        this.annotations = List.copyOf(annotations);
        this.functionSource = source;
        this.blocks.clear();
        this.slots.clear();
        this.bindings.clear();
        this.loops.clear();
        this.registerCounter = 0;
        this.labelCounter = 0;
        this.currentLabel = "entry";
        this.current = new ArrayList<>();
    }

    /**
     * Closes the open block, returning from a void function or marking the end unreachable
     * otherwise, and adds the function to the module.
     */
    public void endFunction() {
        if (current != null) {
            emit(returnType.equals("void") ? new IrInstruction.Return(null, functionSource)
                    : new IrInstruction.Unreachable(functionSource));
        }
        if (!slots.isEmpty()) {
            IrBlock entry = blocks.get(0);
            List<IrInstruction> instructions = new ArrayList<>(slots);
            instructions.addAll(entry.instructions());
            blocks.set(0, new IrBlock(entry.label(), instructions));
        }
        functions.add(new IrFunction(functionName, parameters, returnType, blocks, annotations, functionSource));
        functionName = null;
    }

    /**
     * @return The declared return types of the function under construction.
     */
    public List<Type> returnTypes() {
        return returnTypes;
    }

    /**
     * @return The IR return type of the function under construction.
     */
    public String returnType() {
        return returnType;
    }

    /**
     * @param hint A readable prefix.
     * @return A fresh label unique within the function.
     */
    public String newLabel(String hint) {
        return hint + "." + labelCounter++;
    }

    /**
     * Opens a new block. If the current block is still open, it falls through to the new one.
     * @param label The label of the new block.
     */
    public void startBlock(String label) {
        if (current != null) {
            emit(new IrInstruction.Branch(label, SourceInfo.UNKNOWN));
        }
        currentLabel = label;
        current = new ArrayList<>();
    }

    /**
     * @return true if the current block already ended in a terminator.
     */
    public boolean isTerminated() {
        return current == null;
    }

    /**
     * Branches to {@code label} unless the current block already ended.
     */
    public void branch(String label, SourceInfo source) {
        if (current != null) {
            emit(new IrInstruction.Branch(label, source));
        }
    }

    /**
     * Appends an instruction to the current block.
     * @param instruction The instruction.
     */
    public void emit(IrInstruction instruction) {
        if (current == null) {
            currentLabel = newLabel("dead");
            current = new ArrayList<>();
        }
        current.add(instruction);
        if (instruction.isTerminator()) {
            blocks.add(new IrBlock(currentLabel, current));
            current = null;
        }
    }

    /**
     * @param type The IR type.
     * @return A fresh temporary register.
     */
    public IrReg newRegister(String type) {
        return new IrReg("t." + registerCounter++, type);
    }

    // --- Locals ---

    public void bind(Symbol symbol, IrValue value) {
        bindings.put(symbol, new Binding(value, false, value.type()));
    }

    public void bindSlot(Symbol symbol, IrValue address, String type) {
        bindings.put(symbol, new Binding(address, true, type));
    }

    /**
     * @param symbol A local symbol.
     * @return Its storage.
     */
    public Binding binding(Symbol symbol) {
        Binding binding = bindings.get(symbol);
        if (binding == null) {
            throw new InternalCompilerError("Symbol '" + symbol.name() + "' has no storage", symbol.declaredAt());
        }
        return binding;
    }

    /**
     * Allocates a stack slot. The {@code alloca} goes to the top of the entry block, wherever the
     * slot is requested, so a slot inside a loop is allocated once per call.
     * @param name A readable name for the slot register.
     * @param type The IR type of the stored value.
     * @return The slot address.
     */
    public IrReg slot(String name, String type, SourceInfo source) {
        IrReg address = new IrReg(name + ".addr." + registerCounter++, "ptr");
        slots.add(new IrInstruction.Alloca(address, type, source));
        return address;
    }

    public IrValue load(IrValue address, String type, SourceInfo source) {
        IrReg result = newRegister(type);
        emit(new IrInstruction.Load(result, address, source));
        return result;
    }

    public void store(IrValue value, IrValue address, SourceInfo source) {
        emit(new IrInstruction.Store(value, address, source));
    }

    /**
     * Stores a value in a fresh stack slot.
     * @return The slot address.
     */
    public IrValue spill(IrValue value, SourceInfo source) {
        IrReg address = slot("spill", value.type(), source);
        store(value, address, source);
        return address;
    }

    // --- Loops ---

    public void pushLoop(String breakLabel, String continueLabel) {
        loops.push(new LoopTargets(breakLabel, continueLabel));
    }

    public void popLoop() {
        loops.pop();
    }

    public String breakTarget(SourceInfo source) {
        if (loops.isEmpty()) {
            throw new InternalCompilerError("break outside of a loop", source);
        }
        return loops.peek().breakLabel();
    }

    public String continueTarget(SourceInfo source) {
        if (loops.isEmpty()) {
            throw new InternalCompilerError("continue outside of a loop", source);
        }
        return loops.peek().continueLabel();
    }

    // --- Values ---

    public IrValue binary(String opcode, IrValue left, IrValue right, SourceInfo source) {
        IrReg result = newRegister(left.type());
        emit(new IrInstruction.Binary(result, opcode, left, right, source));
        return result;
    }

    public IrValue compare(String opcode, IrValue left, IrValue right, SourceInfo source) {
        IrReg result = newRegister("i1");
        emit(new IrInstruction.Compare(result, opcode, left, right, source));
        return result;
    }

    public IrValue cast(String opcode, IrValue value, String type, SourceInfo source) {
        IrReg result = newRegister(type);
        emit(new IrInstruction.Cast(result, opcode, value, source));
        return result;
    }

    public IrValue extract(IrValue aggregate, int index, String type, SourceInfo source) {
        IrReg result = newRegister(type);
        emit(new IrInstruction.ExtractValue(result, aggregate, index, source));
        return result;
    }

    /**
     * Builds a struct or array value from its elements.
     * @param type     The aggregate IR type.
     * @param elements The element values in order.
     * @return The aggregate.
     */
    public IrValue aggregate(String type, List<IrValue> elements, SourceInfo source) {
        IrValue value = IrConst.zero(type);
        for (int i = 0; i < elements.size(); i++) {
            IrReg next = newRegister(type);
            emit(new IrInstruction.InsertValue(next, value, elements.get(i), i, source));
            value = next;
        }
        return value;
    }

    /**
     * Emits a call.
     * @return The result register, or null if {@code returnType} is void.
     */
    public IrValue call(String callee, String returnType, List<IrValue> arguments, SourceInfo source) {
        IrReg result = "void".equals(returnType) ? null : newRegister(returnType);
        emit(new IrInstruction.Call(result, callee, returnType, arguments, source));
        return result;
    }

    /**
     * Declares an external once and calls it.
     */
    public IrValue callExternal(String symbol, List<String> parameterTypes, String returnType, List<IrValue> arguments,
                                SourceInfo source) {
        declareExternal(symbol, parameterTypes, returnType);
        return call(symbol, returnType, arguments, source);
    }

    /**
     * Adds an external declaration unless the symbol is already declared.
     */
    public void declareExternal(String symbol, List<String> parameterTypes, String returnType) {
        externals.putIfAbsent(symbol, new IrExternal(symbol, parameterTypes, returnType));
    }

    /**
     * @param value A string.
     * @return The address of a module constant holding it; equal strings share one constant.
     */
    public IrGlobalRef string(String value) {
        return new IrGlobalRef(strings.computeIfAbsent(value,
                v -> new IrStringConstant(".str." + strings.size(), v)).name());
    }

    /**
     * Emits the audit-log call for a logged operation.
     */
    public void audit(String operation, SourceInfo source) {
        callExternal(runtime.auditLog(), List.of("ptr", "i32"), "void",
                List.of(string(operation), IrConst.integer(source.lineNumber(), "i32")), source);
    }

    /**
     * Emits the runtime bounds check for an index that is not a compile-time constant.
     */
    public void boundsCheck(IrValue index, IrValue length, SourceInfo source) {
        callExternal(runtime.boundsCheck(), List.of("i64", "i64", "i32"), "void",
                List.of(index, length, IrConst.integer(source.lineNumber(), "i32")), source);
    }

    /**
     * Widens or narrows an integer to {@code i64}.
     */
    public IrValue toI64(IrValue value, Type type, SourceInfo source) {
        if ("i64".equals(value.type())) {
            return value;
        }
        boolean signed = type instanceof PrimitiveType p && p.kind().isSigned();
        return cast(signed ? "sext" : "zext", value, "i64", source);
    }

    /**
     * @return The all-zero value of a type.
     */
    public IrValue zero(Type type) {
        return IrConst.zero(type.irName());
    }

    /**
     * Converts a value to a type it is assignable to: an array becomes a slice over a copy on
     * the stack, tuples and results are rebuilt element by element where their layouts differ.
     *
     * @param value The value.
     * @param from  Its static type.
     * @param to    The target type.
     * @return The converted value.
     */
    public IrValue coerce(IrValue value, Type from, Type to, SourceInfo source) {
        if (from.irName().equals(to.irName())) {
            return value;
        }
        if (to instanceof SliceType && from instanceof ArrayType array) {
            IrValue base = spill(value, source);
            return aggregate(to.irName(), List.of(base, IrConst.integer(array.size(), "i64")), source);
        }
        List<Type> fromElements = elements(from);
        List<Type> toElements = elements(to);
        if (fromElements != null && toElements != null && fromElements.size() == toElements.size()) {
            List<IrValue> converted = new ArrayList<>();
            for (int i = 0; i < fromElements.size(); i++) {
                IrValue element = extract(value, i, fromElements.get(i).irName(), source);
                converted.add(coerce(element, fromElements.get(i), toElements.get(i), source));
            }
            return aggregate(to.irName(), converted, source);
        }
        throw new InternalCompilerError("Cannot convert " + from.displayName() + " to " + to.displayName(), source);
    }

    private static List<Type> elements(Type type) {
        if (type instanceof TupleType tuple) {
            return tuple.elements();
        }
        if (type instanceof ResultType result) {
            return List.of(PrimitiveType.STATUS, result.inner());
        }
        return null;
    }

    /**
     * Builds the final {@link IrModule} from the generated functions.
     * @return The constructed module.
     */
    public IrModule build() {
        return new IrModule(moduleName, List.copyOf(externals.values()), List.copyOf(strings.values()), functions);
    }
}
