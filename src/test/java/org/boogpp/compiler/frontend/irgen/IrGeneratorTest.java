package org.boogpp.compiler.frontend.irgen;

import org.boogpp.compiler.api.SafetyMode;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.parser.Parser;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.safety.SafeModule;
import org.boogpp.compiler.frontend.safety.SafetyChecker;
import org.boogpp.compiler.frontend.semantics.TypeChecker;
import org.boogpp.compiler.frontend.semantics.TypedModule;
import org.boogpp.compiler.ir.IrBlock;
import org.boogpp.compiler.ir.IrFunction;
import org.boogpp.compiler.ir.IrInstruction;
import org.boogpp.compiler.ir.IrModule;
import org.boogpp.compiler.ir.IrReg;
import org.boogpp.compiler.ir.IrStringConstant;
import org.boogpp.compiler.ir.IrValue;
import org.boogpp.compiler.ir.IrVerifier;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link IrGenerator} and its converters. Every generated module is
 * also run through the {@link IrVerifier}.
 */
public class IrGeneratorTest {

    private static CompilerConfig config;

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @BeforeAll
    static void loadConfig() {
        config = CompilerConfig.defaults();
    }

    private IrModule generate(String... lines) {
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics);
        ModuleNode module = new Parser(lexer.scanTokens(), diagnostics).parse();
        TypedModule typed = new TypeChecker(diagnostics, config.externals()).check(module);
        SafeModule safe = new SafetyChecker(diagnostics, config.classifications()).check(typed, SafetyMode.SAFE);
        assertThat(diagnostics.hasErrors()).as("front-end errors: %s", diagnostics.getErrors()).isFalse();

        IrModule ir = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults(), config.runtime())
                .generate(safe, "test");
        new IrVerifier(diagnostics).verify(ir);
        assertThat(diagnostics.hasErrors()).as("verifier errors: %s", diagnostics.getErrors()).isFalse();
        return ir;
    }

    private static List<IrInstruction> instructions(IrFunction function) {
        return function.blocks().stream().flatMap(b -> b.instructions().stream()).toList();
    }

    private static List<String> callees(IrFunction function) {
        return instructions(function).stream()
                .filter(IrInstruction.Call.class::isInstance)
                .map(i -> ((IrInstruction.Call) i).callee())
                .toList();
    }

    private static List<String> labels(IrFunction function) {
        return function.blocks().stream().map(IrBlock::label).toList();
    }

    @Test
    @Tag("unit")
    void testAddCompilesToSingleBlock() {
        IrModule ir = generate(
                "func add(a: i32, b: i32) -> i32:",
                "    return a + b");

        assertThat(ir.name()).isEqualTo("test");
        IrFunction add = ir.function("add").orElseThrow();
        assertThat(add.parameters()).extracting(IrReg::name, IrReg::type)
                .containsExactly(
                        tuple("a", "i32"),
                        tuple("b", "i32"));
        assertThat(add.returnType()).isEqualTo("i32");
        assertThat(add.blocks()).hasSize(1);

        List<IrInstruction> body = add.entry().instructions();
        assertThat(body).hasSize(2);
        IrInstruction.Binary sum = (IrInstruction.Binary) body.get(0);
        assertThat(sum.opcode()).isEqualTo("add");
        assertThat(((IrInstruction.Return) body.get(1)).value()).isEqualTo(sum.result());
    }

    @Test
    @Tag("unit")
    void testSignednessSelectsOpcodes() {
        IrModule ir = generate(
                "func s(a: i32, b: i32) -> bool:",
                "    return a / b < a % b",
                "func u(a: u32, b: u32) -> bool:",
                "    return a / b < a % b",
                "func f(a: f64, b: f64) -> bool:",
                "    return a / b < a");

        assertThat(opcodes(ir.function("s").orElseThrow())).containsExactly("sdiv", "srem", "icmp slt");
        assertThat(opcodes(ir.function("u").orElseThrow())).containsExactly("udiv", "urem", "icmp ult");
        assertThat(opcodes(ir.function("f").orElseThrow())).containsExactly("fdiv", "fcmp olt");
    }

    private static List<String> opcodes(IrFunction function) {
        return instructions(function).stream()
                .map(i -> i instanceof IrInstruction.Binary b ? b.opcode()
                        : i instanceof IrInstruction.Compare c ? c.opcode() : null)
                .filter(Objects::nonNull)
                .toList();
    }

    @Test
    @Tag("unit")
    void testVoidFunctionGetsImplicitReturn() {
        IrModule ir = generate(
                "func f():",
                "    pass");

        IrFunction f = ir.function("f").orElseThrow();
        assertThat(f.returnType()).isEqualTo("void");
        assertThat(f.entry().terminator()).hasValueSatisfying(t ->
                assertThat(((IrInstruction.Return) t).value()).isNull());
    }

    @Test
    @Tag("unit")
    void testIfElseProducesBranches() {
        IrModule ir = generate(
                "func sign(x: i32) -> i32:",
                "    if x > 0:",
                "        return 1",
                "    elif x < 0:",
                "        return -1",
                "    else:",
                "        return 0");

        IrFunction sign = ir.function("sign").orElseThrow();
        assertThat(labels(sign)).anyMatch(l -> l.startsWith("if.then"));
        assertThat(instructions(sign)).filteredOn(IrInstruction.CondBranch.class::isInstance).hasSize(2);
        assertThat(instructions(sign)).filteredOn(IrInstruction.Return.class::isInstance).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testMutableLocalsLiveInStackSlots() {
        IrModule ir = generate(
                "func count(n: i32) -> i32:",
                "    var total = 0",
                "    var i = 0",
                "    while i < n:",
                "        total += i",
                "        i += 1",
                "    return total");

        IrFunction count = ir.function("count").orElseThrow();
        assertThat(instructions(count)).filteredOn(IrInstruction.Alloca.class::isInstance).hasSize(2);
        assertThat(labels(count)).anyMatch(l -> l.startsWith("while.cond"))
                .anyMatch(l -> l.startsWith("while.body"))
                .anyMatch(l -> l.startsWith("while.end"));
    }

    @Test
    @Tag("unit")
    void testLogicalOperatorsShortCircuit() {
        IrModule ir = generate(
                "func f(a: bool, b: bool) -> bool:",
                "    return a and b");

        IrFunction f = ir.function("f").orElseThrow();
        assertThat(labels(f)).anyMatch(l -> l.startsWith("and.rhs")).anyMatch(l -> l.startsWith("and.end"));
        assertThat(instructions(f)).filteredOn(IrInstruction.CondBranch.class::isInstance).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testStringsBecomeModuleConstants() {
        IrModule ir = generate(
                "func main() -> status:",
                "    print(\"hello\")",
                "    print(\"hello\")",
                "    return SUCCESS");

        assertThat(ir.strings()).extracting(IrStringConstant::value).containsExactly("hello");
        assertThat(ir.external("bpp_print")).hasValueSatisfying(e -> {
            assertThat(e.parameterTypes()).containsExactly("ptr");
            assertThat(e.returnType()).isEqualTo("i32");
        });
        assertThat(callees(ir.function("main").orElseThrow())).containsExactly("bpp_print", "bpp_print");
    }

    @Test
    @Tag("unit")
    void testLoggedOperationIsPrecededByAuditCall() {
        IrModule ir = generate(
                "func stop(pid: u32) -> status:",
                "    return windows.process.terminate(pid)");

        assertThat(callees(ir.function("stop").orElseThrow()))
                .containsExactly("bpp_audit_log", "bpp_process_terminate");
        assertThat(ir.strings()).extracting(IrStringConstant::value).contains("windows.process.terminate");
        assertThat(ir.external("bpp_audit_log")).isPresent();
    }

    @Test
    @Tag("unit")
    void testMultipleReturnValuesFormAStruct() {
        IrModule ir = generate(
                "func pair() -> (status, string):",
                "    return NOT_FOUND, \"missing\"",
                "func use() -> status:",
                "    let r = pair()",
                "    return r[0]");

        assertThat(ir.function("pair").orElseThrow().returnType()).isEqualTo("{ i32, ptr }");
        assertThat(instructions(ir.function("pair").orElseThrow()))
                .filteredOn(IrInstruction.InsertValue.class::isInstance).hasSize(2);
        assertThat(instructions(ir.function("use").orElseThrow()))
                .anySatisfy(i -> assertThat(i).isInstanceOf(IrInstruction.ExtractValue.class));
    }

    @Test
    @Tag("unit")
    void testVariableIndexIsBoundsChecked() {
        IrModule ir = generate(
                "func at(i: i32) -> i32:",
                "    var values: array[i32, 4] = [1, 2, 3, 4]",
                "    let first = values[0]",
                "    return values[i] + first");

        List<String> callees = callees(ir.function("at").orElseThrow());
        assertThat(callees).containsExactly("bpp_bounds_check");
        assertThat(instructions(ir.function("at").orElseThrow()))
                .filteredOn(IrInstruction.ElementPtr.class::isInstance).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testForOverRange() {
        IrModule ir = generate(
                "func sum(n: i32) -> i32:",
                "    var total = 0",
                "    for i in range(1, n):",
                "        if i == 3:",
                "            continue",
                "        total += i",
                "    return total");

        IrFunction sum = ir.function("sum").orElseThrow();
        assertThat(labels(sum)).anyMatch(l -> l.startsWith("for.cond"))
                .anyMatch(l -> l.startsWith("for.step"))
                .anyMatch(l -> l.startsWith("for.end"));
    }

    @Test
    @Tag("unit")
    void testMatchDispatchesOnCases() {
        IrModule ir = generate(
                "func classify(x: i32) -> i32:",
                "    match x:",
                "        case 0:",
                "            return 0",
                "        case 1..9:",
                "            return 1",
                "        case _:",
                "            return 2");

        IrFunction classify = ir.function("classify").orElseThrow();
        assertThat(labels(classify)).filteredOn(l -> l.startsWith("match.case")).hasSize(3);
        assertThat(instructions(classify)).filteredOn(IrInstruction.Return.class::isInstance).hasSize(3);
    }

    @Test
    @Tag("unit")
    void testTryChainFallsThroughClauses() {
        IrModule ir = generate(
                "func fetch() -> (status, string):",
                "    return GENERIC_ERROR, \"\"",
                "func f() -> (status, string):",
                "    return try_chain { primary: fetch() secondary: fetch() fallback: (SUCCESS, \"default\") }");

        IrFunction f = ir.function("f").orElseThrow();
        assertThat(labels(f)).anyMatch(l -> l.startsWith("try.primary"))
                .anyMatch(l -> l.startsWith("try.secondary"))
                .anyMatch(l -> l.startsWith("try.fallback"))
                .anyMatch(l -> l.startsWith("try.end"));
        assertThat(callees(f)).containsExactly("fetch", "fetch");
    }

    @Test
    @Tag("unit")
    void testDecoratorsBecomeAnnotations() {
        IrModule ir = generate(
                "@resilient(max_attempts: 3, backoff: exponential)",
                "func f() -> status:",
                "    return SUCCESS");

        assertThat(ir.function("f").orElseThrow().annotations())
                .containsExactly("safety SAFE", "resilient max_attempts=3 backoff=exponential");
    }

    @Test
    @Tag("unit")
    void testNestedElementWriteGoesToTheVariableSlot() {
        IrModule ir = generate(
                "func main() -> i32:",
                "    var m: array[array[i32, 2], 2]",
                "    m[0][1] = 5",
                "    return m[0][1]");

        IrFunction main = ir.function("main").orElseThrow();
        List<IrInstruction> body = instructions(main);
        List<String> slots = body.stream()
                .filter(IrInstruction.Alloca.class::isInstance)
                .map(i -> ((IrInstruction.Alloca) i).result().name())
                .toList();
        assertThat(slots).hasSize(1);
        assertThat(slots.get(0)).startsWith("m.addr");

        IrInstruction.Store write = body.stream()
                .filter(IrInstruction.Store.class::isInstance)
                .map(IrInstruction.Store.class::cast)
                .filter(store -> store.address() instanceof IrReg reg && !reg.name().startsWith("m.addr"))
                .findFirst().orElseThrow();
        IrInstruction.ElementPtr inner = definition(body, write.address(), IrInstruction.ElementPtr.class);
        IrInstruction.ElementPtr outer = definition(body, inner.base(), IrInstruction.ElementPtr.class);
        assertThat(outer.base()).isInstanceOf(IrReg.class);
        assertThat(((IrReg) outer.base()).name()).startsWith("m.addr");
    }

    @Test
    @Tag("unit")
    void testSlotsAreAllocatedInTheEntryBlock() {
        IrModule ir = generate(
                "func count(n: i32) -> i32:",
                "    var total = 0",
                "    var i = 0",
                "    while i < n:",
                "        var step = i * 2",
                "        total += step",
                "        i += 1",
                "    return total");

        IrFunction count = ir.function("count").orElseThrow();
        assertThat(count.blocks().get(0).label()).isEqualTo("entry");
        assertThat(count.blocks().get(0).instructions())
                .filteredOn(IrInstruction.Alloca.class::isInstance).hasSize(3);
        assertThat(count.blocks().subList(1, count.blocks().size()))
                .flatExtracting(IrBlock::instructions)
                .noneMatch(IrInstruction.Alloca.class::isInstance);
    }

    private static <T extends IrInstruction> T definition(List<IrInstruction> body, IrValue value, Class<T> kind) {
        assertThat(value).isInstanceOf(IrReg.class);
        return body.stream()
                .filter(i -> i.defines().filter(value::equals).isPresent())
                .findFirst()
                .map(kind::cast)
                .orElseThrow();
    }
}
