package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.config.CompilerConfig;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.parser.Parser;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.parser.ast.ReturnNode;
import org.boogpp.compiler.frontend.parser.ast.VarDeclNode;
import org.boogpp.compiler.frontend.semantics.types.FunctionType;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.ResultType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TypeChecker}. The external signatures come from the
 * bundled reference configuration.
 */
public class TypeCheckerTest {

    private static CompilerConfig config;

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    @BeforeAll
    static void loadConfig() {
        config = CompilerConfig.defaults();
    }

    private ModuleNode parse(String... lines) {
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics);
        ModuleNode module = new Parser(lexer.scanTokens(), diagnostics).parse();
        assertThat(diagnostics.hasErrors()).as("parse errors: %s", diagnostics.getErrors()).isFalse();
        return module;
    }

    private TypedModule check(String... lines) {
        return new TypeChecker(diagnostics, config.externals()).check(parse(lines));
    }

    private List<CompilerErrorCode> errorCodes() {
        return diagnostics.getErrors().stream().map(Diagnostic::code).toList();
    }

    private static ExpressionNode firstReturnValue(FunctionDeclNode function) {
        return function.body().statements().stream()
                .filter(ReturnNode.class::isInstance)
                .map(s -> ((ReturnNode) s).values().get(0))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @Tag("unit")
    void testSimpleFunctionIsTyped() {
        TypedModule typed = check(
                "func add(a: i32, b: i32) -> i32:",
                "    return a + b");

        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDeclNode add = typed.module().functions().get(0);
        assertThat(typed.signatureOf(add)).isEqualTo(new FunctionType(
                List.of(PrimitiveType.I32, PrimitiveType.I32), List.of(PrimitiveType.I32)));
        assertThat(typed.typeOf(firstReturnValue(add))).isEqualTo(PrimitiveType.I32);
        assertThat(typed.globals()).containsKey("add");
    }

    @Test
    @Tag("unit")
    void testCheckingTwiceYieldsTheSameTypes() {
        ModuleNode module = parse(
                "func f(x: u8) -> (status, string):",
                "    let y = x * 2",
                "    if y > 10:",
                "        return GENERIC_ERROR, \"big\"",
                "    return SUCCESS, \"ok\"");

        TypedModule first = new TypeChecker(diagnostics, config.externals()).check(module);
        TypedModule second = new TypeChecker(new DiagnosticsEngine(), config.externals()).check(module);

        assertThat(second.expressionTypes()).hasSameSizeAs(first.expressionTypes());
        first.expressionTypes().forEach((node, type) ->
                assertThat(second.expressionTypes().get(node)).as("type of %s", node).isEqualTo(type));
        assertThat(second.signatures().get(module.functions().get(0)))
                .isEqualTo(first.signatures().get(module.functions().get(0)));
    }

    @Test
    @Tag("unit")
    void testUndefinedSymbolsAreReportedInEveryFunction() {
        check(
                "func a() -> i32:",
                "    return missing_one",
                "func b() -> i32:",
                "    return missing_two + 1",
                "func c():",
                "    missing_three()");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.UNDEFINED_SYMBOL, CompilerErrorCode.UNDEFINED_SYMBOL, CompilerErrorCode.UNDEFINED_SYMBOL);
    }

    @Test
    @Tag("unit")
    void testFunctionsMayCallEachOtherRegardlessOfOrder() {
        check(
                "func first() -> i32:",
                "    return second(1)",
                "func second(n: i32) -> i32:",
                "    return n");

        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void testStatusAcceptsIntegersAndNamedConstants() {
        TypedModule typed = check(
                "func a() -> status:",
                "    return 5",
                "func b() -> status:",
                "    return INVALID_PARAMETER");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(typed.typeOf(firstReturnValue(typed.module().functions().get(1)))).isEqualTo(PrimitiveType.STATUS);
    }

    @Test
    @Tag("unit")
    void testReturnMismatches() {
        check(
                "func a() -> i32:",
                "    return \"text\"",
                "func b() -> (i32, i32):",
                "    return 1",
                "func c():",
                "    return 1");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.RETURN_TYPE_MISMATCH,
                CompilerErrorCode.RETURN_ARITY_MISMATCH,
                CompilerErrorCode.RETURN_ARITY_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testMissingReturnOnSomePath() {
        check(
                "func f(x: i32) -> i32:",
                "    if x > 0:",
                "        return 1",
                "func g(x: i32) -> i32:",
                "    if x > 0:",
                "        return 1",
                "    else:",
                "        return 2");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.MISSING_RETURN);
        assertThat(diagnostics.getErrors().get(0).lineNumber()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testTryChainTakesTheTypeOfItsFallback() {
        TypedModule typed = check(
                "func fetch() -> (status, string):",
                "    return SUCCESS, \"value\"",
                "func f() -> (status, string):",
                "    return try_chain { primary: fetch() fallback: (GENERIC_ERROR, \"none\") }");

        assertThat(diagnostics.hasErrors()).isFalse();
        ExpressionNode chain = firstReturnValue(typed.module().functions().get(1));
        assertThat(typed.typeOf(chain)).isEqualTo(TupleType.of(PrimitiveType.STATUS, PrimitiveType.STRING));
    }

    @Test
    @Tag("unit")
    void testTryChainClauseMustMatchFallback() {
        check(
                "func f() -> string:",
                "    return try_chain { primary: 42 fallback: \"none\" }");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.TRY_CHAIN_TYPE_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testImmutableBindingsCannotBeAssigned() {
        check(
                "func f(p: i32):",
                "    let a = 1",
                "    var b = 2",
                "    a = 3",
                "    p = 4",
                "    b = 5");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.IMMUTABLE_ASSIGNMENT, CompilerErrorCode.IMMUTABLE_ASSIGNMENT);
    }

    @Test
    @Tag("unit")
    void testLiteralsTakeTheExpectedType() {
        TypedModule typed = check(
                "func f():",
                "    let small: u8 = 200",
                "    let big: u8 = 300",
                "    let wide = 7u64",
                "    let x = 1.5");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.LITERAL_OUT_OF_RANGE);
        List<VarDeclNode> declarations = typed.module().functions().get(0).body().statements().stream()
                .map(VarDeclNode.class::cast).toList();
        assertThat(typed.typeOf(declarations.get(0).initializer())).isEqualTo(PrimitiveType.U8);
        assertThat(typed.declaredBy(declarations.get(2)).orElseThrow().type()).isEqualTo(PrimitiveType.U64);
        assertThat(typed.declaredBy(declarations.get(3)).orElseThrow().type()).isEqualTo(PrimitiveType.F64);
    }

    @Test
    @Tag("unit")
    void testOperandMismatches() {
        check(
                "func f(a: i32, b: i64, s: string) -> bool:",
                "    let x = a + b",
                "    let y = s + \"!\"",
                "    let z = not a",
                "    return a < s");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.OPERAND_MISMATCH, CompilerErrorCode.OPERAND_MISMATCH, CompilerErrorCode.OPERAND_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testConditionsMustBeBool() {
        check(
                "func f(n: i32):",
                "    if n:",
                "        pass",
                "    while \"yes\":",
                "        break");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.CONDITION_NOT_BOOL, CompilerErrorCode.CONDITION_NOT_BOOL);
    }

    @Test
    @Tag("unit")
    void testBreakOutsideLoop() {
        check(
                "func f():",
                "    for i in range(3):",
                "        continue",
                "    break");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.BREAK_OUTSIDE_LOOP);
    }

    @Test
    @Tag("unit")
    void testDuplicateDeclarationInSameScope() {
        check(
                "func f(a: i32):",
                "    let a = 1",
                "    if true:",
                "        let b = 2",
                "    let b = 3");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.DUPLICATE_DECLARATION);
    }

    @Test
    @Tag("unit")
    void testMatchCoverage() {
        check(
                "func f(x: i32, flag: bool) -> i32:",
                "    match flag:",
                "        case true:",
                "            pass",
                "        case false:",
                "            pass",
                "    match x:",
                "        case 1..5:",
                "            return 1",
                "        case 9:",
                "            return 2",
                "    match x:",
                "        case _:",
                "            return 3",
                "        case 4:",
                "            return 4");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.NON_EXHAUSTIVE_MATCH, CompilerErrorCode.UNREACHABLE_CASE);
    }

    @Test
    @Tag("unit")
    void testIndexing() {
        check(
                "func f(s: slice[u8]) -> u8:",
                "    var a: array[i32, 3] = [1, 2, 3]",
                "    a[1] = 9",
                "    let t = (1, \"x\")",
                "    let name: string = t[1]",
                "    let outside = a[3]",
                "    return s[0]");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INDEX_OUT_OF_BOUNDS);
    }

    @Test
    @Tag("unit")
    void testResultMembers() {
        TypedModule typed = check(
                "from windows.registry import read",
                "func f() -> string:",
                "    let r = read(\"HKLM\\\\Software\", \"Version\")",
                "    if r.status != SUCCESS:",
                "        return \"\"",
                "    return r.value");

        assertThat(diagnostics.hasErrors()).isFalse();
        VarDeclNode r = (VarDeclNode) typed.module().functions().get(0).body().statements().get(0);
        assertThat(typed.typeOf(r.initializer())).isEqualTo(new ResultType(PrimitiveType.STRING));
        CallTarget target = typed.callTarget((CallNode) r.initializer()).orElseThrow();
        assertThat(target.kind()).isEqualTo(CallTarget.Kind.EXTERNAL);
        assertThat(target.qualifiedName()).isEqualTo("windows.registry.read");
    }

    @Test
    @Tag("unit")
    void testImports() {
        check(
                "import windows.process as proc",
                "import does.not.exist",
                "from windows.file import nothing_here",
                "func f() -> status:",
                "    return proc.terminate(1234)");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNKNOWN_MODULE, CompilerErrorCode.UNDEFINED_SYMBOL);
    }

    @Test
    @Tag("unit")
    void testCallArgumentChecks() {
        check(
                "func g(a: i32, b: string) -> i32:",
                "    return a",
                "func f():",
                "    g(1)",
                "    g(1, 2)",
                "    let x = 5",
                "    x(1)");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                CompilerErrorCode.ARGUMENT_TYPE_MISMATCH,
                CompilerErrorCode.NOT_CALLABLE);
    }

    @Test
    @Tag("unit")
    void testUnknownTypeAnnotation() {
        check(
                "func f(x: widget):",
                "    pass");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNKNOWN_TYPE);
    }

    @Test
    @Tag("unit")
    void testExternalFunctionsCannotBeUsedAsValues() {
        check(
                "func f():",
                "    let p = print",
                "    print(\"ok\")");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INVALID_OPERATION);
        assertThat(diagnostics.getErrors().get(0).message()).contains("print");
    }

    @Test
    @Tag("unit")
    void testFunctionsMayNotTakeRuntimeSymbolNames() {
        check(
                "func bpp_print(x: i32) -> i32:",
                "    return x");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.DUPLICATE_DECLARATION);
    }

    @Test
    @Tag("unit")
    void testRuntimeHookNamesAreReservedWhenTheRuntimeIsKnown() {
        new TypeChecker(diagnostics, config.externals(), config.runtime()).check(parse(
                "func bpp_bounds_check(index: i64, length: i64):",
                "    pass",
                "func helper() -> i32:",
                "    return 1"));

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.DUPLICATE_DECLARATION);
    }

    @Test
    @Tag("unit")
    void testNestedElementsAreOnlyWritableThroughAVar() {
        check(
                "func make() -> array[array[i32, 2], 2]:",
                "    var m: array[array[i32, 2], 2]",
                "    return m",
                "func f():",
                "    var grid: array[array[i32, 2], 2]",
                "    let frozen: array[array[i32, 2], 2] = grid",
                "    grid[0][1] = 5",
                "    frozen[0][1] = 5",
                "    make()[0][1] = 5");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.IMMUTABLE_ASSIGNMENT, CompilerErrorCode.INVALID_OPERATION);
    }
}
