package org.boogpp.compiler.frontend.parser;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.diagnostics.Diagnostic;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.Lexer;
import org.boogpp.compiler.frontend.parser.ast.AssignNode;
import org.boogpp.compiler.frontend.parser.ast.BinaryNode;
import org.boogpp.compiler.frontend.parser.ast.BinaryOperator;
import org.boogpp.compiler.frontend.parser.ast.CallNode;
import org.boogpp.compiler.frontend.parser.ast.CaseNode;
import org.boogpp.compiler.frontend.parser.ast.DecoratorNode;
import org.boogpp.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.boogpp.compiler.frontend.parser.ast.ForNode;
import org.boogpp.compiler.frontend.parser.ast.FunctionDeclNode;
import org.boogpp.compiler.frontend.parser.ast.IdentifierNode;
import org.boogpp.compiler.frontend.parser.ast.IfNode;
import org.boogpp.compiler.frontend.parser.ast.ImportNode;
import org.boogpp.compiler.frontend.parser.ast.LiteralNode;
import org.boogpp.compiler.frontend.parser.ast.MatchNode;
import org.boogpp.compiler.frontend.parser.ast.MemberAccessNode;
import org.boogpp.compiler.frontend.parser.ast.ModuleNode;
import org.boogpp.compiler.frontend.parser.ast.ReturnNode;
import org.boogpp.compiler.frontend.parser.ast.TryChainNode;
import org.boogpp.compiler.frontend.parser.ast.TryClause;
import org.boogpp.compiler.frontend.parser.ast.TupleNode;
import org.boogpp.compiler.frontend.parser.ast.TypeRefNode;
import org.boogpp.compiler.frontend.parser.ast.UnaryNode;
import org.boogpp.compiler.frontend.parser.ast.VarDeclNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Parser}, covering declarations, statements, expression
 * precedence, decorators and error recovery.
 */
public class ParserTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private ModuleNode parse(String... lines) {
        Lexer lexer = new Lexer(String.join("\n", lines) + "\n", diagnostics);
        return new Parser(lexer.scanTokens(), diagnostics).parse();
    }

    private List<CompilerErrorCode> errorCodes() {
        return diagnostics.getErrors().stream().map(Diagnostic::code).toList();
    }

    @Test
    @Tag("unit")
    void testFunctionDeclaration() {
        ModuleNode module = parse(
                "func add(a: i32, b: i32) -> i32:",
                "    return a + b");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(module.functions()).hasSize(1);
        FunctionDeclNode add = module.functions().get(0);
        assertThat(add.name()).isEqualTo("add");
        assertThat(add.parameters()).extracting(p -> p.name() + ":" + p.type().name()).containsExactly("a:i32", "b:i32");
        assertThat(add.returnTypes()).extracting(TypeRefNode::name).containsExactly("i32");
        ReturnNode ret = (ReturnNode) add.body().statements().get(0);
        assertThat(ret.values()).singleElement().isInstanceOf(BinaryNode.class);
    }

    @Test
    @Tag("unit")
    void testMultiReturnAndCompositeTypes() {
        ModuleNode module = parse(
                "func f(p: ptr[u8], a: array[i32, 4], s: slice[u8], r: result[handle]) -> (status, string):",
                "    return SUCCESS, \"ok\"");

        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDeclNode f = module.functions().get(0);
        assertThat(f.parameters().get(0).type().mentionsPointer()).isTrue();
        TypeRefNode array = f.parameters().get(1).type();
        assertThat(array.name()).isEqualTo("array");
        assertThat(array.size()).isEqualTo(4L);
        assertThat(f.returnTypes()).extracting(TypeRefNode::name).containsExactly("status", "string");
        assertThat(((ReturnNode) f.body().statements().get(0)).values()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testVoidReturnTypeMeansNoReturnValues() {
        ModuleNode module = parse("func f() -> void:", "    pass");

        assertThat(module.functions().get(0).returnTypes()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testModulePreambleAndImports() {
        ModuleNode module = parse(
                "module tools.cleaner",
                "import windows.process as proc",
                "from windows.registry import read, write",
                "func main() -> status:",
                "    return SUCCESS");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(module.name()).isEqualTo("tools.cleaner");
        assertThat(module.imports()).extracting(ImportNode::modulePath, ImportNode::alias)
                .containsExactly(
                        tuple("windows.process", "proc"),
                        tuple("windows.registry", null));
        assertThat(module.imports().get(1).names()).containsExactly("read", "write");
    }

    @Test
    @Tag("unit")
    void testOperatorPrecedence() {
        ModuleNode module = parse(
                "func f() -> i32:",
                "    return 1 + 2 * 3 ** 2 ** 2");

        BinaryNode add = (BinaryNode) ((ReturnNode) module.functions().get(0).body().statements().get(0)).values().get(0);
        assertThat(add.operator()).isEqualTo(BinaryOperator.ADD);
        BinaryNode mul = (BinaryNode) add.right();
        assertThat(mul.operator()).isEqualTo(BinaryOperator.MUL);
        BinaryNode pow = (BinaryNode) mul.right();
        assertThat(pow.operator()).isEqualTo(BinaryOperator.POWER);
        assertThat(pow.right()).isInstanceOf(BinaryNode.class);
        assertThat(((BinaryNode) pow.right()).operator()).isEqualTo(BinaryOperator.POWER);
    }

    @Test
    @Tag("unit")
    void testLogicalAndComparisonPrecedence() {
        ModuleNode module = parse(
                "func f(a: i32, b: i32) -> bool:",
                "    return not a < b or a == b and b > 0");

        BinaryNode or = (BinaryNode) ((ReturnNode) module.functions().get(0).body().statements().get(0)).values().get(0);
        assertThat(or.operator()).isEqualTo(BinaryOperator.OR);
        assertThat(or.left()).isInstanceOf(UnaryNode.class);
        assertThat(((BinaryNode) or.right()).operator()).isEqualTo(BinaryOperator.AND);
    }

    @Test
    @Tag("unit")
    void testNegativeLiteralsFold() {
        ModuleNode module = parse("func f() -> i32:", "    return -5");

        LiteralNode literal = (LiteralNode) ((ReturnNode) module.functions().get(0).body().statements().get(0)).values().get(0);
        assertThat(literal.integerValue()).isEqualTo(BigInteger.valueOf(-5));
    }

    @Test
    @Tag("unit")
    void testStatements() {
        ModuleNode module = parse(
                "func f(n: i32) -> i32:",
                "    var total: i32 = 0",
                "    let items = [1, 2, 3]",
                "    for i in range(0, n):",
                "        total += i",
                "    if total > 10:",
                "        total = 10",
                "    elif total < 0:",
                "        total = 0",
                "    else:",
                "        pass",
                "    while total > 0:",
                "        total -= 1",
                "        if total == 3:",
                "            break",
                "    items[0] = 4",
                "    print(\"done\")",
                "    return total");

        assertThat(diagnostics.hasErrors()).isFalse();
        var statements = module.functions().get(0).body().statements();
        assertThat(statements).hasSize(8);
        VarDeclNode total = (VarDeclNode) statements.get(0);
        assertThat(total.mutable()).isTrue();
        assertThat(total.type().name()).isEqualTo("i32");
        assertThat(((VarDeclNode) statements.get(1)).mutable()).isFalse();
        ForNode loop = (ForNode) statements.get(2);
        assertThat(loop.variable()).isEqualTo("i");
        assertThat(((AssignNode) loop.body().statements().get(0)).compound()).isEqualTo(BinaryOperator.ADD);
        IfNode branch = (IfNode) statements.get(3);
        assertThat(branch.branches()).hasSize(2);
        assertThat(branch.elseBlock()).isNotNull();
        assertThat(statements.get(5)).isInstanceOf(AssignNode.class);
        assertThat(((ExpressionStatementNode) statements.get(6)).expression()).isInstanceOf(CallNode.class);
    }

    @Test
    @Tag("unit")
    void testMatchWithRangesAndWildcard() {
        ModuleNode module = parse(
                "func f(x: i32) -> i32:",
                "    match x:",
                "        case 0:",
                "            return 0",
                "        case 1..10:",
                "            return 1",
                "        case _:",
                "            return 2");

        assertThat(diagnostics.hasErrors()).isFalse();
        MatchNode match = (MatchNode) module.functions().get(0).body().statements().get(0);
        assertThat(match.cases()).hasSize(3);
        CaseNode range = match.cases().get(1);
        assertThat(range.pattern()).isInstanceOf(LiteralNode.class);
        assertThat(range.rangeEnd()).isInstanceOf(LiteralNode.class);
        assertThat(match.cases().get(2).pattern()).isNull();
    }

    @Test
    @Tag("unit")
    void testSingleLineTryChain() {
        ModuleNode module = parse(
                "func f() -> (status, string):",
                "    return try_chain { primary: g() secondary: h() fallback: (SUCCESS, \"X\") }");

        assertThat(diagnostics.hasErrors()).isFalse();
        TryChainNode chain = (TryChainNode) ((ReturnNode) module.functions().get(0).body().statements().get(0)).values().get(0);
        assertThat(chain.clauses()).extracting(TryClause::kind)
                .containsExactly(TryClause.Kind.PRIMARY, TryClause.Kind.SECONDARY, TryClause.Kind.FALLBACK);
        assertThat(chain.fallback()).hasValueSatisfying(c -> assertThat(c.value()).isInstanceOf(TupleNode.class));
    }

    @Test
    @Tag("unit")
    void testIndentedTryChainWithBlockClause() {
        ModuleNode module = parse(
                "func f() -> status:",
                "    let s = try_chain:",
                "        primary: g()",
                "        secondary:",
                "            let t = 1",
                "            h(t)",
                "        fallback: GENERIC_ERROR",
                "    return s");

        assertThat(diagnostics.hasErrors()).isFalse();
        TryChainNode chain = (TryChainNode) ((VarDeclNode) module.functions().get(0).body().statements().get(0)).initializer();
        TryClause secondary = chain.clauses().get(1);
        assertThat(secondary.body().statements()).hasSize(1);
        assertThat(secondary.value()).isInstanceOf(CallNode.class);
        assertThat(chain.fallback().orElseThrow().value()).isInstanceOf(IdentifierNode.class);
    }

    @Test
    @Tag("unit")
    void testTryChainWithoutFallbackIsReported() {
        parse(
                "func f() -> status:",
                "    return try_chain { primary: g() secondary: h() }");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.MISSING_FALLBACK);
    }

    @Test
    @Tag("unit")
    void testDecoratorsAttachToModuleAndFunction() {
        ModuleNode module = parse(
                "@safety_level(mode: CUSTOM, allow: \"windows.file.*\", block: \"network.connect\")",
                "",
                "@unsafe",
                "@resilient(max_attempts: 3, backoff: exponential)",
                "func f() -> status:",
                "    return SUCCESS");

        assertThat(diagnostics.hasErrors()).isFalse();
        DecoratorNode level = module.decorator(DecoratorKind.SAFETY_LEVEL).orElseThrow();
        assertThat(level.argument("mode").orElseThrow().asText()).isEqualTo("CUSTOM");
        assertThat(level.argument("allow").orElseThrow().asText()).isEqualTo("windows.file.*");
        FunctionDeclNode f = module.functions().get(0);
        assertThat(f.hasDecorator(DecoratorKind.UNSAFE)).isTrue();
        assertThat(f.decorator(DecoratorKind.RESILIENT).orElseThrow().argument("max_attempts").orElseThrow().asLong())
                .isEqualTo(3L);
    }

    @Test
    @Tag("unit")
    void testMalformedDecorators() {
        parse(
                "@resilient(retries: 3)",
                "func a():",
                "    pass",
                "@hook(event: SOMETHING_ELSE)",
                "func b():",
                "    pass",
                "@frobnicate",
                "func c():",
                "    pass",
                "@resilient(max_attempts: 1, max_attempts: 2)",
                "func d():",
                "    pass",
                "@safety_level(mode: SAFE)",
                "func e():",
                "    pass");

        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.MALFORMED_DECORATOR,
                CompilerErrorCode.MALFORMED_DECORATOR,
                CompilerErrorCode.MALFORMED_DECORATOR,
                CompilerErrorCode.MALFORMED_DECORATOR,
                CompilerErrorCode.MALFORMED_DECORATOR);
    }

    @Test
    @Tag("unit")
    void testNestedFunctionIsRejected() {
        ModuleNode module = parse(
                "func outer():",
                "    func inner():",
                "        pass",
                "    pass",
                "func after():",
                "    pass");

        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(module.functions()).extracting(FunctionDeclNode::name).containsExactly("outer", "after");
    }

    @Test
    @Tag("unit")
    void testRecoveryReportsEveryBrokenStatement() {
        ModuleNode module = parse(
                "func f():",
                "    let = 1",
                "    let ok = 2",
                "    let x = (3 +",
                "    )",
                "    return");

        assertThat(errorCodes()).hasSize(2).containsOnly(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(module.functions().get(0).body().statements())
                .anySatisfy(s -> assertThat(s).isInstanceOf(VarDeclNode.class));
    }

    @Test
    @Tag("unit")
    void testMemberAccessOnKeywordName() {
        ModuleNode module = parse(
                "func f(r: result[i32]) -> status:",
                "    return r.status");

        assertThat(diagnostics.hasErrors()).isFalse();
        MemberAccessNode access = (MemberAccessNode) ((ReturnNode) module.functions().get(0).body().statements().get(0)).values().get(0);
        assertThat(access.member()).isEqualTo("status");
    }
}
