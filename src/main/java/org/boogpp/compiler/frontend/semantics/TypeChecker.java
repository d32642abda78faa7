package org.boogpp.compiler.frontend.semantics;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.api.StatusCode;
import org.boogpp.compiler.config.ExternalFunction;
import org.boogpp.compiler.config.ExternalSignatureTable;
import org.boogpp.compiler.config.RuntimeSymbols;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.parser.ast.*;
import org.boogpp.compiler.frontend.semantics.types.ArrayType;
import org.boogpp.compiler.frontend.semantics.types.FunctionType;
import org.boogpp.compiler.frontend.semantics.types.PointerType;
import org.boogpp.compiler.frontend.semantics.types.PrimitiveType;
import org.boogpp.compiler.frontend.semantics.types.ResultType;
import org.boogpp.compiler.frontend.semantics.types.SliceType;
import org.boogpp.compiler.frontend.semantics.types.TupleType;
import org.boogpp.compiler.frontend.semantics.types.Type;
import org.boogpp.compiler.frontend.semantics.types.Types;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Checks and infers the types of a parsed module.
 * <p>
 * The check runs in two passes: the first registers every function signature in the module
 * scope so that functions may call each other regardless of order; the second checks each
 * function body against the scope chain. Results are recorded in side tables of the returned
 * {@link TypedModule}; the AST itself is never modified, so checking the same module twice
 * yields equal results.
 * <p>
 * Untyped integer literals default to {@code i32} and float literals to {@code f64}, unless
 * the context (an annotation, a parameter, the other operand) expects a specific numeric type.
 */
public class TypeChecker {

    private final DiagnosticsEngine diagnostics;
    private final ExternalSignatureTable externals;
    private final Set<String> reservedSymbols;
    private final TypeResolver typeResolver;
    private final Map<Class<? extends StatementNode>, Consumer<StatementNode>> statementHandlers = new HashMap<>();
    private final Map<Class<? extends ExpressionNode>, BiFunction<ExpressionNode, Type, Type>> expressionHandlers = new HashMap<>();

    private SymbolTable symbolTable;
    private Map<String, String> moduleAliases;
    private Map<String, String> importedNames;
    private Map<FunctionDeclNode, FunctionType> signatures;
    private Map<AstNode, Type> types;
    private Map<IdentifierNode, Symbol> references;
    private Map<AstNode, Symbol> declarations;
    private Map<CallNode, CallTarget> callTargets;
    private FunctionDeclNode currentFunction;
    private List<Type> currentReturns;
    private int loopDepth;

    /**
     * Constructs a type checker that knows no runtime hooks. Only the ABI symbols of the
     * external functions are reserved.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param externals The runtime/OS functions callable from the module.
     */
    public TypeChecker(DiagnosticsEngine diagnostics, ExternalSignatureTable externals) {
        this(diagnostics, externals, null);
    }

    /**
     * Constructs a new type checker.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param externals The runtime/OS functions callable from the module.
     * @param runtime The hooks generated code calls; user functions may not take their names. May be null.
     */
    public TypeChecker(DiagnosticsEngine diagnostics, ExternalSignatureTable externals, RuntimeSymbols runtime) {
        this.diagnostics = diagnostics;
        this.externals = externals;
        this.reservedSymbols = new HashSet<>();
        externals.all().forEach(external -> reservedSymbols.add(external.symbol()));
        if (runtime != null) {
            reservedSymbols.addAll(runtime.symbols());
        }
        this.typeResolver = new TypeResolver(diagnostics);
        registerDefaultHandlers();
    }

    @SuppressWarnings("unchecked")
    private <T extends StatementNode> void onStatement(Class<T> type, Consumer<T> handler) {
        statementHandlers.put(type, node -> handler.accept((T) node));
    }

    @SuppressWarnings("unchecked")
    private <T extends ExpressionNode> void onExpression(Class<T> type, BiFunction<T, Type, Type> handler) {
        expressionHandlers.put(type, (node, expected) -> handler.apply((T) node, expected));
    }

    private void registerDefaultHandlers() {
        onStatement(VarDeclNode.class, this::checkVarDecl);
        onStatement(AssignNode.class, this::checkAssign);
        onStatement(IfNode.class, this::checkIf);
        onStatement(WhileNode.class, this::checkWhile);
        onStatement(ForNode.class, this::checkFor);
        onStatement(MatchNode.class, this::checkMatch);
        onStatement(ReturnNode.class, this::checkReturn);
        onStatement(ExpressionStatementNode.class, s -> checkExpression(s.expression(), null));
        onStatement(BlockNode.class, this::checkBlock);
        onStatement(PassNode.class, s -> { });
        onStatement(BreakNode.class, s -> checkInsideLoop("break", s.source()));
        onStatement(ContinueNode.class, s -> checkInsideLoop("continue", s.source()));

        onExpression(LiteralNode.class, this::checkLiteral);
        onExpression(IdentifierNode.class, (node, expected) -> checkIdentifier(node));
        onExpression(UnaryNode.class, this::checkUnary);
        onExpression(BinaryNode.class, this::checkBinary);
        onExpression(CallNode.class, (node, expected) -> checkCall(node));
        onExpression(TupleNode.class, this::checkTuple);
        onExpression(ArrayLiteralNode.class, this::checkArrayLiteral);
        onExpression(IndexNode.class, (node, expected) -> checkIndex(node));
        onExpression(MemberAccessNode.class, (node, expected) -> checkMemberAccess(node));
        onExpression(TryChainNode.class, this::checkTryChain);
    }

    /**
     * Checks a module.
     * @param module The parsed module.
     * @return The module with its type information.
     */
    public TypedModule check(ModuleNode module) {
        symbolTable = new SymbolTable(diagnostics);
        moduleAliases = new HashMap<>();
        importedNames = new HashMap<>();
        signatures = new IdentityHashMap<>();
        types = new IdentityHashMap<>();
        references = new IdentityHashMap<>();
        declarations = new IdentityHashMap<>();
        callTargets = new IdentityHashMap<>();

        defineBuiltinConstants();
        SymbolTable.Scope moduleScope = symbolTable.enterScope();
        resolveImports(module.imports());
        registerSignatures(module.functions());
        for (FunctionDeclNode function : module.functions()) {
            checkFunction(function);
        }
        return new TypedModule(module, moduleScope.symbols(), signatures, types, references, declarations, callTargets);
    }

    private void defineBuiltinConstants() {
        for (StatusCode code : StatusCode.values()) {
            symbolTable.define(new Symbol(code.name(), PrimitiveType.STATUS, Symbol.Kind.CONSTANT, SourceInfo.UNKNOWN));
        }
    }

    private void resolveImports(List<ImportNode> imports) {
        for (ImportNode node : imports) {
            if (!externals.hasModule(node.modulePath())) {
                diagnostics.reportError(CompilerErrorCode.UNKNOWN_MODULE,
                        "No signatures are available for module '" + node.modulePath() + "'.", node.source());
                continue;
            }
            if (!node.isFromImport()) {
                moduleAliases.put(node.boundName(), node.modulePath());
                continue;
            }
            for (String name : node.names()) {
                String qualified = node.modulePath() + "." + name;
                if (externals.lookup(qualified).isEmpty()) {
                    diagnostics.reportError(CompilerErrorCode.UNDEFINED_SYMBOL,
                            "Module '" + node.modulePath() + "' has no function '" + name + "'.", node.source());
                } else {
                    importedNames.put(name, qualified);
                }
            }
        }
    }

    private void registerSignatures(List<FunctionDeclNode> functions) {
        for (FunctionDeclNode function : functions) {
            List<Type> parameters = function.parameters().stream().map(p -> typeResolver.resolve(p.type())).toList();
            List<Type> returns = new ArrayList<>();
            for (TypeRefNode reference : function.returnTypes()) {
                Type type = typeResolver.resolve(reference);
                if (type.isVoid()) {
                    diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                            "'void' cannot be one of several return types.", reference.source());
                    type = Type.UNKNOWN;
                }
                returns.add(type);
            }
            // User functions and ABI symbols share one namespace in the generated module.
            if (reservedSymbols.contains(function.name())) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_DECLARATION,
                        "Function '" + function.name() + "' clashes with the runtime symbol of the same name.",
                        function.source());
            }
            FunctionType signature = new FunctionType(parameters, returns);
            signatures.put(function, signature);
            symbolTable.define(new Symbol(function.name(), signature, Symbol.Kind.FUNCTION, function.source()));
        }
    }

    private void checkFunction(FunctionDeclNode function) {
        FunctionType signature = signatures.get(function);
        currentFunction = function;
        currentReturns = signature.returns();
        loopDepth = 0;

        symbolTable.enterScope();
        for (int i = 0; i < function.parameters().size(); i++) {
            ParameterNode parameter = function.parameters().get(i);
            if (signature.parameters().get(i).isVoid()) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                        "Parameter '" + parameter.name() + "' cannot have type void.", parameter.source());
            }
            Symbol symbol = new Symbol(parameter.name(), signature.parameters().get(i), Symbol.Kind.PARAMETER, parameter.source());
            if (symbolTable.define(symbol)) {
                declarations.put(parameter, symbol);
            }
        }
        checkStatements(function.body().statements());
        symbolTable.leaveScope();

        if (!currentReturns.isEmpty() && !ControlFlow.alwaysReturns(function.body())) {
            diagnostics.reportError(CompilerErrorCode.MISSING_RETURN,
                    "Function '" + function.name() + "' does not return a value on every path.", function.source());
        }
    }

    private void checkStatements(List<StatementNode> statements) {
        for (StatementNode statement : statements) {
            Consumer<StatementNode> handler = statementHandlers.get(statement.getClass());
            if (handler != null) {
                handler.accept(statement);
            }
        }
    }

    private void checkBlock(BlockNode block) {
        symbolTable.enterScope();
        checkStatements(block.statements());
        symbolTable.leaveScope();
    }

    private void checkVarDecl(VarDeclNode node) {
        Type declared = node.type() != null ? typeResolver.resolve(node.type()) : null;
        if (declared != null && declared.isVoid()) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                    "Variable '" + node.name() + "' cannot have type void.", node.source());
            declared = Type.UNKNOWN;
        }
        Type type = declared;
        if (node.initializer() != null) {
            Type initializer = checkExpression(node.initializer(), declared);
            if (declared != null) {
                requireAssignable(declared, initializer, node.initializer().source(),
                        "Cannot initialize '" + node.name() + "' of type " + declared.displayName()
                                + " with a value of type " + initializer.displayName() + ".");
            } else if (initializer.isVoid()) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                        "The initializer of '" + node.name() + "' does not produce a value.", node.initializer().source());
                type = Type.UNKNOWN;
            } else {
                type = initializer;
            }
        }
        Symbol symbol = new Symbol(node.name(), type, node.mutable() ? Symbol.Kind.VAR : Symbol.Kind.LET, node.source());
        if (symbolTable.define(symbol)) {
            declarations.put(node, symbol);
        }
    }

    private void checkAssign(AssignNode node) {
        Type targetType = checkAssignmentTarget(node.target());
        Type valueType = checkExpression(node.value(), targetType);
        if (node.compound() != null) {
            binaryResult(node.compound(), targetType, valueType, node.source());
            return;
        }
        requireAssignable(targetType, valueType, node.value().source(),
                "Cannot assign a value of type " + valueType.displayName() + " to a target of type "
                        + targetType.displayName() + ".");
    }

    private Type checkAssignmentTarget(ExpressionNode target) {
        if (target instanceof IdentifierNode identifier) {
            Type type = checkIdentifier(identifier);
            types.put(identifier, type);
            Symbol symbol = references.get(identifier);
            if (symbol != null && !symbol.isMutable()) {
                diagnostics.reportError(CompilerErrorCode.IMMUTABLE_ASSIGNMENT,
                        "Cannot assign to '" + identifier.name() + "': " + describe(symbol.kind()) + " is immutable.",
                        identifier.source());
            }
            return type;
        }
        if (target instanceof IndexNode index) {
            Type type = checkExpression(index, null);
            checkElementTarget(index);
            return type;
        }
        checkExpression(target, null);
        diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION, "Invalid assignment target.", target.source());
        return Type.UNKNOWN;
    }

    /**
     * An element of an array value is only writable if the array lives in a {@code var}, directly
     * or as an element of an outer array in a {@code var}. Slice and pointer elements are
     * written through memory and need no such root.
     */
    private void checkElementTarget(IndexNode index) {
        Type baseType = types.getOrDefault(index.target(), Type.UNKNOWN);
        if (baseType instanceof TupleType) {
            diagnostics.reportError(CompilerErrorCode.IMMUTABLE_ASSIGNMENT,
                    "Tuple elements cannot be assigned.", index.source());
            return;
        }
        if (!(baseType instanceof ArrayType)) {
            return;
        }
        if (index.target() instanceof IndexNode outer) {
            checkElementTarget(outer);
        } else if (index.target() instanceof IdentifierNode base) {
            Symbol symbol = references.get(base);
            if (symbol != null && !symbol.isMutable()) {
                diagnostics.reportError(CompilerErrorCode.IMMUTABLE_ASSIGNMENT,
                        "Cannot assign to an element of '" + base.name() + "': " + describe(symbol.kind()) + " is immutable.",
                        base.source());
            }
        } else {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "Cannot assign to an element of a temporary array.", index.source());
        }
    }

    private static String describe(Symbol.Kind kind) {
        return switch (kind) {
            case LET -> "a let binding";
            case PARAMETER -> "a parameter";
            case LOOP_VARIABLE -> "a loop variable";
            case CONSTANT -> "a constant";
            case FUNCTION -> "a function";
            case VAR -> "a variable";
        };
    }

    private void checkIf(IfNode node) {
        for (ConditionalBranch branch : node.branches()) {
            requireCondition(branch.condition(), "if");
            checkBlock(branch.body());
        }
        if (node.elseBlock() != null) {
            checkBlock(node.elseBlock());
        }
    }

    private void checkWhile(WhileNode node) {
        requireCondition(node.condition(), "while");
        loopDepth++;
        checkBlock(node.body());
        loopDepth--;
    }

    private void requireCondition(ExpressionNode condition, String construct) {
        Type type = checkExpression(condition, PrimitiveType.BOOL);
        if (!type.isBool() && !type.isUnknown()) {
            diagnostics.reportError(CompilerErrorCode.CONDITION_NOT_BOOL,
                    "The condition of '" + construct + "' must be bool but has type " + type.displayName() + ".",
                    condition.source());
        }
    }

    private void checkInsideLoop(String keyword, SourceInfo source) {
        if (loopDepth == 0) {
            diagnostics.reportError(CompilerErrorCode.BREAK_OUTSIDE_LOOP, "'" + keyword + "' outside of a loop.", source);
        }
    }

    private void checkFor(ForNode node) {
        Type elementType;
        if (isRangeCall(node.iterable())) {
            elementType = checkRange((CallNode) node.iterable());
        } else {
            Type iterable = checkExpression(node.iterable(), null);
            if (iterable instanceof ArrayType array) {
                elementType = array.element();
            } else if (iterable instanceof SliceType slice) {
                elementType = slice.element();
            } else {
                if (!iterable.isUnknown()) {
                    diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                            "Cannot iterate over a value of type " + iterable.displayName() + ".", node.iterable().source());
                }
                elementType = Type.UNKNOWN;
            }
        }
        symbolTable.enterScope();
        Symbol variable = new Symbol(node.variable(), elementType, Symbol.Kind.LOOP_VARIABLE, node.source());
        if (symbolTable.define(variable)) {
            declarations.put(node, variable);
        }
        loopDepth++;
        checkStatements(node.body().statements());
        loopDepth--;
        symbolTable.leaveScope();
    }

    private boolean isRangeCall(ExpressionNode expression) {
        return expression instanceof CallNode call
                && call.callee() instanceof IdentifierNode id
                && id.name().equals("range")
                && symbolTable.resolve("range").isEmpty();
    }

    private Type checkRange(CallNode call) {
        List<ExpressionNode> arguments = call.arguments();
        if (arguments.isEmpty() || arguments.size() > 2) {
            diagnostics.reportError(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "'range' expects 1 or 2 arguments but got " + arguments.size() + ".", call.source());
        }
        for (int i = 0; i < arguments.size(); i++) {
            Type type = checkExpression(arguments.get(i), PrimitiveType.I32);
            requireAssignable(PrimitiveType.I32, type, arguments.get(i).source(), CompilerErrorCode.ARGUMENT_TYPE_MISMATCH,
                    "Argument " + (i + 1) + " of 'range' has type " + type.displayName() + " but i32 is expected.");
        }
        FunctionType signature = new FunctionType(arguments.stream().map(a -> (Type) PrimitiveType.I32).toList(),
                List.of(new SliceType(PrimitiveType.I32)));
        callTargets.put(call, new CallTarget(CallTarget.Kind.BUILTIN, "range", signature, null));
        types.put(call.callee(), signature);
        types.put(call, signature.returnType());
        return PrimitiveType.I32;
    }

    private void checkMatch(MatchNode node) {
        Type subject = checkExpression(node.subject(), null);
        boolean matchable = subject.isInteger() || subject.isBool() || subject.equals(PrimitiveType.CHAR) || subject.isUnknown();
        if (!matchable) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                    "Cannot match on a value of type " + subject.displayName() + ".", node.subject().source());
        }
        boolean wildcardSeen = false;
        boolean trueSeen = false;
        boolean falseSeen = false;
        for (CaseNode caseNode : node.cases()) {
            if (wildcardSeen) {
                diagnostics.reportError(CompilerErrorCode.UNREACHABLE_CASE,
                        "This case can never match because it follows 'case _'.", caseNode.source());
            }
            if (caseNode.isWildcard()) {
                wildcardSeen = true;
            } else {
                checkPattern(caseNode.pattern(), subject);
                if (caseNode.isRange()) {
                    checkPattern(caseNode.rangeEnd(), subject);
                    checkRangePattern(caseNode, subject);
                } else if (caseNode.pattern() instanceof LiteralNode literal && literal.kind() == LiteralNode.Kind.BOOL) {
                    trueSeen |= Boolean.TRUE.equals(literal.value());
                    falseSeen |= Boolean.FALSE.equals(literal.value());
                }
            }
            checkBlock(caseNode.body());
        }
        boolean boolCovered = subject.isBool() && trueSeen && falseSeen;
        if (!wildcardSeen && !boolCovered) {
            diagnostics.reportError(CompilerErrorCode.NON_EXHAUSTIVE_MATCH,
                    "The match does not cover every value; add 'case _'.", node.source());
        }
    }

    private void checkPattern(ExpressionNode pattern, Type subject) {
        boolean constant = pattern instanceof LiteralNode
                || (pattern instanceof IdentifierNode id
                    && symbolTable.resolve(id.name()).map(s -> s.kind() == Symbol.Kind.CONSTANT).orElse(false));
        Type type = checkExpression(pattern, subject);
        if (!constant) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "Case patterns must be literals or named constants.", pattern.source());
            return;
        }
        requireAssignable(subject, type, pattern.source(),
                "Case pattern of type " + type.displayName() + " cannot match a value of type " + subject.displayName() + ".");
    }

    private void checkRangePattern(CaseNode caseNode, Type subject) {
        if (subject.isBool()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "Range patterns cannot match bool values.", caseNode.source());
            return;
        }
        if (caseNode.pattern() instanceof LiteralNode low && caseNode.rangeEnd() instanceof LiteralNode high
                && low.kind() == LiteralNode.Kind.INTEGER && high.kind() == LiteralNode.Kind.INTEGER
                && low.integerValue().compareTo(high.integerValue()) > 0) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "The range " + low.value() + ".." + high.value() + " is empty.", caseNode.source());
        }
    }

    private void checkReturn(ReturnNode node) {
        List<ExpressionNode> values = node.values();
        String function = currentFunction.name();
        if (values.size() == 1 && currentReturns.size() > 1) {
            Type actual = checkExpression(values.get(0), new TupleType(currentReturns));
            if (actual instanceof TupleType tuple && tuple.elements().size() == currentReturns.size()) {
                for (int i = 0; i < currentReturns.size(); i++) {
                    requireReturnPosition(i, currentReturns.get(i), tuple.elements().get(i), values.get(0).source());
                }
            } else if (!actual.isUnknown()) {
                reportArity(function, values.size(), node.source());
            }
            return;
        }
        if (values.size() != currentReturns.size()) {
            for (ExpressionNode value : values) {
                checkExpression(value, null);
            }
            reportArity(function, values.size(), node.source());
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            Type actual = checkExpression(values.get(i), currentReturns.get(i));
            requireReturnPosition(i, currentReturns.get(i), actual, values.get(i).source());
        }
    }

    private void reportArity(String function, int provided, SourceInfo source) {
        diagnostics.reportError(CompilerErrorCode.RETURN_ARITY_MISMATCH,
                "Function '" + function + "' returns " + currentReturns.size() + " value(s) but this return provides "
                        + provided + ".", source);
    }

    private void requireReturnPosition(int position, Type declared, Type actual, SourceInfo source) {
        if (!Types.isAssignable(declared, actual)) {
            diagnostics.reportError(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                    "Return value at position " + (position + 1) + " has type " + actual.displayName()
                            + " but the function declares " + declared.displayName() + ".", source);
        }
    }

    /**
     * Checks an expression and records its type.
     * @param expression The expression.
     * @param expected The type the context expects, used to type literals; may be null.
     * @return The type of the expression.
     */
    private Type checkExpression(ExpressionNode expression, Type expected) {
        BiFunction<ExpressionNode, Type, Type> handler = expressionHandlers.get(expression.getClass());
        Type type = handler != null ? handler.apply(expression, expected) : Type.UNKNOWN;
        types.put(expression, type);
        return type;
    }

    private Type checkLiteral(LiteralNode node, Type expected) {
        switch (node.kind()) {
            case INTEGER: {
                Type type;
                if (node.suffix() != null) {
                    type = TypeResolver.primitive(node.suffix()).orElse(Type.UNKNOWN);
                } else if (expected != null && expected.isNumeric()) {
                    type = expected;
                } else {
                    type = PrimitiveType.I32;
                }
                if (type instanceof PrimitiveType primitive && primitive.kind().isInteger()
                        && !primitive.kind().fits(node.integerValue())) {
                    diagnostics.reportError(CompilerErrorCode.LITERAL_OUT_OF_RANGE,
                            "Literal " + node.integerValue() + " does not fit in " + type.displayName() + ".", node.source());
                }
                return type;
            }
            case FLOAT:
                if (node.suffix() != null) {
                    return TypeResolver.primitive(node.suffix()).orElse(Type.UNKNOWN);
                }
                return expected != null && expected.isFloat() ? expected : PrimitiveType.F64;
            case STRING:
                return PrimitiveType.STRING;
            case CHAR:
                return PrimitiveType.CHAR;
            default:
                return PrimitiveType.BOOL;
        }
    }

    private Type checkIdentifier(IdentifierNode node) {
        Optional<Symbol> symbol = symbolTable.resolve(node.name());
        if (symbol.isPresent()) {
            references.put(node, symbol.get());
            return symbol.get().type();
        }
        if (resolveExternal(node.name()).isPresent()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "The external function '" + node.name() + "' must be called.", node.source());
            return Type.UNKNOWN;
        }
        diagnostics.reportError(CompilerErrorCode.UNDEFINED_SYMBOL, "Undefined symbol '" + node.name() + "'.", node.source());
        return Type.UNKNOWN;
    }

    private Type checkUnary(UnaryNode node, Type expected) {
        switch (node.operator()) {
            case NOT: {
                Type operand = checkExpression(node.operand(), PrimitiveType.BOOL);
                if (!operand.isBool() && !operand.isUnknown()) {
                    reportOperand("not", operand, node.source());
                }
                return PrimitiveType.BOOL;
            }
            case NEGATE: {
                Type operand = checkExpression(node.operand(), expected);
                if (operand.isUnknown()) {
                    return operand;
                }
                if (!operand.isNumeric() || !((PrimitiveType) operand).kind().isSigned()) {
                    reportOperand("-", operand, node.source());
                }
                return operand;
            }
            default: {
                Type operand = checkExpression(node.operand(), expected);
                if (!operand.isInteger() && !operand.isUnknown()) {
                    reportOperand("~", operand, node.source());
                }
                return operand;
            }
        }
    }

    private void reportOperand(String operator, Type operand, SourceInfo source) {
        diagnostics.reportError(CompilerErrorCode.OPERAND_MISMATCH,
                "Operator '" + operator + "' cannot be applied to a value of type " + operand.displayName() + ".", source);
    }

    private Type checkBinary(BinaryNode node, Type expected) {
        BinaryOperator operator = node.operator();
        if (operator.category() == BinaryOperator.Category.LOGICAL) {
            Type left = checkExpression(node.left(), PrimitiveType.BOOL);
            Type right = checkExpression(node.right(), PrimitiveType.BOOL);
            if ((!left.isBool() && !left.isUnknown()) || (!right.isBool() && !right.isUnknown())) {
                diagnostics.reportError(CompilerErrorCode.OPERAND_MISMATCH,
                        "Operator '" + operator.symbol() + "' requires bool operands but got "
                                + left.displayName() + " and " + right.displayName() + ".", node.source());
            }
            return PrimitiveType.BOOL;
        }

        Type hint = operator.isComparison() ? null : expected;
        Type left;
        Type right;
        if (isUntypedNumber(node.left()) && !isUntypedNumber(node.right())) {
            right = checkExpression(node.right(), hint);
            left = checkExpression(node.left(), right.isUnknown() ? hint : right);
        } else {
            left = checkExpression(node.left(), hint);
            right = checkExpression(node.right(), left.isUnknown() ? hint : left);
        }
        return binaryResult(operator, left, right, node.source());
    }

    private static boolean isUntypedNumber(ExpressionNode expression) {
        return expression instanceof LiteralNode literal
                && literal.suffix() == null
                && (literal.kind() == LiteralNode.Kind.INTEGER || literal.kind() == LiteralNode.Kind.FLOAT);
    }

    private Type binaryResult(BinaryOperator operator, Type left, Type right, SourceInfo source) {
        if (left.isUnknown() || right.isUnknown()) {
            return operator.isComparison() ? PrimitiveType.BOOL : Type.UNKNOWN;
        }
        switch (operator.category()) {
            case ARITHMETIC:
                if (operator == BinaryOperator.ADD && left.isString() && right.isString()) {
                    return PrimitiveType.STRING;
                }
                if (left.isNumeric() && left.equals(right)) {
                    return left;
                }
                return operandMismatch(operator, "the same numeric type", left, right, source);
            case BITWISE:
                if (left.isInteger() && left.equals(right)) {
                    return left;
                }
                return operandMismatch(operator, "the same integer type", left, right, source);
            case EQUALITY:
                if (left.equals(right) && Types.isEquatable(left)) {
                    return PrimitiveType.BOOL;
                }
                operandMismatch(operator, "two comparable values of the same type", left, right, source);
                return PrimitiveType.BOOL;
            default:
                if (left.equals(right) && Types.isOrdered(left)) {
                    return PrimitiveType.BOOL;
                }
                operandMismatch(operator, "two ordered values of the same type", left, right, source);
                return PrimitiveType.BOOL;
        }
    }

    private Type operandMismatch(BinaryOperator operator, String requirement, Type left, Type right, SourceInfo source) {
        diagnostics.reportError(CompilerErrorCode.OPERAND_MISMATCH,
                "Operator '" + operator.symbol() + "' requires " + requirement + " but got "
                        + left.displayName() + " and " + right.displayName() + ".", source);
        return Type.UNKNOWN;
    }

    private Type checkCall(CallNode call) {
        Optional<String> calleeName = call.calleeName();
        if (calleeName.isEmpty()) {
            checkExpression(call.callee(), null);
            diagnostics.reportError(CompilerErrorCode.NOT_CALLABLE, "This expression cannot be called.", call.source());
            checkArgumentsLoosely(call);
            return Type.UNKNOWN;
        }
        String name = calleeName.get();
        if (call.callee() instanceof IdentifierNode identifier) {
            Optional<Symbol> symbol = symbolTable.resolve(name);
            if (symbol.isPresent()) {
                references.put(identifier, symbol.get());
                types.put(identifier, symbol.get().type());
                if (symbol.get().kind() == Symbol.Kind.FUNCTION && symbol.get().type() instanceof FunctionType signature) {
                    callTargets.put(call, new CallTarget(CallTarget.Kind.FUNCTION, name, signature, null));
                    checkArguments(call, name, signature);
                    return signature.returnType();
                }
                diagnostics.reportError(CompilerErrorCode.NOT_CALLABLE,
                        "'" + name + "' has type " + symbol.get().type().displayName() + " and cannot be called.", call.source());
                checkArgumentsLoosely(call);
                return Type.UNKNOWN;
            }
            if (name.equals("len")) {
                return checkLen(call);
            }
            if (name.equals("range")) {
                diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                        "'range' can only be used as the iterable of a for loop.", call.source());
                checkArgumentsLoosely(call);
                return Type.UNKNOWN;
            }
        }
        Optional<String> qualified = qualifyExternal(name);
        if (qualified.isPresent()) {
            ExternalFunction external = externals.lookup(qualified.get()).orElseThrow();
            FunctionType signature = external.signature();
            callTargets.put(call, new CallTarget(CallTarget.Kind.EXTERNAL, qualified.get(), signature, external));
            types.put(call.callee(), signature);
            checkArguments(call, name, signature);
            return signature.returnType();
        }
        diagnostics.reportError(CompilerErrorCode.UNDEFINED_SYMBOL, "Undefined function '" + name + "'.", call.source());
        checkArgumentsLoosely(call);
        return Type.UNKNOWN;
    }

    private void checkArguments(CallNode call, String name, FunctionType signature) {
        List<ExpressionNode> arguments = call.arguments();
        if (arguments.size() != signature.parameters().size()) {
            diagnostics.reportError(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "'" + name + "' expects " + signature.parameters().size() + " argument(s) but got "
                            + arguments.size() + ".", call.source());
            checkArgumentsLoosely(call);
            return;
        }
        for (int i = 0; i < arguments.size(); i++) {
            Type parameter = signature.parameters().get(i);
            Type actual = checkExpression(arguments.get(i), parameter);
            requireAssignable(parameter, actual, arguments.get(i).source(), CompilerErrorCode.ARGUMENT_TYPE_MISMATCH,
                    "Argument " + (i + 1) + " of '" + name + "' has type " + actual.displayName()
                            + " but " + parameter.displayName() + " is expected.");
        }
    }

    private void checkArgumentsLoosely(CallNode call) {
        for (ExpressionNode argument : call.arguments()) {
            checkExpression(argument, null);
        }
    }

    private Type checkLen(CallNode call) {
        if (call.arguments().size() != 1) {
            diagnostics.reportError(CompilerErrorCode.ARGUMENT_COUNT_MISMATCH,
                    "'len' expects 1 argument but got " + call.arguments().size() + ".", call.source());
            checkArgumentsLoosely(call);
            return PrimitiveType.U64;
        }
        ExpressionNode argument = call.arguments().get(0);
        Type type = checkExpression(argument, null);
        boolean measurable = type instanceof ArrayType || type instanceof SliceType || type.isString() || type.isUnknown();
        if (!measurable) {
            diagnostics.reportError(CompilerErrorCode.ARGUMENT_TYPE_MISMATCH,
                    "'len' expects an array, a slice or a string but got " + type.displayName() + ".", argument.source());
        }
        FunctionType signature = new FunctionType(List.of(type), List.of(PrimitiveType.U64));
        callTargets.put(call, new CallTarget(CallTarget.Kind.BUILTIN, "len", signature, null));
        types.put(call.callee(), signature);
        return PrimitiveType.U64;
    }

    private Optional<ExternalFunction> resolveExternal(String name) {
        return qualifyExternal(name).flatMap(externals::lookup);
    }

    /**
     * Maps a callee name as written to the qualified name of an external function, applying
     * {@code from ... import} bindings and {@code import ... as} aliases.
     */
    private Optional<String> qualifyExternal(String name) {
        String imported = importedNames.get(name);
        if (imported != null) {
            return Optional.of(imported);
        }
        for (Map.Entry<String, String> alias : moduleAliases.entrySet()) {
            if (name.startsWith(alias.getKey() + ".")) {
                String qualified = alias.getValue() + name.substring(alias.getKey().length());
                if (externals.lookup(qualified).isPresent()) {
                    return Optional.of(qualified);
                }
            }
        }
        return externals.lookup(name).map(ExternalFunction::name);
    }

    private Type checkTuple(TupleNode node, Type expected) {
        if (node.elements().isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION, "A tuple needs at least one element.", node.source());
            return Type.UNKNOWN;
        }
        List<Type> hints = null;
        if (expected instanceof TupleType tuple && tuple.elements().size() == node.elements().size()) {
            hints = tuple.elements();
        } else if (expected instanceof ResultType result && node.elements().size() == 2) {
            hints = List.of(PrimitiveType.STATUS, result.inner());
        }
        List<Type> elements = new ArrayList<>();
        for (int i = 0; i < node.elements().size(); i++) {
            Type element = checkExpression(node.elements().get(i), hints != null ? hints.get(i) : null);
            if (element.isVoid()) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                        "A tuple element must produce a value.", node.elements().get(i).source());
                element = Type.UNKNOWN;
            }
            elements.add(element);
        }
        return new TupleType(elements);
    }

    private Type checkArrayLiteral(ArrayLiteralNode node, Type expected) {
        Type element = expected instanceof ArrayType array ? array.element() : null;
        if (node.elements().isEmpty()) {
            if (element == null) {
                diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                        "Cannot infer the element type of an empty array literal.", node.source());
                return Type.UNKNOWN;
            }
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION, "An array literal needs at least one element.", node.source());
            return Type.UNKNOWN;
        }
        for (ExpressionNode value : node.elements()) {
            Type actual = checkExpression(value, element);
            if (element == null || element.isUnknown()) {
                element = actual;
            } else {
                requireAssignable(element, actual, value.source(),
                        "Array element of type " + actual.displayName() + " does not match element type "
                                + element.displayName() + ".");
            }
        }
        if (element.isUnknown() || element.isVoid()) {
            return Type.UNKNOWN;
        }
        return new ArrayType(element, node.elements().size());
    }

    private Type checkIndex(IndexNode node) {
        Type target = checkExpression(node.target(), null);
        if (target instanceof TupleType tuple) {
            Type indexType = checkExpression(node.index(), null);
            if (!(node.index() instanceof LiteralNode literal) || literal.kind() != LiteralNode.Kind.INTEGER) {
                diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                        "Tuples can only be indexed by integer literals.", node.index().source());
                return Type.UNKNOWN;
            }
            BigInteger index = literal.integerValue();
            if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(tuple.elements().size())) >= 0) {
                diagnostics.reportError(CompilerErrorCode.INDEX_OUT_OF_BOUNDS,
                        "Index " + index + " is out of bounds for a tuple of " + tuple.elements().size() + " elements.",
                        node.index().source());
                return Type.UNKNOWN;
            }
            return indexType.isUnknown() ? Type.UNKNOWN : tuple.elements().get(index.intValue());
        }

        Type indexType = checkExpression(node.index(), null);
        if (!indexType.isInteger() && !indexType.isUnknown()) {
            diagnostics.reportError(CompilerErrorCode.TYPE_MISMATCH,
                    "An index must be an integer but has type " + indexType.displayName() + ".", node.index().source());
        }
        if (target instanceof ArrayType array) {
            if (node.index() instanceof LiteralNode literal && literal.kind() == LiteralNode.Kind.INTEGER) {
                BigInteger index = literal.integerValue();
                if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(array.size())) >= 0) {
                    diagnostics.reportError(CompilerErrorCode.INDEX_OUT_OF_BOUNDS,
                            "Index " + index + " is out of bounds for an array of length " + array.size() + ".",
                            node.index().source());
                }
            }
            return array.element();
        }
        if (target instanceof SliceType slice) {
            return slice.element();
        }
        if (target instanceof PointerType pointer) {
            return pointer.target();
        }
        if (!target.isUnknown()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "A value of type " + target.displayName() + " cannot be indexed.", node.source());
        }
        return Type.UNKNOWN;
    }

    private Type checkMemberAccess(MemberAccessNode node) {
        Optional<String> dotted = CallNode.dottedName(node);
        if (dotted.isPresent() && resolveExternal(dotted.get()).isPresent()) {
            diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                    "The function '" + dotted.get() + "' must be called.", node.source());
            return Type.UNKNOWN;
        }
        Type target = checkExpression(node.target(), null);
        if (target.isUnknown()) {
            return Type.UNKNOWN;
        }
        Type inner = null;
        if (target instanceof ResultType result) {
            inner = result.inner();
        } else if (target instanceof TupleType tuple && tuple.elements().size() == 2
                && tuple.elements().get(0).equals(PrimitiveType.STATUS)) {
            inner = tuple.elements().get(1);
        }
        if (inner != null && node.member().equals("status")) {
            return PrimitiveType.STATUS;
        }
        if (inner != null && node.member().equals("value")) {
            return inner;
        }
        diagnostics.reportError(CompilerErrorCode.INVALID_OPERATION,
                "A value of type " + target.displayName() + " has no member '" + node.member() + "'.", node.source());
        return Type.UNKNOWN;
    }

    /**
     * The fallback determines the type of the chain; every other clause must be assignable to it.
     * A chain whose fallback produces no value is only run for its effects, so the other clauses
     * may produce anything.
     */
    private Type checkTryChain(TryChainNode node, Type expected) {
        Optional<TryClause> fallback = node.fallback();
        Type chainType = fallback.map(clause -> checkClause(clause, expected)).orElse(Type.UNKNOWN);
        for (TryClause clause : node.clauses()) {
            if (clause.kind() == TryClause.Kind.FALLBACK) {
                continue;
            }
            Type clauseType = checkClause(clause, chainType.isUnknown() || chainType.isVoid() ? expected : chainType);
            if (!chainType.isVoid() && !Types.isAssignable(chainType, clauseType)) {
                diagnostics.reportError(CompilerErrorCode.TRY_CHAIN_TYPE_MISMATCH,
                        "The '" + clause.kind().name().toLowerCase() + "' clause produces " + clauseType.displayName()
                                + " but the fallback determines the chain type " + chainType.displayName() + ".",
                        clause.source());
            }
        }
        return chainType;
    }

    private Type checkClause(TryClause clause, Type expected) {
        symbolTable.enterScope();
        if (clause.body() != null) {
            checkStatements(clause.body().statements());
        }
        Type type = clause.value() != null ? checkExpression(clause.value(), expected) : Type.VOID;
        symbolTable.leaveScope();
        return type;
    }

    private void requireAssignable(Type target, Type actual, SourceInfo source, String message) {
        requireAssignable(target, actual, source, CompilerErrorCode.TYPE_MISMATCH, message);
    }

    private void requireAssignable(Type target, Type actual, SourceInfo source, CompilerErrorCode code, String message) {
        if (!Types.isAssignable(target, actual)) {
            diagnostics.reportError(code, message, source);
        }
    }
}
