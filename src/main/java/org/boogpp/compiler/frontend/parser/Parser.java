package org.boogpp.compiler.frontend.parser;

import org.boogpp.compiler.api.CompilerErrorCode;
import org.boogpp.compiler.api.SourceInfo;
import org.boogpp.compiler.diagnostics.DiagnosticsEngine;
import org.boogpp.compiler.frontend.lexer.NumberLiteral;
import org.boogpp.compiler.frontend.lexer.Token;
import org.boogpp.compiler.frontend.lexer.TokenType;
import org.boogpp.compiler.frontend.parser.ast.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The recursive-descent parser. It consumes the tokens produced by the
 * {@link org.boogpp.compiler.frontend.lexer.Lexer} and produces a {@link ModuleNode}.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine} and parsing continues after
 * skipping to the end of the malformed statement, so one run reports every independent error.
 */
public class Parser {

    private static final Map<TokenType, BinaryOperator> BINARY_OPERATORS = new EnumMap<>(TokenType.class);
    private static final Map<TokenType, BinaryOperator> COMPOUND_ASSIGNMENTS = new EnumMap<>(TokenType.class);

    static {
        BINARY_OPERATORS.put(TokenType.OR, BinaryOperator.OR);
        BINARY_OPERATORS.put(TokenType.AND, BinaryOperator.AND);
        BINARY_OPERATORS.put(TokenType.EQ, BinaryOperator.EQ);
        BINARY_OPERATORS.put(TokenType.NE, BinaryOperator.NE);
        BINARY_OPERATORS.put(TokenType.LT, BinaryOperator.LT);
        BINARY_OPERATORS.put(TokenType.LE, BinaryOperator.LE);
        BINARY_OPERATORS.put(TokenType.GT, BinaryOperator.GT);
        BINARY_OPERATORS.put(TokenType.GE, BinaryOperator.GE);
        BINARY_OPERATORS.put(TokenType.PIPE, BinaryOperator.BIT_OR);
        BINARY_OPERATORS.put(TokenType.CARET, BinaryOperator.BIT_XOR);
        BINARY_OPERATORS.put(TokenType.AMPERSAND, BinaryOperator.BIT_AND);
        BINARY_OPERATORS.put(TokenType.LSHIFT, BinaryOperator.SHL);
        BINARY_OPERATORS.put(TokenType.RSHIFT, BinaryOperator.SHR);
        BINARY_OPERATORS.put(TokenType.PLUS, BinaryOperator.ADD);
        BINARY_OPERATORS.put(TokenType.MINUS, BinaryOperator.SUB);
        BINARY_OPERATORS.put(TokenType.STAR, BinaryOperator.MUL);
        BINARY_OPERATORS.put(TokenType.SLASH, BinaryOperator.DIV);
        BINARY_OPERATORS.put(TokenType.PERCENT, BinaryOperator.MOD);
        BINARY_OPERATORS.put(TokenType.POWER, BinaryOperator.POWER);

        COMPOUND_ASSIGNMENTS.put(TokenType.PLUS_ASSIGN, BinaryOperator.ADD);
        COMPOUND_ASSIGNMENTS.put(TokenType.MINUS_ASSIGN, BinaryOperator.SUB);
        COMPOUND_ASSIGNMENTS.put(TokenType.STAR_ASSIGN, BinaryOperator.MUL);
        COMPOUND_ASSIGNMENTS.put(TokenType.SLASH_ASSIGN, BinaryOperator.DIV);
        COMPOUND_ASSIGNMENTS.put(TokenType.PERCENT_ASSIGN, BinaryOperator.MOD);
    }

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse; must end with END_OF_FILE.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The module; declarations that failed to parse are left out.
     */
    public ModuleNode parse() {
        SourceInfo moduleSource = peek().source();
        String moduleName = null;
        List<DecoratorNode> moduleDecorators = new ArrayList<>();
        List<ImportNode> imports = new ArrayList<>();
        List<FunctionDeclNode> functions = new ArrayList<>();
        List<DecoratorNode> pending = new ArrayList<>();

        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            try {
                if (check(TokenType.AT)) {
                    decorator().ifPresent(pending::add);
                    continue;
                }
                if (check(TokenType.FUNC)) {
                    List<DecoratorNode> own = new ArrayList<>();
                    for (DecoratorNode decorator : pending) {
                        if (decorator.kind().isModuleLevel()) {
                            attachToModule(decorator, moduleDecorators, functions.isEmpty());
                        } else {
                            own.add(decorator);
                        }
                    }
                    pending.clear();
                    functions.add(function(own));
                    continue;
                }
                flushPending(pending, moduleDecorators, functions.isEmpty());
                if (match(TokenType.MODULE)) {
                    Token keyword = previous();
                    if (moduleName != null || !functions.isEmpty() || !imports.isEmpty()) {
                        diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                                "'module' must be the first declaration of the file.", keyword);
                    }
                    moduleName = dottedName();
                    endStatement();
                } else if (check(TokenType.IMPORT) || check(TokenType.FROM)) {
                    imports.add(importStatement());
                } else {
                    throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                            "Expected a function declaration but found " + describe(peek()) + ".", peek());
                }
            } catch (ParseException e) {
                synchronize();
            }
        }
        flushPending(pending, moduleDecorators, functions.isEmpty());
        return new ModuleNode(moduleName, moduleDecorators, imports, functions, moduleSource);
    }

    /**
     * Parses a standalone type such as {@code ptr[u8]}, as written in configuration files.
     * @return The type reference, or empty if the tokens do not form exactly one type.
     */
    public Optional<TypeRefNode> parseStandaloneType() {
        try {
            TypeRefNode type = type();
            match(TokenType.NEWLINE);
            if (!isAtEnd()) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected " + describe(peek()) + " after type.", peek());
                return Optional.empty();
            }
            return Optional.of(type);
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    private void attachToModule(DecoratorNode decorator, List<DecoratorNode> moduleDecorators, boolean beforeFirstFunction) {
        if (!beforeFirstFunction) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                    "@" + decorator.kind().decoratorName() + " must appear before the first function.", decorator.source());
        } else if (moduleDecorators.stream().anyMatch(d -> d.kind() == decorator.kind())) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                    "Duplicate @" + decorator.kind().decoratorName() + " decorator.", decorator.source());
        } else {
            moduleDecorators.add(decorator);
        }
    }

    private void flushPending(List<DecoratorNode> pending, List<DecoratorNode> moduleDecorators, boolean beforeFirstFunction) {
        for (DecoratorNode decorator : pending) {
            if (decorator.kind().isModuleLevel()) {
                attachToModule(decorator, moduleDecorators, beforeFirstFunction);
            } else {
                diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                        "@" + decorator.kind().decoratorName() + " must precede a function declaration.", decorator.source());
            }
        }
        pending.clear();
    }

    private ImportNode importStatement() {
        Token keyword = advance();
        String path = dottedName();
        if (keyword.type() == TokenType.FROM) {
            consume(TokenType.IMPORT, "Expected 'import' after module path.");
            List<String> names = new ArrayList<>();
            do {
                names.add(consume(TokenType.IDENTIFIER, "Expected a name to import.").text());
            } while (match(TokenType.COMMA));
            endStatement();
            return new ImportNode(path, null, names, keyword.source());
        }
        String alias = null;
        if (check(TokenType.IDENTIFIER) && "as".equals(peek().text())) {
            advance();
            alias = consume(TokenType.IDENTIFIER, "Expected an alias after 'as'.").text();
        }
        endStatement();
        return new ImportNode(path, alias, List.of(), keyword.source());
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(nameToken("Expected a module name.").text());
        while (match(TokenType.DOT)) {
            name.append('.').append(nameToken("Expected a name after '.'.").text());
        }
        return name.toString();
    }

    private FunctionDeclNode function(List<DecoratorNode> decorators) {
        Token keyword = consume(TokenType.FUNC, "Expected 'func'.");
        String name = consume(TokenType.IDENTIFIER, "Expected function name after 'func'.").text();
        consume(TokenType.LPAREN, "Expected '(' after function name.");
        List<ParameterNode> parameters = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Token parameter = consume(TokenType.IDENTIFIER, "Expected parameter name.");
                consume(TokenType.COLON, "Expected ':' and a type after parameter '" + parameter.text() + "'.");
                parameters.add(new ParameterNode(parameter.text(), type(), parameter.source()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters.");

        List<TypeRefNode> returnTypes = new ArrayList<>();
        if (match(TokenType.ARROW)) {
            if (match(TokenType.LPAREN)) {
                do {
                    returnTypes.add(type());
                } while (match(TokenType.COMMA));
                consume(TokenType.RPAREN, "Expected ')' after return types.");
            } else {
                TypeRefNode single = type();
                if (!"void".equals(single.name())) {
                    returnTypes.add(single);
                }
            }
        }
        consume(TokenType.COLON, "Expected ':' after function signature.");
        BlockNode body = block();
        return new FunctionDeclNode(name, parameters, returnTypes, body, decorators, keyword.source());
    }

    private TypeRefNode type() {
        Token token = peek();
        SourceInfo source = token.source();
        if (match(TokenType.LPAREN)) {
            List<TypeRefNode> elements = new ArrayList<>();
            do {
                elements.add(type());
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Expected ')' after tuple element types.");
            return new TypeRefNode("tuple", elements, null, source);
        }
        if (token.type().isTypeKeyword()) {
            advance();
            switch (token.type()) {
                case PTR, SLICE, RESULT -> {
                    consume(TokenType.LBRACKET, "Expected '[' after '" + token.text() + "'.");
                    TypeRefNode element = type();
                    consume(TokenType.RBRACKET, "Expected ']' after element type.");
                    return new TypeRefNode(token.text(), List.of(element), null, source);
                }
                case ARRAY -> {
                    consume(TokenType.LBRACKET, "Expected '[' after 'array'.");
                    TypeRefNode element = type();
                    consume(TokenType.COMMA, "Expected ',' and a length in array type.");
                    Token length = consume(TokenType.INTEGER_LITERAL, "Expected an integer array length.");
                    consume(TokenType.RBRACKET, "Expected ']' after array length.");
                    return new TypeRefNode("array", List.of(element), ((NumberLiteral) length.value()).value().longValue(), source);
                }
                case TUPLE -> {
                    consume(TokenType.LPAREN, "Expected '(' after 'tuple'.");
                    List<TypeRefNode> elements = new ArrayList<>();
                    do {
                        elements.add(type());
                    } while (match(TokenType.COMMA));
                    consume(TokenType.RPAREN, "Expected ')' after tuple element types.");
                    return new TypeRefNode("tuple", elements, null, source);
                }
                default -> {
                    return TypeRefNode.simple(token.text(), source);
                }
            }
        }
        if (match(TokenType.IDENTIFIER)) {
            return TypeRefNode.simple(token.text(), source);
        }
        throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "Expected a type but found " + describe(token) + ".", token);
    }

    /**
     * Parses the block after a ':'. Either an indented block on the following lines or a
     * single statement on the same line.
     */
    private BlockNode block() {
        SourceInfo source = peek().source();
        if (!match(TokenType.NEWLINE)) {
            StatementNode single = statement();
            return new BlockNode(List.of(single), source);
        }
        consume(TokenType.INDENT, "Expected an indented block.");
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            StatementNode statement = statementWithRecovery();
            if (statement != null) {
                statements.add(statement);
            }
        }
        match(TokenType.DEDENT);
        return new BlockNode(statements, source);
    }

    private StatementNode statementWithRecovery() {
        try {
            return statement();
        } catch (ParseException e) {
            synchronize();
            return null;
        }
    }

    private StatementNode statement() {
        Token token = peek();
        switch (token.type()) {
            case LET, VAR:
                return varDeclaration();
            case IF:
                return ifStatement();
            case WHILE:
                return whileStatement();
            case FOR:
                return forStatement();
            case MATCH:
                return matchStatement();
            case RETURN:
                return returnStatement();
            case PASS:
                advance();
                endStatement();
                return new PassNode(token.source());
            case BREAK:
                advance();
                endStatement();
                return new BreakNode(token.source());
            case CONTINUE:
                advance();
                endStatement();
                return new ContinueNode(token.source());
            case FUNC:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "Functions may only be declared at module level.", token);
            case AT:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "Decorators may only precede module-level functions.", token);
            default:
                return expressionStatement();
        }
    }

    private VarDeclNode varDeclaration() {
        Token keyword = advance();
        boolean mutable = keyword.type() == TokenType.VAR;
        String name = consume(TokenType.IDENTIFIER, "Expected a name after '" + keyword.text() + "'.").text();
        TypeRefNode type = match(TokenType.COLON) ? type() : null;
        ExpressionNode initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = expression();
        } else if (!mutable || type == null) {
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected '=' and an initializer for '" + name + "' but found " + describe(peek()) + ".", peek());
        }
        endStatement();
        return new VarDeclNode(name, mutable, type, initializer, keyword.source());
    }

    private IfNode ifStatement() {
        Token keyword = advance();
        List<ConditionalBranch> branches = new ArrayList<>();
        ExpressionNode condition = expression();
        consume(TokenType.COLON, "Expected ':' after if condition.");
        branches.add(new ConditionalBranch(condition, block(), keyword.source()));
        while (check(TokenType.ELIF)) {
            Token elif = advance();
            ExpressionNode elifCondition = expression();
            consume(TokenType.COLON, "Expected ':' after elif condition.");
            branches.add(new ConditionalBranch(elifCondition, block(), elif.source()));
        }
        BlockNode elseBlock = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expected ':' after 'else'.");
            elseBlock = block();
        }
        return new IfNode(branches, elseBlock, keyword.source());
    }

    private WhileNode whileStatement() {
        Token keyword = advance();
        ExpressionNode condition = expression();
        consume(TokenType.COLON, "Expected ':' after while condition.");
        return new WhileNode(condition, block(), keyword.source());
    }

    private ForNode forStatement() {
        Token keyword = advance();
        String variable = consume(TokenType.IDENTIFIER, "Expected a loop variable after 'for'.").text();
        consume(TokenType.IN, "Expected 'in' after loop variable.");
        ExpressionNode iterable = expression();
        consume(TokenType.COLON, "Expected ':' after for clause.");
        return new ForNode(variable, iterable, block(), keyword.source());
    }

    private MatchNode matchStatement() {
        Token keyword = advance();
        ExpressionNode subject = expression();
        consume(TokenType.COLON, "Expected ':' after match subject.");
        consume(TokenType.NEWLINE, "Expected a new line after 'match ...:'.");
        consume(TokenType.INDENT, "Expected an indented list of cases.");
        List<CaseNode> cases = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            try {
                cases.add(caseClause());
            } catch (ParseException e) {
                synchronize();
            }
        }
        match(TokenType.DEDENT);
        if (cases.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN, "A match needs at least one case.", keyword);
        }
        return new MatchNode(subject, cases, keyword.source());
    }

    private CaseNode caseClause() {
        Token keyword = consume(TokenType.CASE, "Expected 'case'.");
        ExpressionNode pattern = null;
        ExpressionNode rangeEnd = null;
        if (check(TokenType.IDENTIFIER) && "_".equals(peek().text())) {
            advance();
        } else {
            pattern = binary(BinaryOperator.BIT_OR.precedence());
            if (match(TokenType.RANGE)) {
                rangeEnd = binary(BinaryOperator.BIT_OR.precedence());
            }
        }
        consume(TokenType.COLON, "Expected ':' after case pattern.");
        return new CaseNode(pattern, rangeEnd, block(), keyword.source());
    }

    private ReturnNode returnStatement() {
        Token keyword = advance();
        List<ExpressionNode> values = new ArrayList<>();
        if (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            do {
                values.add(expression());
            } while (match(TokenType.COMMA));
        }
        endStatement();
        return new ReturnNode(values, keyword.source());
    }

    private StatementNode expressionStatement() {
        SourceInfo source = peek().source();
        ExpressionNode expression = expression();
        if (check(TokenType.ASSIGN) || COMPOUND_ASSIGNMENTS.containsKey(peek().type())) {
            Token operator = advance();
            if (!(expression instanceof IdentifierNode) && !(expression instanceof IndexNode)
                    && !(expression instanceof MemberAccessNode)) {
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "Invalid assignment target.", operator);
            }
            ExpressionNode value = expression();
            endStatement();
            return new AssignNode(expression, COMPOUND_ASSIGNMENTS.get(operator.type()), value, source);
        }
        endStatement();
        return new ExpressionStatementNode(expression, source);
    }

    /**
     * A statement ends at a NEWLINE. Constructs that end with an indented block have already
     * consumed their terminator, as has a statement that is the last one of its block.
     */
    private void endStatement() {
        if (match(TokenType.NEWLINE)) {
            return;
        }
        if (previous().type() == TokenType.DEDENT || check(TokenType.DEDENT) || isAtEnd()) {
            return;
        }
        throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected end of statement but found " + describe(peek()) + ".", peek());
    }

    /**
     * Parses an expression, including a {@code try_chain} used as a value.
     * @return The parsed expression.
     */
    public ExpressionNode expression() {
        if (check(TokenType.TRY_CHAIN)) {
            return tryChain();
        }
        return binary(BinaryOperator.OR.precedence());
    }

    private ExpressionNode binary(int minPrecedence) {
        ExpressionNode left = unary();
        while (true) {
            BinaryOperator operator = BINARY_OPERATORS.get(peek().type());
            if (operator == null || operator.precedence() < minPrecedence) {
                return left;
            }
            Token operatorToken = advance();
            int nextPrecedence = operator.isRightAssociative() ? operator.precedence() : operator.precedence() + 1;
            ExpressionNode right = binary(nextPrecedence);
            left = new BinaryNode(left, operator, right, operatorToken.source());
        }
    }

    private ExpressionNode unary() {
        Token token = peek();
        if (match(TokenType.NOT)) {
            return new UnaryNode(UnaryOperator.NOT, binary(BinaryOperator.EQ.precedence()), token.source());
        }
        if (match(TokenType.MINUS)) {
            ExpressionNode operand = binary(BinaryOperator.POWER.precedence());
            if (operand instanceof LiteralNode literal && literal.kind() == LiteralNode.Kind.INTEGER) {
                return new LiteralNode(LiteralNode.Kind.INTEGER, literal.integerValue().negate(), literal.suffix(), token.source());
            }
            if (operand instanceof LiteralNode literal && literal.kind() == LiteralNode.Kind.FLOAT) {
                return new LiteralNode(LiteralNode.Kind.FLOAT, -((Double) literal.value()), literal.suffix(), token.source());
            }
            return new UnaryNode(UnaryOperator.NEGATE, operand, token.source());
        }
        if (match(TokenType.TILDE)) {
            return new UnaryNode(UnaryOperator.BIT_NOT, binary(BinaryOperator.POWER.precedence()), token.source());
        }
        return postfix();
    }

    private ExpressionNode postfix() {
        ExpressionNode expression = primary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                List<ExpressionNode> arguments = new ArrayList<>();
                if (!check(TokenType.RPAREN)) {
                    do {
                        arguments.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RPAREN, "Expected ')' after arguments.");
                expression = new CallNode(expression, arguments, expression.source());
            } else if (match(TokenType.LBRACKET)) {
                ExpressionNode index = expression();
                consume(TokenType.RBRACKET, "Expected ']' after index.");
                expression = new IndexNode(expression, index, expression.source());
            } else if (match(TokenType.DOT)) {
                Token dot = previous();
                Token member = nameToken("Expected a member name after '.'.");
                expression = new MemberAccessNode(expression, member.text(), dot.source());
            } else {
                return expression;
            }
        }
    }

    private ExpressionNode primary() {
        Token token = peek();
        SourceInfo source = token.source();
        switch (token.type()) {
            case INTEGER_LITERAL: {
                advance();
                NumberLiteral number = (NumberLiteral) token.value();
                return new LiteralNode(LiteralNode.Kind.INTEGER, number.value(), number.suffix(), source);
            }
            case FLOAT_LITERAL: {
                advance();
                NumberLiteral number = (NumberLiteral) token.value();
                return new LiteralNode(LiteralNode.Kind.FLOAT, number.value().doubleValue(), number.suffix(), source);
            }
            case STRING_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.STRING, token.value(), null, source);
            case CHAR_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.CHAR, token.value(), null, source);
            case TRUE, FALSE:
                advance();
                return new LiteralNode(LiteralNode.Kind.BOOL, token.type() == TokenType.TRUE, null, source);
            case IDENTIFIER:
                advance();
                return new IdentifierNode(token.text(), source);
            case TRY_CHAIN:
                return tryChain();
            case LPAREN: {
                advance();
                if (match(TokenType.RPAREN)) {
                    return new TupleNode(List.of(), source);
                }
                ExpressionNode first = expression();
                if (!match(TokenType.COMMA)) {
                    consume(TokenType.RPAREN, "Expected ')' after expression.");
                    return first;
                }
                List<ExpressionNode> elements = new ArrayList<>();
                elements.add(first);
                while (!check(TokenType.RPAREN)) {
                    elements.add(expression());
                    if (!match(TokenType.COMMA)) {
                        break;
                    }
                }
                consume(TokenType.RPAREN, "Expected ')' after tuple elements.");
                return new TupleNode(elements, source);
            }
            case LBRACKET: {
                advance();
                List<ExpressionNode> elements = new ArrayList<>();
                while (!check(TokenType.RBRACKET)) {
                    elements.add(expression());
                    if (!match(TokenType.COMMA)) {
                        break;
                    }
                }
                consume(TokenType.RBRACKET, "Expected ']' after array elements.");
                return new ArrayLiteralNode(elements, source);
            }
            default:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Expected an expression but found " + describe(token) + ".", token);
        }
    }

    /**
     * Parses {@code try_chain:} followed by an indented clause list, or the single-line
     * form {@code try_chain { primary: a() secondary: b() fallback: c }}.
     */
    private TryChainNode tryChain() {
        Token keyword = advance();
        boolean braced = match(TokenType.LBRACE);
        if (!braced) {
            consume(TokenType.COLON, "Expected ':' or '{' after 'try_chain'.");
            consume(TokenType.NEWLINE, "Expected the try_chain clauses on the following lines.");
            consume(TokenType.INDENT, "Expected an indented list of try_chain clauses.");
        }
        TokenType closing = braced ? TokenType.RBRACE : TokenType.DEDENT;
        List<TryClause> clauses = new ArrayList<>();
        boolean fallbackSeen = false;
        while (!check(closing) && !isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.COMMA, TokenType.SEMICOLON)) {
                continue;
            }
            Token clauseToken = peek();
            TryClause clause;
            if (braced) {
                clause = tryClause(true);
            } else {
                try {
                    clause = tryClause(false);
                } catch (ParseException e) {
                    synchronize();
                    continue;
                }
            }
            if (fallbackSeen) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "'" + clauseToken.text() + "' after 'fallback'; fallback must be the last clause.", clauseToken);
                continue;
            }
            if (clause.kind() == TryClause.Kind.PRIMARY && !clauses.isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "A try_chain has exactly one 'primary' clause, and it comes first.", clauseToken);
                continue;
            }
            if (clause.kind() != TryClause.Kind.PRIMARY && clauses.isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Expected 'primary' as the first try_chain clause but found '" + clauseToken.text() + "'.", clauseToken);
            }
            fallbackSeen = clause.kind() == TryClause.Kind.FALLBACK;
            clauses.add(clause);
        }
        consume(closing, braced ? "Expected '}' after try_chain clauses." : "Expected the end of the try_chain block.");
        if (!fallbackSeen) {
            diagnostics.reportError(CompilerErrorCode.MISSING_FALLBACK,
                    "try_chain requires a terminal 'fallback' clause.", keyword);
        }
        return new TryChainNode(clauses, keyword.source());
    }

    private TryClause tryClause(boolean braced) {
        Token keyword = peek();
        TryClause.Kind kind;
        switch (keyword.type()) {
            case PRIMARY -> kind = TryClause.Kind.PRIMARY;
            case SECONDARY -> kind = TryClause.Kind.SECONDARY;
            case FALLBACK -> kind = TryClause.Kind.FALLBACK;
            default -> throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected 'primary', 'secondary' or 'fallback' but found " + describe(keyword) + ".", keyword);
        }
        advance();
        consume(TokenType.COLON, "Expected ':' after '" + keyword.text() + "'.");
        if (!braced && check(TokenType.NEWLINE)) {
            BlockNode block = block();
            List<StatementNode> statements = new ArrayList<>(block.statements());
            ExpressionNode value = null;
            if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof ExpressionStatementNode last) {
                value = last.expression();
                statements.remove(statements.size() - 1);
            }
            return new TryClause(kind, new BlockNode(statements, block.source()), value, keyword.source());
        }
        ExpressionNode value = expression();
        if (!braced) {
            endStatement();
        }
        return new TryClause(kind, null, value, keyword.source());
    }

    private Optional<DecoratorNode> decorator() {
        Token at = advance();
        Token name = nameToken("Expected a decorator name after '@'.");
        List<DecoratorArgument> written = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                do {
                    written.add(decoratorArgument());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "Expected ')' after decorator arguments.");
        }
        consume(TokenType.NEWLINE, "Expected a new line after decorator.");

        Optional<DecoratorKind> kind = DecoratorKind.fromName(name.text());
        if (kind.isEmpty()) {
            diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR, "Unknown decorator '@" + name.text() + "'.", name);
            return Optional.empty();
        }
        return validateDecorator(kind.get(), written, at.source());
    }

    private Optional<DecoratorNode> validateDecorator(DecoratorKind kind, List<DecoratorArgument> written, SourceInfo source) {
        List<DecoratorArgument> arguments = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean valid = true;
        for (int i = 0; i < written.size(); i++) {
            DecoratorArgument argument = written.get(i);
            if (argument.name() == null) {
                // A single positional argument binds to the first option.
                if (i > 0 || kind.options().isEmpty()) {
                    diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                            "@" + kind.decoratorName() + " arguments must be written as 'name: value'.", argument.source());
                    valid = false;
                    continue;
                }
                argument = new DecoratorArgument(kind.options().get(0).name(), argument.kind(), argument.value(), argument.source());
            }
            Optional<DecoratorKind.Option> option = kind.option(argument.name());
            if (option.isEmpty()) {
                diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                        "Unknown option '" + argument.name() + "' for @" + kind.decoratorName() + ".", argument.source());
                valid = false;
            } else if (!seen.add(argument.name())) {
                diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                        "Duplicate option '" + argument.name() + "' for @" + kind.decoratorName() + ".", argument.source());
                valid = false;
            } else if (!option.get().accepts(argument)) {
                String expected = option.get().choices().isEmpty()
                        ? option.get().kind().name().toLowerCase()
                        : "one of " + String.join(", ", option.get().choices().stream().sorted().toList());
                diagnostics.reportError(CompilerErrorCode.MALFORMED_DECORATOR,
                        "Invalid value '" + argument.asText() + "' for option '" + argument.name() + "' of @"
                                + kind.decoratorName() + "; expected " + expected + ".", argument.source());
                valid = false;
            } else {
                arguments.add(argument);
            }
        }
        return valid ? Optional.of(new DecoratorNode(kind, arguments, source)) : Optional.empty();
    }

    private DecoratorArgument decoratorArgument() {
        String name = null;
        if (isNameToken(peek()) && checkNext(TokenType.COLON)) {
            name = advance().text();
            advance();
        }
        Token value = advance();
        SourceInfo source = value.source();
        switch (value.type()) {
            case INTEGER_LITERAL:
                return new DecoratorArgument(name, DecoratorArgument.Kind.INTEGER,
                        ((NumberLiteral) value.value()).value().longValue(), source);
            case FLOAT_LITERAL:
                return new DecoratorArgument(name, DecoratorArgument.Kind.FLOAT,
                        ((NumberLiteral) value.value()).value().doubleValue(), source);
            case STRING_LITERAL:
                return new DecoratorArgument(name, DecoratorArgument.Kind.STRING, value.value(), source);
            case TRUE, FALSE:
                return new DecoratorArgument(name, DecoratorArgument.Kind.BOOL, value.type() == TokenType.TRUE, source);
            case IDENTIFIER:
                return new DecoratorArgument(name, DecoratorArgument.Kind.SYMBOL, value.text(), source);
            case MINUS:
                if (check(TokenType.INTEGER_LITERAL)) {
                    BigInteger magnitude = (BigInteger) ((NumberLiteral) advance().value()).value();
                    return new DecoratorArgument(name, DecoratorArgument.Kind.INTEGER, magnitude.negate().longValue(), source);
                }
                throw error(CompilerErrorCode.MALFORMED_DECORATOR, "Decorator arguments must be constants.", value);
            default:
                throw error(CompilerErrorCode.MALFORMED_DECORATOR,
                        "Decorator arguments must be constants but found " + describe(value) + ".", value);
        }
    }

    /**
     * Skips to the end of the malformed statement: the next NEWLINE at the current nesting level,
     * together with an indented block that follows it, or the DEDENT that closes the current block.
     */
    private void synchronize() {
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type();
            if (type == TokenType.INDENT) {
                depth++;
            } else if (type == TokenType.DEDENT) {
                if (depth == 0) {
                    return;
                }
                depth--;
                advance();
                if (depth == 0) {
                    return;
                }
                continue;
            } else if (type == TokenType.NEWLINE && depth == 0) {
                advance();
                skipIndentedBlock();
                return;
            }
            advance();
        }
    }

    private void skipIndentedBlock() {
        if (!check(TokenType.INDENT)) {
            return;
        }
        int depth = 0;
        do {
            if (check(TokenType.INDENT)) {
                depth++;
            } else if (check(TokenType.DEDENT)) {
                depth--;
            }
            advance();
        } while (depth > 0 && !isAtEnd());
    }

    private Token nameToken(String errorMessage) {
        if (isNameToken(peek())) {
            return advance();
        }
        throw error(CompilerErrorCode.UNEXPECTED_TOKEN, errorMessage + " Found " + describe(peek()) + ".", peek());
    }

    /**
     * Keywords are accepted where only a name can appear, e.g. {@code result.status}.
     */
    private static boolean isNameToken(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type().keyword() != null;
    }

    private ParseException error(CompilerErrorCode code, String message, Token at) {
        diagnostics.reportError(code, message, at);
        return new ParseException(message);
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case END_OF_FILE -> "end of file";
            case NEWLINE -> "end of line";
            case INDENT -> "indentation";
            case DEDENT -> "end of block";
            default -> "'" + token.text() + "'";
        };
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        if (current == 0) return tokens.get(0);
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        Token unexpected = peek();
        throw error(CompilerErrorCode.UNEXPECTED_TOKEN, errorMessage + " Found " + describe(unexpected) + ".", unexpected);
    }
}
