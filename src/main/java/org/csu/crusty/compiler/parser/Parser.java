package org.csu.crusty.compiler.parser;

import org.csu.crusty.common.exception.ParseException;
import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.lexer.Lexer;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.lexer.TokenType;
import org.csu.crusty.compiler.parser.ast.*;
import org.csu.crusty.compiler.parser.ast.expression.*;
import org.csu.crusty.compiler.parser.ast.item.*;
import org.csu.crusty.compiler.parser.ast.statement.*;
import org.csu.crusty.compiler.parser.ast.type.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 *
 * 语句开头的歧义按以下顺序消解:
 * 1. let / var / const / .label: / 控制关键字
 * 2. Type Ident '('            嵌套函数
 * 3. Type [*|&]* Ident '='     隐式声明 (不可变 let)
 * 4. Ident '='                 总是赋值, 先于规则 3 检查
 * 5. 其余按表达式语句解析
 *
 * 遇到第一个错误即抛出 ParseException, 不做错误恢复。
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private static final Map<TokenType, PrimitiveKind> PRIMITIVES = new EnumMap<>(TokenType.class);
    private static final Map<TokenType, BinaryOperator> ASSIGNMENT_OPERATORS = new EnumMap<>(TokenType.class);
    private static final Map<TokenType, BinaryOperator> BINARY_OPERATORS = new EnumMap<>(TokenType.class);

    // 一个具名类型后紧跟这些Token时, 括号才被当作类型转换
    private static final Set<TokenType> CAST_OPERAND_START = Set.of(
            TokenType.IDENTIFIER, TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.STRING_LITERAL,
            TokenType.CHAR_LITERAL, TokenType.TRUE, TokenType.FALSE, TokenType.NULL, TokenType.LPAREN,
            TokenType.LBRACE, TokenType.LBRACKET, TokenType.AT, TokenType.BANG, TokenType.TILDE, TokenType.SIZEOF
    );

    static {
        PRIMITIVES.put(TokenType.INT, PrimitiveKind.INT);
        PRIMITIVES.put(TokenType.I32, PrimitiveKind.I32);
        PRIMITIVES.put(TokenType.I64, PrimitiveKind.I64);
        PRIMITIVES.put(TokenType.U32, PrimitiveKind.U32);
        PRIMITIVES.put(TokenType.U64, PrimitiveKind.U64);
        PRIMITIVES.put(TokenType.FLOAT, PrimitiveKind.FLOAT);
        PRIMITIVES.put(TokenType.F32, PrimitiveKind.F32);
        PRIMITIVES.put(TokenType.F64, PrimitiveKind.F64);
        PRIMITIVES.put(TokenType.BOOL, PrimitiveKind.BOOL);
        PRIMITIVES.put(TokenType.CHAR, PrimitiveKind.CHAR);
        PRIMITIVES.put(TokenType.VOID, PrimitiveKind.VOID);

        ASSIGNMENT_OPERATORS.put(TokenType.ASSIGN, BinaryOperator.ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.PLUS_ASSIGN, BinaryOperator.ADD_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.MINUS_ASSIGN, BinaryOperator.SUB_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.STAR_ASSIGN, BinaryOperator.MUL_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.SLASH_ASSIGN, BinaryOperator.DIV_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.PERCENT_ASSIGN, BinaryOperator.MOD_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.AND_ASSIGN, BinaryOperator.AND_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.OR_ASSIGN, BinaryOperator.OR_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.XOR_ASSIGN, BinaryOperator.XOR_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.SHIFT_LEFT_ASSIGN, BinaryOperator.SHL_ASSIGN);
        ASSIGNMENT_OPERATORS.put(TokenType.SHIFT_RIGHT_ASSIGN, BinaryOperator.SHR_ASSIGN);

        BINARY_OPERATORS.put(TokenType.OR_OR, BinaryOperator.OR);
        BINARY_OPERATORS.put(TokenType.AND_AND, BinaryOperator.AND);
        BINARY_OPERATORS.put(TokenType.PIPE, BinaryOperator.BIT_OR);
        BINARY_OPERATORS.put(TokenType.CARET, BinaryOperator.BIT_XOR);
        BINARY_OPERATORS.put(TokenType.AMPERSAND, BinaryOperator.BIT_AND);
        BINARY_OPERATORS.put(TokenType.EQUAL_EQUAL, BinaryOperator.EQ);
        BINARY_OPERATORS.put(TokenType.NOT_EQUAL, BinaryOperator.NE);
        BINARY_OPERATORS.put(TokenType.LESS, BinaryOperator.LT);
        BINARY_OPERATORS.put(TokenType.GREATER, BinaryOperator.GT);
        BINARY_OPERATORS.put(TokenType.LESS_EQUAL, BinaryOperator.LE);
        BINARY_OPERATORS.put(TokenType.GREATER_EQUAL, BinaryOperator.GE);
        BINARY_OPERATORS.put(TokenType.SHIFT_LEFT, BinaryOperator.SHL);
        BINARY_OPERATORS.put(TokenType.SHIFT_RIGHT, BinaryOperator.SHR);
        BINARY_OPERATORS.put(TokenType.PLUS, BinaryOperator.ADD);
        BINARY_OPERATORS.put(TokenType.MINUS, BinaryOperator.SUB);
        BINARY_OPERATORS.put(TokenType.STAR, BinaryOperator.MUL);
        BINARY_OPERATORS.put(TokenType.SLASH, BinaryOperator.DIV);
        BINARY_OPERATORS.put(TokenType.PERCENT, BinaryOperator.MOD);
    }

    private record TokenSplit(int index, Token original) {
    }

    private record Checkpoint(int position, int splitCount) {
    }

    private enum StatementHead {
        NESTED_FUNCTION,
        IMPLICIT_DECLARATION,
        OTHER
    }

    private final List<Token> tokens;
    private int position = 0;
    // 被拆分的 '>>' 及其下标, 回溯时需要还原
    private final Deque<TokenSplit> splits = new ArrayDeque<>();
    private final MacroRegistry macroRegistry = new MacroRegistry();

    public Parser(List<Token> tokens) {
        // 拆分 '>>' 时需要改写Token列表
        this.tokens = new ArrayList<>(tokens);
    }

    public static Parser fromSource(String source) {
        return new Parser(new Lexer(source).tokenize());
    }

    public MacroRegistry getMacroRegistry() {
        return macroRegistry;
    }

    public CrustyFile parse() {
        List<ItemNode> items = new ArrayList<>();
        while (!isAtEnd()) {
            items.add(parseItem());
        }
        LOG.fine(() -> "Parsed " + items.size() + " items, " + macroRegistry.size() + " macros registered");
        return new CrustyFile(items);
    }

    // ==================== 顶层条目 ====================

    private ItemNode parseItem() {
        List<AttributeNode> attributes = parseAttributes();
        if (check(TokenType.HASH)) {
            rejectAttributes(attributes, "#define");
            return parseDefine();
        }
        if (match(TokenType.STRUCT)) {
            return parseStruct(previous(), attributes);
        }
        if (match(TokenType.ENUM)) {
            return parseEnum(previous(), attributes);
        }
        if (match(TokenType.TYPEDEF)) {
            rejectAttributes(attributes, "typedef");
            return parseTypedef(previous());
        }
        Visibility visibility = match(TokenType.STATIC) ? Visibility.PRIVATE : Visibility.PUBLIC;
        if (!startsType()) {
            throw new ParseException(peek().span(), "Expected a top-level item",
                    List.of("function", "struct", "enum", "typedef", "#define"), peek().describe());
        }
        return parseFunction(visibility, false, attributes);
    }

    private FunctionNode parseFunction(Visibility visibility, boolean allowSelf, List<AttributeNode> attributes) {
        TypeNode returnType = voidToNull(parseType());
        Token name = consume(TokenType.IDENTIFIER, "function name");
        List<Parameter> params = parseParameters(allowSelf);
        BlockNode body = parseBlock();
        return new FunctionNode(visibility, name.lexeme(), params, returnType, body, attributes, name.span());
    }

    /**
     * 零个或多个 #[name] / #[name(arg, key = "value", 1)]; '#' 后不是 '[' 时留给 #define
     */
    private List<AttributeNode> parseAttributes() {
        List<AttributeNode> attributes = new ArrayList<>();
        while (check(TokenType.HASH) && peekAt(1).type() == TokenType.LBRACKET) {
            advance();
            advance();
            Token name = consume(TokenType.IDENTIFIER, "attribute name");
            List<AttributeNode.Argument> arguments = new ArrayList<>();
            if (match(TokenType.LPAREN)) {
                if (!check(TokenType.RPAREN)) {
                    do {
                        arguments.add(parseAttributeArgument());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RPAREN, "')' to close the attribute arguments");
            }
            consume(TokenType.RBRACKET, "']' to close the attribute");
            attributes.add(new AttributeNode(name.lexeme(), List.copyOf(arguments)));
        }
        return attributes;
    }

    private AttributeNode.Argument parseAttributeArgument() {
        if (match(TokenType.IDENTIFIER)) {
            String name = previous().lexeme();
            if (match(TokenType.ASSIGN)) {
                return AttributeNode.Argument.nameValue(name, parseAttributeLiteral());
            }
            return AttributeNode.Argument.identifier(name);
        }
        return AttributeNode.Argument.literal(parseAttributeLiteral());
    }

    private LiteralNode parseAttributeLiteral() {
        Token token = peek();
        switch (token.type()) {
            case INT_LITERAL:
                advance();
                return LiteralNode.ofInt(integerValue(token, Long.MAX_VALUE));
            case STRING_LITERAL:
                advance();
                return LiteralNode.ofString(token.lexeme());
            case TRUE:
            case FALSE:
                advance();
                return LiteralNode.ofBool(token.type() == TokenType.TRUE);
            default:
                throw new ParseException(token.span(), "Expected a literal in attribute",
                        List.of("integer", "string", "bool"), token.describe());
        }
    }

    private void rejectAttributes(List<AttributeNode> attributes, String item) {
        if (!attributes.isEmpty()) {
            throw new ParseException(peek().span(), "Attributes cannot be applied to " + item,
                    List.of("function", "struct", "enum"), peek().describe());
        }
    }

    private List<Parameter> parseParameters(boolean allowSelf) {
        consume(TokenType.LPAREN, "'(' to start the parameter list");
        List<Parameter> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                if (allowSelf && params.isEmpty() && isSelfParameter()) {
                    params.add(parseSelfParameter());
                } else {
                    TypeNode type = parseType();
                    Token name = consume(TokenType.IDENTIFIER, "parameter name");
                    params.add(new Parameter(name.lexeme(), type));
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' after parameters");
        return params;
    }

    private boolean isSelfParameter() {
        if (isSelf(peek())) {
            return true;
        }
        if (!check(TokenType.AMPERSAND)) {
            return false;
        }
        return isSelf(peekAt(1)) || (peekAt(1).type() == TokenType.VAR && isSelf(peekAt(2)));
    }

    private Parameter parseSelfParameter() {
        TypeNode selfType = new NamedTypeNode("Self");
        if (match(TokenType.AMPERSAND)) {
            boolean mutable = match(TokenType.VAR);
            advance();
            return new Parameter("self", new ReferenceTypeNode(selfType, mutable));
        }
        advance();
        return new Parameter("self", selfType);
    }

    private StructNode parseStruct(Token keyword, List<AttributeNode> attributes) {
        Token name = consume(TokenType.IDENTIFIER, "struct name");
        consume(TokenType.LBRACE, "'{' after struct name");
        List<FieldNode> fields = new ArrayList<>();
        List<FunctionNode> methods = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            List<AttributeNode> memberAttributes = parseAttributes();
            if (match(TokenType.STATIC)) {
                methods.add(parseFunction(Visibility.PRIVATE, true, memberAttributes));
            } else if (classifyTypeHead() == StatementHead.NESTED_FUNCTION) {
                methods.add(parseFunction(Visibility.PUBLIC, true, memberAttributes));
            } else {
                TypeNode type = parseType();
                Token fieldName = consume(TokenType.IDENTIFIER, "field name");
                consume(TokenType.SEMICOLON, "';' after struct field");
                fields.add(new FieldNode(Visibility.PUBLIC, fieldName.lexeme(), type, memberAttributes));
            }
        }
        consume(TokenType.RBRACE, "'}' to close the struct");
        match(TokenType.SEMICOLON);
        return new StructNode(Visibility.PUBLIC, name.lexeme(), fields, methods, attributes,
                keyword.span().to(name.span()));
    }

    private EnumNode parseEnum(Token keyword, List<AttributeNode> attributes) {
        Token name = consume(TokenType.IDENTIFIER, "enum name");
        consume(TokenType.LBRACE, "'{' after enum name");
        List<EnumVariantNode> variants = new ArrayList<>();
        long nextValue = 0;
        while (!check(TokenType.RBRACE)) {
            Token variant = consume(TokenType.IDENTIFIER, "enum variant name");
            long value = nextValue;
            if (match(TokenType.ASSIGN)) {
                boolean negative = match(TokenType.MINUS);
                Token literal = consume(TokenType.INT_LITERAL, "integer discriminant");
                long magnitude = integerValue(literal, Long.MAX_VALUE);
                value = negative ? -magnitude : magnitude;
            }
            variants.add(new EnumVariantNode(variant.lexeme(), value));
            nextValue = value + 1;
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "'}' to close the enum");
        match(TokenType.SEMICOLON);
        return new EnumNode(Visibility.PUBLIC, name.lexeme(), variants, attributes, keyword.span().to(name.span()));
    }

    private TypedefNode parseTypedef(Token keyword) {
        TypeNode target = parseType();
        Token name = consume(TokenType.IDENTIFIER, "typedef name");
        consume(TokenType.SEMICOLON, "';' after typedef");
        return new TypedefNode(Visibility.PUBLIC, name.lexeme(), target, keyword.span().to(name.span()));
    }

    /**
     * #define __NAME__(a, b) body
     * 参数列表的括号必须紧跟宏名; 宏体到行尾或 ';' 为止
     */
    private MacroDefinitionNode parseDefine() {
        Token hash = consume(TokenType.HASH, "'#'");
        consume(TokenType.DEFINE, "'define' after '#'");
        Token nameToken = consume(TokenType.IDENTIFIER, "macro name");
        String name = nameToken.lexeme();
        if (!MacroRegistry.hasMacroPrefix(name)) {
            throw new ParseException(nameToken.span(),
                    "macro name '" + name + "' must start with a double-underscore prefix (e.g. __" + name + "__)",
                    List.of("__NAME__"), nameToken.describe());
        }
        if (!MacroRegistry.hasMacroSuffix(name)) {
            throw new ParseException(nameToken.span(),
                    "macro name '" + name + "' must end with a double-underscore suffix (e.g. " + name + "__)",
                    List.of("__NAME__"), nameToken.describe());
        }

        MacroDelimiter delimiter = directlyFollows(nameToken, peek())
                ? openingDelimiter(peek().type())
                : MacroDelimiter.NONE;
        List<String> params = new ArrayList<>();
        if (delimiter != MacroDelimiter.NONE) {
            advance();
            TokenType close = closingToken(delimiter);
            if (!check(close)) {
                do {
                    params.add(consume(TokenType.IDENTIFIER, "macro parameter name").lexeme());
                } while (match(TokenType.COMMA));
            }
            consume(close, "'" + delimiter.close() + "' to close the macro parameters");
        }

        List<Token> body = new ArrayList<>();
        int line = nameToken.line();
        while (!isAtEnd() && peek().line() == line && !check(TokenType.SEMICOLON)) {
            body.add(advance());
        }
        match(TokenType.SEMICOLON);

        macroRegistry.register(new MacroRegistryEntry(name, delimiter, List.copyOf(params), List.copyOf(body)));
        LOG.finer(() -> "Registered macro " + name + " with " + delimiter.displayName());
        return new MacroDefinitionNode(name, params, delimiter, body, hash.span().to(nameToken.span()));
    }

    // ==================== 语句 ====================

    private BlockNode parseBlock() {
        consume(TokenType.LBRACE, "'{' to start a block");
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            statements.add(parseStatement());
        }
        consume(TokenType.RBRACE, "'}' to close the block");
        return new BlockNode(statements);
    }

    private StatementNode parseStatement() {
        switch (peek().type()) {
            case LET:
                return parseLet();
            case VAR:
                return parseVar();
            case CONST:
                return parseConst();
            case IF:
                return parseIf();
            case WHILE:
            case LOOP:
            case FOR:
                return parseLoop(null);
            case SWITCH:
                return parseSwitch();
            case RETURN:
                return parseReturn();
            case BREAK:
            case CONTINUE:
                return parseBreakOrContinue();
            case LBRACE:
                return parseBlock();
            case DOT:
                if (peekAt(1).type() == TokenType.IDENTIFIER && peekAt(2).type() == TokenType.COLON) {
                    advance();
                    String label = advance().lexeme();
                    advance();
                    return parseLoop(label);
                }
                break;
            default:
                break;
        }

        StatementHead head = classifyTypeHead();
        if (head == StatementHead.NESTED_FUNCTION) {
            return parseNestedFunction();
        }
        if (head == StatementHead.IMPLICIT_DECLARATION) {
            return parseImplicitDeclaration();
        }
        ExpressionNode expression = parseExpression();
        consume(TokenType.SEMICOLON, "';' after expression");
        return new ExpressionStatementNode(expression);
    }

    /**
     * 向前试探, 判断当前语句是嵌套函数、隐式声明还是普通语句. 不消耗Token
     */
    private StatementHead classifyTypeHead() {
        if (check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.ASSIGN) {
            return StatementHead.OTHER;
        }
        if (!startsType()) {
            return StatementHead.OTHER;
        }
        Checkpoint saved = checkpoint();
        try {
            parseType();
            if (check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.LPAREN) {
                return StatementHead.NESTED_FUNCTION;
            }
            while (check(TokenType.STAR) || check(TokenType.AMPERSAND)) {
                advance();
            }
            if (check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.ASSIGN) {
                return StatementHead.IMPLICIT_DECLARATION;
            }
            return StatementHead.OTHER;
        } catch (ParseException e) {
            // 不是类型开头, 交给表达式解析
            return StatementHead.OTHER;
        } finally {
            restore(saved);
        }
    }

    private NestedFunctionNode parseNestedFunction() {
        TypeNode returnType = voidToNull(parseType());
        Token name = consume(TokenType.IDENTIFIER, "nested function name");
        List<Parameter> params = parseParameters(false);
        BlockNode body = parseBlock();
        return new NestedFunctionNode(name.lexeme(), params, returnType, body, name.span());
    }

    /**
     * int x = 1;  int* p = 0;  隐式声明总是不可变的
     */
    private LetStatementNode parseImplicitDeclaration() {
        TypeNode type = parseType();
        while (true) {
            if (match(TokenType.STAR)) {
                type = new PointerTypeNode(type, true);
            } else if (match(TokenType.AMPERSAND)) {
                type = new ReferenceTypeNode(type, false);
            } else {
                break;
            }
        }
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        consume(TokenType.ASSIGN, "'='");
        ExpressionNode init = withDeclaredType(parseExpression(), type);
        consume(TokenType.SEMICOLON, "';' after declaration");
        return new LetStatementNode(name.lexeme(), type, init, false, name.span());
    }

    private record Declarator(Token name, TypeNode type, ExpressionNode init) {
    }

    /**
     * 关键字之后的两种写法: `x: int = 1` 和 `int x = 1`, 类型也可省略
     */
    private Declarator parseDeclarator(boolean requireInit) {
        Token name;
        TypeNode type = null;
        TokenType next = peekAt(1).type();
        if (check(TokenType.IDENTIFIER)
                && (next == TokenType.COLON || next == TokenType.ASSIGN || next == TokenType.SEMICOLON)) {
            name = advance();
            if (match(TokenType.COLON)) {
                type = parseType();
            }
        } else {
            type = parseType();
            name = consume(TokenType.IDENTIFIER, "variable name");
        }
        ExpressionNode init = null;
        if (requireInit) {
            consume(TokenType.ASSIGN, "'=' with a value");
            init = withDeclaredType(parseExpression(), type);
        } else if (match(TokenType.ASSIGN)) {
            init = withDeclaredType(parseExpression(), type);
        }
        consume(TokenType.SEMICOLON, "';' after declaration");
        return new Declarator(name, type, init);
    }

    private LetStatementNode parseLet() {
        consume(TokenType.LET, "'let'");
        Declarator d = parseDeclarator(false);
        return new LetStatementNode(d.name().lexeme(), d.type(), d.init(), false, d.name().span());
    }

    private VarStatementNode parseVar() {
        consume(TokenType.VAR, "'var'");
        Declarator d = parseDeclarator(false);
        return new VarStatementNode(d.name().lexeme(), d.type(), d.init(), d.name().span());
    }

    private ConstStatementNode parseConst() {
        consume(TokenType.CONST, "'const'");
        Declarator d = parseDeclarator(true);
        return new ConstStatementNode(d.name().lexeme(), d.type(), d.init(), d.name().span());
    }

    // 未写类型的结构体初始化 { .x = 1 } 使用声明上的类型
    private ExpressionNode withDeclaredType(ExpressionNode init, TypeNode declared) {
        if (declared != null && init instanceof StructInitNode structInit
                && structInit.type() instanceof AutoTypeNode) {
            return structInit.withType(declared);
        }
        return init;
    }

    private IfStatementNode parseIf() {
        consume(TokenType.IF, "'if'");
        ExpressionNode condition = parseCondition();
        BlockNode thenBlock = parseBlock();
        BlockNode elseBlock = null;
        if (match(TokenType.ELSE)) {
            if (check(TokenType.IF)) {
                elseBlock = BlockNode.of(parseIf());
            } else {
                elseBlock = parseBlock();
            }
        }
        return new IfStatementNode(condition, thenBlock, elseBlock);
    }

    private ExpressionNode parseCondition() {
        consume(TokenType.LPAREN, "'(' before condition");
        ExpressionNode condition = parseExpression();
        consume(TokenType.RPAREN, "')' after condition");
        return condition;
    }

    private StatementNode parseLoop(String label) {
        if (match(TokenType.WHILE)) {
            ExpressionNode condition = parseCondition();
            return new WhileStatementNode(label, condition, parseBlock());
        }
        if (match(TokenType.LOOP)) {
            return new WhileStatementNode(label, LiteralNode.ofBool(true), parseBlock());
        }
        if (match(TokenType.FOR)) {
            return parseFor(label);
        }
        throw new ParseException(peek().span(), "Expected a loop after label", List.of("while", "loop", "for"),
                peek().describe());
    }

    private StatementNode parseFor(String label) {
        consume(TokenType.LPAREN, "'(' after 'for'");
        if (check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.IN) {
            Token variable = advance();
            advance();
            ExpressionNode iterable = parseExpression();
            consume(TokenType.RPAREN, "')' after for-in header");
            return new ForInStatementNode(label, variable.lexeme(), iterable, parseBlock(), variable.span());
        }

        StatementNode init = null;
        if (!match(TokenType.SEMICOLON)) {
            init = parseStatement();
        }
        ExpressionNode condition = check(TokenType.SEMICOLON) ? LiteralNode.ofBool(true) : parseExpression();
        consume(TokenType.SEMICOLON, "';' after loop condition");
        ExpressionNode increment = check(TokenType.RPAREN) ? null : parseExpression();
        consume(TokenType.RPAREN, "')' after for header");
        return new ForStatementNode(label, init, condition, increment, parseBlock());
    }

    private SwitchStatementNode parseSwitch() {
        consume(TokenType.SWITCH, "'switch'");
        ExpressionNode subject = parseCondition();
        consume(TokenType.LBRACE, "'{' after switch");
        List<SwitchCaseNode> cases = new ArrayList<>();
        BlockNode defaultBlock = null;
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            if (match(TokenType.CASE)) {
                List<ExpressionNode> values = new ArrayList<>();
                do {
                    values.add(parseTernary());
                } while (match(TokenType.COMMA));
                consume(TokenType.COLON, "':' after case values");
                cases.add(new SwitchCaseNode(values, parseCaseBody()));
            } else if (match(TokenType.DEFAULT)) {
                consume(TokenType.COLON, "':' after 'default'");
                defaultBlock = parseCaseBody();
            } else {
                throw new ParseException(peek().span(), "Expected a switch arm", List.of("case", "default"),
                        peek().describe());
            }
        }
        consume(TokenType.RBRACE, "'}' to close the switch");
        return new SwitchStatementNode(subject, cases, defaultBlock);
    }

    // case 体可以是一个块, 也可以是直到下一个 case/default 的语句序列
    private BlockNode parseCaseBody() {
        if (check(TokenType.LBRACE)) {
            return parseBlock();
        }
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.CASE) && !check(TokenType.DEFAULT) && !check(TokenType.RBRACE) && !isAtEnd()) {
            statements.add(parseStatement());
        }
        return new BlockNode(statements);
    }

    private ReturnStatementNode parseReturn() {
        Token keyword = consume(TokenType.RETURN, "'return'");
        ExpressionNode value = check(TokenType.SEMICOLON) ? null : parseExpression();
        consume(TokenType.SEMICOLON, "';' after return");
        return new ReturnStatementNode(value, keyword.span());
    }

    private StatementNode parseBreakOrContinue() {
        Token keyword = advance();
        String label = null;
        if (match(TokenType.DOT)) {
            label = consume(TokenType.IDENTIFIER, "label name").lexeme();
        } else if (check(TokenType.IDENTIFIER)) {
            label = advance().lexeme();
        }
        consume(TokenType.SEMICOLON, "';' after " + keyword.lexeme());
        return keyword.type() == TokenType.BREAK
                ? new BreakStatementNode(label, keyword.span())
                : new ContinueStatementNode(label, keyword.span());
    }

    // ==================== 表达式 ====================

    public ExpressionNode parseExpression() {
        return parseAssignment();
    }

    private ExpressionNode parseAssignment() {
        ExpressionNode left = parseTernary();
        BinaryOperator operator = ASSIGNMENT_OPERATORS.get(peek().type());
        if (operator != null) {
            advance();
            // 右结合
            ExpressionNode right = parseAssignment();
            return new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseTernary() {
        ExpressionNode condition = parseRange();
        if (match(TokenType.QUESTION)) {
            ExpressionNode thenExpression = parseExpression();
            consume(TokenType.COLON, "':' in conditional expression");
            ExpressionNode elseExpression = parseTernary();
            return new TernaryExpressionNode(condition, thenExpression, elseExpression);
        }
        return condition;
    }

    private ExpressionNode parseRange() {
        ExpressionNode start = null;
        if (!check(TokenType.DOT_DOT) && !check(TokenType.DOT_DOT_EQUAL)) {
            start = parseBinary(0);
        }
        if (check(TokenType.DOT_DOT) || check(TokenType.DOT_DOT_EQUAL)) {
            boolean inclusive = advance().type() == TokenType.DOT_DOT_EQUAL;
            ExpressionNode end = startsExpression() ? parseBinary(0) : null;
            return new RangeExpressionNode(start, end, inclusive);
        }
        return start;
    }

    // 从低到高的二元运算优先级
    private static final List<Set<TokenType>> PRECEDENCE = List.of(
            Set.of(TokenType.OR_OR),
            Set.of(TokenType.AND_AND),
            Set.of(TokenType.PIPE),
            Set.of(TokenType.CARET),
            Set.of(TokenType.AMPERSAND),
            Set.of(TokenType.EQUAL_EQUAL, TokenType.NOT_EQUAL),
            Set.of(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL),
            Set.of(TokenType.SHIFT_LEFT, TokenType.SHIFT_RIGHT),
            Set.of(TokenType.PLUS, TokenType.MINUS),
            Set.of(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)
    );

    private ExpressionNode parseBinary(int level) {
        if (level == PRECEDENCE.size()) {
            return parseUnary();
        }
        ExpressionNode left = parseBinary(level + 1);
        while (PRECEDENCE.get(level).contains(peek().type())) {
            BinaryOperator operator = BINARY_OPERATORS.get(advance().type());
            ExpressionNode right = parseBinary(level + 1);
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.BANG)) return new UnaryExpressionNode(UnaryOperator.NOT, parseUnary());
        if (match(TokenType.MINUS)) return new UnaryExpressionNode(UnaryOperator.NEG, parseUnary());
        if (match(TokenType.TILDE)) return new UnaryExpressionNode(UnaryOperator.BIT_NOT, parseUnary());
        if (match(TokenType.STAR)) return new UnaryExpressionNode(UnaryOperator.DEREF, parseUnary());
        if (match(TokenType.PLUS_PLUS)) return new UnaryExpressionNode(UnaryOperator.PRE_INC, parseUnary());
        if (match(TokenType.MINUS_MINUS)) return new UnaryExpressionNode(UnaryOperator.PRE_DEC, parseUnary());
        if (match(TokenType.AMPERSAND)) {
            UnaryOperator operator = match(TokenType.VAR) || match(TokenType.MUT) ? UnaryOperator.REF_MUT : UnaryOperator.REF;
            return new UnaryExpressionNode(operator, parseUnary());
        }
        return parsePostfix();
    }

    private ExpressionNode parsePostfix() {
        ExpressionNode expression = parsePrimary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                List<ExpressionNode> arguments = parseArguments(TokenType.RPAREN);
                if (expression instanceof FieldAccessNode access) {
                    expression = new MethodCallNode(access.target(), access.field(), arguments);
                } else {
                    expression = new CallExpressionNode(expression, arguments);
                }
            } else if (match(TokenType.LBRACKET)) {
                ExpressionNode index = parseExpression();
                consume(TokenType.RBRACKET, "']' after index");
                expression = new IndexExpressionNode(expression, index);
            } else if (match(TokenType.DOT)) {
                if (check(TokenType.INT_LITERAL)) {
                    expression = new FieldAccessNode(expression, advance().lexeme());
                } else {
                    expression = new FieldAccessNode(expression, consume(TokenType.IDENTIFIER, "field name").lexeme());
                }
            } else if (match(TokenType.ARROW)) {
                String field = consume(TokenType.IDENTIFIER, "field name after '->'").lexeme();
                expression = new FieldAccessNode(new UnaryExpressionNode(UnaryOperator.DEREF, expression), field);
            } else if (match(TokenType.PLUS_PLUS)) {
                expression = new UnaryExpressionNode(UnaryOperator.POST_INC, expression);
            } else if (match(TokenType.MINUS_MINUS)) {
                expression = new UnaryExpressionNode(UnaryOperator.POST_DEC, expression);
            } else {
                return expression;
            }
        }
    }

    private List<ExpressionNode> parseArguments(TokenType close) {
        List<ExpressionNode> arguments = new ArrayList<>();
        while (!check(close)) {
            arguments.add(parseExpression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(close, "'" + closeLexeme(close) + "' after arguments");
        return arguments;
    }

    private ExpressionNode parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case INT_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.INT, token.lexeme());
            case FLOAT_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.FLOAT, token.lexeme());
            case STRING_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.STRING, token.lexeme());
            case CHAR_LITERAL:
                advance();
                return new LiteralNode(LiteralNode.Kind.CHAR, token.lexeme());
            case TRUE:
            case FALSE:
                advance();
                return new LiteralNode(LiteralNode.Kind.BOOL, token.lexeme());
            case NULL:
                advance();
                return LiteralNode.nullLiteral();
            case SIZEOF: {
                advance();
                consume(TokenType.LPAREN, "'(' after sizeof");
                TypeNode type = parseType();
                consume(TokenType.RPAREN, "')' after sizeof type");
                return new SizeofExpressionNode(type);
            }
            case AT:
                return parseTypeScopedCall();
            case LBRACKET:
                return parseArrayLiteral();
            case LBRACE:
                if (peekAt(1).type() == TokenType.DOT || peekAt(1).type() == TokenType.RBRACE) {
                    return parseStructInitBody(new AutoTypeNode(), token);
                }
                break;
            case LPAREN:
                return parseParenthesized();
            case IDENTIFIER:
                if (MacroRegistry.isMacroName(token.lexeme())) {
                    return parseMacroInvocation();
                }
                advance();
                return new IdentifierNode(token.lexeme(), token.span());
            default:
                break;
        }
        throw new ParseException(token, "an expression");
    }

    /**
     * 括号组的消解: 先在检查点上试探 `Type )`, 成功则为类型转换;
     * 否则回到检查点按表达式解析, 顶层出现逗号时为元组字面量。
     */
    private ExpressionNode parseParenthesized() {
        Token open = consume(TokenType.LPAREN, "'('");
        TypeNode castType = tryParseCastType();
        if (castType != null) {
            if (check(TokenType.LBRACE)) {
                return parseStructInitBody(castType, open);
            }
            return new CastExpressionNode(parseUnary(), castType);
        }

        if (match(TokenType.RPAREN)) {
            return new TupleLiteralNode(List.of());
        }
        ExpressionNode first = parseExpression();
        if (match(TokenType.COMMA)) {
            List<ExpressionNode> elements = new ArrayList<>();
            elements.add(first);
            while (!check(TokenType.RPAREN)) {
                elements.add(parseExpression());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RPAREN, "')' to close the tuple");
            return new TupleLiteralNode(elements);
        }
        consume(TokenType.RPAREN, "')' to close the expression");
        return first;
    }

    /**
     * 成功时消耗 `Type )` 并返回类型; 失败时恢复到检查点并返回 null
     */
    private TypeNode tryParseCastType() {
        if (!startsType()) {
            return null;
        }
        Checkpoint checkpoint = checkpoint();
        try {
            TypeNode type = parseType();
            if (!check(TokenType.RPAREN)) {
                restore(checkpoint);
                return null;
            }
            advance();
            // (x) 这类只含标识符的括号也可能是普通表达式, 需要看后面是否跟着操作数
            if (!isRootedInPrimitive(type) && !CAST_OPERAND_START.contains(peek().type())) {
                restore(checkpoint);
                return null;
            }
            return type;
        } catch (ParseException e) {
            restore(checkpoint);
            return null;
        }
    }

    private boolean isRootedInPrimitive(TypeNode type) {
        if (type instanceof PrimitiveTypeNode) {
            return true;
        }
        if (type instanceof PointerTypeNode pointer) {
            return isRootedInPrimitive(pointer.target());
        }
        if (type instanceof ReferenceTypeNode reference) {
            return isRootedInPrimitive(reference.target());
        }
        if (type instanceof ArrayTypeNode array) {
            return isRootedInPrimitive(array.element());
        }
        if (type instanceof TupleTypeNode tuple) {
            return !tuple.elements().isEmpty() && tuple.elements().stream().allMatch(this::isRootedInPrimitive);
        }
        return false;
    }

    private StructInitNode parseStructInitBody(TypeNode type, Token start) {
        consume(TokenType.LBRACE, "'{' to start the initializer");
        List<FieldInitNode> fields = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            consume(TokenType.DOT, "'.' before field name");
            String field = consume(TokenType.IDENTIFIER, "field name").lexeme();
            consume(TokenType.ASSIGN, "'=' after field name");
            fields.add(new FieldInitNode(field, parseExpression()));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        Token close = consume(TokenType.RBRACE, "'}' to close the initializer");
        return new StructInitNode(type, fields, start.span().to(close.span()));
    }

    private ExpressionNode parseArrayLiteral() {
        consume(TokenType.LBRACKET, "'['");
        if (match(TokenType.RBRACKET)) {
            return new ArrayLiteralNode(List.of());
        }
        ExpressionNode first = parseExpression();
        if (match(TokenType.SEMICOLON)) {
            ExpressionNode count = parseExpression();
            consume(TokenType.RBRACKET, "']' after array length");
            return new ArrayRepeatNode(first, count);
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA) && !check(TokenType.RBRACKET)) {
            elements.add(parseExpression());
        }
        consume(TokenType.RBRACKET, "']' to close the array");
        return new ArrayLiteralNode(elements);
    }

    /**
     * @Type.method(args)  或  @Type(G1, G2).method(args)
     */
    private ExpressionNode parseTypeScopedCall() {
        Token at = consume(TokenType.AT, "'@'");
        TypeNode type = parseBaseType();
        List<TypeNode> generics = null;
        if (match(TokenType.LPAREN)) {
            generics = new ArrayList<>();
            do {
                generics.add(parseType());
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "')' after generic arguments");
        }
        consume(TokenType.DOT, "'.' before method name");
        String method = consume(TokenType.IDENTIFIER, "method name").lexeme();
        consume(TokenType.LPAREN, "'(' after method name");
        List<ExpressionNode> arguments = parseArguments(TokenType.RPAREN);
        Span span = at.span().to(previous().span());
        if (generics != null) {
            return new ExplicitGenericCallNode(type, generics, method, arguments, span);
        }
        return new TypeScopedCallNode(type, method, arguments, span);
    }

    /**
     * 宏调用. 只有已注册的宏才检查括号种类; 未注册的名字不报错 (允许先用后定义)
     */
    private ExpressionNode parseMacroInvocation() {
        Token name = advance();
        MacroDelimiter used = openingDelimiter(peek().type());
        MacroRegistryEntry entry = macroRegistry.lookup(name.lexeme()).orElse(null);

        if (entry != null && entry.delimiter() != used) {
            throw new ParseException(peek().span(),
                    "macro '" + name.lexeme() + "' is defined with " + entry.delimiter().displayName()
                            + " but invoked with " + used.displayName(),
                    List.of(entry.delimiter().displayName()), used.displayName());
        }
        if (used == MacroDelimiter.NONE) {
            if (entry == null) {
                return new IdentifierNode(name.lexeme(), name.span());
            }
            return new MacroCallNode(name.lexeme(), MacroDelimiter.NONE, List.of(), name.span());
        }
        advance();
        List<ExpressionNode> arguments = parseArguments(closingToken(used));
        return new MacroCallNode(name.lexeme(), used, arguments, name.span().to(previous().span()));
    }

    // ==================== 类型 ====================

    public TypeNode parseType() {
        if (match(TokenType.AMPERSAND)) {
            boolean mutable = match(TokenType.VAR) || match(TokenType.MUT);
            return new ReferenceTypeNode(parseType(), mutable);
        }
        TypeNode type = parseBaseType();
        if (type instanceof NamedTypeNode && match(TokenType.LESS)) {
            List<TypeNode> arguments = new ArrayList<>();
            do {
                arguments.add(parseType());
            } while (match(TokenType.COMMA));
            consumeClosingAngle();
            type = new GenericTypeNode(type, arguments);
        }
        while (true) {
            if (match(TokenType.STAR)) {
                type = new PointerTypeNode(type, true);
            } else if (check(TokenType.LBRACKET)
                    && (peekAt(1).type() == TokenType.RBRACKET || peekAt(1).type() == TokenType.INT_LITERAL)
                    && !(peekAt(1).type() == TokenType.INT_LITERAL && peekAt(2).type() != TokenType.RBRACKET)) {
                advance();
                Integer size = null;
                if (check(TokenType.INT_LITERAL)) {
                    size = (int) integerValue(advance(), Integer.MAX_VALUE);
                }
                consume(TokenType.RBRACKET, "']' in array type");
                type = new ArrayTypeNode(type, size);
            } else {
                return type;
            }
        }
    }

    private long integerValue(Token literal, long max) {
        try {
            long value = Long.parseLong(literal.lexeme());
            if (value <= max) {
                return value;
            }
        } catch (NumberFormatException e) {
            // 超出 long 的范围, 按越界处理
        }
        throw new ParseException(literal, "an integer in range (at most " + max + ")");
    }

    private TypeNode parseBaseType() {
        Token token = peek();
        PrimitiveKind primitive = PRIMITIVES.get(token.type());
        if (primitive != null) {
            advance();
            return new PrimitiveTypeNode(primitive);
        }
        if (match(TokenType.AUTO)) {
            return new AutoTypeNode();
        }
        if (match(TokenType.IDENTIFIER)) {
            return new NamedTypeNode(token.lexeme());
        }
        if (match(TokenType.LPAREN)) {
            List<TypeNode> elements = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do {
                    elements.add(parseType());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "')' to close the tuple type");
            return new TupleTypeNode(elements);
        }
        throw new ParseException(token, "a type");
    }

    // Vec<Vec<int>> 中的 '>>' 需要拆成两个 '>'
    private void consumeClosingAngle() {
        if (check(TokenType.SHIFT_RIGHT)) {
            Token shift = peek();
            Span first = Span.of(shift.line(), shift.column(), shift.line(), shift.column() + 1);
            Span second = Span.of(shift.line(), shift.column() + 1, shift.span().end().line(), shift.span().end().column());
            splits.push(new TokenSplit(position, shift));
            tokens.set(position, new Token(TokenType.GREATER, ">", first));
            tokens.add(position + 1, new Token(TokenType.GREATER, ">", second));
        }
        consume(TokenType.GREATER, "'>' to close the generic arguments");
    }

    private TypeNode voidToNull(TypeNode type) {
        return type instanceof PrimitiveTypeNode primitive && primitive.isVoid() ? null : type;
    }

    // ==================== 辅助方法 ====================

    private Checkpoint checkpoint() {
        return new Checkpoint(position, splits.size());
    }

    private void restore(Checkpoint checkpoint) {
        while (splits.size() > checkpoint.splitCount()) {
            TokenSplit split = splits.pop();
            tokens.remove(split.index() + 1);
            tokens.set(split.index(), split.original());
        }
        position = checkpoint.position();
    }

    private boolean startsType() {
        TokenType type = peek().type();
        return type.isPrimitiveType() || type == TokenType.IDENTIFIER || type == TokenType.AUTO;
    }

    private boolean startsExpression() {
        return switch (peek().type()) {
            case SEMICOLON, RPAREN, RBRACKET, RBRACE, COMMA, COLON, EOF -> false;
            default -> true;
        };
    }

    private boolean isSelf(Token token) {
        return token.type() == TokenType.IDENTIFIER && "self".equals(token.lexeme());
    }

    private boolean directlyFollows(Token first, Token second) {
        return first.span().end().equals(second.span().start());
    }

    private MacroDelimiter openingDelimiter(TokenType type) {
        return switch (type) {
            case LPAREN -> MacroDelimiter.PARENS;
            case LBRACKET -> MacroDelimiter.BRACKETS;
            case LBRACE -> MacroDelimiter.BRACES;
            default -> MacroDelimiter.NONE;
        };
    }

    private TokenType closingToken(MacroDelimiter delimiter) {
        return switch (delimiter) {
            case PARENS -> TokenType.RPAREN;
            case BRACKETS -> TokenType.RBRACKET;
            case BRACES -> TokenType.RBRACE;
            case NONE -> throw new IllegalArgumentException("no closing token for " + delimiter);
        };
    }

    private String closeLexeme(TokenType type) {
        return switch (type) {
            case RPAREN -> ")";
            case RBRACKET -> "]";
            case RBRACE -> "}";
            default -> type.name();
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

    private Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) {
            return type == TokenType.EOF;
        }
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            position++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAt(int offset) {
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
