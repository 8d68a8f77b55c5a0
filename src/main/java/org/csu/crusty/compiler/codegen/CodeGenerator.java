package org.csu.crusty.compiler.codegen;

import org.csu.crusty.common.exception.CodeGenException;
import org.csu.crusty.compiler.lexer.Token;
import org.csu.crusty.compiler.lexer.TokenType;
import org.csu.crusty.compiler.parser.MacroRegistry;
import org.csu.crusty.compiler.parser.ast.*;
import org.csu.crusty.compiler.parser.ast.expression.*;
import org.csu.crusty.compiler.parser.ast.item.*;
import org.csu.crusty.compiler.parser.ast.statement.*;
import org.csu.crusty.compiler.parser.ast.type.*;
import org.csu.crusty.compiler.semantic.AnalysisResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 代码生成器
 * 一次遍历AST同时服务两种目标方言, 只在叶子上根据 TargetLanguage 选择输出。
 * 对 Rust 目标: 嵌套函数变为闭包, C 风格 for 循环、自增自减、switch 被降级为等价结构。
 * 对 Crusty 目标: 原样输出 C 风格语法, 用于格式化。
 */
public class CodeGenerator {

    private static final Logger LOG = Logger.getLogger(CodeGenerator.class.getName());

    private static final String DEFAULT_INDENT = "    ";

    private static final Set<String> RUST_KEYWORDS = Set.of(
            "as", "break", "const", "continue", "crate", "else", "enum", "extern", "false", "fn", "for", "if",
            "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref", "return", "self", "static",
            "struct", "super", "trait", "true", "type", "unsafe", "use", "where", "while", "async", "await", "dyn"
    );

    private final TargetLanguage target;
    private final AnalysisResult analysis;
    private final String indentUnit;

    private final StringBuilder out = new StringBuilder();
    private int indentLevel = 0;
    // 枚举成员名 -> 枚举名, Rust 中需要写成 Enum::Variant
    private final Map<String, String> enumVariants = new HashMap<>();

    public CodeGenerator(TargetLanguage target) {
        this(target, null, DEFAULT_INDENT);
    }

    public CodeGenerator(TargetLanguage target, AnalysisResult analysis) {
        this(target, analysis, DEFAULT_INDENT);
    }

    /**
     * @param analysis 捕获分析结果, 可以为 null; 为 null 时可变性按声明关键字决定
     */
    public CodeGenerator(TargetLanguage target, AnalysisResult analysis, String indentUnit) {
        this.target = target;
        this.analysis = analysis;
        this.indentUnit = indentUnit;
    }

    public String generate(CrustyFile file) {
        out.setLength(0);
        indentLevel = 0;
        enumVariants.clear();
        for (ItemNode item : file.items()) {
            if (item instanceof EnumNode enumNode) {
                enumNode.variants().forEach(v -> enumVariants.put(v.name(), enumNode.name()));
            }
        }

        List<ItemNode> items = file.items();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            generateItem(items.get(i));
        }
        LOG.fine(() -> "Generated " + out.length() + " characters of " + target.id() + " code");
        return out.toString();
    }

    private boolean isRust() {
        return target == TargetLanguage.RUST;
    }

    // ==================== 顶层条目 ====================

    private void generateItem(ItemNode item) {
        if (item instanceof FunctionNode function) {
            generateFunction(function);
        } else if (item instanceof StructNode struct) {
            generateStruct(struct);
        } else if (item instanceof EnumNode enumNode) {
            generateEnum(enumNode);
        } else if (item instanceof TypedefNode typedef) {
            if (isRust()) {
                line(visibilityPrefix(typedef.visibility()) + "type " + typedef.name() + " = "
                        + type(typedef.target()) + ";");
            } else {
                line("typedef " + type(typedef.target()) + " " + typedef.name() + ";");
            }
        } else if (item instanceof MacroDefinitionNode macro) {
            generateMacroDefinition(macro);
        } else {
            throw new CodeGenException("Unsupported item: " + item.getClass().getSimpleName());
        }
    }

    private void generateFunction(FunctionNode function) {
        attributes(function.attributes());
        String params = function.params().stream().map(this::parameter).collect(Collectors.joining(", "));
        if (isRust()) {
            String ret = function.returnType() == null ? "" : " -> " + type(function.returnType());
            line(visibilityPrefix(function.visibility()) + "fn " + function.name() + "(" + params + ")" + ret + " {");
        } else {
            String prefix = function.visibility() == Visibility.PRIVATE ? "static " : "";
            line(prefix + returnType(function.returnType()) + " " + function.name() + "(" + params + ") {");
        }
        body(function.body());
        line("}");
    }

    private void generateStruct(StructNode struct) {
        attributes(struct.attributes());
        if (isRust()) {
            line(visibilityPrefix(struct.visibility()) + "struct " + struct.name() + " {");
            indentLevel++;
            for (FieldNode field : struct.fields()) {
                attributes(field.attributes());
                line(visibilityPrefix(field.visibility()) + field.name() + ": " + type(field.type()) + ",");
            }
            indentLevel--;
            line("}");
            if (!struct.methods().isEmpty()) {
                out.append('\n');
                line("impl " + struct.name() + " {");
                indentLevel++;
                generateMethods(struct.methods());
                indentLevel--;
                line("}");
            }
            return;
        }

        line("struct " + struct.name() + " {");
        indentLevel++;
        for (FieldNode field : struct.fields()) {
            attributes(field.attributes());
            line(type(field.type()) + " " + field.name() + ";");
        }
        if (!struct.fields().isEmpty() && !struct.methods().isEmpty()) {
            out.append('\n');
        }
        generateMethods(struct.methods());
        indentLevel--;
        line("}");
    }

    private void generateMethods(List<FunctionNode> methods) {
        for (int i = 0; i < methods.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            generateFunction(methods.get(i));
        }
    }

    private void generateEnum(EnumNode enumNode) {
        attributes(enumNode.attributes());
        line((isRust() ? visibilityPrefix(enumNode.visibility()) : "") + "enum " + enumNode.name() + " {");
        indentLevel++;
        for (EnumVariantNode variant : enumNode.variants()) {
            line(variant.name() + " = " + variant.value() + ",");
        }
        indentLevel--;
        line("}");
    }

    // 两种目标语言的属性写法相同
    private void attributes(List<AttributeNode> attributes) {
        for (AttributeNode attribute : attributes) {
            if (attribute.arguments().isEmpty()) {
                line("#[" + attribute.name() + "]");
                continue;
            }
            String arguments = attribute.arguments().stream()
                    .map(this::attributeArgument)
                    .collect(Collectors.joining(", "));
            line("#[" + attribute.name() + "(" + arguments + ")]");
        }
    }

    private String attributeArgument(AttributeNode.Argument argument) {
        if (argument.value() == null) {
            return argument.name();
        }
        String value = literal(argument.value());
        return argument.name() == null ? value : argument.name() + " = " + value;
    }

    private void generateMacroDefinition(MacroDefinitionNode macro) {
        if (!isRust()) {
            String params = macro.delimiter() == MacroDelimiter.NONE ? ""
                    : macro.delimiter().open() + String.join(", ", macro.params()) + macro.delimiter().close();
            String body = joinTokens(macro.body(), Set.of());
            line("#define " + macro.name() + params + (body.isEmpty() ? "" : " " + body));
            return;
        }
        String pattern = macro.params().stream().map(p -> "$" + p + ":expr").collect(Collectors.joining(", "));
        line("macro_rules! " + rustMacroName(macro.name()) + " {");
        indentLevel++;
        line("(" + pattern + ") => {");
        indentLevel++;
        String body = joinTokens(macro.body(), Set.copyOf(macro.params()));
        if (!body.isEmpty()) {
            line(body);
        }
        indentLevel--;
        line("};");
        indentLevel--;
        line("}");
    }

    /**
     * __MAX__ -> max; Rust 关键字加 _macro 后缀
     */
    static String rustMacroName(String name) {
        String stripped = name;
        if (MacroRegistry.hasMacroPrefix(stripped)) {
            stripped = stripped.substring(2);
        }
        if (stripped.length() > 2 && stripped.endsWith("__")) {
            stripped = stripped.substring(0, stripped.length() - 2);
        }
        stripped = stripped.toLowerCase();
        return RUST_KEYWORDS.contains(stripped) ? stripped + "_macro" : stripped;
    }

    private String joinTokens(List<Token> tokens, Set<String> params) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && needsSpace(previous, token)) {
                sb.append(' ');
            }
            sb.append(macroToken(token, params));
            previous = token;
        }
        return sb.toString();
    }

    private boolean needsSpace(Token previous, Token current) {
        switch (current.type()) {
            case RPAREN:
            case RBRACKET:
            case COMMA:
            case SEMICOLON:
            case DOT:
                return false;
            case LPAREN:
            case LBRACKET:
                return previous.type() != TokenType.IDENTIFIER && previous.type() != TokenType.RPAREN
                        && previous.type() != TokenType.LPAREN;
            default:
                break;
        }
        return switch (previous.type()) {
            case LPAREN, LBRACKET, DOT, BANG, TILDE -> false;
            default -> true;
        };
    }

    private String macroToken(Token token, Set<String> params) {
        switch (token.type()) {
            case STRING_LITERAL:
                return "\"" + escape(token.lexeme(), '"') + "\"";
            case CHAR_LITERAL:
                return "'" + escape(token.lexeme(), '\'') + "'";
            case IDENTIFIER:
                if (!isRust()) {
                    return token.lexeme();
                }
                if (params.contains(token.lexeme())) {
                    return "$" + token.lexeme();
                }
                if (MacroRegistry.isMacroName(token.lexeme())) {
                    return rustMacroName(token.lexeme()) + "!";
                }
                return token.lexeme();
            case NULL:
                return isRust() ? "Option::None" : "NULL";
            default:
                if (isRust() && token.type().isPrimitiveType()) {
                    return primitiveKindOf(token.type()).rustName();
                }
                return token.lexeme();
        }
    }

    private PrimitiveKind primitiveKindOf(TokenType type) {
        return PrimitiveKind.valueOf(type.name());
    }

    // ==================== 语句 ====================

    private void body(BlockNode block) {
        indentLevel++;
        for (StatementNode statement : block.statements()) {
            statement(statement);
        }
        indentLevel--;
    }

    private void statement(StatementNode statement) {
        if (statement instanceof LetStatementNode let) {
            boolean mutable = analysis != null ? analysis.requiresMutable(let) : let.mutable();
            declaration(isRust() ? "let" : (let.mutable() ? "var" : "let"), mutable, let.name(), let.type(), let.init());
        } else if (statement instanceof VarStatementNode varStatement) {
            boolean mutable = analysis == null || analysis.requiresMutable(varStatement);
            declaration(isRust() ? "let" : "var", mutable, varStatement.name(), varStatement.type(),
                    varStatement.init());
        } else if (statement instanceof ConstStatementNode constant) {
            generateConst(constant);
        } else if (statement instanceof ExpressionStatementNode expressionStatement) {
            line(expression(expressionStatement.expression()) + ";");
        } else if (statement instanceof ReturnStatementNode returnStatement) {
            line(returnStatement.value() == null ? "return;" : "return " + expression(returnStatement.value()) + ";");
        } else if (statement instanceof IfStatementNode ifStatement) {
            generateIf(ifStatement, "");
        } else if (statement instanceof WhileStatementNode whileStatement) {
            generateWhile(whileStatement);
        } else if (statement instanceof ForStatementNode forStatement) {
            generateFor(forStatement);
        } else if (statement instanceof ForInStatementNode forIn) {
            String header = isRust()
                    ? "for " + forIn.variable() + " in " + bare(forIn.iterable())
                    : "for (" + forIn.variable() + " in " + bare(forIn.iterable()) + ")";
            line(labelPrefix(forIn.label()) + header + " {");
            body(forIn.body());
            line("}");
        } else if (statement instanceof SwitchStatementNode switchStatement) {
            generateSwitch(switchStatement);
        } else if (statement instanceof BreakStatementNode breakStatement) {
            line("break" + labelSuffix(breakStatement.label()) + ";");
        } else if (statement instanceof ContinueStatementNode continueStatement) {
            line("continue" + labelSuffix(continueStatement.label()) + ";");
        } else if (statement instanceof NestedFunctionNode nested) {
            generateNestedFunction(nested);
        } else if (statement instanceof BlockNode block) {
            line("{");
            body(block);
            line("}");
        } else {
            throw new CodeGenException("Unsupported statement: " + statement.getClass().getSimpleName());
        }
    }

    private void declaration(String keyword, boolean mutable, String name, TypeNode type, ExpressionNode init) {
        line(declarationText(keyword, mutable, name, type, init) + ";");
    }

    private String declarationText(String keyword, boolean mutable, String name, TypeNode type, ExpressionNode init) {
        StringBuilder sb = new StringBuilder(keyword).append(' ');
        if (isRust() && mutable) {
            sb.append("mut ");
        }
        sb.append(name);
        if (type != null && !(isRust() && type instanceof AutoTypeNode)) {
            sb.append(": ").append(type(type));
        }
        if (init != null) {
            sb.append(" = ").append(expression(init));
        }
        return sb.toString();
    }

    private void generateConst(ConstStatementNode constant) {
        TypeNode type = constant.type();
        if (type == null && constant.value() instanceof LiteralNode literal) {
            type = literalType(literal);
        }
        if (isRust() && type == null) {
            // Rust 的 const 必须写类型, 推断不出时退化为不可变 let
            line("let " + constant.name() + " = " + expression(constant.value()) + ";");
            return;
        }
        line(declarationText("const", false, constant.name(), type, constant.value()) + ";");
    }

    private TypeNode literalType(LiteralNode literal) {
        return switch (literal.kind()) {
            case INT -> PrimitiveTypeNode.of(PrimitiveKind.INT);
            case FLOAT -> PrimitiveTypeNode.of(PrimitiveKind.FLOAT);
            case BOOL -> PrimitiveTypeNode.of(PrimitiveKind.BOOL);
            case CHAR -> PrimitiveTypeNode.of(PrimitiveKind.CHAR);
            case STRING -> isRust() ? new ReferenceTypeNode(new NamedTypeNode("str"), false) : null;
            default -> null;
        };
    }

    private void generateIf(IfStatementNode ifStatement, String prefix) {
        String condition = isRust() ? bare(ifStatement.condition()) : "(" + bare(ifStatement.condition()) + ")";
        line(prefix + "if " + condition + " {");
        body(ifStatement.thenBlock());
        BlockNode elseBlock = ifStatement.elseBlock();
        if (elseBlock == null) {
            line("}");
        } else if (elseBlock.statements().size() == 1 && elseBlock.statements().get(0) instanceof IfStatementNode elseIf) {
            generateIf(elseIf, "} else ");
        } else {
            line("} else {");
            body(elseBlock);
            line("}");
        }
    }

    private void generateWhile(WhileStatementNode whileStatement) {
        String header;
        if (isTrue(whileStatement.condition())) {
            header = "loop";
        } else if (isRust()) {
            header = "while " + bare(whileStatement.condition());
        } else {
            header = "while (" + bare(whileStatement.condition()) + ")";
        }
        line(labelPrefix(whileStatement.label()) + header + " {");
        body(whileStatement.body());
        line("}");
    }

    /**
     * Rust: ['label: ]{ init; loop { if !(cond) { break; } body; incr; } }
     */
    private void generateFor(ForStatementNode forStatement) {
        if (!isRust()) {
            String init = forStatement.init() == null ? ";" : inlineStatement(forStatement.init());
            String condition = forStatement.condition() == null ? "" : " " + bare(forStatement.condition());
            String increment = forStatement.increment() == null ? "" : " " + expression(forStatement.increment());
            line(labelPrefix(forStatement.label()) + "for (" + init + condition + ";" + increment + ") {");
            body(forStatement.body());
            line("}");
            return;
        }

        line(labelPrefix(forStatement.label()) + "{");
        indentLevel++;
        if (forStatement.init() != null) {
            forInit(forStatement.init());
        }
        line("loop {");
        indentLevel++;
        if (forStatement.condition() != null && !isTrue(forStatement.condition())) {
            line("if !(" + bare(forStatement.condition()) + ") { break; }");
        }
        for (StatementNode statement : forStatement.body().statements()) {
            statement(statement);
        }
        if (forStatement.increment() != null) {
            line(expression(forStatement.increment()) + ";");
        }
        indentLevel--;
        line("}");
        indentLevel--;
        line("}");
    }

    // 没有分析结果时, 循环变量总是需要可变
    private void forInit(StatementNode init) {
        if (analysis == null && init instanceof LetStatementNode let) {
            declaration("let", true, let.name(), let.type(), let.init());
        } else {
            statement(init);
        }
    }

    private String inlineStatement(StatementNode statement) {
        if (statement instanceof LetStatementNode let) {
            return declarationText(let.mutable() ? "var" : "let", false, let.name(), let.type(), let.init()) + ";";
        }
        if (statement instanceof VarStatementNode varStatement) {
            return declarationText("var", false, varStatement.name(), varStatement.type(), varStatement.init()) + ";";
        }
        if (statement instanceof ExpressionStatementNode expressionStatement) {
            return expression(expressionStatement.expression()) + ";";
        }
        throw new CodeGenException("Unsupported for-loop initializer: " + statement.getClass().getSimpleName());
    }

    private void generateSwitch(SwitchStatementNode switchStatement) {
        if (!isRust()) {
            line("switch (" + bare(switchStatement.subject()) + ") {");
            indentLevel++;
            for (SwitchCaseNode switchCase : switchStatement.cases()) {
                String values = switchCase.values().stream().map(this::bare).collect(Collectors.joining(", "));
                line("case " + values + ": {");
                body(switchCase.body());
                line("}");
            }
            if (switchStatement.defaultBlock() != null) {
                line("default: {");
                body(switchStatement.defaultBlock());
                line("}");
            }
            indentLevel--;
            line("}");
            return;
        }

        line("match " + bare(switchStatement.subject()) + " {");
        indentLevel++;
        for (SwitchCaseNode switchCase : switchStatement.cases()) {
            String patterns = switchCase.values().stream().map(this::bare).collect(Collectors.joining(" | "));
            line(patterns + " => {");
            body(withoutTrailingBreak(switchCase.body()));
            line("},");
        }
        line("_ => {");
        if (switchStatement.defaultBlock() != null) {
            body(withoutTrailingBreak(switchStatement.defaultBlock()));
        }
        line("},");
        indentLevel--;
        line("}");
    }

    // match 分支不会贯穿, C 风格分支末尾的 break 在 Rust 中是多余的
    private BlockNode withoutTrailingBreak(BlockNode block) {
        List<StatementNode> statements = block.statements();
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof BreakStatementNode last
                && last.label() == null) {
            return new BlockNode(statements.subList(0, statements.size() - 1));
        }
        return block;
    }

    /**
     * Rust: let name = |x: i32| -> i32 { ... };  可变捕获时闭包本身要声明为 mut
     */
    private void generateNestedFunction(NestedFunctionNode nested) {
        String params = nested.params().stream().map(this::parameter).collect(Collectors.joining(", "));
        if (!isRust()) {
            line(returnType(nested.returnType()) + " " + nested.name() + "(" + params + ") {");
            body(nested.body());
            line("}");
            return;
        }
        boolean mutable = analysis != null && analysis.hasMutableCapture(nested);
        String ret = nested.returnType() == null ? "" : " -> " + type(nested.returnType());
        line("let " + (mutable ? "mut " : "") + nested.name() + " = |" + params + "|" + ret + " {");
        body(nested.body());
        line("};");
    }

    private String parameter(Parameter param) {
        if (param.isSelf()) {
            if (param.type() instanceof ReferenceTypeNode reference) {
                if (reference.mutable()) {
                    return isRust() ? "&mut self" : "&var self";
                }
                return "&self";
            }
            return "self";
        }
        if (isRust()) {
            boolean mutable = analysis != null && analysis.requiresMutable(param);
            return (mutable ? "mut " : "") + param.name() + ": " + type(param.type());
        }
        return type(param.type()) + " " + param.name();
    }

    private String labelPrefix(String label) {
        if (label == null) {
            return "";
        }
        return (isRust() ? "'" : ".") + label + ": ";
    }

    private String labelSuffix(String label) {
        if (label == null) {
            return "";
        }
        return " " + (isRust() ? "'" : ".") + label;
    }

    private String visibilityPrefix(Visibility visibility) {
        return visibility == Visibility.PUBLIC ? "pub " : "";
    }

    private boolean isTrue(ExpressionNode expression) {
        return expression instanceof LiteralNode literal
                && literal.kind() == LiteralNode.Kind.BOOL && "true".equals(literal.value());
    }

    // ==================== 表达式 ====================

    /**
     * 顶层的二元表达式不加括号, 用于条件、初始化等位置
     */
    private String bare(ExpressionNode expression) {
        if (expression instanceof BinaryExpressionNode binary && !binary.operator().isAssignment()) {
            return expression(binary.left()) + " " + binary.operator().symbol() + " " + expression(binary.right());
        }
        return expression(expression);
    }

    private String expression(ExpressionNode expression) {
        if (expression instanceof LiteralNode literal) {
            return literal(literal);
        }
        if (expression instanceof IdentifierNode identifier) {
            String enumName = enumVariants.get(identifier.name());
            if (isRust() && enumName != null) {
                return enumName + "::" + identifier.name();
            }
            return identifier.name();
        }
        if (expression instanceof BinaryExpressionNode binary) {
            String text = expression(binary.left()) + " " + binary.operator().symbol() + " " + expression(binary.right());
            return binary.operator().isAssignment() ? text : "(" + text + ")";
        }
        if (expression instanceof UnaryExpressionNode unary) {
            return unary(unary);
        }
        if (expression instanceof CallExpressionNode call) {
            return postfixTarget(call.callee()) + "(" + arguments(call.arguments()) + ")";
        }
        if (expression instanceof MethodCallNode methodCall) {
            return postfixTarget(methodCall.receiver()) + "." + methodCall.method()
                    + "(" + arguments(methodCall.arguments()) + ")";
        }
        if (expression instanceof FieldAccessNode access) {
            if (!isRust() && access.target() instanceof UnaryExpressionNode unary
                    && unary.operator() == UnaryOperator.DEREF) {
                return postfixTarget(unary.operand()) + "->" + access.field();
            }
            return postfixTarget(access.target()) + "." + access.field();
        }
        if (expression instanceof IndexExpressionNode index) {
            return postfixTarget(index.target()) + "[" + bare(index.index()) + "]";
        }
        if (expression instanceof CastExpressionNode cast) {
            return isRust()
                    ? "(" + expression(cast.expression()) + " as " + type(cast.type()) + ")"
                    : "(" + type(cast.type()) + ")" + expression(cast.expression());
        }
        if (expression instanceof SizeofExpressionNode sizeof) {
            return isRust()
                    ? "std::mem::size_of::<" + type(sizeof.type()) + ">()"
                    : "sizeof(" + type(sizeof.type()) + ")";
        }
        if (expression instanceof TernaryExpressionNode ternary) {
            return isRust()
                    ? "if " + bare(ternary.condition()) + " { " + bare(ternary.thenExpression())
                    + " } else { " + bare(ternary.elseExpression()) + " }"
                    : "(" + bare(ternary.condition()) + " ? " + bare(ternary.thenExpression())
                    + " : " + bare(ternary.elseExpression()) + ")";
        }
        if (expression instanceof StructInitNode structInit) {
            return structInit(structInit);
        }
        if (expression instanceof ArrayLiteralNode array) {
            return "[" + arguments(array.elements()) + "]";
        }
        if (expression instanceof ArrayRepeatNode repeat) {
            return "[" + bare(repeat.value()) + "; " + bare(repeat.count()) + "]";
        }
        if (expression instanceof TupleLiteralNode tuple) {
            if (tuple.elements().size() == 1) {
                return "(" + bare(tuple.elements().get(0)) + ",)";
            }
            return "(" + arguments(tuple.elements()) + ")";
        }
        if (expression instanceof RangeExpressionNode range) {
            String start = range.start() == null ? "" : expression(range.start());
            String end = range.end() == null ? "" : expression(range.end());
            return start + (range.inclusive() ? "..=" : "..") + end;
        }
        if (expression instanceof MacroCallNode macroCall) {
            return macroCall(macroCall);
        }
        if (expression instanceof TypeScopedCallNode scopedCall) {
            return isRust()
                    ? type(scopedCall.type()) + "::" + scopedCall.method() + "(" + arguments(scopedCall.arguments()) + ")"
                    : "@" + type(scopedCall.type()) + "." + scopedCall.method()
                    + "(" + arguments(scopedCall.arguments()) + ")";
        }
        if (expression instanceof ExplicitGenericCallNode genericCall) {
            String generics = genericCall.generics().stream().map(this::type).collect(Collectors.joining(", "));
            return isRust()
                    ? type(genericCall.type()) + "::<" + generics + ">::" + genericCall.method()
                    + "(" + arguments(genericCall.arguments()) + ")"
                    : "@" + type(genericCall.type()) + "(" + generics + ")." + genericCall.method()
                    + "(" + arguments(genericCall.arguments()) + ")";
        }
        throw new CodeGenException("Unsupported expression: " + expression.getClass().getSimpleName());
    }

    private String literal(LiteralNode literal) {
        return switch (literal.kind()) {
            case STRING -> "\"" + escape(literal.value(), '"') + "\"";
            case CHAR -> "'" + escape(literal.value(), '\'') + "'";
            case NULL -> isRust() ? "Option::None" : "NULL";
            default -> literal.value();
        };
    }

    private String unary(UnaryExpressionNode unary) {
        if (!isRust()) {
            return switch (unary.operator()) {
                case POST_INC, POST_DEC -> postfixTarget(unary.operand()) + unary.operator().symbol();
                case REF_MUT -> "&var " + prefixOperand(unary.operand());
                default -> unary.operator().symbol() + prefixOperand(unary.operand());
            };
        }
        String operand = expression(unary.operand());
        return switch (unary.operator()) {
            case NOT, BIT_NOT -> "!(" + operand + ")";
            case NEG -> "-(" + operand + ")";
            case REF -> "&(" + operand + ")";
            case REF_MUT -> "&mut (" + operand + ")";
            case DEREF -> "*(" + operand + ")";
            case PRE_INC -> "{ let __tmp = &mut (" + operand + "); *__tmp += 1; *__tmp }";
            case PRE_DEC -> "{ let __tmp = &mut (" + operand + "); *__tmp -= 1; *__tmp }";
            case POST_INC -> "{ let __old = (" + operand + "); let __tmp = &mut (" + operand + "); *__tmp += 1; __old }";
            case POST_DEC -> "{ let __old = (" + operand + "); let __tmp = &mut (" + operand + "); *__tmp -= 1; __old }";
        };
    }

    // -(-x) 不能写成 --x, &(&x) 不能写成 &&x
    private String prefixOperand(ExpressionNode operand) {
        String text = expression(operand);
        if (operand instanceof UnaryExpressionNode || operand instanceof CastExpressionNode) {
            return "(" + text + ")";
        }
        return text;
    }

    // 一元、转换、三元表达式作为后缀操作的对象时需要括号
    private String postfixTarget(ExpressionNode target) {
        String text = expression(target);
        if (target instanceof UnaryExpressionNode || target instanceof CastExpressionNode
                || (isRust() && target instanceof TernaryExpressionNode)) {
            return "(" + text + ")";
        }
        return text;
    }

    private String structInit(StructInitNode structInit) {
        if (isRust()) {
            String fields = structInit.fields().stream()
                    .map(f -> f.name() + ": " + bare(f.value()))
                    .collect(Collectors.joining(", "));
            return type(structInit.type()) + " { " + fields + " }";
        }
        String fields = structInit.fields().stream()
                .map(f -> "." + f.name() + " = " + bare(f.value()))
                .collect(Collectors.joining(", "));
        String prefix = structInit.type() instanceof AutoTypeNode ? "" : "(" + type(structInit.type()) + ")";
        return prefix + "{ " + fields + " }";
    }

    private String macroCall(MacroCallNode macroCall) {
        MacroDelimiter delimiter = macroCall.delimiter();
        String args = arguments(macroCall.arguments());
        if (!isRust()) {
            return delimiter == MacroDelimiter.NONE
                    ? macroCall.name()
                    : macroCall.name() + delimiter.open() + args + delimiter.close();
        }
        String name = rustMacroName(macroCall.name()) + "!";
        if (delimiter == MacroDelimiter.NONE) {
            return name + "()";
        }
        return name + delimiter.open() + args + delimiter.close();
    }

    private String arguments(List<ExpressionNode> arguments) {
        return arguments.stream().map(this::bare).collect(Collectors.joining(", "));
    }

    private static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }

    // ==================== 类型 ====================

    private String returnType(TypeNode type) {
        return type == null ? "void" : type(type);
    }

    public String type(TypeNode type) {
        if (type instanceof PrimitiveTypeNode primitive) {
            return isRust() ? primitive.kind().rustName() : primitive.kind().crustyName();
        }
        if (type instanceof NamedTypeNode named) {
            return named.name();
        }
        if (type instanceof PointerTypeNode pointer) {
            if (isRust()) {
                return (pointer.mutable() ? "*mut " : "*const ") + type(pointer.target());
            }
            return type(pointer.target()) + "*";
        }
        if (type instanceof ReferenceTypeNode reference) {
            if (isRust()) {
                return (reference.mutable() ? "&mut " : "&") + type(reference.target());
            }
            return (reference.mutable() ? "&var " : "&") + type(reference.target());
        }
        if (type instanceof ArrayTypeNode array) {
            if (isRust()) {
                return array.size() == null
                        ? "[" + type(array.element()) + "]"
                        : "[" + type(array.element()) + "; " + array.size() + "]";
            }
            return type(array.element()) + "[" + (array.size() == null ? "" : array.size()) + "]";
        }
        if (type instanceof TupleTypeNode tuple) {
            return "(" + tuple.elements().stream().map(this::type).collect(Collectors.joining(", ")) + ")";
        }
        if (type instanceof GenericTypeNode generic) {
            return type(generic.base()) + "<"
                    + generic.arguments().stream().map(this::type).collect(Collectors.joining(", ")) + ">";
        }
        if (type instanceof FunctionTypeNode function) {
            String params = function.parameters().stream().map(this::type).collect(Collectors.joining(", "));
            boolean returnsValue = function.returnType() != null
                    && !(function.returnType() instanceof PrimitiveTypeNode p && p.isVoid());
            return "fn(" + params + ")" + (returnsValue ? " -> " + type(function.returnType()) : "");
        }
        if (type instanceof AutoTypeNode) {
            return isRust() ? "_" : "auto";
        }
        throw new CodeGenException("Unsupported type: " + (type == null ? "null" : type.getClass().getSimpleName()));
    }

    // ==================== 输出 ====================

    private void line(String text) {
        out.append(indentUnit.repeat(indentLevel)).append(text).append('\n');
    }
}
