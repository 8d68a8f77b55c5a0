package org.csu.crusty.compiler.semantic;

import org.csu.crusty.common.exception.SemanticException;
import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.MacroRegistry;
import org.csu.crusty.compiler.parser.ast.*;
import org.csu.crusty.compiler.parser.ast.expression.*;
import org.csu.crusty.compiler.parser.ast.item.*;
import org.csu.crusty.compiler.parser.ast.statement.*;
import org.csu.crusty.compiler.parser.ast.type.NamedTypeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * @author hidyouth
 * @description: 语义分析器 (捕获分析)
 * 遍历每个函数体, 维护作用域链, 计算每个嵌套函数捕获了哪些外层绑定以及是否写入它们,
 * 同时检查先声明后使用、重复定义、const 赋值、break/continue 和返回类型。
 * 错误是累积的, 分析不会在第一个错误处停止。
 */
public class CaptureAnalyzer {

    private static final Logger LOG = Logger.getLogger(CaptureAnalyzer.class.getName());

    /**
     * 一个正在分析的函数 (顶层函数, 方法或嵌套函数)
     */
    private static final class FunctionFrame {
        private final String name;
        private final TypeNode returnType;
        private final Deque<Breakable> breakables = new ArrayDeque<>();

        private FunctionFrame(String name, TypeNode returnType) {
            this.name = name;
            this.returnType = returnType;
        }
    }

    // 循环或 switch; switch 只能被无标签的 break 跳出
    private record Breakable(String label, boolean loop) {
    }

    private AnalysisResult result;
    private Scope scope;
    private final Deque<FunctionFrame> frames = new ArrayDeque<>();
    private final Set<String> typeNames = new HashSet<>();
    private final TypeChecker typeChecker = new TypeChecker(name -> scope.find(name).orElse(null));

    public AnalysisResult analyze(CrustyFile file) {
        result = new AnalysisResult();
        scope = Scope.global();
        frames.clear();
        typeNames.clear();

        declareGlobals(file);
        for (ItemNode item : file.items()) {
            analyzeItem(item);
        }
        LOG.fine(() -> "Capture analysis finished: " + result.getNestedFunctions().size()
                + " nested functions, " + result.getErrors().size() + " errors");
        return result;
    }

    /**
     * 分析并在有任何错误时抛出包含全部错误的 SemanticException
     */
    public AnalysisResult analyzeOrThrow(CrustyFile file) {
        AnalysisResult analysis = analyze(file);
        if (!analysis.isSuccess()) {
            throw new SemanticException(analysis.getErrors());
        }
        return analysis;
    }

    // ==================== 全局作用域 ====================

    private void declareGlobals(CrustyFile file) {
        List<ItemNode> items = file.items();
        for (int i = 0; i < items.size(); i++) {
            ItemNode item = items.get(i);
            if (item instanceof FunctionNode function) {
                checkFunctionName(function.name(), function.span(), SemanticErrorKind.INVALID_OPERATION);
                declare(new Binding(function.name(), Binding.Mutability.FUNCTION, i, function.returnType(), function),
                        function.span());
            } else if (item instanceof StructNode struct) {
                typeNames.add(struct.name());
                declare(new Binding(struct.name(), Binding.Mutability.CONST, i, null, null), struct.span());
            } else if (item instanceof EnumNode enumNode) {
                typeNames.add(enumNode.name());
                declare(new Binding(enumNode.name(), Binding.Mutability.CONST, i, null, null), enumNode.span());
                for (EnumVariantNode variant : enumNode.variants()) {
                    declare(new Binding(variant.name(), Binding.Mutability.CONST, i,
                            new NamedTypeNode(enumNode.name()), null), enumNode.span());
                }
            } else if (item instanceof TypedefNode typedef) {
                typeNames.add(typedef.name());
                declare(new Binding(typedef.name(), Binding.Mutability.CONST, i, typedef.target(), null),
                        typedef.span());
            } else if (item instanceof MacroDefinitionNode macro) {
                declare(new Binding(macro.name(), Binding.Mutability.CONST, i, null, null), macro.span());
            }
        }
    }

    private void analyzeItem(ItemNode item) {
        if (item instanceof FunctionNode function) {
            analyzeFunction(function.name(), function.params(), function.returnType(), function.body(), null,
                    function.span());
        } else if (item instanceof StructNode struct) {
            for (FunctionNode method : struct.methods()) {
                analyzeFunction(method.name(), method.params(), method.returnType(), method.body(), null,
                        method.span());
            }
        }
    }

    private void analyzeFunction(String name, List<Parameter> params, TypeNode returnType, BlockNode body,
                                 NestedFunctionNode owner, Span span) {
        LOG.finer(() -> "Analyzing function " + name);
        Scope enclosing = scope;
        scope = enclosing.child(Scope.Kind.FUNCTION, owner);
        frames.push(new FunctionFrame(name, returnType));
        try {
            for (Parameter param : params) {
                declare(new Binding(param.name(), Binding.Mutability.IMMUTABLE, Binding.PARAMETER_POSITION,
                        param.type(), param), span);
            }
            analyzeStatements(body.statements());
        } finally {
            frames.pop();
            scope = enclosing;
        }
    }

    // ==================== 语句 ====================

    private void analyzeStatements(List<StatementNode> statements) {
        for (int i = 0; i < statements.size(); i++) {
            analyzeStatement(statements.get(i), i);
        }
    }

    private void analyzeBlock(BlockNode block) {
        Scope enclosing = scope;
        scope = enclosing.child(Scope.Kind.BLOCK, null);
        try {
            analyzeStatements(block.statements());
        } finally {
            scope = enclosing;
        }
    }

    private void analyzeStatement(StatementNode statement, int position) {
        if (statement instanceof LetStatementNode let) {
            analyzeDeclaration(let.name(), let.type(), let.init(), position,
                    let.mutable() ? Binding.Mutability.MUTABLE : Binding.Mutability.IMMUTABLE, let, let.span());
        } else if (statement instanceof VarStatementNode varStatement) {
            analyzeDeclaration(varStatement.name(), varStatement.type(), varStatement.init(), position,
                    Binding.Mutability.MUTABLE, varStatement,
                    varStatement.span());
        } else if (statement instanceof ConstStatementNode constant) {
            analyzeDeclaration(constant.name(), constant.type(), constant.value(), position,
                    Binding.Mutability.CONST, constant, constant.span());
        } else if (statement instanceof ExpressionStatementNode expressionStatement) {
            analyzeExpression(expressionStatement.expression());
        } else if (statement instanceof ReturnStatementNode returnStatement) {
            analyzeReturn(returnStatement);
        } else if (statement instanceof IfStatementNode ifStatement) {
            analyzeExpression(ifStatement.condition());
            analyzeBlock(ifStatement.thenBlock());
            if (ifStatement.elseBlock() != null) {
                analyzeBlock(ifStatement.elseBlock());
            }
        } else if (statement instanceof WhileStatementNode whileStatement) {
            analyzeExpression(whileStatement.condition());
            inBreakable(new Breakable(whileStatement.label(), true), () -> analyzeBlock(whileStatement.body()));
        } else if (statement instanceof ForStatementNode forStatement) {
            analyzeFor(forStatement);
        } else if (statement instanceof ForInStatementNode forIn) {
            analyzeExpression(forIn.iterable());
            Scope enclosing = scope;
            scope = enclosing.child(Scope.Kind.BLOCK, null);
            try {
                declare(new Binding(forIn.variable(), Binding.Mutability.IMMUTABLE, Binding.PARAMETER_POSITION,
                        null, forIn), forIn.span());
                inBreakable(new Breakable(forIn.label(), true), () -> analyzeBlock(forIn.body()));
            } finally {
                scope = enclosing;
            }
        } else if (statement instanceof SwitchStatementNode switchStatement) {
            analyzeExpression(switchStatement.subject());
            for (SwitchCaseNode switchCase : switchStatement.cases()) {
                switchCase.values().forEach(this::analyzeExpression);
                inBreakable(new Breakable(null, false), () -> analyzeBlock(switchCase.body()));
            }
            if (switchStatement.defaultBlock() != null) {
                inBreakable(new Breakable(null, false), () -> analyzeBlock(switchStatement.defaultBlock()));
            }
        } else if (statement instanceof BreakStatementNode breakStatement) {
            checkJump("break", breakStatement.label(), false, breakStatement.span());
        } else if (statement instanceof ContinueStatementNode continueStatement) {
            checkJump("continue", continueStatement.label(), true, continueStatement.span());
        } else if (statement instanceof NestedFunctionNode nested) {
            analyzeNestedFunction(nested, position);
        } else if (statement instanceof BlockNode block) {
            analyzeBlock(block);
        }
    }

    // 初始化表达式先于名字本身分析, 所以 int x = x; 中的 x 指向外层
    private void analyzeDeclaration(String name, TypeNode type, ExpressionNode init, int position,
                                    Binding.Mutability mutability, AstNode declaration, Span span) {
        if (init != null) {
            analyzeExpression(init);
        }
        TypeNode bindingType = type != null ? type : (init != null ? typeChecker.infer(init) : null);
        declare(new Binding(name, mutability, position, bindingType, declaration), span);
    }

    private void analyzeReturn(ReturnStatementNode statement) {
        FunctionFrame frame = frames.peek();
        if (statement.value() != null) {
            analyzeExpression(statement.value());
        }
        if (frame == null) {
            return;
        }
        if (statement.value() == null) {
            if (frame.returnType != null) {
                error(statement.span(), SemanticErrorKind.TYPE_MISMATCH,
                        "function '" + frame.name + "' must return a value of type "
                                + TypeChecker.describe(frame.returnType));
            }
            return;
        }
        if (frame.returnType == null) {
            error(statement.span(), SemanticErrorKind.TYPE_MISMATCH,
                    "void function '" + frame.name + "' cannot return a value");
            return;
        }
        TypeNode actual = typeChecker.infer(statement.value());
        if (!typeChecker.isCompatible(frame.returnType, actual)) {
            error(statement.span(), SemanticErrorKind.TYPE_MISMATCH,
                    "function '" + frame.name + "' declares return type " + TypeChecker.describe(frame.returnType)
                            + " but returns " + TypeChecker.describe(actual));
        }
    }

    private void analyzeFor(ForStatementNode statement) {
        Scope enclosing = scope;
        scope = enclosing.child(Scope.Kind.BLOCK, null);
        try {
            if (statement.init() != null) {
                analyzeStatement(statement.init(), 0);
            }
            if (statement.condition() != null) {
                analyzeExpression(statement.condition());
            }
            inBreakable(new Breakable(statement.label(), true), () -> analyzeBlock(statement.body()));
            if (statement.increment() != null) {
                analyzeExpression(statement.increment());
            }
        } finally {
            scope = enclosing;
        }
    }

    /**
     * 嵌套函数的名字在整条语句结束后才可见, 所以函数体内递归调用自身也是未定义
     */
    private void analyzeNestedFunction(NestedFunctionNode nested, int position) {
        // 嵌套函数会变成闭包, 宏形式的名字无法表示
        checkFunctionName(nested.name(), nested.span(), SemanticErrorKind.UNSUPPORTED_FEATURE);
        result.registerNestedFunction(nested);
        analyzeFunction(nested.name(), nested.params(), nested.returnType(), nested.body(), nested, nested.span());
        declare(new Binding(nested.name(), Binding.Mutability.FUNCTION, position, nested.returnType(), nested),
                nested.span());
        LOG.finer(() -> "Captures of " + nested.name() + ": " + result.getCaptures(nested));
    }

    private void inBreakable(Breakable breakable, Runnable body) {
        FunctionFrame frame = frames.peek();
        frame.breakables.push(breakable);
        try {
            body.run();
        } finally {
            frame.breakables.pop();
        }
    }

    private void checkJump(String keyword, String label, boolean requiresLoop, Span span) {
        FunctionFrame frame = frames.peek();
        for (Breakable breakable : frame.breakables) {
            if (label == null) {
                if (breakable.loop() || !requiresLoop) {
                    return;
                }
            } else if (label.equals(breakable.label())) {
                return;
            }
        }
        if (label == null) {
            error(span, SemanticErrorKind.INVALID_OPERATION, "'" + keyword + "' outside of a loop");
        } else {
            error(span, SemanticErrorKind.INVALID_OPERATION,
                    "'" + keyword + "' refers to unknown label '" + label + "'");
        }
    }

    // ==================== 表达式 ====================

    private void analyzeExpression(ExpressionNode expression) {
        if (expression == null || expression instanceof LiteralNode || expression instanceof SizeofExpressionNode) {
            return;
        }
        if (expression instanceof IdentifierNode identifier) {
            resolve(identifier.name(), identifier.span(), false);
        } else if (expression instanceof BinaryExpressionNode binary) {
            if (binary.operator().isAssignment()) {
                analyzeAssignmentTarget(binary.left());
            } else {
                analyzeExpression(binary.left());
            }
            analyzeExpression(binary.right());
        } else if (expression instanceof UnaryExpressionNode unary) {
            if (unary.operator().isIncrementOrDecrement() || unary.operator() == UnaryOperator.REF_MUT) {
                analyzeAssignmentTarget(unary.operand());
            } else {
                analyzeExpression(unary.operand());
            }
        } else if (expression instanceof CallExpressionNode call) {
            analyzeExpression(call.callee());
            call.arguments().forEach(this::analyzeExpression);
        } else if (expression instanceof MethodCallNode methodCall) {
            analyzeExpression(methodCall.receiver());
            methodCall.arguments().forEach(this::analyzeExpression);
        } else if (expression instanceof FieldAccessNode access) {
            analyzeExpression(access.target());
        } else if (expression instanceof IndexExpressionNode index) {
            analyzeExpression(index.target());
            analyzeExpression(index.index());
        } else if (expression instanceof CastExpressionNode cast) {
            analyzeExpression(cast.expression());
        } else if (expression instanceof TernaryExpressionNode ternary) {
            analyzeExpression(ternary.condition());
            analyzeExpression(ternary.thenExpression());
            analyzeExpression(ternary.elseExpression());
        } else if (expression instanceof StructInitNode structInit) {
            if (structInit.type() instanceof NamedTypeNode named && !typeNames.contains(named.name())) {
                error(structInit.span(), SemanticErrorKind.UNDEFINED_VARIABLE,
                        "unknown struct '" + named.name() + "' in initializer");
            }
            structInit.fields().forEach(field -> analyzeExpression(field.value()));
        } else if (expression instanceof ArrayLiteralNode array) {
            array.elements().forEach(this::analyzeExpression);
        } else if (expression instanceof ArrayRepeatNode repeat) {
            analyzeExpression(repeat.value());
            analyzeExpression(repeat.count());
        } else if (expression instanceof TupleLiteralNode tuple) {
            tuple.elements().forEach(this::analyzeExpression);
        } else if (expression instanceof RangeExpressionNode range) {
            analyzeExpression(range.start());
            analyzeExpression(range.end());
        } else if (expression instanceof MacroCallNode macroCall) {
            macroCall.arguments().forEach(this::analyzeExpression);
        } else if (expression instanceof TypeScopedCallNode scopedCall) {
            scopedCall.arguments().forEach(this::analyzeExpression);
        } else if (expression instanceof ExplicitGenericCallNode genericCall) {
            genericCall.arguments().forEach(this::analyzeExpression);
        }
    }

    /**
     * 赋值目标的根标识符按写入处理, 经过字段访问、下标和解引用也一样
     */
    private void analyzeAssignmentTarget(ExpressionNode target) {
        if (target instanceof IdentifierNode identifier) {
            resolve(identifier.name(), identifier.span(), true);
        } else if (target instanceof FieldAccessNode access) {
            analyzeAssignmentTarget(access.target());
        } else if (target instanceof IndexExpressionNode index) {
            analyzeAssignmentTarget(index.target());
            analyzeExpression(index.index());
        } else if (target instanceof UnaryExpressionNode unary && unary.operator() == UnaryOperator.DEREF) {
            analyzeAssignmentTarget(unary.operand());
        } else {
            analyzeExpression(target);
        }
    }

    /**
     * 沿作用域链解析一个名字. 每越过一个嵌套函数的边界, 就为该嵌套函数记录一次捕获
     */
    private Binding resolve(String name, Span span, boolean write) {
        List<NestedFunctionNode> crossed = new ArrayList<>();
        for (Scope s = scope; s != null; s = s.getParent()) {
            Binding binding = s.lookupLocal(name).orElse(null);
            if (binding == null) {
                if (s.isNestedFunctionBoundary()) {
                    crossed.add(s.getOwner());
                }
                continue;
            }
            if (write) {
                checkWritable(binding, span);
            }
            if (s.getKind() != Scope.Kind.GLOBAL) {
                CaptureKind kind = write ? CaptureKind.MUTABLE : CaptureKind.IMMUTABLE;
                for (NestedFunctionNode function : crossed) {
                    result.recordCapture(function, name, kind);
                }
                if (write && isVariable(binding)) {
                    result.markMutable(binding.declaration());
                }
            }
            return binding;
        }
        error(span, SemanticErrorKind.UNDEFINED_VARIABLE,
                "use of undeclared identifier '" + name + "' (not defined, or used before it is declared)");
        return null;
    }

    private void checkWritable(Binding binding, Span span) {
        if (binding.mutability() == Binding.Mutability.CONST) {
            error(span, SemanticErrorKind.INVALID_OPERATION, "cannot assign to constant '" + binding.name() + "'");
        } else if (binding.mutability() == Binding.Mutability.FUNCTION) {
            error(span, SemanticErrorKind.INVALID_OPERATION, "cannot assign to function '" + binding.name() + "'");
        }
    }

    private boolean isVariable(Binding binding) {
        return binding.mutability() == Binding.Mutability.IMMUTABLE
                || binding.mutability() == Binding.Mutability.MUTABLE;
    }

    // ==================== 辅助方法 ====================

    private void checkFunctionName(String name, Span span, SemanticErrorKind kind) {
        if (MacroRegistry.isMacroName(name)) {
            error(span, kind,
                    "function name '" + name + "' is reserved for macros (double-underscore prefix and suffix)");
        }
    }

    private void declare(Binding binding, Span span) {
        if (!scope.declare(binding)) {
            error(span, SemanticErrorKind.DUPLICATE_DEFINITION,
                    "'" + binding.name() + "' is already defined in this scope");
        }
    }

    private void error(Span span, SemanticErrorKind kind, String message) {
        SemanticError error = new SemanticError(span == null ? Span.UNKNOWN : span, kind, message);
        LOG.fine(error::describe);
        result.addError(error);
    }
}
