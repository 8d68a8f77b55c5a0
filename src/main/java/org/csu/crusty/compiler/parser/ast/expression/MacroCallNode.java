package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.MacroDelimiter;

import java.util.List;

/**
 * AST 节点: 宏调用 __name__(args). delimiter 记录调用时实际使用的括号
 */
public record MacroCallNode(String name, MacroDelimiter delimiter, List<ExpressionNode> arguments, Span span) implements ExpressionNode {

    public MacroCallNode(String name, MacroDelimiter delimiter, List<ExpressionNode> arguments) {
        this(name, delimiter, arguments, Span.UNKNOWN);
    }
}
