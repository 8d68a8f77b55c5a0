package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x + y, x = 1, x += 2)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        BinaryOperator operator,
        ExpressionNode right
) implements ExpressionNode {
}
