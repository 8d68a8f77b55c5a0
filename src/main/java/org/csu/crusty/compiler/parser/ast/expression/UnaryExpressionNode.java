package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

public record UnaryExpressionNode(UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {
}
