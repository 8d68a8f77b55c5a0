package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

public record TernaryExpressionNode(ExpressionNode condition, ExpressionNode thenExpression, ExpressionNode elseExpression) implements ExpressionNode {
}
