package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

public record IndexExpressionNode(ExpressionNode target, ExpressionNode index) implements ExpressionNode {
}
