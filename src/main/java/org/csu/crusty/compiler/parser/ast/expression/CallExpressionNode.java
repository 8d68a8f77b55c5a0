package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

import java.util.List;

public record CallExpressionNode(ExpressionNode callee, List<ExpressionNode> arguments) implements ExpressionNode {
}
