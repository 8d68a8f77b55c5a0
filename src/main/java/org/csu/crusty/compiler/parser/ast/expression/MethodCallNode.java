package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * receiver.method(args)
 */
public record MethodCallNode(ExpressionNode receiver, String method, List<ExpressionNode> arguments) implements ExpressionNode {
}
