package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * [value; count]
 */
public record ArrayRepeatNode(ExpressionNode value, ExpressionNode count) implements ExpressionNode {
}
