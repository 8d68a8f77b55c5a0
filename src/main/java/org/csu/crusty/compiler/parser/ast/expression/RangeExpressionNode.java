package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * start..end 或 start..=end, 两端都可以省略 (null)
 */
public record RangeExpressionNode(ExpressionNode start, ExpressionNode end, boolean inclusive) implements ExpressionNode {
}
