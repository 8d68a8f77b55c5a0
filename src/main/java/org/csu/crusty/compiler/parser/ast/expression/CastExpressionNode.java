package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * AST 节点: (Type)expr
 */
public record CastExpressionNode(ExpressionNode expression, TypeNode type) implements ExpressionNode {
}
