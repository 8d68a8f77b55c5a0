package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.AstNode;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * 结构体初始化中的 .field = value
 */
public record FieldInitNode(String name, ExpressionNode value) implements AstNode {
}
