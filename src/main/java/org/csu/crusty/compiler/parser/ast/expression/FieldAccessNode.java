package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * target.field; 元组下标 t.0 也用它表示, p->f 解析为 (*p).f
 */
public record FieldAccessNode(ExpressionNode target, String field) implements ExpressionNode {
}
