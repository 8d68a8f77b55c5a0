package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ExpressionNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * AST 节点: (Point){ .x = 1, .y = 2 }
 * 省略类型时 type 为 AutoTypeNode, let 带类型标注时由解析器替换为标注的类型
 */
public record StructInitNode(TypeNode type, List<FieldInitNode> fields, Span span) implements ExpressionNode {

    public StructInitNode(TypeNode type, List<FieldInitNode> fields) {
        this(type, fields, Span.UNKNOWN);
    }

    public StructInitNode withType(TypeNode newType) {
        return new StructInitNode(newType, fields, span);
    }
}
