package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.AttributeNode;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.parser.ast.Visibility;

import java.util.List;

/**
 * AST 节点: 结构体定义, 方法写在结构体内部
 */
public record StructNode(
        Visibility visibility,
        String name,
        List<FieldNode> fields,
        List<FunctionNode> methods,
        List<AttributeNode> attributes,
        Span span
) implements ItemNode {
}
