package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.AttributeNode;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.parser.ast.Parameter;
import org.csu.crusty.compiler.parser.ast.TypeNode;
import org.csu.crusty.compiler.parser.ast.Visibility;
import org.csu.crusty.compiler.parser.ast.statement.BlockNode;

import java.util.List;

/**
 * AST 节点: 顶层函数或结构体方法. returnType 为 null 表示 void
 */
public record FunctionNode(
        Visibility visibility,
        String name,
        List<Parameter> params,
        TypeNode returnType,
        BlockNode body,
        List<AttributeNode> attributes,
        Span span
) implements ItemNode {
}
