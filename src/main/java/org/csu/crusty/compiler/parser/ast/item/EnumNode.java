package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.AttributeNode;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.parser.ast.Visibility;

import java.util.List;

public record EnumNode(Visibility visibility, String name, List<EnumVariantNode> variants,
                       List<AttributeNode> attributes, Span span) implements ItemNode {
}
