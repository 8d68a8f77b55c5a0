package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.compiler.parser.ast.AstNode;
import org.csu.crusty.compiler.parser.ast.AttributeNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;
import org.csu.crusty.compiler.parser.ast.Visibility;

import java.util.List;

public record FieldNode(Visibility visibility, String name, TypeNode type, List<AttributeNode> attributes)
        implements AstNode {
}
