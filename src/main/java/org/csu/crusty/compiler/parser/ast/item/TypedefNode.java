package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.parser.ast.ItemNode;
import org.csu.crusty.compiler.parser.ast.TypeNode;
import org.csu.crusty.compiler.parser.ast.Visibility;

/**
 * AST 节点: typedef int MyInt;
 */
public record TypedefNode(Visibility visibility, String name, TypeNode target, Span span) implements ItemNode {
}
