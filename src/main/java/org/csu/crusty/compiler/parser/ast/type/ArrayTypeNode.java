package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * int[4]; size 为 null 时是切片 int[]
 */
public record ArrayTypeNode(TypeNode element, Integer size) implements TypeNode {
}
