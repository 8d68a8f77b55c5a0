package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * int* 之类的裸指针
 */
public record PointerTypeNode(TypeNode target, boolean mutable) implements TypeNode {
}
