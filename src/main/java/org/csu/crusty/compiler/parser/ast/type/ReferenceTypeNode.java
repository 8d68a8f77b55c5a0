package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * &T 或 &var T
 */
public record ReferenceTypeNode(TypeNode target, boolean mutable) implements TypeNode {
}
