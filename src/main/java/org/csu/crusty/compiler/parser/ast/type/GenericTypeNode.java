package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * Vec&lt;int&gt;
 */
public record GenericTypeNode(TypeNode base, List<TypeNode> arguments) implements TypeNode {
}
