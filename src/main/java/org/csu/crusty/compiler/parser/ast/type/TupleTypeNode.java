package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

public record TupleTypeNode(List<TypeNode> elements) implements TypeNode {
}
