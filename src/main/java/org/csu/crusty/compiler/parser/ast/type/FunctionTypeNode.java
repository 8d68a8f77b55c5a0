package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

import java.util.List;

/**
 * 函数指针类型, returnType 为 null 表示 void
 */
public record FunctionTypeNode(List<TypeNode> parameters, TypeNode returnType) implements TypeNode {
}
