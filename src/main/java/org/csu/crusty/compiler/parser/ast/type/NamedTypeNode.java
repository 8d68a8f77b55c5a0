package org.csu.crusty.compiler.parser.ast.type;

import org.csu.crusty.compiler.parser.ast.TypeNode;

/**
 * 用户定义的类型名 (结构体, 枚举, typedef) 或 Self
 */
public record NamedTypeNode(String name) implements TypeNode {
}
