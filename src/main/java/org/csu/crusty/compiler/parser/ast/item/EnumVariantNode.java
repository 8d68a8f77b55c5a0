package org.csu.crusty.compiler.parser.ast.item;

import org.csu.crusty.compiler.parser.ast.AstNode;

/**
 * 枚举成员, 判别值总是显式的 (解析时已完成自增)
 */
public record EnumVariantNode(String name, long value) implements AstNode {
}
