package org.csu.crusty.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 一个编译单元中的全部顶层条目
 */
public record CrustyFile(List<ItemNode> items) implements AstNode {
}
