package org.csu.crusty.compiler.parser.ast;

/**
 * 顶层条目: 函数, 结构体, 枚举, 类型别名, 宏定义
 */
public interface ItemNode extends AstNode {

    String name();
}
