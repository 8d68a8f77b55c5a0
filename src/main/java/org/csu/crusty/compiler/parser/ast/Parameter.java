package org.csu.crusty.compiler.parser.ast;

/**
 * 函数参数. 方法的 self 参数以名字 "self" 表示, 类型为 Self 或其引用
 */
public record Parameter(String name, TypeNode type) implements AstNode {

    public boolean isSelf() {
        return "self".equals(name);
    }
}
