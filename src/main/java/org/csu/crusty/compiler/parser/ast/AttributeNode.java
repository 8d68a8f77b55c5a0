package org.csu.crusty.compiler.parser.ast;

import org.csu.crusty.compiler.parser.ast.expression.LiteralNode;

import java.util.List;

/**
 * 属性, 如 #[derive(Debug, Clone)] 或 #[serde(rename = "id")].
 * 可以标注在函数、方法、结构体、字段和枚举上, 两种目标语言的写法相同
 */
public record AttributeNode(String name, List<Argument> arguments) implements AstNode {

    /**
     * 属性参数有三种形式: 标识符 (name 非空), 字面量 (value 非空), name = value (两者都非空)
     */
    public record Argument(String name, LiteralNode value) {

        public static Argument identifier(String name) {
            return new Argument(name, null);
        }

        public static Argument literal(LiteralNode value) {
            return new Argument(null, value);
        }

        public static Argument nameValue(String name, LiteralNode value) {
            return new Argument(name, value);
        }
    }
}
