package org.csu.crusty.compiler.parser.ast.expression;

import org.csu.crusty.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 字面量. 字符串和字符保存未转义的内容
 */
public record LiteralNode(Kind kind, String value) implements ExpressionNode {

    public enum Kind {
        INT, FLOAT, STRING, CHAR, BOOL, NULL
    }

    public static LiteralNode ofInt(long value) {
        return new LiteralNode(Kind.INT, Long.toString(value));
    }

    public static LiteralNode ofBool(boolean value) {
        return new LiteralNode(Kind.BOOL, Boolean.toString(value));
    }

    public static LiteralNode ofString(String value) {
        return new LiteralNode(Kind.STRING, value);
    }

    public static LiteralNode nullLiteral() {
        return new LiteralNode(Kind.NULL, "NULL");
    }
}
