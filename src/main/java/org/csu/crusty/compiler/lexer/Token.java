package org.csu.crusty.compiler.lexer;

import org.csu.crusty.common.model.Span;

/**
 * @param type   词法单元的类型 (种别码)
 * @param lexeme 词法单元的文本; 字符串和字符字面量保存的是去掉引号、转义后的内容
 * @param span   在源码中的区间
 */
public record Token(TokenType type, String lexeme, Span span) {

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    /**
     * 用于错误信息中的 "found ..." 描述
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of file";
            case IDENTIFIER -> "identifier '" + lexeme + "'";
            case INT_LITERAL, FLOAT_LITERAL -> "number '" + lexeme + "'";
            case STRING_LITERAL -> "string \"" + lexeme + "\"";
            case CHAR_LITERAL -> "char '" + lexeme + "'";
            default -> "'" + lexeme + "'";
        };
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-15s, Lexeme='%s', Position=%s]", type, lexeme, span);
    }
}
