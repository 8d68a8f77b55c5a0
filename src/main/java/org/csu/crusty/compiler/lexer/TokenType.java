package org.csu.crusty.compiler.lexer;

/**
 * @author hidyouth
 * @description: 词法单元的种别码
 */
public enum TokenType {
    // 关键字
    LET, VAR, CONST, STATIC, MUT, DEFINE,
    IF, ELSE, WHILE, FOR, IN, LOOP, SWITCH, CASE, DEFAULT,
    RETURN, BREAK, CONTINUE,
    STRUCT, ENUM, TYPEDEF, SIZEOF, AUTO,

    // 基本类型关键字
    INT, I32, I64, U32, U64, FLOAT, F32, F64, BOOL, CHAR, VOID,

    // 字面量
    INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL, CHAR_LITERAL,
    TRUE, FALSE, NULL,

    IDENTIFIER,

    // 运算符
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQUAL_EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    AND_AND, OR_OR, BANG,
    AMPERSAND, PIPE, CARET, TILDE, SHIFT_LEFT, SHIFT_RIGHT,
    ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
    AND_ASSIGN, OR_ASSIGN, XOR_ASSIGN, SHIFT_LEFT_ASSIGN, SHIFT_RIGHT_ASSIGN,
    PLUS_PLUS, MINUS_MINUS,
    DOT, ARROW, DOT_DOT, DOT_DOT_EQUAL, QUESTION, COLON, COLON_COLON,

    // 分隔符
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET, COMMA, SEMICOLON,
    HASH, AT,

    EOF;

    public boolean isPrimitiveType() {
        return switch (this) {
            case INT, I32, I64, U32, U64, FLOAT, F32, F64, BOOL, CHAR, VOID -> true;
            default -> false;
        };
    }

    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                    AND_ASSIGN, OR_ASSIGN, XOR_ASSIGN, SHIFT_LEFT_ASSIGN, SHIFT_RIGHT_ASSIGN -> true;
            default -> false;
        };
    }
}
