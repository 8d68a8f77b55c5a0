package org.csu.crusty.compiler.lexer;

import org.csu.crusty.common.exception.LexException;
import org.csu.crusty.common.model.Span;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将Crusty源码分解为一系列的Token。采用最长匹配, 记录行列号,
 * 并支持 checkpoint/restore 以便向前试探。
 */
public class Lexer {

    /**
     * 词法分析器的游标状态
     */
    public record LexerCheckpoint(int position, int line, int column) {
    }

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表, 区分大小写
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("let", TokenType.LET);
        keywords.put("var", TokenType.VAR);
        keywords.put("const", TokenType.CONST);
        keywords.put("static", TokenType.STATIC);
        keywords.put("mut", TokenType.MUT);
        keywords.put("define", TokenType.DEFINE);
        keywords.put("if", TokenType.IF);
        keywords.put("else", TokenType.ELSE);
        keywords.put("while", TokenType.WHILE);
        keywords.put("for", TokenType.FOR);
        keywords.put("in", TokenType.IN);
        keywords.put("loop", TokenType.LOOP);
        keywords.put("switch", TokenType.SWITCH);
        keywords.put("case", TokenType.CASE);
        keywords.put("default", TokenType.DEFAULT);
        keywords.put("return", TokenType.RETURN);
        keywords.put("break", TokenType.BREAK);
        keywords.put("continue", TokenType.CONTINUE);
        keywords.put("struct", TokenType.STRUCT);
        keywords.put("enum", TokenType.ENUM);
        keywords.put("typedef", TokenType.TYPEDEF);
        keywords.put("sizeof", TokenType.SIZEOF);
        keywords.put("auto", TokenType.AUTO);
        keywords.put("int", TokenType.INT);
        keywords.put("i32", TokenType.I32);
        keywords.put("i64", TokenType.I64);
        keywords.put("u32", TokenType.U32);
        keywords.put("u64", TokenType.U64);
        keywords.put("float", TokenType.FLOAT);
        keywords.put("f32", TokenType.F32);
        keywords.put("f64", TokenType.F64);
        keywords.put("bool", TokenType.BOOL);
        keywords.put("char", TokenType.CHAR);
        keywords.put("void", TokenType.VOID);
        keywords.put("true", TokenType.TRUE);
        keywords.put("false", TokenType.FALSE);
        keywords.put("NULL", TokenType.NULL);
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token, 最后一个总是EOF
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public LexerCheckpoint checkpoint() {
        return new LexerCheckpoint(position, line, column);
    }

    public void restore(LexerCheckpoint checkpoint) {
        this.position = checkpoint.position();
        this.line = checkpoint.line();
        this.column = checkpoint.column();
    }

    /**
     * 查看下一个Token但不消耗它
     */
    public Token peekToken() {
        LexerCheckpoint saved = checkpoint();
        try {
            return nextToken();
        } finally {
            restore(saved);
        }
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    public Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", Span.at(line, column));
        }

        int startLine = line;
        int startCol = column;
        char currentChar = peek();

        // 识别标识符或关键字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        if (currentChar == '"') {
            return readString();
        }
        if (currentChar == '\'') {
            return readChar();
        }

        // 识别运算符和分隔符, 最长匹配优先
        advance();
        switch (currentChar) {
            case '(': return make(TokenType.LPAREN, "(", startLine, startCol);
            case ')': return make(TokenType.RPAREN, ")", startLine, startCol);
            case '{': return make(TokenType.LBRACE, "{", startLine, startCol);
            case '}': return make(TokenType.RBRACE, "}", startLine, startCol);
            case '[': return make(TokenType.LBRACKET, "[", startLine, startCol);
            case ']': return make(TokenType.RBRACKET, "]", startLine, startCol);
            case ',': return make(TokenType.COMMA, ",", startLine, startCol);
            case ';': return make(TokenType.SEMICOLON, ";", startLine, startCol);
            case '?': return make(TokenType.QUESTION, "?", startLine, startCol);
            case '~': return make(TokenType.TILDE, "~", startLine, startCol);
            case '#': return make(TokenType.HASH, "#", startLine, startCol);
            case '@': return make(TokenType.AT, "@", startLine, startCol);
            case ':':
                if (match(':')) return make(TokenType.COLON_COLON, "::", startLine, startCol);
                return make(TokenType.COLON, ":", startLine, startCol);
            case '.':
                if (match('.')) {
                    if (match('=')) return make(TokenType.DOT_DOT_EQUAL, "..=", startLine, startCol);
                    return make(TokenType.DOT_DOT, "..", startLine, startCol);
                }
                return make(TokenType.DOT, ".", startLine, startCol);
            case '+':
                if (match('+')) return make(TokenType.PLUS_PLUS, "++", startLine, startCol);
                if (match('=')) return make(TokenType.PLUS_ASSIGN, "+=", startLine, startCol);
                return make(TokenType.PLUS, "+", startLine, startCol);
            case '-':
                if (match('-')) return make(TokenType.MINUS_MINUS, "--", startLine, startCol);
                if (match('=')) return make(TokenType.MINUS_ASSIGN, "-=", startLine, startCol);
                if (match('>')) return make(TokenType.ARROW, "->", startLine, startCol);
                return make(TokenType.MINUS, "-", startLine, startCol);
            case '*':
                if (match('=')) return make(TokenType.STAR_ASSIGN, "*=", startLine, startCol);
                return make(TokenType.STAR, "*", startLine, startCol);
            case '/':
                if (match('=')) return make(TokenType.SLASH_ASSIGN, "/=", startLine, startCol);
                return make(TokenType.SLASH, "/", startLine, startCol);
            case '%':
                if (match('=')) return make(TokenType.PERCENT_ASSIGN, "%=", startLine, startCol);
                return make(TokenType.PERCENT, "%", startLine, startCol);
            case '=':
                if (match('=')) return make(TokenType.EQUAL_EQUAL, "==", startLine, startCol);
                return make(TokenType.ASSIGN, "=", startLine, startCol);
            case '!':
                if (match('=')) return make(TokenType.NOT_EQUAL, "!=", startLine, startCol);
                return make(TokenType.BANG, "!", startLine, startCol);
            case '<':
                if (match('<')) {
                    if (match('=')) return make(TokenType.SHIFT_LEFT_ASSIGN, "<<=", startLine, startCol);
                    return make(TokenType.SHIFT_LEFT, "<<", startLine, startCol);
                }
                if (match('=')) return make(TokenType.LESS_EQUAL, "<=", startLine, startCol);
                return make(TokenType.LESS, "<", startLine, startCol);
            case '>':
                if (match('>')) {
                    if (match('=')) return make(TokenType.SHIFT_RIGHT_ASSIGN, ">>=", startLine, startCol);
                    return make(TokenType.SHIFT_RIGHT, ">>", startLine, startCol);
                }
                if (match('=')) return make(TokenType.GREATER_EQUAL, ">=", startLine, startCol);
                return make(TokenType.GREATER, ">", startLine, startCol);
            case '&':
                if (match('&')) return make(TokenType.AND_AND, "&&", startLine, startCol);
                if (match('=')) return make(TokenType.AND_ASSIGN, "&=", startLine, startCol);
                return make(TokenType.AMPERSAND, "&", startLine, startCol);
            case '|':
                if (match('|')) return make(TokenType.OR_OR, "||", startLine, startCol);
                if (match('=')) return make(TokenType.OR_ASSIGN, "|=", startLine, startCol);
                return make(TokenType.PIPE, "|", startLine, startCol);
            case '^':
                if (match('=')) return make(TokenType.XOR_ASSIGN, "^=", startLine, startCol);
                return make(TokenType.CARET, "^", startLine, startCol);
            default:
                throw new LexException(Span.at(startLine, startCol),
                        "invalid character '" + currentChar + "'");
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return make(type, text, startLine, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 小数点后必须紧跟数字, 以区分 `t.0` 和范围 `0..10`
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
            return make(TokenType.FLOAT_LITERAL, input.substring(startPos, position), startLine, startCol);
        }
        return make(TokenType.INT_LITERAL, input.substring(startPos, position), startLine, startCol);
    }

    private Token readString() {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的双引号
        StringBuilder sb = new StringBuilder();
        while (position < input.length() && peek() != '"') {
            char ch = peek();
            if (ch == '\n') {
                break;
            }
            if (ch == '\\') {
                advance();
                sb.append(readEscape(startLine, startCol, "unterminated string literal"));
            } else {
                sb.append(ch);
                advance();
            }
        }
        if (position >= input.length() || peek() != '"') {
            throw new LexException(Span.of(startLine, startCol, line, column), "unterminated string literal");
        }
        advance(); // 跳过结束的双引号
        return make(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
    }

    private Token readChar() {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的单引号
        if (position >= input.length() || peek() == '\n') {
            throw new LexException(Span.of(startLine, startCol, line, column), "unterminated char literal");
        }
        char value;
        if (peek() == '\\') {
            advance();
            value = readEscape(startLine, startCol, "unterminated char literal");
        } else {
            value = peek();
            advance();
        }
        if (peek() != '\'') {
            throw new LexException(Span.of(startLine, startCol, line, column), "unterminated char literal");
        }
        advance();
        return make(TokenType.CHAR_LITERAL, String.valueOf(value), startLine, startCol);
    }

    private char readEscape(int startLine, int startCol, String unterminated) {
        // 反斜杠是输入的最后一个字符
        if (position >= input.length()) {
            throw new LexException(Span.of(startLine, startCol, line, column), unterminated);
        }
        char escaped = peek();
        advance();
        return switch (escaped) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            case '\\' -> '\\';
            case '"' -> '"';
            case '\'' -> '\'';
            default -> throw new LexException(Span.of(startLine, startCol, line, column),
                    "invalid escape sequence '\\" + escaped + "'");
        };
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n') {
                advance();
            } else if (ch == '/' && peekNext() == '/') {
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else if (ch == '/' && peekNext() == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column;
        advance();
        advance();
        while (position < input.length()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw new LexException(Span.of(startLine, startCol, line, column), "unterminated block comment");
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private boolean match(char expected) {
        if (peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private Token make(TokenType type, String lexeme, int startLine, int startCol) {
        return new Token(type, lexeme, Span.of(startLine, startCol, line, column));
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
