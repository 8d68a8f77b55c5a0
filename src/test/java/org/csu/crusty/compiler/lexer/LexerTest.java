package org.csu.crusty.compiler.lexer;

import org.csu.crusty.common.exception.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private List<TokenType> types(String source) {
        System.out.println("Input: " + source);
        List<Token> tokens = new Lexer(source).tokenize();
        tokens.forEach(System.out::println);
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testKeywordsAndIdentifiers() {
        System.out.println("--- Running test: testKeywordsAndIdentifiers ---");
        List<TokenType> result = types("let var const int i64 auto NULL counter __MAX__");

        assertEquals(List.of(TokenType.LET, TokenType.VAR, TokenType.CONST, TokenType.INT, TokenType.I64,
                TokenType.AUTO, TokenType.NULL, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), result);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLongestMatchOperators() {
        System.out.println("--- Running test: testLongestMatchOperators ---");
        List<TokenType> result = types("a >>= b <= c -> d ..= e .. f ++ -- :: >>");

        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.SHIFT_RIGHT_ASSIGN, TokenType.IDENTIFIER, TokenType.LESS_EQUAL,
                TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.DOT_DOT_EQUAL,
                TokenType.IDENTIFIER, TokenType.DOT_DOT, TokenType.IDENTIFIER, TokenType.PLUS_PLUS,
                TokenType.MINUS_MINUS, TokenType.COLON_COLON, TokenType.SHIFT_RIGHT, TokenType.EOF), result);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCommentsAreSkipped() {
        System.out.println("--- Running test: testCommentsAreSkipped ---");
        String source = "// line comment\nint /* block\n comment */ x;";
        List<Token> tokens = new Lexer(source).tokenize();
        tokens.forEach(System.out::println);

        assertEquals(4, tokens.size(), "int, x, ';' and EOF should remain");
        assertEquals(TokenType.INT, tokens.get(0).type());
        assertEquals(2, tokens.get(0).line());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals(3, tokens.get(1).line(), "line numbers must advance inside block comments");
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNumbersTupleIndexAndRanges() {
        System.out.println("--- Running test: testNumbersTupleIndexAndRanges ---");
        assertEquals(List.of(TokenType.FLOAT_LITERAL, TokenType.EOF), types("3.14"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.INT_LITERAL, TokenType.EOF), types("t.0"));
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.DOT_DOT, TokenType.INT_LITERAL, TokenType.EOF),
                types("0..10"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringAndCharEscapes() {
        System.out.println("--- Running test: testStringAndCharEscapes ---");
        List<Token> tokens = new Lexer("\"a\\n\\\"b\" '\\t'").tokenize();

        assertEquals(TokenType.STRING_LITERAL, tokens.get(0).type());
        assertEquals("a\n\"b", tokens.get(0).lexeme());
        assertEquals(TokenType.CHAR_LITERAL, tokens.get(1).type());
        assertEquals("\t", tokens.get(1).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSpansAreEndExclusive() {
        System.out.println("--- Running test: testSpansAreEndExclusive ---");
        List<Token> tokens = new Lexer("let  value").tokenize();

        Token value = tokens.get(1);
        assertEquals(1, value.span().start().line());
        assertEquals(6, value.span().start().column());
        assertEquals(11, value.span().end().column());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnterminatedStringFails() {
        System.out.println("--- Running test: testUnterminatedStringFails ---");
        LexException exception = assertThrows(LexException.class, () -> new Lexer("\"never closed").tokenize());
        System.out.println("Caught expected exception: " + exception.getMessage());
        assertTrue(exception.getMessage().contains("unterminated string literal"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBackslashAtEndOfInputFails() {
        System.out.println("--- Running test: testBackslashAtEndOfInputFails ---");
        LexException string = assertThrows(LexException.class, () -> new Lexer("\"abc\\").tokenize());
        System.out.println("Caught expected exception: " + string.getMessage());
        assertTrue(string.getMessage().contains("unterminated string literal"));

        LexException character = assertThrows(LexException.class, () -> new Lexer("'\\").tokenize());
        System.out.println("Caught expected exception: " + character.getMessage());
        assertTrue(character.getMessage().contains("unterminated char literal"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnterminatedBlockCommentAndInvalidCharacter() {
        System.out.println("--- Running test: testUnterminatedBlockCommentAndInvalidCharacter ---");
        LexException comment = assertThrows(LexException.class, () -> new Lexer("int /* open").tokenize());
        assertTrue(comment.getMessage().contains("unterminated block comment"));

        LexException invalid = assertThrows(LexException.class, () -> new Lexer("int $x;").tokenize());
        assertTrue(invalid.getMessage().contains("invalid character '$'"));
        assertEquals(5, invalid.getSpan().start().column());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCheckpointRestoreAndPeek() {
        System.out.println("--- Running test: testCheckpointRestoreAndPeek ---");
        Lexer lexer = new Lexer("foo bar baz");

        assertEquals("foo", lexer.peekToken().lexeme(), "peek must not consume");
        assertEquals("foo", lexer.nextToken().lexeme());

        Lexer.LexerCheckpoint checkpoint = lexer.checkpoint();
        assertEquals("bar", lexer.nextToken().lexeme());
        assertEquals("baz", lexer.nextToken().lexeme());
        lexer.restore(checkpoint);

        Token again = lexer.nextToken();
        assertEquals("bar", again.lexeme());
        assertEquals(5, again.column());
        System.out.println("Result: Test PASSED.\n");
    }
}
