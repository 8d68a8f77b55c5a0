package org.csu.crusty.common.exception;

import lombok.Getter;
import org.csu.crusty.common.model.Span;
import org.csu.crusty.compiler.lexer.Token;

import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常. 解析遇到第一个错误即终止, 不返回部分AST
 */
@Getter
public class ParseException extends RuntimeException {

    private final Span span;
    private final String reason;
    private final List<String> expected;
    private final String found;

    public ParseException(Span span, String reason, List<String> expected, String found) {
        super(format(span, reason, expected, found));
        this.span = span;
        this.reason = reason;
        this.expected = List.copyOf(expected);
        this.found = found;
    }

    public ParseException(Token token, String expected) {
        this(token.span(),
                "Expected " + expected + ", but found '" + token.lexeme() + "' (" + token.type() + ")",
                List.of(expected),
                token.describe());
    }

    private static String format(Span span, String reason, List<String> expected, String found) {
        StringBuilder sb = new StringBuilder();
        sb.append("Syntax Error at ").append(span).append(": ").append(reason);
        if (!expected.isEmpty()) {
            sb.append(" (expected one of ").append(expected).append(", found ").append(found).append(')');
        }
        return sb.toString();
    }
}
