package org.csu.crusty.common.exception;

import lombok.Getter;
import org.csu.crusty.common.model.Span;

/**
 * @author hidyouth
 * @description: 词法分析阶段的异常 (未闭合的字符串/注释, 非法字符)
 */
@Getter
public class LexException extends RuntimeException {

    private final Span span;

    public LexException(Span span, String message) {
        super(String.format("Lex Error at %s: %s", span, message));
        this.span = span;
    }
}
