package org.csu.crusty.compiler.semantic;

import org.csu.crusty.common.model.Span;

/**
 * 一条语义错误. 分析器不会在第一个错误处停止
 */
public record SemanticError(Span span, SemanticErrorKind kind, String message) {

    /**
     * error[KIND] at 3:5-3:9: message
     */
    public String describe() {
        return "error[" + kind + "] at " + span + ": " + message;
    }
}
