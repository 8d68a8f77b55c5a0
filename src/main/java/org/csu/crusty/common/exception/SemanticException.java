package org.csu.crusty.common.exception;

import lombok.Getter;
import org.csu.crusty.compiler.semantic.SemanticError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 语义分析阶段的自定义异常
 * 语义错误是累积的, 一个异常携带整个文件的全部错误
 */
@Getter
public class SemanticException extends RuntimeException {

    private final List<SemanticError> errors;

    public SemanticException(List<SemanticError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    private static String format(List<SemanticError> errors) {
        return "Semantic analysis failed with " + errors.size() + " error(s):\n"
                + errors.stream().map(e -> "  " + e.describe()).collect(Collectors.joining("\n"));
    }
}
