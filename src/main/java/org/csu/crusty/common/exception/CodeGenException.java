package org.csu.crusty.common.exception;

/**
 * @author hidyouth
 * @description: 代码生成阶段遇到无法输出的AST结构时抛出
 */
public class CodeGenException extends RuntimeException {
    public CodeGenException(String message) {
        super(message);
    }
}
