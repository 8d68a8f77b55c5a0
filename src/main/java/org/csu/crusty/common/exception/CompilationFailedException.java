package org.csu.crusty.common.exception;

/**
 * 外部编译器 (rustc) 调用失败
 */
public class CompilationFailedException extends RuntimeException {

    public CompilationFailedException(String message) {
        super(message);
    }

    public CompilationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
