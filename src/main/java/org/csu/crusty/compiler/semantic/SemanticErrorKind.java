package org.csu.crusty.compiler.semantic;

/**
 * @author hidyouth
 * @description: 语义错误的种类
 */
public enum SemanticErrorKind {
    UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    DUPLICATE_DEFINITION,
    INVALID_OPERATION,
    UNSUPPORTED_FEATURE
}
