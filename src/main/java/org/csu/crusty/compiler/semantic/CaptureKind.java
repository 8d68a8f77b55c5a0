package org.csu.crusty.compiler.semantic;

/**
 * 嵌套函数对外层绑定的使用方式. 写入 (=, 复合赋值, ++, --, &var) 为 MUTABLE
 */
public enum CaptureKind {
    IMMUTABLE,
    MUTABLE
}
