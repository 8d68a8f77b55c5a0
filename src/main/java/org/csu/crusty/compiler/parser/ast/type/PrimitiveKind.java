package org.csu.crusty.compiler.parser.ast.type;

/**
 * @author hidyouth
 * @description: 基本类型以及它们在两种目标语言中的名字
 */
public enum PrimitiveKind {
    INT("int", "i32"),
    I32("i32", "i32"),
    I64("i64", "i64"),
    U32("u32", "u32"),
    U64("u64", "u64"),
    FLOAT("float", "f64"),
    F32("f32", "f32"),
    F64("f64", "f64"),
    BOOL("bool", "bool"),
    CHAR("char", "char"),
    VOID("void", "()");

    private final String crustyName;
    private final String rustName;

    PrimitiveKind(String crustyName, String rustName) {
        this.crustyName = crustyName;
        this.rustName = rustName;
    }

    public String crustyName() {
        return crustyName;
    }

    public String rustName() {
        return rustName;
    }
}
