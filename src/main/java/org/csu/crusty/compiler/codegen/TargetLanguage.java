package org.csu.crusty.compiler.codegen;

/**
 * @author hidyouth
 * @description: 代码生成的目标方言
 */
public enum TargetLanguage {
    /** 基于闭包的系统语言方言 (Rust) */
    RUST("rust", ".rs"),
    /** C 风格的源语言本身, 用于格式化输出 */
    CRUSTY("crusty", ".crst");

    private final String id;
    private final String fileExtension;

    TargetLanguage(String id, String fileExtension) {
        this.id = id;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public static TargetLanguage fromId(String id) {
        for (TargetLanguage language : values()) {
            if (language.id.equalsIgnoreCase(id)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown target language: " + id);
    }
}
