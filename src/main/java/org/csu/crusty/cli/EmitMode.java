package org.csu.crusty.cli;

/**
 * @author hidyouth
 * @description: --emit 选项
 */
public enum EmitMode {
    RUST,
    CRUSTY,
    AST,
    TOKENS,
    BINARY;

    public static EmitMode fromId(String id) {
        for (EmitMode mode : values()) {
            if (mode.name().equalsIgnoreCase(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown emit mode '" + id + "' (expected rust, crusty, ast, tokens or binary)");
    }
}
