package org.csu.crusty.engine;

/**
 * @author hidyouth
 * @description: 编译器配置
 * 类加载时读取一次. 先读系统属性, 没有则读环境变量, 再没有用默认值
 */
public final class CompilerConfig {
    private CompilerConfig() {}

    /**
     * 详细日志开关
     * 系统属性: crusty.verbose, 环境变量: CRUSTY_VERBOSE
     */
    public static final boolean VERBOSE = Boolean.parseBoolean(get("crusty.verbose", "CRUSTY_VERBOSE", "false"));

    /**
     * 生成可执行文件时调用的 rustc 路径
     * 系统属性: crusty.rustc, 环境变量: CRUSTY_RUSTC
     */
    public static final String RUSTC = get("crusty.rustc", "CRUSTY_RUSTC", "rustc");

    /**
     * 生成代码时每一级缩进的空格数
     * 系统属性: crusty.indent, 环境变量: CRUSTY_INDENT
     */
    public static final int INDENT_WIDTH = parseIndent(get("crusty.indent", "CRUSTY_INDENT", "4"));

    public static String indentUnit() {
        return " ".repeat(INDENT_WIDTH);
    }

    private static String get(String property, String env, String defaultValue) {
        String value = System.getProperty(property);
        if (value == null) {
            value = System.getenv(env);
        }
        return value != null ? value : defaultValue;
    }

    private static int parseIndent(String value) {
        try {
            int width = Integer.parseInt(value.trim());
            return width > 0 ? width : 4;
        } catch (NumberFormatException e) {
            return 4;
        }
    }
}
