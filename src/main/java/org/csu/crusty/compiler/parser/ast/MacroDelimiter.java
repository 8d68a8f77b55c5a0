package org.csu.crusty.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 宏参数列表使用的括号种类. 宏的每次调用都必须使用定义时的种类
 */
public enum MacroDelimiter {
    PARENS("parentheses", "(", ")"),
    BRACKETS("brackets", "[", "]"),
    BRACES("braces", "{", "}"),
    NONE("no delimiter", "", "");

    private final String displayName;
    private final String open;
    private final String close;

    MacroDelimiter(String displayName, String open, String close) {
        this.displayName = displayName;
        this.open = open;
        this.close = close;
    }

    public String displayName() {
        return displayName;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }
}
