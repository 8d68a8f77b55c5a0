package org.csu.crusty.compiler.parser.ast.expression;

public enum UnaryOperator {
    NOT("!"),
    NEG("-"),
    BIT_NOT("~"),
    REF("&"),
    REF_MUT("&var"),
    DEREF("*"),
    PRE_INC("++"),
    PRE_DEC("--"),
    POST_INC("++"),
    POST_DEC("--");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * ++ 和 -- 会写入操作数
     */
    public boolean isIncrementOrDecrement() {
        return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
    }

    public boolean isPostfix() {
        return this == POST_INC || this == POST_DEC;
    }
}
