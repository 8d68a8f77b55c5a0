package org.csu.crusty.compiler.parser.ast.expression;

/**
 * @author hidyouth
 * @description: 二元运算符, 赋值和复合赋值也在其中
 */
public enum BinaryOperator {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
    EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">="),
    AND("&&"), OR("||"),
    BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"), SHL("<<"), SHR(">>"),
    ASSIGN("="),
    ADD_ASSIGN("+="), SUB_ASSIGN("-="), MUL_ASSIGN("*="), DIV_ASSIGN("/="), MOD_ASSIGN("%="),
    AND_ASSIGN("&="), OR_ASSIGN("|="), XOR_ASSIGN("^="), SHL_ASSIGN("<<="), SHR_ASSIGN(">>=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isAssignment() {
        return ordinal() >= ASSIGN.ordinal();
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }
}
