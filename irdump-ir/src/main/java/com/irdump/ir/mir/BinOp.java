package com.irdump.ir.mir;

/**
 * MIR 二元运算符，带源码层面的符号。
 * 回绕（wrapping）变体以 % 结尾。
 */
public enum BinOp {
    BOOL_OR("BoolOr"),
    BOOL_AND("BoolAnd"),
    CMP_EQ("=="),
    CMP_NOT_EQ("!="),
    CMP_LESS_THAN("<"),
    CMP_GREATER_THAN(">"),
    CMP_LESS_OR_EQ("<="),
    CMP_GREATER_OR_EQ(">="),
    BIN_OR("|"),
    BIN_XOR("^"),
    BIN_AND("&"),
    BIT_SHIFT_LEFT("<<"),
    BIT_SHIFT_LEFT_WRAP("<<%"),
    BIT_SHIFT_RIGHT(">>"),
    ADD("+"),
    ADD_WRAP("+%"),
    SUB("-"),
    SUB_WRAP("-%"),
    MULT("*"),
    MULT_WRAP("*%"),
    DIV("/"),
    MOD("%"),
    ARRAY_CAT("++"),
    ARRAY_MULT("**");

    private final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
