package com.irdump.ir.mir;

/**
 * MIR 一元运算符。
 */
public enum UnOp {
    BOOL_NOT("!"),
    BIN_NOT("~"),
    NEGATION("-"),
    NEGATION_WRAP("-%"),
    ADDRESS_OF("&"),
    CONST_ADDRESS_OF("&const"),
    DEREFERENCE("*"),
    MAYBE("?"),
    ERROR("%"),
    UNWRAP_ERROR("%%"),
    UNWRAP_MAYBE("??"),
    MAYBE_RETURN("?return"),
    ERROR_RETURN("%return");

    private final String symbol;

    UnOp(String symbol) {
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
