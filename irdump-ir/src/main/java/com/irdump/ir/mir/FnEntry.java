package com.irdump.ir.mir;

/**
 * 函数表条目，打印时只用到链接名。
 */
public final class FnEntry {

    private final String symbolName;

    public FnEntry(String symbolName) {
        this.symbolName = symbolName;
    }

    public String getSymbolName() { return symbolName; }

    @Override
    public String toString() {
        return symbolName;
    }
}
