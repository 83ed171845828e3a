package com.irdump.ir.mir;

/**
 * 词法块常量（block 类型的值），按源码位置标识。
 */
public final class ScopeEntry {

    private final SourceLocation location;

    public ScopeEntry(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return "scope@" + location;
    }
}
