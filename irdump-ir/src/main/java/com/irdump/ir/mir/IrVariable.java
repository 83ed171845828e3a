package com.irdump.ir.mir;

/**
 * 声明的变量。
 */
public class IrVariable {

    private final String name;
    private final boolean isConst;
    private final boolean isInline;

    public IrVariable(String name, boolean isConst, boolean isInline) {
        this.name = name;
        this.isConst = isConst;
        this.isInline = isInline;
    }

    public String getName() { return name; }
    public boolean isConst() { return isConst; }
    public boolean isInline() { return isInline; }

    @Override
    public String toString() {
        return (isInline ? "inline " : "") + (isConst ? "const " : "var ") + name;
    }
}
