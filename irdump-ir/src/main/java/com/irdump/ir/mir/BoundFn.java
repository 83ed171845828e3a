package com.irdump.ir.mir;

/**
 * 绑定函数：函数 + 已捕获的第一个实参（偏应用）。
 * 第一个实参以指令 id 引用，不持有该指令。
 */
public final class BoundFn {

    private final FnEntry fn;
    private final int firstArgId;

    public BoundFn(FnEntry fn, int firstArgId) {
        this.fn = fn;
        this.firstArgId = firstArgId;
    }

    public FnEntry getFn() { return fn; }
    public int getFirstArgId() { return firstArgId; }

    @Override
    public String toString() {
        return "bound " + fn + " to #" + firstArgId;
    }
}
