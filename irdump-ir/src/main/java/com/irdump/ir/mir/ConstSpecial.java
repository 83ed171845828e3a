package com.irdump.ir.mir;

/**
 * 指令的求值状态。
 */
public enum ConstSpecial {
    /** 只有运行时才知道，打印时只能引用 #id */
    RUNTIME,
    /** 显式未定义（如未初始化的存储） */
    UNDEF,
    /** 隐式零填充 */
    ZEROES,
    /** 编译期已知，携带具体值 */
    STATIC
}
