package com.irdump.ir.pass;

import com.irdump.ir.mir.Executable;

/**
 * 作用于单个可执行单元的 MIR pass 接口。
 */
public interface ExecutablePass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对可执行单元执行 pass，返回结果（可以是同一个对象）。
     */
    Executable run(Executable executable);
}
