package com.irdump.ir.mir;

/**
 * IR 内部契约被破坏。
 * <p>只会由编译器自身的 bug 触发（未知 id、空 Phi、RUNTIME 值被内联等），
 * 不是用户错误，调用方不应尝试恢复。</p>
 */
public class IrContractException extends RuntimeException {
    private final int instructionId;

    public IrContractException(String message) {
        super(message);
        this.instructionId = -1;
    }

    public IrContractException(String message, int instructionId) {
        super(message);
        this.instructionId = instructionId;
    }

    /**
     * 给一个没有指令 id 的异常补上出错指令。
     */
    public static IrContractException at(IrContractException e, int instructionId) {
        if (e.hasInstructionId()) {
            return e;
        }
        IrContractException located = new IrContractException(e.getMessage(), instructionId);
        located.initCause(e);
        return located;
    }

    /** 出错指令的 debug id，未知时为 -1 */
    public int getInstructionId() {
        return instructionId;
    }

    public boolean hasInstructionId() {
        return instructionId >= 0;
    }

    @Override
    public String getMessage() {
        if (instructionId < 0) {
            return super.getMessage();
        }
        return super.getMessage() + " (instruction #" + instructionId + ")";
    }
}
