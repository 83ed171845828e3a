package com.irdump.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 基本块。
 * <p>块名由名称提示和 debug id 组成（例如 then_0），指令按执行顺序排列。</p>
 */
public class BasicBlock {

    private final int id;
    private final String nameHint;
    private final List<IrInstruction> instructions;

    BasicBlock(int id, String nameHint) {
        if (nameHint == null || nameHint.isEmpty()) {
            throw new IrContractException("block name hint must not be empty");
        }
        this.id = id;
        this.nameHint = nameHint;
        this.instructions = new ArrayList<>();
    }

    public int getId() { return id; }
    public String getNameHint() { return nameHint; }

    /** 块的显示名：nameHint_id */
    public String getLabel() {
        return nameHint + "_" + id;
    }

    public List<IrInstruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    void addInstruction(IrInstruction inst) {
        inst.attachTo(id);
        instructions.add(inst);
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public String toString() {
        return getLabel() + " (" + instructions.size() + " instructions)";
    }
}
