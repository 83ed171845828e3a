package com.irdump.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个可执行单元（函数体或编译期求值块）的 MIR。
 * <p>持有按顺序排列的基本块，并作为指令与块的 arena：
 * 指令之间、指令与块之间的引用都是 debug id，在这里解析。
 * 块 id 与指令 id 各自单调递增，互不相干。</p>
 */
public class Executable {

    private final String name;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<Integer, BasicBlock> blocksById = new HashMap<>();
    private final Map<Integer, IrInstruction> instructionsById = new HashMap<>();
    private int nextBlockId;
    private int nextInstructionId;

    public Executable(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public int getInstructionCount() {
        return instructionsById.size();
    }

    // ========== id 分配 ==========

    public int nextInstructionId() {
        return nextInstructionId++;
    }

    /** 下一个可用的指令 id，不占用；{@link #append} 成功后才前移 */
    public int peekInstructionId() {
        return nextInstructionId;
    }

    // ========== 块 ==========

    /**
     * 追加一个新块，分配下一个块 id。
     */
    public BasicBlock newBlock(String nameHint) {
        BasicBlock block = new BasicBlock(nextBlockId++, nameHint);
        blocks.add(block);
        blocksById.put(block.getId(), block);
        return block;
    }

    public BasicBlock getBlock(int blockId) {
        BasicBlock block = blocksById.get(blockId);
        if (block == null) {
            throw new IrContractException("unknown block id " + blockId + " in " + name);
        }
        return block;
    }

    public boolean hasBlock(int blockId) {
        return blocksById.containsKey(blockId);
    }

    // ========== 指令 ==========

    /**
     * 把指令追加到指定块末尾并登记到 arena。
     */
    public void append(BasicBlock block, IrInstruction inst) {
        if (blocksById.get(block.getId()) != block) {
            throw new IrContractException("block " + block.getLabel() + " does not belong to " + name, inst.getId());
        }
        if (instructionsById.containsKey(inst.getId())) {
            throw new IrContractException("duplicate instruction id in " + name, inst.getId());
        }
        block.addInstruction(inst);
        instructionsById.put(inst.getId(), inst);
        if (inst.getId() >= nextInstructionId) {
            nextInstructionId = inst.getId() + 1;
        }
    }

    public IrInstruction getInstruction(int instructionId) {
        IrInstruction inst = instructionsById.get(instructionId);
        if (inst == null) {
            throw new IrContractException("unknown instruction id " + instructionId + " in " + name);
        }
        return inst;
    }

    public boolean hasInstruction(int instructionId) {
        return instructionsById.containsKey(instructionId);
    }

    @Override
    public String toString() {
        return "Executable(" + name + ", " + blocks.size() + " blocks, "
                + instructionsById.size() + " instructions)";
    }
}
