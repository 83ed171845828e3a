package com.irdump.printer;

import com.irdump.ir.mir.BasicBlock;
import com.irdump.ir.mir.Executable;
import com.irdump.ir.mir.IrContractException;
import com.irdump.ir.mir.IrInstruction;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 打印上下文：输出目标、配置快照、正在打印的可执行单元以及当前值嵌套深度。
 * <p>不可变。进入嵌套值时通过 {@link #descend()} 得到新的上下文，
 * 因此同一个渲染器可以同时服务互不相干的多次 dump。</p>
 */
public final class PrintContext {

    private final Appendable sink;
    private final Executable executable;
    private final String indent;
    private final String blockSigil;
    private final int maxValueDepth;
    private final int valueDepth;

    public PrintContext(Appendable sink, Executable executable, PrintConfig config) {
        this(sink, executable, config.getIndentString(), config.getBlockSigil(), config.getMaxValueDepth(), 0);
    }

    private PrintContext(Appendable sink, Executable executable, String indent, String blockSigil,
                         int maxValueDepth, int valueDepth) {
        this.sink = sink;
        this.executable = executable;
        this.indent = indent;
        this.blockSigil = blockSigil;
        this.maxValueDepth = maxValueDepth;
        this.valueDepth = valueDepth;
    }

    public Executable getExecutable() { return executable; }
    public String getIndent() { return indent; }
    public int getValueDepth() { return valueDepth; }
    public int getMaxValueDepth() { return maxValueDepth; }

    /**
     * 进入下一层嵌套值。
     * <p>顶层值深度为 0，不计入上限；最多允许 {@code maxValueDepth} 层嵌套。</p>
     */
    public PrintContext descend() {
        if (valueDepth + 1 > maxValueDepth) {
            throw new IrContractException("value nesting exceeds " + maxValueDepth + " levels");
        }
        return new PrintContext(sink, executable, indent, blockSigil, maxValueDepth, valueDepth + 1);
    }

    public IrInstruction instruction(int id) {
        return executable.getInstruction(id);
    }

    /**
     * 块引用记号：sigil + 块名。
     */
    public String blockRef(int blockId) {
        BasicBlock block = executable.getBlock(blockId);
        return blockSigil + block.getLabel();
    }

    public PrintContext append(String text) {
        try {
            sink.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write IR dump", e);
        }
        return this;
    }

    public PrintContext newLine() {
        return append("\n");
    }
}
