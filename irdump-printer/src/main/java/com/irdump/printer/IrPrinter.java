package com.irdump.printer;

import com.irdump.ir.mir.BasicBlock;
import com.irdump.ir.mir.Executable;
import com.irdump.ir.mir.IrContractException;
import com.irdump.ir.mir.IrInstruction;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MIR 文本 dump 的入口。
 * <p>按声明顺序遍历块，每块先输出 {@code name_id:} 标签（顶格），再逐条输出指令。
 * 不重排、不过滤。契约被破坏时记录 SEVERE 日志并原样抛出，
 * 之前已写入的内容保留在输出目标中。</p>
 */
public class IrPrinter {

    private static final Logger LOG = Logger.getLogger(IrPrinter.class.getName());

    private final PrintConfig config;
    private final OperandRenderer operands;
    private final InstructionPrinter instructions;

    public IrPrinter() {
        this(new PrintConfig());
    }

    public IrPrinter(PrintConfig config) {
        this.config = config;
        this.operands = new OperandRenderer();
        this.instructions = new InstructionPrinter(operands);
    }

    public PrintConfig getConfig() {
        return config;
    }

    /**
     * 指令的值是否在使用处内联（非 runtime）。
     */
    public boolean isInlined(IrInstruction inst) {
        return OperandRenderer.isInlined(inst);
    }

    public void dump(Executable executable, Appendable sink) {
        PrintContext ctx = new PrintContext(sink, executable, config);
        LOG.fine("Dumping " + executable.getName() + ": " + executable.getBlocks().size() + " blocks");
        try {
            for (BasicBlock block : executable.getBlocks()) {
                ctx.append(block.getLabel()).append(":").newLine();
                for (IrInstruction inst : block.getInstructions()) {
                    instructions.print(inst, ctx);
                }
            }
        } catch (IrContractException e) {
            LOG.log(Level.SEVERE, "IR contract violated while dumping " + executable.getName(), e);
            throw e;
        }
    }

    public static void dump(Executable executable, Appendable sink, PrintConfig config) {
        new IrPrinter(config).dump(executable, sink);
    }

    public String dumpToString(Executable executable) {
        StringBuilder sb = new StringBuilder();
        dump(executable, sb);
        return sb.toString();
    }

    public static String dumpToString(Executable executable, PrintConfig config) {
        return new IrPrinter(config).dumpToString(executable);
    }

    /**
     * 写入文件（UTF-8，覆盖已有文件），必要时创建父目录。
     */
    public void dumpToFile(Executable executable, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            dump(executable, writer);
        }
    }

    public static void dumpToFile(Executable executable, Path path, PrintConfig config) throws IOException {
        new IrPrinter(config).dumpToFile(executable, path);
    }
}
