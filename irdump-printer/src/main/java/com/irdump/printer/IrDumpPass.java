package com.irdump.printer;

import com.irdump.ir.mir.Executable;
import com.irdump.ir.pass.ExecutablePass;

import java.io.PrintStream;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * 调试用的 dump pass：启用时把可执行单元打印到 stderr（或指定的流），
 * 总是原样返回输入。
 * <p>启用条件（任一）：环境变量 {@code IRDUMP_DUMP_IR=1}、
 * 系统属性 {@code irdump.dump=true}、构造时强制启用。</p>
 */
public class IrDumpPass implements ExecutablePass {

    private static final Logger LOG = Logger.getLogger(IrDumpPass.class.getName());

    public static final String ENV_VAR = "IRDUMP_DUMP_IR";
    public static final String SYSTEM_PROPERTY = "irdump.dump";

    private final String label;
    private final IrPrinter printer;
    private final PrintStream out;
    private final boolean forced;
    private final Function<String, String> env;

    public IrDumpPass(String label) {
        this(label, new IrPrinter(), System.err, false);
    }

    public IrDumpPass(String label, IrPrinter printer, PrintStream out, boolean forced) {
        this(label, printer, out, forced, System::getenv);
    }

    /** 环境变量的读取方式可替换，测试不受进程环境影响 */
    IrDumpPass(String label, IrPrinter printer, PrintStream out, boolean forced, Function<String, String> env) {
        this.label = label;
        this.printer = printer;
        this.out = out;
        this.forced = forced;
        this.env = env;
    }

    @Override
    public String getName() {
        return "IrDump(" + label + ")";
    }

    public boolean isEnabled() {
        return forced
                || "1".equals(env.apply(ENV_VAR))
                || Boolean.parseBoolean(System.getProperty(SYSTEM_PROPERTY));
    }

    @Override
    public Executable run(Executable executable) {
        if (!isEnabled()) {
            LOG.fine("IR dump disabled, skipping " + executable.getName());
            return executable;
        }
        LOG.info("Dumping IR of " + executable.getName() + " (" + label + ")");
        out.println("===== IR DUMP: " + label + " =====");
        out.print(printer.dumpToString(executable));
        out.println("===== END IR DUMP =====");
        out.flush();
        return executable;
    }
}
