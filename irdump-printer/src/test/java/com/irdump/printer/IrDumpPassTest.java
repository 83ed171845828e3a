package com.irdump.printer;

import com.irdump.ir.mir.Executable;
import com.irdump.ir.mir.IrBuilder;
import com.irdump.ir.mir.IrType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IrDumpPass 测试")
class IrDumpPassTest {

    private ByteArrayOutputStream bytes;
    private PrintStream out;
    private Executable exec;

    @BeforeEach
    void setUp() {
        System.clearProperty(IrDumpPass.SYSTEM_PROPERTY);
        bytes = new ByteArrayOutputStream();
        out = new PrintStream(bytes, true);
        exec = new Executable("main");
        IrBuilder b = new IrBuilder(exec, "entry");
        b.emitReturn(b.emitConstInt(IrType.ofInt(true, 32), 42).getId());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(IrDumpPass.SYSTEM_PROPERTY);
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("强制启用时输出带横幅的 dump")
    void testForced() {
        IrDumpPass pass = new IrDumpPass("after lowering", new IrPrinter(), out, true);

        assertThat(pass.run(exec)).isSameAs(exec);
        assertThat(output()).isEqualTo(
                "===== IR DUMP: after lowering =====" + System.lineSeparator()
                        + new IrPrinter().dumpToString(exec)
                        + "===== END IR DUMP =====" + System.lineSeparator());
    }

    @Test
    @DisplayName("未启用时不输出，原样返回")
    void testDisabled() {
        IrDumpPass pass = new IrDumpPass("quiet", new IrPrinter(), out, false, name -> null);

        assertThat(pass.isEnabled()).isFalse();
        assertThat(pass.run(exec)).isSameAs(exec);
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("环境变量 IRDUMP_DUMP_IR=1 启用，其他取值不启用")
    void testEnvironmentVariable() {
        Map<String, String> env = new HashMap<>();
        env.put(IrDumpPass.ENV_VAR, "1");
        IrDumpPass pass = new IrDumpPass("env", new IrPrinter(), out, false, env::get);

        assertThat(pass.isEnabled()).isTrue();
        pass.run(exec);
        assertThat(output()).startsWith("===== IR DUMP: env =====");

        env.put(IrDumpPass.ENV_VAR, "true");
        assertThat(pass.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("系统属性 irdump.dump=true 启用")
    void testSystemProperty() {
        System.setProperty(IrDumpPass.SYSTEM_PROPERTY, "true");
        IrDumpPass pass = new IrDumpPass("prop", new IrPrinter(), out, false, name -> null);

        assertThat(pass.isEnabled()).isTrue();
        pass.run(exec);
        assertThat(output()).contains("| return 42");
    }

    @Test
    @DisplayName("使用传入的打印配置")
    void testConfiguredPrinter() {
        PrintConfig config = new PrintConfig();
        config.setIndentSize(0);
        new IrDumpPass("flat", new IrPrinter(config), out, true).run(exec);
        assertThat(output()).contains("entry_0:" + "\n" + "#0  | i32");
    }

    @Test
    @DisplayName("pass 名称包含标签")
    void testName() {
        assertThat(new IrDumpPass("x").getName()).isEqualTo("IrDump(x)");
    }
}
