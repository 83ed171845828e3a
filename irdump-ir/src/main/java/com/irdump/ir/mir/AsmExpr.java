package com.irdump.ir.mir;

import java.util.Collections;
import java.util.List;

/**
 * 内联汇编的语法部分：模板、输出、输入与 clobber 列表。
 * 输出类型与输入值是 {@link IrInstruction.Asm} 上的操作数。
 */
public class AsmExpr {

    private final String template;
    private final List<Output> outputs;
    private final List<Input> inputs;
    private final List<String> clobbers;

    public AsmExpr(String template, List<Output> outputs, List<Input> inputs, List<String> clobbers) {
        this.template = template;
        this.outputs = Collections.unmodifiableList(outputs);
        this.inputs = Collections.unmodifiableList(inputs);
        this.clobbers = Collections.unmodifiableList(clobbers);
    }

    public String getTemplate() { return template; }
    public List<Output> getOutputs() { return outputs; }
    public List<Input> getInputs() { return inputs; }
    public List<String> getClobbers() { return clobbers; }

    /**
     * 汇编输出。要么写入变量，要么作为表达式结果返回（-> type）。
     */
    public static class Output {
        private final String symbolicName;
        private final String constraint;
        private final String variableName;  // returnsValue 时为 null

        private Output(String symbolicName, String constraint, String variableName) {
            this.symbolicName = symbolicName;
            this.constraint = constraint;
            this.variableName = variableName;
        }

        public static Output toVariable(String symbolicName, String constraint, String variableName) {
            return new Output(symbolicName, constraint, variableName);
        }

        public static Output returning(String symbolicName, String constraint) {
            return new Output(symbolicName, constraint, null);
        }

        public String getSymbolicName() { return symbolicName; }
        public String getConstraint() { return constraint; }
        public String getVariableName() { return variableName; }
        public boolean returnsValue() { return variableName == null; }
    }

    /** 汇编输入 */
    public static class Input {
        private final String symbolicName;
        private final String constraint;

        public Input(String symbolicName, String constraint) {
            this.symbolicName = symbolicName;
            this.constraint = constraint;
        }

        public String getSymbolicName() { return symbolicName; }
        public String getConstraint() { return constraint; }
    }
}
