package com.irdump.printer;

import com.irdump.ir.mir.IrInstruction;

/**
 * 操作数引用渲染器。
 * <p>只看被引用指令自身的求值状态：非 runtime 时内联其值，否则输出 {@code #id}。
 * 从不沿生产者链继续展开，所以递归深度只取决于值的嵌套，与指令图大小无关。</p>
 */
public class OperandRenderer {

    private final ConstValueRenderer values;

    public OperandRenderer() {
        this.values = new ConstValueRenderer(this);
    }

    public ConstValueRenderer getValueRenderer() {
        return values;
    }

    /**
     * 指令的值是否会在使用处内联。
     */
    public static boolean isInlined(IrInstruction inst) {
        return !inst.getValue().isRuntime();
    }

    public void render(int instructionId, PrintContext ctx) {
        render(ctx.instruction(instructionId), ctx);
    }

    public void render(IrInstruction inst, PrintContext ctx) {
        if (isInlined(inst)) {
            values.render(inst.getType(), inst.getValue(), ctx);
        } else {
            ctx.append("#").append(String.valueOf(inst.getId()));
        }
    }
}
