package com.irdump.printer;

import com.irdump.ir.mir.AsmExpr;
import com.irdump.ir.mir.IrContractException;
import com.irdump.ir.mir.IrInstruction;
import com.irdump.ir.mir.IrVisitor;

import java.util.List;
import java.util.Locale;

/**
 * 指令渲染器。
 * <p>每条指令一行：固定宽度前缀（id、类型、使用计数）+ 按种类的正文 + 换行。
 * 操作数一律交给 {@link OperandRenderer}。</p>
 */
public class InstructionPrinter implements IrVisitor<Void, PrintContext> {

    private final OperandRenderer operands;

    public InstructionPrinter(OperandRenderer operands) {
        this.operands = operands;
    }

    public void print(IrInstruction inst, PrintContext ctx) {
        printPrefix(inst, ctx);
        try {
            inst.accept(this, ctx);
        } catch (IrContractException e) {
            throw IrContractException.at(e, inst.getId());
        }
        ctx.newLine();
    }

    /**
     * 前缀：边距 + {@code #id| type| count| }，只补齐不截断。
     */
    void printPrefix(IrInstruction inst, PrintContext ctx) {
        String typeName = inst.getType() != null ? inst.getType().getName() : "(unknown)";
        String count = inst.hasSideEffects() ? "-" : String.valueOf(inst.getRefCount());
        ctx.append(ctx.getIndent());
        ctx.append(String.format(Locale.ROOT, "#%-3d| %-12s| %-2s| ", inst.getId(), typeName, count));
    }

    private void operand(int id, PrintContext ctx) {
        operands.render(id, ctx);
    }

    private void call(String name, PrintContext ctx, int... args) {
        ctx.append(name).append("(");
        for (int i = 0; i < args.length; i++) {
            if (i > 0) ctx.append(", ");
            operand(args[i], ctx);
        }
        ctx.append(")");
    }

    private void fieldInits(List<IrInstruction.FieldInit> fields, PrintContext ctx) {
        for (int i = 0; i < fields.size(); i++) {
            IrInstruction.FieldInit field = fields.get(i);
            ctx.append(i == 0 ? "." : ", .").append(field.getName()).append(" = ");
            operand(field.getValueId(), ctx);
        }
    }

    private static String inlineKeyword(boolean isInline) {
        return isInline ? "inline " : "";
    }

    // ========== 控制流 ==========

    @Override
    public Void visitReturn(IrInstruction.Return inst, PrintContext ctx) {
        ctx.append("return ");
        operand(inst.getValueId(), ctx);
        return null;
    }

    @Override
    public Void visitCondBr(IrInstruction.CondBr inst, PrintContext ctx) {
        ctx.append(inlineKeyword(inst.isInline())).append("if (");
        operand(inst.getConditionId(), ctx);
        ctx.append(") ").append(ctx.blockRef(inst.getThenBlockId()))
                .append(" else ").append(ctx.blockRef(inst.getElseBlockId()));
        return null;
    }

    @Override
    public Void visitBr(IrInstruction.Br inst, PrintContext ctx) {
        ctx.append(inlineKeyword(inst.isInline())).append("goto ").append(ctx.blockRef(inst.getDestBlockId()));
        return null;
    }

    @Override
    public Void visitPhi(IrInstruction.Phi inst, PrintContext ctx) {
        if (inst.getIncomingCount() == 0) {
            throw new IrContractException("phi has no incoming edges", inst.getId());
        }
        for (int i = 0; i < inst.getIncomingCount(); i++) {
            if (i > 0) ctx.append(" ");
            ctx.append(ctx.blockRef(inst.getIncomingBlockId(i))).append(":");
            operand(inst.getIncomingValueId(i), ctx);
        }
        return null;
    }

    @Override
    public Void visitUnreachable(IrInstruction.Unreachable inst, PrintContext ctx) {
        ctx.append("unreachable");
        return null;
    }

    @Override
    public Void visitSwitchBr(IrInstruction.SwitchBr inst, PrintContext ctx) {
        ctx.append(inlineKeyword(inst.isInline())).append("switch (");
        operand(inst.getTargetValueId(), ctx);
        ctx.append(") ");
        for (IrInstruction.SwitchCase switchCase : inst.getCases()) {
            operand(switchCase.getValueId(), ctx);
            ctx.append(" => ").append(ctx.blockRef(switchCase.getBlockId())).append(", ");
        }
        ctx.append("else => ").append(ctx.blockRef(inst.getElseBlockId()));
        return null;
    }

    @Override
    public Void visitSwitchVar(IrInstruction.SwitchVar inst, PrintContext ctx) {
        ctx.append("switchvar ");
        operand(inst.getTargetValuePtrId(), ctx);
        ctx.append(", ");
        operand(inst.getProngValueId(), ctx);
        return null;
    }

    @Override
    public Void visitSwitchTarget(IrInstruction.SwitchTarget inst, PrintContext ctx) {
        ctx.append("switchtarget ");
        operand(inst.getTargetValuePtrId(), ctx);
        return null;
    }

    // ========== 值与运算 ==========

    @Override
    public Void visitConst(IrInstruction.Const inst, PrintContext ctx) {
        operands.getValueRenderer().render(inst.getType(), inst.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitBinOp(IrInstruction.BinOpInst inst, PrintContext ctx) {
        operand(inst.getLhsId(), ctx);
        ctx.append(" ").append(inst.getOp().getSymbol()).append(" ");
        operand(inst.getRhsId(), ctx);
        return null;
    }

    @Override
    public Void visitUnOp(IrInstruction.UnOpInst inst, PrintContext ctx) {
        ctx.append(inst.getOp().getSymbol()).append(" ");
        operand(inst.getValueId(), ctx);
        return null;
    }

    @Override
    public Void visitDeclVar(IrInstruction.DeclVar inst, PrintContext ctx) {
        ctx.append(inlineKeyword(inst.getVariable().isInline()))
                .append(inst.getVariable().isConst() ? "const " : "var ")
                .append(inst.getVariable().getName());
        if (inst.hasVarType()) {
            ctx.append(": ");
            operand(inst.getVarTypeId(), ctx);
        }
        ctx.append(" = ");
        operand(inst.getInitValueId(), ctx);
        return null;
    }

    @Override
    public Void visitCast(IrInstruction.Cast inst, PrintContext ctx) {
        ctx.append("cast ");
        operand(inst.getValueId(), ctx);
        ctx.append(" to ").append(inst.getDestType().getName());
        return null;
    }

    @Override
    public Void visitCall(IrInstruction.Call inst, PrintContext ctx) {
        if (inst.hasKnownFn()) {
            ctx.append(inst.getFn().getSymbolName());
        } else {
            operand(inst.getFnRefId(), ctx);
        }
        call("", ctx, inst.getArgIds());
        return null;
    }

    // ========== 初始化 ==========

    @Override
    public Void visitContainerInitList(IrInstruction.ContainerInitList inst, PrintContext ctx) {
        operand(inst.getContainerTypeId(), ctx);
        ctx.append("{");
        int[] items = inst.getItemIds();
        for (int i = 0; i < items.length; i++) {
            if (i > 0) ctx.append(", ");
            operand(items[i], ctx);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitContainerInitFields(IrInstruction.ContainerInitFields inst, PrintContext ctx) {
        operand(inst.getContainerTypeId(), ctx);
        ctx.append("{");
        fieldInits(inst.getFields(), ctx);
        ctx.append("} // container init");
        return null;
    }

    @Override
    public Void visitStructInit(IrInstruction.StructInit inst, PrintContext ctx) {
        ctx.append(inst.getStructType().getName()).append(" {");
        fieldInits(inst.getFields(), ctx);
        ctx.append("} // struct init");
        return null;
    }

    // ========== 指针与字段 ==========

    @Override
    public Void visitElemPtr(IrInstruction.ElemPtr inst, PrintContext ctx) {
        ctx.append("&");
        operand(inst.getArrayPtrId(), ctx);
        ctx.append("[");
        operand(inst.getElemIndexId(), ctx);
        ctx.append("]");
        if (!inst.isSafetyCheckOn()) {
            ctx.append(" // no safety");
        }
        return null;
    }

    @Override
    public Void visitVarPtr(IrInstruction.VarPtr inst, PrintContext ctx) {
        ctx.append("&").append(inst.getVariable().getName());
        return null;
    }

    @Override
    public Void visitLoadPtr(IrInstruction.LoadPtr inst, PrintContext ctx) {
        ctx.append("*");
        operand(inst.getPtrId(), ctx);
        return null;
    }

    @Override
    public Void visitStorePtr(IrInstruction.StorePtr inst, PrintContext ctx) {
        ctx.append("*");
        operand(inst.getPtrId(), ctx);
        ctx.append(" = ");
        operand(inst.getValueId(), ctx);
        return null;
    }

    @Override
    public Void visitFieldPtr(IrInstruction.FieldPtr inst, PrintContext ctx) {
        ctx.append("fieldptr ");
        operand(inst.getContainerPtrId(), ctx);
        ctx.append(".").append(inst.getFieldName());
        return null;
    }

    @Override
    public Void visitStructFieldPtr(IrInstruction.StructFieldPtr inst, PrintContext ctx) {
        ctx.append("@StructFieldPtr(&");
        operand(inst.getStructPtrId(), ctx);
        ctx.append(".").append(inst.getFieldName()).append(")");
        return null;
    }

    @Override
    public Void visitEnumFieldPtr(IrInstruction.EnumFieldPtr inst, PrintContext ctx) {
        ctx.append("@EnumFieldPtr(&");
        operand(inst.getEnumPtrId(), ctx);
        ctx.append(".").append(inst.getFieldName()).append(")");
        return null;
    }

    @Override
    public Void visitUnwrapMaybe(IrInstruction.UnwrapMaybe inst, PrintContext ctx) {
        ctx.append("&??*");
        operand(inst.getValueId(), ctx);
        if (!inst.isSafetyCheckOn()) {
            ctx.append(" // no safety");
        }
        return null;
    }

    // ========== 单操作数 ==========

    @Override
    public Void visitTypeOf(IrInstruction.TypeOf inst, PrintContext ctx) {
        call("@typeOf", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitToPtrType(IrInstruction.ToPtrType inst, PrintContext ctx) {
        call("@toPtrType", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitPtrTypeChild(IrInstruction.PtrTypeChild inst, PrintContext ctx) {
        call("@ptrTypeChild", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitCompileVar(IrInstruction.CompileVar inst, PrintContext ctx) {
        call("@compileVar", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitSizeOf(IrInstruction.SizeOf inst, PrintContext ctx) {
        call("@sizeOf", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitTestNull(IrInstruction.TestNull inst, PrintContext ctx) {
        ctx.append("*");
        operand(inst.getValueId(), ctx);
        ctx.append(" == null");
        return null;
    }

    @Override
    public Void visitClz(IrInstruction.Clz inst, PrintContext ctx) {
        call("@clz", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitCtz(IrInstruction.Ctz inst, PrintContext ctx) {
        call("@ctz", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitEnumTag(IrInstruction.EnumTag inst, PrintContext ctx) {
        ctx.append("enumtag ");
        operand(inst.getValueId(), ctx);
        return null;
    }

    @Override
    public Void visitStaticEval(IrInstruction.StaticEval inst, PrintContext ctx) {
        call("@staticEval", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitImport(IrInstruction.Import inst, PrintContext ctx) {
        call("@import", ctx, inst.getValueId());
        return null;
    }

    @Override
    public Void visitArrayLen(IrInstruction.ArrayLen inst, PrintContext ctx) {
        operand(inst.getValueId(), ctx);
        ctx.append(".len");
        return null;
    }

    @Override
    public Void visitRef(IrInstruction.Ref inst, PrintContext ctx) {
        ctx.append("ref ");
        operand(inst.getValueId(), ctx);
        return null;
    }

    // ========== 编译期设置 ==========

    @Override
    public Void visitSetFnTest(IrInstruction.SetFnTest inst, PrintContext ctx) {
        call("@setFnTest", ctx, inst.getFnValueId(), inst.getIsTestId());
        return null;
    }

    @Override
    public Void visitSetFnVisible(IrInstruction.SetFnVisible inst, PrintContext ctx) {
        call("@setFnVisible", ctx, inst.getFnValueId(), inst.getIsVisibleId());
        return null;
    }

    @Override
    public Void visitSetDebugSafety(IrInstruction.SetDebugSafety inst, PrintContext ctx) {
        call("@setDebugSafety", ctx, inst.getScopeValueId(), inst.getDebugSafetyOnId());
        return null;
    }

    // ========== 类型构造与汇编 ==========

    @Override
    public Void visitArrayType(IrInstruction.ArrayType inst, PrintContext ctx) {
        ctx.append("[");
        operand(inst.getSizeId(), ctx);
        ctx.append("]");
        operand(inst.getChildTypeId(), ctx);
        return null;
    }

    @Override
    public Void visitSliceType(IrInstruction.SliceType inst, PrintContext ctx) {
        ctx.append(inst.isConst() ? "[]const " : "[]");
        operand(inst.getChildTypeId(), ctx);
        return null;
    }

    @Override
    public Void visitAsm(IrInstruction.Asm inst, PrintContext ctx) {
        AsmExpr asm = inst.getAsm();
        ctx.append("asm").append(inst.isVolatile() ? " volatile" : "")
                .append(" (\"").append(asm.getTemplate()).append("\") : ");

        List<AsmExpr.Output> outputs = asm.getOutputs();
        for (int i = 0; i < outputs.size(); i++) {
            AsmExpr.Output output = outputs.get(i);
            if (i > 0) ctx.append(", ");
            ctx.append("[").append(output.getSymbolicName()).append("] \"")
                    .append(output.getConstraint()).append("\" (");
            if (output.returnsValue()) {
                ctx.append("-> ");
                operand(inst.getOutputTypeId(i), ctx);
            } else {
                ctx.append(output.getVariableName());
            }
            ctx.append(")");
        }

        ctx.append(" : ");
        List<AsmExpr.Input> inputs = asm.getInputs();
        for (int i = 0; i < inputs.size(); i++) {
            AsmExpr.Input input = inputs.get(i);
            if (i > 0) ctx.append(", ");
            ctx.append("[").append(input.getSymbolicName()).append("] \"")
                    .append(input.getConstraint()).append("\" (");
            operand(inst.getInputId(i), ctx);
            ctx.append(")");
        }

        ctx.append(" : ");
        List<String> clobbers = asm.getClobbers();
        for (int i = 0; i < clobbers.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append("\"").append(clobbers.get(i)).append("\"");
        }
        ctx.append(")");
        return null;
    }
}
