package com.irdump.ir.mir;

/**
 * MIR 指令访问者接口。
 * <p>每个指令种类一个方法；新增指令种类时所有实现都必须补上对应分支。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface IrVisitor<R, C> {

    // ========== 控制流 (8) ==========

    R visitReturn(IrInstruction.Return inst, C context);

    R visitCondBr(IrInstruction.CondBr inst, C context);

    R visitBr(IrInstruction.Br inst, C context);

    R visitPhi(IrInstruction.Phi inst, C context);

    R visitUnreachable(IrInstruction.Unreachable inst, C context);

    R visitSwitchBr(IrInstruction.SwitchBr inst, C context);

    R visitSwitchVar(IrInstruction.SwitchVar inst, C context);

    R visitSwitchTarget(IrInstruction.SwitchTarget inst, C context);

    // ========== 值与运算 (6) ==========

    R visitConst(IrInstruction.Const inst, C context);

    R visitBinOp(IrInstruction.BinOpInst inst, C context);

    R visitUnOp(IrInstruction.UnOpInst inst, C context);

    R visitDeclVar(IrInstruction.DeclVar inst, C context);

    R visitCast(IrInstruction.Cast inst, C context);

    R visitCall(IrInstruction.Call inst, C context);

    // ========== 初始化 (3) ==========

    R visitContainerInitList(IrInstruction.ContainerInitList inst, C context);

    R visitContainerInitFields(IrInstruction.ContainerInitFields inst, C context);

    R visitStructInit(IrInstruction.StructInit inst, C context);

    // ========== 指针与字段 (8) ==========

    R visitElemPtr(IrInstruction.ElemPtr inst, C context);

    R visitVarPtr(IrInstruction.VarPtr inst, C context);

    R visitLoadPtr(IrInstruction.LoadPtr inst, C context);

    R visitStorePtr(IrInstruction.StorePtr inst, C context);

    R visitFieldPtr(IrInstruction.FieldPtr inst, C context);

    R visitStructFieldPtr(IrInstruction.StructFieldPtr inst, C context);

    R visitEnumFieldPtr(IrInstruction.EnumFieldPtr inst, C context);

    R visitUnwrapMaybe(IrInstruction.UnwrapMaybe inst, C context);

    // ========== 单操作数 (13) ==========

    R visitTypeOf(IrInstruction.TypeOf inst, C context);

    R visitToPtrType(IrInstruction.ToPtrType inst, C context);

    R visitPtrTypeChild(IrInstruction.PtrTypeChild inst, C context);

    R visitCompileVar(IrInstruction.CompileVar inst, C context);

    R visitSizeOf(IrInstruction.SizeOf inst, C context);

    R visitTestNull(IrInstruction.TestNull inst, C context);

    R visitClz(IrInstruction.Clz inst, C context);

    R visitCtz(IrInstruction.Ctz inst, C context);

    R visitEnumTag(IrInstruction.EnumTag inst, C context);

    R visitStaticEval(IrInstruction.StaticEval inst, C context);

    R visitImport(IrInstruction.Import inst, C context);

    R visitArrayLen(IrInstruction.ArrayLen inst, C context);

    R visitRef(IrInstruction.Ref inst, C context);

    // ========== 编译期设置 (3) ==========

    R visitSetFnTest(IrInstruction.SetFnTest inst, C context);

    R visitSetFnVisible(IrInstruction.SetFnVisible inst, C context);

    R visitSetDebugSafety(IrInstruction.SetDebugSafety inst, C context);

    // ========== 类型构造与汇编 (3) ==========

    R visitArrayType(IrInstruction.ArrayType inst, C context);

    R visitSliceType(IrInstruction.SliceType inst, C context);

    R visitAsm(IrInstruction.Asm inst, C context);
}
