package com.irdump.ir.mir;

import java.util.ArrayList;
import java.util.List;

/**
 * MIR 构建辅助类。
 * 封装创建基本块、分配 debug id、追加指令并维护操作数使用计数的便捷方法。
 */
public class IrBuilder {

    private final Executable executable;
    private BasicBlock currentBlock;
    private SourceLocation location = SourceLocation.UNKNOWN;

    public IrBuilder(Executable executable) {
        this.executable = executable;
    }

    /** 绑定到已有可执行单元，并新建入口块 */
    public IrBuilder(Executable executable, String entryNameHint) {
        this.executable = executable;
        this.currentBlock = executable.newBlock(entryNameHint);
    }

    public Executable getExecutable() { return executable; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock(String nameHint) {
        return executable.newBlock(nameHint);
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    /** 之后发射的指令使用的源码位置 */
    public void setLocation(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    // ========== 指令发射 ==========

    /** 只预取 id；发射失败时不占用 */
    private int nextId() {
        return executable.peekInstructionId();
    }

    /**
     * 先解析全部操作数再追加并计数；任何一步失败都不改动图。
     */
    private <T extends IrInstruction> T emit(T inst) {
        if (currentBlock == null) {
            throw new IrContractException("no current block to emit into", inst.getId());
        }
        List<IrInstruction> operands = new ArrayList<>();
        for (int operandId : inst.getOperandIds()) {
            operands.add(executable.getInstruction(operandId));
        }
        executable.append(currentBlock, inst);
        for (IrInstruction operand : operands) {
            operand.incrementRefCount();
        }
        return inst;
    }

    private <T extends IrInstruction> T typed(T inst, IrType type) {
        inst.setType(type);
        return inst;
    }

    public IrInstruction.Const emitConst(IrType type, ConstValue value) {
        IrInstruction.Const inst = new IrInstruction.Const(nextId(), location);
        inst.setType(type);
        inst.setValue(value);
        return emit(inst);
    }

    public IrInstruction.Const emitConstInt(IrType type, long value) {
        return emitConst(type, ConstValue.ofInt(value));
    }

    public IrInstruction.Const emitConstBool(boolean value) {
        return emitConst(IrType.ofBool(), ConstValue.ofBool(value));
    }

    public IrInstruction.Const emitConstType(IrType type) {
        return emitConst(IrType.ofMetaType(), ConstValue.ofType(type));
    }

    public IrInstruction.Const emitConstVoid() {
        return emitConst(IrType.ofVoid(), ConstValue.ofStatic());
    }

    public IrInstruction.Return emitReturn(int valueId) {
        return emit(new IrInstruction.Return(nextId(), location, valueId));
    }

    public IrInstruction.BinOpInst emitBinOp(BinOp op, int lhsId, int rhsId) {
        return emit(new IrInstruction.BinOpInst(nextId(), location, op, lhsId, rhsId));
    }

    public IrInstruction.UnOpInst emitUnOp(UnOp op, int valueId) {
        return emit(new IrInstruction.UnOpInst(nextId(), location, op, valueId));
    }

    public IrInstruction.DeclVar emitDeclVar(IrVariable variable, int varTypeId, int initValueId) {
        return emit(typed(new IrInstruction.DeclVar(nextId(), location, variable, varTypeId, initValueId),
                IrType.ofVoid()));
    }

    public IrInstruction.Cast emitCast(int valueId, IrType destType) {
        return emit(typed(new IrInstruction.Cast(nextId(), location, valueId, destType), destType));
    }

    public IrInstruction.Call emitCall(FnEntry fn, int... argIds) {
        return emit(new IrInstruction.Call(nextId(), location, fn, -1, argIds));
    }

    public IrInstruction.Call emitCallIndirect(int fnRefId, int... argIds) {
        return emit(new IrInstruction.Call(nextId(), location, null, fnRefId, argIds));
    }

    public IrInstruction.CondBr emitCondBr(int conditionId, BasicBlock thenBlock, BasicBlock elseBlock,
                                           boolean isInline) {
        return emit(typed(new IrInstruction.CondBr(nextId(), location, conditionId,
                thenBlock.getId(), elseBlock.getId(), isInline), IrType.ofUnreachable()));
    }

    public IrInstruction.Br emitBr(BasicBlock dest, boolean isInline) {
        return emit(typed(new IrInstruction.Br(nextId(), location, dest.getId(), isInline),
                IrType.ofUnreachable()));
    }

    public IrInstruction.Phi emitPhi(int[] incomingBlockIds, int[] incomingValueIds) {
        return emit(new IrInstruction.Phi(nextId(), location, incomingBlockIds, incomingValueIds));
    }

    /**
     * 给已发射的 Phi 补一条入边，用于循环头引用循环体里之后才定义的值。
     */
    public void addIncoming(IrInstruction.Phi phi, BasicBlock fromBlock, int valueId) {
        if (executable.getInstruction(phi.getId()) != phi) {
            throw new IrContractException("phi does not belong to " + executable.getName(), phi.getId());
        }
        if (executable.getBlock(fromBlock.getId()) != fromBlock) {
            throw new IrContractException("block " + fromBlock.getLabel() + " does not belong to "
                    + executable.getName(), phi.getId());
        }
        IrInstruction value = executable.getInstruction(valueId);
        phi.addIncoming(fromBlock.getId(), valueId);
        value.incrementRefCount();
    }

    public IrInstruction.ContainerInitList emitContainerInitList(int containerTypeId, int... itemIds) {
        return emit(new IrInstruction.ContainerInitList(nextId(), location, containerTypeId, itemIds));
    }

    public IrInstruction.ContainerInitFields emitContainerInitFields(int containerTypeId,
                                                                     List<IrInstruction.FieldInit> fields) {
        return emit(new IrInstruction.ContainerInitFields(nextId(), location, containerTypeId, fields));
    }

    public IrInstruction.StructInit emitStructInit(IrType structType, List<IrInstruction.FieldInit> fields) {
        return emit(typed(new IrInstruction.StructInit(nextId(), location, structType, fields), structType));
    }

    public IrInstruction.Unreachable emitUnreachable() {
        return emit(typed(new IrInstruction.Unreachable(nextId(), location), IrType.ofUnreachable()));
    }

    public IrInstruction.ElemPtr emitElemPtr(int arrayPtrId, int elemIndexId, boolean safetyCheckOn) {
        return emit(new IrInstruction.ElemPtr(nextId(), location, arrayPtrId, elemIndexId, safetyCheckOn));
    }

    public IrInstruction.VarPtr emitVarPtr(IrVariable variable) {
        return emit(new IrInstruction.VarPtr(nextId(), location, variable));
    }

    public IrInstruction.LoadPtr emitLoadPtr(int ptrId) {
        return emit(new IrInstruction.LoadPtr(nextId(), location, ptrId));
    }

    public IrInstruction.StorePtr emitStorePtr(int ptrId, int valueId) {
        return emit(typed(new IrInstruction.StorePtr(nextId(), location, ptrId, valueId), IrType.ofVoid()));
    }

    public IrInstruction.TypeOf emitTypeOf(int valueId) {
        return emit(typed(new IrInstruction.TypeOf(nextId(), location, valueId), IrType.ofMetaType()));
    }

    public IrInstruction.ToPtrType emitToPtrType(int valueId) {
        return emit(typed(new IrInstruction.ToPtrType(nextId(), location, valueId), IrType.ofMetaType()));
    }

    public IrInstruction.PtrTypeChild emitPtrTypeChild(int valueId) {
        return emit(typed(new IrInstruction.PtrTypeChild(nextId(), location, valueId), IrType.ofMetaType()));
    }

    public IrInstruction.FieldPtr emitFieldPtr(int containerPtrId, String fieldName) {
        return emit(new IrInstruction.FieldPtr(nextId(), location, containerPtrId, fieldName));
    }

    public IrInstruction.StructFieldPtr emitStructFieldPtr(int structPtrId, String fieldName) {
        return emit(new IrInstruction.StructFieldPtr(nextId(), location, structPtrId, fieldName));
    }

    public IrInstruction.EnumFieldPtr emitEnumFieldPtr(int enumPtrId, String fieldName) {
        return emit(new IrInstruction.EnumFieldPtr(nextId(), location, enumPtrId, fieldName));
    }

    public IrInstruction.SetFnTest emitSetFnTest(int fnValueId, int isTestId) {
        return emit(typed(new IrInstruction.SetFnTest(nextId(), location, fnValueId, isTestId), IrType.ofVoid()));
    }

    public IrInstruction.SetFnVisible emitSetFnVisible(int fnValueId, int isVisibleId) {
        return emit(typed(new IrInstruction.SetFnVisible(nextId(), location, fnValueId, isVisibleId),
                IrType.ofVoid()));
    }

    public IrInstruction.SetDebugSafety emitSetDebugSafety(int scopeValueId, int debugSafetyOnId) {
        return emit(typed(new IrInstruction.SetDebugSafety(nextId(), location, scopeValueId, debugSafetyOnId),
                IrType.ofVoid()));
    }

    public IrInstruction.ArrayType emitArrayType(int sizeId, int childTypeId) {
        return emit(typed(new IrInstruction.ArrayType(nextId(), location, sizeId, childTypeId),
                IrType.ofMetaType()));
    }

    public IrInstruction.SliceType emitSliceType(boolean isConst, int childTypeId) {
        return emit(typed(new IrInstruction.SliceType(nextId(), location, isConst, childTypeId),
                IrType.ofMetaType()));
    }

    public IrInstruction.Asm emitAsm(AsmExpr asm, int[] outputTypeIds, int[] inputIds, boolean isVolatile) {
        return emit(new IrInstruction.Asm(nextId(), location, asm, outputTypeIds, inputIds, isVolatile));
    }

    public IrInstruction.CompileVar emitCompileVar(int nameId) {
        return emit(new IrInstruction.CompileVar(nextId(), location, nameId));
    }

    public IrInstruction.SizeOf emitSizeOf(int typeValueId) {
        return emit(new IrInstruction.SizeOf(nextId(), location, typeValueId));
    }

    public IrInstruction.TestNull emitTestNull(int valueId) {
        return emit(typed(new IrInstruction.TestNull(nextId(), location, valueId), IrType.ofBool()));
    }

    public IrInstruction.UnwrapMaybe emitUnwrapMaybe(int valueId, boolean safetyCheckOn) {
        return emit(new IrInstruction.UnwrapMaybe(nextId(), location, valueId, safetyCheckOn));
    }

    public IrInstruction.Clz emitClz(int valueId) {
        return emit(new IrInstruction.Clz(nextId(), location, valueId));
    }

    public IrInstruction.Ctz emitCtz(int valueId) {
        return emit(new IrInstruction.Ctz(nextId(), location, valueId));
    }

    public IrInstruction.SwitchBr emitSwitchBr(int targetValueId, List<IrInstruction.SwitchCase> cases,
                                               BasicBlock elseBlock, boolean isInline) {
        return emit(typed(new IrInstruction.SwitchBr(nextId(), location, targetValueId, cases,
                elseBlock.getId(), isInline), IrType.ofUnreachable()));
    }

    public IrInstruction.SwitchVar emitSwitchVar(int targetValuePtrId, int prongValueId) {
        return emit(new IrInstruction.SwitchVar(nextId(), location, targetValuePtrId, prongValueId));
    }

    public IrInstruction.SwitchTarget emitSwitchTarget(int targetValuePtrId) {
        return emit(new IrInstruction.SwitchTarget(nextId(), location, targetValuePtrId));
    }

    public IrInstruction.EnumTag emitEnumTag(int valueId) {
        return emit(new IrInstruction.EnumTag(nextId(), location, valueId));
    }

    public IrInstruction.StaticEval emitStaticEval(int valueId) {
        return emit(new IrInstruction.StaticEval(nextId(), location, valueId));
    }

    public IrInstruction.Import emitImport(int nameId) {
        return emit(typed(new IrInstruction.Import(nextId(), location, nameId), IrType.ofNamespace()));
    }

    public IrInstruction.ArrayLen emitArrayLen(int arrayValueId) {
        return emit(new IrInstruction.ArrayLen(nextId(), location, arrayValueId));
    }

    public IrInstruction.Ref emitRef(int valueId) {
        return emit(new IrInstruction.Ref(nextId(), location, valueId));
    }
}
