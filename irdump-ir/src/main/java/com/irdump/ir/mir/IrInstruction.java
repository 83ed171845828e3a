package com.irdump.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 指令。
 * <p>每条指令有唯一的 debug id、解析后的类型（可为 null，表示尚未确定）、
 * 使用计数以及内嵌的求值状态。操作数与目标块都以 id 引用，
 * 由 {@link Executable} 解析，指令本身不持有它们。</p>
 * <p>具体种类是本类的静态内部类，分派统一走 {@link IrVisitor}。</p>
 */
public abstract class IrInstruction {

    private static final int[] NO_IDS = new int[0];

    private final int id;
    private final SourceLocation location;
    private IrType type;
    private int refCount;
    private ConstValue value = ConstValue.runtime();
    /** 所属基本块 id，-1 = 尚未加入 */
    private int blockId = -1;

    protected IrInstruction(int id, SourceLocation location) {
        if (id < 0) {
            throw new IrContractException("debug id must be non-negative: " + id);
        }
        this.id = id;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public int getId() { return id; }
    public SourceLocation getLocation() { return location; }

    /** 解析后的类型，null = unknown */
    public IrType getType() { return type; }
    public void setType(IrType type) { this.type = type; }

    public int getRefCount() { return refCount; }
    public void setRefCount(int refCount) { this.refCount = refCount; }
    public void incrementRefCount() { refCount++; }

    public ConstValue getValue() { return value; }

    public void setValue(ConstValue value) {
        if (value == null) {
            throw new IrContractException("value must not be null, use ConstValue.runtime()", id);
        }
        this.value = value;
    }

    public int getBlockId() { return blockId; }

    void attachTo(int blockId) {
        if (this.blockId >= 0) {
            throw new IrContractException("instruction already belongs to block " + this.blockId, id);
        }
        this.blockId = blockId;
    }

    /**
     * 有副作用的指令不参与死代码消除，打印时使用计数列显示为 "-"。
     */
    public boolean hasSideEffects() {
        return false;
    }

    /**
     * 本指令引用的所有操作数 id（按声明顺序）。
     */
    public abstract int[] getOperandIds();

    public abstract <R, C> R accept(IrVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id;
    }

    private static int[] ids(int... ids) {
        return ids.length == 0 ? NO_IDS : ids.clone();
    }

    private static int[] concat(int[] head, int[] tail) {
        int[] result = new int[head.length + tail.length];
        System.arraycopy(head, 0, result, 0, head.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }

    // ===================================================================
    // 控制流
    // ===================================================================

    public static class Return extends IrInstruction {
        private final int valueId;

        public Return(int id, SourceLocation location, int valueId) {
            super(id, location);
            this.valueId = valueId;
        }

        public int getValueId() { return valueId; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitReturn(this, context);
        }
    }

    /**
     * 条件分支。
     */
    public static class CondBr extends IrInstruction {
        private final int conditionId;
        private final int thenBlockId;
        private final int elseBlockId;
        private final boolean isInline;

        public CondBr(int id, SourceLocation location, int conditionId,
                      int thenBlockId, int elseBlockId, boolean isInline) {
            super(id, location);
            this.conditionId = conditionId;
            this.thenBlockId = thenBlockId;
            this.elseBlockId = elseBlockId;
            this.isInline = isInline;
        }

        public int getConditionId() { return conditionId; }
        public int getThenBlockId() { return thenBlockId; }
        public int getElseBlockId() { return elseBlockId; }
        public boolean isInline() { return isInline; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(conditionId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitCondBr(this, context);
        }
    }

    /**
     * 无条件跳转。
     */
    public static class Br extends IrInstruction {
        private final int destBlockId;
        private final boolean isInline;

        public Br(int id, SourceLocation location, int destBlockId, boolean isInline) {
            super(id, location);
            this.destBlockId = destBlockId;
            this.isInline = isInline;
        }

        public int getDestBlockId() { return destBlockId; }
        public boolean isInline() { return isInline; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return NO_IDS; }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitBr(this, context);
        }
    }

    /**
     * Phi 节点，incoming 块与 incoming 值一一对应。
     */
    /**
     * Phi：按前驱块给出的值。
     * <p>循环头的回边值在 Phi 之后才定义，所以入边可以分两步补齐，见 {@link IrBuilder#addIncoming}。</p>
     */
    public static class Phi extends IrInstruction {
        private final List<Integer> incomingBlockIds = new ArrayList<>();
        private final List<Integer> incomingValueIds = new ArrayList<>();

        public Phi(int id, SourceLocation location, int[] incomingBlockIds, int[] incomingValueIds) {
            super(id, location);
            if (incomingBlockIds.length != incomingValueIds.length) {
                throw new IrContractException("phi has " + incomingBlockIds.length + " incoming blocks but "
                        + incomingValueIds.length + " incoming values", id);
            }
            for (int i = 0; i < incomingBlockIds.length; i++) {
                addIncoming(incomingBlockIds[i], incomingValueIds[i]);
            }
        }

        void addIncoming(int blockId, int valueId) {
            incomingBlockIds.add(blockId);
            incomingValueIds.add(valueId);
        }

        public int getIncomingCount() { return incomingBlockIds.size(); }
        public int getIncomingBlockId(int i) { return incomingBlockIds.get(i); }
        public int getIncomingValueId(int i) { return incomingValueIds.get(i); }

        @Override
        public int[] getOperandIds() {
            int[] result = new int[incomingValueIds.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = incomingValueIds.get(i);
            }
            return result;
        }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitPhi(this, context);
        }
    }

    public static class Unreachable extends IrInstruction {
        public Unreachable(int id, SourceLocation location) {
            super(id, location);
        }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return NO_IDS; }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitUnreachable(this, context);
        }
    }

    /**
     * switch 分支：按声明顺序的 case 列表 + 必需的 else 块。
     */
    public static class SwitchBr extends IrInstruction {
        private final int targetValueId;
        private final List<SwitchCase> cases;
        private final int elseBlockId;
        private final boolean isInline;

        public SwitchBr(int id, SourceLocation location, int targetValueId,
                        List<SwitchCase> cases, int elseBlockId, boolean isInline) {
            super(id, location);
            this.targetValueId = targetValueId;
            this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
            this.elseBlockId = elseBlockId;
            this.isInline = isInline;
        }

        public int getTargetValueId() { return targetValueId; }
        public List<SwitchCase> getCases() { return cases; }
        public int getElseBlockId() { return elseBlockId; }
        public boolean isInline() { return isInline; }

        @Override public boolean hasSideEffects() { return true; }

        @Override
        public int[] getOperandIds() {
            int[] caseValues = new int[cases.size()];
            for (int i = 0; i < caseValues.length; i++) {
                caseValues[i] = cases.get(i).getValueId();
            }
            return concat(ids(targetValueId), caseValues);
        }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSwitchBr(this, context);
        }
    }

    /** switch 的一个 case */
    public static class SwitchCase {
        private final int valueId;
        private final int blockId;

        public SwitchCase(int valueId, int blockId) {
            this.valueId = valueId;
            this.blockId = blockId;
        }

        public int getValueId() { return valueId; }
        public int getBlockId() { return blockId; }
    }

    public static class SwitchVar extends IrInstruction {
        private final int targetValuePtrId;
        private final int prongValueId;

        public SwitchVar(int id, SourceLocation location, int targetValuePtrId, int prongValueId) {
            super(id, location);
            this.targetValuePtrId = targetValuePtrId;
            this.prongValueId = prongValueId;
        }

        public int getTargetValuePtrId() { return targetValuePtrId; }
        public int getProngValueId() { return prongValueId; }

        @Override public int[] getOperandIds() { return ids(targetValuePtrId, prongValueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSwitchVar(this, context);
        }
    }

    public static class SwitchTarget extends IrInstruction {
        private final int targetValuePtrId;

        public SwitchTarget(int id, SourceLocation location, int targetValuePtrId) {
            super(id, location);
            this.targetValuePtrId = targetValuePtrId;
        }

        public int getTargetValuePtrId() { return targetValuePtrId; }

        @Override public int[] getOperandIds() { return ids(targetValuePtrId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSwitchTarget(this, context);
        }
    }

    // ===================================================================
    // 值与运算
    // ===================================================================

    /**
     * 常量，值保存在求值状态里。
     */
    public static class Const extends IrInstruction {
        public Const(int id, SourceLocation location) {
            super(id, location);
        }

        @Override public int[] getOperandIds() { return NO_IDS; }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitConst(this, context);
        }
    }

    public static class BinOpInst extends IrInstruction {
        private final BinOp op;
        private final int lhsId;
        private final int rhsId;

        public BinOpInst(int id, SourceLocation location, BinOp op, int lhsId, int rhsId) {
            super(id, location);
            this.op = op;
            this.lhsId = lhsId;
            this.rhsId = rhsId;
        }

        public BinOp getOp() { return op; }
        public int getLhsId() { return lhsId; }
        public int getRhsId() { return rhsId; }

        @Override public int[] getOperandIds() { return ids(lhsId, rhsId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitBinOp(this, context);
        }
    }

    public static class UnOpInst extends IrInstruction {
        private final UnOp op;
        private final int valueId;

        public UnOpInst(int id, SourceLocation location, UnOp op, int valueId) {
            super(id, location);
            this.op = op;
            this.valueId = valueId;
        }

        public UnOp getOp() { return op; }
        public int getValueId() { return valueId; }

        @Override public int[] getOperandIds() { return ids(valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitUnOp(this, context);
        }
    }

    /**
     * 变量声明。varTypeId = -1 表示未显式给出类型。
     */
    public static class DeclVar extends IrInstruction {
        private final IrVariable variable;
        private final int varTypeId;
        private final int initValueId;

        public DeclVar(int id, SourceLocation location, IrVariable variable, int varTypeId, int initValueId) {
            super(id, location);
            this.variable = variable;
            this.varTypeId = varTypeId;
            this.initValueId = initValueId;
        }

        public IrVariable getVariable() { return variable; }
        public int getVarTypeId() { return varTypeId; }
        public boolean hasVarType() { return varTypeId >= 0; }
        public int getInitValueId() { return initValueId; }

        @Override public boolean hasSideEffects() { return true; }

        @Override
        public int[] getOperandIds() {
            return hasVarType() ? ids(varTypeId, initValueId) : ids(initValueId);
        }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitDeclVar(this, context);
        }
    }

    public static class Cast extends IrInstruction {
        private final int valueId;
        private final IrType destType;

        public Cast(int id, SourceLocation location, int valueId, IrType destType) {
            super(id, location);
            this.valueId = valueId;
            this.destType = destType;
        }

        public int getValueId() { return valueId; }
        public IrType getDestType() { return destType; }

        @Override public int[] getOperandIds() { return ids(valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitCast(this, context);
        }
    }

    /**
     * 函数调用。被调用者要么是已知函数（fn），要么是一个操作数（fnRefId）。
     */
    public static class Call extends IrInstruction {
        private final FnEntry fn;
        private final int fnRefId;
        private final int[] argIds;

        public Call(int id, SourceLocation location, FnEntry fn, int fnRefId, int[] argIds) {
            super(id, location);
            if ((fn == null) == (fnRefId < 0)) {
                throw new IrContractException("call needs exactly one of a known function or a callee operand", id);
            }
            this.fn = fn;
            this.fnRefId = fnRefId;
            this.argIds = argIds.clone();
        }

        public FnEntry getFn() { return fn; }
        public boolean hasKnownFn() { return fn != null; }
        public int getFnRefId() { return fnRefId; }
        public int[] getArgIds() { return argIds.clone(); }

        @Override public boolean hasSideEffects() { return true; }

        @Override
        public int[] getOperandIds() {
            return fn != null ? ids(argIds) : concat(ids(fnRefId), argIds);
        }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitCall(this, context);
        }
    }

    // ===================================================================
    // 初始化
    // ===================================================================

    /** 按字段名初始化的一项 */
    public static class FieldInit {
        private final String name;
        private final int valueId;

        public FieldInit(String name, int valueId) {
            this.name = name;
            this.valueId = valueId;
        }

        public String getName() { return name; }
        public int getValueId() { return valueId; }
    }

    private static int[] fieldValueIds(List<FieldInit> fields) {
        int[] result = new int[fields.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = fields.get(i).getValueId();
        }
        return result;
    }

    public static class ContainerInitList extends IrInstruction {
        private final int containerTypeId;
        private final int[] itemIds;

        public ContainerInitList(int id, SourceLocation location, int containerTypeId, int[] itemIds) {
            super(id, location);
            this.containerTypeId = containerTypeId;
            this.itemIds = itemIds.clone();
        }

        public int getContainerTypeId() { return containerTypeId; }
        public int[] getItemIds() { return itemIds.clone(); }

        @Override public int[] getOperandIds() { return concat(ids(containerTypeId), itemIds); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitContainerInitList(this, context);
        }
    }

    public static class ContainerInitFields extends IrInstruction {
        private final int containerTypeId;
        private final List<FieldInit> fields;

        public ContainerInitFields(int id, SourceLocation location, int containerTypeId, List<FieldInit> fields) {
            super(id, location);
            this.containerTypeId = containerTypeId;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        public int getContainerTypeId() { return containerTypeId; }
        public List<FieldInit> getFields() { return fields; }

        @Override public int[] getOperandIds() { return concat(ids(containerTypeId), fieldValueIds(fields)); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitContainerInitFields(this, context);
        }
    }

    /**
     * 结构体初始化（类型已解析）。
     */
    public static class StructInit extends IrInstruction {
        private final IrType structType;
        private final List<FieldInit> fields;

        public StructInit(int id, SourceLocation location, IrType structType, List<FieldInit> fields) {
            super(id, location);
            this.structType = structType;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        public IrType getStructType() { return structType; }
        public List<FieldInit> getFields() { return fields; }

        @Override public int[] getOperandIds() { return fieldValueIds(fields); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitStructInit(this, context);
        }
    }

    // ===================================================================
    // 指针与字段
    // ===================================================================

    public static class ElemPtr extends IrInstruction {
        private final int arrayPtrId;
        private final int elemIndexId;
        private final boolean safetyCheckOn;

        public ElemPtr(int id, SourceLocation location, int arrayPtrId, int elemIndexId, boolean safetyCheckOn) {
            super(id, location);
            this.arrayPtrId = arrayPtrId;
            this.elemIndexId = elemIndexId;
            this.safetyCheckOn = safetyCheckOn;
        }

        public int getArrayPtrId() { return arrayPtrId; }
        public int getElemIndexId() { return elemIndexId; }
        public boolean isSafetyCheckOn() { return safetyCheckOn; }

        @Override public int[] getOperandIds() { return ids(arrayPtrId, elemIndexId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitElemPtr(this, context);
        }
    }

    public static class VarPtr extends IrInstruction {
        private final IrVariable variable;

        public VarPtr(int id, SourceLocation location, IrVariable variable) {
            super(id, location);
            this.variable = variable;
        }

        public IrVariable getVariable() { return variable; }

        @Override public int[] getOperandIds() { return NO_IDS; }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitVarPtr(this, context);
        }
    }

    public static class LoadPtr extends IrInstruction {
        private final int ptrId;

        public LoadPtr(int id, SourceLocation location, int ptrId) {
            super(id, location);
            this.ptrId = ptrId;
        }

        public int getPtrId() { return ptrId; }

        @Override public int[] getOperandIds() { return ids(ptrId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitLoadPtr(this, context);
        }
    }

    public static class StorePtr extends IrInstruction {
        private final int ptrId;
        private final int valueId;

        public StorePtr(int id, SourceLocation location, int ptrId, int valueId) {
            super(id, location);
            this.ptrId = ptrId;
            this.valueId = valueId;
        }

        public int getPtrId() { return ptrId; }
        public int getValueId() { return valueId; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(ptrId, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitStorePtr(this, context);
        }
    }

    public static class FieldPtr extends IrInstruction {
        private final int containerPtrId;
        private final String fieldName;

        public FieldPtr(int id, SourceLocation location, int containerPtrId, String fieldName) {
            super(id, location);
            this.containerPtrId = containerPtrId;
            this.fieldName = fieldName;
        }

        public int getContainerPtrId() { return containerPtrId; }
        public String getFieldName() { return fieldName; }

        @Override public int[] getOperandIds() { return ids(containerPtrId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitFieldPtr(this, context);
        }
    }

    public static class StructFieldPtr extends IrInstruction {
        private final int structPtrId;
        private final String fieldName;

        public StructFieldPtr(int id, SourceLocation location, int structPtrId, String fieldName) {
            super(id, location);
            this.structPtrId = structPtrId;
            this.fieldName = fieldName;
        }

        public int getStructPtrId() { return structPtrId; }
        public String getFieldName() { return fieldName; }

        @Override public int[] getOperandIds() { return ids(structPtrId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitStructFieldPtr(this, context);
        }
    }

    public static class EnumFieldPtr extends IrInstruction {
        private final int enumPtrId;
        private final String fieldName;

        public EnumFieldPtr(int id, SourceLocation location, int enumPtrId, String fieldName) {
            super(id, location);
            this.enumPtrId = enumPtrId;
            this.fieldName = fieldName;
        }

        public int getEnumPtrId() { return enumPtrId; }
        public String getFieldName() { return fieldName; }

        @Override public int[] getOperandIds() { return ids(enumPtrId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitEnumFieldPtr(this, context);
        }
    }

    public static class UnwrapMaybe extends IrInstruction {
        private final int valueId;
        private final boolean safetyCheckOn;

        public UnwrapMaybe(int id, SourceLocation location, int valueId, boolean safetyCheckOn) {
            super(id, location);
            this.valueId = valueId;
            this.safetyCheckOn = safetyCheckOn;
        }

        public int getValueId() { return valueId; }
        public boolean isSafetyCheckOn() { return safetyCheckOn; }

        @Override public int[] getOperandIds() { return ids(valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitUnwrapMaybe(this, context);
        }
    }

    // ===================================================================
    // 单操作数指令
    // ===================================================================

    /**
     * 只有一个操作数的指令的公共基类。
     */
    public abstract static class UnaryInst extends IrInstruction {
        private final int valueId;

        protected UnaryInst(int id, SourceLocation location, int valueId) {
            super(id, location);
            this.valueId = valueId;
        }

        public int getValueId() { return valueId; }

        @Override public int[] getOperandIds() { return ids(valueId); }
    }

    public static class TypeOf extends UnaryInst {
        public TypeOf(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitTypeOf(this, context);
        }
    }

    public static class ToPtrType extends UnaryInst {
        public ToPtrType(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitToPtrType(this, context);
        }
    }

    public static class PtrTypeChild extends UnaryInst {
        public PtrTypeChild(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitPtrTypeChild(this, context);
        }
    }

    /** valueId 为变量名常量 */
    public static class CompileVar extends UnaryInst {
        public CompileVar(int id, SourceLocation location, int nameId) { super(id, location, nameId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitCompileVar(this, context);
        }
    }

    /** valueId 为类型值 */
    public static class SizeOf extends UnaryInst {
        public SizeOf(int id, SourceLocation location, int typeValueId) { super(id, location, typeValueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSizeOf(this, context);
        }
    }

    public static class TestNull extends UnaryInst {
        public TestNull(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitTestNull(this, context);
        }
    }

    public static class Clz extends UnaryInst {
        public Clz(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitClz(this, context);
        }
    }

    public static class Ctz extends UnaryInst {
        public Ctz(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitCtz(this, context);
        }
    }

    public static class EnumTag extends UnaryInst {
        public EnumTag(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitEnumTag(this, context);
        }
    }

    public static class StaticEval extends UnaryInst {
        public StaticEval(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitStaticEval(this, context);
        }
    }

    /** valueId 为导入路径常量 */
    public static class Import extends UnaryInst {
        public Import(int id, SourceLocation location, int nameId) { super(id, location, nameId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitImport(this, context);
        }
    }

    public static class ArrayLen extends UnaryInst {
        public ArrayLen(int id, SourceLocation location, int arrayValueId) { super(id, location, arrayValueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitArrayLen(this, context);
        }
    }

    public static class Ref extends UnaryInst {
        public Ref(int id, SourceLocation location, int valueId) { super(id, location, valueId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitRef(this, context);
        }
    }

    // ===================================================================
    // 编译期设置（@setFnTest 等）
    // ===================================================================

    public static class SetFnTest extends IrInstruction {
        private final int fnValueId;
        private final int isTestId;

        public SetFnTest(int id, SourceLocation location, int fnValueId, int isTestId) {
            super(id, location);
            this.fnValueId = fnValueId;
            this.isTestId = isTestId;
        }

        public int getFnValueId() { return fnValueId; }
        public int getIsTestId() { return isTestId; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(fnValueId, isTestId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSetFnTest(this, context);
        }
    }

    public static class SetFnVisible extends IrInstruction {
        private final int fnValueId;
        private final int isVisibleId;

        public SetFnVisible(int id, SourceLocation location, int fnValueId, int isVisibleId) {
            super(id, location);
            this.fnValueId = fnValueId;
            this.isVisibleId = isVisibleId;
        }

        public int getFnValueId() { return fnValueId; }
        public int getIsVisibleId() { return isVisibleId; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(fnValueId, isVisibleId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSetFnVisible(this, context);
        }
    }

    public static class SetDebugSafety extends IrInstruction {
        private final int scopeValueId;
        private final int debugSafetyOnId;

        public SetDebugSafety(int id, SourceLocation location, int scopeValueId, int debugSafetyOnId) {
            super(id, location);
            this.scopeValueId = scopeValueId;
            this.debugSafetyOnId = debugSafetyOnId;
        }

        public int getScopeValueId() { return scopeValueId; }
        public int getDebugSafetyOnId() { return debugSafetyOnId; }

        @Override public boolean hasSideEffects() { return true; }
        @Override public int[] getOperandIds() { return ids(scopeValueId, debugSafetyOnId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSetDebugSafety(this, context);
        }
    }

    // ===================================================================
    // 类型构造
    // ===================================================================

    public static class ArrayType extends IrInstruction {
        private final int sizeId;
        private final int childTypeId;

        public ArrayType(int id, SourceLocation location, int sizeId, int childTypeId) {
            super(id, location);
            this.sizeId = sizeId;
            this.childTypeId = childTypeId;
        }

        public int getSizeId() { return sizeId; }
        public int getChildTypeId() { return childTypeId; }

        @Override public int[] getOperandIds() { return ids(sizeId, childTypeId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitArrayType(this, context);
        }
    }

    public static class SliceType extends IrInstruction {
        private final boolean isConst;
        private final int childTypeId;

        public SliceType(int id, SourceLocation location, boolean isConst, int childTypeId) {
            super(id, location);
            this.isConst = isConst;
            this.childTypeId = childTypeId;
        }

        public boolean isConst() { return isConst; }
        public int getChildTypeId() { return childTypeId; }

        @Override public int[] getOperandIds() { return ids(childTypeId); }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitSliceType(this, context);
        }
    }

    // ===================================================================
    // 内联汇编
    // ===================================================================

    /**
     * 内联汇编。outputTypeIds 与 asm 的输出一一对应，写入变量的输出为 -1；
     * inputIds 与输入一一对应。volatile 汇编视为有副作用。
     */
    public static class Asm extends IrInstruction {
        private final AsmExpr asm;
        private final int[] outputTypeIds;
        private final int[] inputIds;
        private final boolean isVolatile;

        public Asm(int id, SourceLocation location, AsmExpr asm,
                   int[] outputTypeIds, int[] inputIds, boolean isVolatile) {
            super(id, location);
            if (outputTypeIds.length != asm.getOutputs().size()) {
                throw new IrContractException("asm has " + asm.getOutputs().size() + " outputs but "
                        + outputTypeIds.length + " output types", id);
            }
            if (inputIds.length != asm.getInputs().size()) {
                throw new IrContractException("asm has " + asm.getInputs().size() + " inputs but "
                        + inputIds.length + " input values", id);
            }
            for (int i = 0; i < outputTypeIds.length; i++) {
                boolean returns = asm.getOutputs().get(i).returnsValue();
                if (returns != (outputTypeIds[i] >= 0)) {
                    throw new IrContractException("asm output " + i
                            + (returns ? " returns a value but has no type operand" : " writes a variable but has a type operand"), id);
                }
            }
            this.asm = asm;
            this.outputTypeIds = outputTypeIds.clone();
            this.inputIds = inputIds.clone();
            this.isVolatile = isVolatile;
        }

        public AsmExpr getAsm() { return asm; }
        public int getOutputTypeId(int i) { return outputTypeIds[i]; }
        public int getInputId(int i) { return inputIds[i]; }
        public boolean isVolatile() { return isVolatile; }

        @Override
        public boolean hasSideEffects() {
            return isVolatile;
        }

        @Override
        public int[] getOperandIds() {
            int count = 0;
            for (int typeId : outputTypeIds) {
                if (typeId >= 0) count++;
            }
            int[] outputs = new int[count];
            int j = 0;
            for (int typeId : outputTypeIds) {
                if (typeId >= 0) outputs[j++] = typeId;
            }
            return concat(outputs, inputIds);
        }

        @Override
        public <R, C> R accept(IrVisitor<R, C> visitor, C context) {
            return visitor.visitAsm(this, context);
        }
    }
}
