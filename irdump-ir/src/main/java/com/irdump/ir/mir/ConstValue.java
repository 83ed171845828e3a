package com.irdump.ir.mir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 指令内嵌的求值状态与编译期值。
 * <p>只有 {@link ConstSpecial#STATIC} 携带数据，数据的形状由指令的类型种类决定：</p>
 * <ul>
 *   <li>数值 → {@link BigNum}</li>
 *   <li>bool → {@link Boolean}</li>
 *   <li>元类型 → {@link IrType}</li>
 *   <li>指针 / 可选值 → 子 {@link ConstValue}（可选值可为空）</li>
 *   <li>函数 → {@link FnEntry}，词法块 → {@link ScopeEntry}，命名空间 → {@link ImportEntry}</li>
 *   <li>数组 → 元素列表，绑定函数 → {@link BoundFn}</li>
 *   <li>struct / enum / union / error union / pure error / void → 无数据</li>
 * </ul>
 * 实例不可变。
 */
public final class ConstValue {

    private static final ConstValue RUNTIME = new ConstValue(ConstSpecial.RUNTIME, null);
    private static final ConstValue UNDEF = new ConstValue(ConstSpecial.UNDEF, null);
    private static final ConstValue ZEROES = new ConstValue(ConstSpecial.ZEROES, null);

    /** 可选值为空时的占位 */
    private static final Object ABSENT = new Object();

    private final ConstSpecial special;
    private final Object data;

    private ConstValue(ConstSpecial special, Object data) {
        this.special = special;
        this.data = data;
    }

    // ========== 求值状态 ==========

    public static ConstValue runtime() { return RUNTIME; }
    public static ConstValue undef()   { return UNDEF; }
    public static ConstValue zeroes()  { return ZEROES; }

    // ========== 编译期值 ==========

    public static ConstValue ofInt(long value) {
        return new ConstValue(ConstSpecial.STATIC, BigNum.ofInt(value));
    }

    public static ConstValue ofInt(BigInteger value) {
        return new ConstValue(ConstSpecial.STATIC, BigNum.ofInt(value));
    }

    public static ConstValue ofFloat(double value) {
        return new ConstValue(ConstSpecial.STATIC, BigNum.ofFloat(value));
    }

    public static ConstValue ofBigNum(BigNum value) {
        return new ConstValue(ConstSpecial.STATIC, value);
    }

    public static ConstValue ofBool(boolean value) {
        return new ConstValue(ConstSpecial.STATIC, value);
    }

    public static ConstValue ofType(IrType type) {
        return new ConstValue(ConstSpecial.STATIC, type);
    }

    public static ConstValue ofPointer(ConstValue pointee) {
        return new ConstValue(ConstSpecial.STATIC, pointee);
    }

    public static ConstValue ofFn(FnEntry fn) {
        return new ConstValue(ConstSpecial.STATIC, fn);
    }

    public static ConstValue ofScope(ScopeEntry scope) {
        return new ConstValue(ConstSpecial.STATIC, scope);
    }

    public static ConstValue ofArray(List<ConstValue> elements) {
        return new ConstValue(ConstSpecial.STATIC, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static ConstValue ofArray(ConstValue... elements) {
        return ofArray(Arrays.asList(elements));
    }

    /**
     * 可选值。child 为 null 表示 null。
     */
    public static ConstValue ofMaybe(ConstValue child) {
        return new ConstValue(ConstSpecial.STATIC, child != null ? child : ABSENT);
    }

    public static ConstValue ofNamespace(ImportEntry entry) {
        return new ConstValue(ConstSpecial.STATIC, entry);
    }

    public static ConstValue ofBoundFn(FnEntry fn, int firstArgId) {
        return new ConstValue(ConstSpecial.STATIC, new BoundFn(fn, firstArgId));
    }

    /**
     * 无数据的编译期值：void、各种聚合常量以及 pure error。
     */
    public static ConstValue ofStatic() {
        return new ConstValue(ConstSpecial.STATIC, null);
    }

    // ========== 访问 ==========

    public ConstSpecial getSpecial() { return special; }

    public boolean isRuntime() { return special == ConstSpecial.RUNTIME; }

    public BigNum getBigNum() {
        return payload(BigNum.class, "number");
    }

    public boolean getBool() {
        return payload(Boolean.class, "bool");
    }

    public IrType getType() {
        return payload(IrType.class, "type");
    }

    public ConstValue getPointee() {
        return payload(ConstValue.class, "pointer");
    }

    public FnEntry getFn() {
        return payload(FnEntry.class, "fn");
    }

    public ScopeEntry getScope() {
        return payload(ScopeEntry.class, "block");
    }

    @SuppressWarnings("unchecked")
    public List<ConstValue> getElements() {
        return (List<ConstValue>) payload(List.class, "array");
    }

    /**
     * 可选值的子值，null 表示值为 null。
     */
    public ConstValue getMaybeChild() {
        if (data == ABSENT) {
            requireStatic("maybe");
            return null;
        }
        return payload(ConstValue.class, "maybe");
    }

    public ImportEntry getImport() {
        return payload(ImportEntry.class, "namespace");
    }

    public BoundFn getBoundFn() {
        return payload(BoundFn.class, "bound fn");
    }

    private <T> T payload(Class<T> shape, String what) {
        requireStatic(what);
        if (!shape.isInstance(data)) {
            throw new IrContractException("expected " + what + " payload, found "
                    + (data == null || data == ABSENT ? "none" : data.getClass().getSimpleName()));
        }
        return shape.cast(data);
    }

    private void requireStatic(String what) {
        if (special != ConstSpecial.STATIC) {
            throw new IrContractException("expected static " + what + " value, found " + special);
        }
    }

    @Override
    public String toString() {
        if (special != ConstSpecial.STATIC) return special.name().toLowerCase();
        if (data == ABSENT) return "null";
        return String.valueOf(data);
    }
}
