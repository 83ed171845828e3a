package com.irdump.ir.mir;

/**
 * 按类型种类分派常量值的访问者接口，25 个 visit 方法。
 * <p>新增 {@link TypeKind} 时必须同时在此处加方法，所有实现类都会在编译期报错。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface TypeKindVisitor<R, C> {

    // ===== 别名 / 占位 (3) =====
    R visitTypeDecl(IrType type, ConstValue value, C context);
    R visitInvalid(IrType type, ConstValue value, C context);
    R visitVar(IrType type, ConstValue value, C context);

    // ===== 标量 (10) =====
    R visitVoid(IrType type, ConstValue value, C context);
    R visitNumLitFloat(IrType type, ConstValue value, C context);
    R visitNumLitInt(IrType type, ConstValue value, C context);
    R visitMetaType(IrType type, ConstValue value, C context);
    R visitInt(IrType type, ConstValue value, C context);
    R visitFloat(IrType type, ConstValue value, C context);
    R visitUnreachable(IrType type, ConstValue value, C context);
    R visitBool(IrType type, ConstValue value, C context);
    R visitNullLit(IrType type, ConstValue value, C context);
    R visitUndefLit(IrType type, ConstValue value, C context);

    // ===== 引用 / 复合 (7) =====
    R visitPointer(IrType type, ConstValue value, C context);
    R visitFn(IrType type, ConstValue value, C context);
    R visitBlock(IrType type, ConstValue value, C context);
    R visitArray(IrType type, ConstValue value, C context);
    R visitMaybe(IrType type, ConstValue value, C context);
    R visitNamespace(IrType type, ConstValue value, C context);
    R visitBoundFn(IrType type, ConstValue value, C context);

    // ===== 不透明聚合 (5) =====
    R visitStruct(IrType type, ConstValue value, C context);
    R visitEnum(IrType type, ConstValue value, C context);
    R visitErrorUnion(IrType type, ConstValue value, C context);
    R visitUnion(IrType type, ConstValue value, C context);
    R visitPureError(IrType type, ConstValue value, C context);
}
