package com.irdump.ir.mir;

/**
 * 类型种类。每个常量都实现 {@link #accept}，保证分派在编译期穷尽。
 */
public enum TypeKind {
    TYPE_DECL {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitTypeDecl(type, value, context);
        }
    },
    INVALID {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitInvalid(type, value, context);
        }
    },
    VAR {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitVar(type, value, context);
        }
    },
    VOID {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitVoid(type, value, context);
        }
    },
    NUM_LIT_FLOAT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitNumLitFloat(type, value, context);
        }
    },
    NUM_LIT_INT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitNumLitInt(type, value, context);
        }
    },
    META_TYPE {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitMetaType(type, value, context);
        }
    },
    INT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitInt(type, value, context);
        }
    },
    FLOAT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitFloat(type, value, context);
        }
    },
    UNREACHABLE {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitUnreachable(type, value, context);
        }
    },
    BOOL {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitBool(type, value, context);
        }
    },
    POINTER {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitPointer(type, value, context);
        }
    },
    FN {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitFn(type, value, context);
        }
    },
    BLOCK {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitBlock(type, value, context);
        }
    },
    ARRAY {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitArray(type, value, context);
        }
    },
    NULL_LIT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitNullLit(type, value, context);
        }
    },
    UNDEF_LIT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitUndefLit(type, value, context);
        }
    },
    MAYBE {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitMaybe(type, value, context);
        }
    },
    NAMESPACE {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitNamespace(type, value, context);
        }
    },
    BOUND_FN {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitBoundFn(type, value, context);
        }
    },
    STRUCT {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitStruct(type, value, context);
        }
    },
    ENUM {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitEnum(type, value, context);
        }
    },
    ERROR_UNION {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitErrorUnion(type, value, context);
        }
    },
    UNION {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitUnion(type, value, context);
        }
    },
    PURE_ERROR {
        @Override
        public <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context) {
            return v.visitPureError(type, value, context);
        }
    };

    public abstract <R, C> R accept(TypeKindVisitor<R, C> v, IrType type, ConstValue value, C context);
}
