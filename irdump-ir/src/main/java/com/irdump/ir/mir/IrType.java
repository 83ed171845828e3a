package com.irdump.ir.mir;

/**
 * MIR 类型表条目。
 * <p>类型身份、名称由类型系统提供，这里只保存打印所需的信息：
 * 种类、声明名、别名的规范类型、指针/数组/可选的子类型以及数组长度。</p>
 */
public class IrType {

    private final TypeKind kind;
    private final String name;
    private final IrType canonical;   // TYPE_DECL 时使用
    private final IrType child;       // POINTER / ARRAY / MAYBE / ERROR_UNION 时使用
    private final long length;        // ARRAY 时使用

    private IrType(TypeKind kind, String name, IrType canonical, IrType child, long length) {
        this.kind = kind;
        this.name = name;
        this.canonical = canonical;
        this.child = child;
        this.length = length;
    }

    public static IrType ofVoid()        { return new IrType(TypeKind.VOID, "void", null, null, 0); }
    public static IrType ofBool()        { return new IrType(TypeKind.BOOL, "bool", null, null, 0); }
    public static IrType ofMetaType()    { return new IrType(TypeKind.META_TYPE, "type", null, null, 0); }
    public static IrType ofUnreachable() { return new IrType(TypeKind.UNREACHABLE, "unreachable", null, null, 0); }
    public static IrType ofNumLitInt()   { return new IrType(TypeKind.NUM_LIT_INT, "(integer literal)", null, null, 0); }
    public static IrType ofNumLitFloat() { return new IrType(TypeKind.NUM_LIT_FLOAT, "(float literal)", null, null, 0); }
    public static IrType ofNullLit()     { return new IrType(TypeKind.NULL_LIT, "(null)", null, null, 0); }
    public static IrType ofUndefLit()    { return new IrType(TypeKind.UNDEF_LIT, "(undefined)", null, null, 0); }
    public static IrType ofBlock()       { return new IrType(TypeKind.BLOCK, "(block)", null, null, 0); }
    public static IrType ofNamespace()   { return new IrType(TypeKind.NAMESPACE, "(namespace)", null, null, 0); }
    public static IrType ofPureError()   { return new IrType(TypeKind.PURE_ERROR, "error", null, null, 0); }
    public static IrType ofInvalid()     { return new IrType(TypeKind.INVALID, "(invalid)", null, null, 0); }
    public static IrType ofVar()         { return new IrType(TypeKind.VAR, "(var)", null, null, 0); }

    /** 定长整数，如 i32 / u8 */
    public static IrType ofInt(boolean signed, int bits) {
        return new IrType(TypeKind.INT, (signed ? "i" : "u") + bits, null, null, 0);
    }

    /** 定长浮点，如 f32 / f64 */
    public static IrType ofFloat(int bits) {
        return new IrType(TypeKind.FLOAT, "f" + bits, null, null, 0);
    }

    public static IrType ofPointer(IrType child, boolean isConst) {
        String name = (isConst ? "&const " : "&") + child.getName();
        return new IrType(TypeKind.POINTER, name, null, child, 0);
    }

    public static IrType ofArray(IrType child, long length) {
        if (length < 0) {
            throw new IllegalArgumentException("array length must be non-negative: " + length);
        }
        return new IrType(TypeKind.ARRAY, "[" + length + "]" + child.getName(), null, child, length);
    }

    public static IrType ofMaybe(IrType child) {
        return new IrType(TypeKind.MAYBE, "?" + child.getName(), null, child, 0);
    }

    public static IrType ofErrorUnion(IrType child) {
        return new IrType(TypeKind.ERROR_UNION, "%" + child.getName(), null, child, 0);
    }

    /** 具名别名，打印常量时按规范类型处理 */
    public static IrType ofTypeDecl(String name, IrType canonical) {
        return new IrType(TypeKind.TYPE_DECL, name, canonical, null, 0);
    }

    public static IrType ofFn(String name)      { return new IrType(TypeKind.FN, name, null, null, 0); }
    public static IrType ofBoundFn(String name) { return new IrType(TypeKind.BOUND_FN, name, null, null, 0); }
    public static IrType ofStruct(String name)  { return new IrType(TypeKind.STRUCT, name, null, null, 0); }
    public static IrType ofEnum(String name)    { return new IrType(TypeKind.ENUM, name, null, null, 0); }
    public static IrType ofUnion(String name)   { return new IrType(TypeKind.UNION, name, null, null, 0); }

    public TypeKind getKind() { return kind; }
    public String getName() { return name; }

    /**
     * 别名的规范类型。
     */
    public IrType getCanonical() {
        if (kind != TypeKind.TYPE_DECL) {
            throw new IrContractException("type " + name + " is not a declared alias");
        }
        return canonical;
    }

    /**
     * 指针所指、数组元素、可选值或错误联合的子类型。
     */
    public IrType getChild() {
        if (child == null) {
            throw new IrContractException("type " + name + " (" + kind + ") has no child type");
        }
        return child;
    }

    public long getLength() {
        if (kind != TypeKind.ARRAY) {
            throw new IrContractException("type " + name + " is not an array");
        }
        return length;
    }

    /**
     * 按本类型的种类分派。
     */
    public <R, C> R accept(TypeKindVisitor<R, C> visitor, ConstValue value, C context) {
        return kind.accept(visitor, this, value, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
