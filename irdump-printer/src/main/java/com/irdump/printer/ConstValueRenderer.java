package com.irdump.printer;

import com.irdump.ir.mir.BigNum;
import com.irdump.ir.mir.BoundFn;
import com.irdump.ir.mir.ConstValue;
import com.irdump.ir.mir.IrContractException;
import com.irdump.ir.mir.IrType;
import com.irdump.ir.mir.SourceLocation;
import com.irdump.ir.mir.TypeKindVisitor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 常量值渲染器。
 * <p>先看求值状态（undefined / zeroes），静态值再按类型种类分派。
 * 嵌套值（指针所指、数组元素、可选值、绑定函数的接收者）通过 {@link PrintContext#descend()}
 * 递归，深度受 {@link PrintConfig#getMaxValueDepth()} 限制。</p>
 */
public class ConstValueRenderer implements TypeKindVisitor<Void, PrintContext> {

    private final OperandRenderer operands;

    ConstValueRenderer(OperandRenderer operands) {
        this.operands = operands;
    }

    public void render(IrType type, ConstValue value, PrintContext ctx) {
        switch (value.getSpecial()) {
            case UNDEF:
                ctx.append("undefined");
                return;
            case ZEROES:
                ctx.append("zeroes");
                return;
            case RUNTIME:
                throw new IrContractException("runtime value reached the constant renderer");
            case STATIC:
                if (type == null) {
                    throw new IrContractException("static value has no type");
                }
                type.accept(this, value, ctx);
                return;
            default:
                throw new IrContractException("unknown evaluation state " + value.getSpecial());
        }
    }

    // ========== 无负载 ==========

    @Override
    public Void visitTypeDecl(IrType type, ConstValue value, PrintContext ctx) {
        render(type.getCanonical(), value, ctx);
        return null;
    }

    @Override
    public Void visitInvalid(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(invalid)");
        return null;
    }

    @Override
    public Void visitVar(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(var)");
        return null;
    }

    @Override
    public Void visitVoid(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("{}");
        return null;
    }

    @Override
    public Void visitUnreachable(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("@unreachable()");
        return null;
    }

    @Override
    public Void visitNullLit(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("null");
        return null;
    }

    @Override
    public Void visitUndefLit(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("undefined");
        return null;
    }

    // ========== 数值 ==========

    @Override
    public Void visitNumLitFloat(IrType type, ConstValue value, PrintContext ctx) {
        renderFloat(value.getBigNum(), ctx);
        return null;
    }

    @Override
    public Void visitFloat(IrType type, ConstValue value, PrintContext ctx) {
        renderFloat(value.getBigNum(), ctx);
        return null;
    }

    @Override
    public Void visitNumLitInt(IrType type, ConstValue value, PrintContext ctx) {
        renderInt(value.getBigNum(), ctx);
        return null;
    }

    @Override
    public Void visitInt(IrType type, ConstValue value, PrintContext ctx) {
        renderInt(value.getBigNum(), ctx);
        return null;
    }

    private void renderInt(BigNum num, PrintContext ctx) {
        // 量值与符号分开保存，-0 也会带上负号
        String magnitude = num.getMagnitude().toString();
        ctx.append(num.isNegative() ? "-" + magnitude : magnitude);
    }

    /**
     * C {@code %f} 记法：按二进制精确值舍入到六位小数（半数取偶），
     * 负号取自符号位，非有限值写作 nan / inf / -inf。
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        boolean negative = (Double.doubleToRawLongBits(d) & Long.MIN_VALUE) != 0;
        if (Double.isInfinite(d)) {
            return negative ? "-inf" : "inf";
        }
        String digits = new BigDecimal(Math.abs(d)).setScale(6, RoundingMode.HALF_EVEN).toPlainString();
        return negative ? "-" + digits : digits;
    }

    private void renderFloat(BigNum num, PrintContext ctx) {
        ctx.append(formatFloat(num.getFloatValue()));
    }

    // ========== 简单负载 ==========

    @Override
    public Void visitMetaType(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append(value.getType().getName());
        return null;
    }

    @Override
    public Void visitBool(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append(value.getBool() ? "true" : "false");
        return null;
    }

    @Override
    public Void visitFn(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append(value.getFn().getSymbolName());
        return null;
    }

    @Override
    public Void visitBlock(IrType type, ConstValue value, PrintContext ctx) {
        SourceLocation loc = value.getScope().getLocation();
        ctx.append("(scope:" + loc.getLine() + ":" + loc.getColumn() + ")");
        return null;
    }

    @Override
    public Void visitNamespace(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(namespace: " + value.getImport().getPath() + ")");
        return null;
    }

    // ========== 递归 ==========

    @Override
    public Void visitPointer(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("&");
        render(type.getChild(), value.getPointee(), ctx.descend());
        return null;
    }

    @Override
    public Void visitArray(IrType type, ConstValue value, PrintContext ctx) {
        List<ConstValue> elements = value.getElements();
        if (elements.size() != type.getLength()) {
            throw new IrContractException("array of type " + type.getName() + " has "
                    + elements.size() + " elements");
        }
        PrintContext inner = ctx.descend();
        ctx.append(type.getName()).append("{");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) ctx.append(",");
            render(type.getChild(), elements.get(i), inner);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitMaybe(IrType type, ConstValue value, PrintContext ctx) {
        ConstValue child = value.getMaybeChild();
        if (child == null) {
            ctx.append("null");
        } else {
            render(type.getChild(), child, ctx.descend());
        }
        return null;
    }

    @Override
    public Void visitBoundFn(IrType type, ConstValue value, PrintContext ctx) {
        BoundFn bound = value.getBoundFn();
        ctx.append("bound ").append(bound.getFn().getSymbolName()).append(" to ");
        operands.render(bound.getFirstArgId(), ctx.descend());
        return null;
    }

    // ========== 不透明聚合 ==========

    @Override
    public Void visitStruct(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(struct " + type.getName() + " constant)");
        return null;
    }

    @Override
    public Void visitEnum(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(enum " + type.getName() + " constant)");
        return null;
    }

    @Override
    public Void visitErrorUnion(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(error union " + type.getName() + " constant)");
        return null;
    }

    @Override
    public Void visitUnion(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(union " + type.getName() + " constant)");
        return null;
    }

    @Override
    public Void visitPureError(IrType type, ConstValue value, PrintContext ctx) {
        ctx.append("(pure error constant)");
        return null;
    }
}
