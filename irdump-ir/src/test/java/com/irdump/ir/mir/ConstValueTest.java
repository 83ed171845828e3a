package com.irdump.ir.mir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConstValue / IrType / BigNum 测试")
class ConstValueTest {

    @Nested
    @DisplayName("求值状态")
    class Specials {

        @Test
        @DisplayName("runtime / undef / zeroes 不带数据")
        void testSpecials() {
            assertThat(ConstValue.runtime().isRuntime()).isTrue();
            assertThat(ConstValue.undef().getSpecial()).isEqualTo(ConstSpecial.UNDEF);
            assertThat(ConstValue.zeroes().getSpecial()).isEqualTo(ConstSpecial.ZEROES);
            assertThatThrownBy(() -> ConstValue.zeroes().getBigNum())
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("found ZEROES");
        }
    }

    @Nested
    @DisplayName("数据形状")
    class Payloads {

        @Test
        @DisplayName("按形状读取数据")
        void testPayloads() {
            assertThat(ConstValue.ofBool(true).getBool()).isTrue();
            assertThat(ConstValue.ofType(IrType.ofBool()).getType().getName()).isEqualTo("bool");
            assertThat(ConstValue.ofPointer(ConstValue.ofBool(false)).getPointee().getBool()).isFalse();
            assertThat(ConstValue.ofFn(new FnEntry("main")).getFn().getSymbolName()).isEqualTo("main");
            assertThat(ConstValue.ofArray(ConstValue.zeroes(), ConstValue.zeroes()).getElements()).hasSize(2);
            assertThat(ConstValue.ofNamespace(new ImportEntry("std")).getImport().getPath()).isEqualTo("std");
            assertThat(ConstValue.ofBoundFn(new FnEntry("foo"), 7).getBoundFn().getFirstArgId()).isEqualTo(7);
        }

        @Test
        @DisplayName("可选值可以为空")
        void testMaybe() {
            assertThat(ConstValue.ofMaybe(null).getMaybeChild()).isNull();
            assertThat(ConstValue.ofMaybe(ConstValue.ofBool(true)).getMaybeChild().getBool()).isTrue();
            assertThatThrownBy(() -> ConstValue.ofMaybe(null).getPointee())
                    .isInstanceOf(IrContractException.class);
        }

        @Test
        @DisplayName("形状不符违反契约")
        void testWrongShape() {
            assertThatThrownBy(() -> ConstValue.ofInt(3).getBool())
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("expected bool payload, found BigNum");
            assertThatThrownBy(() -> ConstValue.ofStatic().getFn())
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("found none");
        }

        @Test
        @DisplayName("数组元素列表不可修改")
        void testArrayImmutable() {
            ConstValue array = ConstValue.ofArray(ConstValue.ofInt(1));
            assertThatThrownBy(() -> array.getElements().add(ConstValue.ofInt(2)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("BigNum")
    class BigNums {

        @Test
        @DisplayName("整数保存符号与量值")
        void testSignMagnitude() {
            BigNum n = BigNum.ofInt(-42);
            assertThat(n.isNegative()).isTrue();
            assertThat(n.getMagnitude()).isEqualTo(BigInteger.valueOf(42));
            assertThat(BigNum.ofMagnitude(true, BigInteger.ZERO).isNegative()).isTrue();
        }

        @Test
        @DisplayName("整数与浮点不能混读")
        void testKindChecks() {
            assertThatThrownBy(() -> BigNum.ofFloat(1.5).getMagnitude()).isInstanceOf(IrContractException.class);
            assertThatThrownBy(() -> BigNum.ofInt(1).getFloatValue()).isInstanceOf(IrContractException.class);
            assertThatThrownBy(() -> BigNum.ofMagnitude(false, BigInteger.valueOf(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("IrType")
    class Types {

        @Test
        @DisplayName("复合类型的名称")
        void testNames() {
            IrType u8 = IrType.ofInt(false, 8);
            assertThat(IrType.ofInt(true, 32).getName()).isEqualTo("i32");
            assertThat(IrType.ofFloat(64).getName()).isEqualTo("f64");
            assertThat(IrType.ofArray(u8, 3).getName()).isEqualTo("[3]u8");
            assertThat(IrType.ofPointer(u8, true).getName()).isEqualTo("&const u8");
            assertThat(IrType.ofMaybe(u8).getName()).isEqualTo("?u8");
            assertThat(IrType.ofErrorUnion(u8).getName()).isEqualTo("%u8");
        }

        @Test
        @DisplayName("不适用的链接违反契约")
        void testLinks() {
            IrType u8 = IrType.ofInt(false, 8);
            assertThat(IrType.ofArray(u8, 4).getLength()).isEqualTo(4);
            assertThat(IrType.ofTypeDecl("byte", u8).getCanonical()).isSameAs(u8);
            assertThatThrownBy(u8::getChild).isInstanceOf(IrContractException.class);
            assertThatThrownBy(u8::getLength).isInstanceOf(IrContractException.class);
            assertThatThrownBy(u8::getCanonical).isInstanceOf(IrContractException.class);
        }

        @Test
        @DisplayName("按种类分派到访问者")
        void testDispatch() {
            TypeKindVisitor<String, Void> names = new KindNames();
            assertThat(IrType.ofBool().accept(names, ConstValue.ofBool(true), null)).isEqualTo("bool");
            assertThat(IrType.ofStruct("P").accept(names, ConstValue.ofStatic(), null)).isEqualTo("struct");
            assertThat(IrType.ofNamespace().accept(names, ConstValue.ofStatic(), null)).isEqualTo("namespace");
        }
    }

    @Test
    @DisplayName("契约异常附带指令 id")
    void testContractExceptionId() {
        IrContractException plain = new IrContractException("broken");
        assertThat(plain.hasInstructionId()).isFalse();
        assertThat(plain.getMessage()).isEqualTo("broken");

        IrContractException located = IrContractException.at(plain, 5);
        assertThat(located.getInstructionId()).isEqualTo(5);
        assertThat(located.getMessage()).isEqualTo("broken (instruction #5)");
        assertThat(located.getCause()).isSameAs(plain);
        assertThat(IrContractException.at(located, 9)).isSameAs(located);
    }

    /** 只返回种类名的访问者 */
    private static class KindNames implements TypeKindVisitor<String, Void> {
        @Override public String visitTypeDecl(IrType t, ConstValue v, Void c) { return "typedecl"; }
        @Override public String visitInvalid(IrType t, ConstValue v, Void c) { return "invalid"; }
        @Override public String visitVar(IrType t, ConstValue v, Void c) { return "var"; }
        @Override public String visitVoid(IrType t, ConstValue v, Void c) { return "void"; }
        @Override public String visitNumLitFloat(IrType t, ConstValue v, Void c) { return "numlitfloat"; }
        @Override public String visitNumLitInt(IrType t, ConstValue v, Void c) { return "numlitint"; }
        @Override public String visitMetaType(IrType t, ConstValue v, Void c) { return "metatype"; }
        @Override public String visitInt(IrType t, ConstValue v, Void c) { return "int"; }
        @Override public String visitFloat(IrType t, ConstValue v, Void c) { return "float"; }
        @Override public String visitUnreachable(IrType t, ConstValue v, Void c) { return "unreachable"; }
        @Override public String visitBool(IrType t, ConstValue v, Void c) { return "bool"; }
        @Override public String visitNullLit(IrType t, ConstValue v, Void c) { return "nulllit"; }
        @Override public String visitUndefLit(IrType t, ConstValue v, Void c) { return "undeflit"; }
        @Override public String visitPointer(IrType t, ConstValue v, Void c) { return "pointer"; }
        @Override public String visitFn(IrType t, ConstValue v, Void c) { return "fn"; }
        @Override public String visitBlock(IrType t, ConstValue v, Void c) { return "block"; }
        @Override public String visitArray(IrType t, ConstValue v, Void c) { return "array"; }
        @Override public String visitMaybe(IrType t, ConstValue v, Void c) { return "maybe"; }
        @Override public String visitNamespace(IrType t, ConstValue v, Void c) { return "namespace"; }
        @Override public String visitBoundFn(IrType t, ConstValue v, Void c) { return "boundfn"; }
        @Override public String visitStruct(IrType t, ConstValue v, Void c) { return "struct"; }
        @Override public String visitEnum(IrType t, ConstValue v, Void c) { return "enum"; }
        @Override public String visitErrorUnion(IrType t, ConstValue v, Void c) { return "errorunion"; }
        @Override public String visitUnion(IrType t, ConstValue v, Void c) { return "union"; }
        @Override public String visitPureError(IrType t, ConstValue v, Void c) { return "pureerror"; }
    }
}
