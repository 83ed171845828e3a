package com.irdump.printer;

import com.irdump.ir.mir.BasicBlock;
import com.irdump.ir.mir.BigNum;
import com.irdump.ir.mir.ConstValue;
import com.irdump.ir.mir.Executable;
import com.irdump.ir.mir.FnEntry;
import com.irdump.ir.mir.ImportEntry;
import com.irdump.ir.mir.IrContractException;
import com.irdump.ir.mir.IrInstruction;
import com.irdump.ir.mir.IrType;
import com.irdump.ir.mir.IrVariable;
import com.irdump.ir.mir.ScopeEntry;
import com.irdump.ir.mir.SourceLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConstValueRenderer 测试")
class ConstValueRendererTest {

    private static final IrType I32 = IrType.ofInt(true, 32);
    private static final IrType U8 = IrType.ofInt(false, 8);

    private Executable exec;
    private BasicBlock entry;
    private PrintConfig config;

    @BeforeEach
    void setUp() {
        exec = new Executable("values");
        entry = exec.newBlock("entry");
        config = new PrintConfig();
    }

    private String render(IrType type, ConstValue value) {
        StringBuilder sb = new StringBuilder();
        new OperandRenderer().getValueRenderer().render(type, value, new PrintContext(sb, exec, config));
        return sb.toString();
    }

    @Nested
    @DisplayName("求值状态")
    class States {

        @Test
        @DisplayName("undefined 与 zeroes 与类型无关")
        void testUndefAndZeroes() {
            assertThat(render(I32, ConstValue.undef())).isEqualTo("undefined");
            assertThat(render(IrType.ofStruct("Point"), ConstValue.zeroes())).isEqualTo("zeroes");
            assertThat(render(null, ConstValue.zeroes())).isEqualTo("zeroes");
        }

        @Test
        @DisplayName("runtime 值不能进入常量渲染器")
        void testRuntimeRejected() {
            assertThatThrownBy(() -> render(I32, ConstValue.runtime()))
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("runtime value");
        }

        @Test
        @DisplayName("静态值必须有类型")
        void testStaticWithoutType() {
            assertThatThrownBy(() -> render(null, ConstValue.ofInt(1)))
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("no type");
        }
    }

    @Nested
    @DisplayName("数值")
    class Numbers {

        @Test
        @DisplayName("整数输出符号与量值")
        void testIntegers() {
            assertThat(render(I32, ConstValue.ofInt(42))).isEqualTo("42");
            assertThat(render(I32, ConstValue.ofInt(-17))).isEqualTo("-17");
            assertThat(render(IrType.ofNumLitInt(), ConstValue.ofInt(new BigInteger("123456789012345678901234567890"))))
                    .isEqualTo("123456789012345678901234567890");
            assertThat(render(I32, ConstValue.ofBigNum(BigNum.ofMagnitude(true, BigInteger.ZERO)))).isEqualTo("-0");
        }

        @Test
        @DisplayName("浮点固定输出六位小数")
        void testFloats() {
            assertThat(render(IrType.ofNumLitFloat(), ConstValue.ofFloat(1.5))).isEqualTo("1.500000");
            assertThat(render(IrType.ofFloat(64), ConstValue.ofFloat(-2.25))).isEqualTo("-2.250000");
        }

        @Test
        @DisplayName("浮点按二进制精确值舍入")
        void testFloatRoundsExactBinaryValue() {
            IrType f64 = IrType.ofFloat(64);
            assertThat(render(f64, ConstValue.ofFloat(5e-7))).isEqualTo("0.000000");
            assertThat(render(f64, ConstValue.ofFloat(0.1234565))).isEqualTo("0.123456");
            assertThat(render(f64, ConstValue.ofFloat(1.0000005))).isEqualTo("1.000001");
            assertThat(render(f64, ConstValue.ofFloat(1e20))).isEqualTo("100000000000000000000.000000");
        }

        @Test
        @DisplayName("负零与被舍成零的负数保留负号")
        void testFloatNegativeZero() {
            IrType f32 = IrType.ofFloat(32);
            assertThat(render(f32, ConstValue.ofFloat(-0.0))).isEqualTo("-0.000000");
            assertThat(render(f32, ConstValue.ofFloat(-1e-9))).isEqualTo("-0.000000");
        }

        @Test
        @DisplayName("非有限浮点写作 nan 与 inf")
        void testFloatNonFinite() {
            IrType f64 = IrType.ofFloat(64);
            assertThat(render(f64, ConstValue.ofFloat(Double.NaN))).isEqualTo("nan");
            assertThat(render(f64, ConstValue.ofFloat(Double.POSITIVE_INFINITY))).isEqualTo("inf");
            assertThat(render(IrType.ofNumLitFloat(), ConstValue.ofFloat(Double.NEGATIVE_INFINITY))).isEqualTo("-inf");
        }

        @Test
        @DisplayName("整数类型遇到浮点数违反契约，反之亦然")
        void testNumberKindMismatch() {
            assertThatThrownBy(() -> render(I32, ConstValue.ofFloat(1.0)))
                    .isInstanceOf(IrContractException.class);
            assertThatThrownBy(() -> render(IrType.ofFloat(32), ConstValue.ofInt(1)))
                    .isInstanceOf(IrContractException.class);
        }

        @Test
        @DisplayName("别名按规范类型渲染")
        void testTypeDecl() {
            IrType alias = IrType.ofTypeDecl("Handle", U8);
            assertThat(render(alias, ConstValue.ofInt(9))).isEqualTo("9");
        }
    }

    @Nested
    @DisplayName("简单种类")
    class Simple {

        @Test
        @DisplayName("固定文本的种类")
        void testFixedText() {
            assertThat(render(IrType.ofVoid(), ConstValue.ofStatic())).isEqualTo("{}");
            assertThat(render(IrType.ofUnreachable(), ConstValue.ofStatic())).isEqualTo("@unreachable()");
            assertThat(render(IrType.ofInvalid(), ConstValue.ofStatic())).isEqualTo("(invalid)");
            assertThat(render(IrType.ofVar(), ConstValue.ofStatic())).isEqualTo("(var)");
            assertThat(render(IrType.ofNullLit(), ConstValue.ofStatic())).isEqualTo("null");
            assertThat(render(IrType.ofUndefLit(), ConstValue.ofStatic())).isEqualTo("undefined");
            assertThat(render(IrType.ofPureError(), ConstValue.ofStatic())).isEqualTo("(pure error constant)");
        }

        @Test
        @DisplayName("bool / 元类型 / 函数 / 作用域 / 命名空间")
        void testPayloadKinds() {
            assertThat(render(IrType.ofBool(), ConstValue.ofBool(false))).isEqualTo("false");
            assertThat(render(IrType.ofMetaType(), ConstValue.ofType(IrType.ofMaybe(U8)))).isEqualTo("?u8");
            assertThat(render(IrType.ofFn("fn()"), ConstValue.ofFn(new FnEntry("main")))).isEqualTo("main");
            assertThat(render(IrType.ofBlock(),
                    ConstValue.ofScope(new ScopeEntry(new SourceLocation("a.zig", 3, 7))))).isEqualTo("(scope:3:7)");
            assertThat(render(IrType.ofNamespace(), ConstValue.ofNamespace(new ImportEntry("std/io.zig"))))
                    .isEqualTo("(namespace: std/io.zig)");
        }

        @Test
        @DisplayName("不透明聚合只输出占位")
        void testOpaqueAggregates() {
            assertThat(render(IrType.ofStruct("Point"), ConstValue.ofStatic())).isEqualTo("(struct Point constant)");
            assertThat(render(IrType.ofEnum("Color"), ConstValue.ofStatic())).isEqualTo("(enum Color constant)");
            assertThat(render(IrType.ofUnion("Value"), ConstValue.ofStatic())).isEqualTo("(union Value constant)");
            assertThat(render(IrType.ofErrorUnion(I32), ConstValue.ofStatic()))
                    .isEqualTo("(error union %i32 constant)");
        }

        @Test
        @DisplayName("数据形状不符违反契约")
        void testWrongPayload() {
            assertThatThrownBy(() -> render(IrType.ofBool(), ConstValue.ofInt(1)))
                    .isInstanceOf(IrContractException.class);
        }
    }

    @Nested
    @DisplayName("递归种类")
    class Recursive {

        @Test
        @DisplayName("指向 true 的指针")
        void testPointer() {
            assertThat(render(IrType.ofPointer(IrType.ofBool(), false), ConstValue.ofPointer(ConstValue.ofBool(true))))
                    .isEqualTo("&true");
        }

        @Test
        @DisplayName("zeroes 元素与整数零元素可区分")
        void testArrayZeroes() {
            IrType type = IrType.ofArray(U8, 3);
            assertThat(render(type, ConstValue.ofArray(ConstValue.zeroes(), ConstValue.zeroes(), ConstValue.zeroes())))
                    .isEqualTo("[3]u8{zeroes,zeroes,zeroes}");
            assertThat(render(type, ConstValue.ofArray(ConstValue.ofInt(0), ConstValue.ofInt(0), ConstValue.ofInt(0))))
                    .isEqualTo("[3]u8{0,0,0}");
        }

        @Test
        @DisplayName("空数组与嵌套数组")
        void testNestedArrays() {
            assertThat(render(IrType.ofArray(U8, 0), ConstValue.ofArray())).isEqualTo("[0]u8{}");
            IrType row = IrType.ofArray(U8, 2);
            IrType matrix = IrType.ofArray(row, 2);
            ConstValue value = ConstValue.ofArray(
                    ConstValue.ofArray(ConstValue.ofInt(1), ConstValue.ofInt(2)),
                    ConstValue.undef());
            assertThat(render(matrix, value)).isEqualTo("[2][2]u8{[2]u8{1,2},undefined}");
        }

        @Test
        @DisplayName("元素个数与数组长度不符违反契约")
        void testArrayLengthMismatch() {
            assertThatThrownBy(() -> render(IrType.ofArray(U8, 3), ConstValue.ofArray(ConstValue.ofInt(1))))
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("has 1 elements");
        }

        @Test
        @DisplayName("可选值：有值与 null")
        void testMaybe() {
            IrType type = IrType.ofMaybe(I32);
            assertThat(render(type, ConstValue.ofMaybe(ConstValue.ofInt(3)))).isEqualTo("3");
            assertThat(render(type, ConstValue.ofMaybe(null))).isEqualTo("null");
        }

        @Test
        @DisplayName("绑定函数的 runtime 接收者输出引用")
        void testBoundFnRuntimeReceiver() {
            exec.append(entry, new IrInstruction.VarPtr(7, null, new IrVariable("self", false, false)));
            assertThat(render(IrType.ofBoundFn("(bound fn foo)"), ConstValue.ofBoundFn(new FnEntry("foo"), 7)))
                    .isEqualTo("bound foo to #7");
        }

        @Test
        @DisplayName("绑定函数的常量接收者内联")
        void testBoundFnStaticReceiver() {
            IrInstruction.Const receiver = new IrInstruction.Const(2, null);
            receiver.setType(I32);
            receiver.setValue(ConstValue.ofInt(5));
            exec.append(entry, receiver);
            assertThat(render(IrType.ofBoundFn("(bound fn foo)"), ConstValue.ofBoundFn(new FnEntry("foo"), 2)))
                    .isEqualTo("bound foo to 5");
        }

        @Test
        @DisplayName("绑定函数的接收者必须存在")
        void testBoundFnUnknownReceiver() {
            assertThatThrownBy(() -> render(IrType.ofBoundFn("(bound fn foo)"),
                    ConstValue.ofBoundFn(new FnEntry("foo"), 40)))
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("unknown instruction id 40");
        }
    }

    @Nested
    @DisplayName("嵌套深度")
    class Depth {

        private final IrType ptr3 = IrType.ofPointer(IrType.ofPointer(IrType.ofPointer(IrType.ofBool(), false), false), false);
        private final ConstValue value3 = ConstValue.ofPointer(ConstValue.ofPointer(ConstValue.ofPointer(ConstValue.ofBool(true))));

        @Test
        @DisplayName("默认深度足够")
        void testDefaultDepth() {
            assertThat(render(ptr3, value3)).isEqualTo("&&&true");
        }

        @Test
        @DisplayName("超过上限违反契约")
        void testDepthExceeded() {
            config.setMaxValueDepth(2);
            assertThatThrownBy(() -> render(ptr3, value3))
                    .isInstanceOf(IrContractException.class)
                    .hasMessageContaining("value nesting exceeds 2 levels");
        }

        @Test
        @DisplayName("上限恰好等于嵌套层数时正常输出")
        void testDepthAtLimit() {
            config.setMaxValueDepth(3);
            assertThat(render(ptr3, value3)).isEqualTo("&&&true");
        }

        @Test
        @DisplayName("上限为 1 时允许一层嵌套")
        void testSingleLevel() {
            config.setMaxValueDepth(1);
            IrType ptr = IrType.ofPointer(IrType.ofBool(), false);
            assertThat(render(ptr, ConstValue.ofPointer(ConstValue.ofBool(false)))).isEqualTo("&false");
            assertThat(render(IrType.ofBool(), ConstValue.ofBool(true))).isEqualTo("true");
        }
    }
}
