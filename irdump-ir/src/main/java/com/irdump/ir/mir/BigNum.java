package com.irdump.ir.mir;

import java.math.BigInteger;

/**
 * 编译期数值：整数以「符号 + 无符号量值」保存，浮点直接保存 double。
 */
public final class BigNum {

    public enum Kind { INT, FLOAT }

    private final Kind kind;
    private final boolean negative;
    private final BigInteger magnitude;   // INT 时使用，恒为非负
    private final double floatValue;      // FLOAT 时使用

    private BigNum(Kind kind, boolean negative, BigInteger magnitude, double floatValue) {
        this.kind = kind;
        this.negative = negative;
        this.magnitude = magnitude;
        this.floatValue = floatValue;
    }

    public static BigNum ofInt(long value) {
        return ofInt(BigInteger.valueOf(value));
    }

    public static BigNum ofInt(BigInteger value) {
        return new BigNum(Kind.INT, value.signum() < 0, value.abs(), 0);
    }

    /**
     * 直接给出符号和量值。允许 -0，与上游常量求值的表示保持一致。
     */
    public static BigNum ofMagnitude(boolean negative, BigInteger magnitude) {
        if (magnitude.signum() < 0) {
            throw new IllegalArgumentException("magnitude must be non-negative: " + magnitude);
        }
        return new BigNum(Kind.INT, negative, magnitude, 0);
    }

    public static BigNum ofFloat(double value) {
        return new BigNum(Kind.FLOAT, false, null, value);
    }

    public Kind getKind() { return kind; }
    public boolean isNegative() { return negative; }

    public BigInteger getMagnitude() {
        if (kind != Kind.INT) {
            throw new IrContractException("big number is not an integer");
        }
        return magnitude;
    }

    public double getFloatValue() {
        if (kind != Kind.FLOAT) {
            throw new IrContractException("big number is not a float");
        }
        return floatValue;
    }

    @Override
    public String toString() {
        if (kind == Kind.FLOAT) return Double.toString(floatValue);
        return (negative ? "-" : "") + magnitude;
    }
}
