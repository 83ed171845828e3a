package com.irdump.printer;

/**
 * IR 打印配置
 */
public class PrintConfig {
    private int indentSize = 4;
    private String blockSigil = "";
    private int maxValueDepth = 64;

    public PrintConfig() {
    }

    /**
     * 指令行的固定左边距（空格数），不随嵌套增加。
     */
    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    /**
     * 块引用的前缀，例如 "$" 得到 $then_0。
     */
    public String getBlockSigil() {
        return blockSigil;
    }

    public void setBlockSigil(String blockSigil) {
        if (blockSigil == null) {
            throw new IllegalArgumentException("blockSigil must not be null");
        }
        this.blockSigil = blockSigil;
    }

    public int getMaxValueDepth() {
        return maxValueDepth;
    }

    public void setMaxValueDepth(int maxValueDepth) {
        if (maxValueDepth < 1) {
            throw new IllegalArgumentException("maxValueDepth must be >= 1: " + maxValueDepth);
        }
        this.maxValueDepth = maxValueDepth;
    }

    /**
     * 获取左边距字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
