package com.irdump.ir.mir;

/**
 * 导入表条目（namespace 类型的值）。
 */
public final class ImportEntry {

    private final String path;

    public ImportEntry(String path) {
        this.path = path;
    }

    public String getPath() { return path; }

    @Override
    public String toString() {
        return path;
    }
}
