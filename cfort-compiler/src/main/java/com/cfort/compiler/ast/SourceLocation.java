package com.cfort.compiler.ast;

/**
 * 源码位置信息，诊断中渲染为 {@code file:line:column}。
 * 行号为 0 表示只知道文件（整个翻译单元的错误，如模块名冲突）。
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    /**
     * 只有文件名、没有具体行列的位置
     */
    public static SourceLocation ofFile(String file) {
        return new SourceLocation(file, 0, 0, 0, 0);
    }

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    /** 是否指向具体的行列 */
    public boolean hasLine() {
        return line > 0;
    }

    @Override
    public String toString() {
        return hasLine() ? file + ":" + line + ":" + column : file;
    }
}
