package com.cfort.compiler.codegen;

/**
 * Fortran 代码生成配置
 */
public class GeneratorConfig {
    private int indentSize = 2;
    private int maxLineWidth = 132;
    private String moduleName = "c_functions";
    private String programName = "main";
    private boolean emitHeader = true;
    private String ioStatusName = "io_status";
    private String tempPrefix = "tmp";

    public GeneratorConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0 || indentSize > 8) {
            throw new IllegalArgumentException("Indent size must be between 0 and 8: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    /** 单行最大宽度（含缩进），超出时用 &amp; 续行 */
    public int getMaxLineWidth() {
        return maxLineWidth;
    }

    public void setMaxLineWidth(int maxLineWidth) {
        if (maxLineWidth < 40 || maxLineWidth > 132) {
            throw new IllegalArgumentException("Max line width must be between 40 and 132: " + maxLineWidth);
        }
        this.maxLineWidth = maxLineWidth;
    }

    /** 容纳 main 以外函数的模块名 */
    public String getModuleName() {
        return moduleName;
    }

    public void setModuleName(String moduleName) {
        this.moduleName = moduleName;
    }

    public String getProgramName() {
        return programName;
    }

    public void setProgramName(String programName) {
        this.programName = programName;
    }

    public boolean isEmitHeader() {
        return emitHeader;
    }

    public void setEmitHeader(boolean emitHeader) {
        this.emitHeader = emitHeader;
    }

    /** scanf 转换出的 read 语句使用的 iostat 变量名（冲突时加后缀） */
    public String getIoStatusName() {
        return ioStatusName;
    }

    public void setIoStatusName(String ioStatusName) {
        this.ioStatusName = ioStatusName;
    }

    /** 生成器引入的临时变量名前缀 */
    public String getTempPrefix() {
        return tempPrefix;
    }

    public void setTempPrefix(String tempPrefix) {
        this.tempPrefix = tempPrefix;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
