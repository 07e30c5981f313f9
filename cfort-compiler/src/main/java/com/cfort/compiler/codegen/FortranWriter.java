package com.cfort.compiler.codegen;

/**
 * Fortran 输出缓冲区，跟踪缩进层级，超宽的行用 &amp; 续行
 *
 * <p>续行统一采用"行尾 &amp; + 下一行行首 &amp;"的形式，在字符常量内部断开也合法。
 * 优先在字符常量之外的逗号或空格之后断开。</p>
 */
public class FortranWriter {
    private static final String CONTINUATION_INDENT = "    ";

    private final StringBuilder output = new StringBuilder();
    private final GeneratorConfig config;
    private int indentLevel;

    public FortranWriter(GeneratorConfig config) {
        this(config, 0);
    }

    public FortranWriter(GeneratorConfig config, int indentLevel) {
        this.config = config;
        this.indentLevel = indentLevel;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 输出一行语句，必要时续行
     */
    public void line(String text) {
        String indent = indentString();
        String continuationPrefix = indent + CONTINUATION_INDENT + "&";
        int width = config.getMaxLineWidth();

        String rest = text;
        String prefix = indent;
        while (prefix.length() + rest.length() > width) {
            // 行尾还要留一个 &
            int budget = Math.max(8, width - prefix.length() - 1);
            int cut = findBreak(rest, budget);
            output.append(prefix).append(rest, 0, cut).append("&\n");
            rest = rest.substring(cut);
            prefix = continuationPrefix;
        }
        output.append(prefix).append(rest).append('\n');
    }

    /**
     * 输出注释行；超宽时拆成多条注释
     */
    public void comment(String text) {
        String prefix = indentString() + "! ";
        int budget = Math.max(8, config.getMaxLineWidth() - prefix.length());
        String rest = text;
        while (rest.length() > budget) {
            int cut = rest.lastIndexOf(' ', budget);
            if (cut <= 0) cut = budget;
            output.append(prefix).append(rest, 0, cut).append('\n');
            rest = rest.substring(cut).trim();
        }
        output.append(prefix).append(rest).append('\n');
    }

    /**
     * 追加空行（避免连续空行）
     */
    public void blankLine() {
        int len = output.length();
        if (len == 0 || (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n')) {
            return;
        }
        output.append('\n');
    }

    /**
     * 原样追加另一个缓冲区的内容（已含缩进与换行）
     */
    public void appendRaw(String text) {
        output.append(text);
    }

    public String getOutput() {
        return output.toString();
    }

    /**
     * 在 budget 之内选断点：字符常量之外逗号或空格之后最好，其次字符常量内部，最后硬断
     */
    static int findBreak(String text, int budget) {
        int lastOutside = -1;
        int lastInside = -1;
        boolean inString = false;
        int limit = Math.min(budget, text.length() - 1);
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                if (inString && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    // 成对的引号不能拆开
                    i++;
                    if (i < limit) lastInside = i + 1;
                    continue;
                }
                inString = !inString;
                continue;
            }
            if (inString) {
                lastInside = i + 1;
            } else if (c == ',' || c == ' ') {
                lastOutside = i + 1;
            }
        }
        if (lastOutside > budget / 2) return lastOutside;
        if (lastInside > 0) return Math.max(lastInside, lastOutside);
        if (lastOutside > 0) return lastOutside;
        return limit;
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
