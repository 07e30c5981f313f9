package com.cfort.compiler.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * FortranWriter 与 GeneratorConfig 测试
 */
class FortranWriterTest {

    private static GeneratorConfig config(int width) {
        GeneratorConfig config = new GeneratorConfig();
        config.setMaxLineWidth(width);
        return config;
    }

    /** 去掉续行符号，拼回原来的语句 */
    private static String join(String output) {
        StringBuilder sb = new StringBuilder();
        String[] lines = output.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) {
                line = line.trim().substring(1);
            } else {
                line = line.trim();
            }
            if (i < lines.length - 1) {
                assertThat(line).endsWith("&");
                line = line.substring(0, line.length() - 1);
            }
            sb.append(line);
        }
        return sb.toString();
    }

    // ============ 缩进与空行 ============

    @Nested
    @DisplayName("缩进与空行")
    class LayoutTests {

        @Test
        @DisplayName("按层级缩进，dedent 不会低于 0")
        void testIndent() {
            FortranWriter w = new FortranWriter(new GeneratorConfig());
            w.line("program main");
            w.indent();
            w.line("x = 1");
            w.dedent();
            w.dedent();
            w.line("end program main");
            assertThat(w.getOutput()).isEqualTo("program main\n  x = 1\nend program main\n");
            assertThat(w.getIndentLevel()).isZero();
        }

        @Test
        @DisplayName("可配置的缩进宽度与初始层级")
        void testIndentSize() {
            GeneratorConfig config = new GeneratorConfig();
            config.setIndentSize(4);
            FortranWriter w = new FortranWriter(config, 2);
            w.line("return");
            assertThat(w.getOutput()).isEqualTo("        return\n");
        }

        @Test
        @DisplayName("开头不输出空行，也不输出连续空行")
        void testBlankLines() {
            FortranWriter w = new FortranWriter(new GeneratorConfig());
            w.blankLine();
            w.line("a = 1");
            w.blankLine();
            w.blankLine();
            w.line("b = 2");
            assertThat(w.getOutput()).isEqualTo("a = 1\n\nb = 2\n");
        }
    }

    // ============ 续行 ============

    @Nested
    @DisplayName("续行")
    class ContinuationTests {

        @Test
        @DisplayName("不超宽的行原样输出")
        void testShortLine() {
            FortranWriter w = new FortranWriter(config(40));
            w.line("write(*, '(I0)') x");
            assertThat(w.getOutput()).isEqualTo("write(*, '(I0)') x\n");
        }

        @Test
        @DisplayName("超宽的行拆开后每行不超过上限，拼接后与原文一致")
        void testLongLine() {
            FortranWriter w = new FortranWriter(config(40));
            w.indent();
            String text = "write(*, '(A, I0, A, I0, A, I0)') 'first ', alpha, ' second ', beta, ' third ', gamma";
            w.line(text);

            String out = w.getOutput();
            String[] lines = out.split("\n");
            assertThat(lines.length).isGreaterThan(2);
            for (String line : lines) {
                assertThat(line.length()).isLessThanOrEqualTo(40);
            }
            for (int i = 1; i < lines.length; i++) {
                assertThat(lines[i]).startsWith("      &");
            }
            assertThat(join(out)).isEqualTo(text);
        }

        @Test
        @DisplayName("很长的字符常量在内部断开")
        void testLongStringLiteral() {
            FortranWriter w = new FortranWriter(config(40));
            StringBuilder text = new StringBuilder("write(*, '(A)') '");
            for (int i = 0; i < 60; i++) {
                text.append((char) ('a' + i % 26));
            }
            text.append("'");
            w.line(text.toString());

            for (String line : w.getOutput().split("\n")) {
                assertThat(line.length()).isLessThanOrEqualTo(40);
            }
            assertThat(join(w.getOutput())).isEqualTo(text.toString());
        }

        @Test
        @DisplayName("优先在常量之外的逗号或空格之后断开")
        void testBreakAfterComma() {
            assertThat(FortranWriter.findBreak("abc, def, ghi", 9)).isEqualTo(9);
        }

        @Test
        @DisplayName("常量之外的断点太靠前时在常量内部断开")
        void testBreakInsideString() {
            assertThat(FortranWriter.findBreak("'abcdefghijklmnop'", 10)).isEqualTo(10);
            assertThat(FortranWriter.findBreak("a, 'bcdefghijklmnop'", 12)).isEqualTo(12);
        }

        @Test
        @DisplayName("成对的单引号不会被拆开")
        void testEscapedQuoteKept() {
            assertThat(FortranWriter.findBreak("'abcdefgh''ij'", 10)).isEqualTo(9);
        }

        @Test
        @DisplayName("没有断点时硬断")
        void testHardBreak() {
            assertThat(FortranWriter.findBreak("abcdefghijklmnop", 10)).isEqualTo(10);
        }
    }

    @Test
    @DisplayName("超宽注释拆成多条注释")
    void testComment() {
        FortranWriter w = new FortranWriter(config(40));
        w.comment("Translated from a rather long file name that will not fit on one line");
        String[] lines = w.getOutput().split("\n");
        assertThat(lines.length).isGreaterThan(1);
        for (String line : lines) {
            assertThat(line).startsWith("! ");
            assertThat(line.length()).isLessThanOrEqualTo(40);
        }
    }

    // ============ 配置 ============

    @Nested
    @DisplayName("生成配置")
    class ConfigTests {

        @Test
        @DisplayName("默认值")
        void testDefaults() {
            GeneratorConfig config = new GeneratorConfig();
            assertThat(config.getIndentSize()).isEqualTo(2);
            assertThat(config.getMaxLineWidth()).isEqualTo(132);
            assertThat(config.getModuleName()).isEqualTo("c_functions");
            assertThat(config.getProgramName()).isEqualTo("main");
            assertThat(config.isEmitHeader()).isTrue();
            assertThat(config.getIndentString()).isEqualTo("  ");
        }

        @Test
        @DisplayName("超出范围的缩进与行宽被拒绝")
        void testInvalidValues() {
            GeneratorConfig config = new GeneratorConfig();
            assertThatThrownBy(() -> config.setIndentSize(9)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> config.setIndentSize(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> config.setMaxLineWidth(39)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> config.setMaxLineWidth(133))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("133");
        }
    }

    @Test
    @DisplayName("名字分配跳过已占用的名字（不区分大小写）")
    void testNameAllocator() {
        NameAllocator names = new NameAllocator(Arrays.asList("IO_STATUS", "tmp"));
        assertThat(names.allocate("io_status")).isEqualTo("io_status_2");
        assertThat(names.allocate("io_status")).isEqualTo("io_status_3");
        assertThat(names.allocate("tmp2")).isEqualTo("tmp2");
        assertThat(names.isTaken("TMP2")).isTrue();
    }
}
