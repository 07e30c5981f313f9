package com.cfort.compiler.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 64 位无符号运算的模块辅助函数。
 *
 * <p>{@code integer(kind=8)} 是有符号的，2^63 及以上的 unsigned long long 值以负数存放。
 * 比较用 bgt/blt 即可，输出、除法与取模需要按无符号解释，这里生成只用移位和不溢出的有符号运算实现的纯函数。</p>
 */
final class UnsignedHelpers {

    /** 无符号十进制文本 */
    static final String TO_STRING = "u64_str";
    /** 无符号除法 */
    static final String DIVIDE = "u64_div";
    /** 无符号取模 */
    static final String MODULO = "u64_mod";

    /** 输出顺序 */
    static final List<String> ALL = Collections.unmodifiableList(Arrays.asList(TO_STRING, DIVIDE, MODULO));

    private UnsignedHelpers() {
    }

    /**
     * 按固定顺序输出用到的辅助函数，每个前面空一行
     */
    static void emit(Set<String> used, FortranWriter out) {
        for (String name : ALL) {
            if (!used.contains(name)) {
                continue;
            }
            out.blankLine();
            if (TO_STRING.equals(name)) {
                emitToString(out);
            } else if (DIVIDE.equals(name)) {
                emitDivide(out);
            } else {
                emitModulo(out);
            }
        }
    }

    private static void emitToString(FortranWriter out) {
        out.line("pure function " + TO_STRING + "(x) result(s)");
        out.indent();
        out.line("implicit none");
        out.line("integer(kind=8), intent(in) :: x");
        out.line("character(len=:), allocatable :: s");
        out.line("character(len=20) :: buf");
        out.line("integer(kind=8) :: v");
        out.line("integer :: i");
        out.line("i = 20");
        out.line("if (x >= 0) then");
        out.indent();
        out.line("v = x");
        out.dedent();
        out.line("else");
        out.indent();
        // x = 2h + b，x / 10 = h / 5，x mod 10 = 2 * mod(h, 5) + b
        out.line("v = ishft(x, -1) / 5");
        out.line("buf(i:i) = achar(48 + int(2 * mod(ishft(x, -1), 5_8) + iand(x, 1_8)))");
        out.line("i = i - 1");
        out.dedent();
        out.line("end if");
        out.line("do");
        out.indent();
        out.line("buf(i:i) = achar(48 + int(mod(v, 10_8)))");
        out.line("v = v / 10");
        out.line("if (v == 0) exit");
        out.line("i = i - 1");
        out.dedent();
        out.line("end do");
        out.line("s = buf(i:20)");
        out.dedent();
        out.line("end function " + TO_STRING);
    }

    private static void emitDivide(FortranWriter out) {
        out.line("pure function " + DIVIDE + "(a, b) result(q)");
        out.indent();
        out.line("implicit none");
        out.line("integer(kind=8), intent(in) :: a");
        out.line("integer(kind=8), intent(in) :: b");
        out.line("integer(kind=8) :: q");
        out.line("integer(kind=8) :: h");
        out.line("integer(kind=8) :: r");
        out.line("if (b < 0) then");
        out.indent();
        // 除数不小于 2^63，商只能是 0 或 1
        out.line("q = merge(1_8, 0_8, bge(a, b))");
        out.dedent();
        out.line("else if (a >= 0) then");
        out.indent();
        out.line("q = a / b");
        out.dedent();
        out.line("else");
        out.indent();
        out.line("h = ishft(a, -1)");
        out.line("q = ishft(h / b, 1)");
        out.line("r = mod(h, b)");
        out.line("if (r >= b - r - iand(a, 1_8)) then");
        out.indent();
        out.line("q = ior(q, 1_8)");
        out.dedent();
        out.line("end if");
        out.dedent();
        out.line("end if");
        out.dedent();
        out.line("end function " + DIVIDE);
    }

    private static void emitModulo(FortranWriter out) {
        out.line("pure function " + MODULO + "(a, b) result(r)");
        out.indent();
        out.line("implicit none");
        out.line("integer(kind=8), intent(in) :: a");
        out.line("integer(kind=8), intent(in) :: b");
        out.line("integer(kind=8) :: r");
        out.line("integer(kind=8) :: h");
        out.line("if (b < 0) then");
        out.indent();
        out.line("if (bge(a, b)) then");
        out.indent();
        out.line("r = a - b");
        out.dedent();
        out.line("else");
        out.indent();
        out.line("r = a");
        out.dedent();
        out.line("end if");
        out.dedent();
        out.line("else if (a >= 0) then");
        out.indent();
        out.line("r = mod(a, b)");
        out.dedent();
        out.line("else");
        out.indent();
        out.line("h = ishft(a, -1)");
        out.line("r = mod(h, b)");
        // 2r + b 是否不小于 b，改写成不会溢出的形式
        out.line("if (r >= b - r - iand(a, 1_8)) then");
        out.indent();
        out.line("r = r - (b - r - iand(a, 1_8))");
        out.dedent();
        out.line("else");
        out.indent();
        out.line("r = 2 * r + iand(a, 1_8)");
        out.dedent();
        out.line("end if");
        out.dedent();
        out.line("end if");
        out.dedent();
        out.line("end function " + MODULO);
    }
}
