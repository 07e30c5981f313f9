package com.cfort.compiler;

import com.cfort.compiler.codegen.GeneratorConfig;
import com.cfort.compiler.pass.HoistException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * 端到端翻译测试
 */
class CFortTranslatorTest {

    private GeneratorConfig config;
    private CFortTranslator translator;

    @BeforeEach
    void setUp() {
        config = new GeneratorConfig();
        config.setEmitHeader(false);
        translator = new CFortTranslator(config);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = CFortTranslatorTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture " + name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ============ 基本场景 ============

    @Nested
    @DisplayName("基本场景")
    class ScenarioTests {

        @Test
        @DisplayName("声明在前，单值输出不带多余内容")
        void testSimpleSum() {
            String source = "int main() {\n"
                    + "  int i;\n"
                    + "  int j;\n"
                    + "  i = 2;\n"
                    + "  j = 3;\n"
                    + "  printf(\"%d\\n\", i + j);\n"
                    + "}\n";
            assertThat(translator.translate(source, "sum.c")).isEqualTo(lines(
                    "program main",
                    "  implicit none",
                    "  integer :: i",
                    "  integer :: j",
                    "",
                    "  i = 2",
                    "  j = 3",
                    "  write(*, '(I0)') i + j",
                    "end program main"));
        }

        @Test
        @DisplayName("多个提前返回：每个出口都赋值结果变量并立即退出")
        void testEarlyReturns() {
            String source = "int classify(int n) {\n"
                    + "  if (n == 0) {\n"
                    + "    return 1;\n"
                    + "  }\n"
                    + "  if (n < 0) {\n"
                    + "    printf(\"negative\\n\");\n"
                    + "    return 0;\n"
                    + "  }\n"
                    + "  int result = 1;\n"
                    + "  for (int i = 1; i <= n; i++) {\n"
                    + "    result *= i;\n"
                    + "  }\n"
                    + "  return result;\n"
                    + "}\n"
                    + "int main() {\n"
                    + "  printf(\"%d\\n\", classify(4));\n"
                    + "  return 0;\n"
                    + "}\n";
            assertThat(translator.translate(source, "early.c")).isEqualTo(lines(
                    "module c_functions",
                    "  implicit none",
                    "contains",
                    "",
                    "  function classify(n) result(classify_result)",
                    "    implicit none",
                    "    integer, intent(in) :: n",
                    "    integer :: classify_result",
                    "    integer :: result",
                    "    integer :: i",
                    "    if (n == 0) then",
                    "      classify_result = 1",
                    "      return",
                    "    end if",
                    "    if (n < 0) then",
                    "      write(*, '(A)') 'negative'",
                    "      classify_result = 0",
                    "      return",
                    "    end if",
                    "    result = 1",
                    "    do i = 1, n",
                    "      result = result * i",
                    "    end do",
                    "    classify_result = result",
                    "  end function classify",
                    "",
                    "end module c_functions",
                    "",
                    "program main",
                    "  use c_functions",
                    "  implicit none",
                    "  integer :: tmp",
                    "",
                    "  tmp = classify(4)",
                    "  write(*, '(I0)') tmp",
                    "end program main"));
        }

        @Test
        @DisplayName("复合赋值链")
        void testCompoundChain() {
            String source = "int main() {\n"
                    + "  int a = 10, b = 5;\n"
                    + "  a += b;\n"
                    + "  a -= 3;\n"
                    + "  a *= 2;\n"
                    + "  a /= 4;\n"
                    + "  printf(\"%d\\n\", a);\n"
                    + "  return 0;\n"
                    + "}\n";
            assertThat(translator.translate(source, "chain.c")).isEqualTo(lines(
                    "program main",
                    "  implicit none",
                    "  integer :: a",
                    "  integer :: b",
                    "",
                    "  a = 10",
                    "  b = 5",
                    "  a = a + b",
                    "  a = a - 3",
                    "  a = a * 2",
                    "  a = a / 4",
                    "  write(*, '(I0)') a",
                    "end program main"));
        }

        @Test
        @DisplayName("计数循环与制表符分隔的输出")
        void testCountedLoop() {
            String source = "int main() {\n"
                    + "  for (int i = 1; i <= 10; i++)\n"
                    + "    printf(\"%d\\t%d\\t%d\\n\", i, i*i, i*i*i);\n"
                    + "  return 0;\n"
                    + "}\n";
            assertThat(translator.translate(source, "table.c")).isEqualTo(lines(
                    "program main",
                    "  implicit none",
                    "  integer :: i",
                    "",
                    "  do i = 1, 10",
                    "    write(*, '(I0, A, I0, A, I0)') i, achar(9), i * i, achar(9), i * i * i",
                    "  end do",
                    "end program main"));
        }

        @Test
        @DisplayName("严格上界与步长")
        void testLoopBounds() {
            String source = "int main() {\n"
                    + "  int n = 9;\n"
                    + "  int s = 0;\n"
                    + "  for (int i = 0; i < n; i += 2) s += i;\n"
                    + "  for (int k = n; k > 0; k--) s -= k;\n"
                    + "  printf(\"%d\\n\", s);\n"
                    + "  return 0;\n"
                    + "}\n";
            String out = translator.translate(source, "bounds.c");
            assertThat(out).contains("  do i = 0, n - 1, 2\n    s = s + i\n  end do\n",
                    "  do k = n, 1, -1\n    s = s - k\n  end do\n");
        }
    }

    // ============ 示例程序 ============

    @Nested
    @DisplayName("示例程序")
    class FixtureTests {

        @Test
        @DisplayName("xfact.c：带头部注释的完整翻译")
        void testXfact() throws IOException {
            config.setEmitHeader(true);
            assertThat(translator.translate(fixture("xfact.c"), "xfact.c")).isEqualTo(lines(
                    "! Translated from xfact.c by cfort",
                    "! #include <stdio.h>",
                    "! #include <limits.h>",
                    "",
                    "module c_functions",
                    "  implicit none",
                    "contains",
                    "",
                    "  function factorial(n) result(factorial_result)",
                    "    implicit none",
                    "    integer, intent(in) :: n",
                    "    integer :: factorial_result",
                    "    integer :: result",
                    "    integer :: i",
                    "    if (n == 0) then",
                    "      factorial_result = 1",
                    "      return",
                    "    end if",
                    "    if (n < 0) then",
                    "      write(*, '(A)') 'Error: Factorial not defined for negative numbers'",
                    "      factorial_result = 0",
                    "      return",
                    "    end if",
                    "    result = 1",
                    "    do i = 1, n",
                    "      if (result > huge(0) / i) then",
                    "        write(*, '(A)') 'Error: Factorial overflow'",
                    "        factorial_result = 0",
                    "        return",
                    "      end if",
                    "      result = result * i",
                    "    end do",
                    "    factorial_result = result",
                    "  end function factorial",
                    "",
                    "end module c_functions",
                    "",
                    "program main",
                    "  use c_functions",
                    "  implicit none",
                    "  integer :: tmp",
                    "",
                    "  tmp = factorial(3)",
                    "  write(*, '(A, I0)', advance='no') 'factorial(3) = ', tmp",
                    "end program main"));
        }

        @Test
        @DisplayName("xfactorial.c：不相交块中 result 的类型不同")
        void testXfactorialRejected() throws IOException {
            String source = fixture("xfactorial.c");
            HoistException e = catchThrowableOfType(() -> translator.translate(source, "xfactorial.c"),
                    HoistException.class);
            assertThat(e).isNotNull();
            assertThat(e.getHoistKind()).isEqualTo(HoistException.Kind.DUPLICATE_INCOMPATIBLE_TYPE);
            assertThat(e.getLocation().getLine()).isEqualTo(55);
            assertThat(e.getMessage()).startsWith("xfactorial.c:55:").contains("hoist error:", "'result'");
        }
    }

    // ============ 诊断 ============

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "int main() { return 0 @ 1; }|LEX",
            "int main() { return 0 }|PARSE",
            "int main() { return x; }|BIND",
            "int f(int a) { if (a) return 1; } int main() { return f(1); }|NORMALIZE",
            "int main() { { int t = 1; } { unsigned long long t = 2; } return 0; }|HOIST",
            "int main() { printf(\"%f\\n\", 1); return 0; }|GENERATE"
    })
    @DisplayName("每个阶段的错误带有阶段名与位置")
    void testStages(String source, TranslationException.Stage stage) {
        TranslationException e = catchThrowableOfType(() -> translator.translate(source, "bad.c"),
                TranslationException.class);
        assertThat(e).isNotNull();
        assertThat(e.getStage()).isEqualTo(stage);
        assertThat(e.getMessage()).startsWith("bad.c:1:").contains(stage.getDisplayName() + " error: " + e.getDetail());
        assertThat(e.getKind()).isNotEmpty();
    }

    @Test
    @DisplayName("同一个翻译器可以重复使用")
    void testTranslatorIsReusable() {
        String source = "int main() { int x = 1; printf(\"%d\\n\", x); return 0; }";
        String first = translator.translate(source, "a.c");
        assertThatThrownBy(() -> translator.translate("int main() { return y; }", "b.c"))
                .isInstanceOf(TranslationException.class);
        assertThat(translator.translate(source, "a.c")).isEqualTo(first);
    }

    @Test
    @DisplayName("按 UTF-8 读取文件，文件名进入头部注释")
    void testTranslateFile(@TempDir Path dir) throws IOException {
        config.setEmitHeader(true);
        Path file = dir.resolve("hello.c");
        Files.write(file, "int main() { printf(\"héllo\\n\"); return 0; }".getBytes(StandardCharsets.UTF_8));
        String out = translator.translateFile(new File(file.toString()));
        assertThat(out).startsWith("! Translated from hello.c by cfort\n")
                .contains("  write(*, '(A)') 'héllo'\n");
    }
}
