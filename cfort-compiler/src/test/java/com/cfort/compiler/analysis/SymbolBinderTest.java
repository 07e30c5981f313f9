package com.cfort.compiler.analysis;

import com.cfort.compiler.ast.CType;
import com.cfort.compiler.lexer.Lexer;
import com.cfort.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SymbolBinder 单元测试
 */
class SymbolBinderTest {

    private TranslationUnit bind(String source) {
        Parser parser = new Parser(new Lexer(source, "<test>"), "<test>");
        return new SymbolBinder().bind(parser.parse());
    }

    private BindException bindError(String source) {
        return assertThrows(BindException.class, () -> bind(source));
    }

    // ============ 正常绑定 ============

    @Nested
    @DisplayName("绑定结果")
    class BindingTests {

        @Test
        @DisplayName("main 单独存放，其余函数按定义顺序")
        void testUnitLayout() {
            TranslationUnit unit = bind("#define N 3\n"
                    + "int square(int x) { return x * x; }\n"
                    + "void show(int x) { printf(\"%d\\n\", x); }\n"
                    + "int main() { show(square(N)); return 0; }");
            assertEquals("main", unit.getMain().getName());
            assertEquals(2, unit.getFunctions().size());
            assertEquals("square", unit.getFunctions().get(0).getName());
            assertEquals(1, unit.getConstants().size());
            assertSame(unit.getMain(), unit.getFunction("main"));
            assertNull(unit.getFunction("missing"));
        }

        @Test
        @DisplayName("有返回值的函数得到结果变量名，void 函数与 main 没有")
        void testResultNames() {
            TranslationUnit unit = bind("int f(int a) { return a; }\n"
                    + "void g() { }\n"
                    + "int main() { g(); return f(1); }");
            assertEquals("f_result", unit.getFunction("f").getResultName());
            assertTrue(unit.getFunction("g").isSubroutine());
            assertFalse(unit.getFunction("g").hasResult());
            assertFalse(unit.getMain().hasResult());
        }

        @Test
        @DisplayName("结果变量名避开程序中已有的名字（不区分大小写）")
        void testResultNameCollision() {
            TranslationUnit unit = bind("int f(int F_RESULT) { int f_result_2 = 1; return F_RESULT + f_result_2; }\n"
                    + "int main() { return f(1); }");
            assertEquals("f_result_3", unit.getFunction("f").getResultName());
        }

        @Test
        @DisplayName("内层块可以遮蔽外层名字，扁平作用域保留全部声明")
        void testShadowing() {
            TranslationUnit unit = bind("int main() {\n"
                    + "  int x = 1;\n"
                    + "  if (x) { int x = 2; printf(\"%d\", x); }\n"
                    + "  { unsigned long long x = 3; }\n"
                    + "  return 0;\n"
                    + "}");
            FunctionScope scope = unit.getMain().getScope();
            List<Symbol> all = scope.lookupAll("x");
            assertEquals(3, all.size());
            assertSame(all.get(0), scope.lookup("x"));
            assertEquals(CType.UINT64, all.get(2).getType());
            assertNotEquals(all.get(0).getBlockId(), all.get(1).getBlockId());
        }

        @Test
        @DisplayName("参数与函数体顶层共享同一个块")
        void testParameterBlock() {
            BindException e = bindError("int f(int a) { int a = 1; return a; }\nint main() { return 0; }");
            assertEquals(BindException.Kind.DUPLICATE_DECLARATION, e.getBindKind());
        }

        @Test
        @DisplayName("for 初始化中的声明只在循环内可见")
        void testForScope() {
            TranslationUnit unit = bind("int main() {\n"
                    + "  for (int i = 0; i < 3; i++) { printf(\"%d\", i); }\n"
                    + "  for (int i = 5; i > 0; i--) { }\n"
                    + "  return 0;\n"
                    + "}");
            List<Symbol> all = unit.getMain().getScope().lookupAll("i");
            assertEquals(2, all.size());
            assertEquals(SymbolKind.LOCAL, all.get(0).getKind());
        }

        @Test
        @DisplayName("数组符号记录长度")
        void testArraySymbol() {
            TranslationUnit unit = bind("int main() { int a[4] = {1}; a[0] = a[1] + 2; return 0; }");
            Symbol a = unit.getMain().getScope().lookup("a");
            assertTrue(a.isArray());
            assertEquals(4, a.getArraySize());
        }

        @Test
        @DisplayName("原型之后的定义与调用")
        void testPrototype() {
            TranslationUnit unit = bind("int twice(int);\n"
                    + "int main() { return twice(2); }\n"
                    + "int twice(int v) { return v + v; }");
            assertEquals(1, unit.getFunctions().size());
            assertEquals("twice", unit.getFunctions().get(0).getName());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("绑定错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少 main")
        void testMissingMain() {
            assertEquals(BindException.Kind.UNRESOLVED_IDENTIFIER,
                    bindError("int f() { return 1; }").getBindKind());
        }

        @Test
        @DisplayName("main 必须返回 int 且没有参数")
        void testMainSignature() {
            assertEquals(BindException.Kind.TYPE_MISMATCH, bindError("void main() { }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH, bindError("int main(int n) { return n; }").getBindKind());
        }

        @Test
        @DisplayName("同一块中重复声明")
        void testDuplicateLocal() {
            BindException e = bindError("int main() { int x; int x; return 0; }");
            assertEquals(BindException.Kind.DUPLICATE_DECLARATION, e.getBindKind());
            assertEquals("DUPLICATE_DECLARATION", e.getKind());
            assertEquals(1, e.getLocation().getLine());
        }

        @Test
        @DisplayName("只有大小写不同的全局名字冲突")
        void testCaseInsensitiveGlobals() {
            BindException e = bindError("int Fact(int n) { return n; }\nint fact(int n) { return n; }\nint main() { return 0; }");
            assertEquals(BindException.Kind.DUPLICATE_DECLARATION, e.getBindKind());
            assertTrue(e.getDetail().contains("case-insensitive"));
        }

        @Test
        @DisplayName("局部名字不能与 #define 常量同名")
        void testLocalShadowsConstant() {
            assertEquals(BindException.Kind.DUPLICATE_DECLARATION,
                    bindError("#define N 2\nint f(int N) { return N; }\nint main() { return 0; }").getBindKind());
        }

        @Test
        @DisplayName("原型与定义不一致")
        void testPrototypeMismatch() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int f(int);\nunsigned long long f(int a) { return a; }\nint main() { return 0; }").getBindKind());
        }

        @Test
        @DisplayName("调用只有原型的函数")
        void testPrototypeOnly() {
            BindException e = bindError("int f(int);\nint main() { return f(1); }");
            assertEquals(BindException.Kind.UNRESOLVED_IDENTIFIER, e.getBindKind());
            assertTrue(e.getDetail().contains("never defined"));
        }

        @Test
        @DisplayName("未声明的标识符与函数")
        void testUnresolved() {
            assertEquals(BindException.Kind.UNRESOLVED_IDENTIFIER,
                    bindError("int main() { return y; }").getBindKind());
            assertEquals(BindException.Kind.UNRESOLVED_IDENTIFIER,
                    bindError("int main() { g(); return 0; }").getBindKind());
        }

        @Test
        @DisplayName("实参个数不匹配")
        void testArity() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int f(int a, int b) { return a; }\nint main() { return f(1); }").getBindKind());
        }

        @Test
        @DisplayName("void 函数的结果不能当作值")
        void testVoidAsValue() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("void g() { }\nint main() { int x = g(); return x; }").getBindKind());
        }

        @Test
        @DisplayName("void 函数不能返回值，非 void 函数必须返回值")
        void testReturnValue() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("void g() { return 1; }\nint main() { return 0; }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int f() { return; }\nint main() { return 0; }").getBindKind());
        }

        @Test
        @DisplayName("数组不能当作标量，标量不能下标访问")
        void testArrayScalarMismatch() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int a[2]; int x = a; return x; }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int x = 1; return x[0]; }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int a[2]; int b[2]; a = b; return 0; }").getBindKind());
        }

        @Test
        @DisplayName("不能给常量和函数赋值")
        void testAssignToNonVariable() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("#define N 1\nint main() { N = 2; return 0; }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int f() { return 1; }\nint main() { f = 2; return 0; }").getBindKind());
        }

        @Test
        @DisplayName("& 只能用于 scanf 实参，scanf 实参必须取址")
        void testAddressOf() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int x; int y = &x; return 0; }").getBindKind());
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int x; scanf(\"%d\", x); return 0; }").getBindKind());
        }

        @Test
        @DisplayName("字符串字面量只能作为 printf 实参")
        void testStringOutsidePrintf() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int x = \"a\"; return 0; }").getBindKind());
        }

        @Test
        @DisplayName("格式参数必须是字符串字面量")
        void testFormatNotLiteral() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int main() { int x = 1; printf(x); return 0; }").getBindKind());
        }

        @Test
        @DisplayName("main 不能被调用")
        void testCallMain() {
            assertEquals(BindException.Kind.TYPE_MISMATCH,
                    bindError("int f() { return main(); }\nint main() { return 0; }").getBindKind());
        }
    }
}
