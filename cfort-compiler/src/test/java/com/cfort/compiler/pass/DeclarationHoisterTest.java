package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.LocalDecl;
import com.cfort.compiler.analysis.SymbolBinder;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.CType;
import com.cfort.compiler.ast.expr.ArrayLiteral;
import com.cfort.compiler.ast.expr.BinaryExpr;
import com.cfort.compiler.ast.expr.CallExpr;
import com.cfort.compiler.ast.expr.Identifier;
import com.cfort.compiler.ast.expr.Literal;
import com.cfort.compiler.ast.stmt.*;
import com.cfort.compiler.lexer.Lexer;
import com.cfort.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * DeclarationHoister 测试
 */
class DeclarationHoisterTest {

    private TranslationUnit bind(String source) {
        return new SymbolBinder().bind(new Parser(new Lexer(source, "<test>"), "<test>").parse());
    }

    private TranslationUnit hoist(String source) {
        return new DeclarationHoister(Arrays.asList("c_functions", "main")).run(bind(source));
    }

    private static List<String> names(FunctionUnit fn) {
        List<String> names = new ArrayList<String>();
        for (LocalDecl decl : fn.getDeclarations()) {
            names.add(decl.getName());
        }
        return names;
    }

    private static String targetName(Statement stmt) {
        return ((Identifier) ((AssignStmt) stmt).getTarget()).getName();
    }

    // ============ 收集声明 ============

    @Nested
    @DisplayName("收集声明")
    class CollectTests {

        @Test
        @DisplayName("参数在前，局部变量按首次声明顺序")
        void testDeclarationOrder() {
            FunctionUnit fn = hoist("int f(int a, unsigned long long b) {\n"
                    + "  int x = 1;\n"
                    + "  if (a) { int y; y = 2; x = y; }\n"
                    + "  return x;\n"
                    + "}\nint main() { return 0; }").getFunction("f");

            assertThat(names(fn)).containsExactly("a", "b", "x", "y");
            assertThat(fn.getDeclarations().get(0).isParameter()).isTrue();
            assertThat(fn.getDeclarations().get(1).getType()).isEqualTo(CType.UINT64);
            assertThat(fn.getDeclarations().get(2).getKind()).isEqualTo(LocalDecl.Kind.LOCAL);
            assertThat(fn.isHoisted()).isTrue();
        }

        @Test
        @DisplayName("带初始值的声明变为赋值，无初始值的声明消失")
        void testDeclarationsRewritten() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  int x = 5;\n"
                    + "  int y;\n"
                    + "  y = x;\n"
                    + "  return y;\n"
                    + "}").getMain();

            List<Statement> body = main.getBody().getStatements();
            assertThat(body).hasSize(3);
            assertThat(targetName(body.get(0))).isEqualTo("x");
            assertThat(((AssignStmt) body.get(0)).getValue()).isInstanceOf(Literal.class);
            assertThat(targetName(body.get(1))).isEqualTo("y");
        }

        @Test
        @DisplayName("数组初始化列表用 0 补齐到数组长度")
        void testArrayInitializerPadded() {
            FunctionUnit main = hoist("int main() { int a[4] = {7, 8}; return a[0]; }").getMain();
            AssignStmt init = (AssignStmt) main.getBody().getStatements().get(0);
            ArrayLiteral values = (ArrayLiteral) init.getValue();
            assertThat(values.getValues()).hasSize(4);
            assertThat(((Literal) values.getValues().get(3)).getIntValue()).isZero();
            assertThat(main.getDeclarations().get(0).getType().isArray()).isTrue();
        }

        @Test
        @DisplayName("for 初始化中的声明变为赋值")
        void testForInitDeclaration() {
            FunctionUnit main = hoist("int main() { for (int i = 0; i < 3; i++) { } return 0; }").getMain();
            ForStmt loop = (ForStmt) main.getBody().getStatements().get(0);
            assertThat(loop.getInit()).isInstanceOf(AssignStmt.class);
            assertThat(names(main)).containsExactly("i");
        }
    }

    // ============ 重命名 ============

    @Nested
    @DisplayName("重命名")
    class RenameTests {

        @Test
        @DisplayName("内层遮蔽的变量加后缀，引用随之改名")
        void testShadowRenamed() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  int x = 1;\n"
                    + "  if (x) { int x = 2; printf(\"%d\", x); }\n"
                    + "  printf(\"%d\", x);\n"
                    + "  return 0;\n"
                    + "}").getMain();

            assertThat(names(main)).containsExactly("x", "x_2");
            assertThat(main.getDeclarations().get(1).isRenamed()).isTrue();
            assertThat(main.getDeclarations().get(1).getSourceName()).isEqualTo("x");

            IfStmt ifStmt = (IfStmt) main.getBody().getStatements().get(1);
            List<Statement> inner = ifStmt.getThenBlock().getStatements();
            assertThat(targetName(inner.get(0))).isEqualTo("x_2");
            CallExpr innerPrint = (CallExpr) ((ExpressionStmt) inner.get(1)).getExpression();
            assertThat(((Identifier) innerPrint.getArgs().get(1)).getName()).isEqualTo("x_2");
            CallExpr outerPrint = (CallExpr) ((ExpressionStmt) main.getBody().getStatements().get(2)).getExpression();
            assertThat(((Identifier) outerPrint.getArgs().get(1)).getName()).isEqualTo("x");
        }

        @Test
        @DisplayName("初始值在新声明生效之前求值")
        void testInitializerSeesOuter() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  int x = 1;\n"
                    + "  { int x = x + 1; printf(\"%d\", x); }\n"
                    + "  return 0;\n"
                    + "}").getMain();
            Block inner = (Block) main.getBody().getStatements().get(1);
            AssignStmt init = (AssignStmt) inner.getStatements().get(0);
            assertThat(targetName(init)).isEqualTo("x_2");
            assertThat(((Identifier) ((BinaryExpr) init.getValue()).getLeft()).getName()).isEqualTo("x");
        }

        @Test
        @DisplayName("不相交块中同类型的同名声明也按出现顺序加后缀")
        void testDisjointSameType() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  { int t = 1; printf(\"%d\", t); }\n"
                    + "  { int t = 2; printf(\"%d\", t); }\n"
                    + "  return 0;\n"
                    + "}").getMain();
            assertThat(names(main)).containsExactly("t", "t_2");
        }

        @Test
        @DisplayName("后缀跳过程序中已出现的名字")
        void testSuffixSkipsUsedNames() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  int x = 1;\n"
                    + "  int x_2 = 2;\n"
                    + "  { int x = 3; x_2 = x; }\n"
                    + "  return 0;\n"
                    + "}").getMain();
            assertThat(names(main)).containsExactly("x", "x_2", "x_3");
        }

        @Test
        @DisplayName("与内建函数、函数名、模块名冲突的名字被改名（不区分大小写），结果变量名让给局部变量")
        void testReservedNames() {
            TranslationUnit unit = hoist("int twice(int v) { return v + v; }\n"
                    + "int main() {\n"
                    + "  int MOD = 1;\n"
                    + "  int Twice = 2;\n"
                    + "  int c_functions = 3;\n"
                    + "  int twice_result = 4;\n"
                    + "  return twice(MOD + Twice + c_functions + twice_result);\n"
                    + "}");
            assertThat(names(unit.getMain())).containsExactly("MOD_2", "Twice_2", "c_functions_2", "twice_result");
            assertThat(unit.getFunction("twice").getResultName()).isEqualTo("twice_result_2");
        }

        @Test
        @DisplayName("函数之间的重命名互不影响")
        void testPerFunctionCounters() {
            TranslationUnit unit = hoist("int f(int a) { { int a = 1; return a; } }\n"
                    + "int main() { int a = 1; { int a = 2; printf(\"%d\", a); } return 0; }");
            assertThat(names(unit.getFunction("f"))).containsExactly("a", "a_2");
            assertThat(names(unit.getMain())).containsExactly("a", "a_2");
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("不相交块中同名声明类型不同")
        void testIncompatibleTypes() {
            TranslationUnit unit = bind("int main() {\n"
                    + "  { int t = 1; printf(\"%d\", t); }\n"
                    + "  { unsigned long long t = 2; printf(\"%llu\", t); }\n"
                    + "  return 0;\n"
                    + "}");
            assertThatThrownBy(() -> new DeclarationHoister().run(unit))
                    .isInstanceOfSatisfying(HoistException.class, e -> {
                        assertThat(e.getHoistKind()).isEqualTo(HoistException.Kind.DUPLICATE_INCOMPATIBLE_TYPE);
                        assertThat(e.getLocation().getLine()).isEqualTo(3);
                    });
        }

        @Test
        @DisplayName("嵌套遮蔽允许类型不同")
        void testNestedDifferentTypes() {
            FunctionUnit main = hoist("int main() {\n"
                    + "  int t = 1;\n"
                    + "  { unsigned long long t = 2; printf(\"%llu\", t); }\n"
                    + "  return t;\n"
                    + "}").getMain();
            assertThat(main.getDeclarations().get(1).getType()).isEqualTo(CType.UINT64);
            assertThat(names(main)).containsExactly("t", "t_2");
        }

        @Test
        @DisplayName("块结束之后引用块内变量")
        void testReferenceOutOfScope() {
            TranslationUnit unit = bind("int main() {\n"
                    + "  { int t = 1; }\n"
                    + "  t = 2;\n"
                    + "  return 0;\n"
                    + "}");
            assertThatThrownBy(() -> new DeclarationHoister().run(unit))
                    .isInstanceOf(HoistException.class)
                    .hasMessageStartingWith("<test>:3:3: hoist error:")
                    .hasMessageContaining("'t'");
        }
    }

    // ============ 幂等 ============

    @Test
    @DisplayName("对已提升的单元再次运行返回同一实例")
    void testIdempotent() {
        DeclarationHoister hoister = new DeclarationHoister();
        TranslationUnit once = hoister.run(bind("int f(int a) { int b = a; { int b = 2; a = b; } return a + b; }\n"
                + "int main() { int i; for (i = 0; i < 2; i++) { int k = i; printf(\"%d\", k); } return f(1); }"));
        TranslationUnit twice = hoister.run(once);
        assertThat(twice).isSameAs(once);
    }

    @Test
    @DisplayName("默认管线先规范化再提升")
    void testDefaultPipeline() {
        PassPipeline pipeline = PassPipeline.createDefault(Arrays.asList("c_functions", "main"));
        assertThat(pipeline.getPasses()).extracting(UnitPass::getName)
                .containsExactly("ControlFlowNormalizer", "DeclarationHoister");

        TranslationUnit unit = pipeline.execute(bind("int f(int n) { if (n) { int r = n * 2; return r; } return 0; }\n"
                + "int main() { return f(2); }"));
        FunctionUnit f = unit.getFunction("f");
        assertThat(f.isNormalized()).isTrue();
        assertThat(f.isHoisted()).isTrue();
        assertThat(names(f)).containsExactly("n", "r");
        assertThat(pipeline.execute(unit)).isSameAs(unit);
    }
}
