package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.SymbolBinder;
import com.cfort.compiler.lexer.Lexer;
import com.cfort.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

/**
 * 随机生成 if/循环/return 嵌套的函数，比较规范化前后的执行结果。
 */
class ControlFlowNormalizerPropertyTest {

    private static final List<String> PARAMS = Arrays.asList("a", "b");
    private static final int MAX_DEPTH = 3;

    static LongStream seeds() {
        return LongStream.range(0, 200);
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("seeds")
    @DisplayName("有返回值的函数：规范化前后返回值与赋值轨迹一致")
    void testValueFunction(long seed) {
        check(new Generator(new Random(seed), true).function());
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("seeds")
    @DisplayName("void 函数：规范化前后赋值轨迹一致")
    void testVoidFunction(long seed) {
        check(new Generator(new Random(seed ^ 0x5DEECE66DL), false).function());
    }

    private void check(String source) {
        FunctionUnit original = new SymbolBinder()
                .bind(new Parser(new Lexer(source, "<random>"), "<random>").parse())
                .getFunction("f");
        FunctionUnit normalized = new ControlFlowNormalizer().normalize(original);
        assertThat(ReturnAnalysis.verify(normalized)).as(source).isEmpty();

        for (long a = -2; a <= 4; a++) {
            for (long b = -1; b <= 3; b++) {
                Map<String, Long> args = new HashMap<String, Long>();
                args.put("a", a);
                args.put("b", b);

                AstInterpreter before = new AstInterpreter(args, PARAMS);
                Long expected = before.run(original.getBody(), null);
                AstInterpreter after = new AstInterpreter(args, PARAMS);
                Long actual = after.run(normalized.getBody(), normalized.getResultName());

                String context = source + "\nwith a=" + a + ", b=" + b;
                assertThat(actual).as(context).isEqualTo(expected);
                assertThat(after.getTrace()).as(context).isEqualTo(before.getTrace());
            }
        }
    }

    /**
     * 随机源码生成器；赋值只写参数，循环变量按嵌套深度区分，保证循环终止
     */
    private static final class Generator {
        final Random random;
        final boolean hasValue;
        final StringBuilder sb = new StringBuilder();

        Generator(Random random, boolean hasValue) {
            this.random = random;
            this.hasValue = hasValue;
        }

        String function() {
            sb.append(hasValue ? "int" : "void").append(" f(int a, int b) {\n");
            sb.append("  int i0, i1, i2;\n");
            block(0, "  ");
            if (hasValue) {
                sb.append("  return ").append(expr()).append(";\n");
            } else if (random.nextBoolean()) {
                sb.append("  return;\n");
            }
            sb.append("}\nint main() { return 0; }\n");
            return sb.toString();
        }

        private void block(int depth, String indent) {
            int count = 1 + random.nextInt(3);
            for (int i = 0; i < count; i++) {
                statement(depth, indent);
            }
        }

        private void statement(int depth, String indent) {
            int choice = depth >= MAX_DEPTH ? random.nextInt(2) : random.nextInt(5);
            switch (choice) {
                case 0:
                    sb.append(indent).append(PARAMS.get(random.nextInt(2))).append(" = ").append(expr()).append(";\n");
                    break;
                case 1:
                    sb.append(indent).append(hasValue ? "return " + expr() + ";" : "return;").append('\n');
                    break;
                case 2:
                case 3:
                    ifStatement(depth, indent);
                    break;
                default:
                    String var = "i" + depth;
                    sb.append(indent).append("for (").append(var).append(" = 0; ").append(var).append(" < ")
                            .append(1 + random.nextInt(3)).append("; ").append(var).append("++) {\n");
                    block(depth + 1, indent + "  ");
                    sb.append(indent).append("}\n");
                    break;
            }
        }

        private void ifStatement(int depth, String indent) {
            sb.append(indent).append("if (").append(condition()).append(") {\n");
            block(depth + 1, indent + "  ");
            sb.append(indent).append('}');
            int tail = random.nextInt(3);
            if (tail == 1) {
                sb.append(" else {\n");
                block(depth + 1, indent + "  ");
                sb.append(indent).append('}');
            } else if (tail == 2) {
                sb.append(" else ");
                ifStatement(depth + 1, indent);
                return;
            }
            sb.append('\n');
        }

        private String operand() {
            return random.nextBoolean() ? PARAMS.get(random.nextInt(2)) : String.valueOf(random.nextInt(5));
        }

        private String expr() {
            switch (random.nextInt(4)) {
                case 0: return operand();
                case 1: return operand() + " + " + operand();
                case 2: return operand() + " - " + operand();
                default: return operand() + " * 2";
            }
        }

        private String condition() {
            switch (random.nextInt(5)) {
                case 0: return operand() + " < " + operand();
                case 1: return operand() + " == " + operand();
                case 2: return operand() + " > " + operand() + " && " + operand() + " != 0";
                case 3: return "!(" + operand() + " >= " + operand() + ")";
                default: return operand() + " <= 1 || " + operand() + " > 2";
            }
        }
    }
}
