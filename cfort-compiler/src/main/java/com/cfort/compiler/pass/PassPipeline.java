package com.cfort.compiler.pass;

import com.cfort.compiler.analysis.FunctionUnit;
import com.cfort.compiler.analysis.TranslationUnit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 绑定之后的 pass 管线：控制流规范化 → 声明提升。
 */
public class PassPipeline {
    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<UnitPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线。
     *
     * @param reservedNames 生成代码时另外占用的名字（模块名、主程序名），提升时视为冲突
     */
    public static PassPipeline createDefault(Collection<String> reservedNames) {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new ControlFlowNormalizer());
        pipeline.addPass(new DeclarationHoister(reservedNames));
        return pipeline;
    }

    public static PassPipeline createDefault() {
        return createDefault(Collections.<String>emptyList());
    }

    public void addPass(UnitPass pass) {
        passes.add(pass);
    }

    public List<UnitPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 依次执行所有 pass，之后检查每个规范化过的函数仍满足返回不变式。
     */
    public TranslationUnit execute(TranslationUnit unit) {
        for (UnitPass pass : passes) {
            long start = System.nanoTime();
            unit = pass.run(unit);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("Pass %s finished in %.2f ms",
                        pass.getName(), (System.nanoTime() - start) / 1_000_000.0));
            }
        }
        for (FunctionUnit fn : unit.getAllFunctions()) {
            if (!fn.isNormalized()) continue;
            List<String> violations = ReturnAnalysis.verify(fn);
            if (!violations.isEmpty()) {
                throw new IllegalStateException("Return invariant violated in '" + fn.getName() + "': "
                        + violations);
            }
        }
        return unit;
    }
}
