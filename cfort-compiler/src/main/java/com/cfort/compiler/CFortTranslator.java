package com.cfort.compiler;

import com.cfort.compiler.analysis.SymbolBinder;
import com.cfort.compiler.analysis.TranslationUnit;
import com.cfort.compiler.ast.decl.Program;
import com.cfort.compiler.codegen.FortranGenerator;
import com.cfort.compiler.codegen.GeneratorConfig;
import com.cfort.compiler.lexer.Lexer;
import com.cfort.compiler.parser.Parser;
import com.cfort.compiler.pass.PassPipeline;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

/**
 * C 子集到 Fortran 的翻译器门面。
 * 管线：源码 → Lexer → Parser → AST → SymbolBinder → 控制流规范化 → 声明提升 → Fortran。
 *
 * <p>每次调用都创建新的各阶段对象，互不影响；第一个错误以 {@link TranslationException} 抛出。</p>
 */
public class CFortTranslator {

    private final GeneratorConfig config;

    public CFortTranslator() {
        this(new GeneratorConfig());
    }

    public CFortTranslator(GeneratorConfig config) {
        this.config = config;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    /**
     * 翻译源代码。
     *
     * @param source   C 源代码
     * @param fileName 文件名，用于诊断位置与头部注释
     * @return Fortran 源代码
     */
    public String translate(String source, String fileName) {
        TranslationUnit unit = analyze(source, fileName);
        return new FortranGenerator(config).generate(unit);
    }

    /**
     * 执行到声明提升为止，返回可交给生成器的翻译单元。
     */
    public TranslationUnit analyze(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName);
        Parser parser = new Parser(lexer, fileName);
        Program program = parser.parse();
        TranslationUnit unit = new SymbolBinder().bind(program);
        PassPipeline pipeline = PassPipeline.createDefault(
                Arrays.asList(config.getModuleName(), config.getProgramName()));
        return pipeline.execute(unit);
    }

    /**
     * 翻译文件（UTF-8）。
     */
    public String translateFile(File file) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return translate(source, file.getName());
    }
}
