package com.cfort.cli;

import com.cfort.compiler.CFortTranslator;
import com.cfort.compiler.TranslationException;
import com.cfort.compiler.codegen.GeneratorConfig;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 翻译执行器：读取 C 源文件，翻译成功后才写出 Fortran 文件
 */
public class TranslateRunner {
    private static final Logger LOG = Logger.getLogger(TranslateRunner.class.getName());

    private final GeneratorConfig config;
    private final DiagnosticsPrinter diagnostics;
    private final PrintWriter out;

    public TranslateRunner(GeneratorConfig config, DiagnosticsPrinter diagnostics, PrintWriter out) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.out = out;
    }

    /**
     * @return 进程退出码：0 成功，1 失败
     */
    public int run(File input, File output) {
        String source;
        try {
            source = read(input);
        } catch (NoSuchFileException e) {
            diagnostics.reportIo(input.getPath(), "文件不存在");
            return 1;
        } catch (IOException e) {
            diagnostics.reportIo(input.getPath(), "读取失败: " + e.getMessage());
            return 1;
        }

        String fortran;
        try {
            fortran = new CFortTranslator(config).translate(source, input.getName());
        } catch (TranslationException e) {
            LOG.log(Level.FINE, "Translation of " + input + " failed", e);
            diagnostics.report(e);
            return 1;
        }

        try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
            writer.write(fortran);
        } catch (IOException e) {
            diagnostics.reportIo(output.getPath(), "写入失败: " + e.getMessage());
            return 1;
        }
        out.println("已生成: " + output.getPath());
        out.flush();
        return 0;
    }

    private static String read(File input) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader reader = Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int n;
            while ((n = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, n);
            }
        }
        return sb.toString();
    }
}
