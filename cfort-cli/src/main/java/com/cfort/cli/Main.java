package com.cfort.cli;

import com.cfort.compiler.codegen.GeneratorConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * cfort CLI 入口点（picocli）
 */
@Command(name = "translate", version = "cfort v0.1.0",
         mixinStandardHelpOptions = true,
         description = "把 C 子集源文件翻译为 Fortran 源文件")
public class Main implements Callable<Integer> {

    // 持有引用，避免 logger 被回收后级别失效
    private static final Logger ROOT_LOGGER = Logger.getLogger("com.cfort");

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "输入的 C 源文件")
    File input;

    @Parameters(index = "1", description = "输出的 Fortran 源文件")
    File output;

    @Option(names = "--module-name", defaultValue = "c_functions", description = "模块名（默认 c_functions）")
    String moduleName;

    @Option(names = "--indent", defaultValue = "2", description = "缩进空格数（默认 2）")
    int indent;

    @Option(names = "--max-line-width", defaultValue = "132", description = "最大行宽，超出时续行（默认 132）")
    int maxLineWidth;

    @Option(names = "--no-header", description = "不输出头部注释")
    boolean noHeader;

    @Option(names = "--diagnostics", defaultValue = "text", description = "诊断输出格式（text, json）")
    DiagnosticsFormat diagnostics;

    @Option(names = {"-v", "--verbose"}, description = "输出各阶段的调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        DiagnosticsPrinter printer = new DiagnosticsPrinter(diagnostics, spec.commandLine().getErr());
        GeneratorConfig config = new GeneratorConfig();
        try {
            config.setIndentSize(indent);
            config.setMaxLineWidth(maxLineWidth);
        } catch (IllegalArgumentException e) {
            printer.reportUsage(e.getMessage());
            return 1;
        }
        config.setModuleName(moduleName);
        config.setEmitHeader(!noHeader);
        return new TranslateRunner(config, printer, spec.commandLine().getOut()).run(input, output);
    }

    static void enableVerboseLogging() {
        ROOT_LOGGER.setLevel(Level.FINE);
        for (Handler handler : ROOT_LOGGER.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
    }

    /**
     * 创建已配置好的命令行（枚举选项不区分大小写）
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
