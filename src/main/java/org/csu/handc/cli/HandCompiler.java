package org.csu.handc.cli;

import org.csu.handc.cli.tool.AstPrinter;
import org.csu.handc.cli.tool.DiagnosticFormatter;
import org.csu.handc.cli.tool.OutputPaths;
import org.csu.handc.engine.CompileResult;
import org.csu.handc.engine.CompilerEngine;
import org.csu.handc.engine.CompilerOptions;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * @author hidyouth
 * 命令行入口: handc [--ast] [--stdout] [--verbose] &lt;file&gt;
 * 读取源文件，交给 {@link CompilerEngine}，再把生成的代码写到标准输出或推导出的 .c 文件。
 */
public class HandCompiler {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println("Usage: handc [--ast] [--stdout] [--verbose] <file>");
            return EXIT_OK;
        }
        CompilerOptions options = parseOptions(args);
        options.setTraceStream(err);

        String source;
        try {
            source = Files.readString(options.getInputFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("ERROR: Cannot read " + options.getInputFile() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        CompileResult result = new CompilerEngine(options).compile(source);
        if (options.isPrintAst() && result.ast() != null) {
            out.print(AstPrinter.format(result.ast()));
        }
        if (!result.isSuccess()) {
            err.print(DiagnosticFormatter.format(result));
            return EXIT_COMPILE_ERROR;
        }

        if (options.isToStdout()) {
            out.println(result.code());
            return EXIT_OK;
        }
        Path outputPath = OutputPaths.derive(options.getInputFile());
        try {
            Files.writeString(outputPath, result.code(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("ERROR: Cannot write " + outputPath + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        err.println("Generated C code written to: " + outputPath);
        return EXIT_OK;
    }

    // 最后一个参数是输入文件，其余位置只识别开关
    static CompilerOptions parseOptions(String[] args) {
        List<String> flags = Arrays.asList(args).subList(0, args.length - 1);
        CompilerOptions options = new CompilerOptions();
        options.setInputFile(Paths.get(args[args.length - 1]));
        options.setPrintAst(flags.contains("--ast"));
        options.setToStdout(flags.contains("--stdout"));
        options.setVerbose(flags.contains("--verbose"));
        return options;
    }
}
