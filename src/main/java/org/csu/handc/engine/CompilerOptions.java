package org.csu.handc.engine;

import lombok.Getter;
import lombok.Setter;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * 编译选项，由命令行参数映射而来。
 */
@Getter
@Setter
public class CompilerOptions {

    public static final String SOURCE_EXTENSION = ".hand";
    public static final String TARGET_EXTENSION = ".c";

    private Path inputFile;
    private boolean printAst = false;
    private boolean toStdout = false;
    private boolean verbose = false;

    // verbose 模式下各阶段信息的输出位置。标准输出可能用于生成的代码，所以默认用 stderr
    private PrintStream traceStream = System.err;
}
