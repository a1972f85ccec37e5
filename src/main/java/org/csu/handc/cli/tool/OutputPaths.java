package org.csu.handc.cli.tool;

import org.csu.handc.engine.CompilerOptions;

import java.nio.file.Path;

/**
 * 根据输入文件推导输出的 .c 文件路径：foo.hand → foo.c，其余情况直接追加 .c
 */
public class OutputPaths {

    public static Path derive(Path input) {
        String fileName = input.getFileName().toString();
        String outputName;
        if (fileName.endsWith(CompilerOptions.SOURCE_EXTENSION)) {
            outputName = fileName.substring(0, fileName.length() - CompilerOptions.SOURCE_EXTENSION.length())
                    + CompilerOptions.TARGET_EXTENSION;
        } else {
            outputName = fileName + CompilerOptions.TARGET_EXTENSION;
        }
        return input.resolveSibling(outputName);
    }
}
