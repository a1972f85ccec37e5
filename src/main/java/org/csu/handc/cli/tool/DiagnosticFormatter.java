package org.csu.handc.cli.tool;

import org.csu.handc.compiler.semantic.SemanticError;
import org.csu.handc.engine.CompileResult;

/**
 * @author hidyouth
 * @description: 将失败的编译结果格式化为给用户看的错误文本。
 */
public class DiagnosticFormatter {

    public static String format(CompileResult result) {
        return switch (result.status()) {
            case SEMANTIC_ERRORS -> formatSemanticErrors(result);
            case FATAL -> stageName(result.failedStage()) + " error: " + result.message() + "\n";
            case SUCCESS -> "";
        };
    }

    private static String formatSemanticErrors(CompileResult result) {
        StringBuilder sb = new StringBuilder("Semantic analysis failed:\n");
        for (SemanticError error : result.errors()) {
            sb.append("  Error: ").append(error.message()).append('\n');
        }
        return sb.toString();
    }

    private static String stageName(CompileResult.Stage stage) {
        return switch (stage) {
            case LEXER -> "Lexer";
            case PARSER -> "Parser";
            case SEMANTIC -> "Semantic";
        };
    }
}
