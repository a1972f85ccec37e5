package org.csu.handc.engine;

import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.semantic.SemanticError;

import java.util.List;

/**
 * @author hidyouth
 * 封装一次编译的全部结果信息。三种结局互斥：
 * 成功（有生成代码）、语义错误（有完整的错误列表）、致命错误（词法/语法阶段，带阶段和消息）。
 */
public record CompileResult(
        Status status,
        String code,                  // 生成的C代码，仅成功时非 null
        AbstractSyntaxTree ast,       // 语法分析得到的树，致命错误时为 null
        List<SemanticError> errors,   // 语义错误列表
        Stage failedStage,            // 致命错误发生的阶段
        String message                // 致命错误的描述
) {

    public enum Status {
        SUCCESS,
        SEMANTIC_ERRORS,
        FATAL
    }

    public enum Stage {
        LEXER,
        PARSER,
        SEMANTIC
    }

    // 静态工厂方法，用于编译成功的返回
    public static CompileResult newSuccessResult(AbstractSyntaxTree ast, String code) {
        return new CompileResult(Status.SUCCESS, code, ast, List.of(), null, null);
    }

    // 静态工厂方法，用于语义分析失败的返回，不产生任何代码
    public static CompileResult newSemanticErrorResult(AbstractSyntaxTree ast, List<SemanticError> errors) {
        return new CompileResult(Status.SEMANTIC_ERRORS, null, ast, List.copyOf(errors), Stage.SEMANTIC,
                errors.size() + " semantic error(s).");
    }

    // 静态工厂方法，用于词法或语法阶段的致命错误
    public static CompileResult newFatalResult(Stage stage, String message) {
        return new CompileResult(Status.FATAL, null, null, List.of(), stage, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
