package org.csu.handc.engine;

import org.csu.handc.common.exception.LexException;
import org.csu.handc.common.exception.ParseException;
import org.csu.handc.compiler.codegen.CodeGenerator;
import org.csu.handc.compiler.lexer.Lexer;
import org.csu.handc.compiler.lexer.Token;
import org.csu.handc.compiler.parser.Parser;
import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.semantic.SemanticAnalyzer;
import org.csu.handc.compiler.semantic.SemanticError;

import java.util.List;

/**
 * @author hidyouth
 * @description: 编译流水线入口
 * 词法分析 → 语法分析 → 语义分析 → 代码生成。每个阶段只消费上一阶段的结果。
 * 词法/语法错误不会以异常形式抛出，而是转换为 {@link CompileResult.Status#FATAL} 结果。
 */
public class CompilerEngine {

    private final CompilerOptions options;
    private final CodeGenerator codeGenerator = new CodeGenerator();

    public CompilerEngine() {
        this(new CompilerOptions());
    }

    public CompilerEngine(CompilerOptions options) {
        this.options = options;
    }

    public CompileResult compile(String source) {
        // 1. 词法分析
        List<Token> tokens;
        try {
            tokens = new Lexer(source).tokenize();
        } catch (LexException e) {
            trace("lexing failed: " + e.getMessage());
            return CompileResult.newFatalResult(CompileResult.Stage.LEXER, e.getMessage());
        }
        trace("lexed " + tokens.size() + " tokens");

        // 2. 语法分析
        AbstractSyntaxTree ast;
        try {
            ast = new Parser(tokens).parse();
        } catch (ParseException e) {
            trace("parsing failed: " + e.getMessage());
            return CompileResult.newFatalResult(CompileResult.Stage.PARSER, e.getMessage());
        }
        trace("parsed " + ast.statements().size() + " top-level statements");

        // 3. 语义分析，收集全部错误
        List<SemanticError> errors = new SemanticAnalyzer().analyze(ast);
        if (!errors.isEmpty()) {
            trace("semantic analysis found " + errors.size() + " error(s)");
            return CompileResult.newSemanticErrorResult(ast, errors);
        }
        trace("semantic analysis passed");

        // 4. 代码生成
        String code = codeGenerator.generate(ast);
        trace("generated " + code.length() + " characters of C code");
        return CompileResult.newSuccessResult(ast, code);
    }

    private void trace(String message) {
        if (options.isVerbose()) {
            options.getTraceStream().println("[Compiler] " + message);
        }
    }
}
