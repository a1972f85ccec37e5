package org.csu.handc.common.exception;

import org.csu.handc.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 语法分析阶段的致命错误，第一个错误即终止编译
 */
public class ParseException extends RuntimeException {

    /**
     * @param token 实际遇到的Token，输入已结束时为 null
     * @param expected 期望的语法成分
     */
    public ParseException(Token token, String expected) {
        super(token == null
                ? String.format("Syntax Error: Expected %s, but found end of input", expected)
                : String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                        token.line(),
                        token.column(),
                        expected,
                        token.lexeme(),
                        token.type()));
    }
}
