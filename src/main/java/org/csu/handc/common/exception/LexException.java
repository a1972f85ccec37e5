package org.csu.handc.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 词法分析阶段的致命错误（非法字符、整数溢出）
 */
@Getter
public class LexException extends RuntimeException {

    private final int line;
    private final int column;

    public LexException(String message, int line, int column) {
        super(String.format("Lexical Error at line %d, column %d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }
}
