package org.csu.handc.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * hand 语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    LET,        // "let"
    LOOP,       // "loop"
    PRINT,      // "print"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名

    // ---- 常量 (Constants) ----
    NUMBER,     // 整数常量, e.g., 123

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    EQUALS,     // =

    // ---- 分隔符 (Delimiters) ----
    SEMICOLON,  // ;
    LBRACE,     // {
    RBRACE      // }
}
