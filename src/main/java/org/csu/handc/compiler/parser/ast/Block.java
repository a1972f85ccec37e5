package org.csu.handc.compiler.parser.ast;

/**
 * AST 节点: 循环体 { ... }，只属于包含它的 loop 语句，对应一个嵌套的作用域。
 */
public record Block(StatementList statements) implements AstNode {
}
