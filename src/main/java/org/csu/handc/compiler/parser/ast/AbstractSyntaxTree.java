package org.csu.handc.compiler.parser.ast;

/**
 * AST 的根节点，包装顶层语句序列。
 */
public record AbstractSyntaxTree(StatementList statements) implements AstNode {
}
