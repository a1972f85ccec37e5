package org.csu.handc.compiler.parser.ast;

/**
 * AST 节点: 语句 (let / 赋值 / loop / print)
 */
public interface StatementNode extends AstNode {
}
