package org.csu.handc.compiler.parser.ast;

/**
 * 所有AST节点的标记接口。
 */
public interface AstNode {
}
