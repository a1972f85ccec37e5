package org.csu.handc.compiler.parser.ast.expression;

/**
 * AST 节点: 变量引用，如 x
 */
public record IdentifierNode(String name) implements TermNode {
}
