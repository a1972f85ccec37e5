package org.csu.handc.compiler.parser.ast.expression;

/**
 * AST 节点: 整数字面量，如 42
 */
public record NumberNode(int value) implements TermNode {
}
