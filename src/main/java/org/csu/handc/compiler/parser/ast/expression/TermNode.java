package org.csu.handc.compiler.parser.ast.expression;

import org.csu.handc.compiler.parser.ast.AstNode;

/**
 * AST 节点: 表达式中的原子操作数，变量引用或整数字面量。
 */
public interface TermNode extends AstNode {
}
