package org.csu.handc.compiler.parser.ast.statement;

import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;

/**
 * AST 节点: print expr;
 */
public record PrintStatementNode(ExpressionNode value) implements StatementNode {
}
