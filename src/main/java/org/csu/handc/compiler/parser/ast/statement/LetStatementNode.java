package org.csu.handc.compiler.parser.ast.statement;

import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;

/**
 * AST 节点: let x = expr;
 */
public record LetStatementNode(String identifier, ExpressionNode value) implements StatementNode {
}
