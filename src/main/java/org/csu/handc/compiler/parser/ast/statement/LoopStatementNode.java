package org.csu.handc.compiler.parser.ast.statement;

import org.csu.handc.compiler.parser.ast.Block;
import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;

/**
 * AST 节点: loop count { ... };
 */
public record LoopStatementNode(ExpressionNode count, Block body) implements StatementNode {
}
