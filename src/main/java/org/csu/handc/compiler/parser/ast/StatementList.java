package org.csu.handc.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 有序的语句序列，顺序即执行顺序。
 */
public record StatementList(List<StatementNode> statements) implements AstNode {

    public StatementList {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }

    public StatementNode get(int index) {
        return statements.get(index);
    }
}
