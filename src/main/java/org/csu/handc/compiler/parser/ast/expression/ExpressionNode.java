package org.csu.handc.compiler.parser.ast.expression;

import org.csu.handc.compiler.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AST 节点: 加法链 a + b + c
 * 以右倾的单链表表示：lhs 为第一个操作数，rhs 为“剩下的链”，没有后续时为 null。
 * 链的深度等于操作数个数，因此遍历一律用循环而不是递归。
 */
public record ExpressionNode(TermNode lhs, ExpressionNode rhs) implements AstNode {

    public ExpressionNode {
        Objects.requireNonNull(lhs, "an expression needs at least one term");
    }

    public static ExpressionNode of(TermNode term) {
        return new ExpressionNode(term, null);
    }

    /**
     * 由从左到右的操作数序列构建链，从右向左连接。
     */
    public static ExpressionNode chain(List<TermNode> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("an expression needs at least one term");
        }
        ExpressionNode expr = null;
        for (int i = terms.size() - 1; i >= 0; i--) {
            expr = new ExpressionNode(terms.get(i), expr);
        }
        return expr;
    }

    public boolean hasRest() {
        return rhs != null;
    }

    /**
     * @return 从左到右的所有操作数
     */
    public List<TermNode> terms() {
        List<TermNode> terms = new ArrayList<>();
        for (ExpressionNode e = this; e != null; e = e.rhs()) {
            terms.add(e.lhs());
        }
        return terms;
    }

    // record 默认的 equals/hashCode/toString 会沿着链递归，超长链会栈溢出
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpressionNode)) return false;
        ExpressionNode a = this;
        ExpressionNode b = (ExpressionNode) o;
        while (a != null && b != null) {
            if (a == b) return true;
            if (!a.lhs().equals(b.lhs())) return false;
            a = a.rhs();
            b = b.rhs();
        }
        return a == null && b == null;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (ExpressionNode e = this; e != null; e = e.rhs()) {
            hash = 31 * hash + e.lhs().hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return "ExpressionNode" + terms();
    }
}
