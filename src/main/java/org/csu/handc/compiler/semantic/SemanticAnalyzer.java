package org.csu.handc.compiler.semantic;

import org.csu.handc.common.exception.SemanticException;
import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.parser.ast.StatementList;
import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;
import org.csu.handc.compiler.parser.ast.expression.IdentifierNode;
import org.csu.handc.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LetStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LoopStatementNode;
import org.csu.handc.compiler.parser.ast.statement.PrintStatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语义分析器
 * 检查每一处变量使用（赋值目标和表达式中的变量）之前都已在可见的作用域中用 let 声明。
 * 与词法、语法分析不同，这里不在第一个错误处停下，而是收集全部错误后一起返回。
 * 每个实例只分析一棵树。
 */
public class SemanticAnalyzer {

    private final ScopeStack scopes = new ScopeStack();
    private final List<SemanticError> errors = new ArrayList<>();

    /**
     * @return 按遍历顺序排列的全部错误；为空表示分析通过
     */
    public List<SemanticError> analyze(AbstractSyntaxTree ast) {
        analyzeStatementList(ast.statements());
        return List.copyOf(errors);
    }

    /**
     * 与 {@link #analyze} 相同，但有错误时抛出携带全部错误的 {@link SemanticException}。
     */
    public void check(AbstractSyntaxTree ast) {
        List<SemanticError> result = analyze(ast);
        if (!result.isEmpty()) {
            throw new SemanticException(result);
        }
    }

    private void analyzeStatementList(StatementList statementList) {
        for (StatementNode statement : statementList.statements()) {
            analyzeStatement(statement);
        }
    }

    private void analyzeStatement(StatementNode node) {
        if (node instanceof LetStatementNode let) {
            analyzeLet(let);
        } else if (node instanceof AssignmentStatementNode assignment) {
            analyzeAssignment(assignment);
        } else if (node instanceof LoopStatementNode loop) {
            analyzeLoop(loop);
        } else if (node instanceof PrintStatementNode print) {
            analyzeExpression(print.value());
        } else {
            throw new IllegalArgumentException("Unsupported statement node: " + node);
        }
    }

    private void analyzeLet(LetStatementNode node) {
        // 先声明再检查初始化表达式，let x = x; 中右侧的 x 视为已声明
        scopes.declare(node.identifier());
        analyzeExpression(node.value());
    }

    private void analyzeAssignment(AssignmentStatementNode node) {
        checkDeclared(node.identifier());
        analyzeExpression(node.value());
    }

    private void analyzeLoop(LoopStatementNode node) {
        // 循环次数表达式属于外层作用域
        analyzeExpression(node.count());
        scopes.enterScope();
        try {
            analyzeStatementList(node.body().statements());
        } finally {
            scopes.exitScope();
        }
    }

    private void analyzeExpression(ExpressionNode expr) {
        for (ExpressionNode e = expr; e != null; e = e.rhs()) {
            if (e.lhs() instanceof IdentifierNode identifier) {
                checkDeclared(identifier.name());
            }
            // 数字字面量总是合法的
        }
    }

    private void checkDeclared(String name) {
        if (!scopes.isDeclared(name)) {
            errors.add(SemanticError.undeclaredVariable(name));
        }
    }
}
