package org.csu.handc.cli.tool;

import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.parser.ast.StatementList;
import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;
import org.csu.handc.compiler.parser.ast.expression.IdentifierNode;
import org.csu.handc.compiler.parser.ast.expression.NumberNode;
import org.csu.handc.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LetStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LoopStatementNode;
import org.csu.handc.compiler.parser.ast.statement.PrintStatementNode;

import java.util.stream.Collectors;

/**
 * @author hidyouth
 * 把AST格式化为缩进的大纲文本，用于 --ast 选项。
 * <pre>
 * Program
 *   Let x = 1 + 2
 *   Loop x
 *     Print x
 * </pre>
 */
public class AstPrinter {

    private static final String INDENT = "  ";

    public static String format(AbstractSyntaxTree ast) {
        StringBuilder sb = new StringBuilder("Program\n");
        appendStatements(ast.statements(), 1, sb);
        return sb.toString();
    }

    private static void appendStatements(StatementList statements, int depth, StringBuilder sb) {
        for (StatementNode statement : statements.statements()) {
            sb.append(INDENT.repeat(depth));
            if (statement instanceof LetStatementNode let) {
                sb.append("Let ").append(let.identifier()).append(" = ").append(format(let.value())).append('\n');
            } else if (statement instanceof AssignmentStatementNode assignment) {
                sb.append("Assign ").append(assignment.identifier()).append(" = ")
                        .append(format(assignment.value())).append('\n');
            } else if (statement instanceof PrintStatementNode print) {
                sb.append("Print ").append(format(print.value())).append('\n');
            } else if (statement instanceof LoopStatementNode loop) {
                sb.append("Loop ").append(format(loop.count())).append('\n');
                appendStatements(loop.body().statements(), depth + 1, sb);
            }
        }
    }

    public static String format(ExpressionNode expr) {
        return expr.terms().stream()
                .map(term -> term instanceof NumberNode number
                        ? String.valueOf(number.value())
                        : ((IdentifierNode) term).name())
                .collect(Collectors.joining(" + "));
    }
}
