package org.csu.handc.compiler.codegen;

import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.parser.ast.Block;
import org.csu.handc.compiler.parser.ast.StatementList;
import org.csu.handc.compiler.parser.ast.StatementNode;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;
import org.csu.handc.compiler.parser.ast.expression.IdentifierNode;
import org.csu.handc.compiler.parser.ast.expression.NumberNode;
import org.csu.handc.compiler.parser.ast.expression.TermNode;
import org.csu.handc.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LetStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LoopStatementNode;
import org.csu.handc.compiler.parser.ast.statement.PrintStatementNode;

/**
 * @author hidyouth
 * @description: 代码生成器
 * 把通过语义分析的AST翻译为C源代码。自身不做任何校验；同一棵树总是得到完全相同的输出。
 */
public class CodeGenerator {

    private static final String PREAMBLE = "#include <stdio.h>\nint main() {\n";
    private static final String EPILOGUE = "return 0;\n}\n";

    // 生成的循环计数器。hand 语言的标识符不允许 '_'，所以不会与用户变量冲突
    private static final String LOOP_COUNTER = "_";

    public String generate(AbstractSyntaxTree ast) {
        StringBuilder sb = new StringBuilder();
        sb.append(PREAMBLE);
        generateStatementList(ast.statements(), sb);
        sb.append(EPILOGUE);
        return sb.toString();
    }

    private void generateStatementList(StatementList statementList, StringBuilder sb) {
        for (StatementNode statement : statementList.statements()) {
            generateStatement(statement, sb);
        }
    }

    private void generateStatement(StatementNode node, StringBuilder sb) {
        if (node instanceof LetStatementNode let) {
            sb.append("int ").append(let.identifier()).append(" = ");
            generateExpression(let.value(), sb);
            sb.append(";\n");
        } else if (node instanceof AssignmentStatementNode assignment) {
            sb.append(assignment.identifier()).append(" = ");
            generateExpression(assignment.value(), sb);
            sb.append(";\n");
        } else if (node instanceof PrintStatementNode print) {
            sb.append("printf(\"%d\\n\", ");
            generateExpression(print.value(), sb);
            sb.append(");\n");
        } else if (node instanceof LoopStatementNode loop) {
            generateLoop(loop, sb);
        } else {
            throw new IllegalArgumentException("Unsupported statement node: " + node);
        }
    }

    /**
     * 循环次数表达式原样写进循环条件，每次迭代都会重新求值，而不是在循环前缓存到临时变量。
     * 如果表达式引用的变量在循环体中被修改，实际迭代次数会随之变化。
     */
    private void generateLoop(LoopStatementNode loop, StringBuilder sb) {
        sb.append("for (int ").append(LOOP_COUNTER).append(" = 0; ")
                .append(LOOP_COUNTER).append(" < ");
        generateExpression(loop.count(), sb);
        sb.append("; ").append(LOOP_COUNTER).append("++) ");
        generateBlock(loop.body(), sb);
    }

    private void generateBlock(Block block, StringBuilder sb) {
        sb.append("{\n");
        generateStatementList(block.statements(), sb);
        sb.append("}\n");
    }

    private void generateExpression(ExpressionNode expr, StringBuilder sb) {
        for (ExpressionNode e = expr; e != null; e = e.rhs()) {
            generateTerm(e.lhs(), sb);
            if (e.hasRest()) {
                sb.append(" + ");
            }
        }
    }

    private void generateTerm(TermNode term, StringBuilder sb) {
        if (term instanceof NumberNode number) {
            sb.append(number.value());
        } else if (term instanceof IdentifierNode identifier) {
            sb.append(identifier.name());
        } else {
            throw new IllegalArgumentException("Unsupported term node: " + term);
        }
    }
}
