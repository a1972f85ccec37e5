package org.csu.handc.compiler.parser;

import org.csu.handc.common.exception.ParseException;
import org.csu.handc.compiler.lexer.Token;
import org.csu.handc.compiler.lexer.TokenType;
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

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 * 只看当前一个Token，不回溯；遇到第一个语法错误立即抛出 {@link ParseException}。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public AbstractSyntaxTree parse() {
        StatementList statements = parseStatementList(false);
        return new AbstractSyntaxTree(statements);
    }

    /**
     * @param inBlock 为 true 时读到 '}' 结束（'}' 留给调用者消费）；否则读到输入结束
     */
    private StatementList parseStatementList(boolean inBlock) {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd() && !(inBlock && check(TokenType.RBRACE))) {
            statements.add(parseStatement());
        }
        return new StatementList(statements);
    }

    private StatementNode parseStatement() {
        if (match(TokenType.LET)) {
            return parseLetStatement();
        }
        if (check(TokenType.IDENTIFIER)) {
            return parseAssignmentStatement();
        }
        if (match(TokenType.LOOP)) {
            return parseLoopStatement();
        }
        if (match(TokenType.PRINT)) {
            return parsePrintStatement();
        }
        throw new ParseException(peek(), "a statement (let, loop, print or an assignment)");
    }

    private LetStatementNode parseLetStatement() {
        Token identifier = consume(TokenType.IDENTIFIER, "variable name after 'let'");
        consume(TokenType.EQUALS, "'=' after variable name");
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON, "';' at the end of the statement");
        return new LetStatementNode(identifier.lexeme(), value);
    }

    private AssignmentStatementNode parseAssignmentStatement() {
        Token identifier = consume(TokenType.IDENTIFIER, "variable name");
        consume(TokenType.EQUALS, "'=' after variable name");
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON, "';' at the end of the statement");
        return new AssignmentStatementNode(identifier.lexeme(), value);
    }

    private LoopStatementNode parseLoopStatement() {
        ExpressionNode count = parseExpression();
        Block body = parseBlock();
        consume(TokenType.SEMICOLON, "';' after loop body");
        return new LoopStatementNode(count, body);
    }

    private PrintStatementNode parsePrintStatement() {
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON, "';' at the end of the statement");
        return new PrintStatementNode(value);
    }

    private Block parseBlock() {
        consume(TokenType.LBRACE, "'{' to open loop body");
        StatementList statements = parseStatementList(true);
        consume(TokenType.RBRACE, "'}' to close loop body");
        return new Block(statements);
    }

    /**
     * Expr := Term ('+' Expr)?
     * 先从左到右收集操作数，再由 {@link ExpressionNode#chain} 构建右倾链，避免深递归。
     */
    private ExpressionNode parseExpression() {
        List<TermNode> terms = new ArrayList<>();
        terms.add(parseTerm());
        while (match(TokenType.PLUS)) {
            terms.add(parseTerm());
        }
        return ExpressionNode.chain(terms);
    }

    private TermNode parseTerm() {
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (match(TokenType.NUMBER)) {
            return new NumberNode(previous().intValue());
        }
        throw new ParseException(peek(), "an expression (a number or a variable name)");
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    // 输入已结束时返回 null
    private Token peek() {
        return isAtEnd() ? null : tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
