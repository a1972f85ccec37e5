package org.csu.handc.compiler.parser;

import org.csu.handc.common.exception.ParseException;
import org.csu.handc.compiler.lexer.Lexer;
import org.csu.handc.compiler.lexer.Token;
import org.csu.handc.compiler.lexer.TokenType;
import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.csu.handc.compiler.parser.ast.StatementList;
import org.csu.handc.compiler.parser.ast.expression.ExpressionNode;
import org.csu.handc.compiler.parser.ast.expression.IdentifierNode;
import org.csu.handc.compiler.parser.ast.expression.NumberNode;
import org.csu.handc.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LetStatementNode;
import org.csu.handc.compiler.parser.ast.statement.LoopStatementNode;
import org.csu.handc.compiler.parser.ast.statement.PrintStatementNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Parser 类的单元测试
 */
public class ParserTest {

    private AbstractSyntaxTree parseSource(String source) {
        System.out.println("Input: " + source);
        List<Token> tokens = new Lexer(source).tokenize();
        AbstractSyntaxTree ast = new Parser(tokens).parse();
        System.out.println("Generated AST: " + ast);
        return ast;
    }

    @Test
    public void testParseLetAndPrint() {
        System.out.println("--- Running test: testParseLetAndPrint ---");
        AbstractSyntaxTree ast = parseSource("let x = 5; print x;");

        StatementList statements = ast.statements();
        assertEquals(2, statements.size());
        LetStatementNode let = assertInstanceOf(LetStatementNode.class, statements.get(0));
        assertEquals("x", let.identifier());
        assertEquals(ExpressionNode.of(new NumberNode(5)), let.value());
        PrintStatementNode print = assertInstanceOf(PrintStatementNode.class, statements.get(1));
        assertEquals(ExpressionNode.of(new IdentifierNode("x")), print.value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testExpressionIsRightNestedChain() {
        System.out.println("--- Running test: testExpressionIsRightNestedChain ---");
        AbstractSyntaxTree ast = parseSource("let x = 1 + 2 + 3;");

        ExpressionNode expr = ((LetStatementNode) ast.statements().get(0)).value();
        assertEquals(new NumberNode(1), expr.lhs());
        assertEquals(new NumberNode(2), expr.rhs().lhs());
        assertEquals(new NumberNode(3), expr.rhs().rhs().lhs());
        assertNull(expr.rhs().rhs().rhs());
        assertEquals(3, expr.terms().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testParseLoopWithBody() {
        AbstractSyntaxTree ast = parseSource("let x = 5; loop 3 { x = x + 1; print x; };");

        assertEquals(2, ast.statements().size());
        LoopStatementNode loop = assertInstanceOf(LoopStatementNode.class, ast.statements().get(1));
        assertEquals(ExpressionNode.of(new NumberNode(3)), loop.count());

        StatementList body = loop.body().statements();
        assertEquals(2, body.size());
        AssignmentStatementNode assignment = assertInstanceOf(AssignmentStatementNode.class, body.get(0));
        assertEquals("x", assignment.identifier());
        assertEquals(List.of(new IdentifierNode("x"), new NumberNode(1)), assignment.value().terms());
        assertInstanceOf(PrintStatementNode.class, body.get(1));
    }

    @Test
    public void testParseNestedLoopsAndEmptyBody() {
        AbstractSyntaxTree ast = parseSource("loop a + 1 { loop 2 { }; };");

        LoopStatementNode outer = (LoopStatementNode) ast.statements().get(0);
        assertEquals(List.of(new IdentifierNode("a"), new NumberNode(1)), outer.count().terms());
        LoopStatementNode inner = (LoopStatementNode) outer.body().statements().get(0);
        assertEquals(0, inner.body().statements().size());
    }

    @Test
    public void testParseFromHandBuiltTokens() {
        List<Token> tokens = List.of(
                Token.of(TokenType.PRINT, "print"),
                Token.of(TokenType.NUMBER, "7"),
                Token.of(TokenType.SEMICOLON, ";"));
        AbstractSyntaxTree ast = new Parser(tokens).parse();
        PrintStatementNode print = (PrintStatementNode) ast.statements().get(0);
        assertEquals(new NumberNode(7), print.value().lhs());
    }

    @Test
    public void testEmptyProgram() {
        assertEquals(0, parseSource("").statements().size());
    }

    @Test
    public void testMissingSemicolonAfterLet() {
        System.out.println("--- Running test: testMissingSemicolonAfterLet ---");
        ParseException e = assertThrows(ParseException.class, () -> parseSource("let a = 1 + 2 print a;"));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertTrue(e.getMessage().contains("';'"));
        assertTrue(e.getMessage().contains("'print'"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testLoopRequiresTrailingSemicolon() {
        assertThrows(ParseException.class, () -> parseSource("loop 3 { print 1; }"));
        assertThrows(ParseException.class, () -> parseSource("loop 3 { print 1; } print 2;"));
    }

    @Test
    public void testUnclosedBlock() {
        ParseException e = assertThrows(ParseException.class, () -> parseSource("loop 3 { print 1;"));
        assertTrue(e.getMessage().contains("end of input"));
    }

    @Test
    public void testMissingOpenBrace() {
        assertThrows(ParseException.class, () -> parseSource("loop 3 print 1; };"));
    }

    @Test
    public void testStrayCloseBraceAtTopLevel() {
        assertThrows(ParseException.class, () -> parseSource("print 1; };"));
    }

    @Test
    public void testInvalidStatementStart() {
        assertThrows(ParseException.class, () -> parseSource("5 = x;"));
        assertThrows(ParseException.class, () -> parseSource("+ x;"));
    }

    @Test
    public void testMalformedStatements() {
        assertThrows(ParseException.class, () -> parseSource("let = 5;"));
        assertThrows(ParseException.class, () -> parseSource("let x 5;"));
        assertThrows(ParseException.class, () -> parseSource("x = ;"));
        assertThrows(ParseException.class, () -> parseSource("print 1 +;"));
        assertThrows(ParseException.class, () -> parseSource("print"));
        assertThrows(ParseException.class, () -> parseSource("let let = 1;"));
    }

    @Test
    public void testVeryLongExpressionChain() {
        int terms = 100_000;
        StringBuilder source = new StringBuilder("print 1");
        for (int i = 1; i < terms; i++) {
            source.append(" + 1");
        }
        source.append(';');

        AbstractSyntaxTree ast = new Parser(new Lexer(source.toString()).tokenize()).parse();
        ExpressionNode expr = ((PrintStatementNode) ast.statements().get(0)).value();
        assertEquals(terms, expr.terms().size());
    }
}
