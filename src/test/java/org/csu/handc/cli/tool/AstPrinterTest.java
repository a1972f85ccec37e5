package org.csu.handc.cli.tool;

import org.csu.handc.compiler.lexer.Lexer;
import org.csu.handc.compiler.parser.Parser;
import org.csu.handc.compiler.parser.ast.AbstractSyntaxTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AstPrinterTest {

    private AbstractSyntaxTree parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    @Test
    void testFormatOutline() {
        String text = AstPrinter.format(parse(
                "let x = 1 + 2; loop x + 1 { x = x + 1; loop 2 { print x; }; }; print 3;"));
        assertEquals("Program\n"
                + "  Let x = 1 + 2\n"
                + "  Loop x + 1\n"
                + "    Assign x = x + 1\n"
                + "    Loop 2\n"
                + "      Print x\n"
                + "  Print 3\n", text);
    }

    @Test
    void testEmptyProgram() {
        assertEquals("Program\n", AstPrinter.format(parse("")));
    }
}
