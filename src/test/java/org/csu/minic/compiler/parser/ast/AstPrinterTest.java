package org.csu.minic.compiler.parser.ast;

import org.csu.minic.compiler.lexer.Lexer;
import org.csu.minic.compiler.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstPrinterTest {

    @Test
    void testPrintIfElse() {
        BlockNode program = new Parser(new Lexer("if (x < 5) y = 1 + 2; else { y = 2; }").tokenize()).parse();
        String expected = String.join("\n",
                "Block",
                "  If",
                "    BinOp <",
                "      Identifier x",
                "      Number 5",
                "    Then",
                "      Assign y",
                "        BinOp +",
                "          Number 1",
                "          Number 2",
                "    Else",
                "      Block",
                "        Assign y",
                "          Number 2",
                "");
        assertEquals(expected, AstPrinter.print(program));
    }

    @Test
    void testBlockCopiesStatements() {
        List<AstNode> statements = new ArrayList<>();
        statements.add(new IdentifierNode("a"));
        BlockNode block = new BlockNode(statements);
        statements.add(new IdentifierNode("b"));
        assertEquals(1, block.statements().size());
        assertThrows(UnsupportedOperationException.class, () -> block.statements().add(new IdentifierNode("c")));
    }
}
