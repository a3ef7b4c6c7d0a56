package org.csu.minic.compiler.generator;

import org.csu.minic.common.exception.CodeGenException;
import org.csu.minic.compiler.parser.ast.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 直接基于手工构造的 AST 测试代码生成，不经过词法和语法分析。
 */
public class CodeGeneratorTest {

    private final CodeGenerator generator = new CodeGenerator();

    private static IdentifierNode id(String name) {
        return new IdentifierNode(name);
    }

    private static NumberNode num(long value) {
        return new NumberNode(BigInteger.valueOf(value));
    }

    @Test
    void testLeaves() {
        assertEquals("42", generator.generate(num(42)));
        assertEquals("counter_1", generator.generate(id("counter_1")));
        assertEquals("123456789012345678901234567890",
                generator.generate(NumberNode.of("000123456789012345678901234567890")));
    }

    @Test
    void testBinaryExpressionIsFullyParenthesized() {
        BinaryExpressionNode nested = new BinaryExpressionNode(
                num(1), BinaryOperator.ADD, new BinaryExpressionNode(num(2), BinaryOperator.MULTIPLY, num(3)));
        assertEquals("(1 + (2 * 3))", generator.generate(nested));
    }

    @Test
    void testAssignmentEndsWithSemicolon() {
        AssignmentNode assignment = new AssignmentNode(id("x"),
                new BinaryExpressionNode(id("y"), BinaryOperator.GREATER_EQUAL, num(0)));
        assertEquals("x = (y >= 0);", generator.generate(assignment));
    }

    @Test
    void testIfWithoutElse() {
        IfStatementNode ifNode = new IfStatementNode(id("x"), new AssignmentNode(id("y"), num(1)));
        assertEquals("if (x) {\n  y = 1;\n}", generator.generate(ifNode));
    }

    @Test
    void testIfWithElse() {
        IfStatementNode ifNode = new IfStatementNode(
                new BinaryExpressionNode(id("x"), BinaryOperator.LESS, num(5)),
                new BlockNode(List.of(new AssignmentNode(id("y"), num(1)))),
                new BlockNode(List.of(new AssignmentNode(id("y"), num(2)))));
        assertEquals("if ((x < 5)) {\n  y = 1;\n} else {\n  y = 2;\n}", generator.generate(ifNode));
    }

    @Test
    void testEmptyElseBlockIsStillRendered() {
        IfStatementNode ifNode = new IfStatementNode(id("x"), new BlockNode(List.of()), new BlockNode(List.of()));
        assertEquals("if (x) {\n  \n} else {\n  \n}", generator.generate(ifNode));
    }

    @Test
    void testNestedIfIsNotReindented() {
        IfStatementNode inner = new IfStatementNode(id("b"), new AssignmentNode(id("y"), num(1)));
        IfStatementNode outer = new IfStatementNode(id("a"), inner);
        assertEquals("if (a) {\n  if (b) {\n  y = 1;\n}\n}", generator.generate(outer));
    }

    @Test
    void testBlockJoinsWithNewlinesWithoutTrailingSeparator() {
        BlockNode block = new BlockNode(List.of(
                new AssignmentNode(id("a"), num(1)),
                new BinaryExpressionNode(id("a"), BinaryOperator.NOT_EQUAL, num(2)),
                id("a")));
        assertEquals("a = 1;\n(a != 2)\na", generator.generate(block));
        assertEquals("", generator.generate(new BlockNode(List.of())));
    }

    @Test
    void testMultiStatementBranchOnlyIndentsFirstLine() {
        IfStatementNode ifNode = new IfStatementNode(id("c"), new BlockNode(List.of(
                new AssignmentNode(id("a"), num(1)),
                new AssignmentNode(id("b"), num(2)))));
        assertEquals("if (c) {\n  a = 1;\nb = 2;\n}", generator.generate(ifNode));
    }

    @Test
    void testNullNodeIsRejected() {
        CodeGenException e = assertThrows(CodeGenException.class, () -> generator.generate(null));
        assertTrue(e.getMessage().startsWith("Unsupported node"));
    }
}
