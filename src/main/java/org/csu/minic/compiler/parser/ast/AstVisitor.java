package org.csu.minic.compiler.parser.ast;

/**
 * 按节点类型分派的访问者。每种节点都有一个方法，漏掉任何一种都无法通过编译。
 *
 * @param <R> 访问结果类型
 */
public interface AstVisitor<R> {

    R visitNumber(NumberNode node);

    R visitIdentifier(IdentifierNode node);

    R visitBinaryExpression(BinaryExpressionNode node);

    R visitAssignment(AssignmentNode node);

    R visitIfStatement(IfStatementNode node);

    R visitBlock(BlockNode node);
}
