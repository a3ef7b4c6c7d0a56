package org.csu.minic.compiler.parser.ast;

/**
 * 表达式节点：数字、标识符、二元运算。单独作为语句出现时（表达式语句）也直接用它表示。
 */
public sealed interface ExpressionNode extends AstNode
        permits NumberNode, IdentifierNode, BinaryExpressionNode {
}
