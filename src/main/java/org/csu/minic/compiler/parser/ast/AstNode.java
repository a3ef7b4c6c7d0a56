package org.csu.minic.compiler.parser.ast;

/**
 * 所有 AST 节点的公共接口。节点集合是封闭的，新增节点类型必须同时扩展 {@link AstVisitor}。
 */
public sealed interface AstNode
        permits ExpressionNode, AssignmentNode, IfStatementNode, BlockNode {

    <R> R accept(AstVisitor<R> visitor);
}
