package org.csu.minic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: if 语句。
 *
 * @param condition 条件表达式
 * @param thenBranch then 分支，可以是 {@link BlockNode} 也可以是单条语句
 * @param elseBranch else 分支；源码中没有 else 子句时为 null
 */
public record IfStatementNode(
        ExpressionNode condition,
        AstNode thenBranch,
        AstNode elseBranch
) implements AstNode {

    public IfStatementNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBranch, "thenBranch");
    }

    public IfStatementNode(ExpressionNode condition, AstNode thenBranch) {
        this(condition, thenBranch, null);
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
