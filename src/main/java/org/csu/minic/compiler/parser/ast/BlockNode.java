package org.csu.minic.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 语句块。整个程序也是一个 BlockNode。语句顺序与源码一致。
 */
public record BlockNode(List<AstNode> statements) implements AstNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
