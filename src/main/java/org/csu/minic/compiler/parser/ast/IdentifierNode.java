package org.csu.minic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 标识符，即变量名。
 */
public record IdentifierNode(String name) implements ExpressionNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
