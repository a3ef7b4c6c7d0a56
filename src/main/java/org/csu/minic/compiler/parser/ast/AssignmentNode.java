package org.csu.minic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 赋值语句 (e.g., x = 1 + 2;)
 */
public record AssignmentNode(IdentifierNode target, ExpressionNode value) implements AstNode {

    public AssignmentNode {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
