package org.csu.minic.compiler.parser.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * AST 节点: 整数常量 (e.g., 42)。不限位数。
 */
public record NumberNode(BigInteger value) implements ExpressionNode {

    public NumberNode {
        Objects.requireNonNull(value, "value");
    }

    public static NumberNode of(String digits) {
        return new NumberNode(new BigInteger(digits));
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
