package org.csu.minic.compiler.generator;

import org.csu.minic.common.exception.CodeGenException;
import org.csu.minic.compiler.parser.ast.*;

import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 代码生成器
 *
 * 把 AST 重新渲染成规范化的源码：
 * 每个二元运算都加上括号；赋值语句以 ';' 结尾，表达式语句不加 ';'；
 * if 的每个分支只在开头加一次两个空格的缩进，嵌套时不会逐层加深。
 * 该类无状态，可以被多个线程共享。
 */
public class CodeGenerator implements AstVisitor<String> {

    private static final String INDENT = "  ";

    public String generate(AstNode node) {
        if (node == null) {
            throw new CodeGenException("Unsupported node: null");
        }
        return node.accept(this);
    }

    @Override
    public String visitNumber(NumberNode node) {
        return node.value().toString();
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }

    @Override
    public String visitBinaryExpression(BinaryExpressionNode node) {
        return "(" + generate(node.left()) + " " + node.operator().getSymbol() + " " + generate(node.right()) + ")";
    }

    @Override
    public String visitAssignment(AssignmentNode node) {
        return node.target().name() + " = " + generate(node.value()) + ";";
    }

    @Override
    public String visitIfStatement(IfStatementNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append("if (").append(generate(node.condition())).append(") {\n")
                .append(INDENT).append(generate(node.thenBranch())).append("\n}");
        if (node.hasElse()) {
            sb.append(" else {\n")
                    .append(INDENT).append(generate(node.elseBranch())).append("\n}");
        }
        return sb.toString();
    }

    @Override
    public String visitBlock(BlockNode node) {
        return node.statements().stream()
                .map(this::generate)
                .collect(Collectors.joining("\n"));
    }
}
