package org.csu.minic.compiler.parser.ast;

/**
 * 以缩进树的形式打印 AST，每个节点一行，每层缩进两个空格。调试用。
 */
public class AstPrinter implements AstVisitor<Void> {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public static String print(AstNode node) {
        AstPrinter printer = new AstPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    @Override
    public Void visitNumber(NumberNode node) {
        line("Number " + node.value());
        return null;
    }

    @Override
    public Void visitIdentifier(IdentifierNode node) {
        line("Identifier " + node.name());
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpressionNode node) {
        line("BinOp " + node.operator().getSymbol());
        nested(node.left());
        nested(node.right());
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) {
        line("Assign " + node.target().name());
        nested(node.value());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatementNode node) {
        line("If");
        nested(node.condition());
        depth++;
        line("Then");
        nested(node.thenBranch());
        if (node.hasElse()) {
            line("Else");
            nested(node.elseBranch());
        }
        depth--;
        return null;
    }

    @Override
    public Void visitBlock(BlockNode node) {
        line("Block");
        for (AstNode statement : node.statements()) {
            nested(statement);
        }
        return null;
    }

    private void nested(AstNode node) {
        depth++;
        node.accept(this);
        depth--;
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
