package org.csu.minic.compiler.parser;

import org.csu.minic.common.exception.ParseException;
import org.csu.minic.common.log.CompilerLogger;
import org.csu.minic.compiler.lexer.Token;
import org.csu.minic.compiler.lexer.TokenType;
import org.csu.minic.compiler.parser.ast.*;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * Program      := { Statement }
 * Statement    := IfStatement | Assignment | ExprStatement
 * IfStatement  := "if" "(" Expr ")" BlockOrStmt [ "else" BlockOrStmt ]
 * BlockOrStmt  := "{" { Statement } "}" | Statement
 * Assignment   := IDENTIFIER "=" Expr ";"
 * ExprStatement:= Expr ";"
 * Expr         := Term { ("+"|"-"|"=="|"!="|"<"|">"|"<="|">=") Term }
 * Term         := Factor { ("*"|"/") Factor }
 * Factor       := NUMBER | IDENTIFIER | "(" Expr ")"
 * </pre>
 */
public class Parser {

    private static final Logger LOGGER = CompilerLogger.getLogger(Parser.class);

    // 加减和比较运算共用一个优先级
    private static final Set<TokenType> EXPRESSION_OPERATORS = Set.of(
            TokenType.PLUS, TokenType.MINUS,
            TokenType.EQ, TokenType.NEQ,
            TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE
    );

    private static final Set<TokenType> TERM_OPERATORS = Set.of(
            TokenType.MULTIPLY, TokenType.DIVIDE
    );

    /** 括号、if 分支和连续二元运算共同计入的嵌套层数上限 */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 1000;

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        List<Token> copy = new ArrayList<>(tokens);
        // 保证末尾总有一个 EOF，游标永远不会越界
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
            int line = last == null ? 1 : last.line();
            int column = last == null ? 1 : last.column() + last.lexeme().length();
            copy.add(new Token(TokenType.EOF, "", line, column));
        }
        this.tokens = List.copyOf(copy);
    }

    /**
     * 解析整个程序，直到 Token 流结束。
     * @return 程序对应的顶层语句块
     */
    public BlockNode parse() {
        List<AstNode> statements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                statements.add(parseStatement());
            }
        } catch (StackOverflowError e) {
            // 嵌套上限之内仍可能耗尽较小的线程栈
            throw new ParseException(peek(), "less deeply nested input (parser stack exhausted)");
        }
        LOGGER.debug("Parsed {} top-level statements", statements.size());
        return new BlockNode(statements);
    }

    private AstNode parseStatement() {
        if (check(TokenType.IF)) {
            return parseIfStatement();
        }
        // 向前看一个 Token：标识符后面紧跟 '=' 才是赋值语句
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            return parseAssignment();
        }
        ExpressionNode expression = parseExpression();
        consume(TokenType.SEMICOLON);
        return expression;
    }

    private IfStatementNode parseIfStatement() {
        enterNesting();
        consume(TokenType.IF);
        consume(TokenType.LPAREN);
        ExpressionNode condition = parseExpression();
        consume(TokenType.RPAREN);
        AstNode thenBranch = parseBlockOrStatement();
        AstNode elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = parseBlockOrStatement();
        }
        depth--;
        return new IfStatementNode(condition, thenBranch, elseBranch);
    }

    private AstNode parseBlockOrStatement() {
        if (check(TokenType.LBRACE)) {
            enterNesting();
            advance();
            List<AstNode> statements = new ArrayList<>();
            while (!check(TokenType.RBRACE) && !isAtEnd()) {
                statements.add(parseStatement());
            }
            consume(TokenType.RBRACE);
            depth--;
            return new BlockNode(statements);
        }
        return parseStatement();
    }

    private AssignmentNode parseAssignment() {
        IdentifierNode target = new IdentifierNode(consume(TokenType.IDENTIFIER).lexeme());
        consume(TokenType.ASSIGN);
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON);
        return new AssignmentNode(target, value);
    }

    // 左结合的运算链每多一个运算符，语法树就深一层，同样计入嵌套层数
    private ExpressionNode parseExpression() {
        int enclosingDepth = depth;
        ExpressionNode left = parseTerm();
        while (EXPRESSION_OPERATORS.contains(peek().type())) {
            enterNesting();
            BinaryOperator operator = toOperator(advance());
            ExpressionNode right = parseTerm();
            left = new BinaryExpressionNode(left, operator, right);
        }
        depth = enclosingDepth;
        return left;
    }

    private ExpressionNode parseTerm() {
        int enclosingDepth = depth;
        ExpressionNode left = parseFactor();
        while (TERM_OPERATORS.contains(peek().type())) {
            enterNesting();
            BinaryOperator operator = toOperator(advance());
            ExpressionNode right = parseFactor();
            left = new BinaryExpressionNode(left, operator, right);
        }
        depth = enclosingDepth;
        return left;
    }

    private ExpressionNode parseFactor() {
        if (match(TokenType.NUMBER)) {
            return NumberNode.of(previous().lexeme());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (check(TokenType.LPAREN)) {
            enterNesting();
            advance();
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN);
            depth--;
            return expr;
        }
        throw new ParseException(peek(), "an expression (a number, an identifier, or '(')");
    }

    private BinaryOperator toOperator(Token token) {
        Optional<BinaryOperator> operator = BinaryOperator.fromTokenType(token.type());
        return operator.orElseThrow(() -> new ParseException(token, "a binary operator"));
    }

    // --- 辅助方法 ---

    private void enterNesting() {
        if (++depth > maxNestingDepth) {
            throw new ParseException(peek(),
                    "an expression nested at most " + maxNestingDepth + " levels deep (expression nested too deeply)");
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type) {
        if (check(type)) return advance();
        throw new ParseException(peek(), type, type.getDescription());
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (position + 1 >= tokens.size()) return false;
        return tokens.get(position + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
