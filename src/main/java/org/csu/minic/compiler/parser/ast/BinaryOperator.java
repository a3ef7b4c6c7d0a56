package org.csu.minic.compiler.parser.ast;

import org.csu.minic.compiler.lexer.TokenType;

import java.util.Arrays;
import java.util.Optional;

/**
 * 二元运算符。加减与所有比较运算符处于同一优先级，乘除更高。
 */
public enum BinaryOperator {
    ADD("+", TokenType.PLUS),
    SUBTRACT("-", TokenType.MINUS),
    MULTIPLY("*", TokenType.MULTIPLY),
    DIVIDE("/", TokenType.DIVIDE),
    EQUAL("==", TokenType.EQ),
    NOT_EQUAL("!=", TokenType.NEQ),
    LESS("<", TokenType.LT),
    GREATER(">", TokenType.GT),
    LESS_EQUAL("<=", TokenType.LE),
    GREATER_EQUAL(">=", TokenType.GE);

    private final String symbol;
    private final TokenType tokenType;

    BinaryOperator(String symbol, TokenType tokenType) {
        this.symbol = symbol;
        this.tokenType = tokenType;
    }

    public String getSymbol() {
        return symbol;
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public static Optional<BinaryOperator> fromTokenType(TokenType type) {
        return Arrays.stream(values()).filter(op -> op.getTokenType() == type).findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
