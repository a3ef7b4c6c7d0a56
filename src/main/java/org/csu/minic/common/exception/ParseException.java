package org.csu.minic.common.exception;

import org.csu.minic.compiler.lexer.Token;
import org.csu.minic.compiler.lexer.TokenType;

/**
 * @author hidyouth
 * @description: 语法分析阶段的异常
 *
 * 记录期望的内容以及实际遇到的 Token；实际 Token 为 EOF 时报告 "end of input"。
 */
public class ParseException extends CompilationException {

    private final TokenType expected;
    private final Token found;

    public ParseException(Token found, String expected) {
        this(found, null, expected);
    }

    public ParseException(Token found, TokenType expected, String expectedDescription) {
        super(buildMessage(found, expectedDescription));
        this.expected = expected;
        this.found = found;
    }

    private static String buildMessage(Token found, String expected) {
        if (found.type() == TokenType.EOF) {
            return String.format("Syntax Error at line %d, column %d: Expected %s, but found end of input",
                    found.line(), found.column(), expected);
        }
        return String.format("Syntax Error at line %d, column %d: Expected %s, but found '%s' (%s)",
                found.line(),
                found.column(),
                expected,
                found.lexeme(),
                found.type());
    }

    /**
     * @return 期望的 Token 类型；期望的是一类语法成分（如表达式）时为 null
     */
    public TokenType getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    public boolean isEndOfInput() {
        return found.type() == TokenType.EOF;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SYNTAX;
    }
}
