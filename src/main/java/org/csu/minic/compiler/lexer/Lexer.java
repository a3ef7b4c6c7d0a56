package org.csu.minic.compiler.lexer;

import org.csu.minic.common.config.CompilerSettings;
import org.csu.minic.common.config.OperatorMatching;
import org.csu.minic.common.config.UnknownCharacterPolicy;
import org.csu.minic.common.exception.LexException;
import org.csu.minic.common.log.CompilerLogger;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 从左到右扫描源码，依次尝试：关键字 if/else、整数、运算符和分隔符、标识符。
 * 空白字符直接丢弃。返回的列表总是以一个 EOF Token 结尾。
 */
public class Lexer {

    private static final Logger LOGGER = CompilerLogger.getLogger(Lexer.class);

    // 关键字映射表
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "if", TokenType.IF,
            "else", TokenType.ELSE
    );

    private final String input;
    private final OperatorMatching operatorMatching;
    private final UnknownCharacterPolicy unknownCharacterPolicy;

    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    public Lexer(String input) {
        this(input, new CompilerSettings());
    }

    public Lexer(String input, CompilerSettings settings) {
        this.input = input == null ? "" : input;
        this.operatorMatching = settings.getOperatorMatching();
        this.unknownCharacterPolicy = settings.getUnknownCharacterPolicy();
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return 不可修改的Token列表，最后一个元素是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        LOGGER.debug("Tokenized {} characters into {} tokens", input.length(), tokens.size() - 1);
        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken() {
        while (true) {
            skipWhitespace();

            if (position >= input.length()) {
                return new Token(TokenType.EOF, "", line, column);
            }

            char currentChar = peek();

            // 识别关键字或标识符
            if (isLetter(currentChar)) {
                return readIdentifierOrKeyword();
            }

            // 识别数字
            if (isDigit(currentChar)) {
                return readNumber();
            }

            Token operator = readOperator(currentChar);
            if (operator != null) {
                return operator;
            }

            // 没有任何模式能匹配当前字符
            if (unknownCharacterPolicy == UnknownCharacterPolicy.FAIL) {
                throw new LexException(currentChar, line, column);
            }
            LOGGER.debug("Skipping unexpected character '{}' at {}:{}", currentChar, line, column);
            advance();
        }
    }

    private Token readOperator(char currentChar) {
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                return consumeAndReturn(TokenType.MULTIPLY, "*");
            case '/':
                return consumeAndReturn(TokenType.DIVIDE, "/");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '=':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.EQ, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '!':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.NEQ, "!=");
                }
                return null; // 单独的 '!' 不是合法字符
            case '<':
                if (operatorMatching == OperatorMatching.LONGEST_MATCH && peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.LE, "<=");
                }
                return consumeAndReturn(TokenType.LT, "<");
            case '>':
                if (operatorMatching == OperatorMatching.LONGEST_MATCH && peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.GE, ">=");
                }
                return consumeAndReturn(TokenType.GT, ">");
            default:
                return null;
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 关键字区分大小写，"If" 是普通标识符
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        String number = input.substring(startPos, position);
        return new Token(TokenType.NUMBER, number, line, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (Character.isWhitespace(ch)) {
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
