package org.csu.minic.compiler.lexer;

import org.csu.minic.common.config.CompilerSettings;
import org.csu.minic.common.config.OperatorMatching;
import org.csu.minic.common.config.UnknownCharacterPolicy;
import org.csu.minic.common.exception.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private static List<Token> lex(String source) {
        return new Lexer(source).tokenize();
    }

    private static List<TokenType> types(String source, CompilerSettings settings) {
        return new Lexer(source, settings).tokenize().stream()
                .map(Token::type)
                .collect(Collectors.toList());
    }

    private static List<TokenType> types(String source) {
        return types(source, new CompilerSettings());
    }

    @Test
    void testSimpleAssignment() {
        System.out.println("--- Running test: testSimpleAssignment ---");
        List<Token> tokens = lex("x = 5;");
        System.out.println("Generated Tokens: " + tokens);

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER,
                TokenType.SEMICOLON, TokenType.EOF), types("x = 5;"));
        assertEquals("x", tokens.get(0).lexeme());
        assertEquals("5", tokens.get(2).lexeme());
    }

    @Test
    void testAllOperatorsAndDelimiters() {
        assertEquals(List.of(
                TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.DIVIDE,
                TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE,
                TokenType.SEMICOLON, TokenType.EQ, TokenType.NEQ, TokenType.LT, TokenType.GT,
                TokenType.LE, TokenType.GE, TokenType.ASSIGN, TokenType.EOF
        ), types("+ - * / ( ) { } ; == != < > <= >= ="));
    }

    @Test
    void testKeywordsAreWholeWords() {
        assertEquals(List.of(TokenType.IF, TokenType.ELSE, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.EOF), types("if else iffy elsewhere If"));
    }

    @Test
    void testNumberFollowedByIdentifier() {
        List<Token> tokens = lex("12abc _x9");
        assertEquals(TokenType.NUMBER, tokens.get(0).type());
        assertEquals("12", tokens.get(0).lexeme());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals("abc", tokens.get(1).lexeme());
        assertEquals("_x9", tokens.get(2).lexeme());
    }

    @Test
    void testOperatorsWithoutSpaces() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EQ, TokenType.NUMBER, TokenType.ASSIGN,
                TokenType.IDENTIFIER, TokenType.EOF), types("a==1=b"));
    }

    @Test
    void testFirstMatchSplitsComparisonOperators() {
        CompilerSettings settings = new CompilerSettings(OperatorMatching.FIRST_MATCH, UnknownCharacterPolicy.FAIL);
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LT, TokenType.ASSIGN, TokenType.IDENTIFIER,
                TokenType.EOF), types("a <= b", settings));
        assertEquals(List.of(TokenType.GT, TokenType.ASSIGN, TokenType.EOF), types(">=", settings));
        // "==" 和 "!=" 在模式表里排在 "=" 之前，不受影响
        assertEquals(List.of(TokenType.EQ, TokenType.NEQ, TokenType.EOF), types("== !=", settings));
    }

    @Test
    void testWhitespaceAndPositions() {
        List<Token> tokens = lex("a\n\t  b\r\n c");
        assertEquals(1, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
        assertEquals(2, tokens.get(1).line());
        assertEquals(4, tokens.get(1).column());
        assertEquals(3, tokens.get(2).line());
        assertEquals(2, tokens.get(2).column());
    }

    @Test
    void testEmptyAndBlankInput() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(List.of(TokenType.EOF), types("  \n\t "));
        assertEquals(List.of(TokenType.EOF), types(null));
    }

    @Test
    void testIllegalCharacterFailsByDefault() {
        System.out.println("--- Running test: testIllegalCharacterFailsByDefault ---");
        LexException e = assertThrows(LexException.class, () -> lex("x = 1 @;"));
        System.out.println("Error: " + e.getMessage());
        assertEquals('@', e.getCharacter());
        assertEquals(1, e.getLine());
        assertEquals(7, e.getColumn());
        assertTrue(e.getMessage().contains("'@'"));
    }

    @Test
    void testLoneBangIsIllegal() {
        assertThrows(LexException.class, () -> lex("!x"));
    }

    @Test
    void testIllegalCharacterSkippedWhenConfigured() {
        CompilerSettings settings = new CompilerSettings(OperatorMatching.LONGEST_MATCH, UnknownCharacterPolicy.SKIP);
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER,
                TokenType.SEMICOLON, TokenType.EOF), types("x #= 1 @;", settings));
    }

    @Test
    void testTokenListIsUnmodifiable() {
        List<Token> tokens = lex("x;");
        assertThrows(UnsupportedOperationException.class, () -> tokens.remove(0));
    }
}
