package com.hdltree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Keywords are case-insensitive and identifiers keep their spelling")
    void testKeywordsAndIdentifiers() {
        List<Token> tokens = Lexer.tokenize("ENTITY Demo_Device Is");
        assertEquals(TokenType.ENTITY, tokens.get(0).type());
        assertEquals("ENTITY", tokens.get(0).lexeme());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals("Demo_Device", tokens.get(1).lexeme());
        assertEquals(TokenType.IS, tokens.get(2).type());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    @DisplayName("Comments and whitespace become the leading text of the next token")
    void testTriviaAttachedToNextToken() {
        String source = "-- header\nlibrary /* block */ ieee;  -- tail\n";
        List<Token> tokens = Lexer.tokenize(source);
        assertEquals("-- header\n", tokens.get(0).leading());
        assertEquals(" /* block */ ", tokens.get(1).leading());
        assertEquals("", tokens.get(2).leading());
        Token eof = tokens.get(tokens.size() - 1);
        assertEquals(TokenType.EOF, eof.type());
        assertEquals("", eof.lexeme());
        assertEquals("  -- tail\n", eof.leading());

        StringBuilder rebuilt = new StringBuilder();
        for (Token token : tokens) {
            rebuilt.append(token.leading()).append(token.lexeme());
        }
        assertEquals(source, rebuilt.toString());
    }

    @Test
    @DisplayName("A quote after a name is a tick, elsewhere it opens a character literal")
    void testTickVersusCharacterLiteral() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.TICK, TokenType.IDENTIFIER, TokenType.EOF),
            types("clk'event"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.VAR_ASSIGN, TokenType.CHARACTER_LITERAL, TokenType.EOF),
            types("x := '1'"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.TICK, TokenType.LPAREN, TokenType.CHARACTER_LITERAL,
            TokenType.RPAREN, TokenType.EOF), types("std_ulogic'('0')"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.RPAREN,
            TokenType.TICK, TokenType.IDENTIFIER, TokenType.EOF), types("a(i)'length"));
    }

    @Test
    @DisplayName("Compound delimiters are recognized greedily")
    void testCompoundDelimiters() {
        assertEquals(List.of(TokenType.ARROW, TokenType.VAR_ASSIGN, TokenType.LE, TokenType.GE, TokenType.NE,
                TokenType.BOX, TokenType.DOUBLE_STAR, TokenType.DOUBLE_LT, TokenType.DOUBLE_GT, TokenType.EOF),
            types("=> := <= >= /= <> ** << >>"));
        assertEquals(List.of(TokenType.CONDITION, TokenType.MATCH_EQ, TokenType.MATCH_NE, TokenType.MATCH_LT,
                TokenType.MATCH_LE, TokenType.MATCH_GT, TokenType.MATCH_GE, TokenType.QUESTION, TokenType.EOF),
            types("?? ?= ?/= ?< ?<= ?> ?>= ?"));
    }

    @Test
    @DisplayName("Numeric, string and bit string literals")
    void testLiterals() {
        List<Token> tokens = Lexer.tokenize("1_000 3.14e-2 16#FF_FF# 2#1.1#E3 \"a\"\"b\" x\"0F\" 12UB\"01\" \\bus wire\\");
        assertEquals(TokenType.DECIMAL_LITERAL, tokens.get(0).type());
        assertEquals("1_000", tokens.get(0).lexeme());
        assertEquals(TokenType.DECIMAL_LITERAL, tokens.get(1).type());
        assertEquals("3.14e-2", tokens.get(1).lexeme());
        assertEquals(TokenType.BASED_LITERAL, tokens.get(2).type());
        assertEquals(TokenType.BASED_LITERAL, tokens.get(3).type());
        assertEquals(TokenType.STRING_LITERAL, tokens.get(4).type());
        assertEquals("\"a\"\"b\"", tokens.get(4).lexeme());
        assertEquals(TokenType.BIT_STRING_LITERAL, tokens.get(5).type());
        assertEquals(TokenType.BIT_STRING_LITERAL, tokens.get(6).type());
        assertEquals("12UB\"01\"", tokens.get(6).lexeme());
        assertEquals(TokenType.IDENTIFIER, tokens.get(7).type());
        assertEquals("\\bus wire\\", tokens.get(7).lexeme());
    }

    @Test
    @DisplayName("Spans carry 1-based lines and 0-based columns")
    void testSpans() {
        List<Token> tokens = Lexer.tokenize("entity e is\n  port");
        Span port = tokens.get(3).span();
        assertEquals(14, port.start());
        assertEquals(18, port.end());
        assertEquals(2, port.line());
        assertEquals(2, port.column());
        assertEquals("2:3", port.position());
    }

    @Test
    @DisplayName("Lexical errors report their location")
    void testLexErrors() {
        LexException unterminated = assertThrows(LexException.class, () -> Lexer.tokenize("x := \"abc\n;"));
        assertTrue(unterminated.getMessage().startsWith("Unterminated string literal"));
        assertEquals(5, unterminated.getSpan().start());

        LexException underscores = assertThrows(LexException.class, () -> Lexer.tokenize("signal a__b"));
        assertTrue(underscores.getMessage().contains("consecutive underscores"));

        LexException trailing = assertThrows(LexException.class, () -> Lexer.tokenize("signal ab_ :"));
        assertTrue(trailing.getMessage().contains("ends with an underscore"));

        LexException base = assertThrows(LexException.class, () -> Lexer.tokenize("17#10#"));
        assertTrue(base.getMessage().startsWith("Base 17 is outside 2..16"));

        LexException comment = assertThrows(LexException.class, () -> Lexer.tokenize("a /* never closed"));
        assertTrue(comment.getMessage().startsWith("Unterminated block comment"));

        LexException character = assertThrows(LexException.class, () -> Lexer.tokenize("a := b $ c;"));
        assertTrue(character.getMessage().startsWith("Unexpected character '$'"));
        assertEquals(1, character.getSpan().line());
        assertEquals(7, character.getSpan().column());
    }
}
