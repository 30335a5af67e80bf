package com.hdltree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * VHDL-2008 lexer.
 *
 * Whitespace and comments never become tokens; they are attached to the following token
 * as its leading text so the source can be rebuilt exactly. The token list always ends
 * with an {@link TokenType#EOF} token that owns any trailing trivia.
 */
public final class Lexer {

    private static final Set<String> BIT_STRING_BASES =
        Set.of("b", "o", "x", "ub", "uo", "ux", "sb", "so", "sx", "d");

    // After these a ' is an attribute tick, never the start of a character literal
    private static final Set<TokenType> TICK_PREDECESSORS = EnumSet.of(
        TokenType.IDENTIFIER, TokenType.RPAREN, TokenType.RBRACKET, TokenType.ALL);

    private final String source;
    private final int length;
    private final LineMap lines;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;

    public Lexer(String source) {
        this.source = source;
        this.length = source.length();
        this.lines = new LineMap(source);
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        while (true) {
            int triviaStart = pos;
            skipTrivia();
            String leading = source.substring(triviaStart, pos);
            if (pos >= length) {
                tokens.add(new Token(TokenType.EOF, "", leading, lines.span(pos, pos)));
                break;
            }
            int start = pos;
            TokenType type = scanToken();
            tokens.add(new Token(type, source.substring(start, pos), leading, lines.span(start, pos)));
        }
        return Collections.unmodifiableList(tokens);
    }

    // ========================================================================
    // Trivia
    // ========================================================================

    private void skipTrivia() {
        while (pos < length) {
            char c = source.charAt(pos);
            if (isWhitespace(c)) {
                pos++;
            } else if (c == '-' && peekAt(1) == '-') {
                while (pos < length && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (c == '/' && peekAt(1) == '*') {
                int start = pos;
                int close = source.indexOf("*/", pos + 2);
                if (close < 0) {
                    throw new LexException("Unterminated block comment", lines.span(start, length));
                }
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u000B' || c == '\f' || c == '\u00A0';
    }

    // ========================================================================
    // Tokens
    // ========================================================================

    private TokenType scanToken() {
        char c = source.charAt(pos);
        if (Character.isLetter(c)) {
            return identifierOrBitString();
        }
        if (isDigit(c)) {
            return number();
        }
        switch (c) {
            case '\\':
                return extendedIdentifier();
            case '"':
                stringBody(pos);
                return TokenType.STRING_LITERAL;
            case '\'':
                return tickOrCharacter();
            case '&': pos++; return TokenType.AMPERSAND;
            case '(': pos++; return TokenType.LPAREN;
            case ')': pos++; return TokenType.RPAREN;
            case '+': pos++; return TokenType.PLUS;
            case ',': pos++; return TokenType.COMMA;
            case '-': pos++; return TokenType.MINUS;
            case '.': pos++; return TokenType.DOT;
            case ';': pos++; return TokenType.SEMICOLON;
            case '|': pos++; return TokenType.BAR;
            case '[': pos++; return TokenType.LBRACKET;
            case ']': pos++; return TokenType.RBRACKET;
            case '@': pos++; return TokenType.AT;
            case '^': pos++; return TokenType.CARET;
            case '=':
                return pick('>', TokenType.ARROW, TokenType.EQ);
            case '*':
                return pick('*', TokenType.DOUBLE_STAR, TokenType.STAR);
            case ':':
                return pick('=', TokenType.VAR_ASSIGN, TokenType.COLON);
            case '/':
                return pick('=', TokenType.NE, TokenType.SLASH);
            case '>':
                if (peekAt(1) == '=') {
                    pos += 2;
                    return TokenType.GE;
                }
                return pick('>', TokenType.DOUBLE_GT, TokenType.GT);
            case '<':
                if (peekAt(1) == '=') {
                    pos += 2;
                    return TokenType.LE;
                }
                if (peekAt(1) == '>') {
                    pos += 2;
                    return TokenType.BOX;
                }
                return pick('<', TokenType.DOUBLE_LT, TokenType.LT);
            case '?':
                return matchingOperator();
            default:
                throw new LexException("Unexpected character '" + c + "'", lines.span(pos, pos + 1));
        }
    }

    private TokenType pick(char second, TokenType pair, TokenType single) {
        if (peekAt(1) == second) {
            pos += 2;
            return pair;
        }
        pos++;
        return single;
    }

    private TokenType matchingOperator() {
        char next = peekAt(1);
        if (next == '?') {
            pos += 2;
            return TokenType.CONDITION;
        }
        if (next == '=') {
            pos += 2;
            return TokenType.MATCH_EQ;
        }
        if (next == '/' && peekAt(2) == '=') {
            pos += 3;
            return TokenType.MATCH_NE;
        }
        if (next == '<') {
            if (peekAt(2) == '=') {
                pos += 3;
                return TokenType.MATCH_LE;
            }
            pos += 2;
            return TokenType.MATCH_LT;
        }
        if (next == '>') {
            if (peekAt(2) == '=') {
                pos += 3;
                return TokenType.MATCH_GE;
            }
            pos += 2;
            return TokenType.MATCH_GT;
        }
        pos++;
        return TokenType.QUESTION;
    }

    private TokenType identifierOrBitString() {
        int start = pos;
        while (pos < length && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String word = source.substring(start, pos);
        if (pos < length && source.charAt(pos) == '"' && BIT_STRING_BASES.contains(word.toLowerCase(Locale.ROOT))) {
            stringBody(start);
            return TokenType.BIT_STRING_LITERAL;
        }
        checkUnderscores(word, start);
        TokenType keyword = TokenType.keyword(word);
        return keyword != null ? keyword : TokenType.IDENTIFIER;
    }

    private void checkUnderscores(String word, int start) {
        int doubled = word.indexOf("__");
        if (doubled >= 0) {
            throw new LexException("Identifier '" + word + "' contains consecutive underscores",
                lines.span(start + doubled, start + doubled + 2));
        }
        if (word.endsWith("_")) {
            throw new LexException("Identifier '" + word + "' ends with an underscore",
                lines.span(start, start + word.length()));
        }
    }

    private TokenType extendedIdentifier() {
        int start = pos;
        pos++;
        while (true) {
            if (pos >= length || source.charAt(pos) == '\n' || source.charAt(pos) == '\r') {
                throw new LexException("Unterminated extended identifier", lines.span(start, pos));
            }
            char c = source.charAt(pos++);
            if (c == '\\') {
                if (peekAt(0) == '\\') {
                    pos++;
                } else {
                    break;
                }
            }
        }
        if (pos - start == 2) {
            throw new LexException("Empty extended identifier", lines.span(start, pos));
        }
        return TokenType.IDENTIFIER;
    }

    /**
     * Consumes a quoted body starting at the opening quote at or after {@code pos}.
     */
    private void stringBody(int tokenStart) {
        pos++; // opening quote
        while (true) {
            if (pos >= length || source.charAt(pos) == '\n' || source.charAt(pos) == '\r') {
                throw new LexException("Unterminated string literal", lines.span(tokenStart, pos));
            }
            char c = source.charAt(pos++);
            if (c == '"') {
                if (peekAt(0) == '"') {
                    pos++;
                } else {
                    return;
                }
            }
        }
    }

    private TokenType tickOrCharacter() {
        TokenType previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1).type();
        if (previous != null && TICK_PREDECESSORS.contains(previous)) {
            pos++;
            return TokenType.TICK;
        }
        if (pos + 2 < length && source.charAt(pos + 2) == '\'' && !Character.isISOControl(source.charAt(pos + 1))) {
            pos += 3;
            return TokenType.CHARACTER_LITERAL;
        }
        pos++;
        return TokenType.TICK;
    }

    private TokenType number() {
        int start = pos;
        digits(start, false);
        if (peekAt(0) == '#') {
            return basedLiteral(start);
        }
        boolean integer = true;
        if (peekAt(0) == '.' && isDigit(peekAt(1))) {
            pos++;
            digits(start, false);
            integer = false;
        }
        if (exponent(start)) {
            integer = false;
        }
        if (integer) {
            int wordEnd = pos;
            while (wordEnd < length && Character.isLetter(source.charAt(wordEnd))) {
                wordEnd++;
            }
            if (wordEnd > pos && wordEnd < length && source.charAt(wordEnd) == '"'
                && BIT_STRING_BASES.contains(source.substring(pos, wordEnd).toLowerCase(Locale.ROOT))) {
                pos = wordEnd;
                stringBody(start);
                return TokenType.BIT_STRING_LITERAL;
            }
        }
        return TokenType.DECIMAL_LITERAL;
    }

    private TokenType basedLiteral(int start) {
        int base;
        try {
            base = Integer.parseInt(source.substring(start, pos).replace("_", ""));
        } catch (NumberFormatException e) {
            throw new LexException("Invalid base in based literal", lines.span(start, pos));
        }
        if (base < 2 || base > 16) {
            throw new LexException("Base " + base + " is outside 2..16", lines.span(start, pos));
        }
        pos++; // '#'
        digits(start, true);
        if (peekAt(0) == '.') {
            pos++;
            digits(start, true);
        }
        if (peekAt(0) != '#') {
            throw new LexException("Unterminated based literal", lines.span(start, pos));
        }
        pos++;
        exponent(start);
        return TokenType.BASED_LITERAL;
    }

    private boolean exponent(int start) {
        char e = peekAt(0);
        if (e != 'e' && e != 'E') {
            return false;
        }
        int sign = (peekAt(1) == '+' || peekAt(1) == '-') ? 1 : 0;
        if (!isDigit(peekAt(1 + sign))) {
            return false;
        }
        pos += 1 + sign;
        digits(start, false);
        return true;
    }

    private void digits(int start, boolean extended) {
        boolean sawDigit = false;
        boolean lastUnderscore = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (extended ? isExtendedDigit(c) : isDigit(c)) {
                sawDigit = true;
                lastUnderscore = false;
            } else if (c == '_' && sawDigit && !lastUnderscore) {
                lastUnderscore = true;
            } else {
                break;
            }
            pos++;
        }
        if (!sawDigit || lastUnderscore) {
            throw new LexException("Malformed numeric literal", lines.span(start, pos));
        }
    }

    private char peekAt(int offset) {
        int i = pos + offset;
        return i < length ? source.charAt(i) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isExtendedDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
