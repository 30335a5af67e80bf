package com.hdltree;

/**
 * A lexical token.
 *
 * @param type    the token kind
 * @param lexeme  exact source spelling, case preserved
 * @param leading whitespace and comments consumed immediately before the token
 * @param span    location of the lexeme (the leading text is not included)
 */
public record Token(TokenType type, String lexeme, String leading, Span span) {

    public int position() {
        return span.start();
    }

    public int endPosition() {
        return span.end();
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * Same kind and spelling, ignoring location and surrounding trivia.
     */
    public boolean sameText(Token other) {
        return type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")@" + span.position();
    }
}
