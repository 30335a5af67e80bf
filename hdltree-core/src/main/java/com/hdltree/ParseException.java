package com.hdltree;

/**
 * The token stream does not conform to the grammar, or a parse could not be completed.
 */
public class ParseException extends SourceException {

    private final transient Token token;

    public ParseException(String message, Span span, Token token) {
        super(message, span);
        this.token = token;
    }

    public ParseException(String message, Span span) {
        this(message, span, (Token) null);
    }

    public ParseException(String message, Span span, Throwable cause) {
        super(message, span, cause);
        this.token = null;
    }

    /**
     * The offending token, when the failure is tied to one.
     */
    public Token getToken() {
        return token;
    }
}
