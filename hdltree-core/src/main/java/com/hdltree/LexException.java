package com.hdltree;

/**
 * A character sequence matched no lexical rule.
 */
public class LexException extends SourceException {

    public LexException(String message, Span span) {
        super(message, span);
    }
}
