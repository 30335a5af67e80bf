package com.hdltree;

/**
 * Base class for failures that point at a location in the parsed source.
 */
public abstract class SourceException extends RuntimeException {

    private final transient Span span;

    protected SourceException(String message, Span span) {
        super(message + " at " + span.position());
        this.span = span;
    }

    protected SourceException(String message, Span span, Throwable cause) {
        super(message + " at " + span.position(), cause);
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
