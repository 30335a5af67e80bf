package com.hdltree;

/**
 * Thrown by strict transformation when the input contains an {@link UnsupportedConstruct}.
 * Lenient callers collect the construct instead.
 */
public class UnsupportedConstructException extends SourceException {

    private final transient UnsupportedConstruct construct;

    public UnsupportedConstructException(UnsupportedConstruct construct) {
        super("Unsupported " + construct.kind() + ": " + construct.reason(), construct.span());
        this.construct = construct;
    }

    public UnsupportedConstruct getConstruct() {
        return construct;
    }
}
