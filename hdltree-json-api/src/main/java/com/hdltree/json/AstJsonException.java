package com.hdltree.json;

/**
 * A node or extraction result could not be written as JSON or read back from it.
 * The message names what was being converted, followed by the underlying problem.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(cause.getMessage() == null ? message : message + ": " + cause.getMessage(), cause);
    }
}
