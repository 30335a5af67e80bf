package com.hdltree;

/**
 * Rendered text did not reproduce the token stream of its source. This is a transformer
 * bug rather than a problem with the input.
 */
public class ReconstructionMismatchException extends IllegalStateException {

    private final int tokenIndex;
    private final Token expected;
    private final Token actual;

    public ReconstructionMismatchException(int tokenIndex, Token expected, Token actual) {
        super("Reconstruction differs at token " + tokenIndex + ": expected "
            + (expected == null ? "end of input" : expected) + " but rendered "
            + (actual == null ? "end of input" : actual));
        this.tokenIndex = tokenIndex;
        this.expected = expected;
        this.actual = actual;
    }

    public int getTokenIndex() {
        return tokenIndex;
    }

    public Token getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }
}
