package com.hdltree;

/**
 * Limits and modes for one {@link VhdlParser}.
 *
 * @param maxDepth       deepest nesting of named constructs accepted by the resolver and transformer
 * @param maxDerivations most derivations kept for a single forest node before giving up
 * @param lenient        record unsupported constructs instead of failing on them
 */
public record ParserOptions(int maxDepth, int maxDerivations, boolean lenient) {

    public static final ParserOptions DEFAULTS = new ParserOptions(2000, 64, false);

    public ParserOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxDerivations < 1) {
            throw new IllegalArgumentException("maxDerivations must be positive: " + maxDerivations);
        }
    }

    public ParserOptions withMaxDepth(int maxDepth) {
        return new ParserOptions(maxDepth, maxDerivations, lenient);
    }

    public ParserOptions withMaxDerivations(int maxDerivations) {
        return new ParserOptions(maxDepth, maxDerivations, lenient);
    }

    public ParserOptions withLenient(boolean lenient) {
        return new ParserOptions(maxDepth, maxDerivations, lenient);
    }
}
