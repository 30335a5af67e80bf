package com.hdltree.forest;

import com.hdltree.grammar.Production;

/**
 * The chain of already-resolved named ancestors above a forest node, nearest first.
 * Immutable; {@link #enter} returns a new, longer chain.
 */
public final class ResolutionContext {

    public static final ResolutionContext ROOT = new ResolutionContext(-1, null, 0);

    private final int symbol;
    private final ResolutionContext parent;
    private final int depth;

    private ResolutionContext(int symbol, ResolutionContext parent, int depth) {
        this.symbol = symbol;
        this.parent = parent;
        this.depth = depth;
    }

    public ResolutionContext enter(int symbol) {
        return new ResolutionContext(symbol, this, depth + 1);
    }

    /**
     * Number of named ancestors.
     */
    public int depth() {
        return depth;
    }

    /**
     * Distance to the nearest ancestor under which {@code production} is preferred, counting
     * the immediate parent as 1.
     *
     * @return the distance, or {@link Integer#MAX_VALUE} if no ancestor matches
     */
    public int distance(Production production) {
        if (!production.hasContextPreference()) {
            return Integer.MAX_VALUE;
        }
        int distance = 1;
        for (ResolutionContext c = this; c.parent != null; c = c.parent) {
            if (production.isPreferredUnder(c.symbol)) {
                return distance;
            }
            distance++;
        }
        return Integer.MAX_VALUE;
    }
}
