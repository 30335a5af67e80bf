package com.hdltree.grammar;

import java.util.Arrays;

/**
 * One alternative of a grammar rule, with its tie-break metadata.
 *
 * Right-hand-side symbols are encoded as ints: non-negative values are non-terminal ids,
 * negative values are terminals (see {@link Grammar#terminal(int)}).
 */
public final class Production {

    private final int index;
    private final int lhs;
    private final int[] rhs;
    private final String id;
    private final int priority;
    private final int[] preferredUnder;

    Production(int index, int lhs, int[] rhs, String id, int priority, int[] preferredUnder) {
        this.index = index;
        this.lhs = lhs;
        this.rhs = rhs;
        this.id = id;
        this.priority = priority;
        this.preferredUnder = preferredUnder;
    }

    /**
     * Position in {@link Grammar#productions()}.
     */
    public int index() {
        return index;
    }

    public int lhs() {
        return lhs;
    }

    public int length() {
        return rhs.length;
    }

    public int symbol(int position) {
        return rhs[position];
    }

    /**
     * Stable identifier used in diagnostics, {@code rule:label} or {@code rule#n}.
     */
    public String id() {
        return id;
    }

    /**
     * Higher wins when two derivations of one span compete.
     */
    public int priority() {
        return priority;
    }

    /**
     * Non-terminal ids under which this production is the preferred reading.
     */
    public boolean isPreferredUnder(int symbol) {
        for (int s : preferredUnder) {
            if (s == symbol) {
                return true;
            }
        }
        return false;
    }

    public boolean hasContextPreference() {
        return preferredUnder.length > 0;
    }

    @Override
    public String toString() {
        return id + Arrays.toString(rhs);
    }
}
