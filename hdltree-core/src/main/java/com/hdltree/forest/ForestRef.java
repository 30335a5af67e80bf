package com.hdltree.forest;

/**
 * A non-terminal recognized over the token range {@code [start, end)}. Forest nodes are
 * identified by this triple alone, so equal refs denote the same set of derivations.
 */
public record ForestRef(int symbol, int start, int end) {

    public int length() {
        return end - start;
    }
}
