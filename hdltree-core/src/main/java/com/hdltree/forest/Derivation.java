package com.hdltree.forest;

import com.hdltree.Token;
import com.hdltree.grammar.Production;

import java.util.List;

/**
 * One way of deriving a forest node: a production and its matched children, each either a
 * {@link Token} or a {@link ForestRef}.
 */
public record Derivation(Production production, List<Object> children) {

    public Derivation {
        children = List.copyOf(children);
    }

    /**
     * Number of tokens covered by the child at {@code index}.
     */
    public int childLength(int index) {
        Object child = children.get(index);
        return child instanceof ForestRef ref ? ref.length() : 1;
    }

    @Override
    public String toString() {
        return production.id() + children;
    }
}
