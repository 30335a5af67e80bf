package com.hdltree.forest;

import com.hdltree.Span;
import com.hdltree.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A node of the canonical concrete tree chosen from the forest. Children are tokens and
 * nested trees in source order; transparent helper rules have already been spliced away.
 */
public final class ParseTree {

    private final int symbol;
    private final String rule;
    private final String productionId;
    private final int startToken;
    private final int endToken;
    private final Span span;
    private final List<Object> children = new ArrayList<>();

    ParseTree(int symbol, String rule, String productionId, int startToken, int endToken, Span span) {
        this.symbol = symbol;
        this.rule = rule;
        this.productionId = productionId;
        this.startToken = startToken;
        this.endToken = endToken;
        this.span = span;
    }

    public int symbol() {
        return symbol;
    }

    public String rule() {
        return rule;
    }

    public String productionId() {
        return productionId;
    }

    /**
     * Index of the first covered token.
     */
    public int startToken() {
        return startToken;
    }

    /**
     * Index one past the last covered token.
     */
    public int endToken() {
        return endToken;
    }

    public Span span() {
        return span;
    }

    public List<Object> children() {
        return Collections.unmodifiableList(children);
    }

    void add(Object child) {
        children.add(child);
    }

    /**
     * Indented outline of the tree, one node or token per line.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[] {this, 0});
        while (!stack.isEmpty()) {
            Object[] entry = stack.pop();
            int indent = (Integer) entry[1];
            sb.append("  ".repeat(indent));
            if (entry[0] instanceof ParseTree tree) {
                sb.append(tree.productionId).append(' ').append(tree.span.position()).append('\n');
                for (int i = tree.children.size() - 1; i >= 0; i--) {
                    stack.push(new Object[] {tree.children.get(i), indent + 1});
                }
            } else {
                Token token = (Token) entry[0];
                sb.append(token.type()).append(" '").append(token.lexeme()).append("'\n");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return productionId + "[" + startToken + ".." + endToken + ")";
    }
}
