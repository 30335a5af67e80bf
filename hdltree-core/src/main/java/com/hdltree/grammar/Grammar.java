package com.hdltree.grammar;

import com.hdltree.TokenType;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A compiled, immutable context-free grammar.
 *
 * Instances are built once by {@link GrammarBuilder} and never change afterwards, so a single
 * instance is shared by every parse in the process.
 */
public final class Grammar {

    private final String[] names;
    private final boolean[] transparent;
    private final boolean[] collapse;
    private final boolean[] nullable;
    private final List<Production> productions;
    private final int[][] bySymbol;
    private final Map<String, Integer> ids;
    private final int start;

    Grammar(String[] names, boolean[] transparent, boolean[] collapse, boolean[] nullable,
            List<Production> productions, int[][] bySymbol, Map<String, Integer> ids, int start) {
        this.names = names;
        this.transparent = transparent;
        this.collapse = collapse;
        this.nullable = nullable;
        this.productions = Collections.unmodifiableList(productions);
        this.bySymbol = bySymbol;
        this.ids = Map.copyOf(ids);
        this.start = start;
    }

    /**
     * The VHDL-2008 grammar, compiled on first use.
     */
    public static Grammar vhdl() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        static final Grammar INSTANCE = VhdlGrammar.build();
    }

    // ========================================================================
    // Symbol encoding
    // ========================================================================

    public static boolean isTerminal(int symbol) {
        return symbol < 0;
    }

    public static TokenType terminal(int symbol) {
        return TokenType.values()[-symbol - 1];
    }

    static int encode(TokenType type) {
        return -(type.ordinal() + 1);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public int startSymbol() {
        return start;
    }

    public int symbolCount() {
        return names.length;
    }

    public String name(int symbol) {
        return isTerminal(symbol) ? terminal(symbol).describe() : names[symbol];
    }

    /**
     * @return the id of the named non-terminal
     * @throws IllegalArgumentException if no such rule exists
     */
    public int symbol(String name) {
        Integer id = ids.get(name);
        if (id == null) {
            throw new IllegalArgumentException("Unknown rule: " + name);
        }
        return id;
    }

    public boolean hasRule(String name) {
        return ids.containsKey(name);
    }

    /**
     * Transparent symbols splice their children into the parent parse-tree node.
     */
    public boolean isTransparent(int symbol) {
        return transparent[symbol];
    }

    /**
     * Collapsing symbols pass a lone child node through unchanged.
     */
    public boolean isCollapse(int symbol) {
        return collapse[symbol];
    }

    public boolean isNullable(int symbol) {
        return !isTerminal(symbol) && nullable[symbol];
    }

    public List<Production> productions() {
        return productions;
    }

    public Production production(int index) {
        return productions.get(index);
    }

    /**
     * Indexes into {@link #productions()} of every alternative of a non-terminal.
     */
    public int[] productionsOf(int symbol) {
        return bySymbol[symbol];
    }
}
