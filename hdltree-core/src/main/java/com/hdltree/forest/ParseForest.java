package com.hdltree.forest;

import com.hdltree.AmbiguityException;
import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.grammar.Grammar;
import com.hdltree.grammar.Production;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Every parse of a token stream, kept as the Earley chart and unpacked on demand.
 *
 * {@link #derivations(ForestRef)} reconstructs the alternatives of one node from the chart
 * and caches them, so only nodes the resolver actually visits are ever materialized.
 */
public final class ParseForest {

    private final Grammar grammar;
    private final List<Token> tokens;
    private final Token eof;
    private final ItemSet[] sets;
    private final int maxDerivations;
    private final Map<ForestRef, List<Derivation>> cache = new HashMap<>();

    ParseForest(Grammar grammar, List<Token> tokens, Token eof, ItemSet[] sets, int maxDerivations) {
        this.grammar = grammar;
        this.tokens = tokens;
        this.eof = eof;
        this.sets = sets;
        this.maxDerivations = maxDerivations;
    }

    public Grammar grammar() {
        return grammar;
    }

    /**
     * The parsed tokens, without the end-of-input marker.
     */
    public List<Token> tokens() {
        return tokens;
    }

    /**
     * The end-of-input token, or null if the input had none.
     */
    public Token eof() {
        return eof;
    }

    public ForestRef root() {
        return new ForestRef(grammar.startSymbol(), 0, tokens.size());
    }

    /**
     * Source span of a token range; an empty range maps to an empty span at its position.
     */
    public Span span(int start, int end) {
        if (start < end) {
            return Span.cover(tokens.get(start).span(), tokens.get(end - 1).span());
        }
        if (start < tokens.size()) {
            Span at = tokens.get(start).span();
            return Span.empty(at.start(), at.line(), at.column());
        }
        if (eof != null) {
            return eof.span();
        }
        if (tokens.isEmpty()) {
            return Span.empty(0, 1, 0);
        }
        Span last = tokens.get(tokens.size() - 1).span();
        return Span.empty(last.end(), last.endLine(), last.endColumn());
    }

    /**
     * All derivations of {@code ref}, in production order.
     *
     * @throws AmbiguityException if the node has more than the configured number of derivations
     */
    public List<Derivation> derivations(ForestRef ref) {
        List<Derivation> cached = cache.get(ref);
        if (cached != null) {
            return cached;
        }
        List<Derivation> result = new ArrayList<>();
        for (int index : grammar.productionsOf(ref.symbol())) {
            Production p = grammar.production(index);
            if (sets[ref.end()].contains(ItemSet.item(index, p.length(), ref.start()))) {
                unpack(p, p.length(), ref.start(), ref.end(), new ArrayDeque<>(), result, ref);
            }
        }
        result = Collections.unmodifiableList(result);
        cache.put(ref, result);
        return result;
    }

    /**
     * Walks a completed item backwards, splitting the range at every point where the chart
     * shows both the shorter item and a recognition of the symbol before the dot.
     */
    private void unpack(Production p, int dot, int start, int end, Deque<Object> suffix,
                        List<Derivation> out, ForestRef ref) {
        if (dot == 0) {
            if (start == end) {
                out.add(new Derivation(p, new ArrayList<>(suffix)));
                if (out.size() > maxDerivations) {
                    throw new AmbiguityException("More than " + maxDerivations + " derivations of "
                        + grammar.name(ref.symbol()), span(ref.start(), ref.end()), ids(out));
                }
            }
            return;
        }
        int symbol = p.symbol(dot - 1);
        long shorter;
        if (Grammar.isTerminal(symbol)) {
            if (end <= start || tokens.get(end - 1).type() != Grammar.terminal(symbol)) {
                return;
            }
            shorter = ItemSet.item(p.index(), dot - 1, start);
            if (sets[end - 1].contains(shorter)) {
                suffix.addFirst(tokens.get(end - 1));
                unpack(p, dot - 1, start, end - 1, suffix, out, ref);
                suffix.removeFirst();
            }
            return;
        }
        shorter = ItemSet.item(p.index(), dot - 1, start);
        for (int middle : sets[end].completedOrigins(symbol)) {
            if (middle < start) {
                continue;
            }
            if (sets[middle].contains(shorter)) {
                suffix.addFirst(new ForestRef(symbol, middle, end));
                unpack(p, dot - 1, start, middle, suffix, out, ref);
                suffix.removeFirst();
            }
        }
    }

    private static List<String> ids(List<Derivation> derivations) {
        List<String> ids = new ArrayList<>();
        for (Derivation d : derivations) {
            if (!ids.contains(d.production().id())) {
                ids.add(d.production().id());
            }
        }
        return ids;
    }
}
