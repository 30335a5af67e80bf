package com.hdltree.forest;

import com.hdltree.ParseException;
import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.TokenType;
import com.hdltree.grammar.Grammar;
import com.hdltree.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Chart parser over a token stream. Recognition keeps every derivation alive, so the result
 * is a {@link ParseForest} rather than a single tree.
 *
 * Nullable non-terminals are handled by advancing over them at prediction time
 * (Aycock and Horspool), which keeps completion of empty rules out of the main loop.
 */
public final class EarleyParser {

    private static final Logger logger = LoggerFactory.getLogger(EarleyParser.class);

    private static final int MAX_EXPECTED = 12;

    private final Grammar grammar;
    private final int maxDerivations;

    public EarleyParser(Grammar grammar) {
        this(grammar, 64);
    }

    public EarleyParser(Grammar grammar, int maxDerivations) {
        this.grammar = grammar;
        this.maxDerivations = maxDerivations;
    }

    /**
     * @param tokens lexer output; a trailing {@code EOF} token is split off and kept for
     *               error reporting
     * @throws ParseException at the first token that no production can accept
     */
    public ParseForest parse(List<Token> tokens) {
        long started = System.nanoTime();
        Token eof = null;
        List<Token> input = tokens;
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            eof = tokens.get(tokens.size() - 1);
            input = tokens.subList(0, tokens.size() - 1);
        }
        int n = input.size();

        ItemSet[] sets = new ItemSet[n + 1];
        for (int i = 0; i <= n; i++) {
            sets[i] = new ItemSet();
        }
        int start = grammar.startSymbol();
        predict(sets[0], start, 0);

        for (int i = 0; i <= n; i++) {
            ItemSet set = sets[i];
            Token next = i < n ? input.get(i) : null;
            for (int k = 0; k < set.size(); k++) {
                long item = set.get(k);
                Production p = grammar.production(ItemSet.production(item));
                int dot = ItemSet.dot(item);
                int origin = ItemSet.origin(item);

                if (dot == p.length()) {
                    set.complete(p.lhs(), origin);
                    if (origin != i) {
                        for (long parent : sets[origin].waitingOn(p.lhs())) {
                            set.add(advance(parent));
                        }
                    }
                    continue;
                }

                int symbol = p.symbol(dot);
                if (Grammar.isTerminal(symbol)) {
                    if (next != null && next.type() == Grammar.terminal(symbol)) {
                        sets[i + 1].add(advance(item));
                    }
                } else {
                    if (set.await(symbol, item)) {
                        predict(set, symbol, i);
                    }
                    if (grammar.isNullable(symbol)) {
                        set.add(advance(item));
                    }
                }
            }
            if (i < n && sets[i + 1].isEmpty()) {
                throw syntaxError(input, i, input.get(i), set);
            }
        }

        if (!accepts(sets[n], start)) {
            Token at = eof != null ? eof : syntheticEnd(input);
            throw syntaxError(input, n, at, sets[n]);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Recognized {} tokens in {} ms", n, (System.nanoTime() - started) / 1_000_000);
        }
        return new ParseForest(grammar, input, eof, sets, maxDerivations);
    }

    private void predict(ItemSet set, int symbol, int position) {
        for (int production : grammar.productionsOf(symbol)) {
            set.add(ItemSet.item(production, 0, position));
        }
    }

    private static long advance(long item) {
        return ItemSet.item(ItemSet.production(item), ItemSet.dot(item) + 1, ItemSet.origin(item));
    }

    private boolean accepts(ItemSet last, int start) {
        for (int production : grammar.productionsOf(start)) {
            Production p = grammar.production(production);
            if (last.contains(ItemSet.item(production, p.length(), 0))) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // Diagnostics
    // ========================================================================

    private ParseException syntaxError(List<Token> input, int index, Token offending, ItemSet set) {
        TreeSet<String> expected = new TreeSet<>();
        for (int k = 0; k < set.size(); k++) {
            long item = set.get(k);
            Production p = grammar.production(ItemSet.production(item));
            int dot = ItemSet.dot(item);
            if (dot < p.length() && Grammar.isTerminal(p.symbol(dot))) {
                expected.add(Grammar.terminal(p.symbol(dot)).describe());
            }
        }
        String message = offending.is(TokenType.EOF)
            ? "Unexpected end of input"
            : "Unexpected " + describe(offending);
        if (!expected.isEmpty()) {
            message += ", expected " + expectedList(expected);
        }
        Span span = Span.cover(statementStart(input, index, offending).span(), offending.span());
        return new ParseException(message, span, offending);
    }

    private static String describe(Token token) {
        TokenType type = token.type();
        return type.text() != null ? type.describe() : type.describe() + " '" + token.lexeme() + "'";
    }

    private static String expectedList(TreeSet<String> expected) {
        List<String> shown = new ArrayList<>(expected);
        String list = shown.stream().limit(MAX_EXPECTED).collect(Collectors.joining(", "));
        if (shown.size() > MAX_EXPECTED) {
            list += " or " + (shown.size() - MAX_EXPECTED) + " more";
        }
        return shown.size() == 1 ? list : "one of " + list;
    }

    /**
     * The first token of the statement holding {@code index}: the token after the previous
     * {@code ;}, {@code is}, {@code begin} or {@code then}.
     */
    private static Token statementStart(List<Token> input, int index, Token offending) {
        for (int i = index - 1; i >= 0; i--) {
            TokenType type = input.get(i).type();
            if (type == TokenType.SEMICOLON || type == TokenType.IS
                || type == TokenType.BEGIN || type == TokenType.THEN) {
                return i + 1 < index ? input.get(i + 1) : offending;
            }
        }
        return input.isEmpty() || index == 0 ? offending : input.get(0);
    }

    private static Token syntheticEnd(List<Token> input) {
        if (input.isEmpty()) {
            return new Token(TokenType.EOF, "", "", Span.empty(0, 1, 0));
        }
        Span last = input.get(input.size() - 1).span();
        return new Token(TokenType.EOF, "", "", Span.empty(last.end(), last.endLine(), last.endColumn()));
    }
}
