package com.hdltree.transform;

import com.hdltree.Span;
import com.hdltree.Token;
import com.hdltree.TokenType;
import com.hdltree.UnsupportedConstruct;
import com.hdltree.ast.Identifier;
import com.hdltree.forest.ParseTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The built children of one parse-tree node: tokens and AST values in source order, with
 * lookups by type and by position relative to marker tokens.
 */
final class Children {

    private final ParseTree tree;
    private final List<Object> values;
    private final TreeTransformer.Session session;

    Children(ParseTree tree, List<Object> values, TreeTransformer.Session session) {
        this.tree = tree;
        this.values = values;
        this.session = session;
    }

    String rule() {
        return tree.rule();
    }

    /**
     * True when the chosen production carries the given label.
     */
    boolean is(String label) {
        return tree.productionId().equals(tree.rule() + ":" + label);
    }

    String label() {
        String id = tree.productionId();
        int colon = id.indexOf(':');
        return colon < 0 ? null : id.substring(colon + 1);
    }

    Span span() {
        return tree.span();
    }

    List<Object> all() {
        return values;
    }

    boolean isEmpty() {
        return values.isEmpty();
    }

    void unsupported(UnsupportedConstruct construct) {
        session.unsupported(construct);
    }

    // ========================================================================
    // Tokens
    // ========================================================================

    List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Token token) {
                tokens.add(token);
            }
        }
        return List.copyOf(tokens);
    }

    Token token(TokenType... types) {
        for (Object value : values) {
            if (value instanceof Token token && matches(token, types)) {
                return token;
            }
        }
        return null;
    }

    boolean has(TokenType type) {
        return token(type) != null;
    }

    /**
     * Lower-case spelling of the first token of any of the given types, or null.
     */
    String keyword(TokenType... types) {
        Token token = token(types);
        return token == null ? null : token.lexeme().toLowerCase(Locale.ROOT);
    }

    /**
     * The token right after the first {@code marker}, or null.
     */
    Token tokenAfter(TokenType marker) {
        int at = indexOf(marker);
        if (at < 0) {
            return null;
        }
        for (int i = at + 1; i < values.size(); i++) {
            if (values.get(i) instanceof Token token) {
                return token;
            }
        }
        return null;
    }

    // ========================================================================
    // Nodes
    // ========================================================================

    <T> T node(Class<T> type) {
        return first(type, 0, values.size());
    }

    <T> List<T> nodes(Class<T> type) {
        return collect(type, 0, values.size());
    }

    /**
     * First value of {@code type} after the first {@code marker} token, or null when the
     * marker is absent.
     */
    <T> T nodeAfter(TokenType marker, Class<T> type) {
        int at = indexOf(marker);
        return at < 0 ? null : first(type, at + 1, values.size());
    }

    <T> List<T> nodesAfter(TokenType marker, Class<T> type) {
        int at = indexOf(marker);
        return at < 0 ? List.of() : collect(type, at + 1, values.size());
    }

    /**
     * Values of {@code type} before the first {@code marker} token, or all of them when the
     * marker is absent.
     */
    <T> List<T> nodesBefore(TokenType marker, Class<T> type) {
        int at = indexOf(marker);
        return collect(type, 0, at < 0 ? values.size() : at);
    }

    /**
     * A comma separated run of {@code type} values starting right after {@code marker}.
     */
    <T> List<T> listAfter(TokenType marker, Class<T> type) {
        int at = indexOf(marker);
        if (at < 0) {
            return List.of();
        }
        List<T> found = new ArrayList<>();
        for (int i = at + 1; i < values.size(); i++) {
            Object value = values.get(i);
            if (type.isInstance(value)) {
                found.add(type.cast(value));
            } else if (!(value instanceof Token token && token.is(TokenType.COMMA))) {
                break;
            }
        }
        return List.copyOf(found);
    }

    /**
     * An identifier directly followed by a colon at the start, or after the keyword opening a
     * generate alternative: a statement or alternative label.
     */
    Identifier leadingLabel() {
        int i = 0;
        if (!values.isEmpty() && values.get(0) instanceof Token first
            && (first.is(TokenType.IF) || first.is(TokenType.ELSIF) || first.is(TokenType.ELSE) || first.is(TokenType.WHEN))) {
            i = 1;
        }
        if (i + 1 < values.size() && values.get(i) instanceof Identifier id
            && values.get(i + 1) instanceof Token colon && colon.is(TokenType.COLON)) {
            return id;
        }
        return null;
    }

    /**
     * The repeated name after the last {@code end}, or null.
     */
    Identifier endLabel() {
        int end = -1;
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) instanceof Token token && token.is(TokenType.END)) {
                end = i;
            }
        }
        return end < 0 ? null : first(Identifier.class, end + 1, values.size());
    }

    private int indexOf(TokenType marker) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) instanceof Token token && token.is(marker)) {
                return i;
            }
        }
        return -1;
    }

    private <T> T first(Class<T> type, int from, int to) {
        for (int i = from; i < to; i++) {
            if (type.isInstance(values.get(i))) {
                return type.cast(values.get(i));
            }
        }
        return null;
    }

    private <T> List<T> collect(Class<T> type, int from, int to) {
        List<T> found = new ArrayList<>();
        for (int i = from; i < to; i++) {
            if (type.isInstance(values.get(i))) {
                found.add(type.cast(values.get(i)));
            }
        }
        return List.copyOf(found);
    }

    private static boolean matches(Token token, TokenType[] types) {
        for (TokenType type : types) {
            if (token.is(type)) {
                return true;
            }
        }
        return false;
    }
}
