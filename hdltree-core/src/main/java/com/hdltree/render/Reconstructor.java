package com.hdltree.render;

import com.hdltree.Lexer;
import com.hdltree.ReconstructionMismatchException;
import com.hdltree.Token;
import com.hdltree.TokenType;
import com.hdltree.ast.DesignFile;
import com.hdltree.ast.Node;
import com.hdltree.ast.Nodes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Turns an AST back into source text from the tokens stored on its nodes.
 */
public final class Reconstructor {

    public enum Mode {
        /** Original separators, comments included. */
        EXACT,
        /** Each separator reduced to a newline, a space, or nothing. */
        NORMALIZED
    }

    private Reconstructor() {
    }

    public static String render(Node node) {
        return render(node, Mode.EXACT);
    }

    /**
     * Renders {@code node}. In {@link Mode#EXACT} a {@link DesignFile} reproduces its source
     * byte for byte; for other nodes the trivia before the first token is left out.
     */
    public static String render(Node node, Mode mode) {
        List<Token> tokens = tokens(node);
        StringBuilder sb = new StringBuilder();
        boolean whole = node instanceof DesignFile;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (i > 0 || whole && mode == Mode.EXACT) {
                sb.append(mode == Mode.EXACT ? token.leading() : separator(token.leading()));
            }
            sb.append(token.lexeme());
        }
        return sb.toString();
    }

    /**
     * Single-line text of a node with every separator reduced to at most one space, as used
     * for type and default-value summaries.
     */
    public static String text(Node node) {
        List<Token> tokens = tokens(node);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.EOF)) {
                continue;
            }
            if (i > 0 && !token.leading().isEmpty()) {
                sb.append(' ');
            }
            sb.append(token.lexeme());
        }
        return sb.toString().trim();
    }

    /**
     * Every token stored under {@code node}, in source order.
     */
    public static List<Token> tokens(Node node) {
        List<Token> out = new ArrayList<>();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Object item = stack.pop();
            if (item instanceof Token token) {
                out.add(token);
                continue;
            }
            Node current = (Node) item;
            List<Object> parts = new ArrayList<>(current.tokens());
            parts.addAll(Nodes.children(current));
            parts.sort(Comparator.comparingInt(Reconstructor::start));
            for (int i = parts.size() - 1; i >= 0; i--) {
                stack.push(parts.get(i));
            }
        }
        return out;
    }

    /**
     * Checks that the normalized rendering of {@code file} lexes to the same tokens as
     * {@code source}.
     *
     * @throws ReconstructionMismatchException at the first differing token
     */
    public static void verify(String source, DesignFile file) {
        List<Token> expected = Lexer.tokenize(source);
        List<Token> actual = Lexer.tokenize(render(file, Mode.NORMALIZED));
        int count = Math.max(expected.size(), actual.size());
        for (int i = 0; i < count; i++) {
            Token e = i < expected.size() ? expected.get(i) : null;
            Token a = i < actual.size() ? actual.get(i) : null;
            if (e == null || a == null || !e.sameText(a)) {
                throw new ReconstructionMismatchException(i, e, a);
            }
        }
    }

    private static String separator(String leading) {
        if (leading.isEmpty()) {
            return "";
        }
        return leading.indexOf('\n') >= 0 || leading.indexOf('\r') >= 0 ? "\n" : " ";
    }

    private static int start(Object part) {
        return part instanceof Token token ? token.position() : ((Node) part).span().start();
    }
}
