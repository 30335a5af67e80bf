package com.hdltree.transform;

import com.hdltree.ParseException;
import com.hdltree.ParseResult;
import com.hdltree.Token;
import com.hdltree.UnsupportedConstruct;
import com.hdltree.UnsupportedConstructException;
import com.hdltree.ast.DesignFile;
import com.hdltree.forest.ParseTree;
import com.hdltree.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Folds a canonical {@link ParseTree} into the typed AST.
 *
 * The fold runs on an explicit stack, so deeply nested expressions cost heap rather than
 * call stack. Nesting beyond {@code maxDepth} is still rejected with a {@link ParseException}.
 */
public final class TreeTransformer {

    private static final Logger logger = LoggerFactory.getLogger(TreeTransformer.class);

    private static final Map<String, AstBuilder> BUILDERS = VhdlAstBuilders.create();

    private final Grammar grammar;
    private final int maxDepth;
    private final boolean lenient;

    public TreeTransformer(Grammar grammar, int maxDepth, boolean lenient) {
        this.grammar = grammar;
        this.maxDepth = maxDepth;
        this.lenient = lenient;
    }

    /**
     * Rule names this transformer knows how to build.
     */
    public static boolean supports(String rule) {
        return BUILDERS.containsKey(rule);
    }

    /**
     * @param root the tree for {@code design_file}
     * @param eof  end-of-input token, kept so exact reconstruction reproduces trailing trivia
     */
    public ParseResult transform(ParseTree root, Token eof) {
        Session session = new Session(lenient);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));
        Object result = null;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<Object> children = frame.tree.children();
            if (frame.next < children.size()) {
                Object child = children.get(frame.next++);
                if (child instanceof ParseTree nested) {
                    if (frame.depth >= maxDepth) {
                        throw new ParseException("Nesting deeper than " + maxDepth + " levels", nested.span());
                    }
                    stack.push(new Frame(nested, frame.depth + 1));
                } else {
                    frame.values.add(child);
                }
                continue;
            }

            stack.pop();
            if (frame.tree == root && eof != null) {
                frame.values.add(eof);
            }
            Object built = build(frame, session);
            if (stack.isEmpty()) {
                result = built;
            } else if (built != VhdlAstBuilders.DROPPED) {
                stack.peek().values.add(built);
            }
        }

        if (!(result instanceof DesignFile designFile)) {
            throw new IllegalStateException("Root rule " + root.rule() + " did not build a design file");
        }
        if (!session.unsupported.isEmpty()) {
            logger.debug("Dropped {} unsupported construct(s)", session.unsupported.size());
        }
        return new ParseResult(designFile, List.copyOf(session.unsupported));
    }

    private Object build(Frame frame, Session session) {
        ParseTree tree = frame.tree;
        List<Object> values = frame.values;
        if (grammar.isCollapse(tree.symbol()) && values.size() == 1 && !(values.get(0) instanceof Token)) {
            return values.get(0);
        }
        AstBuilder builder = BUILDERS.get(tree.rule());
        if (builder == null) {
            throw new IllegalStateException("No AST builder for rule " + tree.rule());
        }
        return builder.build(new Children(tree, values, session));
    }

    private static final class Frame {
        final ParseTree tree;
        final int depth;
        final List<Object> values = new ArrayList<>();
        int next;

        Frame(ParseTree tree, int depth) {
            this.tree = tree;
            this.depth = depth;
        }
    }

    /**
     * Per-transformation state shared with the builders.
     */
    static final class Session {
        private final boolean lenient;
        private final List<UnsupportedConstruct> unsupported = new ArrayList<>();

        Session(boolean lenient) {
            this.lenient = lenient;
        }

        void unsupported(UnsupportedConstruct construct) {
            if (!lenient) {
                throw new UnsupportedConstructException(construct);
            }
            logger.warn("Skipping {}", construct);
            unsupported.add(construct);
        }
    }
}
