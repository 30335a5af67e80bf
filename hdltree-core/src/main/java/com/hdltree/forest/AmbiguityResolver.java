package com.hdltree.forest;

import com.hdltree.AmbiguityException;
import com.hdltree.ParseException;
import com.hdltree.Token;
import com.hdltree.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Picks one derivation per forest node, top-down, and builds the canonical {@link ParseTree}.
 *
 * The walk uses an explicit stack, so arbitrarily deep input never touches the call stack;
 * nesting of named nodes beyond {@code maxDepth} is rejected instead.
 */
public final class AmbiguityResolver {

    private static final Logger logger = LoggerFactory.getLogger(AmbiguityResolver.class);

    private final int maxDepth;

    public AmbiguityResolver(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /** A forest node on the current path, used to detect unit cycles. */
    private record Path(ForestRef ref, Path parent) {}

    private record Task(Object item, ParseTree target, ResolutionContext context, Path path) {}

    /**
     * @throws AmbiguityException if a node has two best derivations
     * @throws ParseException     if the tree nests deeper than the configured limit
     */
    public ParseTree resolve(ParseForest forest) {
        Grammar grammar = forest.grammar();
        ForestRef rootRef = forest.root();
        Derivation rootDerivation = choose(forest, rootRef, ResolutionContext.ROOT, null);
        ParseTree root = new ParseTree(rootRef.symbol(), grammar.name(rootRef.symbol()),
            rootDerivation.production().id(), rootRef.start(), rootRef.end(),
            forest.span(rootRef.start(), rootRef.end()));
        ResolutionContext rootContext = ResolutionContext.ROOT.enter(rootRef.symbol());
        Path rootPath = new Path(rootRef, null);

        Deque<Task> stack = new ArrayDeque<>();
        pushChildren(stack, rootDerivation, root, rootContext, rootPath);

        while (!stack.isEmpty()) {
            Task task = stack.pop();
            if (task.item() instanceof Token token) {
                task.target().add(token);
                continue;
            }
            ForestRef ref = (ForestRef) task.item();
            Derivation chosen = choose(forest, ref, task.context(), task.path());
            Path path = new Path(ref, task.path());
            if (grammar.isTransparent(ref.symbol())) {
                pushChildren(stack, chosen, task.target(), task.context(), path);
                continue;
            }
            ResolutionContext context = task.context().enter(ref.symbol());
            if (context.depth() > maxDepth) {
                throw new ParseException("Nesting deeper than " + maxDepth + " levels",
                    forest.span(ref.start(), ref.end()));
            }
            ParseTree node = new ParseTree(ref.symbol(), grammar.name(ref.symbol()), chosen.production().id(),
                ref.start(), ref.end(), forest.span(ref.start(), ref.end()));
            task.target().add(node);
            pushChildren(stack, chosen, node, context, path);
        }
        return root;
    }

    private static void pushChildren(Deque<Task> stack, Derivation derivation, ParseTree target,
                                     ResolutionContext context, Path path) {
        List<Object> children = derivation.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Task(children.get(i), target, context, path));
        }
    }

    private Derivation choose(ParseForest forest, ForestRef ref, ResolutionContext context, Path path) {
        List<Derivation> candidates = new ArrayList<>();
        for (Derivation d : forest.derivations(ref)) {
            if (!reentersAncestor(d, ref, path)) {
                candidates.add(d);
            }
        }
        if (candidates.isEmpty()) {
            throw new ParseException("No acyclic derivation of " + forest.grammar().name(ref.symbol()),
                forest.span(ref.start(), ref.end()));
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        candidates.sort((a, b) -> TieBreakRules.compare(a, b, context));
        Derivation best = candidates.get(0);
        if (TieBreakRules.compare(best, candidates.get(1), context) == 0) {
            List<String> ids = new ArrayList<>();
            for (Derivation d : candidates) {
                if (TieBreakRules.compare(best, d, context) == 0 && !ids.contains(d.production().id())) {
                    ids.add(d.production().id());
                }
            }
            throw new AmbiguityException("Ambiguous " + forest.grammar().name(ref.symbol()),
                forest.span(ref.start(), ref.end()), ids);
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Resolved {} at {} to {} over {} alternatives", forest.grammar().name(ref.symbol()),
                forest.span(ref.start(), ref.end()).position(), best.production().id(), candidates.size() - 1);
        }
        return best;
    }

    /**
     * A child covering the same range as the node can only repeat a node already on the path
     * through unit productions; such derivations would never terminate.
     */
    private static boolean reentersAncestor(Derivation derivation, ForestRef ref, Path path) {
        for (Object child : derivation.children()) {
            if (child instanceof ForestRef c && c.start() == ref.start() && c.end() == ref.end()) {
                if (c.equals(ref)) {
                    return true;
                }
                for (Path p = path; p != null && p.ref().start() == ref.start() && p.ref().end() == ref.end(); p = p.parent()) {
                    if (p.ref().equals(c)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
