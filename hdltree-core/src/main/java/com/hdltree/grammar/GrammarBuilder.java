package com.hdltree.grammar;

import com.hdltree.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Grammar} from EBNF-style rule definitions.
 *
 * Items in a rule body are {@link TokenType} terminals, {@code String} references to other
 * rules, or the combinators {@link #opt}, {@link #star}, {@link #plus}, {@link #sepBy} and
 * {@link #oneOf}. Combinators are lowered to generated helper rules, which are transparent.
 *
 * <pre>{@code
 * GrammarBuilder g = new GrammarBuilder();
 * g.rule("use_clause").alt(USE, sepBy("selected_name", COMMA), SEMICOLON);
 * Grammar grammar = g.build("design_file");
 * }</pre>
 */
public final class GrammarBuilder {

    public sealed interface Element permits Ref, Term, Seq, Repeat, Choice {}

    record Ref(String name) implements Element {}

    record Term(TokenType type) implements Element {}

    public record Seq(List<Element> items) implements Element {}

    record Repeat(Seq body, int min, boolean single) implements Element {}

    record Choice(List<Seq> alternatives) implements Element {}

    private final Map<String, RuleBuilder> rules = new LinkedHashMap<>();

    // ========================================================================
    // Combinators
    // ========================================================================

    public static Seq seq(Object... items) {
        List<Element> elements = new ArrayList<>();
        for (Object item : items) {
            elements.add(element(item));
        }
        return new Seq(List.copyOf(elements));
    }

    /** Zero or one occurrence. */
    public static Element opt(Object... items) {
        return new Repeat(seq(items), 0, true);
    }

    /** Zero or more occurrences. */
    public static Element star(Object... items) {
        return new Repeat(seq(items), 0, false);
    }

    /** One or more occurrences. */
    public static Element plus(Object... items) {
        return new Repeat(seq(items), 1, false);
    }

    /** {@code item (separator item)*} */
    public static Element sepBy(Object item, TokenType separator) {
        return seq(item, star(separator, item));
    }

    /** Exactly one of the alternatives; use {@link #seq} for multi-item alternatives. */
    public static Element oneOf(Object... alternatives) {
        List<Seq> seqs = new ArrayList<>();
        for (Object alternative : alternatives) {
            Element element = element(alternative);
            seqs.add(element instanceof Seq s ? s : new Seq(List.of(element)));
        }
        return new Choice(List.copyOf(seqs));
    }

    private static Element element(Object item) {
        if (item instanceof Element e) {
            return e;
        }
        if (item instanceof TokenType t) {
            return new Term(t);
        }
        if (item instanceof String s) {
            return new Ref(s);
        }
        throw new IllegalArgumentException("Not a grammar item: " + item);
    }

    // ========================================================================
    // Rules
    // ========================================================================

    public RuleBuilder rule(String name) {
        if (rules.containsKey(name)) {
            throw new IllegalStateException("Duplicate rule: " + name);
        }
        RuleBuilder rule = new RuleBuilder(name);
        rules.put(name, rule);
        return rule;
    }

    public final class RuleBuilder {
        private final String name;
        private final List<Alternative> alternatives = new ArrayList<>();
        private boolean transparent;
        private boolean collapse;

        private RuleBuilder(String name) {
            this.name = name;
        }

        /** Splice this rule's children into its parent instead of creating a node. */
        public RuleBuilder inline() {
            this.transparent = true;
            return this;
        }

        /** Pass a single child node through instead of building a new one. */
        public RuleBuilder collapse() {
            this.collapse = true;
            return this;
        }

        public RuleBuilder alt(Object... items) {
            alternatives.add(new Alternative(seq(items)));
            return this;
        }

        public RuleBuilder label(String label) {
            last().label = label;
            return this;
        }

        public RuleBuilder priority(int priority) {
            last().priority = priority;
            return this;
        }

        public RuleBuilder preferredUnder(String... contexts) {
            last().preferredUnder = List.of(contexts);
            return this;
        }

        private Alternative last() {
            if (alternatives.isEmpty()) {
                throw new IllegalStateException("Rule " + name + " has no alternative yet");
            }
            return alternatives.get(alternatives.size() - 1);
        }
    }

    private static final class Alternative {
        final Seq body;
        String label;
        int priority;
        List<String> preferredUnder = List.of();

        Alternative(Seq body) {
            this.body = body;
        }
    }

    // ========================================================================
    // Compilation
    // ========================================================================

    private record PendingProduction(int lhs, int[] rhs, String id, int priority, List<String> preferredUnder) {}

    private record RepeatCheck(int helper, int[] body) {}

    /**
     * Lowers every rule and validates the result.
     *
     * @throws IllegalStateException if a rule is undefined, empty, or repeats a nullable body
     */
    public Grammar build(String startRule) {
        Map<String, Integer> ids = new HashMap<>();
        List<String> names = new ArrayList<>();
        List<Boolean> transparent = new ArrayList<>();
        List<Boolean> collapse = new ArrayList<>();
        for (RuleBuilder rule : rules.values()) {
            if (rule.alternatives.isEmpty()) {
                throw new IllegalStateException("Rule " + rule.name + " has no alternatives");
            }
            ids.put(rule.name, names.size());
            names.add(rule.name);
            transparent.add(rule.transparent);
            collapse.add(rule.collapse);
        }
        if (!ids.containsKey(startRule)) {
            throw new IllegalStateException("Start rule " + startRule + " is not defined");
        }

        Lowering lowering = new Lowering(ids, names, transparent, collapse);
        for (RuleBuilder rule : rules.values()) {
            int lhs = ids.get(rule.name);
            for (int i = 0; i < rule.alternatives.size(); i++) {
                Alternative alternative = rule.alternatives.get(i);
                String id = alternative.label != null ? rule.name + ":" + alternative.label : rule.name + "#" + i;
                int[] rhs = lowering.lower(alternative.body, rule.name);
                lowering.pending.add(new PendingProduction(lhs, rhs, id, alternative.priority, alternative.preferredUnder));
            }
        }

        int symbolCount = names.size();
        List<Production> productions = new ArrayList<>();
        List<List<Integer>> bySymbol = new ArrayList<>();
        for (int i = 0; i < symbolCount; i++) {
            bySymbol.add(new ArrayList<>());
        }
        for (PendingProduction p : lowering.pending) {
            int[] preferred = p.preferredUnder().stream().mapToInt(context -> {
                Integer id = ids.get(context);
                if (id == null) {
                    throw new IllegalStateException("Production " + p.id() + " prefers unknown rule " + context);
                }
                return id;
            }).toArray();
            Production production = new Production(productions.size(), p.lhs(), p.rhs(), p.id(), p.priority(), preferred);
            bySymbol.get(p.lhs()).add(production.index());
            productions.add(production);
        }

        boolean[] nullable = computeNullable(symbolCount, productions);
        for (RepeatCheck check : lowering.repeats) {
            if (Arrays.stream(check.body()).allMatch(s -> !Grammar.isTerminal(s) && nullable[s])) {
                throw new IllegalStateException("Repetition " + names.get(check.helper()) + " has a nullable body");
            }
        }

        int[][] index = new int[symbolCount][];
        for (int i = 0; i < symbolCount; i++) {
            index[i] = bySymbol.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        boolean[] transparentFlags = new boolean[symbolCount];
        boolean[] collapseFlags = new boolean[symbolCount];
        for (int i = 0; i < symbolCount; i++) {
            transparentFlags[i] = transparent.get(i);
            collapseFlags[i] = collapse.get(i);
        }
        return new Grammar(names.toArray(new String[0]), transparentFlags, collapseFlags, nullable,
            productions, index, ids, ids.get(startRule));
    }

    private static boolean[] computeNullable(int symbolCount, List<Production> productions) {
        boolean[] nullable = new boolean[symbolCount];
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : productions) {
                if (nullable[p.lhs()]) {
                    continue;
                }
                boolean all = true;
                for (int i = 0; i < p.length() && all; i++) {
                    int s = p.symbol(i);
                    all = !Grammar.isTerminal(s) && nullable[s];
                }
                if (all) {
                    nullable[p.lhs()] = true;
                    changed = true;
                }
            }
        }
        return nullable;
    }

    /**
     * Turns nested combinators into flat symbol sequences plus helper rules.
     */
    private static final class Lowering {
        final Map<String, Integer> ids;
        final List<String> names;
        final List<Boolean> transparent;
        final List<Boolean> collapse;
        final List<PendingProduction> pending = new ArrayList<>();
        final List<RepeatCheck> repeats = new ArrayList<>();
        final Map<String, Integer> helperCounts = new HashMap<>();

        Lowering(Map<String, Integer> ids, List<String> names, List<Boolean> transparent, List<Boolean> collapse) {
            this.ids = ids;
            this.names = names;
            this.transparent = transparent;
            this.collapse = collapse;
        }

        int[] lower(Seq seq, String owner) {
            List<Integer> out = new ArrayList<>();
            for (Element element : seq.items()) {
                lowerInto(element, owner, out);
            }
            return out.stream().mapToInt(Integer::intValue).toArray();
        }

        private void lowerInto(Element element, String owner, List<Integer> out) {
            if (element instanceof Term t) {
                out.add(Grammar.encode(t.type()));
            } else if (element instanceof Ref r) {
                Integer id = ids.get(r.name());
                if (id == null) {
                    throw new IllegalStateException("Rule " + owner + " references undefined rule " + r.name());
                }
                out.add(id);
            } else if (element instanceof Seq s) {
                for (Element item : s.items()) {
                    lowerInto(item, owner, out);
                }
            } else if (element instanceof Repeat r) {
                out.add(repeatHelper(r, owner));
            } else if (element instanceof Choice c) {
                out.add(choiceHelper(c, owner));
            }
        }

        private int newHelper(String owner) {
            int n = helperCounts.merge(owner, 1, Integer::sum);
            int id = names.size();
            String name = owner + "$" + n;
            names.add(name);
            ids.put(name, id);
            transparent.add(true);
            collapse.add(false);
            return id;
        }

        private int repeatHelper(Repeat repeat, String owner) {
            int helper = newHelper(owner);
            String name = names.get(helper);
            int[] body = lower(repeat.body(), owner);
            if (repeat.single()) {
                pending.add(new PendingProduction(helper, body, name + "#0", 0, List.of()));
                pending.add(new PendingProduction(helper, new int[0], name + "#1", 0, List.of()));
                return helper;
            }
            repeats.add(new RepeatCheck(helper, body));
            int[] more = new int[body.length + 1];
            more[0] = helper;
            System.arraycopy(body, 0, more, 1, body.length);
            // Left recursion keeps the Earley chart linear in the number of repetitions
            pending.add(new PendingProduction(helper, repeat.min() == 0 ? new int[0] : body, name + "#0", 0, List.of()));
            pending.add(new PendingProduction(helper, more, name + "#1", 0, List.of()));
            return helper;
        }

        private int choiceHelper(Choice choice, String owner) {
            int helper = newHelper(owner);
            String name = names.get(helper);
            for (int i = 0; i < choice.alternatives().size(); i++) {
                pending.add(new PendingProduction(helper, lower(choice.alternatives().get(i), owner), name + "#" + i, 0, List.of()));
            }
            return helper;
        }
    }
}
