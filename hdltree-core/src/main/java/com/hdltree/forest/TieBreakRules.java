package com.hdltree.forest;

/**
 * Orders competing derivations of one forest node. Rules are applied in sequence and the
 * first that separates the candidates decides:
 *
 * <ol>
 *   <li>higher production priority wins;</li>
 *   <li>comparing children left to right, the first child whose token length differs
 *       decides, and the longer one wins;</li>
 *   <li>the production preferred under the nearer resolved ancestor wins.</li>
 * </ol>
 *
 * The ordering is total over derivations and depends on nothing but its arguments.
 */
public final class TieBreakRules {

    private TieBreakRules() {
    }

    /**
     * @return a negative number if {@code a} is preferred, positive if {@code b} is, and zero
     *         if no rule separates them
     */
    public static int compare(Derivation a, Derivation b, ResolutionContext context) {
        int byPriority = Integer.compare(b.production().priority(), a.production().priority());
        if (byPriority != 0) {
            return byPriority;
        }
        int bySpan = compareSpans(a, b);
        if (bySpan != 0) {
            return bySpan;
        }
        return Integer.compare(context.distance(a.production()), context.distance(b.production()));
    }

    static int compareSpans(Derivation a, Derivation b) {
        int count = Math.min(a.children().size(), b.children().size());
        for (int i = 0; i < count; i++) {
            int diff = Integer.compare(b.childLength(i), a.childLength(i));
            if (diff != 0) {
                return diff;
            }
        }
        return 0;
    }
}
