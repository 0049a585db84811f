/*@LICENSE@
 */
package org.tinyfa.regex;

import static org.tinyfa.regex.Misc.disjoint;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an epsilon-free NFA over an input by tracking the set of all states it
 * could be in - the subset construction, done lazily one input char at a time
 * instead of up front. Costs O(states x input) per call with no
 * preprocessing, so it suits one-off evaluation.
 * <p>
 * Evaluation only reads the automaton; it is safe to run concurrently on the
 * same automaton as long as nothing rewrites it meanwhile.
 */
public final class SubsetSimulator {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");
    private static final Level level = Level.FINER;

    private SubsetSimulator() {
    } // never instantiated

    /**
     * @param input
     *            the chars to consume.
     * @param start
     *            the start state.
     * @param delta
     *            an epsilon-free transition function.
     * @param accept
     *            the accept states.
     * @return true if some state active after the whole input is an accept
     *         state.
     * @throws IllegalArgumentException
     *             if <code>delta</code> has epsilon arcs; eliminate them with
     *             {@link LambdaEliminator} first.
     */
    public static boolean accepts(CharSequence input, String start,
            TransitionFunction delta, Set<String> accept) {
        return accepts(input, start, delta, accept, level);
    }

    public static boolean accepts(CharSequence input, NFA nfa) {
        return accepts(input, nfa.start, nfa.delta, nfa.accept, level);
    }

    /**
     * As {@link #accepts(CharSequence, String, TransitionFunction, Set)},
     * logging the active states after each char at <code>traceLevel</code>.
     */
    static boolean accepts(CharSequence input, String start,
            TransitionFunction delta, Set<String> accept, Level traceLevel) {

        if (delta.hasEpsilon()) {
            throw new IllegalArgumentException(
                "automaton has lambda arcs; eliminate them first");
        }
        final boolean trace = logger.isLoggable(traceLevel);

        SortedSet<String> active = new TreeSet<String>();
        active.add(start);
        if (trace) logger.log(traceLevel, "Start " + active);

        for (int i = 0; i < input.length(); ++i) {
            final Symbol c = Symbol.of(input.charAt(i));
            final SortedSet<String> next = new TreeSet<String>();
            for (String p : active) {
                next.addAll(delta.get(p, c));
            }
            active = next;
            if (trace) logger.log(traceLevel, c + " " + active);
            if (active.isEmpty() && !trace) break; // stays empty
        }
        return !disjoint(active, accept);
    }
}
