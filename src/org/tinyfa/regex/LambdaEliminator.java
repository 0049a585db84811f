/* @LICENSE@
 */
package org.tinyfa.regex;

import static org.tinyfa.regex.Misc.disjoint;

import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes the epsilon ("lambda") arcs from an automaton without changing the
 * language it accepts from any of its states.
 * <p>
 * For each state <code>s</code> with epsilon closure <code>R(s)</code> (the
 * states reachable over one or more epsilon arcs, never <code>s</code>
 * itself):
 * <ol>
 * <li><code>s</code> becomes an accept state if <code>R(s)</code> contains
 * one;</li>
 * <li><code>s</code> gets a copy of every non-epsilon arc leaving a state of
 * <code>R(s)</code>;</li>
 * </ol>
 * then all epsilon arcs are dropped. Step 2 reads the arcs as they were before
 * the rewrite began, never arcs added by the rewrite itself.
 * <p>
 * The rewrite is destructive: the transition function and accept set are
 * changed in place. Not safe for concurrent use on the same structures.
 */
public final class LambdaEliminator {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");
    private static final Level level = Level.FINER;

    private LambdaEliminator() {
    } // never instantiated

    /**
     * Computes the epsilon closure of <code>state</code>: all states reachable
     * from it by following one or more epsilon arcs, excluding
     * <code>state</code> itself even when an epsilon cycle leads back to it.
     *
     * @return a new set; empty if no epsilon arcs leave <code>state</code>.
     */
    public static SortedSet<String> closure(String state, TransitionFunction delta) {
        final SortedSet<String> reached = new TreeSet<String>();
        final LinkedList<String> stack = new LinkedList<String>();
        stack.addFirst(state);
        while (!stack.isEmpty()) {
            final String s = stack.removeFirst();
            for (String ns : delta.get(s, Symbol.EPSILON)) {
                // the visited check is what keeps epsilon cycles finite
                if (reached.add(ns)) stack.addFirst(ns);
            }
        }
        reached.remove(state);
        return reached;
    }

    /**
     * Rewrites <code>delta</code> and <code>accept</code> in place into an
     * equivalent automaton without epsilon arcs. An automaton without epsilon
     * arcs is left unchanged.
     *
     * @param delta
     *            the transition function; rewritten.
     * @param accept
     *            the accept states; states which reach one of them over
     *            epsilon arcs are added.
     */
    public static void eliminate(TransitionFunction delta, Set<String> accept) {

        if (!delta.hasEpsilon()) {
            logger.log(level, "no lambdas");
            return;
        }
        final int sizeBefore = delta.size();

        /*
         * read-only view of the original arcs, per source state
         */
        final Map<String, SortedMap<Symbol, SortedSet<String>>> snapshot =
                new HashMap<String, SortedMap<Symbol, SortedSet<String>>>();
        for (String s : delta.sources()) {
            snapshot.put(s, delta.arcsFrom(s));
        }

        final Set<String> newAccept = new TreeSet<String>();
        for (String s : delta.states()) {
            final SortedSet<String> reach = closure(s, delta);
            if (reach.isEmpty()) continue;
            if (!disjoint(reach, accept)) {
                newAccept.add(s);
            }
            for (String t : reach) {
                final SortedMap<Symbol, SortedSet<String>> arcs = snapshot.get(t);
                if (arcs == null) continue;
                for (Map.Entry<Symbol, SortedSet<String>> e : arcs.entrySet()) {
                    if (!e.getKey().isEpsilon()) {
                        delta.addAll(s, e.getKey(), e.getValue());
                    }
                }
            }
        }
        accept.addAll(newAccept);

        final int removed = delta.removeEpsilon();
        assert !delta.hasEpsilon() : delta;

        logger.log(level, "eliminated " + removed + " lambda entries: "
            + sizeBefore + " -> " + delta.size() + " entries; new accept "
            + newAccept);
    }

    /**
     * The rewrite as a transfer of ownership: the transition function and
     * accept set of <code>nfa</code> are rewritten and handed over to the
     * result. <code>nfa</code> must not be used afterwards; pass
     * {@link NFA#copy()} to keep the original.
     *
     * @return the epsilon-free automaton, with the same start state.
     */
    public static NFA eliminate(NFA nfa) {
        eliminate(nfa.delta, nfa.accept);
        return new NFA(nfa.start, nfa.delta, nfa.accept);
    }
}
