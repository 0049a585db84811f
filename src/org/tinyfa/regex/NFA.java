/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata.
 */
package org.tinyfa.regex;

import static org.tinyfa.regex.Misc.LS;

import java.util.Collection;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A nondeterministic finite automaton: a start state, a
 * {@linkplain TransitionFunction transition function} and a set of accept
 * states. The state set is implied by the transition function (see
 * {@link TransitionFunction#states()}) plus the start and accept states.
 * <p>
 * This is a plain holder. The transition function and accept set are the
 * live, mutable objects passed in (or created) at construction; operations
 * such as {@link LambdaEliminator#eliminate(NFA)} rewrite them in place. Use
 * {@link #copy()} to keep an automaton across such a rewrite.
 */
public final class NFA {

    final String start;
    final TransitionFunction delta;
    final Set<String> accept;

    /**
     * An automaton with no arcs and no accept states.
     */
    public NFA(String start) {
        this(start, new TransitionFunction(), new TreeSet<String>());
    }

    /**
     * Wraps, without copying, the given structures.
     */
    public NFA(String start, TransitionFunction delta, Set<String> accept) {
        if (start == null || delta == null || accept == null) {
            throw new NullPointerException();
        }
        this.start = start;
        this.delta = delta;
        this.accept = accept;
    }

    public String start() {
        return start;
    }

    /**
     * @return the live transition function.
     */
    public TransitionFunction delta() {
        return delta;
    }

    /**
     * @return the live accept set.
     */
    public Set<String> accept() {
        return accept;
    }

    public NFA addAccept(String state) {
        accept.add(state);
        return this;
    }

    public NFA addAccept(Collection<String> states) {
        accept.addAll(states);
        return this;
    }

    /**
     * All states: those of the transition function, plus the start and
     * accept states (which may have no arcs at all).
     */
    public SortedSet<String> states() {
        SortedSet<String> ret = delta.states();
        ret.add(start);
        ret.addAll(accept);
        return ret;
    }

    /**
     * @return true if some arc is labelled {@link Symbol#EPSILON}.
     */
    public boolean hasLambdas() {
        return delta.hasEpsilon();
    }

    /**
     * Deep copy: the copy shares nothing mutable with this automaton.
     */
    public NFA copy() {
        return new NFA(start, new TransitionFunction(delta),
            new TreeSet<String>(accept));
    }

    /**
     * Runs the automaton over <code>input</code>.
     *
     * @see SubsetSimulator#accepts(CharSequence, NFA)
     */
    public boolean accepts(CharSequence input) {
        return SubsetSimulator.accepts(input, this);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + start.hashCode();
        result = prime * result + delta.hashCode();
        result = prime * result + accept.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof NFA))
            return false;
        final NFA other = (NFA) obj;
        return start.equals(other.start) && delta.equals(other.delta)
                && accept.equals(other.accept);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("start=").append(start).append(LS)
          .append("accept=").append(new TreeSet<String>(accept)).append(LS)
          .append(delta);
        return sb.toString();
    }
}
