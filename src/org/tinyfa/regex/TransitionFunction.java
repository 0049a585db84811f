/* @LICENSE@
 */
package org.tinyfa.regex;

import static org.tinyfa.regex.Misc.LS;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The transition relation (delta) of an {@link NFA}: a mapping from a
 * <code>(state, symbol)</code> pair to the set of states reached by following
 * the arcs so labelled. A symbol may be {@link Symbol#EPSILON}.
 * <p>
 * There is no separate registry of states. The state set of the automaton is
 * whatever appears as a source or a destination in the mapping, and is
 * recomputed by {@link #states()} on each call.
 * <p>
 * A pair which is not in the mapping means "no transition"; lookups never
 * fail. Only non-empty destination sets are stored, so two instances with the
 * same arcs are {@link #equals(Object) equal}.
 * <p>
 * Instances are not thread safe.
 */
public final class TransitionFunction {

    private final SortedMap<String, SortedMap<Symbol, SortedSet<String>>> arcs =
            new TreeMap<String, SortedMap<Symbol, SortedSet<String>>>();

    public TransitionFunction() {
    }

    /**
     * Deep copy.
     */
    public TransitionFunction(TransitionFunction delta) {
        for (Map.Entry<String, SortedMap<Symbol, SortedSet<String>>> e
                : delta.arcs.entrySet()) {
            for (Map.Entry<Symbol, SortedSet<String>> f : e.getValue().entrySet()) {
                addAll(e.getKey(), f.getKey(), f.getValue());
            }
        }
    }

    /**
     * Adds the arc <code>from --on--> to</code>.
     *
     * @return true if the arc was not already present.
     */
    public boolean add(String from, Symbol on, String to) {
        if (from == null || on == null || to == null) {
            throw new NullPointerException();
        }
        return destinations(from, on).add(to);
    }

    public boolean add(String from, char on, String to) {
        return add(from, Symbol.of(on), to);
    }

    /**
     * Unions <code>to</code> into <code>delta[(from, on)]</code>. An empty
     * collection leaves the mapping untouched.
     *
     * @return true if the mapping changed.
     */
    public boolean addAll(String from, Symbol on, Collection<String> to) {
        if (from == null || on == null) {
            throw new NullPointerException();
        }
        for (String s : to) {
            if (s == null) throw new NullPointerException();
        }
        if (to.isEmpty()) return false;
        return destinations(from, on).addAll(to);
    }

    private SortedSet<String> destinations(String from, Symbol on) {
        SortedMap<Symbol, SortedSet<String>> row = arcs.get(from);
        if (row == null) {
            arcs.put(from, row = new TreeMap<Symbol, SortedSet<String>>());
        }
        SortedSet<String> ns = row.get(on);
        if (ns == null) {
            row.put(on, ns = new TreeSet<String>());
        }
        return ns;
    }

    /**
     * @return an unmodifiable view of <code>delta[(from, on)]</code>; the empty
     *         set when there is no such transition.
     */
    public Set<String> get(String from, Symbol on) {
        SortedMap<Symbol, SortedSet<String>> row = arcs.get(from);
        SortedSet<String> ns = row == null ? null : row.get(on);
        return ns == null ? Collections.<String>emptySet()
                          : Collections.unmodifiableSet(ns);
    }

    public Set<String> get(String from, char on) {
        return get(from, Symbol.of(on));
    }

    public boolean contains(String from, Symbol on) {
        return !get(from, on).isEmpty();
    }

    /**
     * @return a snapshot of the arcs leaving <code>from</code>, keyed by
     *         symbol; empty when there are none. Later changes to this
     *         mapping are not reflected in the snapshot, nor vice versa.
     */
    public SortedMap<Symbol, SortedSet<String>> arcsFrom(String from) {
        SortedMap<Symbol, SortedSet<String>> ret =
                new TreeMap<Symbol, SortedSet<String>>();
        SortedMap<Symbol, SortedSet<String>> row = arcs.get(from);
        if (row != null) {
            for (Map.Entry<Symbol, SortedSet<String>> e : row.entrySet()) {
                ret.put(e.getKey(), new TreeSet<String>(e.getValue()));
            }
        }
        return ret;
    }

    /**
     * @return the states with at least one outgoing arc.
     */
    public SortedSet<String> sources() {
        return Collections.unmodifiableSortedSet(
            new TreeSet<String>(arcs.keySet()));
    }

    /**
     * Derives the state set of the automaton: every state occurring as the
     * source or a destination of some arc. Computed afresh on each call, so it
     * is never stale after the mapping is rewritten.
     *
     * @return a new set of states.
     */
    public SortedSet<String> states() {
        SortedSet<String> ret = new TreeSet<String>(arcs.keySet());
        for (SortedMap<Symbol, SortedSet<String>> row : arcs.values()) {
            for (SortedSet<String> ns : row.values()) ret.addAll(ns);
        }
        return ret;
    }

    /**
     * @return the non-epsilon symbols labelling at least one arc.
     */
    public SortedSet<Symbol> alphabet() {
        SortedSet<Symbol> ret = new TreeSet<Symbol>();
        for (SortedMap<Symbol, SortedSet<String>> row : arcs.values()) {
            ret.addAll(row.keySet());
        }
        ret.remove(Symbol.EPSILON);
        return ret;
    }

    public boolean hasEpsilon() {
        for (SortedMap<Symbol, SortedSet<String>> row : arcs.values()) {
            if (row.containsKey(Symbol.EPSILON)) return true;
        }
        return false;
    }

    /**
     * Deletes every <code>(state, epsilon)</code> entry.
     *
     * @return the number of entries removed.
     */
    int removeEpsilon() {
        int n = 0;
        for (Iterator<SortedMap<Symbol, SortedSet<String>>> ri =
                arcs.values().iterator(); ri.hasNext();) {
            SortedMap<Symbol, SortedSet<String>> row = ri.next();
            if (row.remove(Symbol.EPSILON) != null) ++n;
            if (row.isEmpty()) ri.remove();
        }
        return n;
    }

    /**
     * @return the number of <code>(state, symbol)</code> entries.
     */
    public int size() {
        int n = 0;
        for (SortedMap<Symbol, SortedSet<String>> row : arcs.values()) {
            n += row.size();
        }
        return n;
    }

    public boolean isEmpty() {
        return arcs.isEmpty();
    }

    @Override
    public int hashCode() {
        return arcs.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof TransitionFunction))
            return false;
        return arcs.equals(((TransitionFunction) obj).arcs);
    }

    /*
     * one line per (state, symbol) entry: (p, c) -> [q, r]
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, SortedMap<Symbol, SortedSet<String>>> e
                : arcs.entrySet()) {
            for (Map.Entry<Symbol, SortedSet<String>> f : e.getValue().entrySet()) {
                sb.append('(').append(e.getKey()).append(", ").append(f.getKey())
                  .append(") -> ").append(f.getValue()).append(LS);
            }
        }
        return sb.toString();
    }
}
