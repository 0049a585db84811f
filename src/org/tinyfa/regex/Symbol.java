/* @LICENSE@
 */
package org.tinyfa.regex;

/**
 * The label on an arc of an {@link NFA}: either a single input
 * <code>char</code> or the distinguished {@link #EPSILON} marker, which labels
 * an arc taken without consuming input (a "lambda" arrow). Instances are
 * immutable and interned for the Latin-1 range, so identity comparison works
 * there, but {@link #equals(Object)} should be used in general.
 */
public final class Symbol implements Comparable<Symbol> {

    private static final int NONE = -1;

    /**
     * The empty label.
     */
    public static final Symbol EPSILON = new Symbol(NONE);

    private static final Symbol[] cache = new Symbol[256];
    static {
        for (int c = 0; c < cache.length; ++c) {
            cache[c] = new Symbol(c);
        }
    }

    private final int c;

    private Symbol(int c) {
        this.c = c;
    }

    public static Symbol of(char c) {
        return c < cache.length ? cache[c] : new Symbol(c);
    }

    public boolean isEpsilon() {
        return c == NONE;
    }

    /**
     * @return the char this symbol reads.
     * @throws IllegalStateException
     *             if this is {@link #EPSILON}.
     */
    public char ch() {
        if (isEpsilon()) {
            throw new IllegalStateException("epsilon has no char");
        }
        return (char) c;
    }

    /*
     * epsilon sorts first
     */
    public int compareTo(Symbol o) {
        return c < o.c ? -1 : (c == o.c ? 0 : 1);
    }

    @Override
    public int hashCode() {
        return c;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Symbol))
            return false;
        return c == ((Symbol) obj).c;
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : Misc.Esc.JAVA.esc(c);
    }
}
