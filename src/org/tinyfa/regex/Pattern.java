/*
 * @LICENSE@
 */

package org.tinyfa.regex;

import static org.tinyfa.regex.Misc.isSet;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tinyfa.regex.Misc.FlagMgr;

/**
 * A compiled representation of a regular expression; loosely analogous to
 * the {@link java.util.regex.Pattern} class, for a much smaller syntax. Like
 * that class, instances of this Pattern class are immutable and thread safe.
 * <p>
 * <strong>Syntax:</strong> literal chars, juxtaposition (concatenation),
 * <code>|</code> (alternation), <code>*</code> (zero or more) and parentheses
 * for grouping. A backslash makes the following char a literal. There are no
 * character classes, anchors, or other quantifiers. See
 * {@link PostfixCompiler}.
 * <p>
 * <strong>Compilation:</strong> the expression is compiled to postfix, an NFA
 * is built from that by {@link Thompson} construction, and its epsilon arcs are
 * removed by the {@link LambdaEliminator}. Matching is done by the
 * {@link SubsetSimulator}, in time proportional to the input length times the
 * number of states; there is no backtracking.
 * <p>
 * Matching is always against the entire input, as with
 * {@link java.util.regex.Matcher#matches()}.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Every char of the expression is a literal; nothing is an operator.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    /**
     * Logs the set of active states after each input char, at
     * {@link Level#INFO} on the <code>org.tinyfa.regex</code> logger, on every
     * {@link #matches(CharSequence)}. Without it the same trace goes out at
     * {@link Level#FINER}. This is a nonstandard flag.
     */
    public static final int X_TRACE = flagMgr.next("X_TRACE");

    static final int FLAG_COUNT = flagMgr.freezeAndCount();

    final String regex;
    final int flags;
    final List<Token> postfix;
    private final NFA nfa;
    private final Level traceLevel;

    private Pattern(String regex, int flags) {

        flagMgr.check(flags);
        this.regex = regex;
        this.flags = flags;
        logger.log(level, "regex: " + Misc.Esc.JAVA.esc(regex)
            + " flags: " + flagMgr.stringFrom(flags));

        this.postfix = PostfixCompiler.toPostfix(
            isSet(flags, LITERAL) ? Misc.Esc.RXP.esc(regex) : regex);
        this.nfa = LambdaEliminator.eliminate(Thompson.build(postfix));
        this.traceLevel = isSet(flags, X_TRACE) ? Level.INFO : Level.FINER;

        logger.log(level, "nfa final: " + Misc.LS + nfa);
    }

    /**
     * @throws MalformedExpressionException
     *             if the expression is malformed.
     */
    public static Pattern compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param flags
     *            a bit mask of {@link #LITERAL} and {@link #X_TRACE}.
     * @throws MalformedExpressionException
     *             if the expression is malformed.
     * @throws IllegalArgumentException
     *             if unknown flags are set.
     */
    public static Pattern compile(String regex, int flags) {
        if (regex == null) {
            throw new NullPointerException();
        }
        return new Pattern(regex, flags);
    }

    /**
     * Compiles <code>regex</code> and matches the entire <code>input</code>
     * against it.
     */
    public static boolean matches(String regex, CharSequence input) {
        return Pattern.compile(regex).matches(input);
    }

    /**
     * @return true if the whole of <code>input</code> is in the language of
     *         this pattern.
     */
    public boolean matches(CharSequence input) {
        return SubsetSimulator.accepts(
            input, nfa.start, nfa.delta, nfa.accept, traceLevel);
    }

    public int flags() {
        return flags;
    }

    /**
     * @return the postfix form of the expression; unmodifiable.
     */
    public List<Token> postfix() {
        return postfix;
    }

    /**
     * @return a copy of the epsilon-free automaton this pattern matches with.
     */
    public NFA nfa() {
        return nfa.copy();
    }

    public String pattern() {
        return regex;
    }

    /**
     * @return an expression matching exactly <code>s</code>.
     */
    public static String quote(String s) {
        return Misc.Esc.RXP.esc(s);
    }

    @Override
    public String toString() {
        return regex;
    }
}
