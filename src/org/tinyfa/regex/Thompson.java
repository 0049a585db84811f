/* @LICENSE@
 */
package org.tinyfa.regex;

import java.util.LinkedList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds an NFA with epsilon arcs from a postfix token sequence, one
 * fragment per operator in the classic manner:
 * <ul>
 * <li>operand <code>c_i</code>: states <code>c_i --c--> c_i_0</code>;</li>
 * <li>concatenation: an epsilon arc from the exit of the left fragment to the
 * entry of the right;</li>
 * <li>alternation: a new split state with epsilon arcs to both entries, and a
 * new join state with epsilon arcs from both exits;</li>
 * <li>star: a new hub state with an epsilon arc to the entry and one back from
 * the exit; the hub is both entry and exit of the result.</li>
 * </ul>
 * The whole is wrapped between {@link #START} and {@link #FINISH}, and
 * {@link #FINISH} is the only accept state.
 * <p>
 * State names are readable in traces: besides <code>Start</code> and
 * <code>Finish</code>, every state is either an
 * operand name <code>c_i</code> or such a name with underscore separated
 * numeric suffixes, where the prefix is the operand the enclosing fragment
 * begins with.
 */
public final class Thompson {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");
    private static final Level level = Level.FINER;

    public static final String START = "Start";
    public static final String FINISH = "Finish";

    private static final class Fragment {
        final String anchor;    // operand state this fragment begins with
        final String entry;
        final String exit;
        Fragment(String anchor, String entry, String exit) {
            this.anchor = anchor;
            this.entry = entry;
            this.exit = exit;
        }
        @Override
        public String toString() {
            return "{" + entry + ".." + exit + '}';
        }
    }

    private final TransitionFunction delta = new TransitionFunction();
    private int serial = 0;

    private Thompson() {
    }

    /**
     * @param postfix
     *            a sequence as produced by {@link PostfixCompiler}.
     * @return a new automaton accepting the language of the expression.
     * @throws IllegalArgumentException
     *             if the sequence is not a well formed postfix expression.
     */
    public static NFA build(List<Token> postfix) {
        NFA nfa = new Thompson().construct(postfix);
        logger.log(level, "thompson nfa: " + nfa.delta.size() + " entries, "
            + nfa.states().size() + " states");
        return nfa;
    }

    private NFA construct(List<Token> postfix) {

        final LinkedList<Fragment> stack = new LinkedList<Fragment>();

        for (Token t : postfix) {
            Fragment f, f1, f2;
            switch (t.kind) {
            case OPERAND:
                final String name = t.toString();
                f = new Fragment(name, name, name + "_0");
                delta.add(f.entry, Symbol.of(t.c), f.exit);
                stack.addFirst(f);
                break;
            case CONCAT:
                f2 = pop(stack, t);
                f1 = pop(stack, t);
                lambda(f1.exit, f2.entry);
                stack.addFirst(new Fragment(f1.anchor, f1.entry, f2.exit));
                break;
            case UNION:
                f2 = pop(stack, t);
                f1 = pop(stack, t);
                final String split = fresh(f1.anchor);
                final String join = fresh(f1.anchor);
                lambda(split, f1.entry);
                lambda(split, f2.entry);
                lambda(f1.exit, join);
                lambda(f2.exit, join);
                stack.addFirst(new Fragment(f1.anchor, split, join));
                break;
            case STAR:
                f = pop(stack, t);
                final String hub = fresh(f.anchor);
                lambda(hub, f.entry);
                lambda(f.exit, hub);
                stack.addFirst(new Fragment(f.anchor, hub, hub));
                break;
            default:
                throw new IllegalArgumentException(
                    "not a postfix token: " + t + " in " + postfix);
            }
        }

        if (stack.isEmpty()) {
            lambda(START, FINISH);
        } else {
            final Fragment f = stack.removeFirst();
            if (!stack.isEmpty()) {
                throw new IllegalArgumentException(
                    "operands left without operator: " + stack + " in " + postfix);
            }
            lambda(START, f.entry);
            lambda(f.exit, FINISH);
        }
        return new NFA(START, delta, new TreeSet<String>()).addAccept(FINISH);
    }

    private static Fragment pop(LinkedList<Fragment> stack, Token op) {
        if (stack.isEmpty()) {
            throw new IllegalArgumentException("missing operand for " + op);
        }
        return stack.removeFirst();
    }

    private String fresh(String anchor) {
        return anchor + '_' + (++serial);
    }

    private void lambda(String from, String to) {
        delta.add(from, Symbol.EPSILON, to);
    }
}
