/* @LICENSE@
 */
package org.tinyfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brute force check of a {@link Pattern} against {@link java.util.regex}: every
 * string over an alphabet, up to a maximum length, is matched with both and
 * the answers compared. Strings are tried in shortlex order - by length, then
 * by the order of chars in the alphabet.
 * <p>
 * The expression must mean the same thing to both packages, which holds for
 * literals, grouping, <code>|</code> and <code>*</code>.
 */
public final class ReferenceComparator {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");

    /**
     * An input on which the two packages disagree.
     */
    public static final class Mismatch {

        final String input;
        final boolean ours;
        final boolean reference;

        Mismatch(String input, boolean ours, boolean reference) {
            this.input = input;
            this.ours = ours;
            this.reference = reference;
        }

        public String input() {
            return input;
        }

        public boolean ours() {
            return ours;
        }

        public boolean reference() {
            return reference;
        }

        @Override
        public String toString() {
            return "Wrong on \"" + Misc.Esc.JAVA.esc(input) + "\": ours " + ours
                    + ", java.util.regex " + reference;
        }
    }

    /**
     * Outcome of a {@link ReferenceComparator#compare(String, String, int)
     * comparison}.
     */
    public static final class Report {

        final String regex;
        final int maxLength;
        final int tried;
        final List<Mismatch> mismatches;

        Report(String regex, int maxLength, int tried, List<Mismatch> mismatches) {
            this.regex = regex;
            this.maxLength = maxLength;
            this.tried = tried;
            this.mismatches = Collections.unmodifiableList(mismatches);
        }

        public int tried() {
            return tried;
        }

        public int correct() {
            return tried - mismatches.size();
        }

        public List<Mismatch> mismatches() {
            return mismatches;
        }

        public boolean isClean() {
            return mismatches.isEmpty();
        }

        @Override
        public String toString() {
            return correct() + " / " + tried + " correct on " + regex
                    + " up to length " + maxLength;
        }
    }

    private ReferenceComparator() {
    } // never instantiated

    /**
     * @param regex
     *            an expression in the syntax common to both packages.
     * @param alphabet
     *            the chars to build inputs from, in order.
     * @param maxLength
     *            the longest input tried.
     * @return the report; never null.
     */
    public static Report compare(String regex, String alphabet, int maxLength) {

        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength: " + maxLength);
        }
        final Pattern ours = Pattern.compile(regex);
        final java.util.regex.Pattern reference =
                java.util.regex.Pattern.compile(regex);

        final List<Mismatch> mismatches = new ArrayList<Mismatch>();
        final LinkedList<String> queue = new LinkedList<String>();
        queue.add("");
        int tried = 0;
        while (!queue.isEmpty()) {
            final String s = queue.removeFirst();
            ++tried;
            final boolean a = ours.matches(s);
            final boolean b = reference.matcher(s).matches();
            if (a != b) {
                Mismatch m = new Mismatch(s, a, b);
                logger.warning(m.toString());
                mismatches.add(m);
            }
            if (s.length() < maxLength) {
                for (int i = 0; i < alphabet.length(); ++i) {
                    queue.addLast(s + alphabet.charAt(i));
                }
            }
        }
        final Report report = new Report(regex, maxLength, tried, mismatches);
        logger.log(Level.INFO, report.toString());
        return report;
    }
}
