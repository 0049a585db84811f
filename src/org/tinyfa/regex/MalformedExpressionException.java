/* @LICENSE@
 */
package org.tinyfa.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a regular expression cannot be compiled: unbalanced
 * parentheses, an escape with nothing to escape, or an operator missing an
 * operand. The {@link #getIndex() index} is the position in the expression
 * where the problem was detected, or -1 if it can't be pinned down.
 */
public final class MalformedExpressionException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public MalformedExpressionException(String desc, String regex, int index) {
        super(desc, regex, index);
    }
}
