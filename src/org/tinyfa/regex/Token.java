/* @LICENSE@
 */
package org.tinyfa.regex;

/**
 * One element of a compiled regular expression: an operator, or an operand
 * standing for one occurrence of a literal char. Operands are tagged with the
 * position of the occurrence among all literals of the expression, so the
 * two <code>a</code>s of <code>a*a</code> are the distinct operands
 * <code>a_0</code> and <code>a_1</code>. Instances are immutable.
 */
public final class Token {

    /**
     * Token kinds. Operators carry their binding precedence and arity;
     * parentheses only exist while an expression is being compiled and never
     * appear in a postfix sequence.
     */
    public enum Kind {
        OPERAND(-1, 0, '\0'),
        UNION(0, 2, '|'),
        CONCAT(1, 2, '.'),
        STAR(2, 1, '*'),
        LPAREN(-1, 0, '('),
        RPAREN(-1, 0, ')');

        final int precedence;
        final int arity;
        final char image;

        Kind(int precedence, int arity, char image) {
            this.precedence = precedence;
            this.arity = arity;
            this.image = image;
        }

        public boolean isOperator() {
            return precedence >= 0;
        }

        public int precedence() {
            return precedence;
        }

        public int arity() {
            return arity;
        }
    }

    public static final Token UNION = new Token(Kind.UNION, '|', -1);
    public static final Token CONCAT = new Token(Kind.CONCAT, '.', -1);
    public static final Token STAR = new Token(Kind.STAR, '*', -1);
    static final Token LPAREN = new Token(Kind.LPAREN, '(', -1);
    static final Token RPAREN = new Token(Kind.RPAREN, ')', -1);

    final Kind kind;
    final char c;
    final int index;

    private Token(Kind kind, char c, int index) {
        this.kind = kind;
        this.c = c;
        this.index = index;
    }

    /**
     * @param c
     *            the literal char.
     * @param index
     *            the occurrence index of the literal in its expression.
     */
    public static Token operand(char c, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative index: " + index);
        }
        return new Token(Kind.OPERAND, c, index);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isOperand() {
        return kind == Kind.OPERAND;
    }

    /**
     * @return the literal char of an operand, or the image of an operator.
     */
    public char ch() {
        return c;
    }

    /**
     * @return the occurrence index of an operand.
     * @throws IllegalStateException
     *             for operators.
     */
    public int index() {
        if (!isOperand()) {
            throw new IllegalStateException("not an operand: " + this);
        }
        return index;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + kind.hashCode();
        result = prime * result + c;
        result = prime * result + index;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Token))
            return false;
        final Token other = (Token) obj;
        return kind == other.kind && c == other.c && index == other.index;
    }

    /**
     * Operands print as <code>c_i</code> - which is also the name of the
     * state {@link Thompson} builds for them - operators as their image.
     */
    @Override
    public String toString() {
        return isOperand() ? c + "_" + index : String.valueOf(kind.image);
    }
}
