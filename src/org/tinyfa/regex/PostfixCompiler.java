/* @LICENSE@
 */
package org.tinyfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tinyfa.regex.Token.Kind;

/**
 * Compiles an infix regular expression into a postfix (reverse Polish)
 * sequence of {@link Token}s.
 * <p>
 * Syntax: <code>*</code> (zero or more, postfix), <code>|</code>
 * (alternation, infix), juxtaposition for concatenation, and parentheses for
 * grouping. A backslash makes the char after it a literal, whatever it is.
 * Every other char is a literal. Precedence is star, then concatenation,
 * then alternation; binary operators associate to the left.
 * <p>
 * The empty expression compiles to the empty sequence. Instances hold parse
 * state and are not thread safe; the static {@link #toPostfix(String)} is.
 */
public final class PostfixCompiler {

    private static final Logger logger = Logger.getLogger("org.tinyfa.regex");
    private static final Level level = Level.FINER;

    static final char ESCAPE = '\\';

    /*
     * fields to hold parameters
     */
    private String regex;

    /*
     * infix token list, with the index in regex each token came from
     */
    private final List<Token> infix = new ArrayList<Token>();
    private final List<Integer> infixAt = new ArrayList<Integer>();

    public static List<Token> toPostfix(String regex) {
        return new PostfixCompiler().compile(regex);
    }

    /**
     * @param regex
     *            the infix expression.
     * @return the postfix sequence; an unmodifiable list.
     * @throws MalformedExpressionException
     *             for unbalanced parentheses, an empty group, a trailing
     *             backslash, or an operator without its operands.
     */
    public List<Token> compile(String regex) {

        if (regex == null) {
            throw new NullPointerException();
        }
        this.regex = regex;
        infix.clear();
        infixAt.clear();

        tokenize();
        logger.log(level, "infix: " + infix);

        List<Integer> postfixAt = new ArrayList<Integer>(infix.size());
        List<Token> postfix = shuntingYard(postfixAt);
        checkArity(postfix, postfixAt);

        logger.log(level, "postfix: " + postfix);
        return Collections.unmodifiableList(postfix);
    }

    /*
     * Literals become operands numbered by occurrence; explicit CONCAT
     * tokens go wherever two adjacent tokens have no operator between them.
     */
    private void tokenize() {
        int n = 0;
        for (int i = 0; i < regex.length(); ++i) {
            final int at = i;
            final char c = regex.charAt(i);
            Token t;
            switch (c) {
            case '*':
                t = Token.STAR;
                break;
            case '|':
                t = Token.UNION;
                break;
            case '(':
                t = Token.LPAREN;
                break;
            case ')':
                t = Token.RPAREN;
                if (!infix.isEmpty() && last().kind == Kind.LPAREN) {
                    syntaxError("empty group", at);
                }
                break;
            case ESCAPE:
                if (++i == regex.length()) {
                    syntaxError("nothing to escape", at);
                }
                t = Token.operand(regex.charAt(i), n++);
                break;
            default:
                t = Token.operand(c, n++);
                break;
            }
            if (!infix.isEmpty() && concatenates(last(), t)) {
                emit(Token.CONCAT, at);
            }
            emit(t, at);
        }
    }

    private static boolean concatenates(Token prev, Token next) {
        final boolean endsOperand = prev.kind == Kind.OPERAND
                || prev.kind == Kind.RPAREN || prev.kind == Kind.STAR;
        final boolean beginsOperand = next.kind == Kind.OPERAND
                || next.kind == Kind.LPAREN;
        return endsOperand && beginsOperand;
    }

    private Token last() {
        return infix.get(infix.size() - 1);
    }

    private void emit(Token t, int at) {
        infix.add(t);
        infixAt.add(at);
    }

    private List<Token> shuntingYard(List<Integer> postfixAt) {

        final List<Token> postfix = new ArrayList<Token>(infix.size());
        final LinkedList<Token> stack = new LinkedList<Token>();
        final LinkedList<Integer> stackAt = new LinkedList<Integer>();

        for (int k = 0; k < infix.size(); ++k) {
            final Token t = infix.get(k);
            final int at = infixAt.get(k);
            switch (t.kind) {
            case OPERAND:
                postfix.add(t);
                postfixAt.add(at);
                break;
            case LPAREN:
                stack.addFirst(t);
                stackAt.addFirst(at);
                break;
            case RPAREN:
                while (!stack.isEmpty() && stack.getFirst().kind != Kind.LPAREN) {
                    postfix.add(stack.removeFirst());
                    postfixAt.add(stackAt.removeFirst());
                }
                if (stack.isEmpty()) {
                    syntaxError("unbalanced parenthesis", at);
                }
                stack.removeFirst();
                stackAt.removeFirst();
                break;
            default:
                assert t.kind.isOperator() : t;
                while (!stack.isEmpty()
                        && stack.getFirst().kind != Kind.LPAREN
                        && t.kind.precedence <= stack.getFirst().kind.precedence) {
                    postfix.add(stack.removeFirst());
                    postfixAt.add(stackAt.removeFirst());
                }
                stack.addFirst(t);
                stackAt.addFirst(at);
                break;
            }
        }
        while (!stack.isEmpty()) {
            if (stack.getFirst().kind == Kind.LPAREN) {
                syntaxError("unclosed parenthesis", stackAt.getFirst());
            }
            postfix.add(stack.removeFirst());
            postfixAt.add(stackAt.removeFirst());
        }
        return postfix;
    }

    /*
     * evaluate the postfix sequence on operand counts only
     */
    private void checkArity(List<Token> postfix, List<Integer> postfixAt) {
        int depth = 0;
        for (int k = 0; k < postfix.size(); ++k) {
            final Token t = postfix.get(k);
            if (t.isOperand()) {
                ++depth;
            } else if (depth < t.kind.arity) {
                syntaxError("missing operand for '" + t + "'", postfixAt.get(k));
            } else {
                depth -= t.kind.arity - 1;
            }
        }
        if (!postfix.isEmpty() && depth != 1) {
            syntaxError("incomplete expression", -1);
        }
    }

    private void syntaxError(String msg, int index) {
        throw new MalformedExpressionException(msg, regex, index);
    }
}
