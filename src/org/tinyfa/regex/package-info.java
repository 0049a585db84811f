/*
 * @LICENSE@
 */

/**
 * <h3><b>tinyfa</b> - a small finite automata based regex package.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * A regular expression goes through four stages:
 * <ol>
 * <li>{@link org.tinyfa.regex.PostfixCompiler} turns the infix expression into
 * a postfix {@link org.tinyfa.regex.Token} sequence by the shunting-yard
 * algorithm, making concatenation explicit and numbering each literal
 * occurrence.</li>
 * <li>{@link org.tinyfa.regex.Thompson} builds an NFA with epsilon arcs from
 * the postfix sequence.</li>
 * <li>{@link org.tinyfa.regex.LambdaEliminator} rewrites that NFA into an
 * equivalent one without epsilon arcs.</li>
 * <li>{@link org.tinyfa.regex.SubsetSimulator} runs the NFA on an input,
 * tracking every state it could be in.</li>
 * </ol>
 * {@link org.tinyfa.regex.Pattern} strings the stages together. Each stage is
 * also usable on its own; in particular hand built automata (a
 * {@link org.tinyfa.regex.TransitionFunction}, a start state and a set of
 * accept states) can be fed straight to the last two.
 * <p>
 * <h4>Syntax.</h4>
 * <p>
 * Literals, concatenation, <code>|</code>, <code>*</code> and parentheses,
 * with backslash as the escape char. That is all: the point of the package is
 * the automata, not the syntax.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * All classes log to the <code>org.tinyfa.regex</code>
 * {@link java.util.logging.Logger}: compilation details at
 * <code>FINER</code> and <code>FINEST</code>, the per-char set of active states
 * at <code>FINER</code> (or <code>INFO</code>, see
 * {@link org.tinyfa.regex.Pattern#X_TRACE}).
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Chapter 3 of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book</a>, for the constructions used here.</li>
 * <li>Russ Cox's <a href="http://swtch.com/~rsc/regexp/regexp1.html">article</a>
 * on finite automata regex matching, for the case against backtracking.</li>
 * </ul>
 */
package org.tinyfa.regex;
