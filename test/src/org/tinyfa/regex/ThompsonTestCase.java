/* @LICENSE@  
 */

package org.tinyfa.regex;

import static org.tinyfa.regex.RegexAssert.*;

import java.util.Arrays;
import java.util.Collections;

public class ThompsonTestCase extends AbstractRxTestCase {

    public ThompsonTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
    }

    protected void tearDown() throws Exception {
        super.tearDown();
    }
    
    private static NFA nfaOf(String regex) {
        return Thompson.build(PostfixCompiler.toPostfix(regex));
    }
    
    public void testEmpty() {
        NFA nfa = Thompson.build(Collections.<Token>emptyList());
        assertEquals(Thompson.START, nfa.start());
        assertEquals(states(Thompson.FINISH), nfa.accept());
        assertEquals(states(Thompson.FINISH), nfa.delta().get(Thompson.START, Symbol.EPSILON));
        assertEquals(1, nfa.delta().size());
    }
    
    public void testOperand() {
        NFA nfa = nfaOf("a");
        TransitionFunction delta = nfa.delta();
        assertEquals(states("a_0_0"), delta.get("a_0", 'a'));
        assertEquals(states("a_0"), delta.get("Start", Symbol.EPSILON));
        assertEquals(states("Finish"), delta.get("a_0_0", Symbol.EPSILON));
        assertEquals(states("Start", "a_0", "a_0_0", "Finish"), nfa.states());
    }
    
    public void testConcat() {
        NFA nfa = nfaOf("ab");
        assertEquals(states("b_1"), nfa.delta().get("a_0_0", Symbol.EPSILON));
        assertEquals(states("Finish"), nfa.delta().get("b_1_0", Symbol.EPSILON));
        assertEquals(6, nfa.states().size());
    }
    
    public void testUnion() {
        NFA nfa = nfaOf("a|b");
        TransitionFunction delta = nfa.delta();
        assertEquals(states("a_0_1"), delta.get("Start", Symbol.EPSILON));
        assertEquals(states("a_0", "b_1"), delta.get("a_0_1", Symbol.EPSILON));
        assertEquals(states("a_0_2"), delta.get("a_0_0", Symbol.EPSILON));
        assertEquals(states("a_0_2"), delta.get("b_1_0", Symbol.EPSILON));
        assertEquals(states("Finish"), delta.get("a_0_2", Symbol.EPSILON));
    }
    
    public void testStar() {
        NFA nfa = nfaOf("a*");
        TransitionFunction delta = nfa.delta();
        assertEquals(states("a_0_1"), delta.get("Start", Symbol.EPSILON));
        assertEquals(states("a_0", "Finish"), delta.get("a_0_1", Symbol.EPSILON));
        assertEquals(states("a_0_1"), delta.get("a_0_0", Symbol.EPSILON));
    }
    
    public void testNamingConvention() {
        String[] regexes = {"", "a", "(a|b)*abb", "a*|b*c", "((ab)*|c)*d", "x\\*y"};
        for (String regex : regexes) {
            NFA nfa = nfaOf(regex);
            assertTrue(nfa.states().contains(Thompson.START));
            assertTrue(nfa.states().contains(Thompson.FINISH));
            assertEquals(states(Thompson.FINISH), nfa.accept());
            for (String s : nfa.states()) {
                if (s.equals(Thompson.START) || s.equals(Thompson.FINISH)) continue;
                assertTrue(regex + ": " + s, s.matches("(?s)._\\d+(_\\d+)*"));
            }
        }
    }
    
    public void testStatesUnique() {
        // every operand contributes exactly 2 states, every | 2, every * 1
        NFA nfa = nfaOf("(a|b)*a(a|b)");
        assertEquals(2 + 5 * 2 + 2 * 2 + 1, nfa.states().size());
    }
    
    public void testLanguage() {
        NFA nfa = LambdaEliminator.eliminate(nfaOf("(a|b)*abb"));
        assertAccepts(nfa, "abb", "aabb", "babb", "ababb", "bbbabb");
        assertRejects(nfa, "", "ab", "abba", "abab", "bb");
        
        nfa = LambdaEliminator.eliminate(nfaOf(""));
        assertAccepts(nfa, "");
        assertRejects(nfa, "a");
    }
    
    public void testHasLambdas() {
        NFA nfa = nfaOf("ab");
        assertTrue(nfa.hasLambdas());
        try {
            nfa.accepts("ab");
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }
    
    public void testMalformedPostfix() {
        try {
            Thompson.build(Arrays.asList(Token.STAR));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            Thompson.build(Arrays.asList(Token.operand('a', 0), Token.operand('b', 1)));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            Thompson.build(Arrays.asList(Token.operand('a', 0), Token.LPAREN));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }
}
