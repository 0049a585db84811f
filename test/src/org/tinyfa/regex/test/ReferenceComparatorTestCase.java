/* @LICENSE@  
 */

package org.tinyfa.regex.test;

import static org.tinyfa.regex.RegexAssert.*;

import java.util.List;
import java.util.logging.Level;

import org.tinyfa.regex.AbstractRxTestCase;
import org.tinyfa.regex.ReferenceComparator;
import org.tinyfa.regex.ReferenceComparator.Mismatch;
import org.tinyfa.regex.ReferenceComparator.Report;

public class ReferenceComparatorTestCase extends AbstractRxTestCase {

    public ReferenceComparatorTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
    }

    protected void tearDown() throws Exception {
        super.tearDown();
    }
    
    public void testCorpusAB() {
        String[] regexes = {
            "", "a", "ab", "a|b", "a*", "ab*", "(ab)*", "a*b*", "(a|b)*",
            "(a|b)*abb", "(a|b)*a(a|b)", "((a|b)(a|b))*", "(a*|b)*",
            "a(a|b)*b|b", "(aa|b)*(a|bb)", "(a|ab)b*"
        };
        for (String regex : regexes) {
            assertJavaAgrees(regex, "ab", 6);
        }
    }
    
    public void testCorpusABC() {
        String[] regexes = {
            "a(b|c)*c", "(a|b|c)*", "abc|ab*c*", "((ab)*c)*", "(a(b(c)*)*)*"
        };
        for (String regex : regexes) {
            assertJavaAgrees(regex, "abc", 5);
        }
    }
    
    public void testEscaped() {
        assertJavaAgrees("a\\*|\\(b\\)", "ab*()", 3);
    }
    
    public void testCounts() {
        Report report = ReferenceComparator.compare("a*", "ab", 2);
        assertEquals(7, report.tried());
        assertEquals(7, report.correct());
        assertTrue(report.isClean());
        assertEquals("7 / 7 correct on a* up to length 2", report.toString());
        
        report = ReferenceComparator.compare("a", "abc", 0);
        assertEquals(1, report.tried());
        
        report = ReferenceComparator.compare("a", "", 4);
        assertEquals(1, report.tried());
    }
    
    public void testMismatches() {
        // \b is a literal here and a word boundary to java.util.regex
        CapturingHandler h = captureRx(Level.WARNING);
        Report report = ReferenceComparator.compare("a\\b", "ab", 2);
        assertFalse(report.isClean());
        assertEquals(5, report.correct());
        
        List<Mismatch> mismatches = report.mismatches();
        assertEquals(2, mismatches.size());
        assertEquals("a", mismatches.get(0).input());
        assertFalse(mismatches.get(0).ours());
        assertTrue(mismatches.get(0).reference());
        assertEquals("ab", mismatches.get(1).input());
        assertTrue(mismatches.get(1).ours());
        assertFalse(mismatches.get(1).reference());
        
        assertEquals("Wrong on \"a\": ours false, java.util.regex true", 
            mismatches.get(0).toString());
        assertEquals(2, h.messages().size());
        assertEquals(mismatches.get(1).toString(), h.messages().get(1));
    }
    
    public void testBadLength() {
        try {
            ReferenceComparator.compare("a", "ab", -1);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }
}
