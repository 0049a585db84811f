/* @LICENSE@  
 */

package org.tinyfa.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.tinyfa.regex.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractRxTestCase(String name) {
        super(name);
    }

    /**
     * Keeps the messages published to the package logger while a test runs.
     */
    protected static final class CapturingHandler extends Handler {
        
        private final List<String> messages = new ArrayList<String>();

        @Override
        public synchronized void publish(LogRecord record) {
            if (isLoggable(record)) messages.add(record.getMessage());
        }
        @Override
        public void flush() {}
        @Override
        public void close() {}
        
        public synchronized List<String> messages() {
            return Collections.unmodifiableList(new ArrayList<String>(messages));
        }
    }

    private Logger rxLogger = Logger.getLogger("org.tinyfa.regex");
    private CapturingHandler rxHandler = null;
    private Level rxLevel = null;
    
    /**
     * Starts capturing records of at least <code>level</code> from the
     * <code>org.tinyfa.regex</code> logger, for the rest of the test.
     */
    protected CapturingHandler captureRx(Level level) {
        if (rxHandler == null) {
            rxHandler = new CapturingHandler();
            rxLevel = rxLogger.getLevel();
            rxLogger.addHandler(rxHandler);
        }
        rxHandler.setLevel(level);
        if (!rxLogger.isLoggable(level)) {
            rxLogger.setLevel(level);
        }
        return rxHandler;
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        if (rxHandler != null) {
            rxLogger.removeHandler(rxHandler);
            rxLogger.setLevel(rxLevel);
            rxHandler = null;
        }
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }
    
    protected static SortedSet<String> states(String... names) {
        SortedSet<String> ret = new TreeSet<String>();
        for (String name : names) {
            ret.add(name);
        }
        return ret;
    }
    
    /*
     * wrapper for Misc functions needed by subclasses outside package
     */
    protected static String esc(String s) {
        return Misc.Esc.JAVA.esc(s);
    }
    
    /**
     * Renders a postfix sequence the way it is written in the docs:
     * <code>a_0 b_1 |</code>.
     */
    protected static String postfixOf(String regex) {
        StringBuilder sb = new StringBuilder();
        for (Token t : PostfixCompiler.toPostfix(regex)) {
            sb.append(sb.length() == 0 ? "" : " ").append(t);
        }
        return sb.toString();
    }
}
