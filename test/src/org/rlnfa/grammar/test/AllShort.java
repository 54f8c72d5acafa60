/* @LICENSE@  
 */


package org.rlnfa.grammar.test;

import org.rlnfa.grammar.AutomatonBuilderTestCase;
import org.rlnfa.grammar.EpsilonClosureTestCase;
import org.rlnfa.grammar.RuleParserTestCase;
import org.rlnfa.grammar.RuleValidatorTestCase;
import org.rlnfa.grammar.SymbolsTestCase;
import org.rlnfa.grammar.shell.MainTestCase;
import org.rlnfa.grammar.shell.SessionTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(SymbolsTestCase.class);
        suite.addTestSuite(RuleParserTestCase.class);
        suite.addTestSuite(RuleValidatorTestCase.class);
        suite.addTestSuite(AutomatonBuilderTestCase.class);
        suite.addTestSuite(EpsilonClosureTestCase.class);
        suite.addTestSuite(SimulationTestCase.class);
        suite.addTestSuite(SessionTestCase.class);
        suite.addTestSuite(MainTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
