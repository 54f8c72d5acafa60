/* @LICENSE@  
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.RawRule.of;

import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

import org.rlnfa.grammar.GrammarException.Kind;
import org.rlnfa.grammar.Rule.Shape;

public class RuleValidatorTestCase extends TestCase {

    private RuleValidator validator;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RuleValidatorTestCase.class);
    }

    public RuleValidatorTestCase(String arg0) {
        super(arg0);
    }

    protected void setUp() throws Exception {
        super.setUp();
        validator = new RuleValidator(Symbols.parse("a b", "S A", "S"));
    }

    private GrammarException assertInvalid(Kind kind, RawRule raw) {
        try {
            Rule r = validator.validate(raw);
            fail("validated " + r);
            return null;
        } catch (GrammarException e) {
            assertEquals(e.getMessage(), kind, e.kind());
            assertEquals(raw.text(), e.rule());
            assertEquals(raw.line(), e.index());
            return e;
        }
    }

    public void testEpsilon() {
        for (String eps : new String[] {"epsilon", "EPSILON", "ε"}) {
            Rule r = validator.validate(of(1, "S", eps));
            assertEquals(Shape.EPSILON, r.shape());
            assertEquals("S", r.source());
            assertNull(r.terminal());
            assertNull(r.target());
        }
    }

    public void testTerminal() {
        Rule r = validator.validate(of(3, "A", "b"));
        assertEquals(Shape.TERMINAL, r.shape());
        assertEquals("A", r.source());
        assertEquals("b", r.terminal());
        assertNull(r.target());
        assertEquals(3, r.line());
        assertEquals("A -> b", r.toString());
    }

    public void testStep() {
        Rule r = validator.validate(of(1, "S", "a", "A"));
        assertEquals(Shape.TERMINAL_NONTERMINAL, r.shape());
        assertEquals("a", r.terminal());
        assertEquals("A", r.target());
        assertEquals("S -> a A", r.toString());
    }

    public void testUnknownSymbol() {
        assertInvalid(Kind.UNKNOWN_SYMBOL, of(1, "S", "c"));
        assertInvalid(Kind.UNKNOWN_SYMBOL, of(1, "S", "a", "X"));
        GrammarException e = assertInvalid(Kind.UNKNOWN_SYMBOL, of(2, "S", "c", "A"));
        assertTrue(e.getMessage(), e.getMessage().contains("'c'"));
    }

    public void testHeadMustBeNonTerminal() {
        assertInvalid(Kind.NON_TERMINAL_START_REQUIRED, of(1, "a", "b"));
        assertInvalid(Kind.NON_TERMINAL_START_REQUIRED, of(1, "X", "b"));
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "", "b"));
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S A", "b"));
    }

    public void testBadShapes() {
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S", "A"));        // unit rule
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S", "A", "a"));   // left-linear
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S", "a", "b"));
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S", "epsilon", "A"));
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S"));
        assertInvalid(Kind.INVALID_RULE_SHAPE, of(1, "S", "a", "b", "A"));
    }

    public void testFirstFailureWins() {
        List<RawRule> raws = Arrays.asList(
            of(1, "S", "a", "A"),
            of(2, "S", "A"),
            of(3, "S", "z"));
        try {
            validator.validateAll(raws);
            fail();
        } catch (GrammarException e) {
            assertEquals(Kind.INVALID_RULE_SHAPE, e.kind());
            assertEquals(2, e.index());
        }
    }

    public void testValidateAll() {
        List<Rule> rules = validator.validateAll(Arrays.asList(
            of(1, "S", "a", "A"),
            of(2, "A", "b"),
            of(3, "A", "epsilon")));
        assertEquals(3, rules.size());
        assertEquals(Shape.TERMINAL_NONTERMINAL, rules.get(0).shape());
        assertEquals(Shape.TERMINAL, rules.get(1).shape());
        assertEquals(Shape.EPSILON, rules.get(2).shape());
    }

    public void testEqualityIgnoresLine() {
        Rule r1 = validator.validate(of(1, "S", "a", "A"));
        Rule r2 = validator.validate(of(7, "S", "a", "A"));
        assertEquals(r1, r2);
        assertEquals(r1.hashCode(), r2.hashCode());
        assertFalse(r1.equals(validator.validate(of(1, "S", "a"))));
    }
}
