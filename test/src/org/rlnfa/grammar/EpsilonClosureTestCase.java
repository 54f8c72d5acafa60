/* @LICENSE@  
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.RawRule.of;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public class EpsilonClosureTestCase extends AbstractGrammarTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(EpsilonClosureTestCase.class);
    }

    public EpsilonClosureTestCase(String name) {
        super(name);
    }

    private static Set<State> set(State... states) {
        return new HashSet<State>(Arrays.asList(states));
    }

    /*
     * P -e-> Q -e-> R -e-> P, R -e-> ACCEPT, P -x-> Q, Z isolated.
     * Grammar rules only ever add epsilon edges into ACCEPT, so the
     * cycle has to be built by hand.
     */
    private static Automaton cyclic() {
        State p = State.nonTerminal("P");
        State q = State.nonTerminal("Q");
        State r = State.nonTerminal("R");
        State z = State.nonTerminal("Z");
        TransitionTable table = new TransitionTable();
        table.addEpsilon(p, q);
        table.addEpsilon(q, r);
        table.addEpsilon(r, p);
        table.addEpsilon(r, State.ACCEPT);
        table.addEpsilon(z, z);
        table.add(p, "x", q);
        List<State> states = new ArrayList<State>(Arrays.asList(p, q, r, z, State.ACCEPT));
        SortedSet<String> alphabet = new TreeSet<String>(Arrays.asList("x"));
        return new Automaton(states, alphabet, table, p);
    }

    private static void assertClosureLaws(Automaton nfa, EpsilonClosure closure) {
        assertEquals(new HashSet<State>(nfa.states()), closure.states());
        for (State s : nfa.states()) {
            Set<State> c = closure.closureOf(s);
            assertTrue(s + " not in own closure", c.contains(s));
            for (State t : c) {
                assertTrue("closure of " + s + " not transitive at " + t,
                    c.containsAll(closure.closureOf(t)));
                assertTrue("closure of " + s + " not closed under epsilon at " + t,
                    c.containsAll(nfa.epsilonTargets(t)));
            }
            assertEquals(c, closure.closureOf(c));
        }
    }

    public void testFromGrammar() {
        Symbols symbols = Symbols.parse("a", "S A", "S");
        Automaton nfa = build(symbols,
            of(1, "S", "epsilon"),
            of(2, "S", "a", "A"),
            of(3, "A", "a"));
        EpsilonClosure closure = EpsilonClosure.of(nfa);
        assertEquals(set(nfa.start(), State.ACCEPT), closure.closureOf(nfa.start()));
        assertEquals(set(nfa.stateOf("A")), closure.closureOf(nfa.stateOf("A")));
        assertEquals(set(State.ACCEPT), closure.closureOf(State.ACCEPT));
        assertClosureLaws(nfa, closure);
    }

    public void testCycle() {
        Automaton nfa = cyclic();
        EpsilonClosure closure = EpsilonClosure.of(nfa);
        Set<State> all = set(nfa.stateOf("P"), nfa.stateOf("Q"), nfa.stateOf("R"), State.ACCEPT);
        assertEquals(all, closure.closureOf(nfa.stateOf("P")));
        assertEquals(all, closure.closureOf(nfa.stateOf("Q")));
        assertEquals(all, closure.closureOf(nfa.stateOf("R")));
        assertEquals(set(nfa.stateOf("Z")), closure.closureOf(nfa.stateOf("Z")));
        assertEquals(set(State.ACCEPT), closure.closureOf(State.ACCEPT));
        assertClosureLaws(nfa, closure);
    }

    public void testDeterministic() {
        Automaton nfa = cyclic();
        assertEquals(EpsilonClosure.of(nfa), EpsilonClosure.of(nfa));
        assertEquals(EpsilonClosure.of(nfa).hashCode(), EpsilonClosure.of(nfa).hashCode());
    }

    public void testUnion() {
        Automaton nfa = cyclic();
        EpsilonClosure closure = EpsilonClosure.of(nfa);
        Set<State> u = closure.closureOf(Arrays.asList(nfa.stateOf("Z"), State.ACCEPT));
        assertEquals(set(nfa.stateOf("Z"), State.ACCEPT), u);
        assertTrue(closure.closureOf(new ArrayList<State>()).isEmpty());
    }

    public void testUnknownState() {
        EpsilonClosure closure = EpsilonClosure.of(cyclic());
        try {
            closure.closureOf(State.nonTerminal("nope"));
            fail();
        } catch (IllegalArgumentException e) {/* expected */}
    }
}
