/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rlnfa.grammar.Misc.BreadthFirstVisitor;

/**
 * The epsilon closure table of an {@link Automaton}: for every state, the
 * states reachable through zero or more epsilon transitions, the state itself
 * included. All closures are computed up front by {@link #of(Automaton)};
 * lookups afterwards never traverse the graph. Epsilon cycles are fine, the
 * traversal never visits a state twice.
 */
public final class EpsilonClosure {

    private static final Logger logger = Logger.getLogger("org.rlnfa.grammar");
    private static final Level level = Level.FINER;

    private final Map<State, Set<State>> table;

    private EpsilonClosure(Map<State, Set<State>> table) {
        this.table = Collections.unmodifiableMap(table);
    }

    public static EpsilonClosure of(final Automaton nfa) {

        final BreadthFirstVisitor<State> bfs = new BreadthFirstVisitor<State>() {
            @Override
            protected Iterable<State> successors(State state) {
                return nfa.epsilonTargets(state);
            }
        };

        Map<State, Set<State>> table = new LinkedHashMap<State, Set<State>>();
        for (State state : nfa.states()) {
            table.put(state, bfs.start(state).visited());
        }
        EpsilonClosure ret = new EpsilonClosure(table);
        logger.log(level, "closure: " + ret, ret);
        return ret;
    }

    /**
     * @return the closure of <code>state</code>; contains <code>state</code>.
     * @throws IllegalArgumentException
     *             if <code>state</code> does not belong to the automaton.
     */
    public Set<State> closureOf(State state) {
        Set<State> ret = table.get(state);
        if (ret == null) {
            throw new IllegalArgumentException("unknown state: " + state);
        }
        return ret;
    }

    /**
     * @return the union of the closures of <code>states</code>.
     */
    public Set<State> closureOf(Collection<State> states) {
        Set<State> ret = new LinkedHashSet<State>();
        for (State s : states) {
            ret.addAll(closureOf(s));
        }
        return ret;
    }

    public Set<State> states() {
        return table.keySet();
    }

    @Override
    public int hashCode() {
        return table.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof EpsilonClosure))
            return false;
        return table.equals(((EpsilonClosure) obj).table);
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
