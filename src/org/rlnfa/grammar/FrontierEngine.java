/*@LICENSE@
 */
package org.rlnfa.grammar;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Subset simulation on sets of {@link State}s. The frontier starts as the
 * closure of the start state; for each symbol, the destinations of every
 * frontier state on that symbol are collected and the frontier becomes the
 * union of their closures. An empty frontier can never fill up again, so
 * once it empties no more transitions are looked up.
 */
final class FrontierEngine extends Engine {

    private final Automaton nfa;
    private final EpsilonClosure closure;

    FrontierEngine(EngineStyle style, Automaton nfa, EpsilonClosure closure) {
        super(style);
        this.nfa = nfa;
        this.closure = closure;
    }

    @Override
    protected void eval(Simulation sim) {

        Set<State> frontier = closure.closureOf(nfa.start());
        sim.record(frontier);

        int i = 0;
        for (String symbol : sim.input) {
            if (!frontier.isEmpty()) {
                Set<State> reached = new LinkedHashSet<State>();
                for (State q : frontier) {
                    reached.addAll(nfa.targets(q, symbol));
                }
                frontier = reached.isEmpty()
                        ? Collections.<State>emptySet()
                        : closure.closureOf(reached);
                if (frontier.isEmpty()) {
                    sim.deadAt = i;
                }
            }
            if (sim.tracing) {
                sim.record(frontier);
            } else if (frontier.isEmpty()) {
                break;
            }
            ++i;
        }
        sim.accepted = !Collections.disjoint(frontier, nfa.accepting());
    }
}
