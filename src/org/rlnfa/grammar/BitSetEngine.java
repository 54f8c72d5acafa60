/*@LICENSE@
 */
package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Table driven subset simulation. States are numbered in automaton order; the
 * frontier is a {@link BitSet}. For every (symbol, state) pair the table holds
 * the union of the closures of the destinations, so stepping the frontier is
 * an OR of one row per live state and no closure is looked up at run time.
 */
final class BitSetEngine extends Engine {

    final State[] states;
    final BitSet initial;
    final BitSet[][] step;      // [symbol][state]
    final Map<String, Integer> symbolIndex = new HashMap<String, Integer>();
    final int accept;

    BitSetEngine(EngineStyle style, final Automaton nfa, final EpsilonClosure closure) {

        super(style);
        states = nfa.states().toArray(new State[nfa.states().size()]);
        Map<State, Integer> s2i = new HashMap<State, Integer>();
        for (int i = 0; i < states.length; ++i) s2i.put(states[i], i);

        int k = 0;
        for (String symbol : nfa.alphabet()) symbolIndex.put(symbol, k++);

        step = new BitSet[k][states.length];
        for (String symbol : nfa.alphabet()) {
            BitSet[] row = step[symbolIndex.get(symbol)];
            for (int i = 0; i < states.length; ++i) {
                row[i] = bitsFor(closure.closureOf(nfa.targets(states[i], symbol)), s2i);
            }
        }
        initial = bitsFor(closure.closureOf(nfa.start()), s2i);
        accept = s2i.get(State.ACCEPT);
        // N.B. : no reference to the Automaton is kept around.
    }

    private BitSet bitsFor(Set<State> set, Map<State, Integer> s2i) {
        BitSet ret = new BitSet(states.length);
        for (State s : set) ret.set(s2i.get(s));
        return ret;
    }

    private Set<State> statesFor(BitSet bits) {
        Set<State> ret = new LinkedHashSet<State>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            ret.add(states[i]);
        }
        return ret;
    }

    @Override
    protected void eval(Simulation sim) {

        BitSet frontier = (BitSet) initial.clone();
        if (sim.tracing) sim.record(statesFor(frontier));

        int i = 0;
        for (String symbol : sim.input) {
            if (!frontier.isEmpty()) {
                Integer k = symbolIndex.get(symbol);
                BitSet next = new BitSet(states.length);
                if (k != null) {
                    BitSet[] row = step[k];
                    for (int q = frontier.nextSetBit(0); q >= 0; q = frontier.nextSetBit(q + 1)) {
                        next.or(row[q]);
                    }
                }
                frontier = next;
                if (frontier.isEmpty()) {
                    sim.deadAt = i;
                }
            }
            if (sim.tracing) {
                sim.record(statesFor(frontier));
            } else if (frontier.isEmpty()) {
                break;
            }
            ++i;
        }
        sim.accepted = frontier.get(accept);
    }

    @Override
    protected String doToString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states=").append(Arrays.toString(states)).append(LS)
          .append(" symbols=").append(symbolIndex).append(LS)
          .append(" initial=").append(initial);
        return sb.toString();
    }
}
