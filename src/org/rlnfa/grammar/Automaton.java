/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * Automaton: an epsilon-NFA compiled from a right-linear grammar. Holds the
 * states (one per non-terminal, then {@link State#ACCEPT}), the terminal
 * alphabet, the transition table, the start state and the accepting set,
 * which is always exactly <code>{ACCEPT}</code>. Immutable once built.
 */
public final class Automaton {

    final List<State> states;
    final SortedSet<String> alphabet;
    final TransitionTable transitions;
    final State start;
    final Set<State> accepting;

    Automaton(List<State> states, SortedSet<String> alphabet,
            TransitionTable transitions, State start) {

        this.states = Collections.unmodifiableList(states);
        this.alphabet = Collections.unmodifiableSortedSet(alphabet);
        this.transitions = transitions.freeze();
        this.start = start;
        this.accepting = Collections.singleton(State.ACCEPT);

        assert states.contains(start) : start;
        assert states.containsAll(accepting) : states;
        assert states.containsAll(transitions.endpoints()) : transitions;
        assert alphabet.containsAll(transitions.alphabetUsed()) : transitions;
    }

    /**
     * @return the states, non-terminal states in symbol order followed by
     *         {@link State#ACCEPT}.
     */
    public List<State> states() {
        return states;
    }

    public SortedSet<String> alphabet() {
        return alphabet;
    }

    public State start() {
        return start;
    }

    public Set<State> accepting() {
        return accepting;
    }

    public boolean isAccepting(State state) {
        return accepting.contains(state);
    }

    /**
     * @return the destinations of <code>source</code> on <code>terminal</code>;
     *         empty if there are none, in particular for symbols outside the
     *         alphabet.
     */
    public Set<State> targets(State source, String terminal) {
        return transitions.targets(source, terminal);
    }

    public Set<State> epsilonTargets(State source) {
        return transitions.epsilonTargets(source);
    }

    /**
     * @return the state standing for non-terminal <code>name</code>, or
     *         <code>null</code> if there is none.
     */
    public State stateOf(String name) {
        for (State s : states) {
            if (!s.isAccepting() && s.name().equals(name)) return s;
        }
        return null;
    }

    /**
     * @return the number of transitions, epsilon transitions included.
     */
    public int transitionCount() {
        return transitions.size();
    }

    /**
     * Structural equality: same states, alphabet, start and transitions.
     */
    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + states.hashCode();
        result = prime * result + alphabet.hashCode();
        result = prime * result + start.hashCode();
        result = prime * result + transitions.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Automaton))
            return false;
        final Automaton other = (Automaton) obj;
        return states.equals(other.states)
                && alphabet.equals(other.alphabet)
                && start.equals(other.start)
                && transitions.equals(other.transitions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("NFA(").append(LS)
          .append("  States: ").append(states).append(LS)
          .append("  Alphabet: ").append(alphabet).append(LS)
          .append("  Transitions:").append(LS).append(transitions)
          .append("  Start State: ").append(start).append(LS)
          .append("  Accept States: ").append(accepting).append(LS)
          .append(')');
        return sb.toString();
    }
}
