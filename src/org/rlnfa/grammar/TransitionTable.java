/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The transition relation of an automaton: (state, terminal) to a set of
 * states, and state to the set of its epsilon successors. Inserting never
 * overwrites - a second destination for the same key is added to the set,
 * which is how nondeterminism is kept. After {@link #freeze()} the table is
 * read only.
 */
final class TransitionTable {

    private final SortedMap<State, SortedMap<String, SortedSet<State>>> delta =
            new TreeMap<State, SortedMap<String, SortedSet<State>>>();
    private final SortedMap<State, SortedSet<State>> epsilon =
            new TreeMap<State, SortedSet<State>>();
    private boolean frozen = false;

    void add(State source, String terminal, State dest) {
        checkNotFrozen();
        SortedMap<String, SortedSet<State>> row = delta.get(source);
        if (row == null) {
            delta.put(source, row = new TreeMap<String, SortedSet<State>>());
        }
        SortedSet<State> dests = row.get(terminal);
        if (dests == null) {
            row.put(terminal, dests = new TreeSet<State>());
        }
        dests.add(dest);
    }

    void addEpsilon(State source, State dest) {
        checkNotFrozen();
        SortedSet<State> dests = epsilon.get(source);
        if (dests == null) {
            epsilon.put(source, dests = new TreeSet<State>());
        }
        dests.add(dest);
    }

    private void checkNotFrozen() {
        if (frozen)
            throw new IllegalStateException("frozen TransitionTable");
    }

    TransitionTable freeze() {
        if (frozen) return this;
        frozen = true;
        for (Map.Entry<State, SortedMap<String, SortedSet<State>>> e : delta.entrySet()) {
            SortedMap<String, SortedSet<State>> row = e.getValue();
            for (Map.Entry<String, SortedSet<State>> r : row.entrySet()) {
                r.setValue(Collections.unmodifiableSortedSet(r.getValue()));
            }
            e.setValue(Collections.unmodifiableSortedMap(row));
        }
        for (Map.Entry<State, SortedSet<State>> e : epsilon.entrySet()) {
            e.setValue(Collections.unmodifiableSortedSet(e.getValue()));
        }
        return this;
    }

    boolean isFrozen() {
        return frozen;
    }

    /**
     * @return the destinations of <code>source</code> on <code>terminal</code>;
     *         empty if there is no such transition.
     */
    Set<State> targets(State source, String terminal) {
        SortedMap<String, SortedSet<State>> row = delta.get(source);
        if (row == null) return Collections.emptySet();
        Set<State> dests = row.get(terminal);
        return dests == null ? Collections.<State>emptySet() : dests;
    }

    /**
     * @return the epsilon successors of <code>source</code>; possibly empty.
     */
    Set<State> epsilonTargets(State source) {
        Set<State> dests = epsilon.get(source);
        return dests == null ? Collections.<State>emptySet() : dests;
    }

    /**
     * Every state appearing as a source or a destination, in order.
     */
    SortedSet<State> endpoints() {
        SortedSet<State> ret = new TreeSet<State>();
        for (Map.Entry<State, SortedMap<String, SortedSet<State>>> e : delta.entrySet()) {
            ret.add(e.getKey());
            for (Set<State> dests : e.getValue().values()) ret.addAll(dests);
        }
        for (Map.Entry<State, SortedSet<State>> e : epsilon.entrySet()) {
            ret.add(e.getKey());
            ret.addAll(e.getValue());
        }
        return ret;
    }

    /**
     * Every terminal used as a label.
     */
    SortedSet<String> alphabetUsed() {
        SortedSet<String> ret = new TreeSet<String>();
        for (SortedMap<String, SortedSet<State>> row : delta.values()) {
            ret.addAll(row.keySet());
        }
        return ret;
    }

    int size() {
        int n = 0;
        for (SortedMap<String, SortedSet<State>> row : delta.values()) {
            for (Set<State> dests : row.values()) n += dests.size();
        }
        for (Set<State> dests : epsilon.values()) n += dests.size();
        return n;
    }

    @Override
    public int hashCode() {
        return 31 * delta.hashCode() + epsilon.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof TransitionTable))
            return false;
        final TransitionTable other = (TransitionTable) obj;
        return delta.equals(other.delta) && epsilon.equals(other.epsilon);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<State, SortedMap<String, SortedSet<State>>> e : delta.entrySet()) {
            for (Map.Entry<String, SortedSet<State>> r : e.getValue().entrySet()) {
                sb.append("    (").append(e.getKey()).append(", ").append(r.getKey())
                  .append("): ").append(r.getValue()).append(LS);
            }
        }
        for (Map.Entry<State, SortedSet<State>> e : epsilon.entrySet()) {
            sb.append("    (").append(e.getKey()).append(", ").append(Symbols.EPSILON_SIGN)
              .append("): ").append(e.getValue()).append(LS);
        }
        return sb.toString();
    }
}
