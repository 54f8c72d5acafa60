/*
 * @LICENSE@
 */
package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The outcome of running one input through a compiled {@link Grammar}: the
 * accept/reject verdict plus what a report needs to explain it. Instances are
 * produced by {@link Grammar#simulate(java.util.List)} and
 * {@link Grammar#trace(java.util.List)} and are immutable once returned.
 * <p>
 * A simulation never fails. Input symbols outside the terminal alphabet have
 * no transitions, so they empty the frontier and the input is rejected; they
 * are listed by {@link #unknownSymbols()} for the caller to warn about. A
 * <code>null</code> symbol is a caller bug, not input, and is refused with a
 * {@link NullPointerException} before the run starts.
 */
public final class Simulation {

    private static final Logger logger = Logger.getLogger("org.rlnfa.grammar");
    private static final Level level = Level.FINE;

    final List<String> input;
    final boolean tracing;
    private final SortedSet<String> unknownSymbols;
    private final List<Set<State>> frontiers;

    /*
     * set by the Engine
     */
    boolean accepted = false;
    int deadAt = -1;

    Simulation(Grammar grammar, List<String> input, boolean tracing) {
        this.input = Collections.unmodifiableList(new ArrayList<String>(input));
        this.tracing = tracing;
        this.frontiers = tracing
                ? new ArrayList<Set<State>>(input.size() + 1)
                : Collections.<Set<State>>emptyList();

        SortedSet<String> unknown = new TreeSet<String>();
        for (int i = 0; i < this.input.size(); ++i) {
            final String symbol = this.input.get(i);
            if (symbol == null) {
                throw new NullPointerException("input symbol " + i + " is null");
            }
            if (!grammar.automaton.alphabet.contains(symbol)) unknown.add(symbol);
        }
        this.unknownSymbols = Collections.unmodifiableSortedSet(unknown);
        if (!unknown.isEmpty()) {
            logger.log(level, "symbols outside the alphabet " + grammar.automaton.alphabet
                + ": " + unknown);
        }
    }

    void record(Set<State> frontier) {
        if (tracing) {
            frontiers.add(Collections.unmodifiableSortedSet(new TreeSet<State>(frontier)));
        }
    }

    Simulation run(Engine engine) {
        engine.eval(this);
        return this;
    }

    public boolean accepted() {
        return accepted;
    }

    public List<String> input() {
        return input;
    }

    /**
     * @return the distinct input symbols that are not in the terminal
     *         alphabet; empty for well-formed input.
     */
    public SortedSet<String> unknownSymbols() {
        return unknownSymbols;
    }

    /**
     * @return the index of the input symbol after which the frontier became
     *         empty, or -1 if it never did.
     */
    public int deadAt() {
        return deadAt;
    }

    public boolean isTraced() {
        return tracing;
    }

    /**
     * The frontiers of a traced run: the closure of the start state first,
     * then the frontier after each input symbol, so there are
     * <code>input().size() + 1</code> of them. Empty for untraced runs.
     */
    public List<Set<State>> frontiers() {
        return Collections.unmodifiableList(frontiers);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("input=").append(input).append(',')
          .append("accepted=").append(accepted);
        if (!unknownSymbols.isEmpty()) {
            sb.append(',').append("unknown=").append(unknownSymbols);
        }
        if (deadAt >= 0) {
            sb.append(',').append("deadAt=").append(deadAt);
        }
        for (int i = 0; i < frontiers.size(); ++i) {
            sb.append(LS).append("  ")
              .append(i == 0 ? "start" : input.get(i - 1)).append(": ")
              .append(frontiers.get(i));
        }
        return sb.toString();
    }
}
