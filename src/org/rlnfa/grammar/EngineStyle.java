/* @LICENSE@
 */
package org.rlnfa.grammar;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Represents each implemented simulation algorithm. Internally, this enum
 * class is used as a factory to create "Engine"s. Every style simulates the
 * same epsilon-NFA and reaches the same verdicts; they differ in speed and in
 * how much they keep around.
 */
public enum EngineStyle {

    /**
     * The default style: steps a set of {@link State}s through the input,
     * looking closures up after every symbol. Frontiers are handed out as
     * they are computed, which makes this the natural choice for tracing.
     */
    FRONTIER {
        @Override
        Engine newEngine(Automaton nfa, EpsilonClosure closure) {
            return new FrontierEngine(this, nfa, closure);
        }
    },

    /**
     * Table driven implementation: states are numbered, and for every
     * (symbol, state) pair the closure of the destinations is precomputed as
     * a {@link java.util.BitSet}. A step is then a handful of word-wide ORs.
     */
    BIT_TABLE {
        @Override
        Engine newEngine(Automaton nfa, EpsilonClosure closure) {
            return new BitSetEngine(this, nfa, closure);
        }
    };

    private static final Logger logger = Logger.getLogger("org.rlnfa.grammar");
    private static final Level level = Level.FINEST;

    abstract Engine newEngine(Automaton nfa, EpsilonClosure closure);

    final Engine engineFor(Automaton nfa, EpsilonClosure closure) {
        logger.log(level, "EngineStyle selected: " + this);
        return newEngine(nfa, closure);
    }

    /**
     * Lenient lookup by name, ignoring case and accepting the short spellings
     * <code>frontier</code>, <code>bitset</code> and <code>bit-table</code>.
     *
     * @throws IllegalArgumentException
     *             if no style matches.
     */
    public static EngineStyle forName(String name) {
        String n = name.trim().toUpperCase().replace('-', '_');
        if (n.equals("BITSET")) {
            return BIT_TABLE;
        }
        return valueOf(n);
    }
}
