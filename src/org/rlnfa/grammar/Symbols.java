/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.containsWhitespace;
import static org.rlnfa.grammar.Misc.intersect;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.rlnfa.grammar.GrammarException.Kind;

/**
 * The symbol tables of a grammar: the declared terminals, the declared
 * non-terminals and the start symbol. Instances are immutable; the sets are
 * sorted so that everything built from them is reproducible.
 * <p>
 * A symbol is any non-blank token without whitespace. The two spellings of
 * the epsilon marker, <code>epsilon</code> (in any letter case) and
 * <code>&#949;</code>, are reserved.
 */
public final class Symbols {

    /**
     * The ASCII spelling of the epsilon marker; matched ignoring case.
     */
    public static final String EPSILON = "epsilon";

    /**
     * The Greek spelling of the epsilon marker.
     */
    public static final String EPSILON_SIGN = "\u03b5";

    private final SortedSet<String> terminals;
    private final SortedSet<String> nonTerminals;
    private final String start;

    private Symbols(SortedSet<String> terminals, SortedSet<String> nonTerminals,
            String start) {
        this.terminals = Collections.unmodifiableSortedSet(terminals);
        this.nonTerminals = Collections.unmodifiableSortedSet(nonTerminals);
        this.start = start;
    }

    /**
     * Validates and freezes a grammar declaration.
     *
     * @param terminals
     *            the terminal alphabet; must not be empty.
     * @param nonTerminals
     *            the non-terminals; must not be empty, must not share a symbol
     *            with <code>terminals</code>.
     * @param start
     *            the start symbol; must be one of <code>nonTerminals</code>.
     * @return the symbol tables.
     * @throws GrammarException
     *             with kind {@link Kind#EMPTY_SYMBOL_SET},
     *             {@link Kind#RESERVED_SYMBOL},
     *             {@link Kind#OVERLAPPING_SYMBOLS} or
     *             {@link Kind#UNDECLARED_START_SYMBOL}.
     */
    public static Symbols declare(Collection<String> terminals,
            Collection<String> nonTerminals, String start) {

        SortedSet<String> ts = checked("terminal", terminals);
        SortedSet<String> nts = checked("non-terminal", nonTerminals);

        Set<String> overlap = intersect(ts, nts);
        if (!overlap.isEmpty()) {
            throw new GrammarException(Kind.OVERLAPPING_SYMBOLS,
                "overlap: " + overlap);
        }
        if (start == null || !nts.contains(start)) {
            throw new GrammarException(Kind.UNDECLARED_START_SYMBOL,
                "start symbol '" + start + "' is not in the declared non-terminals " + nts);
        }
        return new Symbols(ts, nts, start);
    }

    /**
     * Convenience factory for whitespace separated declarations, e.g.
     * <code>parse("a b", "S A", "S")</code>.
     */
    public static Symbols parse(String terminals, String nonTerminals, String start) {
        return declare(split(terminals), split(nonTerminals),
            start == null ? null : start.trim());
    }

    private static Collection<String> split(String s) {
        String trimmed = s == null ? "" : s.trim();
        if (trimmed.length() == 0) {
            return Collections.emptyList();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private static SortedSet<String> checked(String what, Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            throw new GrammarException(Kind.EMPTY_SYMBOL_SET,
                "at least one " + what + " symbol must be declared");
        }
        SortedSet<String> ret = new TreeSet<String>();
        for (String s : symbols) {
            if (s == null || s.length() == 0 || containsWhitespace(s)) {
                throw new GrammarException(Kind.RESERVED_SYMBOL,
                    what + " symbol '" + s + "' is blank or contains whitespace");
            }
            if (isEpsilon(s)) {
                throw new GrammarException(Kind.RESERVED_SYMBOL,
                    what + " symbol '" + s + "' spells the epsilon marker");
            }
            ret.add(s);
        }
        return ret;
    }

    /**
     * @return true iff <code>token</code> is one of the epsilon marker
     *         spellings.
     */
    public static boolean isEpsilon(String token) {
        return token != null
                && (EPSILON.equalsIgnoreCase(token) || EPSILON_SIGN.equals(token));
    }

    public boolean isTerminal(String token) {
        return token != null && terminals.contains(token);
    }

    public boolean isNonTerminal(String token) {
        return token != null && nonTerminals.contains(token);
    }

    /**
     * @return true iff <code>token</code> is a declared symbol of either kind.
     */
    public boolean isDeclared(String token) {
        return isTerminal(token) || isNonTerminal(token);
    }

    public SortedSet<String> terminals() {
        return terminals;
    }

    public SortedSet<String> nonTerminals() {
        return nonTerminals;
    }

    public String start() {
        return start;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + nonTerminals.hashCode();
        result = prime * result + start.hashCode();
        result = prime * result + terminals.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Symbols))
            return false;
        final Symbols other = (Symbols) obj;
        return terminals.equals(other.terminals)
                && nonTerminals.equals(other.nonTerminals)
                && start.equals(other.start);
    }

    @Override
    public String toString() {
        return "{T=" + terminals + ", N=" + nonTerminals + ", S=" + start + '}';
    }
}
