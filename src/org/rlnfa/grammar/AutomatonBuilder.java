/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rlnfa.grammar.GrammarException.Kind;

/**
 * Folds validated rules into an {@link Automaton}. One state is allocated per
 * declared non-terminal, in symbol order, and {@link State#ACCEPT} is added
 * last. Then, rule by rule:
 * <p>
 * <code>A -&gt; epsilon</code> adds the epsilon transition A to ACCEPT <br>
 * <code>A -&gt; a</code> adds (A, a) to ACCEPT <br>
 * <code>A -&gt; aB</code> adds (A, a) to B
 * <p>
 * Destinations accumulate; a rule never replaces an earlier one.
 */
final class AutomatonBuilder {

    private static final Logger logger = Logger.getLogger("org.rlnfa.grammar");
    private static final Level level = Level.FINER;

    private final Symbols symbols;

    AutomatonBuilder(Symbols symbols) {
        this.symbols = symbols;
    }

    Automaton build(List<Rule> rules) {

        if (rules.isEmpty()) {
            throw new GrammarException(Kind.EMPTY_GRAMMAR, "no rules supplied");
        }
        if (!symbols.isNonTerminal(symbols.start())) {
            throw new GrammarException(Kind.UNDECLARED_START_SYMBOL,
                "start symbol '" + symbols.start() + "' is not in the declared non-terminals "
                + symbols.nonTerminals());
        }

        final Map<String, State> byName = new HashMap<String, State>();
        final List<State> states = new ArrayList<State>(symbols.nonTerminals().size() + 1);
        for (String nt : symbols.nonTerminals()) {
            State s = State.nonTerminal(nt);
            byName.put(nt, s);
            states.add(s);
        }
        states.add(State.ACCEPT);

        final TransitionTable table = new TransitionTable();
        for (Rule rule : rules) {
            final State source = byName.get(rule.source);
            assert source != null : rule;
            switch (rule.shape()) {
            case EPSILON:
                table.addEpsilon(source, State.ACCEPT);
                break;
            case TERMINAL:
                table.add(source, rule.terminal, State.ACCEPT);
                break;
            case TERMINAL_NONTERMINAL:
                final State target = byName.get(rule.target);
                assert target != null : rule;
                table.add(source, rule.terminal, target);
                break;
            default:
                throw new AssertionError(rule.shape());
            }
        }

        Automaton nfa = new Automaton(states, symbols.terminals(), table,
            byName.get(symbols.start()));
        logger.log(level, "automaton: " + nfa, nfa);
        return nfa;
    }
}
