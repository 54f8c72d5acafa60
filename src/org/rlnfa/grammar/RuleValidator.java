/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.containsWhitespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.rlnfa.grammar.GrammarException.Kind;

/**
 * Checks raw rules against the three right-linear shapes and the declared
 * symbols. Shapes are tried in a fixed order - epsilon, terminal followed by
 * non-terminal, lone terminal - so that a given token list always resolves
 * the same way.
 */
final class RuleValidator {

    private final Symbols symbols;

    RuleValidator(Symbols symbols) {
        this.symbols = symbols;
    }

    /**
     * @throws GrammarException
     *             on the first rule that fails; later rules are not looked at.
     */
    List<Rule> validateAll(List<RawRule> raws) {
        List<Rule> ret = new ArrayList<Rule>(raws.size());
        for (RawRule raw : raws) {
            ret.add(validate(raw));
        }
        return Collections.unmodifiableList(ret);
    }

    Rule validate(RawRule raw) {

        final String head = raw.head;
        final List<String> body = raw.body;

        if (head == null || head.length() == 0 || containsWhitespace(head)) {
            throw error(Kind.INVALID_RULE_SHAPE,
                "left side must be exactly one symbol", raw);
        }
        if (!symbols.isNonTerminal(head)) {
            throw error(Kind.NON_TERMINAL_START_REQUIRED,
                "'" + head + "' is not a declared non-terminal", raw);
        }

        switch (body.size()) {
        case 1: {
            final String token = body.get(0);
            if (Symbols.isEpsilon(token)) {
                return Rule.epsilon(head, raw.line);
            }
            checkKnown(token, raw);
            if (!symbols.isTerminal(token)) {
                throw error(Kind.INVALID_RULE_SHAPE,
                    "a single body symbol must be a terminal, found non-terminal '"
                    + token + "'", raw);
            }
            return Rule.terminal(head, token, raw.line);
        }
        case 2: {
            final String terminal = body.get(0);
            final String target = body.get(1);
            checkKnown(terminal, raw);
            checkKnown(target, raw);
            if (!symbols.isTerminal(terminal)) {
                throw error(Kind.INVALID_RULE_SHAPE,
                    "expected a terminal first, found '" + terminal + "'", raw);
            }
            if (!symbols.isNonTerminal(target)) {
                throw error(Kind.INVALID_RULE_SHAPE,
                    "expected a non-terminal after '" + terminal + "', found '"
                    + target + "'", raw);
            }
            return Rule.step(head, terminal, target, raw.line);
        }
        default:
            throw error(Kind.INVALID_RULE_SHAPE,
                "expected 'terminal NonTerminal', 'terminal' or 'epsilon', found "
                + body.size() + " symbols", raw);
        }
    }

    private void checkKnown(String token, RawRule raw) {
        if (!symbols.isDeclared(token) && !Symbols.isEpsilon(token)) {
            throw error(Kind.UNKNOWN_SYMBOL,
                "'" + token + "' is neither a declared terminal nor a declared non-terminal",
                raw);
        }
    }

    private static GrammarException error(Kind kind, String detail, RawRule raw) {
        return new GrammarException(kind, detail, raw.text, raw.line);
    }
}
