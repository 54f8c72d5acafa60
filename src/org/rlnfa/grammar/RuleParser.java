/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.containsWhitespace;
import static org.rlnfa.grammar.Misc.symbolsOf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.rlnfa.grammar.GrammarException.Kind;

/**
 * Reads rule lines of the form <code>S -&gt; aA | b | epsilon</code> into
 * {@link RawRule}s, one per alternative. Blank lines and lines starting with
 * <code>#</code> are skipped. No symbol checking happens here beyond what is
 * needed to split an alternative into tokens; that is the validator's job.
 */
final class RuleParser {

    static final String ARROW = "->";
    static final char BAR = '|';
    static final char COMMENT = '#';

    private final Symbols symbols;

    RuleParser(Symbols symbols) {
        this.symbols = symbols;
    }

    List<RawRule> parse(String... lines) {
        return parse(Arrays.asList(lines));
    }

    List<RawRule> parse(List<String> lines) {
        List<RawRule> ret = new ArrayList<RawRule>();
        int n = 0;
        for (String line : lines) {
            ++n;
            parseLine(line, n, ret);
        }
        return Collections.unmodifiableList(ret);
    }

    private void parseLine(String line, int n, List<RawRule> out) {

        final String trimmed = line.trim();
        if (trimmed.length() == 0 || trimmed.charAt(0) == COMMENT) {
            return;
        }
        final int arrow = trimmed.indexOf(ARROW);
        if (arrow < 0) {
            throw new GrammarException(Kind.INVALID_RULE_SHAPE,
                "missing '" + ARROW + "'", trimmed, n);
        }
        final String head = trimmed.substring(0, arrow).trim();
        if (head.length() == 0) {
            throw new GrammarException(Kind.INVALID_RULE_SHAPE,
                "rule head cannot be empty", trimmed, n);
        }
        final String body = trimmed.substring(arrow + ARROW.length());
        if (body.indexOf(ARROW) >= 0) {
            throw new GrammarException(Kind.INVALID_RULE_SHAPE,
                "duplicate '" + ARROW + "'", trimmed, n);
        }

        int from = 0;
        int bar;
        do {
            bar = body.indexOf(BAR, from);
            final String alt = (bar < 0 ? body.substring(from) : body.substring(from, bar)).trim();
            if (alt.length() == 0) {
                throw new GrammarException(Kind.INVALID_RULE_SHAPE,
                    "empty alternative for '" + head + "', use '" + Symbols.EPSILON + "'",
                    trimmed, n);
            }
            out.add(new RawRule(head, tokens(alt), head + ' ' + ARROW + ' ' + alt, n));
            from = bar + 1;
        } while (bar >= 0);
    }

    /**
     * Whitespace separates tokens when present; otherwise a declared symbol
     * or the epsilon marker is one token, and anything else is read one
     * character per token (so <code>aA</code> is <code>a</code>,
     * <code>A</code>).
     */
    List<String> tokens(String alt) {
        if (containsWhitespace(alt)) {
            return Arrays.asList(alt.split("\\s+"));
        }
        if (Symbols.isEpsilon(alt) || symbols.isDeclared(alt)) {
            return Collections.singletonList(alt);
        }
        return symbolsOf(alt);
    }
}
