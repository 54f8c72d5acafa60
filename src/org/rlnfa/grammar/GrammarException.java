/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

/**
 * Thrown when a grammar declaration or one of its rules cannot be compiled.
 * Analog to {@link java.util.regex.PatternSyntaxException}: the exception names
 * what went wrong ({@link #kind()}), the offending rule text and the index of
 * that rule, so that a caller can print a useful diagnostic. A build that
 * throws never yields a partial automaton.
 */
public final class GrammarException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * The reasons a grammar is rejected.
     */
    public enum Kind {
        /**
         * The rule body matches none of the right-linear forms
         * <code>aB</code>, <code>a</code> or <code>epsilon</code>.
         */
        INVALID_RULE_SHAPE("invalid rule shape"),
        /**
         * A rule token is neither a declared terminal, a declared non-terminal
         * nor the epsilon marker.
         */
        UNKNOWN_SYMBOL("unknown symbol"),
        /**
         * The left side of a rule is not a declared non-terminal.
         */
        NON_TERMINAL_START_REQUIRED("non-terminal required on the left side"),
        /**
         * No rules were supplied.
         */
        EMPTY_GRAMMAR("empty grammar"),
        /**
         * The start symbol is not among the declared non-terminals.
         */
        UNDECLARED_START_SYMBOL("undeclared start symbol"),
        /**
         * The terminal or the non-terminal declaration is empty.
         */
        EMPTY_SYMBOL_SET("empty symbol set"),
        /**
         * A symbol is declared both as a terminal and as a non-terminal.
         */
        OVERLAPPING_SYMBOLS("terminals and non-terminals overlap"),
        /**
         * A declared symbol is blank, contains whitespace, or spells the
         * epsilon marker.
         */
        RESERVED_SYMBOL("reserved or malformed symbol");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Kind kind;
    private final String rule;
    private final int index;

    GrammarException(Kind kind, String detail) {
        this(kind, detail, null, -1);
    }

    GrammarException(Kind kind, String detail, String rule, int index) {
        super(detail);
        this.kind = kind;
        this.rule = rule;
        this.index = index;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the text of the offending rule, or <code>null</code> if the
     *         failure is not tied to a single rule.
     */
    public String rule() {
        return rule;
    }

    /**
     * @return the 1-based index (line number) of the offending rule, or -1.
     */
    public int index() {
        return index;
    }

    public String detail() {
        return super.getMessage();
    }

    /**
     * Multi-line message in the manner of
     * {@link java.util.regex.PatternSyntaxException#getMessage()}: the kind and
     * detail, then the rule and its index when there is one.
     */
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.description());
        if (detail() != null) {
            sb.append(": ").append(detail());
        }
        if (rule != null) {
            sb.append(LS);
            sb.append(index >= 0 ? "rule " + index + ": " : "rule: ").append(rule);
        }
        return sb.toString();
    }
}
