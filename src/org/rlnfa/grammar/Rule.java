/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

/**
 * A validated right-linear production. Exactly one of three shapes holds:
 * <ul>
 * <li>{@link Shape#EPSILON} - <code>A -&gt; epsilon</code>: no terminal, no
 * target;</li>
 * <li>{@link Shape#TERMINAL_NONTERMINAL} - <code>A -&gt; aB</code>: a terminal
 * and a target;</li>
 * <li>{@link Shape#TERMINAL} - <code>A -&gt; a</code>: a terminal, no target
 * (the rule ends in the accepting state).</li>
 * </ul>
 * Instances are created by the rule validator only, and are immutable.
 */
public final class Rule {

    public enum Shape {
        EPSILON,
        TERMINAL_NONTERMINAL,
        TERMINAL
    }

    final String source;
    final String terminal;  // null for epsilon
    final String target;    // null when the rule ends in ACCEPT
    final int line;

    private Rule(String source, String terminal, String target, int line) {
        assert source != null;
        assert terminal != null || target == null : "epsilon rule with target";
        this.source = source;
        this.terminal = terminal;
        this.target = target;
        this.line = line;
    }

    static Rule epsilon(String source, int line) {
        return new Rule(source, null, null, line);
    }

    static Rule terminal(String source, String terminal, int line) {
        return new Rule(source, terminal, null, line);
    }

    static Rule step(String source, String terminal, String target, int line) {
        return new Rule(source, terminal, target, line);
    }

    public Shape shape() {
        if (terminal == null) return Shape.EPSILON;
        return target == null ? Shape.TERMINAL : Shape.TERMINAL_NONTERMINAL;
    }

    public String source() {
        return source;
    }

    /**
     * @return the terminal, or <code>null</code> for an epsilon rule.
     */
    public String terminal() {
        return terminal;
    }

    /**
     * @return the target non-terminal, or <code>null</code> if the rule ends in
     *         the accepting state.
     */
    public String target() {
        return target;
    }

    public int line() {
        return line;
    }

    /*
     * line is provenance only, not part of the rule's identity
     */
    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + source.hashCode();
        result = prime * result + ((terminal == null) ? 0 : terminal.hashCode());
        result = prime * result + ((target == null) ? 0 : target.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Rule))
            return false;
        final Rule other = (Rule) obj;
        if (!source.equals(other.source))
            return false;
        if (terminal == null) {
            if (other.terminal != null)
                return false;
        } else if (!terminal.equals(other.terminal))
            return false;
        if (target == null) {
            if (other.target != null)
                return false;
        } else if (!target.equals(other.target))
            return false;
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(source).append(" -> ");
        switch (shape()) {
        case EPSILON:
            sb.append(Symbols.EPSILON_SIGN);
            break;
        case TERMINAL:
            sb.append(terminal);
            break;
        default:
            sb.append(terminal).append(' ').append(target);
        }
        return sb.toString();
    }
}
