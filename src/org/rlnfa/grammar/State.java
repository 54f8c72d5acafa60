/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

/**
 * A state of a compiled automaton: either the state standing for a declared
 * non-terminal, or the single accepting state. The accepting state is its own
 * kind rather than a reserved name, so no non-terminal can ever be confused
 * with it. Instances are immutable; non-terminal states compare by name.
 */
public final class State implements Comparable<State> {

    public enum Kind {
        NON_TERMINAL,
        ACCEPTING
    }

    /**
     * The accepting state synthesized for every automaton.
     */
    public static final State ACCEPT = new State(Kind.ACCEPTING, null);

    private final Kind kind;
    private final String name;

    private State(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    static State nonTerminal(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        return new State(Kind.NON_TERMINAL, name);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAccepting() {
        return kind == Kind.ACCEPTING;
    }

    /**
     * @return the non-terminal this state stands for, or <code>null</code> for
     *         {@link #ACCEPT}.
     */
    public String name() {
        return name;
    }

    /*
     * non-terminal states by name, ACCEPT last
     */
    public int compareTo(State o) {
        if (kind != o.kind) {
            return kind.compareTo(o.kind);
        }
        return kind == Kind.ACCEPTING ? 0 : name.compareTo(o.name);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + kind.hashCode();
        result = prime * result + ((name == null) ? 0 : name.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof State))
            return false;
        final State other = (State) obj;
        if (kind != other.kind)
            return false;
        if (name == null) {
            if (other.name != null)
                return false;
        } else if (!name.equals(other.name))
            return false;
        return true;
    }

    @Override
    public String toString() {
        return isAccepting() ? "<accept>" : name;
    }
}
