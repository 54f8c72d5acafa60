/* @LICENSE@
 */
package org.rlnfa.grammar;

/**
 * A simulation algorithm bound to one compiled automaton. Engines are
 * immutable; all per-run state lives in the {@link Simulation} passed to
 * {@link #eval(Simulation)}, so one engine serves any number of runs.
 */
abstract class Engine {

    final EngineStyle style;
    protected Engine(EngineStyle style) {
        this.style = style;
    }

    /**
     * Runs <code>sim.input</code> through the automaton, setting the verdict
     * and, if the simulation is tracing, recording each frontier.
     */
    abstract protected void eval(Simulation sim);

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getName() + "@" + Integer.toHexString(hashCode());
    }
}
