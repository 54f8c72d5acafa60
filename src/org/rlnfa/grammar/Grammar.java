/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.symbolsOf;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A compiled representation of a right-linear grammar; analog to
 * {@link java.util.regex.Pattern}. Compiling validates every rule, builds the
 * epsilon-NFA and precomputes all epsilon closures; after that a Grammar is
 * immutable and thread safe, and can decide membership for any number of
 * strings.
 * <p>
 * Rules can be supplied as text lines:
 * <blockquote><pre>
 *   Symbols symbols = Symbols.parse("0 1", "S A", "S");
 *   Grammar g = Grammar.compile(symbols,
 *       "# strings over {0,1} ending in 1",
 *       "S -&gt; 0S | 1S | 1A",
 *       "A -&gt; epsilon");
 *   g.accepts("0101");  // true
 * </pre></blockquote>
 * or, when the caller has its own tokenizer, as {@link RawRule}s. Input given
 * as a {@link CharSequence} is read one symbol per code point; input
 * given as a <code>List&lt;String&gt;</code> is taken as is.
 */
public final class Grammar {

    private static final Logger logger = Logger.getLogger("org.rlnfa.grammar");
    private static final Level level = Level.FINEST;

    final Symbols symbols;
    final List<Rule> rules;
    final Automaton automaton;
    final EpsilonClosure closure;
    final Engine engine;

    private Grammar(Symbols symbols, List<RawRule> raws, EngineStyle style) {

        this.symbols = symbols;
        logger.log(level, "symbols: " + symbols);
        this.rules = new RuleValidator(symbols).validateAll(raws);
        logger.log(level, "rules: " + rules);
        this.automaton = new AutomatonBuilder(symbols).build(rules);
        this.closure = EpsilonClosure.of(automaton);
        this.engine = style.engineFor(automaton, closure);
    }

    private Grammar(Grammar g, EngineStyle style) {
        this.symbols = g.symbols;
        this.rules = g.rules;
        this.automaton = g.automaton;
        this.closure = g.closure;
        this.engine = style.engineFor(automaton, closure);
    }

    /**
     * Compiles text rules, e.g. <code>"S -&gt; aA | b"</code>, with the default
     * {@link EngineStyle}.
     *
     * @throws GrammarException
     *             if a rule is malformed or the grammar is empty.
     */
    public static Grammar compile(Symbols symbols, String... ruleLines) {
        return compile(symbols, EngineStyle.FRONTIER, ruleLines);
    }

    public static Grammar compile(Symbols symbols, EngineStyle style, String... ruleLines) {
        return compile(symbols, style, new RuleParser(symbols).parse(Arrays.asList(ruleLines)));
    }

    /**
     * Compiles text rules read elsewhere, one list element per line.
     */
    public static Grammar compileLines(Symbols symbols, EngineStyle style, List<String> ruleLines) {
        return compile(symbols, style, new RuleParser(symbols).parse(ruleLines));
    }

    /**
     * Compiles pre-tokenized rules with the default {@link EngineStyle}.
     *
     * @throws GrammarException
     *             on the first invalid rule, or if <code>rules</code> is
     *             empty.
     */
    public static Grammar compile(Symbols symbols, List<RawRule> rules) {
        return compile(symbols, EngineStyle.FRONTIER, rules);
    }

    public static Grammar compile(Symbols symbols, EngineStyle style, List<RawRule> rules) {
        return new Grammar(symbols, rules, style);
    }

    /**
     * @return a Grammar sharing this one's automaton and closure table but
     *         simulating with <code>style</code>.
     */
    public Grammar using(EngineStyle style) {
        return style == engine.style ? this : new Grammar(this, style);
    }

    public boolean accepts(CharSequence input) {
        return simulate(input).accepted();
    }

    public boolean accepts(List<String> input) {
        return simulate(input).accepted();
    }

    public Simulation simulate(CharSequence input) {
        return simulate(symbolsOf(input));
    }

    /**
     * Runs <code>input</code>, one list element per symbol. Symbols outside
     * the alphabet lead to rejection, never to an exception.
     *
     * @throws NullPointerException
     *             if <code>input</code> or one of its elements is
     *             <code>null</code>.
     */
    public Simulation simulate(List<String> input) {
        return new Simulation(this, input, false).run(engine);
    }

    /**
     * Like {@link #simulate(List)}, but the returned Simulation also holds
     * the frontier after every symbol.
     */
    public Simulation trace(CharSequence input) {
        return trace(symbolsOf(input));
    }

    public Simulation trace(List<String> input) {
        return new Simulation(this, input, true).run(engine);
    }

    public Symbols symbols() {
        return symbols;
    }

    /**
     * @return the validated rules, one per alternative, in input order.
     */
    public List<Rule> rules() {
        return rules;
    }

    public Automaton automaton() {
        return automaton;
    }

    public EpsilonClosure closure() {
        return closure;
    }

    /**
     * The simulation algorithm, as represented by the {@link EngineStyle}
     * class, selected for use with this Grammar instance.
     */
    public EngineStyle style() {
        return engine.style;
    }

    @Override
    public String toString() {
        return rules.toString();
    }
}
