/*
 * @LICENSE@
 */

/**
 * <h3><b>rlnfa</b> - right-linear grammars compiled to epsilon-NFAs.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * Every right-linear grammar describes a regular language, and every such
 * grammar can be turned, rule by rule, into a nondeterministic finite
 * automaton with epsilon transitions. <b>rlnfa</b> performs that translation
 * and then runs the automaton against input strings, so that a grammar can be
 * checked by example: "does my grammar derive <code>abba</code>?".
 * <p>
 * The accepted rule shapes are the three right-linear forms:
 * <ul>
 * <li><code>A -&gt; aB</code> - a terminal followed by a non-terminal,</li>
 * <li><code>A -&gt; a</code> - a single terminal,</li>
 * <li><code>A -&gt; epsilon</code> (or <code>A -&gt; &#949;</code>) - the
 * empty string.</li>
 * </ul>
 * <p>
 * <h4>Usage.</h4>
 * <blockquote><pre>
 *   Symbols symbols = Symbols.parse("a b", "S A", "S");
 *   Grammar g = Grammar.compile(symbols, "S -&gt; aA", "A -&gt; b | epsilon");
 *   g.accepts("ab");    // true
 *   g.accepts("a");     // true
 *   g.accepts("ba");    // false
 * </pre></blockquote>
 * <p>
 * <h4>Construction.</h4>
 * <p>
 * Each declared non-terminal becomes one {@link org.rlnfa.grammar.State};
 * one extra {@linkplain org.rlnfa.grammar.State#ACCEPT accepting state} is
 * added. <code>A -&gt; aB</code> contributes the transition <code>(A, a) -&gt;
 * B</code>, <code>A -&gt; a</code> contributes <code>(A, a) -&gt; ACCEPT</code>
 * and <code>A -&gt; epsilon</code> contributes the epsilon transition
 * <code>A -&gt; ACCEPT</code>. Rules sharing a source and a terminal are kept
 * side by side: the automaton stays nondeterministic, it is never collapsed
 * into a DFA.
 * <p>
 * The epsilon closure of every state is computed once, when the
 * {@link org.rlnfa.grammar.Grammar} is compiled. Matching then only looks
 * closures up.
 * <p>
 * <h4>Engines.</h4>
 * <p>
 * As in other automata packages, "engines are cheap": a compiled grammar is
 * simulated by an {@link org.rlnfa.grammar.EngineStyle engine style} of the
 * caller's choice. The default engine steps a set of states and can record
 * the frontier after every symbol; the bit table engine runs the same
 * simulation on precompiled bit sets. Both produce identical verdicts.
 * <p>
 * Compiled grammars are immutable and may be shared between threads.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>The grammar/automaton correspondence, and the subset simulation of an
 * NFA, are covered in the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Hopcroft, Motwani and Ullman, <em>Introduction to Automata Theory,
 * Languages, and Computation</em>, on epsilon-NFAs and regular grammars.</li>
 * </ul>
 */
package org.rlnfa.grammar;
