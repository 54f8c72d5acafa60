/*
 * @LICENSE@
 */

package org.rlnfa.grammar.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.rlnfa.grammar.EngineStyle;
import org.rlnfa.grammar.Grammar;
import org.rlnfa.grammar.GrammarException;
import org.rlnfa.grammar.Simulation;
import org.rlnfa.grammar.State;
import org.rlnfa.grammar.Symbols;

/**
 * One interactive conversation: declare the symbols, enter the rules, then
 * check strings until the input ends. Reads from any reader and writes to
 * any writer, so a whole session can be replayed from a script.
 * <p>
 * Rule entry stops at the first empty line (or end of input). String entry
 * stops only at end of input; an empty line checks the empty string.
 */
public final class Session {

    static final String RULER = "--------------------------------";

    private final BufferedReader in;
    private final PrintWriter out;
    private final PrintWriter err;
    private final EngineStyle style;
    private final boolean trace;

    public Session(BufferedReader in, PrintWriter out, PrintWriter err,
            EngineStyle style, boolean trace) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.style = style;
        this.trace = trace;
    }

    /**
     * @return 0 when the session ran to the end of its input, 1 when it
     *         stopped on a declaration or grammar error.
     * @throws IOException
     *             if reading the input fails.
     */
    public int run() throws IOException {
        try {
            return converse();
        } catch (GrammarException e) {
            err.println();
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            out.println();
            out.println("Exiting.");
            out.flush();
            err.flush();
        }
    }

    private int converse() throws IOException {

        out.println("Regular Grammar to NFA Converter");
        out.println(RULER);
        out.println("Define the grammar components first.");

        String terminals = prompt("Enter Terminal symbols (space-separated, e.g., a b 0 1): ");
        if (isBlank(terminals)) {
            return fail("At least one terminal symbol must be provided.");
        }
        String nonTerminals = prompt("Enter Non-Terminal symbols (space-separated, e.g., S A B): ");
        if (isBlank(nonTerminals)) {
            return fail("At least one non-terminal symbol must be provided.");
        }
        String start = prompt("Enter the Start Symbol (must be one of the non-terminals): ");
        if (isBlank(start)) {
            return fail("A start symbol must be provided.");
        }
        Symbols symbols = Symbols.parse(terminals, nonTerminals, start);

        out.println();
        out.println("--- Grammar Definition ---");
        out.println("Terminals (Σ): " + symbols.terminals());
        out.println("Non-Terminals (V): " + symbols.nonTerminals());
        out.println("Start Symbol (S): " + symbols.start());
        out.println("--------------------------");

        out.println();
        out.println("Enter grammar rules (one per line, e.g., 'S -> aA | b').");
        out.println("Use 'epsilon' or 'ε' for the empty string production.");
        out.println("Ensure symbols used match the declared terminals and non-terminals.");
        out.println("Press Enter on an empty line to finish grammar input.");
        out.println(RULER);

        List<String> lines = new ArrayList<String>();
        String line;
        while ((line = prompt("> ")) != null && line.length() != 0) {
            lines.add(line);
        }
        if (lines.isEmpty()) {
            out.println("No grammar rules entered.");
            return 0;
        }

        Grammar grammar = Grammar.compileLines(symbols, style, lines);
        out.println();
        out.println("--- Grammar Parsed Successfully ---");
        out.println();
        out.println("--- NFA Constructed ---");
        out.println("NFA States: " + grammar.automaton().states());
        out.println("NFA Alphabet: " + grammar.automaton().alphabet());
        out.println("NFA Start State: " + grammar.automaton().start());
        out.println("NFA Accept States: " + grammar.automaton().accepting());

        out.println();
        out.println("--- String Acceptance Check ---");
        out.println("Enter strings to check (one per line). End the input to exit.");
        while ((line = prompt("String? ")) != null) {
            out.println(report(grammar, line));
        }
        return 0;
    }

    String report(Grammar grammar, String input) {
        Simulation sim = trace ? grammar.trace(input) : grammar.simulate(input);
        StringBuilder sb = new StringBuilder();
        sb.append("String '").append(input).append("': ");
        if (!sim.unknownSymbols().isEmpty()) {
            sb.append("Rejected (Contains symbols not in alphabet: ")
              .append(sim.unknownSymbols()).append(')');
        } else {
            sb.append(sim.accepted() ? "Accepted" : "Rejected");
        }
        if (sim.isTraced()) {
            List<Set<State>> frontiers = sim.frontiers();
            for (int i = 0; i < frontiers.size(); ++i) {
                sb.append(System.getProperty("line.separator")).append("    ")
                  .append(i == 0 ? "start" : "'" + sim.input().get(i - 1) + "'")
                  .append(" -> ").append(frontiers.get(i));
            }
        }
        return sb.toString();
    }

    private String prompt(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        return in.readLine();
    }

    private int fail(String msg) {
        err.println("Error: " + msg);
        return 1;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().length() == 0;
    }
}
