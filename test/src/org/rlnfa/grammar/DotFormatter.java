/*@LICENSE@
 */
package org.rlnfa.grammar;

import static org.rlnfa.grammar.Misc.LS;

import java.util.Set;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;

/**
 * Emits a GraphViz digraph for each {@link Automaton} passed as the single
 * parameter of a log record; any other record becomes a comment. Messages are
 * expected to start with a label, <code>"automaton: ..."</code>, which names
 * the graph.
 * <p>
 * Run <code>dot -Tsvg</code> on the resulting file to see the automata.
 */
final class DotFormatter extends Formatter {
    
    private static final java.util.regex.Pattern msgPrefixPattern = 
        java.util.regex.Pattern.compile(
            "^(\\p{javaJavaIdentifierStart}[\\p{javaJavaIdentifierPart}\\s]*): (.*)$",
            java.util.regex.Pattern.DOTALL);
    
    private final java.util.regex.Matcher msgPrefixMatcher =
        msgPrefixPattern.matcher("");

    private int graphs = 0;

    @Override
    public String getHead(Handler handler) {
        StringBuilder sb = new StringBuilder();
        if (handler instanceof DotFileHandler) {
            DotFileHandler dh = (DotFileHandler) handler;
            sb.append("// ").append(dh.testClass).append('.').append(dh.testName)
              .append("()").append(LS);
        }
        return sb.toString();
    }
 
    @Override
    public String format(LogRecord record) {
        
        String msg = record.getMessage();
        Object[] params = record.getParameters();
        assert params == null || params.length == 1;

        msgPrefixMatcher.reset(msg);
        final String label = msgPrefixMatcher.matches() 
                ? msgPrefixMatcher.group(1) : record.getLevel().getName();

        if (params != null && params[0] instanceof Automaton) {
            return digraph(label + "_" + graphs++, (Automaton) params[0]);
        }
        StringBuilder sb = new StringBuilder();
        for (String line : msg.split("\\r?\\n")) {
            sb.append("// ").append(line).append(LS);
        }
        return sb.toString();
    }

    static String digraph(String name, Automaton nfa) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(name)).append(" {").append(LS)
          .append("    rankdir=LR;").append(LS)
          .append("    __start [shape=point];").append(LS);
        for (State s : nfa.states()) {
            sb.append("    ").append(id(s))
              .append(nfa.isAccepting(s) ? " [shape=doublecircle];" : " [shape=circle];")
              .append(LS);
        }
        sb.append("    __start -> ").append(id(nfa.start())).append(';').append(LS);
        for (State s : nfa.states()) {
            for (String a : nfa.alphabet()) {
                edges(sb, s, nfa.targets(s, a), a);
            }
            edges(sb, s, nfa.epsilonTargets(s), Symbols.EPSILON_SIGN);
        }
        sb.append('}').append(LS);
        return sb.toString();
    }

    private static void edges(StringBuilder sb, State from, Set<State> to, String label) {
        for (State t : to) {
            sb.append("    ").append(id(from)).append(" -> ").append(id(t))
              .append(" [label=").append(quote(label)).append("];").append(LS);
        }
    }

    private static String id(State s) {
        return quote(s.toString());
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
