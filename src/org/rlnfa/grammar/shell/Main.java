/*
 * @LICENSE@
 */

package org.rlnfa.grammar.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;

import org.rlnfa.grammar.EngineStyle;

/**
 * Command line entry point: parses the options, then runs an interactive
 * {@link Session} on stdin/stdout.
 */
public final class Main {

    // held so the level set by --verbose is not lost to garbage collection
    private static final Logger libLogger = Logger.getLogger("org.rlnfa.grammar");

    private Main() {
    }

    /*
     * Console encoding; fixed so that the epsilon sign reads and prints the
     * same whatever the platform default is.
     */
    static final Charset CONSOLE = StandardCharsets.UTF_8;

    public static void main(String[] argv) throws JSAPException, IOException {
        System.exit(run(argv, reader(System.in), writer(System.out), writer(System.err)));
    }

    static BufferedReader reader(InputStream in) {
        return new BufferedReader(new InputStreamReader(in, CONSOLE));
    }

    static PrintWriter writer(OutputStream out) {
        return new PrintWriter(new OutputStreamWriter(out, CONSOLE), true);
    }

    static int run(String[] argv, BufferedReader in, PrintWriter out, PrintWriter err)
            throws JSAPException, IOException {

        JSAP jsap = new JSAP();
        JSAPResult config = processParameters(jsap, argv);

        if (!config.success()) {
            for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();) {
                err.println("Error: " + errs.next());
            }
            usage(jsap, err);
            return 2;
        }
        if (config.getBoolean("help")) {
            usage(jsap, out);
            return 0;
        }
        if (config.getBoolean("verbose")) {
            verbose(Level.FINER);
        }
        EngineStyle style = EngineStyle.forName(config.getString("engine"));
        return new Session(in, out, err, style, config.getBoolean("trace")).run();
    }

    private static JSAPResult processParameters(JSAP jsap, String[] argv) throws JSAPException {

        Switch helpsw = new Switch("help",
                'h',
                "help",
                "print this help message");
        jsap.registerParameter(helpsw);

        Switch verbosesw = new Switch("verbose",
                'v',
                "verbose",
                "log grammar compilation (symbols, rules, automaton, closures) to stderr");
        jsap.registerParameter(verbosesw);

        Switch tracesw = new Switch("trace",
                't',
                "trace",
                "print the frontier (set of current states) after every input symbol");
        jsap.registerParameter(tracesw);

        FlaggedOption engineopt = new FlaggedOption("engine",
                EnumeratedStringParser.getParser("frontier;bitset"),
                "frontier",
                true,
                'e',
                "engine",
                "simulation engine: frontier (set based, default) or bitset (table driven)");
        jsap.registerParameter(engineopt);

        return jsap.parse(argv);
    }

    private static void usage(JSAP jsap, PrintWriter w) {
        w.println("Usage: java " + Main.class.getName() + " " + jsap.getUsage());
        w.println();
        w.println(jsap.getHelp());
        w.flush();
    }

    private static void verbose(Level level) {
        libLogger.setLevel(level);
        for (Handler h : libLogger.getHandlers()) {
            if (h instanceof ConsoleHandler) return;
        }
        Handler handler = new ConsoleHandler();
        handler.setLevel(level);
        libLogger.addHandler(handler);
    }
}
