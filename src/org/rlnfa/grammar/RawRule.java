/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A production as it arrives from the outside, already split into tokens but
 * not yet checked: a head token and the body tokens. The source text and its
 * line number travel along for diagnostics.
 */
public final class RawRule {

    final String head;
    final List<String> body;
    final String text;
    final int line;

    public RawRule(String head, List<String> body, String text, int line) {
        this.head = head;
        this.body = Collections.unmodifiableList(new ArrayList<String>(body));
        this.text = text;
        this.line = line;
    }

    /**
     * Builds a raw rule from tokens alone; the text is synthesized as
     * <code>head -&gt; body...</code>.
     */
    public static RawRule of(int line, String head, String... body) {
        StringBuilder sb = new StringBuilder();
        sb.append(head).append(" ->");
        for (String token : body) sb.append(' ').append(token);
        return new RawRule(head, Arrays.asList(body), sb.toString(), line);
    }

    public String head() {
        return head;
    }

    public List<String> body() {
        return body;
    }

    public String text() {
        return text;
    }

    /**
     * @return the 1-based line (or position) this rule came from.
     */
    public int line() {
        return line;
    }

    @Override
    public String toString() {
        return text;
    }
}
