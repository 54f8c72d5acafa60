/*
 * @LICENSE@
 */

package org.rlnfa.grammar;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    /*
     * idiom suppression for Strings
     */
    static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new Iterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /**
     * One symbol per code point, the way strings are read when the caller
     * doesn't tokenize them. A surrogate pair is one symbol.
     */
    static List<String> symbolsOf(CharSequence cs) {
        List<String> ret = new ArrayList<String>(cs.length());
        for (int i = 0; i < cs.length();) {
            int n = Character.charCount(Character.codePointAt(cs, i));
            ret.add(cs.subSequence(i, i + n).toString());
            i += n;
        }
        return Collections.unmodifiableList(ret);
    }

    static boolean containsWhitespace(CharSequence cs) {
        for (char c : iterize(cs)) {
            if (Character.isWhitespace(c)) return true;
        }
        return false;
    }

    static <T> Set<T> intersect(Collection<T> lhs, Collection<T> rhs) {
        Set<T> ret = new LinkedHashSet<T>(lhs);
        ret.retainAll(rhs);
        return ret;
    }

    /*
     * A FIFO queue which refuses elements it has already seen since the last
     * clear(): each vertex is offered at most once per traversal.
     */
    static final class SetQueue<E> extends AbstractQueue<E> {

        final Set<E> seen = new LinkedHashSet<E>();
        final LinkedList<E> list = new LinkedList<E>();

        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            return list.size();
        }

        public boolean offer(E o) {
            if (o == null || !seen.add(o)) return false;
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            return list.poll();
        }

        @Override
        public void clear() {
            seen.clear();
            list.clear();
        }
    }

    /*
     * Generic breadth first digraph visitor. Subclasses supply the edges;
     * the visited set makes it safe on cyclic graphs.
     */
    static abstract class BreadthFirstVisitor<V> {

        final Set<V> black = new LinkedHashSet<V>();
        final SetQueue<V> gray = new SetQueue<V>();

        final BreadthFirstVisitor<V> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        /**
         * @return the vertices visited by the last traversal, in visiting
         *         order.
         */
        final Set<V> visited() {
            return Collections.unmodifiableSet(new LinkedHashSet<V>(black));
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                V vertex = gray.remove();
                black.add(vertex);
                for (V next : successors(vertex)) {
                    if (!black.contains(next)) gray.offer(next);
                }
            }
        }

        protected abstract Iterable<V> successors(V vertex);
    }
}
