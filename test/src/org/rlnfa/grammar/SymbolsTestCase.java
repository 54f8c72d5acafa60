/* @LICENSE@  
 */

package org.rlnfa.grammar;

import static org.rlnfa.grammar.GrammarAssert.assertDeclarationFails;

import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;

import org.rlnfa.grammar.GrammarException.Kind;

public class SymbolsTestCase extends TestCase {
    
    public static void main(String[] args) {
        junit.textui.TestRunner.run(SymbolsTestCase.class);
    }

    public SymbolsTestCase(String arg0) {
        super(arg0);
    }

    public void testParse() {
        Symbols s = Symbols.parse(" b  a ", "S A", "S");
        assertEquals(Arrays.asList("a", "b"), Arrays.asList(s.terminals().toArray()));
        assertEquals(Arrays.asList("A", "S"), Arrays.asList(s.nonTerminals().toArray()));
        assertEquals("S", s.start());
        assertTrue(s.isTerminal("a"));
        assertFalse(s.isTerminal("A"));
        assertTrue(s.isNonTerminal("A"));
        assertFalse(s.isNonTerminal("x"));
        assertTrue(s.isDeclared("b"));
        assertFalse(s.isDeclared(null));
    }

    public void testDeclare() {
        Symbols s = Symbols.declare(Arrays.asList("if", "then"), 
            Collections.singleton("Stmt"), "Stmt");
        assertTrue(s.isTerminal("if"));
        assertEquals(s, Symbols.parse("then if", "Stmt", "Stmt"));
        assertEquals(s.hashCode(), Symbols.parse("then if", "Stmt", "Stmt").hashCode());
        assertFalse(s.equals(Symbols.parse("then if", "Stmt Other", "Stmt")));
    }

    public void testEmptySets() {
        assertDeclarationFails(Kind.EMPTY_SYMBOL_SET, "", "S", "S");
        assertDeclarationFails(Kind.EMPTY_SYMBOL_SET, "   ", "S", "S");
        assertDeclarationFails(Kind.EMPTY_SYMBOL_SET, "a", "", "S");
        assertDeclarationFails(Kind.EMPTY_SYMBOL_SET, null, "S", "S");
    }

    public void testOverlap() {
        GrammarException e = 
            assertDeclarationFails(Kind.OVERLAPPING_SYMBOLS, "a S", "S A", "S");
        assertTrue(e.getMessage(), e.getMessage().contains("[S]"));
        assertNull(e.rule());
        assertEquals(-1, e.index());
    }

    public void testReserved() {
        assertDeclarationFails(Kind.RESERVED_SYMBOL, "a epsilon", "S", "S");
        assertDeclarationFails(Kind.RESERVED_SYMBOL, "a", "S EPSILON", "S");
        assertDeclarationFails(Kind.RESERVED_SYMBOL, "a ε", "S", "S");
        try {
            Symbols.declare(Arrays.asList("a", ""), Arrays.asList("S"), "S");
            fail();
        } catch (GrammarException e) {
            assertEquals(Kind.RESERVED_SYMBOL, e.kind());
        }
        try {
            Symbols.declare(Arrays.asList("a"), Arrays.asList("S", "B C"), "S");
            fail();
        } catch (GrammarException e) {
            assertEquals(Kind.RESERVED_SYMBOL, e.kind());
        }
    }

    public void testUndeclaredStart() {
        assertDeclarationFails(Kind.UNDECLARED_START_SYMBOL, "a", "S A", "X");
        assertDeclarationFails(Kind.UNDECLARED_START_SYMBOL, "a", "S A", "a");
        assertDeclarationFails(Kind.UNDECLARED_START_SYMBOL, "a", "S A", null);
    }

    public void testIsEpsilon() {
        assertTrue(Symbols.isEpsilon("epsilon"));
        assertTrue(Symbols.isEpsilon("Epsilon"));
        assertTrue(Symbols.isEpsilon("ε"));
        assertFalse(Symbols.isEpsilon("eps"));
        assertFalse(Symbols.isEpsilon(""));
        assertFalse(Symbols.isEpsilon(null));
    }

    public void testUnmodifiable() {
        Symbols s = Symbols.parse("a", "S", "S");
        try {
            s.terminals().add("b");
            fail();
        } catch (UnsupportedOperationException e) {/* expected */}
        try {
            s.nonTerminals().clear();
            fail();
        } catch (UnsupportedOperationException e) {/* expected */}
    }
}
