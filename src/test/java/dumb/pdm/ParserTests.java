package dumb.pdm;

import dumb.pdm.Formula.*;
import dumb.pdm.FormulaParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static dumb.pdm.Token.Kind.*;
import static org.junit.jupiter.api.Assertions.*;

class ParserTests extends AbstractTest {

    private static final Atom A = Atom.of("A"), B = Atom.of("B"), C = Atom.of("C"), D = Atom.of("D");

    @Test
    void tokenizesSymbolsAndKeywords() throws ParseException {
        var kinds = Tokenizer.tokenize("a and (B | ~c) <-> d -> xor_1 XOR e").stream().map(Token::kind).toList();
        assertEquals(List.of(IDENT, AND, LPAREN, IDENT, OR, NOT, IDENT, RPAREN, IFF, IDENT, IMPLIES, IDENT, XOR, IDENT, EOF), kinds);
    }

    @Test
    void identifiersKeepCaseAndPosition() throws ParseException {
        var tokens = Tokenizer.tokenize("  Fever & notes");
        assertEquals(new Token(IDENT, "Fever", 2), tokens.get(0));
        assertEquals(new Token(AND, "&", 8), tokens.get(1));
        assertEquals(new Token(IDENT, "notes", 10), tokens.get(2), "a keyword prefix does not split an identifier");
        assertEquals(EOF, tokens.get(3).kind());
        assertEquals(4, tokens.size());
    }

    @Test
    void emptyTextIsJustEof() throws ParseException {
        var tokens = Tokenizer.tokenize("   ");
        assertEquals(1, tokens.size());
        assertEquals(EOF, tokens.get(0).kind());
    }

    @Test
    void unexpectedCharacterReportsPosition() {
        var e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("A AND $B"));
        assertEquals(6, e.position());
        assertTrue(e.getMessage().contains("'$'"), e.getMessage());
        assertTrue(e.getMessage().contains("at position 6"), e.getMessage());
    }

    @Test
    void loneArrowHeadIsRejected() {
        assertThrows(ParseException.class, () -> FormulaParser.parse("A < B"));
        assertThrows(ParseException.class, () -> FormulaParser.parse("A - B"));
    }

    @Test
    void collectsAtoms() {
        assertEquals(Set.of("A", "B", "C", "D"), f("A AND (B OR NOT C) -> D").atoms());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void atomsOfDeepFormulaInOneWalk() {
        Formula chain = Atom.of("X0");
        for (var i = 1; i < 50_000; i++) chain = new And(chain, Atom.of("X" + (i % 1000)));
        assertEquals(1000, chain.atoms().size());
        assertTrue(chain.atoms().contains("X999"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "x y", "A-B", "Fever?", "and", "Or", "NOT", "xor"})
    void atomNameMustBeAnIdentifier(String name) {
        assertThrows(IllegalArgumentException.class, () -> Atom.of(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A", "fever_2", "_x", "42", "Android", "NOTE", "ORDER"})
    void atomNameReparsesAsItself(String name) {
        assertEquals(Atom.of(name), f(Atom.of(name).str()));
    }

    @Test
    void precedenceLoosestToTightest() {
        assertEquals(new Iff(new Implies(A, new Or(B, new Xor(C, new And(D, new Not(A))))), B),
                f("A -> B OR C XOR D AND NOT A <-> B"));
    }

    @Test
    void binaryOperatorsFoldLeft() {
        assertEquals(new Or(new Or(A, B), C), f("A OR B OR C"));
        assertEquals(new Implies(new Implies(A, B), C), f("A -> B -> C"));
        assertEquals(new Iff(new Iff(A, B), C), f("A <-> B <-> C"));
    }

    @Test
    void notIsPrefixAndNests() {
        assertEquals(new And(new Not(new Not(A)), B), f("~NOT A & B"));
        assertEquals(new Not(new And(A, B)), f("not (A and B)"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        assertEquals(new And(new Or(A, B), C), f("(A OR B) AND C"));
        assertEquals(new Implies(A, new Implies(B, C)), f("A -> (B -> C)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A AND AND B", "", "A AND", "(A OR B", "A B", "A OR B)", "NOT", "()", "-> A"})
    void rejectsMalformedFormulas(String text) {
        assertThrows(ParseException.class, () -> FormulaParser.parse(text));
    }

    @Test
    void missingParenthesisNamesExpectedAndFound() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("(A OR B"));
        assertEquals("Expected ) but found end of input", e.reason());
        assertEquals(7, e.position());
    }

    @Test
    void trailingInputSaysFormulaWasComplete() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("A OR B C"));
        assertTrue(e.reason().contains("'C'"), e.reason());
        assertTrue(e.reason().contains("already complete"), e.reason());
        assertEquals(7, e.position());
    }

    @Test
    void doubledOperatorFailsWhereAtomExpected() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("A AND AND B"));
        assertEquals(6, e.position());
        assertTrue(e.reason().contains("where an atom or '(' was expected"), e.reason());
    }

    @Test
    void tryParseReturnsFailureAsValue() throws ParseException {
        var bad = FormulaParser.tryParse("A AND AND B");
        assertFalse(bad.ok());
        assertNull(bad.formula());
        assertNotNull(bad.error());
        assertThrows(ParseException.class, bad::get);

        var good = FormulaParser.tryParse("A");
        assertTrue(good.ok());
        assertEquals(A, good.get());
    }

    @Test
    void printsCanonicalText() {
        assertEquals("A AND NOT B -> C", f("(A & ~B) -> C").str());
        assertEquals("(A OR B) AND C", f("(A | B) & C").str());
        assertEquals("NOT (A AND B)", f("~(A & B)").str());
        assertEquals("A -> (B -> C)", f("A -> (B -> C)").str());
        assertEquals("A -> B -> C", f("(A -> B) -> C").str());
        assertEquals("NOT NOT A", f("~~A").str());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "A",
            "NOT A",
            "A AND B AND C",
            "A AND (B AND C)",
            "A OR B XOR C AND D",
            "(A OR B) XOR (C AND D)",
            "A -> (B -> C)",
            "(A <-> B) <-> (C <-> D)",
            "NOT (A -> B) <-> NOT NOT C",
            "Fever AND (Cough OR SoreThroat) -> Flu",
            "((A XOR B) OR C) -> NOT (D AND A) <-> B"
    })
    void printThenParseRoundTrips(String text) {
        var formula = f(text);
        assertEquals(formula, f(formula.str()));
        assertEquals(formula.str(), f(formula.str()).str());
    }
}
