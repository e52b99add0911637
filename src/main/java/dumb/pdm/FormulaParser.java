package dumb.pdm;

import dumb.pdm.Formula.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static dumb.pdm.Token.Kind.*;
import static java.util.Objects.requireNonNull;

/**
 * Recursive-descent parser for propositional formulas.
 * <pre>
 * expr    := iff
 * iff     := implies ( "&lt;-&gt;" implies )*
 * implies := or ( "-&gt;" or )*
 * or      := xor ( ("OR"|"|") xor )*
 * xor     := and ( "XOR" and )*
 * and     := unary ( ("AND"|"&amp;") unary )*
 * unary   := ("NOT"|"~") unary | primary
 * primary := IDENT | "(" expr ")"
 * </pre>
 * Keywords are case-insensitive; binary operators fold to the left.
 */
public class FormulaParser {
    private static final int CONTEXT_RADIUS = 20;

    private final String text;
    private final List<Token> tokens;
    private int pos = 0;

    private FormulaParser(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    public static Formula parse(String text) throws ParseException {
        requireNonNull(text);
        var p = new FormulaParser(text, Tokenizer.tokenize(text));
        var f = p.iff();
        if (p.current().kind() != EOF) {
            var t = p.current();
            throw new ParseException("Unexpected token '" + t.value() + "' after end of formula; the formula was already complete", t.pos(), text);
        }
        return f;
    }

    /** Parses without throwing: failures are returned as a value. */
    public static Parsed tryParse(String text) {
        try {
            return Parsed.ok(parse(text));
        } catch (ParseException e) {
            return Parsed.failed(e);
        }
    }

    private Token current() {
        return tokens.get(pos);
    }

    private boolean accept(Token.Kind kind) {
        if (current().kind() != kind) return false;
        pos++;
        return true;
    }

    private Token expect(Token.Kind kind) throws ParseException {
        var t = current();
        if (t.kind() != kind)
            throw new ParseException("Expected " + kind.label + " but found " + t.kind().label, t.pos(), text);
        pos++;
        return t;
    }

    private Formula iff() throws ParseException {
        var f = implies();
        while (accept(IFF)) f = new Iff(f, implies());
        return f;
    }

    private Formula implies() throws ParseException {
        var f = or();
        while (accept(IMPLIES)) f = new Implies(f, or());
        return f;
    }

    private Formula or() throws ParseException {
        var f = xor();
        while (accept(OR)) f = new Or(f, xor());
        return f;
    }

    private Formula xor() throws ParseException {
        var f = and();
        while (accept(XOR)) f = new Xor(f, and());
        return f;
    }

    private Formula and() throws ParseException {
        var f = unary();
        while (accept(AND)) f = new And(f, unary());
        return f;
    }

    private Formula unary() throws ParseException {
        return accept(NOT) ? new Not(unary()) : primary();
    }

    private Formula primary() throws ParseException {
        if (accept(LPAREN)) {
            var f = iff();
            expect(RPAREN);
            return f;
        }
        var t = current();
        if (t.kind() == IDENT) {
            pos++;
            return Atom.of(t.value());
        }
        var found = t.kind() == EOF ? "end of input" : "token '" + t.value() + "'";
        throw new ParseException("Unexpected " + found + " where an atom or '(' was expected", t.pos(), text);
    }

    /** Outcome of {@link #tryParse}: exactly one of formula and error is set. */
    public record Parsed(@Nullable Formula formula, @Nullable ParseException error) {
        public Parsed {
            if ((formula == null) == (error == null))
                throw new IllegalArgumentException("Exactly one of formula or error must be present");
        }

        static Parsed ok(Formula f) {
            return new Parsed(f, null);
        }

        static Parsed failed(ParseException e) {
            return new Parsed(null, e);
        }

        public boolean ok() {
            return formula != null;
        }

        /** The parsed formula, or the failure rethrown. */
        public Formula get() throws ParseException {
            if (error != null) throw error;
            return formula;
        }
    }

    public static class ParseException extends Exception {
        private final int position;
        private final String context;

        public ParseException(String message, int position, @Nullable String text) {
            super(message);
            this.position = position;
            this.context = snippet(text, position);
        }

        private static String snippet(@Nullable String text, int position) {
            if (text == null || text.isEmpty()) return "";
            if (position < 0) return text;
            var from = Math.max(0, position - CONTEXT_RADIUS);
            var to = Math.min(text.length(), position + CONTEXT_RADIUS);
            return text.substring(from, to);
        }

        /** 0-based character offset of the offending input, or -1 when unknown. */
        public int position() {
            return position;
        }

        /** The message without location or context. */
        public String reason() {
            return super.getMessage();
        }

        @Override
        public String getMessage() {
            var location = position != -1 ? " at position " + position : "";
            var contextSnippet = !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
