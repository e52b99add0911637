package dumb.pdm;

import static java.util.Objects.requireNonNull;

/**
 * Lexical unit of formula text. {@code pos} is the 0-based character offset of the
 * first character of {@code value} in the source text.
 */
public record Token(Kind kind, String value, int pos) {
    public Token {
        requireNonNull(kind);
        requireNonNull(value);
    }

    @Override
    public String toString() {
        return kind == Kind.EOF ? "EOF" : kind + "('" + value + "')@" + pos;
    }

    public enum Kind {
        LPAREN("("), RPAREN(")"), AND("AND"), OR("OR"), NOT("NOT"), XOR("XOR"), IMPLIES("->"), IFF("<->"), IDENT("identifier"), EOF("end of input");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }
}
