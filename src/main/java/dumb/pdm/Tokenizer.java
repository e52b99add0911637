package dumb.pdm;

import dumb.pdm.FormulaParser.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static dumb.pdm.Token.Kind.*;

public class Tokenizer {
    private static final Map<String, Token.Kind> KEYWORDS = Map.of("AND", AND, "OR", OR, "NOT", NOT, "XOR", XOR);

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;

    private Tokenizer(String text) {
        this.text = text;
    }

    /**
     * Splits formula text into tokens. The returned list always ends with a single
     * {@link Token.Kind#EOF} token.
     */
    public static List<Token> tokenize(String text) throws ParseException {
        var t = new Tokenizer(text);
        t.run();
        return List.copyOf(t.tokens);
    }

    static boolean isIdentChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    /** Whether {@code word} would tokenize as a single {@link Token.Kind#IDENT}. */
    static boolean isIdentifier(String word) {
        if (word.isEmpty() || KEYWORDS.containsKey(word.toUpperCase(Locale.ROOT))) return false;
        for (var i = 0; i < word.length(); i++)
            if (!isIdentChar(word.charAt(i))) return false;
        return true;
    }

    private void run() throws ParseException {
        var n = text.length();
        while (pos < n) {
            var c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '(') {
                emit(LPAREN, 1);
            } else if (c == ')') {
                emit(RPAREN, 1);
            } else if (text.startsWith("<->", pos)) {
                emit(IFF, 3);
            } else if (text.startsWith("->", pos)) {
                emit(IMPLIES, 2);
            } else if (c == '&') {
                emit(AND, 1);
            } else if (c == '|') {
                emit(OR, 1);
            } else if (c == '~') {
                emit(NOT, 1);
            } else if (isIdentChar(c)) {
                word();
            } else {
                throw new ParseException("Unexpected character '" + c + "'", pos, text);
            }
        }
        tokens.add(new Token(EOF, "", n));
    }

    private void emit(Token.Kind kind, int len) {
        tokens.add(new Token(kind, text.substring(pos, pos + len), pos));
        pos += len;
    }

    private void word() {
        var start = pos;
        while (pos < text.length() && isIdentChar(text.charAt(pos))) pos++;
        var w = text.substring(start, pos);
        tokens.add(new Token(KEYWORDS.getOrDefault(w.toUpperCase(Locale.ROOT), IDENT), w, start));
    }
}
