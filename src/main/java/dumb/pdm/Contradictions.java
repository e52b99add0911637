package dumb.pdm;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.util.Json;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Facts named {@code "NOT x"} stand for the negation of {@code x}. Only such bare fact
 * strings are compared; negations inside formulas are not considered.
 */
public class Contradictions {
    public static final String NEGATION_PREFIX = "NOT ";

    private Contradictions() {
    }

    public static String negate(String atom) {
        return NEGATION_PREFIX + atom;
    }

    public static boolean isNegated(String fact) {
        return fact.startsWith(NEGATION_PREFIX);
    }

    /** Atoms present both plainly and negated, sorted by atom name. */
    public static List<Contradiction> detect(Collection<String> facts) {
        var positive = new TreeSet<String>();
        var negative = new TreeSet<String>();
        for (var f : facts) {
            if (isNegated(f)) negative.add(f.substring(NEGATION_PREFIX.length()));
            else positive.add(f);
        }
        positive.retainAll(negative);
        return positive.stream().map(Contradiction::of).toList();
    }

    public record Contradiction(String atom, String message) {
        public Contradiction {
            requireNonNull(atom);
            requireNonNull(message);
        }

        static Contradiction of(String atom) {
            return new Contradiction(atom, "Contradiction between " + atom + " and " + negate(atom));
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
