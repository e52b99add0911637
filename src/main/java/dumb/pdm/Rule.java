package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dumb.pdm.FormulaParser.ParseException;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * If {@code premise} holds, {@code conclusion} holds. Ids are expected to be unique
 * within a rule set but nothing here checks that.
 */
public record Rule(String id, Formula premise, Formula conclusion, String description) {
    public Rule {
        requireNonNull(id);
        requireNonNull(premise);
        requireNonNull(conclusion);
        requireNonNull(description);
    }

    public static Rule parse(String id, String premise, String conclusion, String description) throws ParseException {
        return new Rule(id, FormulaParser.parse(premise), FormulaParser.parse(conclusion), description);
    }

    public Set<String> premiseAtoms() {
        return premise.atoms();
    }

    public Set<String> conclusionAtoms() {
        return conclusion.atoms();
    }

    /** Interchange form, with both formulas printed back to text. */
    public Entry entry() {
        return new Entry(id, premise.str(), conclusion.str(), description);
    }

    @Override
    public String toString() {
        return id + ": " + premise.str() + " => " + conclusion.str();
    }

    @JsonPropertyOrder({"id", "premise", "conclusion", "text"})
    public record Entry(@JsonProperty("id") String id,
                        @JsonProperty("premise") String premise,
                        @JsonProperty("conclusion") String conclusion,
                        @JsonProperty("text") String text) {
    }
}
