package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Data-driven inference. Rules are fired in passes, in list order, until a whole pass
 * adds no fact. Facts only grow and are drawn from the finite set of atoms named by
 * the rules, so the loop terminates.
 */
public class Forward {
    private static final Logger logger = LoggerFactory.getLogger(Forward.class);

    private Forward() {
    }

    public static Result chain(Collection<String> initialFacts, List<Rule> rules) {
        requireNonNull(rules);
        var facts = new TreeSet<>(initialFacts);
        var steps = new ArrayList<Step>();
        var premiseAtoms = rules.stream().map(Rule::premiseAtoms).toList();
        var passes = 0;

        boolean fired;
        do {
            fired = false;
            passes++;
            for (var i = 0; i < rules.size(); i++) {
                var rule = rules.get(i);
                var premise = assignment(premiseAtoms.get(i), facts);
                if (!Evaluator.evaluate(rule.premise(), premise)) continue;

                var inferred = satisfiable(rule.conclusion(), facts);
                inferred.removeAll(facts);
                if (inferred.isEmpty()) continue;

                facts.addAll(inferred);
                var step = new Step(steps.size() + 1, rule.id(), inferred, explain(steps.size() + 1, rule.id(), premiseAtoms.get(i), inferred));
                steps.add(step);
                fired = true;
                logger.debug(step.explanation());
            }
        } while (fired);

        var contradictions = Contradictions.detect(facts);
        logger.info("Forward chaining reached fixpoint after {} passes: {} rules fired, {} facts, {} contradictions",
                passes, steps.size(), facts.size(), contradictions.size());
        return new Result(facts, steps, contradictions);
    }

    private static Map<String, Boolean> assignment(Set<String> atoms, Set<String> facts) {
        var m = new HashMap<String, Boolean>(atoms.size() * 2);
        atoms.forEach(a -> m.put(a, facts.contains(a)));
        return m;
    }

    /**
     * Conclusion atoms which, set true with every other atom held at its current
     * fact value, make the conclusion true.
     */
    private static SortedSet<String> satisfiable(Formula conclusion, Set<String> facts) {
        var atoms = conclusion.atoms();
        var base = assignment(atoms, facts);
        var result = new TreeSet<String>();
        for (var a : atoms) {
            var trial = new HashMap<>(base);
            trial.put(a, true);
            if (Evaluator.evaluate(conclusion, trial)) result.add(a);
        }
        return result;
    }

    private static String explain(int step, String ruleId, Set<String> premiseAtoms, Set<String> inferred) {
        var because = String.join(" and ", new TreeSet<>(premiseAtoms));
        return "Step " + step + ": " + ruleId + " fired because " + because + " are True -> inferred " + String.join(", ", inferred) + ".";
    }

    /** One successful rule firing. */
    public record Step(int step, String ruleId, Set<String> inferred, String explanation) {
        public Step {
            requireNonNull(ruleId);
            inferred = Collections.unmodifiableSortedSet(new TreeSet<>(inferred));
            requireNonNull(explanation);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Result(Set<String> finalFacts, List<Step> steps, List<Contradictions.Contradiction> contradictions) {
        public Result {
            finalFacts = Collections.unmodifiableSortedSet(new TreeSet<>(finalFacts));
            steps = List.copyOf(steps);
            contradictions = List.copyOf(contradictions);
        }

        /** Facts that were not given initially, in firing order. */
        public List<String> inferred() {
            return steps.stream().flatMap(s -> s.inferred().stream()).toList();
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
