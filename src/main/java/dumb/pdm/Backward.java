package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Goal-driven prover. Builds a proof tree for a goal atom from given facts and the
 * rules concluding it; a goal that cannot be proved yields a failed node, not an error.
 */
public class Backward {
    public static final String MSG_FACT = "Given as a fact.";
    public static final String MSG_CYCLE = "Cycle detected while proving this goal.";
    public static final String MSG_NO_RULES = "No rules conclude this goal.";
    public static final String MSG_ALL_FAILED = "All applicable rules failed to prove this goal.";

    private static final Logger logger = LoggerFactory.getLogger(Backward.class);

    private final CycleGuard guard;

    public Backward(CycleGuard guard) {
        this.guard = requireNonNull(guard);
    }

    public static ProofNode prove(String goal, Set<String> facts, List<Rule> rules) {
        return new Backward(CycleGuard.PER_PATH).proveGoal(goal, facts, rules);
    }

    public ProofNode proveGoal(String goal, Set<String> facts, List<Rule> rules) {
        requireNonNull(goal);
        requireNonNull(facts);
        requireNonNull(rules);
        var proof = new Search(Set.copyOf(facts), rules).prove(goal);
        logger.info("Goal {} {} ({} guard)", goal, proof.succeeded() ? "proved" : "not proved", guard);
        return proof;
    }

    /**
     * Which goals count as "already being proved" when a goal comes up again.
     */
    public enum CycleGuard {
        /** Only the goals on the current recursion path; independent branches may reuse an atom. */
        PER_PATH,
        /**
         * Every goal visited anywhere in the search. An atom proved via a rule in one branch
         * cannot be proved again in a sibling branch.
         */
        SHARED
    }

    /**
     * One proof attempt. Under {@link CycleGuard#PER_PATH} finished goals are remembered:
     * every success, and every failure whose search never hit a goal still on the path.
     * Both are independent of the path they were reached by, so a goal shared by several
     * branches is searched once and its subtree reused.
     */
    private final class Search {
        private final Set<String> facts;
        private final List<Rule> rules;
        private final Set<String> visiting = new HashSet<>();
        private final Map<String, ProofNode> memo = new HashMap<>();
        private int cycles = 0;

        Search(Set<String> facts, List<Rule> rules) {
            this.facts = facts;
            this.rules = rules;
        }

        ProofNode prove(String goal) {
            if (facts.contains(goal)) return ProofNode.fact(goal);
            var known = memo.get(goal);
            if (known != null) return known;
            if (!visiting.add(goal)) {
                cycles++;
                return ProofNode.failed(goal, MSG_CYCLE);
            }
            var cyclesBefore = cycles;
            try {
                var proof = proveByRules(goal);
                if (guard == CycleGuard.PER_PATH && (proof.succeeded() || cycles == cyclesBefore))
                    memo.put(goal, proof);
                return proof;
            } finally {
                if (guard == CycleGuard.PER_PATH) visiting.remove(goal);
            }
        }

        private ProofNode proveByRules(String goal) {
            var applicable = rules.stream().filter(r -> r.conclusionAtoms().contains(goal)).toList();
            if (applicable.isEmpty()) return ProofNode.failed(goal, MSG_NO_RULES);

            for (var rule : applicable) {
                var premises = new ArrayList<ProofNode>();
                var ok = true;
                for (var atom : new TreeSet<>(rule.premiseAtoms())) {
                    var sub = prove(atom);
                    premises.add(sub);
                    ok &= sub.succeeded();
                }
                if (ok) return ProofNode.proved(goal, rule.id(), premises);
                logger.debug("Rule {} failed for goal {}", rule.id(), goal);
            }
            return ProofNode.failed(goal, MSG_ALL_FAILED);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProofNode(String goal, @Nullable String ruleId, List<ProofNode> premises, boolean succeeded,
                            String message) {
        public ProofNode {
            requireNonNull(goal);
            premises = List.copyOf(premises);
            requireNonNull(message);
        }

        static ProofNode fact(String goal) {
            return new ProofNode(goal, null, List.of(), true, MSG_FACT);
        }

        static ProofNode failed(String goal, String message) {
            return new ProofNode(goal, null, List.of(), false, message);
        }

        static ProofNode proved(String goal, String ruleId, List<ProofNode> premises) {
            return new ProofNode(goal, ruleId, premises, true, "Proved " + goal + " using rule " + ruleId + ".");
        }

        /** Indented outline of the tree, one goal per line. */
        public String outline() {
            var sb = new StringBuilder();
            outline(sb, 0);
            return sb.toString();
        }

        private void outline(StringBuilder sb, int depth) {
            sb.append("  ".repeat(depth))
                    .append("Goal: ").append(goal).append(succeeded ? " (success) " : " (failure) ")
                    .append(message).append('\n');
            premises.forEach(p -> p.outline(sb, depth + 1));
        }

        /** Every rule id used in this proof, depth first. */
        public List<String> rulesUsed() {
            var ids = new LinkedHashSet<String>();
            rulesUsed(ids, Collections.newSetFromMap(new IdentityHashMap<>()));
            return List.copyOf(ids);
        }

        /** Subtrees reused from an earlier branch are walked once. */
        private void rulesUsed(Set<String> ids, Set<ProofNode> seen) {
            if (!seen.add(this)) return;
            if (ruleId != null) ids.add(ruleId);
            premises.forEach(p -> p.rulesUsed(ids, seen));
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
