package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.FormulaParser.ParseException;
import dumb.pdm.RuleSets.RuleLoadException;
import dumb.pdm.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Propositional Decision Maker session: named rule-set domains, rules added during the
 * session on top of them, and the three ways of reasoning over a domain (truth tables,
 * forward chaining, backward chaining). Not thread-safe.
 */
public class Pdm {
    public static final String FORMULA_COLUMN = "Formula";

    private static final Logger logger = LoggerFactory.getLogger(Pdm.class);

    private final Configuration config;
    private final Map<String, List<Rule>> base;
    private final Map<String, List<Rule>> custom = new LinkedHashMap<>();
    private final Backward backward;

    public Pdm(Configuration config, Map<String, List<Rule>> ruleSets) {
        this.config = requireNonNull(config);
        var b = new LinkedHashMap<String, List<Rule>>();
        config.domains().forEach(d -> b.put(d, List.of()));
        ruleSets.forEach((d, rules) -> b.put(d, List.copyOf(rules)));
        this.base = Collections.unmodifiableMap(b);
        this.backward = new Backward(config.cycleGuard());
        resetCustomRules();
    }

    public static Pdm load(Configuration config, String rulesJson) throws RuleLoadException {
        return new Pdm(config, RuleSets.load(rulesJson));
    }

    public Set<String> domains() {
        return base.keySet();
    }

    /** The domain's loaded rules followed by those added this session. */
    public List<Rule> rules(String domain) {
        var r = new ArrayList<>(base(domain));
        r.addAll(custom.get(domain));
        return Collections.unmodifiableList(r);
    }

    public Rule addRule(String domain, String id, String premise, String conclusion, String description) throws ParseException {
        base(domain);
        var rule = Rule.parse(id, premise, conclusion, description);
        custom.get(domain).add(rule);
        logger.info("Added rule {} to {}", rule, domain);
        return rule;
    }

    public void resetCustomRules() {
        custom.clear();
        base.keySet().forEach(d -> custom.put(d, new ArrayList<>()));
    }

    public List<String> atoms(String domain) {
        return RuleSets.atoms(rules(domain));
    }

    public Forward.Result forward(String domain, Set<String> facts) {
        return Forward.chain(facts, rules(domain));
    }

    public Backward.ProofNode backward(String domain, String goal, Set<String> facts) {
        return backward.proveGoal(goal, facts, rules(domain));
    }

    /**
     * Evaluates a formula over the domain's atoms plus its own. Up to
     * {@link Configuration#maxTableAtoms()} atoms the full truth table is produced; beyond
     * that only the given facts are evaluated.
     */
    public Evaluation evaluate(String domain, String formulaText, Set<String> facts) throws ParseException {
        var formula = FormulaParser.parse(formulaText);
        var atoms = new TreeSet<>(atoms(domain));
        atoms.addAll(formula.atoms());

        var assignment = new LinkedHashMap<String, Boolean>();
        atoms.forEach(a -> assignment.put(a, facts.contains(a)));
        var value = Evaluator.evaluate(formula, assignment);

        if (atoms.size() > config.maxTableAtoms()) {
            logger.warn("Too many atoms ({}) for a full table, evaluating the current assignment only", atoms.size());
            return new Evaluation(formula.str(), Mode.CURRENT_ASSIGNMENT, List.copyOf(atoms), assignment, value, null);
        }
        var table = TruthTable.generate(List.of(new TruthTable.Column(FORMULA_COLUMN, formula)), List.copyOf(atoms), null);
        return new Evaluation(formula.str(), Mode.FULL_TABLE, List.copyOf(atoms), assignment, value, table);
    }

    public JsonNode export(String domain) {
        return RuleSets.export(domain, rules(domain));
    }

    private List<Rule> base(String domain) {
        var r = base.get(requireNonNull(domain));
        if (r == null) throw new IllegalArgumentException("Unknown domain: " + domain + " (known: " + base.keySet() + ")");
        return r;
    }

    public enum Mode {FULL_TABLE, CURRENT_ASSIGNMENT}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Evaluation(String formula, Mode mode, List<String> atoms, Map<String, Boolean> assignment,
                             boolean value, @Nullable TruthTable table) {
        public Evaluation {
            requireNonNull(formula);
            requireNonNull(mode);
            atoms = List.copyOf(atoms);
            assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        }

        /** Rows of the full table where the formula holds; empty in current-assignment mode. */
        public List<TruthTable.Row> trueRows() {
            return table == null ? List.of() : table.rowsWhere(FORMULA_COLUMN);
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
