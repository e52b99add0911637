package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.FormulaParser.ParseException;
import dumb.pdm.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Rule-set interchange: a JSON object mapping each domain name to an ordered array of
 * {@code {"id", "premise", "conclusion", "text"}} records.
 */
public class RuleSets {
    private static final Logger logger = LoggerFactory.getLogger(RuleSets.class);
    private static final List<String> FIELDS = List.of("id", "premise", "conclusion", "text");

    private RuleSets() {
    }

    public static Map<String, List<Rule>> load(String json) throws RuleLoadException {
        return load(readTree(json));
    }

    public static Map<String, List<Rule>> load(InputStream in) throws RuleLoadException {
        try {
            return load(Json.tree(in));
        } catch (IOException e) {
            throw new RuleLoadException("Unreadable rule set: " + e.getMessage(), e);
        }
    }

    /** Every domain in the document, in document order. */
    public static Map<String, List<Rule>> load(JsonNode root) throws RuleLoadException {
        if (root == null || !root.isObject())
            throw new RuleLoadException("Rule set must be a JSON object mapping domain names to rule arrays");
        var sets = new LinkedHashMap<String, List<Rule>>();
        var names = root.fieldNames();
        while (names.hasNext()) {
            var domain = names.next();
            sets.put(domain, domain(root, domain));
        }
        logger.info("Loaded {} rule sets: {}", sets.size(), sets.keySet());
        return Collections.unmodifiableMap(sets);
    }

    /** Rules of one domain; empty when the document has no such domain. */
    public static List<Rule> load(String json, String domain) throws RuleLoadException {
        var root = readTree(json);
        if (root == null || !root.isObject())
            throw new RuleLoadException("Rule set must be a JSON object mapping domain names to rule arrays");
        return domain(root, domain);
    }

    private static List<Rule> domain(JsonNode root, String domain) throws RuleLoadException {
        var raw = root.get(domain);
        if (raw == null || raw.isNull()) return List.of();
        if (!raw.isArray())
            throw new RuleLoadException("Rules of domain '" + domain + "' must be a JSON array");
        var rules = new ArrayList<Rule>(raw.size());
        for (var i = 0; i < raw.size(); i++)
            rules.add(rule(domain, i, raw.get(i)));
        return List.copyOf(rules);
    }

    private static Rule rule(String domain, int index, JsonNode r) throws RuleLoadException {
        var where = "rule #" + index + " of domain '" + domain + "'";
        if (!r.isObject()) throw new RuleLoadException(where + " is not a JSON object");
        var values = new HashMap<String, String>();
        for (var f : FIELDS) {
            var v = r.get(f);
            if (v == null || v.isNull())
                throw new RuleLoadException(where + " is missing required field '" + f + "'");
            values.put(f, v.asText());
        }
        var id = values.get("id");
        try {
            return Rule.parse(id, values.get("premise"), values.get("conclusion"), values.get("text"));
        } catch (ParseException e) {
            throw new RuleLoadException(where + " (" + id + ") has an invalid formula: " + e.getMessage(), e);
        }
    }

    private static JsonNode readTree(String json) throws RuleLoadException {
        try {
            return Json.tree(requireNonNull(json));
        } catch (JsonProcessingException e) {
            throw new RuleLoadException("Malformed rule set JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** {@code {"rules": [...]}} */
    public static JsonNode toJson(Collection<Rule> rules) {
        return Json.node(new Export(null, entries(rules)));
    }

    /** {@code {"domain": ..., "rules": [...]}}, the shape offered for download. */
    public static JsonNode export(String domain, Collection<Rule> rules) {
        return Json.node(new Export(requireNonNull(domain), entries(rules)));
    }

    private static List<Rule.Entry> entries(Collection<Rule> rules) {
        return rules.stream().map(Rule::entry).toList();
    }

    /** Sorted union of every premise and conclusion atom. */
    public static List<String> atoms(Collection<Rule> rules) {
        var s = new TreeSet<String>();
        rules.forEach(r -> {
            s.addAll(r.premiseAtoms());
            s.addAll(r.conclusionAtoms());
        });
        return List.copyOf(s);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Export(@Nullable String domain, List<Rule.Entry> rules) {
    }

    public static class RuleLoadException extends Exception {
        public RuleLoadException(String message) {
            super(message);
        }

        public RuleLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
