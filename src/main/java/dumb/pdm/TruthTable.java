package dumb.pdm;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.pdm.FormulaParser.ParseException;
import dumb.pdm.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Every assignment over an ordered atom list, with the value of each named formula.
 * Rows count up in binary with the last atom as the least significant bit, so the
 * first row is all false and the last all true.
 */
public record TruthTable(List<String> atoms, List<String> formulas, List<Row> rows) {
    private static final Logger logger = LoggerFactory.getLogger(TruthTable.class);

    /** Widest atom list whose row count still fits the counter. */
    private static final int MAX_COUNTER_BITS = 62;

    public TruthTable {
        atoms = List.copyOf(atoms);
        formulas = List.copyOf(formulas);
        rows = List.copyOf(rows);
    }

    public static TruthTable generate(List<Column> formulas) {
        return generate(formulas, null, null);
    }

    /**
     * @param atoms  explicit ordering (duplicates dropped, first occurrence wins); when null
     *               the atoms of {@code formulas}, sorted by name
     * @param filter when present only rows satisfying it are kept, and it is added as a column
     * @throws IllegalArgumentException when a column name repeats an atom or another column
     */
    public static TruthTable generate(List<Column> formulas, @Nullable List<String> atoms, @Nullable Column filter) {
        requireNonNull(formulas);
        var atomList = atoms != null ? List.copyOf(new LinkedHashSet<>(atoms)) : inferredAtoms(formulas);
        var n = atomList.size();
        if (n > MAX_COUNTER_BITS)
            throw new IllegalArgumentException("Cannot enumerate " + n + " atoms");

        var names = new ArrayList<String>(formulas.size() + 1);
        formulas.forEach(c -> names.add(c.name()));
        if (filter != null) names.add(filter.name());
        var columns = new HashSet<>(atomList);
        for (var name : names)
            if (!columns.add(name))
                throw new IllegalArgumentException("Column name '" + name + "' is already used by an atom or another column");

        var total = 1L << n;
        var rows = new ArrayList<Row>();
        for (long i = 0; i < total; i++) {
            var assignment = new LinkedHashMap<String, Boolean>(n * 2);
            for (var j = 0; j < n; j++)
                assignment.put(atomList.get(j), ((i >>> (n - 1 - j)) & 1L) == 1L);

            if (filter != null && !Evaluator.evaluate(filter.formula(), assignment)) continue;

            var values = new LinkedHashMap<>(assignment);
            for (var c : formulas) values.put(c.name(), Evaluator.evaluate(c.formula(), assignment));
            if (filter != null) values.put(filter.name(), true);
            rows.add(new Row(values));
        }
        logger.debug("Truth table over {} atoms: {} of {} rows kept", n, rows.size(), total);
        return new TruthTable(atomList, names, rows);
    }

    private static List<String> inferredAtoms(List<Column> formulas) {
        var s = new TreeSet<String>();
        formulas.forEach(c -> s.addAll(c.formula().atoms()));
        return List.copyOf(s);
    }

    public int size() {
        return rows.size();
    }

    /** Rows in which the given column is true. */
    public List<Row> rowsWhere(String column) {
        return rows.stream().filter(r -> r.get(column)).toList();
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    /** A formula column. */
    public record Column(String name, Formula formula) {
        public Column {
            requireNonNull(name);
            requireNonNull(formula);
        }

        public static Column parse(String name, String formulaText) throws ParseException {
            return new Column(name, FormulaParser.parse(formulaText));
        }
    }

    public record Row(Map<String, Boolean> values) {
        public Row {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        /** Atom and formula values in column order. */
        @JsonValue
        @Override
        public Map<String, Boolean> values() {
            return values;
        }

        public boolean get(String column) {
            var v = values.get(column);
            if (v == null) throw new NoSuchElementException("No column " + column);
            return v;
        }

        /** Just the atom part of this row, in column order. */
        public Map<String, Boolean> assignment(List<String> atoms) {
            var m = new LinkedHashMap<String, Boolean>();
            atoms.forEach(a -> m.put(a, get(a)));
            return m;
        }
    }
}
