package dumb.pdm;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Propositional formula. The node set is closed: every operation over formulas is a
 * {@link Visitor}, so adding a node kind is a compile-time change everywhere.
 */
sealed public interface Formula permits Formula.Atom, Formula.Not, Formula.Binary {

    <R> R accept(Visitor<R> v);

    Connective connective();

    /** Names of every atom reachable from this node, in one walk of the tree. */
    default Set<String> atoms() {
        var names = new HashSet<String>();
        var todo = new ArrayDeque<Formula>();
        todo.push(this);
        while (!todo.isEmpty()) {
            var f = todo.pop();
            if (f instanceof Atom a) {
                names.add(a.name());
            } else if (f instanceof Not n) {
                todo.push(n.operand());
            } else if (f instanceof Binary b) {
                todo.push(b.right());
                todo.push(b.left());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    default String str() {
        return FormulaPrinter.print(this);
    }

    interface Visitor<R> {
        R atom(Atom a);

        R not(Not n);

        R and(And a);

        R or(Or o);

        R xor(Xor x);

        R implies(Implies i);

        R iff(Iff i);
    }

    /**
     * Binding strength, loosest first. Binary connectives are left-associative.
     */
    enum Connective {
        IFF("<->", 1), IMPLIES("->", 2), OR("OR", 3), XOR("XOR", 4), AND("AND", 5), NOT("NOT", 6), ATOM("", 7);

        public final String symbol;
        public final int precedence;

        Connective(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }
    }

    /** Two-operand node. */
    sealed interface Binary extends Formula permits And, Or, Xor, Implies, Iff {
        Formula left();

        Formula right();
    }

    record Atom(String name) implements Formula {
        public Atom {
            requireNonNull(name);
            if (!Tokenizer.isIdentifier(name))
                throw new IllegalArgumentException("Not an atom name: '" + name + "'");
        }

        public static Atom of(String name) {
            return new Atom(name);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.atom(this);
        }

        @Override
        public Connective connective() {
            return Connective.ATOM;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            requireNonNull(operand);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.not(this);
        }

        @Override
        public Connective connective() {
            return Connective.NOT;
        }

        @Override
        public String toString() {
            return str();
        }
    }

    record And(Formula left, Formula right) implements Binary {
        public And {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.and(this);
        }

        @Override
        public Connective connective() {
            return Connective.AND;
        }

        @Override
        public String toString() {
            return str();
        }
    }

    record Or(Formula left, Formula right) implements Binary {
        public Or {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.or(this);
        }

        @Override
        public Connective connective() {
            return Connective.OR;
        }

        @Override
        public String toString() {
            return str();
        }
    }

    record Xor(Formula left, Formula right) implements Binary {
        public Xor {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.xor(this);
        }

        @Override
        public Connective connective() {
            return Connective.XOR;
        }

        @Override
        public String toString() {
            return str();
        }
    }

    /** Material implication. */
    record Implies(Formula left, Formula right) implements Binary {
        public Implies {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.implies(this);
        }

        @Override
        public Connective connective() {
            return Connective.IMPLIES;
        }

        @Override
        public String toString() {
            return str();
        }
    }

    /** Biconditional. */
    record Iff(Formula left, Formula right) implements Binary {
        public Iff {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.iff(this);
        }

        @Override
        public Connective connective() {
            return Connective.IFF;
        }

        @Override
        public String toString() {
            return str();
        }
    }
}
