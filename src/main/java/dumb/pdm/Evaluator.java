package dumb.pdm;

import dumb.pdm.Formula.*;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Truth value of a formula under an assignment. Atoms absent from the assignment
 * are false.
 */
public final class Evaluator implements Formula.Visitor<Boolean> {
    private final Map<String, Boolean> assignment;

    private Evaluator(Map<String, Boolean> assignment) {
        this.assignment = requireNonNull(assignment);
    }

    public static boolean evaluate(Formula f, Map<String, Boolean> assignment) {
        return f.accept(new Evaluator(assignment));
    }

    private boolean eval(Formula f) {
        return f.accept(this);
    }

    @Override
    public Boolean atom(Atom a) {
        return Boolean.TRUE.equals(assignment.get(a.name()));
    }

    @Override
    public Boolean not(Not n) {
        return !eval(n.operand());
    }

    @Override
    public Boolean and(And a) {
        return eval(a.left()) && eval(a.right());
    }

    @Override
    public Boolean or(Or o) {
        return eval(o.left()) || eval(o.right());
    }

    @Override
    public Boolean xor(Xor x) {
        return eval(x.left()) ^ eval(x.right());
    }

    @Override
    public Boolean implies(Implies i) {
        return !eval(i.left()) || eval(i.right());
    }

    @Override
    public Boolean iff(Iff i) {
        return eval(i.left()) == eval(i.right());
    }
}
