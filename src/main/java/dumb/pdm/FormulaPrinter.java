package dumb.pdm;

import dumb.pdm.Formula.*;

/**
 * Renders formulas back to parseable text, using as few parentheses as the
 * precedence table allows: a child is wrapped when it binds looser than its parent,
 * and a right operand of equal strength is wrapped too since binary operators
 * associate to the left.
 */
public final class FormulaPrinter implements Formula.Visitor<String> {
    private static final FormulaPrinter the = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(Formula f) {
        return f.accept(the);
    }

    private static String child(Formula parent, Formula child, boolean rightOperand) {
        var p = parent.connective().precedence;
        var c = child.connective().precedence;
        var s = print(child);
        return c < p || (rightOperand && c == p) ? "(" + s + ")" : s;
    }

    private static String binary(Binary b) {
        return child(b, b.left(), false) + " " + b.connective().symbol + " " + child(b, b.right(), true);
    }

    @Override
    public String atom(Atom a) {
        return a.name();
    }

    @Override
    public String not(Not n) {
        return Connective.NOT.symbol + " " + child(n, n.operand(), false);
    }

    @Override
    public String and(And a) {
        return binary(a);
    }

    @Override
    public String or(Or o) {
        return binary(o);
    }

    @Override
    public String xor(Xor x) {
        return binary(x);
    }

    @Override
    public String implies(Implies i) {
        return binary(i);
    }

    @Override
    public String iff(Iff i) {
        return binary(i);
    }
}
