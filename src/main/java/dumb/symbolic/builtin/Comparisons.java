package dumb.symbolic.builtin;

import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element;
import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;

import static dumb.symbolic.Attributes.PROTECTED;

/**
 * {@code Equal} and the order comparisons decide only when they can: numbers by value, strings by
 * text, identical expressions as equal. Anything else stays unevaluated. {@code SameQ} always
 * decides, structurally.
 */
public enum Comparisons {
    ;

    public static final Symbol EQUAL = Symbol.of("Equal");
    public static final Symbol UNEQUAL = Symbol.of("Unequal");
    public static final Symbol LESS = Symbol.of("Less");
    public static final Symbol GREATER = Symbol.of("Greater");
    public static final Symbol LESS_EQUAL = Symbol.of("LessEqual");
    public static final Symbol GREATER_EQUAL = Symbol.of("GreaterEqual");
    public static final Symbol SAME_Q = Symbol.of("SameQ");
    public static final Symbol UNSAME_Q = Symbol.of("UnsameQ");

    static void register(BuiltinRegistry r) {
        var attrs = Set.of(PROTECTED);
        r.register(EQUAL, attrs, (x, ev) -> equal(x).map(Comparisons::truth));
        r.register(UNEQUAL, attrs, (x, ev) -> equal(x).map(b -> truth(!b)));
        r.register(LESS, attrs, (x, ev) -> order(x, c -> c < 0));
        r.register(GREATER, attrs, (x, ev) -> order(x, c -> c > 0));
        r.register(LESS_EQUAL, attrs, (x, ev) -> order(x, c -> c <= 0));
        r.register(GREATER_EQUAL, attrs, (x, ev) -> order(x, c -> c >= 0));
        r.register(SAME_Q, attrs, (x, ev) -> Optional.of(truth(allSame(x))));
        r.register(UNSAME_Q, attrs, (x, ev) -> Optional.of(truth(!allSame(x))));
    }

    public static Symbol truth(boolean b) {
        return b ? Symbol.TRUE : Symbol.FALSE;
    }

    private static boolean allSame(Expression x) {
        return x.tail().stream().allMatch(a -> a.equals(x.get(0)));
    }

    /** Empty when some pair cannot be decided. */
    private static Optional<Boolean> equal(Expression x) {
        if (x.size() < 2) return Optional.of(true);
        for (var i = 1; i < x.size(); i++) {
            var d = equal(x.get(i - 1), x.get(i));
            if (d.isEmpty()) return Optional.empty();
            if (!d.get()) return Optional.of(false);
        }
        return Optional.of(true);
    }

    private static Optional<Boolean> equal(Element a, Element b) {
        if (a instanceof Atom na && na.isNumber() && b instanceof Atom nb && nb.isNumber())
            return Optional.of(Numbers.numericallyEqual(na, nb));
        if (a.equals(b)) return Optional.of(true);
        if (a instanceof Atom sa && sa.isString() && b instanceof Atom sb && sb.isString()) return Optional.of(false);
        if (isBoolean(a) && isBoolean(b)) return Optional.of(a.isTrue() == b.isTrue());
        return Optional.empty();
    }

    private static boolean isBoolean(Element e) {
        return e.equals(Symbol.TRUE) || e.equals(Symbol.FALSE) || (e instanceof Atom a && a.isBoolean());
    }

    private static Optional<Element> order(Expression x, IntPredicate holds) {
        if (x.size() < 2) return Optional.of(Symbol.TRUE);
        if (!x.tail().stream().allMatch(Numbers::isReal)) return Optional.empty();
        for (var i = 1; i < x.size(); i++)
            if (!holds.test(Numbers.compare((Atom) x.get(i - 1), (Atom) x.get(i)))) return Optional.of(Symbol.FALSE);
        return Optional.of(Symbol.TRUE);
    }
}
