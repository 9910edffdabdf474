package dumb.symbolic.builtin;

import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element;
import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.Evaluator;

import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;

import static dumb.symbolic.Attributes.*;

/**
 * Numeric folding for the arithmetic heads. Numbers are combined, everything else is left in place,
 * so {@code Plus[1, a, 2]} becomes {@code Plus[3, a]}. No algebra beyond that.
 */
public enum Arithmetic {
    ;

    public static final Symbol PLUS = Symbol.of("Plus");
    public static final Symbol TIMES = Symbol.of("Times");
    public static final Symbol POWER = Symbol.of("Power");
    public static final Symbol MINUS = Symbol.of("Minus");
    public static final Symbol SUBTRACT = Symbol.of("Subtract");
    public static final Symbol DIVIDE = Symbol.of("Divide");

    private static final Set<Symbol> ASSOCIATIVE = Set.of(FLAT, ORDERLESS, ONE_IDENTITY, LISTABLE, NUMERIC_FUNCTION, PROTECTED);
    private static final Set<Symbol> NUMERIC = Set.of(LISTABLE, NUMERIC_FUNCTION, PROTECTED);

    static void register(BuiltinRegistry r) {
        r.register(PLUS, ASSOCIATIVE, Arithmetic::plus);
        r.register(TIMES, ASSOCIATIVE, Arithmetic::times);
        r.register(POWER, Set.of(LISTABLE, NUMERIC_FUNCTION, ONE_IDENTITY, PROTECTED), Arithmetic::power);
        r.register(MINUS, NUMERIC, (x, ev) -> x.size() == 1
                ? Optional.of(Expression.of(TIMES, Atom.of(-1L), x.get(0)))
                : Optional.empty());
        r.register(SUBTRACT, NUMERIC, (x, ev) -> x.size() == 2
                ? Optional.of(Expression.of(PLUS, x.get(0), Expression.of(TIMES, Atom.of(-1L), x.get(1))))
                : Optional.empty());
        r.register(DIVIDE, NUMERIC, Arithmetic::divide);
        r.register(Evaluator.N, Set.of(PROTECTED), Arithmetic::numeric);
    }

    static Optional<Element> plus(Expression x, Evaluator.Evaluation ev) {
        return fold(x, Numbers.zero(), Numbers::plus);
    }

    static Optional<Element> times(Expression x, Evaluator.Evaluation ev) {
        if (x.tail().stream().anyMatch(a -> a instanceof Atom n && n.isInteger() && n.longValue() == 0))
            return Optional.of(Numbers.zero());
        return fold(x, Numbers.one(), Numbers::times);
    }

    private static Optional<Element> fold(Expression x, Atom identity, BinaryOperator<Atom> op) {
        if (x.isEmpty()) return Optional.of(identity);
        if (x.size() == 1) return Optional.of(x.get(0));

        Atom total = null;
        var rest = new ArrayList<Element>(x.size());
        for (var a : x.tail()) {
            if (Numbers.isNumber(a)) total = total == null ? (Atom) a : op.apply(total, (Atom) a);
            else rest.add(a);
        }
        if (rest.isEmpty()) return Optional.of(total);
        if (total == null) return Optional.empty();

        var args = new ArrayList<Element>(rest.size() + 1);
        if (!(total.isInteger() && total.equals(identity))) args.add(total);
        args.addAll(rest);
        return Optional.of(args.size() == 1 ? args.get(0) : x.withTail(args));
    }

    static Optional<Element> power(Expression x, Evaluator.Evaluation ev) {
        if (x.size() == 1) return Optional.of(x.get(0));
        if (x.size() != 2) return Optional.empty();
        var base = x.get(0);
        var exponent = x.get(1);
        if (base instanceof Atom b && b.isNumber() && exponent instanceof Atom e && e.isNumber())
            return Numbers.power(b, e).map(Element.class::cast);
        if (exponent instanceof Atom e && e.isInteger()) {
            if (e.longValue() == 0) return Optional.of(Numbers.one());
            if (e.longValue() == 1) return Optional.of(base);
        }
        if (base instanceof Atom b && b.isInteger() && b.longValue() == 1) return Optional.of(Numbers.one());
        return Optional.empty();
    }

    static Optional<Element> divide(Expression x, Evaluator.Evaluation ev) {
        if (x.size() != 2) return Optional.empty();
        if (x.get(0) instanceof Atom a && a.isNumber() && x.get(1) instanceof Atom b && b.isNumber())
            return Numbers.divide(a, b).map(Element.class::cast);
        if (x.get(1) instanceof Atom b && b.isNumber() && Numbers.isZero(b)) return Optional.empty();
        return Optional.of(Expression.of(TIMES, x.get(0), Expression.of(POWER, x.get(1), Atom.of(-1L))));
    }

    /** {@code N[x]}: integers become reals, and N is pushed into the arguments of an expression. */
    static Optional<Element> numeric(Expression x, Evaluator.Evaluation ev) {
        if (x.size() != 1) return Optional.empty();
        var arg = x.get(0);
        if (arg instanceof Atom a) return Optional.of(a.isNumber() ? Numbers.toReal(a) : a);
        if (arg instanceof Symbol) return Optional.of(arg);
        var e = (Expression) arg;
        return Optional.of(e.map(sub -> Expression.of(Evaluator.N, sub)));
    }
}
