package dumb.symbolic.builtin;

import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.Evaluator;

import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;

import static dumb.symbolic.Attributes.*;

/** Logic connectives and flow control. And/Or short-circuit, so they hold their arguments. */
public enum Control {
    ;

    public static final Symbol NOT = Symbol.of("Not");
    public static final Symbol AND = Symbol.of("And");
    public static final Symbol OR = Symbol.of("Or");
    public static final Symbol TRUE_Q = Symbol.of("TrueQ");
    public static final Symbol IF = Symbol.of("If");
    public static final Symbol COMPOUND_EXPRESSION = Symbol.of("CompoundExpression");

    static void register(BuiltinRegistry r) {
        r.register(NOT, Set.of(PROTECTED), Control::not);
        r.register(AND, Set.of(FLAT, ONE_IDENTITY, HOLD_ALL, PROTECTED), (x, ev) -> connective(x, ev, false));
        r.register(OR, Set.of(FLAT, ONE_IDENTITY, HOLD_ALL, PROTECTED), (x, ev) -> connective(x, ev, true));
        r.register(TRUE_Q, Set.of(PROTECTED), (x, ev) -> x.size() == 1
                ? Optional.of(Comparisons.truth(x.get(0).isTrue()))
                : Optional.empty());
        r.register(IF, Set.of(HOLD_REST, PROTECTED), Control::ifThen);
        r.register(COMPOUND_EXPRESSION, Set.of(HOLD_ALL, PROTECTED), Control::compound);
    }

    static Optional<Element> not(Expression x, Evaluator.Evaluation ev) {
        if (x.size() != 1) return Optional.empty();
        var a = x.get(0);
        if (a.isTrue()) return Optional.of(Symbol.FALSE);
        if (isFalse(a)) return Optional.of(Symbol.TRUE);
        if (a instanceof Expression ax && ax.hasHead(NOT) && ax.size() == 1) return Optional.of(ax.get(0));
        return Optional.empty();
    }

    /**
     * And ({@code decisive == false}) or Or ({@code decisive == true}): evaluates left to right and
     * stops at the first decisive value; neutral values are dropped, undecided ones kept.
     */
    static Optional<Element> connective(Expression x, Evaluator.Evaluation ev, boolean decisive) {
        var undecided = new ArrayList<Element>();
        for (var a : x.tail()) {
            var v = ev.evaluate(a);
            if (decisive ? v.isTrue() : isFalse(v)) return Optional.of(Comparisons.truth(decisive));
            if (!(decisive ? isFalse(v) : v.isTrue())) undecided.add(v);
        }
        if (undecided.isEmpty()) return Optional.of(Comparisons.truth(!decisive));
        if (undecided.size() == 1) return Optional.of(undecided.get(0));
        return Optional.of(x.withTail(undecided));
    }

    static Optional<Element> ifThen(Expression x, Evaluator.Evaluation ev) {
        if (x.size() < 2 || x.size() > 4) return Optional.empty();
        var c = x.get(0);
        if (c.isTrue()) return Optional.of(x.get(1));
        if (isFalse(c)) return Optional.of(x.size() >= 3 ? x.get(2) : Symbol.NULL);
        return x.size() == 4 ? Optional.of(x.get(3)) : Optional.empty();
    }

    static Optional<Element> compound(Expression x, Evaluator.Evaluation ev) {
        Element last = Symbol.NULL;
        for (var a : x.tail()) last = ev.evaluate(a);
        return Optional.of(last);
    }

    static boolean isFalse(Element e) {
        return e.equals(Symbol.FALSE) || e.equals(Element.Atom.FALSE);
    }
}
