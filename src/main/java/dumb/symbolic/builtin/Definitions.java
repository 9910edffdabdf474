package dumb.symbolic.builtin;

import dumb.symbolic.Attributes;
import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.EvaluationContext;
import dumb.symbolic.EvaluationException;
import dumb.symbolic.Evaluator;
import dumb.symbolic.Patterns;
import dumb.symbolic.ProtectedException;
import dumb.symbolic.Rule;
import dumb.symbolic.ValueStore.Category;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static dumb.symbolic.Attributes.*;

/**
 * Assignment and attribute management. {@code Set} and {@code SetDelayed} file the new rule under
 * the value category the left-hand side's shape selects:
 * <ul>
 *     <li>a symbol: OwnValue</li>
 *     <li>{@code Default[f, ...]}: DefaultValue of f</li>
 *     <li>{@code N[f[...], ...]}: NValue of f</li>
 *     <li>{@code f[...]}: DownValue of f</li>
 *     <li>{@code f[...][...]}: SubValue of f</li>
 * </ul>
 */
public enum Definitions {
    ;

    public static final Symbol SET = Symbol.of("Set");
    public static final Symbol SET_DELAYED = Symbol.of("SetDelayed");
    public static final Symbol CLEAR = Symbol.of("Clear");
    public static final Symbol CLEAR_ALL = Symbol.of("ClearAll");
    public static final Symbol SET_ATTRIBUTES = Symbol.of("SetAttributes");
    public static final Symbol CLEAR_ATTRIBUTES = Symbol.of("ClearAttributes");
    public static final Symbol ATTRIBUTES = Symbol.of("Attributes");
    public static final Symbol OWN_VALUES = Symbol.of("OwnValues");
    public static final Symbol DOWN_VALUES = Symbol.of("DownValues");
    public static final Symbol UP_VALUES = Symbol.of("UpValues");
    public static final Symbol SUB_VALUES = Symbol.of("SubValues");

    static void register(BuiltinRegistry r) {
        r.register(SET, Set.of(HOLD_FIRST, SEQUENCE_HOLD, PROTECTED), (x, ev) -> assign(x, ev, Rule.Kind.IMMEDIATE));
        r.register(SET_DELAYED, Set.of(HOLD_ALL, SEQUENCE_HOLD, PROTECTED), (x, ev) -> assign(x, ev, Rule.Kind.DELAYED));
        r.register(CLEAR, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> clear(x, ev, false));
        r.register(CLEAR_ALL, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> clear(x, ev, true));
        r.register(SET_ATTRIBUTES, Set.of(HOLD_FIRST, PROTECTED), (x, ev) -> changeAttributes(x, ev, true));
        r.register(CLEAR_ATTRIBUTES, Set.of(HOLD_FIRST, PROTECTED), (x, ev) -> changeAttributes(x, ev, false));
        r.register(ATTRIBUTES, Set.of(HOLD_ALL, PROTECTED), Definitions::attributes);
        r.register(OWN_VALUES, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> values(x, ev, Category.OWN));
        r.register(DOWN_VALUES, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> values(x, ev, Category.DOWN));
        r.register(UP_VALUES, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> values(x, ev, Category.UP));
        r.register(SUB_VALUES, Set.of(HOLD_ALL, PROTECTED), (x, ev) -> values(x, ev, Category.SUB));
    }

    /** Where a definition goes: the category and the symbol that owns it. */
    record Target(Category category, Symbol symbol) {
    }

    static Optional<Element> assign(Expression x, Evaluator.Evaluation ev, Rule.Kind kind) {
        if (x.size() != 2) return Optional.empty();
        Element lhs = x.get(0);
        Element rhs = x.get(1);
        Element condition = null;

        if (Patterns.isCondition(lhs)) {
            condition = ((Expression) lhs).get(1);
            lhs = ((Expression) lhs).get(0);
        }
        if (kind == Rule.Kind.DELAYED && Patterns.isCondition(rhs)) {
            condition = condition == null ? ((Expression) rhs).get(1)
                    : Expression.of(Control.AND, condition, ((Expression) rhs).get(1));
            rhs = ((Expression) rhs).get(0);
        }

        var target = target(lhs);
        var owner = target.symbol();
        if (Attributes.isProtected(ev.attributes(owner)))
            throw new ProtectedException(owner, "Cannot assign to " + lhs + ": " + owner + " is Protected");

        define(ev.context(), target, new Rule(lhs, new Rule.Template(rhs), kind, condition, 0));
        return Optional.of(kind == Rule.Kind.IMMEDIATE ? rhs : Symbol.NULL);
    }

    /** @throws EvaluationException when {@code lhs} cannot carry a definition */
    static Target target(Element lhs) {
        var bare = Patterns.unhold(lhs);
        if (bare instanceof Symbol s) return new Target(Category.OWN, s);
        if (bare instanceof Expression x) {
            if (x.hasHead(EvaluationContext.DEFAULT) && !x.isEmpty() && x.get(0) instanceof Symbol f)
                return new Target(Category.DEFAULT, f);
            if (x.hasHead(Evaluator.N) && !x.isEmpty()) {
                var first = Patterns.unhold(x.get(0));
                var root = first instanceof Symbol s ? Optional.of(s)
                        : first instanceof Expression fx ? fx.rootSymbol() : Optional.<Symbol>empty();
                if (root.isPresent()) return new Target(Category.N, root.get());
            }
            if (x.head() instanceof Symbol f) {
                if (isPatternHead(f))
                    throw new EvaluationException("Cannot assign to the pattern " + lhs);
                return new Target(Category.DOWN, f);
            }
            var root = x.rootSymbol();
            if (root.isPresent()) return new Target(Category.SUB, root.get());
        }
        throw new EvaluationException("Cannot assign to " + lhs);
    }

    private static boolean isPatternHead(Symbol f) {
        return f.equals(Patterns.PATTERN) || f.equals(Patterns.CONDITION) || f.equals(Patterns.ALTERNATIVES);
    }

    private static void define(EvaluationContext context, Target target, Rule rule) {
        context.define(target.category(), target.symbol(), rule);
    }

    static Optional<Element> clear(Expression x, Evaluator.Evaluation ev, boolean all) {
        for (var s : symbols(x.tail())) {
            if (Attributes.isProtected(ev.attributes(s)))
                throw new ProtectedException(s, "Cannot clear Protected symbol " + s);
            if (all) ev.context().clearAll(s);
            else ev.context().clearValues(s);
        }
        return Optional.of(Symbol.NULL);
    }

    static Optional<Element> changeAttributes(Expression x, Evaluator.Evaluation ev, boolean add) {
        if (x.size() != 2) return Optional.empty();
        var targets = symbols(List.of(x.get(0)));
        var attrs = symbols(List.of(x.get(1))).toArray(Symbol[]::new);
        for (var a : attrs)
            if (!Attributes.isAttribute(a)) throw new EvaluationException("Not an attribute: " + a);
        for (var s : targets) {
            if (Attributes.isLocked(ev.attributes(s)))
                throw new ProtectedException(s, "Attributes of " + s + " are Locked");
            var context = ev.context();
            if (context.lookupAttributes(s).isEmpty()) context.setAttributes(s, ev.attributes(s));
            if (add) context.addAttributes(s, attrs);
            else context.removeAttributes(s, attrs);
        }
        return Optional.of(Symbol.NULL);
    }

    static Optional<Element> attributes(Expression x, Evaluator.Evaluation ev) {
        if (x.size() != 1 || !(x.get(0) instanceof Symbol s)) return Optional.empty();
        return Optional.of(list(ev.attributes(s)));
    }

    /** The stored rules as a list of {@code Rule}/{@code RuleDelayed} expressions, in trial order. */
    static Optional<Element> values(Expression x, Evaluator.Evaluation ev, Category category) {
        if (x.size() != 1 || !(x.get(0) instanceof Symbol s)) return Optional.empty();
        var rules = new ArrayList<>(ev.context().rules(s, category));
        rules.sort(Rule.BY_PRIORITY);
        var out = new ArrayList<Element>(rules.size());
        for (var rule : rules)
            if (rule.rhs() instanceof Rule.Template) out.add(Structure.toExpression(rule));
        return Optional.of(Expression.of(Symbol.LIST, out));
    }

    static Expression list(Set<Symbol> attrs) {
        var sorted = new ArrayList<>(attrs);
        sorted.sort(Comparator.comparing(Symbol::name));
        return Expression.of(Symbol.LIST, sorted);
    }

    /** Symbols named directly or inside a {@code List}; anything else is an error. */
    private static List<Symbol> symbols(List<Element> args) {
        var out = new ArrayList<Symbol>();
        for (var a : args) {
            if (a instanceof Symbol s) out.add(s);
            else if (a instanceof Expression l && l.hasHead(Symbol.LIST)) out.addAll(symbols(l.tail()));
            else throw new EvaluationException("Expected a symbol, got " + a);
        }
        return out;
    }
}
