package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Structural pattern constructs. Like the {@link Blanks} they are ordinary expressions with
 * reserved heads; an expression with a reserved head but the wrong shape (e.g. {@code Pattern[1]})
 * is not a construct and matches literally.
 */
public final class Patterns {

    public static final Symbol PATTERN = Symbol.of("Pattern");
    public static final Symbol CONDITION = Symbol.of("Condition");
    public static final Symbol ALTERNATIVES = Symbol.of("Alternatives");
    public static final Symbol PATTERN_TEST = Symbol.of("PatternTest");
    public static final Symbol OPTIONAL = Symbol.of("Optional");
    public static final Symbol REPEATED = Symbol.of("Repeated");
    public static final Symbol REPEATED_NULL = Symbol.of("RepeatedNull");
    public static final Symbol EXCEPT = Symbol.of("Except");
    public static final Symbol VERBATIM = Symbol.of("Verbatim");
    public static final Symbol HOLD_PATTERN = Symbol.of("HoldPattern");

    private static final Set<Symbol> HEADS = Set.of(PATTERN, CONDITION, ALTERNATIVES, PATTERN_TEST, OPTIONAL,
            REPEATED, REPEATED_NULL, EXCEPT, VERBATIM, HOLD_PATTERN,
            Blanks.BLANK, Blanks.BLANK_SEQUENCE, Blanks.BLANK_NULL_SEQUENCE);

    private Patterns() {
    }

    /** {@code Pattern[name, inner]}, written {@code name_} when inner is a bare blank. */
    public static Expression pattern(Symbol name, Element inner) {
        return Expression.of(PATTERN, requireNonNull(name), requireNonNull(inner));
    }

    public static Expression pattern(String name, Element inner) {
        return pattern(Symbol.of(name), inner);
    }

    public static Expression condition(Element pattern, Element test) {
        return Expression.of(CONDITION, requireNonNull(pattern), requireNonNull(test));
    }

    public static Expression alternatives(Element... alternatives) {
        if (alternatives.length < 2)
            throw new IllegalArgumentException("Alternatives needs at least 2 patterns, got " + alternatives.length);
        return Expression.of(ALTERNATIVES, alternatives);
    }

    public static Expression patternTest(Element pattern, Element test) {
        return Expression.of(PATTERN_TEST, requireNonNull(pattern), requireNonNull(test));
    }

    public static Expression optional(Element pattern) {
        return Expression.of(OPTIONAL, requireNonNull(pattern));
    }

    public static Expression optional(Element pattern, Element defaultValue) {
        return Expression.of(OPTIONAL, requireNonNull(pattern), requireNonNull(defaultValue));
    }

    public static Expression repeated(Element pattern) {
        return Expression.of(REPEATED, requireNonNull(pattern));
    }

    /** At most {@code max} repetitions. */
    public static Expression repeated(Element pattern, int max) {
        return Expression.of(REPEATED, requireNonNull(pattern), Atom.of(max));
    }

    public static Expression repeated(Element pattern, int min, int max) {
        return Expression.of(REPEATED, requireNonNull(pattern), Expression.of(Symbol.LIST, Atom.of(min), Atom.of(max)));
    }

    public static Expression repeatedNull(Element pattern) {
        return Expression.of(REPEATED_NULL, requireNonNull(pattern));
    }

    public static Expression repeatedNull(Element pattern, int max) {
        return Expression.of(REPEATED_NULL, requireNonNull(pattern), Atom.of(max));
    }

    public static Expression except(Element excluded) {
        return Expression.of(EXCEPT, requireNonNull(excluded));
    }

    public static Expression except(Element excluded, Element alternative) {
        return Expression.of(EXCEPT, requireNonNull(excluded), requireNonNull(alternative));
    }

    public static Expression verbatim(Element literal) {
        return Expression.of(VERBATIM, requireNonNull(literal));
    }

    public static Expression holdPattern(Element pattern) {
        return Expression.of(HOLD_PATTERN, requireNonNull(pattern));
    }

    public static boolean isPattern(Element e) {
        return is(e, PATTERN, 2, 2) && ((Expression) e).get(0) instanceof Symbol;
    }

    public static boolean isCondition(Element e) {
        return is(e, CONDITION, 2, 2);
    }

    public static boolean isAlternatives(Element e) {
        return is(e, ALTERNATIVES, 1, Integer.MAX_VALUE);
    }

    public static boolean isPatternTest(Element e) {
        return is(e, PATTERN_TEST, 2, 2);
    }

    public static boolean isOptional(Element e) {
        return is(e, OPTIONAL, 1, 2);
    }

    public static boolean isRepeated(Element e) {
        return is(e, REPEATED, 1, 2) && repeatBounds((Expression) e).isPresent();
    }

    public static boolean isRepeatedNull(Element e) {
        return is(e, REPEATED_NULL, 1, 2) && repeatBounds((Expression) e).isPresent();
    }

    public static boolean isAnyRepeated(Element e) {
        return isRepeated(e) || isRepeatedNull(e);
    }

    public static boolean isExcept(Element e) {
        return is(e, EXCEPT, 1, 2);
    }

    public static boolean isVerbatim(Element e) {
        return is(e, VERBATIM, 1, 1);
    }

    public static boolean isHoldPattern(Element e) {
        return is(e, HOLD_PATTERN, 1, 1);
    }

    private static boolean is(Element e, Symbol head, int minArgs, int maxArgs) {
        return e instanceof Expression x && x.head().equals(head) && x.size() >= minArgs && x.size() <= maxArgs;
    }

    public static Symbol patternName(Expression pattern) {
        if (!isPattern(pattern)) throw new IllegalArgumentException("Not a named pattern: " + pattern);
        return (Symbol) pattern.get(0);
    }

    public static Element patternInner(Expression pattern) {
        if (!isPattern(pattern)) throw new IllegalArgumentException("Not a named pattern: " + pattern);
        return pattern.get(1);
    }

    /** The explicit default of an {@code Optional}, if it has one. */
    public static Optional<Element> defaultValue(Expression optional) {
        if (!isOptional(optional)) throw new IllegalArgumentException("Not an optional: " + optional);
        return optional.size() == 2 ? Optional.of(optional.get(1)) : Optional.empty();
    }

    /**
     * Run-length bounds of a {@code Repeated} or {@code RepeatedNull}: {@code Repeated[p]} is 1..,
     * {@code RepeatedNull[p]} 0..; a second argument {@code n} caps the run at n, {@code List[n]}
     * fixes it to exactly n and {@code List[min, max]} gives both bounds. Empty for a malformed spec.
     */
    public static Optional<int[]> repeatBounds(Expression repeat) {
        var min = repeat.head().equals(REPEATED_NULL) ? 0 : 1;
        if (repeat.size() == 1) return Optional.of(new int[]{min, Integer.MAX_VALUE});
        var spec = repeat.get(1);
        if (spec instanceof Atom a && a.isInteger() && a.longValue() >= min)
            return Optional.of(new int[]{min, (int) Math.min(a.longValue(), Integer.MAX_VALUE)});
        if (spec instanceof Expression l && l.head().equals(Symbol.LIST) && (l.size() == 1 || l.size() == 2)
                && l.tail().stream().allMatch(x -> x instanceof Atom a && a.isInteger() && a.longValue() >= 0)) {
            var lo = ((Atom) l.get(0)).longValue();
            var hi = ((Atom) l.get(l.size() - 1)).longValue();
            if (lo <= hi)
                return Optional.of(new int[]{(int) Math.min(lo, Integer.MAX_VALUE), (int) Math.min(hi, Integer.MAX_VALUE)});
        }
        return Optional.empty();
    }

    /** Names bound anywhere inside {@code pattern}, in first-occurrence order. */
    public static Set<Symbol> collectPatternNames(Element pattern) {
        var names = new LinkedHashSet<Symbol>();
        collectPatternNames(pattern, names);
        return names;
    }

    private static void collectPatternNames(Element e, Set<Symbol> names) {
        if (!(e instanceof Expression x)) return;
        if (isVerbatim(x)) return;
        if (isPattern(x)) names.add(patternName(x));
        collectPatternNames(x.head(), names);
        x.tail().forEach(sub -> collectPatternNames(sub, names));
    }

    /** True when no pattern construct occurs anywhere in {@code e}, so it can only match literally. */
    public static boolean isPatternFree(Element e) {
        if (!(e instanceof Expression x)) return true;
        if (x.head() instanceof Symbol s && HEADS.contains(s)) return false;
        return isPatternFree(x.head()) && x.tail().stream().allMatch(Patterns::isPatternFree);
    }

    /** Strips {@code HoldPattern} wrappers. */
    public static Element unhold(Element pattern) {
        var p = pattern;
        while (isHoldPattern(p)) p = ((Expression) p).get(0);
        return p;
    }
}
