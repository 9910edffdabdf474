package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Structural normalizations the evaluator applies after argument evaluation. Each returns the
 * argument itself when there is nothing to do, so callers can detect change by identity.
 */
public enum Transforms {
    ;

    /**
     * Canonical argument order: numbers, then strings, then symbols, then expressions. Numbers
     * compare by value, strings and symbols by text, expressions by depth, then leaf count, then
     * printed form.
     */
    public static final Comparator<Element> CANONICAL_ORDER = Transforms::compareCanonical;

    public static boolean isSequence(Element e) {
        return e instanceof Expression x && x.head().equals(Symbol.SEQUENCE);
    }

    /** Splices top-level {@code Sequence[...]} arguments; {@code Sequence[]} vanishes. */
    public static Expression spliceSequences(Expression x) {
        if (x.tail().stream().noneMatch(Transforms::isSequence)) return x;
        var tail = new ArrayList<Element>(x.size());
        for (var a : x.tail()) {
            if (isSequence(a)) tail.addAll(((Expression) a).tail());
            else tail.add(a);
        }
        return x.withTail(tail);
    }

    /** Lifts the arguments of nested same-head sub-expressions into {@code x}, at any depth. */
    public static Expression flatten(Expression x) {
        var head = x.head();
        if (x.tail().stream().noneMatch(a -> a instanceof Expression ax && ax.head().equals(head))) return x;
        var tail = new ArrayList<Element>(x.size() + 4);
        flattenInto(head, x.tail(), tail);
        return x.withTail(tail);
    }

    private static void flattenInto(Element head, List<Element> args, List<Element> out) {
        for (var a : args) {
            if (a instanceof Expression ax && ax.head().equals(head)) flattenInto(head, ax.tail(), out);
            else out.add(a);
        }
    }

    public static Expression sortOrderless(Expression x) {
        if (x.size() < 2) return x;
        var sorted = x.tail().stream().sorted(CANONICAL_ORDER).toList();
        return sorted.equals(x.tail()) ? x : x.withTail(sorted);
    }

    /**
     * Threads {@code x}'s head over its {@code List} arguments: {@code f[List[a, b], c]} becomes
     * {@code List[f[a, c], f[b, c]]}. Empty when there is no List argument or the Lists differ in
     * length.
     */
    public static Optional<Expression> threadListable(Expression x) {
        var length = -1;
        for (var a : x.tail()) {
            if (!isList(a)) continue;
            var n = ((Expression) a).size();
            if (length == -1) length = n;
            else if (length != n) return Optional.empty();
        }
        if (length == -1) return Optional.empty();

        var threaded = new ArrayList<Element>(length);
        for (var i = 0; i < length; i++) {
            var args = new ArrayList<Element>(x.size());
            for (var a : x.tail()) args.add(isList(a) ? ((Expression) a).get(i) : a);
            threaded.add(x.withTail(args));
        }
        return Optional.of(Expression.of(Symbol.LIST, threaded));
    }

    public static boolean isList(Element e) {
        return e instanceof Expression x && x.head().equals(Symbol.LIST);
    }

    private static int rank(Element e) {
        if (e instanceof Atom a) {
            if (a.isNumber()) return 0;
            if (a.isString()) return 1;
            return 2;
        }
        return e instanceof Symbol ? 2 : 3;
    }

    private static int compareCanonical(Element a, Element b) {
        var c = Integer.compare(rank(a), rank(b));
        if (c != 0) return c;
        if (a instanceof Expression xa && b instanceof Expression xb) {
            c = Integer.compare(xa.depth(), xb.depth());
            if (c == 0) c = Integer.compare(xa.leafCount(), xb.leafCount());
        } else if (a instanceof Atom na && na.isNumber() && b instanceof Atom nb && nb.isNumber()) {
            c = compareNumbers(na, nb);
        } else if (a instanceof Atom sa && sa.isString() && b instanceof Atom sb && sb.isString()) {
            c = sa.stringValue().compareTo(sb.stringValue());
        }
        return c != 0 ? c : a.toString().compareTo(b.toString());
    }

    private static int compareNumbers(Atom a, Atom b) {
        var c = Double.compare(re(a), re(b));
        return c != 0 ? c : Double.compare(im(a), im(b));
    }

    private static double re(Atom a) {
        return a.value() instanceof Atom.Complex z ? z.re() : a.doubleValue();
    }

    private static double im(Atom a) {
        return a.value() instanceof Atom.Complex z ? z.im() : 0;
    }
}
