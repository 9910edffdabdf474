package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A node of an expression tree: a {@link Symbol}, a self-evaluating {@link Atom} or a compound
 * {@link Expression}. There are exactly these three shapes.
 */
sealed public interface Element permits Element.Symbol, Element.Atom, Element.Expression {

    /**
     * The head of this element. Expressions report their head; symbols report {@code Symbol};
     * atoms report their type symbol ({@code Integer}, {@code Real}, {@code Complex}, {@code String}).
     */
    Element head();

    /** Nesting depth, 1 for leaves. Heads do not count. */
    int depth();

    /** Number of leaves, heads included. */
    int leafCount();

    JsonNode toJson();

    default boolean hasHead(Element head) {
        return head().equals(head);
    }

    default boolean isTrue() {
        return equals(Symbol.TRUE) || equals(Atom.TRUE);
    }

    record Symbol(String name) implements Element {
        private static final Map<String, Symbol> internCache = new ConcurrentHashMap<>(1024);

        public static final Symbol SYMBOL = of("Symbol");
        public static final Symbol TRUE = of("True");
        public static final Symbol FALSE = of("False");
        public static final Symbol NULL = of("Null");
        public static final Symbol LIST = of("List");
        public static final Symbol SEQUENCE = of("Sequence");

        public Symbol {
            requireNonNull(name, "symbol name");
            if (name.isEmpty()) throw new IllegalArgumentException("Symbol name must not be empty");
        }

        /** The interned symbol for {@code name}. */
        public static Symbol of(String name) {
            return internCache.computeIfAbsent(name, Symbol::new);
        }

        public static int internedCount() {
            return internCache.size();
        }

        /**
         * Drops the intern table. Symbols compare by name, so instances obtained before the reset
         * stay equal to those obtained after it.
         */
        public static void clearInternCache() {
            internCache.clear();
        }

        @Override
        public Element head() {
            return SYMBOL;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public int leafCount() {
            return 1;
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JsonNode toJson() {
            return Json.node()
                    .put("type", "symbol")
                    .put("name", name);
        }
    }

    record Atom(@Nullable Object value) implements Element {
        public static final Atom NULL = new Atom(null);
        public static final Atom TRUE = new Atom(Boolean.TRUE);
        public static final Atom FALSE = new Atom(Boolean.FALSE);

        private static final Symbol INTEGER = Symbol.of("Integer");
        private static final Symbol REAL = Symbol.of("Real");
        private static final Symbol COMPLEX = Symbol.of("Complex");
        private static final Symbol STRING = Symbol.of("String");

        public Atom {
            if (value != null && !(value instanceof Long || value instanceof Double || value instanceof Complex
                    || value instanceof String || value instanceof Boolean))
                throw new IllegalArgumentException("Unsupported atom value type: " + value.getClass().getName());
        }

        public static Atom of(long value) {
            return new Atom(value);
        }

        public static Atom of(double value) {
            return new Atom(value);
        }

        public static Atom of(String value) {
            return new Atom(requireNonNull(value));
        }

        public static Atom of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public static Atom complex(double re, double im) {
            return new Atom(new Complex(re, im));
        }

        public boolean isInteger() {
            return value instanceof Long;
        }

        public boolean isReal() {
            return value instanceof Double;
        }

        public boolean isComplex() {
            return value instanceof Complex;
        }

        public boolean isNumber() {
            return isInteger() || isReal() || isComplex();
        }

        public boolean isString() {
            return value instanceof String;
        }

        public boolean isBoolean() {
            return value instanceof Boolean;
        }

        public boolean isNull() {
            return value == null;
        }

        public long longValue() {
            if (value instanceof Long l) return l;
            throw new IllegalStateException("Not an integer atom: " + this);
        }

        public double doubleValue() {
            if (value instanceof Long l) return l;
            if (value instanceof Double d) return d;
            throw new IllegalStateException("Not a real atom: " + this);
        }

        public String stringValue() {
            if (value instanceof String s) return s;
            throw new IllegalStateException("Not a string atom: " + this);
        }

        @Override
        public Element head() {
            if (value instanceof Long) return INTEGER;
            if (value instanceof Double) return REAL;
            if (value instanceof Complex) return COMPLEX;
            if (value instanceof String) return STRING;
            return Symbol.SYMBOL;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public int leafCount() {
            return 1;
        }

        @Override
        public String toString() {
            if (value == null) return "Null";
            if (value instanceof Boolean b) return b ? "True" : "False";
            if (value instanceof String s) return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
            return value.toString();
        }

        @Override
        public JsonNode toJson() {
            var n = Json.node().put("type", "atom").put("head", head().toString());
            if (value instanceof Long l) n.put("value", l);
            else if (value instanceof Double d) n.put("value", d);
            else if (value instanceof String s) n.put("value", s);
            else if (value instanceof Boolean b) n.put("value", b);
            else if (value instanceof Complex c) n.putObject("value").put("re", c.re()).put("im", c.im());
            else n.putNull("value");
            return n;
        }

        public record Complex(double re, double im) {
            public Complex plus(Complex o) {
                return new Complex(re + o.re, im + o.im);
            }

            public Complex times(Complex o) {
                return new Complex(re * o.re - im * o.im, re * o.im + im * o.re);
            }

            @Override
            public String toString() {
                return "Complex[" + re + ", " + im + ']';
            }
        }
    }

    /**
     * Immutable compound node. Equality and hash cover head and tail only; the local attribute set
     * is carried along by every transformation but never distinguishes two expressions.
     */
    final class Expression implements Element {
        private final Element head;
        private final List<Element> tail;
        private final Set<Symbol> attributes;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String fullFormCache;
        private volatile int depthCache = -1, leafCountCache = -1;

        public Expression(Element head, List<? extends Element> tail, Set<Symbol> attributes) {
            requireNonNull(head, "expression head");
            if (head instanceof Atom)
                throw new IllegalArgumentException("Expression head must be a Symbol or Expression, got atom " + head);
            requireNonNull(tail, "expression tail");
            for (var i = 0; i < tail.size(); i++)
                if (tail.get(i) == null) throw new NullPointerException("expression tail entry " + i + " is null");
            for (var a : requireNonNull(attributes, "expression attributes"))
                if (!Attributes.isAttribute(requireNonNull(a, "attribute")))
                    throw new IllegalArgumentException("Not an attribute: " + a);
            this.head = head;
            this.tail = List.copyOf(tail);
            this.attributes = Set.copyOf(attributes);
        }

        public Expression(Element head, List<? extends Element> tail) {
            this(head, tail, Set.of());
        }

        public static Expression of(Element head, Element... tail) {
            return new Expression(head, List.of(tail));
        }

        public static Expression of(String head, Element... tail) {
            return new Expression(Symbol.of(head), List.of(tail));
        }

        public static Expression of(Element head, List<? extends Element> tail) {
            return new Expression(head, tail);
        }

        @Override
        public Element head() {
            return head;
        }

        public List<Element> tail() {
            return tail;
        }

        public Set<Symbol> attributes() {
            return attributes;
        }

        public int size() {
            return tail.size();
        }

        public boolean isEmpty() {
            return tail.isEmpty();
        }

        public Element get(int index) {
            return tail.get(index);
        }

        public boolean hasAttribute(Symbol attribute) {
            return attributes.contains(attribute);
        }

        /** The head when it is a symbol. */
        public Optional<Symbol> symbolHead() {
            return head instanceof Symbol s ? Optional.of(s) : Optional.empty();
        }

        /** The symbol at the bottom of a chain of expression heads, e.g. {@code f} for {@code f[a][b]}. */
        public Optional<Symbol> rootSymbol() {
            Element h = head;
            while (h instanceof Expression e) h = e.head;
            return h instanceof Symbol s ? Optional.of(s) : Optional.empty();
        }

        public Expression withHead(Element newHead) {
            return newHead == head ? this : new Expression(newHead, tail, attributes);
        }

        public Expression withTail(List<? extends Element> newTail) {
            return new Expression(head, newTail, attributes);
        }

        public Expression withTail(Element... newTail) {
            return withTail(List.of(newTail));
        }

        public Expression withAttributes(Symbol... added) {
            var s = new HashSet<>(attributes);
            s.addAll(List.of(added));
            return new Expression(head, tail, s);
        }

        public Expression withoutAttributes(Symbol... removed) {
            var s = new HashSet<>(attributes);
            List.of(removed).forEach(s::remove);
            return new Expression(head, tail, s);
        }

        /** Applies {@code fn} to every tail element; returns this instance if none changed. */
        public Expression map(UnaryOperator<Element> fn) {
            var changed = false;
            var mapped = new ArrayList<Element>(tail.size());
            for (var e : tail) {
                var m = fn.apply(e);
                if (m != e) changed = true;
                mapped.add(m);
            }
            return changed ? withTail(mapped) : this;
        }

        @Override
        public int depth() {
            if (depthCache == -1) depthCache = 1 + tail.stream().mapToInt(Element::depth).max().orElse(0);
            return depthCache;
        }

        @Override
        public int leafCount() {
            if (leafCountCache == -1) leafCountCache = head.leafCount() + tail.stream().mapToInt(Element::leafCount).sum();
            return leafCountCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Expression that && this.hashCode() == that.hashCode()
                    && head.equals(that.head) && tail.equals(that.tail));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 31 * head.hashCode() + tail.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            if (fullFormCache == null)
                fullFormCache = head + tail.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
            return fullFormCache;
        }

        @Override
        public JsonNode toJson() {
            var jsonTail = Json.array();
            tail.forEach(e -> jsonTail.add(e.toJson()));
            var n = Json.node().put("type", "expression");
            n.set("head", head.toJson());
            n.set("tail", jsonTail);
            if (!attributes.isEmpty()) {
                var attrs = n.putArray("attributes");
                attributes.stream().map(Symbol::name).sorted().forEach(attrs::add);
            }
            n.put("fullForm", toString());
            return n;
        }
    }
}
