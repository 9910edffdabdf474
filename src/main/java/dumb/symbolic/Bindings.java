package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.util.Json;

import java.util.*;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable map from pattern variables to the elements they matched. Binding a name that is
 * already bound to an equal value returns the same instance; binding it to a different value is a
 * {@link Conflict}, never an overwrite.
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<Symbol, Element> map;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated = false;

    private Bindings(Map<Symbol, Element> map) {
        this.map = map;
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(Symbol name, Element value) {
        return EMPTY.bind(name, value);
    }

    public static Bindings of(Map<Symbol, ? extends Element> entries) {
        var b = EMPTY;
        for (var e : entries.entrySet()) b = b.bind(e.getKey(), e.getValue());
        return b;
    }

    public Bindings bind(Symbol name, Element value) {
        requireNonNull(name, "binding name");
        requireNonNull(value, "binding value");
        var existing = map.get(name);
        if (existing != null) {
            if (existing.equals(value)) return this;
            throw new Conflict(name, existing, value);
        }
        var m = new LinkedHashMap<>(map);
        m.put(name, value);
        return new Bindings(Collections.unmodifiableMap(m));
    }

    public Bindings bindAll(Map<Symbol, ? extends Element> entries) {
        var b = this;
        for (var e : entries.entrySet()) b = b.bind(e.getKey(), e.getValue());
        return b;
    }

    public Bindings unbind(Symbol name) {
        if (!map.containsKey(name)) return this;
        var m = new LinkedHashMap<>(map);
        m.remove(name);
        return m.isEmpty() ? EMPTY : new Bindings(Collections.unmodifiableMap(m));
    }

    /** Union of both; throws {@link Conflict} when they disagree on a name. */
    public Bindings merge(Bindings other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        return bindAll(other.map);
    }

    public boolean isCompatible(Bindings other) {
        return other.map.entrySet().stream().allMatch(e -> {
            var mine = map.get(e.getKey());
            return mine == null || mine.equals(e.getValue());
        });
    }

    public Optional<Element> get(Symbol name) {
        return Optional.ofNullable(map.get(name));
    }

    public boolean contains(Symbol name) {
        return map.containsKey(name);
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Map<Symbol, Element> asMap() {
        return map;
    }

    public JsonNode toJson() {
        var n = Json.node();
        map.forEach((k, v) -> n.set(k.name(), v.toJson()));
        return n;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Bindings that && map.equals(that.map));
    }

    @Override
    public int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = map.hashCode();
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    @Override
    public String toString() {
        return map.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(Symbol::name)))
                .map(e -> e.getKey() + " -> " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /** A name was bound twice, to unequal values, within one match attempt. */
    public static final class Conflict extends RuntimeException {
        private final Symbol name;
        private final Element existing;
        private final Element attempted;

        public Conflict(Symbol name, Element existing, Element attempted) {
            super("Cannot bind " + name + " to " + attempted + ": already bound to " + existing);
            this.name = name;
            this.existing = existing;
            this.attempted = attempted;
        }

        public Symbol name() {
            return name;
        }

        public Element existing() {
            return existing;
        }

        public Element attempted() {
            return attempted;
        }
    }
}
