package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.ValueStore.Category;
import dumb.symbolic.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Symbol attributes and values for one scope. A symbol with no entry here is looked up in the
 * parent chain; definitions always go to this context. Mutations are serialized by a write lock
 * and readers always see whole rule lists.
 */
public class EvaluationContext {

    public static final Symbol DEFAULT = Symbol.of("Default");

    private static final Logger logger = LoggerFactory.getLogger(EvaluationContext.class);

    private final String name;
    @Nullable
    private final EvaluationContext parent;
    private final Map<Symbol, Set<Symbol>> attributes = new ConcurrentHashMap<>();
    private final ValueStore values = new ValueStore();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public EvaluationContext(String name) {
        this(name, null);
    }

    public EvaluationContext(String name, @Nullable EvaluationContext parent) {
        this.name = requireNonNull(name, "context name");
        this.parent = parent;
    }

    /** A nested scope whose lookups fall back to this context. */
    public EvaluationContext child(String name) {
        return new EvaluationContext(name, this);
    }

    public String name() {
        return name;
    }

    public Optional<EvaluationContext> parent() {
        return Optional.ofNullable(parent);
    }

    /** Attributes recorded for {@code symbol} here or in the nearest ancestor that has an entry. */
    public Optional<Set<Symbol>> lookupAttributes(Symbol symbol) {
        var a = read(() -> attributes.get(symbol));
        if (a != null) return Optional.of(a);
        return parent == null ? Optional.empty() : parent.lookupAttributes(symbol);
    }

    public Set<Symbol> attributes(Symbol symbol) {
        return lookupAttributes(symbol).orElse(Set.of());
    }

    public boolean hasAttribute(Symbol symbol, Symbol attribute) {
        return attributes(symbol).contains(attribute);
    }

    /** Rules of {@code category} for {@code symbol}, from the nearest context that defines any. */
    public List<Rule> rules(Symbol symbol, Category category) {
        var local = read(() -> values.rules(symbol, category));
        if (!local.isEmpty() || parent == null) return local;
        return parent.rules(symbol, category);
    }

    public List<Rule> ownValues(Symbol symbol) {
        return rules(symbol, Category.OWN);
    }

    public List<Rule> downValues(Symbol symbol) {
        return rules(symbol, Category.DOWN);
    }

    public List<Rule> upValues(Symbol symbol) {
        return rules(symbol, Category.UP);
    }

    public List<Rule> subValues(Symbol symbol) {
        return rules(symbol, Category.SUB);
    }

    public List<Rule> nValues(Symbol symbol) {
        return rules(symbol, Category.N);
    }

    public List<Rule> defaultValues(Symbol symbol) {
        return rules(symbol, Category.DEFAULT);
    }

    public List<Rule> formatValues(Symbol symbol) {
        return rules(symbol, Category.FORMAT);
    }

    public void define(Category category, Symbol symbol, Rule rule) {
        write(() -> {
            guardProtected(symbol);
            values.add(symbol, category, rule);
            logger.debug("{}: {}[{}] += {}", name, category.label(), symbol, rule);
        });
    }

    public void defineOwnValue(Symbol symbol, Element value) {
        define(Category.OWN, symbol, Rule.immediate(symbol, value));
    }

    public void defineOwnValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition, int priority) {
        define(Category.OWN, symbol, rule(pattern, replacement, condition, priority));
    }

    public void defineDownValue(Symbol symbol, Element pattern, Element replacement) {
        defineDownValue(symbol, pattern, replacement, null, 0);
    }

    public void defineDownValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition) {
        defineDownValue(symbol, pattern, replacement, condition, 0);
    }

    public void defineDownValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition, int priority) {
        define(Category.DOWN, symbol, rule(pattern, replacement, condition, priority));
    }

    public void defineUpValue(Symbol symbol, Element pattern, Element replacement) {
        defineUpValue(symbol, pattern, replacement, null, 0);
    }

    public void defineUpValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition, int priority) {
        define(Category.UP, symbol, rule(pattern, replacement, condition, priority));
    }

    public void defineSubValue(Symbol symbol, Element pattern, Element replacement) {
        defineSubValue(symbol, pattern, replacement, null, 0);
    }

    public void defineSubValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition, int priority) {
        define(Category.SUB, symbol, rule(pattern, replacement, condition, priority));
    }

    public void defineNValue(Symbol symbol, Element pattern, Element replacement) {
        defineNValue(symbol, pattern, replacement, null, 0);
    }

    public void defineNValue(Symbol symbol, Element pattern, Element replacement, @Nullable Element condition, int priority) {
        define(Category.N, symbol, rule(pattern, replacement, condition, priority));
    }

    public void defineDefaultValue(Symbol symbol, Element pattern, Element replacement) {
        define(Category.DEFAULT, symbol, rule(pattern, replacement, null, 0));
    }

    /**
     * Default for every omitted {@code Optional} argument of {@code symbol}; with {@code position}
     * for that 1-based argument only. Stored as {@code Default[symbol]} and
     * {@code Default[symbol, position]}.
     */
    public void defineDefaultValue(Symbol symbol, Element value) {
        defineDefaultValue(symbol, Expression.of(DEFAULT, symbol), value);
    }

    public void defineDefaultValue(Symbol symbol, int position, Element value) {
        defineDefaultValue(symbol, Expression.of(DEFAULT, symbol, Element.Atom.of(position)), value);
    }

    public void defineFormatValue(Symbol symbol, Element pattern, Element replacement) {
        define(Category.FORMAT, symbol, rule(pattern, replacement, null, 0));
    }

    private static Rule rule(Element pattern, Element replacement, @Nullable Element condition, int priority) {
        return Rule.delayed(pattern, replacement).withCondition(condition).withPriority(priority);
    }

    public void clearValues(Symbol symbol) {
        write(() -> {
            guardProtected(symbol);
            values.clear(symbol);
        });
    }

    public void clearValues(Symbol symbol, Category category) {
        write(() -> {
            guardProtected(symbol);
            values.clear(symbol, category);
        });
    }

    /** Removes values and attributes of {@code symbol} in this context. */
    public void clearAll(Symbol symbol) {
        write(() -> {
            guardProtected(symbol);
            guardLocked(symbol);
            values.clear(symbol);
            attributes.remove(symbol);
        });
    }

    public void setAttributes(Symbol symbol, Set<Symbol> attrs) {
        var checked = validated(attrs);
        write(() -> {
            guardLocked(symbol);
            attributes.put(symbol, checked);
        });
    }

    public void addAttributes(Symbol symbol, Symbol... attrs) {
        var added = validated(List.of(attrs));
        write(() -> {
            guardLocked(symbol);
            var s = new HashSet<>(attributes(symbol));
            s.addAll(added);
            attributes.put(symbol, Set.copyOf(s));
        });
    }

    public void removeAttributes(Symbol symbol, Symbol... attrs) {
        write(() -> {
            guardLocked(symbol);
            var s = new HashSet<>(attributes(symbol));
            List.of(attrs).forEach(s::remove);
            attributes.put(symbol, Set.copyOf(s));
        });
    }

    /** Forgets the attributes recorded here, so lookups fall back to the parent chain again. */
    public void clearAttributes(Symbol symbol) {
        write(() -> {
            guardLocked(symbol);
            attributes.remove(symbol);
        });
    }

    /** Symbols with attributes or values in this context (not its ancestors). */
    public Set<Symbol> definedSymbols() {
        return read(() -> {
            var s = new TreeSet<Symbol>(Comparator.comparing(Symbol::name));
            s.addAll(attributes.keySet());
            s.addAll(values.symbols());
            return Collections.unmodifiableSet(s);
        });
    }

    public JsonNode toJson() {
        var n = Json.node().put("name", name);
        if (parent != null) n.put("parent", parent.name);
        var symbols = n.putObject("symbols");
        for (var s : definedSymbols()) {
            var sn = symbols.putObject(s.name());
            var attrs = read(() -> attributes.get(s));
            if (attrs != null) {
                var a = sn.putArray("attributes");
                attrs.stream().map(Symbol::name).sorted().forEach(a::add);
            }
            sn.setAll(read(() -> values.toJson(s)));
        }
        return n;
    }

    @Override
    public String toString() {
        return "EvaluationContext[" + name + (parent == null ? "" : " <- " + parent.name) + ']';
    }

    private void guardProtected(Symbol symbol) {
        if (Attributes.isProtected(attributes(symbol)))
            throw new ProtectedException(symbol, "Symbol " + symbol + " is Protected");
    }

    private void guardLocked(Symbol symbol) {
        if (Attributes.isLocked(attributes(symbol)))
            throw new ProtectedException(symbol, "Attributes of " + symbol + " are Locked");
    }

    private static Set<Symbol> validated(Collection<Symbol> attrs) {
        for (var a : attrs)
            if (!Attributes.isAttribute(requireNonNull(a, "attribute")))
                throw new IllegalArgumentException("Not an attribute: " + a);
        return Set.copyOf(attrs);
    }

    private <X> X read(Supplier<X> s) {
        lock.readLock().lock();
        try {
            return s.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable r) {
        lock.writeLock().lock();
        try {
            r.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
