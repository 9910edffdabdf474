package dumb.symbolic;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.util.Json;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Per-symbol rule lists, one per {@link Category}. Lists are replaced, never mutated, so any list
 * handed out is a stable snapshot. Callers serialize writers; {@link EvaluationContext} does so.
 */
public final class ValueStore {

    private final Map<Symbol, Map<Category, List<Rule>>> values = new ConcurrentHashMap<>();

    public List<Rule> rules(Symbol symbol, Category category) {
        var bySymbol = values.get(symbol);
        if (bySymbol == null) return List.of();
        var rules = bySymbol.get(category);
        return rules == null ? List.of() : rules;
    }

    public boolean has(Symbol symbol, Category category) {
        return !rules(symbol, category).isEmpty();
    }

    public boolean has(Symbol symbol) {
        return values.containsKey(symbol);
    }

    /**
     * Adds {@code rule}. A rule with the same lhs and condition as an existing one replaces it in
     * place; otherwise it goes after every rule of equal or higher priority.
     */
    public void add(Symbol symbol, Category category, Rule rule) {
        requireNonNull(rule);
        var bySymbol = values.computeIfAbsent(requireNonNull(symbol), s -> new ConcurrentHashMap<>());
        var rules = new ArrayList<>(bySymbol.getOrDefault(requireNonNull(category), List.of()));
        var existing = -1;
        for (var i = 0; i < rules.size() && existing < 0; i++)
            if (rules.get(i).sameDefinition(rule)) existing = i;

        if (existing >= 0) {
            rules.set(existing, rule);
        } else {
            var at = 0;
            while (at < rules.size() && rules.get(at).priority() >= rule.priority()) at++;
            rules.add(at, rule);
        }
        bySymbol.put(category, List.copyOf(rules));
    }

    public void set(Symbol symbol, Category category, List<Rule> rules) {
        var sorted = new ArrayList<>(rules);
        sorted.sort(Rule.BY_PRIORITY);
        if (sorted.isEmpty()) clear(symbol, category);
        else values.computeIfAbsent(symbol, s -> new ConcurrentHashMap<>()).put(category, List.copyOf(sorted));
    }

    public void clear(Symbol symbol, Category category) {
        values.computeIfPresent(symbol, (s, bySymbol) -> {
            bySymbol.remove(category);
            return bySymbol.isEmpty() ? null : bySymbol;
        });
    }

    public void clear(Symbol symbol) {
        values.remove(symbol);
    }

    public void clear() {
        values.clear();
    }

    public Set<Symbol> symbols() {
        return Set.copyOf(values.keySet());
    }

    public ObjectNode toJson(Symbol symbol) {
        var n = Json.node();
        var bySymbol = values.get(symbol);
        if (bySymbol == null || bySymbol.isEmpty()) return n;
        new EnumMap<>(bySymbol).forEach((c, rules) -> {
            var a = n.putArray(c.label());
            rules.forEach(r -> a.add(r.toJson()));
        });
        return n;
    }

    /** The value categories, in the order the evaluator consults them. */
    public enum Category {
        OWN("OwnValues"),
        DOWN("DownValues"),
        UP("UpValues"),
        SUB("SubValues"),
        N("NValues"),
        DEFAULT("DefaultValues"),
        FORMAT("FormatValues");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
