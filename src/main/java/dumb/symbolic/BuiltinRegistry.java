package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

import static java.util.Optional.ofNullable;

/**
 * Mutable symbol-to-builtin table. Registries may chain: a miss falls through to the parent, so a
 * kernel can layer its own builtins over a shared set.
 */
public class BuiltinRegistry implements Builtins {

    private static final Logger logger = LoggerFactory.getLogger(BuiltinRegistry.class);

    private final ConcurrentMap<Symbol, Builtin> builtins = new ConcurrentHashMap<>();
    @Nullable
    private final Builtins parent;

    public BuiltinRegistry() {
        this(null);
    }

    public BuiltinRegistry(@Nullable Builtins parent) {
        this.parent = parent;
    }

    public void register(Builtin builtin) {
        var previous = builtins.put(builtin.symbol(), builtin);
        if (previous != null) logger.debug("Replaced builtin {}", builtin.symbol());
        else logger.debug("Registered builtin {}", builtin.symbol());
    }

    public void register(Symbol symbol, Set<Symbol> attributes,
                         BiFunction<Expression, Evaluator.Evaluation, Optional<Element>> function) {
        register(new BasicBuiltin(symbol, attributes, function));
    }

    /** A builtin that has attributes but no native behavior, e.g. {@code Hold}. */
    public void registerAttributes(Symbol symbol, Set<Symbol> attributes) {
        register(symbol, attributes, (x, ev) -> Optional.empty());
    }

    public Optional<Builtin> unregister(Symbol symbol) {
        return ofNullable(builtins.remove(symbol));
    }

    @Override
    public Optional<Builtin> lookupBuiltin(Symbol symbol) {
        var b = builtins.get(symbol);
        if (b != null) return Optional.of(b);
        return parent == null ? Optional.empty() : parent.lookupBuiltin(symbol);
    }

    public boolean contains(Symbol symbol) {
        return builtins.containsKey(symbol);
    }

    /** Symbols registered here, parent excluded. */
    public Set<Symbol> symbols() {
        return Set.copyOf(builtins.keySet());
    }

    public int size() {
        return builtins.size();
    }

    public void clear() {
        builtins.clear();
    }

    public JsonNode toJson() {
        var a = Json.array();
        builtins.values().stream()
                .sorted(Comparator.comparing(b -> b.symbol().name()))
                .forEach(b -> a.add(b.toJson()));
        return a;
    }
}
