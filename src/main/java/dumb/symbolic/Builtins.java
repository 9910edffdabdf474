package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.util.Json;

import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/**
 * Native implementations consulted after every user rule has failed. A builtin also declares the
 * attributes its symbol has when the context records none.
 */
@FunctionalInterface
public interface Builtins {

    Builtins NONE = symbol -> Optional.empty();

    Optional<Builtin> lookupBuiltin(Symbol symbol);

    interface Builtin {
        Symbol symbol();

        Set<Symbol> attributes();

        /** The rewrite of {@code expr}, or {@code expr} itself when this builtin does not apply. */
        Element apply(Expression expr, Evaluator.Evaluation evaluation);

        default JsonNode toJson() {
            var n = Json.node().put("symbol", symbol().name());
            var a = n.putArray("attributes");
            attributes().stream().map(Symbol::name).sorted().forEach(a::add);
            return n;
        }
    }

    /** A builtin backed by a function that answers empty when it does not apply. */
    final class BasicBuiltin implements Builtin {
        private final Symbol symbol;
        private final Set<Symbol> attributes;
        private final BiFunction<Expression, Evaluator.Evaluation, Optional<Element>> function;

        public BasicBuiltin(Symbol symbol, Set<Symbol> attributes,
                            BiFunction<Expression, Evaluator.Evaluation, Optional<Element>> function) {
            this.symbol = requireNonNull(symbol);
            this.attributes = Set.copyOf(attributes);
            this.function = requireNonNull(function);
            for (var a : this.attributes)
                if (!Attributes.isAttribute(a)) throw new IllegalArgumentException("Not an attribute: " + a);
        }

        @Override
        public Symbol symbol() {
            return symbol;
        }

        @Override
        public Set<Symbol> attributes() {
            return attributes;
        }

        @Override
        public Element apply(Expression expr, Evaluator.Evaluation evaluation) {
            return function.apply(expr, evaluation).orElse(expr);
        }

        @Override
        public String toString() {
            return "Builtin[" + symbol + ']';
        }
    }
}
