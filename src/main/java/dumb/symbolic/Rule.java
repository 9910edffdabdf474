package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A rewrite {@code lhs -> rhs} (IMMEDIATE) or {@code lhs :> rhs} (DELAYED), optionally guarded
 * by a condition. Higher priority rules are tried first.
 */
public record Rule(Element lhs, Replacement rhs, Kind kind, @Nullable Element condition, int priority) {

    private static final Logger logger = LoggerFactory.getLogger(Rule.class);

    /** Descending priority. {@code List.sort} is stable, so list order breaks ties. */
    public static final Comparator<Rule> BY_PRIORITY = Comparator.comparingInt(Rule::priority).reversed();

    public Rule {
        requireNonNull(lhs, "rule lhs");
        requireNonNull(rhs, "rule rhs");
        requireNonNull(kind, "rule kind");
    }

    public static Rule immediate(Element lhs, Element rhs) {
        return new Rule(lhs, new Template(rhs), Kind.IMMEDIATE, null, 0);
    }

    public static Rule delayed(Element lhs, Element rhs) {
        return new Rule(lhs, new Template(rhs), Kind.DELAYED, null, 0);
    }

    /** A delayed rule whose replacement is computed natively from the bindings. */
    public static Rule computed(Element lhs, Replacement rhs) {
        return new Rule(lhs, rhs, Kind.DELAYED, null, 0);
    }

    public Rule withCondition(@Nullable Element condition) {
        return new Rule(lhs, rhs, kind, condition, priority);
    }

    public Rule withPriority(int priority) {
        return new Rule(lhs, rhs, kind, condition, priority);
    }

    public boolean isImmediate() {
        return kind == Kind.IMMEDIATE;
    }

    public boolean isDelayed() {
        return kind == Kind.DELAYED;
    }

    /** Whether {@code other} would redefine this rule: same lhs, same condition. */
    public boolean sameDefinition(Rule other) {
        return lhs.equals(other.lhs) && Objects.equals(condition, other.condition);
    }

    /**
     * Rewrites {@code expr} with this rule if it matches. The first match solution whose
     * condition holds is used; an IMMEDIATE result is evaluated before it is returned.
     */
    public Optional<Element> apply(Element expr, Matcher.Oracle oracle) {
        var matcher = new Matcher(oracle);
        var solution = matcher.solutions(lhs, expr)
                .filter(b -> condition == null || oracle.evaluate(Substitution.substitute(condition, b)).isTrue())
                .findFirst();
        if (solution.isEmpty()) return Optional.empty();

        var result = rhs.replace(solution.get(), oracle);
        if (logger.isDebugEnabled()) logger.debug("{} rewrote {} to {}", this, expr, result);
        return Optional.of(isImmediate() ? oracle.evaluate(result) : result);
    }

    /** First successful rewrite in descending priority order, else empty. */
    public static Optional<Element> tryRules(List<Rule> rules, Element expr, Matcher.Oracle oracle) {
        var ordered = new ArrayList<>(rules);
        ordered.sort(BY_PRIORITY);
        for (var r : ordered) {
            var result = r.apply(expr, oracle);
            if (result.isPresent()) return result;
        }
        return Optional.empty();
    }

    /**
     * Rewrites the first (outermost) sub-expressions that some rule matches, trying {@code expr}
     * itself first, then its head and arguments. Replaced parts are not revisited.
     */
    public static Element replaceAll(Element expr, List<Rule> rules, Matcher.Oracle oracle) {
        var replaced = tryRules(rules, expr, oracle);
        if (replaced.isPresent()) return replaced.get();
        if (!(expr instanceof Expression x)) return expr;

        var head = replaceAll(x.head(), rules, oracle);
        var changed = head != x.head();
        var tail = new ArrayList<Element>(x.size());
        for (var a : x.tail()) {
            var r = replaceAll(a, rules, oracle);
            if (r != a) changed = true;
            tail.add(r);
        }
        return changed ? new Expression(head, tail, x.attributes()) : x;
    }

    public static Element replaceAll(Element expr, List<Rule> rules) {
        return replaceAll(expr, rules, Matcher.Oracle.NONE);
    }

    /** Applies {@link #replaceAll} until the result stops changing or {@code maxIterations} passes ran. */
    public static Element replaceRepeated(Element expr, List<Rule> rules, Matcher.Oracle oracle, int maxIterations) {
        var current = expr;
        for (var i = 0; i < maxIterations; i++) {
            var next = replaceAll(current, rules, oracle);
            if (next.equals(current)) return current;
            current = next;
        }
        logger.warn("replaceRepeated stopped after {} iterations on {}", maxIterations, expr);
        return current;
    }

    public static Element replaceRepeated(Element expr, List<Rule> rules, int maxIterations) {
        return replaceRepeated(expr, rules, Matcher.Oracle.NONE, maxIterations);
    }

    public JsonNode toJson() {
        var n = Json.node()
                .put("lhs", lhs.toString())
                .put("rhs", rhs.toString())
                .put("kind", kind.name())
                .put("priority", priority);
        if (condition != null) n.put("condition", condition.toString());
        return n;
    }

    @Override
    public String toString() {
        return lhs + (isImmediate() ? " -> " : " :> ") + rhs + (condition == null ? "" : " /; " + condition);
    }

    public enum Kind {
        IMMEDIATE,
        DELAYED
    }

    /** Produces the right-hand side for one set of match bindings. */
    @FunctionalInterface
    public interface Replacement {
        Element replace(Bindings bindings, Matcher.Oracle oracle);
    }

    /** A right-hand side written as an expression, with the bindings substituted in. */
    public record Template(Element rhs) implements Replacement {
        public Template {
            requireNonNull(rhs, "rule rhs");
        }

        @Override
        public Element replace(Bindings bindings, Matcher.Oracle oracle) {
            return Substitution.substitute(rhs, bindings);
        }

        @Override
        public String toString() {
            return rhs.toString();
        }
    }
}
