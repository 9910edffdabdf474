package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The standard evaluation procedure. Each top-level {@link #evaluate} call gets its own
 * {@link Evaluation}, which carries the recursion depth and rewrite counters for that call and is
 * what builtins, conditions and immediate rules evaluate through; evaluators therefore share no
 * mutable state except the context.
 * <p>
 * One pass over a compound expression evaluates the head, then the arguments its hold attributes
 * allow, splices sequences, applies Flat, Orderless and Listable, and finally dispatches to
 * UpValues, DownValues, SubValues, NValues and the builtin. A rewrite starts the next pass; an
 * expression that no rule or builtin rewrites is the result.
 */
public class Evaluator {

    public static final Symbol N = Symbol.of("N");

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final EvaluationContext context;
    private final Builtins builtins;
    private final Limits limits;

    public Evaluator(EvaluationContext context) {
        this(context, Builtins.NONE, Limits.DEFAULT);
    }

    public Evaluator(EvaluationContext context, Builtins builtins, Limits limits) {
        this.context = requireNonNull(context);
        this.builtins = requireNonNull(builtins);
        this.limits = requireNonNull(limits);
    }

    public EvaluationContext context() {
        return context;
    }

    public Builtins builtins() {
        return builtins;
    }

    public Limits limits() {
        return limits;
    }

    /**
     * Evaluates {@code expr} to a fixed point.
     *
     * @throws RecursionLimitException if nesting exceeds {@link Limits#recursionLimit()}
     * @throws IterationLimitException if the call performs more than
     *                                 {@link Limits#iterationLimit()} rewrites
     */
    public Element evaluate(Element expr) {
        return new Evaluation().evaluate(requireNonNull(expr));
    }

    /** {@link #evaluate}, answering {@code fallback} instead of raising an {@link EvaluationException}. */
    public Element tryEvaluate(Element expr, Element fallback) {
        try {
            return evaluate(expr);
        } catch (EvaluationException e) {
            logger.debug("Evaluation of {} failed: {}", expr, e.getMessage());
            return fallback;
        }
    }

    /** Evaluates {@code n} times in a row, each in a fresh {@link Evaluation}. */
    public Element evaluateIterated(Element expr, int n) {
        var e = expr;
        for (var i = 0; i < n; i++) e = evaluate(e);
        return e;
    }

    /**
     * Matches with this evaluator's attributes and defaults; conditions and pattern tests run in
     * a fresh {@link Evaluation}.
     */
    public Matcher.MatchResult match(Element pattern, Element expr) {
        return new Evaluation().matcher().match(pattern, expr);
    }

    /**
     * Printed form after FormatValues: the outermost sub-expressions whose symbol has a matching
     * format rule are replaced, and replaced parts are not revisited.
     */
    public String format(Element expr) {
        return formatted(expr, new Evaluation()).toString();
    }

    private Element formatted(Element e, Evaluation ev) {
        var symbol = e instanceof Symbol s ? Optional.of(s) : e instanceof Expression x ? x.rootSymbol() : Optional.<Symbol>empty();
        if (symbol.isPresent()) {
            var rules = context.formatValues(symbol.get());
            if (!rules.isEmpty()) {
                var r = Rule.tryRules(rules, e, ev);
                if (r.isPresent()) return r.get();
            }
        }
        if (!(e instanceof Expression x)) return e;
        return new Expression(formatted(x.head(), ev), x.tail().stream().map(a -> formatted(a, ev)).toList(), x.attributes());
    }

    /**
     * State of one top-level evaluation. Nested evaluations triggered by builtins, rule conditions
     * and pattern tests run through the same instance and so count against the same limits.
     */
    public final class Evaluation implements Matcher.Oracle {

        private final Matcher matcher = new Matcher(this);
        private int depth;
        private int maxDepth;
        private long rewrites;

        private Evaluation() {
        }

        public EvaluationContext context() {
            return context;
        }

        public Builtins builtins() {
            return builtins;
        }

        public Limits limits() {
            return limits;
        }

        public Matcher matcher() {
            return matcher;
        }

        /** Current nesting depth. */
        public int depth() {
            return depth;
        }

        public int maxDepth() {
            return maxDepth;
        }

        /**
         * Rewrites performed so far in this evaluation, across all nested expressions. A user rule
         * that fires counts even when its result equals its input; a builtin counts only when it
         * changed the expression.
         */
        public long iterations() {
            return rewrites;
        }

        @Override
        public Element evaluate(Element expr) {
            if (++depth > limits.recursionLimit()) {
                depth--;
                throw new RecursionLimitException(limits.recursionLimit(), expr);
            }
            maxDepth = Math.max(maxDepth, depth);
            try {
                return evaluateToFixedPoint(expr);
            } finally {
                depth--;
            }
        }

        @Override
        public Set<Symbol> attributes(Symbol symbol) {
            return Attributes.attributesOf(context, builtins, symbol);
        }

        /** Tries {@code Default[f, i, n]}, then {@code Default[f, i]}, then {@code Default[f]}. */
        @Override
        public Optional<Element> defaultValue(Element head, int position, int length) {
            var f = head instanceof Symbol s ? Optional.of(s) : head instanceof Expression x ? x.rootSymbol() : Optional.<Symbol>empty();
            if (f.isEmpty()) return Optional.empty();
            var rules = context.defaultValues(f.get());
            if (rules.isEmpty()) return Optional.empty();
            var d = EvaluationContext.DEFAULT;
            for (var query : List.of(Expression.of(d, f.get(), Atom.of(position), Atom.of(length)),
                    Expression.of(d, f.get(), Atom.of(position)),
                    Expression.of(d, f.get()))) {
                var r = Rule.tryRules(rules, query, this);
                if (r.isPresent()) return Optional.of(evaluate(r.get()));
            }
            return Optional.empty();
        }

        private Element evaluateToFixedPoint(Element expr) {
            var current = expr;
            while (true) {
                if (current instanceof Atom) return current;
                if (current instanceof Symbol s) return evaluateSymbol(s);

                var x = normalize((Expression) current);
                if (x.threaded()) return evaluate(x.expr());

                var next = dispatch(x.expr(), x.attributes());
                if (next.isEmpty()) return x.expr();

                if (++rewrites > limits.iterationLimit())
                    throw new IterationLimitException(limits.iterationLimit(), next.get());
                if (logger.isTraceEnabled()) logger.trace("[{}] {} -> {}", depth, x.expr(), next.get());
                current = next.get();
            }
        }

        private Element evaluateSymbol(Symbol s) {
            var own = context.ownValues(s);
            if (own.isEmpty()) return s;
            return Rule.tryRules(own, s, this).map(this::evaluate).orElse(s);
        }

        /** Steps before dispatch: head, arguments, sequences, Flat, Orderless, Listable. */
        private Normalized normalize(Expression x) {
            var head = x.head();
            var headAttrs = x.symbolHead().map(this::attributes).orElse(Set.of());
            if (!Attributes.holdsCompletely(Attributes.effective(headAttrs, x))) {
                var h = evaluate(head);
                if (h instanceof Atom)
                    throw new EvaluationException("Head " + head + " of " + x + " evaluated to the atom " + h);
                if (!h.equals(head)) {
                    x = x.withHead(h);
                    headAttrs = x.symbolHead().map(this::attributes).orElse(Set.of());
                }
            }
            var attrs = Attributes.effective(headAttrs, x);

            x = evaluateArguments(x, attrs);
            if (!Attributes.holdsSequences(attrs)) x = Transforms.spliceSequences(x);
            if (Attributes.isFlat(attrs)) x = Transforms.flatten(x);
            if (Attributes.isOrderless(attrs)) x = Transforms.sortOrderless(x);
            if (Attributes.isListable(attrs)) {
                var threaded = Transforms.threadListable(x);
                if (threaded.isPresent()) return new Normalized(threaded.get(), attrs, true);
            }
            return new Normalized(x, attrs, false);
        }

        private Expression evaluateArguments(Expression x, Set<Symbol> attrs) {
            if (x.isEmpty() || Attributes.holdsAll(attrs)) return x;
            var holdFirst = Attributes.holdsFirst(attrs);
            var holdRest = Attributes.holdsRest(attrs);
            var changed = false;
            var args = new ArrayList<Element>(x.size());
            for (var i = 0; i < x.size(); i++) {
                var a = x.get(i);
                var held = i == 0 ? holdFirst : holdRest;
                var e = held ? a : evaluate(a);
                if (!e.equals(a)) changed = true;
                args.add(e);
            }
            return changed ? x.withTail(args) : x;
        }

        /** The rewrite of {@code x}, or empty when no rule fired and no builtin changed it. */
        private Optional<Element> dispatch(Expression x, Set<Symbol> attrs) {
            if (!Attributes.holdsCompletely(attrs)) {
                var owners = new LinkedHashSet<Symbol>();
                for (var a : x.tail()) {
                    if (a instanceof Symbol s) owners.add(s);
                    else if (a instanceof Expression ax) ax.symbolHead().ifPresent(owners::add);
                }
                for (var s : owners) {
                    var r = tryValues(context.upValues(s), x);
                    if (r.isPresent()) return r;
                }
            }

            var head = x.symbolHead();
            if (head.isPresent()) {
                var r = tryValues(context.downValues(head.get()), x);
                if (r.isPresent()) return r;
            } else {
                var root = x.rootSymbol();
                if (root.isPresent()) {
                    var r = tryValues(context.subValues(root.get()), x);
                    if (r.isPresent()) return r;
                }
            }

            if (head.isPresent() && head.get().equals(N) && !x.isEmpty()) {
                var target = numericTarget(x.get(0));
                if (target.isPresent()) {
                    var r = tryValues(context.nValues(target.get()), x);
                    if (r.isPresent()) return r;
                }
            }

            return head.flatMap(builtins::lookupBuiltin)
                    .map(b -> applyBuiltin(b, x))
                    .filter(r -> !r.equals(x));
        }

        private Optional<Element> tryValues(List<Rule> rules, Expression x) {
            return rules.isEmpty() ? Optional.empty() : Rule.tryRules(rules, x, this);
        }

        private Optional<Symbol> numericTarget(Element e) {
            if (e instanceof Symbol s) return Optional.of(s);
            return e instanceof Expression x ? x.rootSymbol() : Optional.empty();
        }

        private Element applyBuiltin(Builtins.Builtin b, Expression x) {
            try {
                return b.apply(x, this);
            } catch (RecursionLimitException | IterationLimitException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Builtin {} failed on {}: {}", b.symbol(), x, e.getMessage(), e);
                return x;
            }
        }
    }

    private record Normalized(Expression expr, Set<Symbol> attributes, boolean threaded) {
    }

    /** Ceilings on nesting depth and on the rewrites of one top-level evaluation. */
    public record Limits(int recursionLimit, int iterationLimit) {
        public static final int DEFAULT_RECURSION_LIMIT = 256;
        public static final int DEFAULT_ITERATION_LIMIT = 1000;
        public static final Limits DEFAULT = new Limits(DEFAULT_RECURSION_LIMIT, DEFAULT_ITERATION_LIMIT);

        public Limits {
            if (recursionLimit < 1) throw new IllegalArgumentException("recursionLimit must be positive: " + recursionLimit);
            if (iterationLimit < 0) throw new IllegalArgumentException("iterationLimit must not be negative: " + iterationLimit);
        }

        public Limits withRecursionLimit(int recursionLimit) {
            return new Limits(recursionLimit, iterationLimit);
        }

        public Limits withIterationLimit(int iterationLimit) {
            return new Limits(recursionLimit, iterationLimit);
        }
    }
}
