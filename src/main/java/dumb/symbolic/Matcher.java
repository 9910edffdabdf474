package dumb.symbolic;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Backtracking pattern matcher. Every match attempt produces a lazy stream of complete solutions
 * in a fixed order; {@link #match} takes the first, and a failed continuation simply pulls the next
 * candidate, which is how sequence lengths, Orderless assignments and Flat groupings are retried.
 * <p>
 * Anything that needs evaluation (Condition and PatternTest tests, head attributes, Optional
 * defaults) goes through the {@link Oracle}, so the matcher itself never touches a context.
 */
public final class Matcher {

    private static final Matcher STANDALONE = new Matcher(Oracle.NONE);

    private final Oracle oracle;

    public Matcher(Oracle oracle) {
        this.oracle = requireNonNull(oracle);
    }

    /** A matcher that resolves no attributes and evaluates nothing. */
    public static Matcher standalone() {
        return STANDALONE;
    }

    public Oracle oracle() {
        return oracle;
    }

    public MatchResult match(Element pattern, Element expr) {
        return match(pattern, expr, Bindings.empty());
    }

    public MatchResult match(Element pattern, Element expr, Bindings bindings) {
        return first(solutions(pattern, expr, bindings));
    }

    public boolean matches(Element pattern, Element expr) {
        return match(pattern, expr).success();
    }

    public Stream<Bindings> solutions(Element pattern, Element expr) {
        return solutions(pattern, expr, Bindings.empty());
    }

    /** Every way {@code pattern} matches {@code expr}, extending {@code bindings}, in search order. */
    public Stream<Bindings> solutions(Element pattern, Element expr, Bindings bindings) {
        return solve(requireNonNull(pattern), requireNonNull(expr), requireNonNull(bindings));
    }

    public MatchResult matchSequence(List<? extends Element> patterns, List<? extends Element> exprs) {
        return matchSequence(patterns, exprs, Bindings.empty());
    }

    public MatchResult matchSequence(List<? extends Element> patterns, List<? extends Element> exprs, Bindings bindings) {
        return first(sequenceSolutions(patterns, exprs, bindings, null, false, false));
    }

    public MatchResult matchSequence(List<? extends Element> patterns, List<? extends Element> exprs, Bindings bindings,
                                     @Nullable Element head, boolean flat, boolean orderless) {
        return first(sequenceSolutions(patterns, exprs, bindings, head, flat, orderless));
    }

    /**
     * Solutions for matching an argument list. {@code head} is the enclosing head: Flat groupings are
     * rebuilt under it and Optional defaults are looked up for it.
     */
    public Stream<Bindings> sequenceSolutions(List<? extends Element> patterns, List<? extends Element> exprs,
                                              Bindings bindings, @Nullable Element head, boolean flat, boolean orderless) {
        var scope = new Scope(List.copyOf(patterns), List.copyOf(exprs), head, flat && head != null, orderless);
        return orderless
                ? scope.unordered(0, IntStream.range(0, exprs.size()).boxed().toList(), bindings)
                : scope.ordered(0, 0, bindings);
    }

    /** Every sub-expression of {@code expr} that matches, pre-order, heads excluded. */
    public List<Found> findMatches(Element pattern, Element expr) {
        var found = new ArrayList<Found>();
        findMatches(pattern, expr, found);
        return found;
    }

    private void findMatches(Element pattern, Element expr, List<Found> found) {
        var r = match(pattern, expr);
        if (r.success()) found.add(new Found(expr, r.bindings()));
        if (expr instanceof Expression x)
            for (var sub : x.tail()) findMatches(pattern, sub, found);
    }

    public int count(Element pattern, Element expr) {
        return findMatches(pattern, expr).size();
    }

    private static MatchResult first(Stream<Bindings> solutions) {
        return solutions.findFirst().map(MatchResult::of).orElse(MatchResult.NO_MATCH);
    }

    private Stream<Bindings> solve(Element p, Element e, Bindings b) {
        if (!(p instanceof Expression px)) return p.equals(e) ? Stream.of(b) : Stream.empty();

        if (Patterns.isHoldPattern(px)) return solve(px.get(0), e, b);
        if (Patterns.isVerbatim(px)) return px.get(0).equals(e) ? Stream.of(b) : Stream.empty();
        if (Blanks.isAnyBlank(px)) return Blanks.matchesHead(px, e) ? Stream.of(b) : Stream.empty();
        if (Patterns.isPattern(px)) {
            var name = Patterns.patternName(px);
            var inner = Patterns.patternInner(px);
            Element value = isSingle(inner) ? e : sequence(List.of(e));
            return solve(inner, e, b).flatMap(bb -> bind(bb, name, value));
        }
        if (Patterns.isCondition(px)) return solve(px.get(0), e, b).filter(bb -> test(px.get(1), bb));
        if (Patterns.isAlternatives(px)) return px.tail().stream().flatMap(alt -> solve(alt, e, b));
        if (Patterns.isPatternTest(px)) return solve(px.get(0), e, b).filter(bb -> passes(px.get(1), e));
        if (Patterns.isExcept(px)) {
            if (solve(px.get(0), e, b).findFirst().isPresent()) return Stream.empty();
            return px.size() == 2 ? solve(px.get(1), e, b) : Stream.of(b);
        }
        if (Patterns.isOptional(px) || Patterns.isAnyRepeated(px)) return solve(px.get(0), e, b);

        if (!(e instanceof Expression ex)) return Stream.empty();
        var attrs = Attributes.effective(ex.symbolHead().map(oracle::attributes).orElse(Set.of()), ex);
        return solve(px.head(), ex.head(), b).flatMap(bb -> sequenceSolutions(px.tail(), ex.tail(), bb, ex.head(),
                Attributes.isFlat(attrs), Attributes.isOrderless(attrs)));
    }

    /** Matches {@code p} against a run of consecutive arguments. */
    private Stream<Bindings> solveRun(Element p, List<Element> run, Bindings b) {
        if (p instanceof Expression px) {
            if (Patterns.isHoldPattern(px)) return solveRun(px.get(0), run, b);
            if (Blanks.isSequenceBlank(px))
                return run.stream().allMatch(e -> Blanks.matchesHead(px, e)) ? Stream.of(b) : Stream.empty();
            if (Patterns.isPattern(px)) {
                var name = Patterns.patternName(px);
                var inner = Patterns.patternInner(px);
                Element value = isSingle(inner) && run.size() == 1 ? run.get(0) : sequence(run);
                return solveRun(inner, run, b).flatMap(bb -> bind(bb, name, value));
            }
            if (Patterns.isCondition(px)) return solveRun(px.get(0), run, b).filter(bb -> test(px.get(1), bb));
            if (Patterns.isPatternTest(px))
                return solveRun(px.get(0), run, b).filter(bb -> run.stream().allMatch(e -> passes(px.get(1), e)));
            if (Patterns.isAnyRepeated(px)) {
                var s = Stream.of(b);
                for (var e : run) s = s.flatMap(bb -> solve(px.get(0), e, bb));
                return s;
            }
        }
        return run.size() == 1 ? solve(p, run.get(0), b) : Stream.empty();
    }

    private Stream<Bindings> bind(Bindings b, Symbol name, Element value) {
        var existing = b.get(name);
        if (existing.isPresent()) return existing.get().equals(value) ? Stream.of(b) : Stream.empty();
        return Stream.of(b.bind(name, value));
    }

    private boolean test(Element test, Bindings b) {
        return oracle.evaluate(Substitution.substitute(test, b)).isTrue();
    }

    private boolean passes(Element f, Element e) {
        return oracle.evaluate(Expression.of(f, e)).isTrue();
    }

    private static Expression sequence(List<Element> run) {
        return Expression.of(Symbol.SEQUENCE, run);
    }

    /** Minimum and maximum number of arguments a pattern can consume in an argument list. */
    static int[] span(Element p) {
        if (!(p instanceof Expression px)) return new int[]{1, 1};
        if (Patterns.isHoldPattern(px)) return span(px.get(0));
        if (Blanks.isSequenceBlank(px)) return new int[]{Blanks.minLength(px), Blanks.maxLength(px)};
        if (Patterns.isPattern(px)) return span(Patterns.patternInner(px));
        if (Patterns.isCondition(px) || Patterns.isPatternTest(px)) return span(px.get(0));
        if (Patterns.isAnyRepeated(px)) return Patterns.repeatBounds(px).orElseThrow();
        if (Patterns.isOptional(px)) return new int[]{0, 1};
        return new int[]{1, 1};
    }

    private static boolean isSingle(Element p) {
        var s = span(p);
        return s[0] == 1 && s[1] == 1;
    }

    /** One argument-list match: the patterns, the arguments and how the enclosing head treats them. */
    private final class Scope {
        final List<Element> patterns;
        final List<Element> exprs;
        @Nullable
        final Element head;
        final boolean flat;
        final boolean orderless;
        final int[] minRemaining;

        Scope(List<Element> patterns, List<Element> exprs, @Nullable Element head, boolean flat, boolean orderless) {
            this.patterns = patterns;
            this.exprs = exprs;
            this.head = head;
            this.flat = flat;
            this.orderless = orderless;
            minRemaining = new int[patterns.size() + 1];
            for (var i = patterns.size() - 1; i >= 0; i--)
                minRemaining[i] = minRemaining[i + 1] + span(patterns.get(i))[0];
        }

        Stream<Bindings> ordered(int pi, int ei, Bindings b) {
            if (pi == patterns.size()) return ei == exprs.size() ? Stream.of(b) : Stream.empty();
            var p = patterns.get(pi);
            var available = exprs.size() - ei - minRemaining[pi + 1];
            if (available < 0) return Stream.empty();
            var last = pi == patterns.size() - 1;

            if (Patterns.isOptional(p)) {
                var inner = ((Expression) p).get(0);
                Supplier<Stream<Bindings>> consumed = () -> available >= 1
                        ? solve(inner, exprs.get(ei), b).flatMap(bb -> ordered(pi + 1, ei + 1, bb))
                        : Stream.empty();
                return lazyConcat(consumed, () -> defaulted((Expression) p, pi)
                        .map(d -> solve(inner, d, b).flatMap(bb -> ordered(pi + 1, ei, bb)))
                        .orElseGet(Stream::empty));
            }

            var s = span(p);
            if (s[0] == 1 && s[1] == 1) {
                if (available < 1) return Stream.empty();
                Supplier<Stream<Bindings>> single = () -> solve(p, exprs.get(ei), b).flatMap(bb -> ordered(pi + 1, ei + 1, bb));
                if (!flat) return single.get();
                return lazyConcat(single, () -> IntStream.rangeClosed(2, available).boxed()
                        .flatMap(n -> solve(p, grouped(exprs.subList(ei, ei + n)), b).flatMap(bb -> ordered(pi + 1, ei + n, bb))));
            }

            var lo = last ? Math.max(available, s[0]) : s[0];
            var hi = Math.min(s[1], available);
            return IntStream.rangeClosed(lo, hi).boxed()
                    .flatMap(n -> solveRun(p, exprs.subList(ei, ei + n), b).flatMap(bb -> ordered(pi + 1, ei + n, bb)));
        }

        Stream<Bindings> unordered(int pi, List<Integer> pool, Bindings b) {
            if (pi == patterns.size()) return pool.isEmpty() ? Stream.of(b) : Stream.empty();
            var p = patterns.get(pi);
            var available = pool.size() - minRemaining[pi + 1];
            if (available < 0) return Stream.empty();
            var last = pi == patterns.size() - 1;

            if (Patterns.isOptional(p)) {
                var inner = ((Expression) p).get(0);
                Supplier<Stream<Bindings>> consumed = () -> available >= 1
                        ? pool.stream().flatMap(i -> solve(inner, exprs.get(i), b).flatMap(bb -> unordered(pi + 1, without(pool, List.of(i)), bb)))
                        : Stream.empty();
                return lazyConcat(consumed, () -> defaulted((Expression) p, pi)
                        .map(d -> solve(inner, d, b).flatMap(bb -> unordered(pi + 1, pool, bb)))
                        .orElseGet(Stream::empty));
            }

            var s = span(p);
            if (s[0] == 1 && s[1] == 1) {
                if (available < 1) return Stream.empty();
                Supplier<Stream<Bindings>> single = () -> pool.stream()
                        .flatMap(i -> solve(p, exprs.get(i), b).flatMap(bb -> unordered(pi + 1, without(pool, List.of(i)), bb)));
                if (!flat) return single.get();
                return lazyConcat(single, () -> IntStream.rangeClosed(2, available).boxed()
                        .flatMap(n -> combinations(pool, 0, n))
                        .flatMap(c -> solve(p, grouped(pick(c)), b).flatMap(bb -> unordered(pi + 1, without(pool, c), bb))));
            }

            var lo = last ? Math.max(available, s[0]) : s[0];
            var hi = Math.min(s[1], available);
            return IntStream.rangeClosed(lo, hi).boxed()
                    .flatMap(n -> combinations(pool, 0, n))
                    .flatMap(c -> solveRun(p, pick(c), b).flatMap(bb -> unordered(pi + 1, without(pool, c), bb)));
        }

        private Optional<Element> defaulted(Expression optional, int position) {
            return Patterns.defaultValue(optional)
                    .or(() -> head == null ? Optional.empty() : oracle.defaultValue(head, position + 1, patterns.size()));
        }

        private Element grouped(List<Element> run) {
            return Expression.of(requireNonNull(head), run);
        }

        private List<Element> pick(List<Integer> indices) {
            return indices.stream().map(exprs::get).toList();
        }
    }

    private static Stream<Bindings> lazyConcat(Supplier<Stream<Bindings>> a, Supplier<Stream<Bindings>> b) {
        return Stream.of(a, b).flatMap(Supplier::get);
    }

    /** Size-{@code k} subsets of {@code pool} from index {@code from}, in lexicographic index order. */
    private static Stream<List<Integer>> combinations(List<Integer> pool, int from, int k) {
        if (k == 0) return Stream.of(List.of());
        return IntStream.rangeClosed(from, pool.size() - k).boxed()
                .flatMap(i -> combinations(pool, i + 1, k - 1).map(rest -> {
                    var c = new ArrayList<Integer>(k);
                    c.add(pool.get(i));
                    c.addAll(rest);
                    return c;
                }));
    }

    private static List<Integer> without(List<Integer> pool, List<Integer> taken) {
        return pool.stream().filter(i -> !taken.contains(i)).toList();
    }

    /**
     * Outcome of a single match. {@link #NO_MATCH} is an ordinary value: a mismatch is the common
     * case during search and never an exception.
     */
    public record MatchResult(boolean success, Bindings bindings) {
        public static final MatchResult NO_MATCH = new MatchResult(false, Bindings.empty());

        public MatchResult {
            requireNonNull(bindings);
        }

        public static MatchResult of(Bindings bindings) {
            return new MatchResult(true, bindings);
        }

        public JsonNode toJson() {
            var n = Json.node().put("success", success);
            n.set("bindings", bindings.toJson());
            return n;
        }
    }

    /** A matching sub-expression and the bindings it matched with. */
    public record Found(Element element, Bindings bindings) {
    }

    /** The matcher's window onto evaluation. */
    public interface Oracle {

        /** Resolves nothing; a test passes only when it already is {@code True}. */
        Oracle NONE = new Oracle() {
            @Override
            public Set<Symbol> attributes(Symbol symbol) {
                return Set.of();
            }

            @Override
            public Element evaluate(Element element) {
                return element;
            }

            @Override
            public Optional<Element> defaultValue(Element head, int position, int length) {
                return Optional.empty();
            }
        };

        /** Attributes of a head symbol. */
        Set<Symbol> attributes(Symbol symbol);

        Element evaluate(Element element);

        /**
         * Default for an omitted {@code Optional} at 1-based {@code position} of {@code length}
         * argument patterns under {@code head}.
         */
        Optional<Element> defaultValue(Element head, int position, int length);
    }
}
