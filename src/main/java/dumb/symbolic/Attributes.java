package dumb.symbolic;

import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The closed vocabulary of evaluation attributes, and the queries the evaluator and matcher make
 * against attribute sets. Attributes are plain data: looking one up never has a side effect.
 */
public final class Attributes {

    public static final Symbol PROTECTED = Symbol.of("Protected");
    public static final Symbol READ_PROTECTED = Symbol.of("ReadProtected");
    public static final Symbol LOCKED = Symbol.of("Locked");
    public static final Symbol CONSTANT = Symbol.of("Constant");
    public static final Symbol TEMPORARY = Symbol.of("Temporary");

    public static final Symbol HOLD_FIRST = Symbol.of("HoldFirst");
    public static final Symbol HOLD_REST = Symbol.of("HoldRest");
    public static final Symbol HOLD_ALL = Symbol.of("HoldAll");
    public static final Symbol HOLD_ALL_COMPLETE = Symbol.of("HoldAllComplete");
    public static final Symbol SEQUENCE_HOLD = Symbol.of("SequenceHold");

    public static final Symbol NHOLD_FIRST = Symbol.of("NHoldFirst");
    public static final Symbol NHOLD_REST = Symbol.of("NHoldRest");
    public static final Symbol NHOLD_ALL = Symbol.of("NHoldAll");

    public static final Symbol FLAT = Symbol.of("Flat");
    public static final Symbol ORDERLESS = Symbol.of("Orderless");
    public static final Symbol ONE_IDENTITY = Symbol.of("OneIdentity");
    public static final Symbol LISTABLE = Symbol.of("Listable");

    public static final Symbol NUMERIC_FUNCTION = Symbol.of("NumericFunction");
    public static final Symbol STUB = Symbol.of("Stub");

    public static final Set<Symbol> HOLDS = Set.of(HOLD_FIRST, HOLD_REST, HOLD_ALL, HOLD_ALL_COMPLETE, SEQUENCE_HOLD);
    public static final Set<Symbol> NHOLDS = Set.of(NHOLD_FIRST, NHOLD_REST, NHOLD_ALL);
    public static final Set<Symbol> STRUCTURAL = Set.of(FLAT, ORDERLESS, ONE_IDENTITY, LISTABLE);
    public static final Set<Symbol> PROTECTION = Set.of(PROTECTED, READ_PROTECTED, LOCKED, CONSTANT, TEMPORARY);
    public static final Set<Symbol> ALL = Stream.of(HOLDS, NHOLDS, STRUCTURAL, PROTECTION, Set.of(NUMERIC_FUNCTION, STUB))
            .flatMap(Set::stream)
            .collect(Collectors.toUnmodifiableSet());

    private Attributes() {
    }

    public static boolean isAttribute(Symbol s) {
        return ALL.contains(s);
    }

    /**
     * Attributes of {@code symbol} as the context chain records them, falling back to what a
     * registered builtin declares, else none.
     */
    public static Set<Symbol> attributesOf(EvaluationContext context, Builtins builtins, Symbol symbol) {
        return context.lookupAttributes(symbol)
                .or(() -> builtins.lookupBuiltin(symbol).map(Builtins.Builtin::attributes))
                .orElse(Set.of());
    }

    public static Set<Symbol> attributesOf(EvaluationContext context, Symbol symbol) {
        return context.lookupAttributes(symbol).orElse(Set.of());
    }

    /** Head symbol attributes united with the expression's own. */
    public static Set<Symbol> effective(Set<Symbol> headAttributes, Expression expr) {
        if (expr.attributes().isEmpty()) return headAttributes;
        if (headAttributes.isEmpty()) return expr.attributes();
        var s = new HashSet<>(headAttributes);
        s.addAll(expr.attributes());
        return Set.copyOf(s);
    }

    public static Set<Symbol> effectiveAttributes(EvaluationContext context, Expression expr) {
        return effective(expr.symbolHead().map(h -> attributesOf(context, h)).orElse(Set.of()), expr);
    }

    public static boolean holdsFirst(Set<Symbol> attrs) {
        return attrs.contains(HOLD_FIRST) || holdsAll(attrs);
    }

    public static boolean holdsRest(Set<Symbol> attrs) {
        return attrs.contains(HOLD_REST) || holdsAll(attrs);
    }

    public static boolean holdsAll(Set<Symbol> attrs) {
        return attrs.contains(HOLD_ALL) || holdsCompletely(attrs);
    }

    public static boolean holdsCompletely(Set<Symbol> attrs) {
        return attrs.contains(HOLD_ALL_COMPLETE);
    }

    public static boolean holdsSequences(Set<Symbol> attrs) {
        return attrs.contains(SEQUENCE_HOLD) || holdsCompletely(attrs);
    }

    public static boolean isFlat(Set<Symbol> attrs) {
        return attrs.contains(FLAT);
    }

    public static boolean isOrderless(Set<Symbol> attrs) {
        return attrs.contains(ORDERLESS);
    }

    public static boolean isListable(Set<Symbol> attrs) {
        return attrs.contains(LISTABLE);
    }

    public static boolean isProtected(Set<Symbol> attrs) {
        return attrs.contains(PROTECTED);
    }

    public static boolean isLocked(Set<Symbol> attrs) {
        return attrs.contains(LOCKED);
    }
}
