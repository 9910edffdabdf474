package dumb.symbolic.builtin;

import dumb.symbolic.Blanks;
import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element;
import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.EvaluationException;
import dumb.symbolic.Patterns;
import dumb.symbolic.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static dumb.symbolic.Attributes.*;

/** Containers, holds, pattern heads and rule application. */
public enum Structure {
    ;

    public static final Symbol HOLD = Symbol.of("Hold");
    public static final Symbol HOLD_COMPLETE = Symbol.of("HoldComplete");
    public static final Symbol RULE = Symbol.of("Rule");
    public static final Symbol RULE_DELAYED = Symbol.of("RuleDelayed");
    public static final Symbol LENGTH = Symbol.of("Length");
    public static final Symbol HEAD = Symbol.of("Head");
    public static final Symbol MATCH_Q = Symbol.of("MatchQ");
    public static final Symbol REPLACE_ALL = Symbol.of("ReplaceAll");
    public static final Symbol REPLACE_REPEATED = Symbol.of("ReplaceRepeated");

    static void register(BuiltinRegistry r) {
        r.registerAttributes(Symbol.LIST, Set.of(LOCKED, PROTECTED));
        r.registerAttributes(Symbol.SEQUENCE, Set.of(PROTECTED));
        r.registerAttributes(HOLD, Set.of(HOLD_ALL, PROTECTED));
        r.registerAttributes(HOLD_COMPLETE, Set.of(HOLD_ALL_COMPLETE, PROTECTED));
        r.registerAttributes(Patterns.HOLD_PATTERN, Set.of(HOLD_ALL, PROTECTED));
        r.registerAttributes(RULE, Set.of(SEQUENCE_HOLD, PROTECTED));
        r.registerAttributes(RULE_DELAYED, Set.of(HOLD_REST, SEQUENCE_HOLD, PROTECTED));

        r.registerAttributes(Blanks.BLANK, Set.of(PROTECTED));
        r.registerAttributes(Blanks.BLANK_SEQUENCE, Set.of(PROTECTED));
        r.registerAttributes(Blanks.BLANK_NULL_SEQUENCE, Set.of(PROTECTED));
        r.registerAttributes(Patterns.PATTERN, Set.of(HOLD_FIRST, PROTECTED));
        r.registerAttributes(Patterns.CONDITION, Set.of(HOLD_ALL, PROTECTED));
        r.registerAttributes(Patterns.PATTERN_TEST, Set.of(HOLD_REST, PROTECTED));
        r.registerAttributes(Patterns.ALTERNATIVES, Set.of(PROTECTED));
        r.registerAttributes(Patterns.OPTIONAL, Set.of(PROTECTED));
        r.registerAttributes(Patterns.REPEATED, Set.of(PROTECTED));
        r.registerAttributes(Patterns.REPEATED_NULL, Set.of(PROTECTED));
        r.registerAttributes(Patterns.EXCEPT, Set.of(PROTECTED));
        r.registerAttributes(Patterns.VERBATIM, Set.of(HOLD_ALL_COMPLETE, PROTECTED));

        r.register(LENGTH, Set.of(PROTECTED), (x, ev) -> x.size() == 1
                ? Optional.of(Atom.of(x.get(0) instanceof Expression e ? e.size() : 0))
                : Optional.empty());
        r.register(HEAD, Set.of(PROTECTED), (x, ev) -> x.size() == 1
                ? Optional.of(x.get(0).head())
                : Optional.empty());
        r.register(MATCH_Q, Set.of(PROTECTED), (x, ev) -> x.size() == 2
                ? Optional.of(Comparisons.truth(ev.matcher().matches(x.get(1), x.get(0))))
                : Optional.empty());
        r.register(REPLACE_ALL, Set.of(PROTECTED), (x, ev) -> x.size() == 2
                ? Optional.of(Rule.replaceAll(x.get(0), rules(x.get(1)), ev))
                : Optional.empty());
        r.register(REPLACE_REPEATED, Set.of(PROTECTED), (x, ev) -> x.size() == 2
                ? Optional.of(Rule.replaceRepeated(x.get(0), rules(x.get(1)), ev, ev.limits().iterationLimit()))
                : Optional.empty());
    }

    /**
     * {@code Rule[l, r]}, {@code RuleDelayed[l, r]} or a {@code List} of them as rules. Both
     * kinds are applied without evaluating the result here; the evaluator continues with it.
     *
     * @throws EvaluationException for anything that is not a rule
     */
    static List<Rule> rules(Element spec) {
        if (spec instanceof Expression x && (x.hasHead(RULE) || x.hasHead(RULE_DELAYED)) && x.size() == 2)
            return List.of(Rule.delayed(x.get(0), x.get(1)));
        if (spec instanceof Expression l && l.hasHead(Symbol.LIST)) {
            var out = new ArrayList<Rule>(l.size());
            for (var item : l.tail()) out.addAll(rules(item));
            return out;
        }
        throw new EvaluationException("Not a rule or list of rules: " + spec);
    }

    /**
     * Converts a rule back into its {@code Rule}/{@code RuleDelayed} expression. The lhs is wrapped
     * in {@code HoldPattern} so the listing does not evaluate it.
     */
    public static Expression toExpression(Rule rule) {
        if (!(rule.rhs() instanceof Rule.Template t))
            throw new IllegalArgumentException("Computed rule has no expression form: " + rule);
        Element lhs = Patterns.isHoldPattern(rule.lhs()) ? rule.lhs() : Patterns.holdPattern(rule.lhs());
        if (rule.condition() != null) lhs = Patterns.condition(lhs, rule.condition());
        return Expression.of(rule.isImmediate() ? RULE : RULE_DELAYED, lhs, t.rhs());
    }
}
