package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest extends AbstractKernelTest {

    @Test
    void delayedRuleSubstitutesWithoutEvaluating() {
        var rule = Rule.delayed(parse("f[x_]"), parse("Plus[x, 1]"));
        assertEquals(parse("Plus[2, 1]"), rule.apply(parse("f[2]"), oracle()).orElseThrow());
    }

    @Test
    void immediateRuleEvaluatesItsResult() {
        var rule = Rule.immediate(parse("f[x_]"), parse("Plus[x, 1]"));
        assertEquals(Atom.of(3L), rule.apply(parse("f[2]"), oracle()).orElseThrow());
    }

    @Test
    void nonMatchingRuleDoesNotApply() {
        assertTrue(Rule.delayed(parse("f[x_]"), parse("x")).apply(parse("g[1]"), oracle()).isEmpty());
    }

    @Test
    void conditionFailureBacktracksToTheNextSolution() {
        var rule = Rule.delayed(parse("f[x__, y__]"), parse("g[{x}, {y}]"))
                .withCondition(parse("SameQ[Length[{x}], 2]"));
        assertEquals(parse("g[{1, 2}, {3}]"), rule.apply(parse("f[1, 2, 3]"), oracle()).orElseThrow());
    }

    @Test
    void conditionThatNeverHoldsRejects() {
        var rule = Rule.delayed(parse("f[x_]"), parse("x")).withCondition(parse("Greater[x, 10]"));
        assertTrue(rule.apply(parse("f[1]"), oracle()).isEmpty());
    }

    @Test
    void higherPriorityRulesAreTriedFirst() {
        var general = Rule.delayed(parse("f[x_]"), parse("general"));
        var special = Rule.delayed(parse("f[x_]"), parse("special")).withPriority(5);
        assertEquals(sym("special"), Rule.tryRules(List.of(general, special), parse("f[1]"), oracle()).orElseThrow());
        var same = Rule.delayed(parse("f[x_]"), parse("other"));
        assertEquals(sym("general"), Rule.tryRules(List.of(general, same), parse("f[1]"), oracle()).orElseThrow());
    }

    @Test
    void computedRulesRunNativeCode() {
        var rule = Rule.computed(parse("len[x___]"), (b, o) -> Atom.of(((Element.Expression) b.get(sym("x")).orElseThrow()).size()));
        assertEquals(Atom.of(3L), rule.apply(parse("len[a, b, c]"), Matcher.Oracle.NONE).orElseThrow());
    }

    @Test
    void replaceAllRewritesOutermostMatchesOnce() {
        var rules = List.of(Rule.delayed(parse("f[x_]"), parse("g[x]")));
        assertEquals(parse("h[g[f[1]], g[2]]"), Rule.replaceAll(parse("h[f[f[1]], f[2]]"), rules));
    }

    @Test
    void replaceRepeatedRunsToAFixedPoint() {
        var rules = List.of(Rule.delayed(parse("f[x_]"), parse("x")));
        assertEquals(sym("a"), Rule.replaceRepeated(parse("f[f[f[a]]]"), rules, 10));
    }

    @Test
    void replaceRepeatedStopsAtTheCap() {
        var rules = List.of(Rule.delayed(parse("n[x_]"), parse("n[s[x]]")));
        assertEquals(parse("n[s[s[z]]]"), Rule.replaceRepeated(parse("n[z]"), rules, 2));
    }

    @Test
    void sameDefinitionComparesLhsAndCondition() {
        var a = Rule.delayed(parse("f[x_]"), parse("1"));
        assertTrue(a.sameDefinition(Rule.immediate(parse("f[x_]"), parse("2"))));
        assertFalse(a.sameDefinition(a.withCondition(Element.Symbol.TRUE)));
    }

    @Test
    void printedForms() {
        assertEquals("f[Pattern[x, Blank[]]] :> x", Rule.delayed(parse("f[x_]"), parse("x")).toString());
        assertEquals("a -> 1 /; True", Rule.immediate(parse("a"), parse("1")).withCondition(Element.Symbol.TRUE).toString());
        assertEquals("DELAYED", Rule.delayed(parse("a"), parse("b")).toJson().get("kind").asText());
    }
}
