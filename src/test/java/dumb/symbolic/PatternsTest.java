package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternsTest {

    private static final Symbol X = Symbol.of("x");

    @Test
    void constructorsBuildFullForm() {
        assertEquals("Pattern[x, Blank[]]", Patterns.pattern(X, Blanks.blank()).toString());
        assertEquals("Condition[x, True]", Patterns.condition(X, Symbol.TRUE).toString());
        assertEquals("Repeated[a, List[2, 3]]", Patterns.repeated(Symbol.of("a"), 2, 3).toString());
    }

    @Test
    void alternativesNeedTwoChoices() {
        assertThrows(IllegalArgumentException.class, () -> Patterns.alternatives(Symbol.of("a")));
        assertTrue(Patterns.isAlternatives(Patterns.alternatives(Symbol.of("a"), Symbol.of("b"))));
    }

    @Test
    void predicatesCheckArity() {
        assertTrue(Patterns.isPattern(Patterns.pattern(X, Blanks.blank())));
        assertFalse(Patterns.isPattern(Expression.of(Patterns.PATTERN, X)));
        assertFalse(Patterns.isPattern(Expression.of(Patterns.PATTERN, Atom.of(1L), Blanks.blank())));
        assertTrue(Patterns.isOptional(Patterns.optional(X, Atom.of(0L))));
        assertFalse(Patterns.isHoldPattern(Expression.of(Patterns.HOLD_PATTERN)));
    }

    @Test
    void repeatBounds() {
        var a = Symbol.of("a");
        assertArrayEquals(new int[]{1, Integer.MAX_VALUE}, Patterns.repeatBounds(Patterns.repeated(a)).orElseThrow());
        assertArrayEquals(new int[]{0, Integer.MAX_VALUE}, Patterns.repeatBounds(Patterns.repeatedNull(a)).orElseThrow());
        assertArrayEquals(new int[]{1, 4}, Patterns.repeatBounds(Patterns.repeated(a, 4)).orElseThrow());
        assertArrayEquals(new int[]{2, 2}, Patterns.repeatBounds(
                Expression.of(Patterns.REPEATED, a, Expression.of(Symbol.LIST, Atom.of(2L)))).orElseThrow());
        assertTrue(Patterns.repeatBounds(Expression.of(Patterns.REPEATED, a, Atom.of("x"))).isEmpty());
        assertTrue(Patterns.repeatBounds(Patterns.repeated(a, 3, 1)).isEmpty());
    }

    @Test
    void collectsNamesInOrderSkippingVerbatim() {
        var p = Expression.of("f",
                Patterns.pattern("b", Blanks.blank()),
                Patterns.verbatim(Patterns.pattern("hidden", Blanks.blank())),
                Patterns.condition(Patterns.pattern("a", Blanks.blank()), Symbol.TRUE));
        assertEquals(List.of(Symbol.of("b"), Symbol.of("a")), List.copyOf(Patterns.collectPatternNames(p)));
    }

    @Test
    void patternFreedom() {
        assertTrue(Patterns.isPatternFree(Expression.of("f", X, Atom.of(1L))));
        assertFalse(Patterns.isPatternFree(Expression.of("f", Expression.of("g", Blanks.blank()))));
    }

    @Test
    void unholdStripsNestedHolds() {
        var inner = Expression.of("f", X);
        assertEquals(inner, Patterns.unhold(Patterns.holdPattern(Patterns.holdPattern(inner))));
        assertSame(inner, Patterns.unhold(inner));
    }
}
