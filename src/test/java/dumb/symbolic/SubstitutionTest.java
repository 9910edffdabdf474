package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubstitutionTest {

    private static final Symbol X = Symbol.of("x");
    private static final Symbol Y = Symbol.of("y");

    @Test
    void replacesBoundSymbolsEverywhere() {
        var template = Expression.of("f", X, Expression.of("g", X, Y));
        var b = Bindings.of(X, Atom.of(1L));
        assertEquals(Expression.of("f", Atom.of(1L), Expression.of("g", Atom.of(1L), Y)), Substitution.substitute(template, b));
    }

    @Test
    void splicesSequenceValuesIntoArgumentLists() {
        var template = Expression.of("f", Atom.of(0L), X, Y);
        var b = Bindings.of(X, Expression.of(Symbol.SEQUENCE, Atom.of(1L), Atom.of(2L))).bind(Y, Atom.of(3L));
        assertEquals(Expression.of("f", Atom.of(0L), Atom.of(1L), Atom.of(2L), Atom.of(3L)), Substitution.substitute(template, b));
    }

    @Test
    void emptySequenceVanishes() {
        var b = Bindings.of(X, Expression.of(Symbol.SEQUENCE));
        assertEquals(Expression.of("f", Y), Substitution.substitute(Expression.of("f", X, Y), b));
    }

    @Test
    void literalSequencesInTheTemplateAreKept() {
        var literal = Expression.of(Symbol.SEQUENCE, X, Atom.of(1L));
        var template = Expression.of("HoldComplete", literal);
        assertEquals(Expression.of("HoldComplete", Expression.of(Symbol.SEQUENCE, Atom.of(2L), Atom.of(1L))),
                Substitution.substitute(template, Bindings.of(X, Atom.of(2L))));
    }

    @Test
    void headsAreSubstituted() {
        var b = Bindings.of(X, Symbol.of("g"));
        assertEquals(Expression.of("g", Atom.of(1L)), Substitution.substitute(Expression.of(X, Atom.of(1L)), b));
    }

    @Test
    void headBecomingAnAtomIsRejected() {
        var b = Bindings.of(X, Atom.of(1L));
        assertThrows(IllegalArgumentException.class, () -> Substitution.substitute(Expression.of(X, Y), b));
    }

    @Test
    void unchangedInputIsReturnedAsIs() {
        var template = Expression.of("f", Y).withAttributes(Attributes.HOLD_ALL);
        assertSame(template, Substitution.substitute(template, Bindings.of(X, Atom.of(1L))));
        var changed = (Expression) Substitution.substitute(Expression.of("f", X).withAttributes(Attributes.HOLD_ALL), Bindings.of(X, Y));
        assertTrue(changed.hasAttribute(Attributes.HOLD_ALL));
    }
}
