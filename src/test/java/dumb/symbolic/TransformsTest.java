package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformsTest {

    private static final Symbol A = Symbol.of("a");
    private static final Symbol B = Symbol.of("b");

    @Test
    void canonicalOrderRanksNumbersStringsSymbolsExpressions() {
        var deep = Expression.of("f", Expression.of("g", A));
        var shallow = Expression.of("f", A);
        var items = new ArrayList<Element>(List.of(deep, B, Atom.of("s"), shallow, Atom.of(2.5), A, Atom.of(1L)));
        items.sort(Transforms.CANONICAL_ORDER);
        assertEquals(List.of(Atom.of(1L), Atom.of(2.5), Atom.of("s"), A, B, shallow, deep), items);
    }

    @Test
    void numbersCompareByValueAcrossTypes() {
        assertTrue(Transforms.CANONICAL_ORDER.compare(Atom.of(3L), Atom.of(2.5)) > 0);
        assertTrue(Transforms.CANONICAL_ORDER.compare(Atom.complex(1, -1), Atom.complex(1, 1)) < 0);
    }

    @Test
    void flattenLiftsNestedSameHeadArguments() {
        var x = Expression.of("p", A, Expression.of("p", B, Expression.of("p", Atom.of(1L))), Expression.of("q", A));
        assertEquals(Expression.of("p", A, B, Atom.of(1L), Expression.of("q", A)), Transforms.flatten(x));
        var flat = Expression.of("p", A, B);
        assertSame(flat, Transforms.flatten(flat));
    }

    @Test
    void spliceSequences() {
        var x = Expression.of("f", Expression.of(Symbol.SEQUENCE, A, B), Expression.of(Symbol.SEQUENCE), A);
        assertEquals(Expression.of("f", A, B, A), Transforms.spliceSequences(x));
    }

    @Test
    void sortOrderlessKeepsSortedInstances() {
        var sorted = Expression.of("f", Atom.of(1L), A);
        assertSame(sorted, Transforms.sortOrderless(sorted));
        assertEquals(sorted, Transforms.sortOrderless(Expression.of("f", A, Atom.of(1L))));
    }

    @Test
    void threadListableOverEqualLengthLists() {
        var x = Expression.of("f", Expression.of(Symbol.LIST, A, B), Atom.of(1L));
        var threaded = Transforms.threadListable(x).orElseThrow();
        assertEquals(Expression.of(Symbol.LIST, Expression.of("f", A, Atom.of(1L)), Expression.of("f", B, Atom.of(1L))), threaded);
    }

    @Test
    void threadListableDeclinesUnequalLengthsOrNoLists() {
        var unequal = Expression.of("f", Expression.of(Symbol.LIST, A), Expression.of(Symbol.LIST, A, B));
        assertTrue(Transforms.threadListable(unequal).isEmpty());
        assertTrue(Transforms.threadListable(Expression.of("f", A)).isEmpty());
    }
}
