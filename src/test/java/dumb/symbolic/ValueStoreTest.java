package dumb.symbolic;

import dumb.symbolic.Element.Symbol;
import dumb.symbolic.ValueStore.Category;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueStoreTest extends AbstractKernelTest {

    private static final Symbol F = Symbol.of("f");

    private ValueStore store;

    @BeforeEach
    void newStore() {
        store = new ValueStore();
    }

    private static Rule rule(String lhs, String rhs, int priority) {
        return Rule.delayed(parse(lhs), parse(rhs)).withPriority(priority);
    }

    @Test
    void emptyByDefault() {
        assertEquals(List.of(), store.rules(F, Category.DOWN));
        assertFalse(store.has(F));
        assertEquals(0, store.toJson(F).size());
    }

    @Test
    void equalPriorityKeepsDefinitionOrder() {
        var first = rule("f[1]", "one", 0);
        var second = rule("f[x_]", "any", 0);
        store.add(F, Category.DOWN, first);
        store.add(F, Category.DOWN, second);
        assertEquals(List.of(first, second), store.rules(F, Category.DOWN));
    }

    @Test
    void higherPriorityGoesFirst() {
        var low = rule("f[x_]", "low", 0);
        var high = rule("f[1]", "high", 3);
        var mid = rule("f[2]", "mid", 1);
        store.add(F, Category.DOWN, low);
        store.add(F, Category.DOWN, high);
        store.add(F, Category.DOWN, mid);
        assertEquals(List.of(high, mid, low), store.rules(F, Category.DOWN));
    }

    @Test
    void redefinitionReplacesInPlace() {
        store.add(F, Category.DOWN, rule("f[1]", "one", 0));
        store.add(F, Category.DOWN, rule("f[x_]", "any", 0));
        var again = rule("f[1]", "uno", 0);
        store.add(F, Category.DOWN, again);
        var rules = store.rules(F, Category.DOWN);
        assertEquals(2, rules.size());
        assertSame(again, rules.get(0));
    }

    @Test
    void handedOutListsAreSnapshots() {
        store.add(F, Category.DOWN, rule("f[1]", "one", 0));
        var before = store.rules(F, Category.DOWN);
        store.add(F, Category.DOWN, rule("f[2]", "two", 0));
        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(rule("f[3]", "three", 0)));
    }

    @Test
    void setSortsAndEmptySetClears() {
        var a = rule("f[1]", "a", 0);
        var b = rule("f[2]", "b", 2);
        store.set(F, Category.UP, List.of(a, b));
        assertEquals(List.of(b, a), store.rules(F, Category.UP));
        store.set(F, Category.UP, List.of());
        assertFalse(store.has(F, Category.UP));
        assertFalse(store.has(F));
    }

    @Test
    void clearByCategoryAndSymbol() {
        store.add(F, Category.DOWN, rule("f[1]", "a", 0));
        store.add(F, Category.OWN, rule("f", "b", 0));
        store.clear(F, Category.DOWN);
        assertFalse(store.has(F, Category.DOWN));
        assertTrue(store.has(F, Category.OWN));
        store.clear(F);
        assertTrue(store.symbols().isEmpty());
    }

    @Test
    void jsonGroupsByCategoryLabel() {
        store.add(F, Category.DOWN, rule("f[1]", "a", 0));
        store.add(F, Category.N, rule("N[f]", "b", 0));
        var n = store.toJson(F);
        assertEquals(1, n.get("DownValues").size());
        assertEquals(1, n.get("NValues").size());
    }
}
