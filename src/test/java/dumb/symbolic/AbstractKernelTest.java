package dumb.symbolic;

import dumb.symbolic.Element.Symbol;
import dumb.symbolic.FullFormParser.ParseException;
import org.junit.jupiter.api.BeforeEach;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractKernelTest {

    protected Kernel kernel;

    @BeforeEach
    void setUp() {
        kernel = new Kernel(new Kernel.Configuration("Test", 256, 1000));
    }

    protected static Element parse(String text) {
        try {
            return FullFormParser.parse(text);
        } catch (ParseException e) {
            return fail("Failed to parse:\n" + text + "\n" + e.getMessage());
        }
    }

    protected static Symbol sym(String name) {
        return Symbol.of(name);
    }

    /** Evaluates every statement; answers the last result. */
    protected Element eval(String text) {
        return evaluateAll(kernel, text);
    }

    protected static Element evaluateAll(Kernel k, String text) {
        try {
            Element result = Symbol.NULL;
            for (var e : FullFormParser.parseAll(text)) result = k.evaluate(e);
            return result;
        } catch (ParseException e) {
            return fail("Failed to parse:\n" + text + "\n" + e.getMessage());
        }
    }

    protected void assertEval(String expected, String input) {
        assertEquals(parse(expected), eval(input), input);
    }

    /** An oracle that evaluates through {@link #kernel}, for driving matcher and rule code directly. */
    protected Matcher.Oracle oracle() {
        return new Matcher.Oracle() {
            @Override
            public Set<Symbol> attributes(Symbol symbol) {
                return Attributes.attributesOf(kernel.context(), kernel.builtins(), symbol);
            }

            @Override
            public Element evaluate(Element element) {
                return kernel.evaluate(element);
            }

            @Override
            public Optional<Element> defaultValue(Element head, int position, int length) {
                return Optional.empty();
            }
        };
    }

    /** An oracle under which only {@code head} has attributes; nothing is evaluated. */
    protected static Matcher.Oracle attributeOracle(Symbol head, Symbol... attributes) {
        return new Matcher.Oracle() {
            @Override
            public Set<Symbol> attributes(Symbol symbol) {
                return symbol.equals(head) ? Set.of(attributes) : Set.of();
            }

            @Override
            public Element evaluate(Element element) {
                return element;
            }

            @Override
            public Optional<Element> defaultValue(Element h, int position, int length) {
                return Optional.empty();
            }
        };
    }
}
