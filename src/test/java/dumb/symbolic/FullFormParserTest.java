package dumb.symbolic;

import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.FullFormParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FullFormParserTest {

    @Test
    void compoundExpressions() throws ParseException {
        assertEquals(Expression.of("f", Symbol.of("x"), Expression.of("g", Atom.of(1L))),
                FullFormParser.parse("f[x, g[1]]"));
        assertEquals(Expression.of("f"), FullFormParser.parse("f[]"));
    }

    @Test
    void curriedHeads() throws ParseException {
        var e = (Expression) FullFormParser.parse("f[1][2]");
        assertEquals(Expression.of("f", Atom.of(1L)), e.head());
        assertEquals(Atom.of(2L), e.get(0));
    }

    @Test
    void atoms() throws ParseException {
        assertEquals(Atom.of(42L), FullFormParser.parse("42"));
        assertEquals(Atom.of(-7L), FullFormParser.parse("-7"));
        assertEquals(Atom.of(2.5), FullFormParser.parse("2.5"));
        assertEquals(Atom.of("a \"b\""), FullFormParser.parse("\"a \\\"b\\\"\""));
    }

    @Test
    void lists() throws ParseException {
        assertEquals(Expression.of(Symbol.LIST, Atom.of(1L), Atom.of(2L)), FullFormParser.parse("{1, 2}"));
        assertEquals(Expression.of(Symbol.LIST), FullFormParser.parse("{}"));
    }

    @Test
    void blanks() throws ParseException {
        assertEquals(Blanks.blank(), FullFormParser.parse("_"));
        assertEquals(Blanks.blank(Symbol.of("Integer")), FullFormParser.parse("_Integer"));
        assertEquals(Patterns.pattern("x", Blanks.blank()), FullFormParser.parse("x_"));
        assertEquals(Patterns.pattern("x", Blanks.blankSequence()), FullFormParser.parse("x__"));
        assertEquals(Patterns.pattern("x", Blanks.blankNullSequence(Symbol.of("h"))), FullFormParser.parse("x___h"));
    }

    @Test
    void optionalAndPatternTest() throws ParseException {
        assertEquals(Patterns.optional(Patterns.pattern("y", Blanks.blank())), FullFormParser.parse("y_."));
        assertEquals(Patterns.patternTest(Patterns.pattern("n", Blanks.blank()), Symbol.of("EvenQ")),
                FullFormParser.parse("n_?EvenQ"));
    }

    @Test
    void commentsAndSeparators() throws ParseException {
        var all = FullFormParser.parseAll("(* first *) a; b\n c");
        assertEquals(3, all.size());
        assertEquals(Symbol.of("c"), all.get(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"f[x", "f[x,]", "\"open", "1[2]", "x____", "(* never closed", "a b"})
    void malformedInputIsRejected(String text) {
        assertThrows(ParseException.class, () -> FullFormParser.parse(text));
    }

    @Test
    void errorsCarryPosition() {
        var e = assertThrows(ParseException.class, () -> FullFormParser.parse("f[1,\n  ]"));
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("line 2"));
    }
}
