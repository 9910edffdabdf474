package dumb.symbolic;

import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Wildcards: {@code Blank[]} matches one element, {@code BlankSequence[]} one or more,
 * {@code BlankNullSequence[]} zero or more. Each may carry a head constraint, checked per element.
 */
public final class Blanks {

    public static final Symbol BLANK = Symbol.of("Blank");
    public static final Symbol BLANK_SEQUENCE = Symbol.of("BlankSequence");
    public static final Symbol BLANK_NULL_SEQUENCE = Symbol.of("BlankNullSequence");

    private static final Expression ANY = Expression.of(BLANK);
    private static final Expression ANY_SEQUENCE = Expression.of(BLANK_SEQUENCE);
    private static final Expression ANY_NULL_SEQUENCE = Expression.of(BLANK_NULL_SEQUENCE);

    private Blanks() {
    }

    public static Expression blank() {
        return ANY;
    }

    public static Expression blank(Element head) {
        return Expression.of(BLANK, requireNonNull(head));
    }

    public static Expression blankSequence() {
        return ANY_SEQUENCE;
    }

    public static Expression blankSequence(Element head) {
        return Expression.of(BLANK_SEQUENCE, requireNonNull(head));
    }

    public static Expression blankNullSequence() {
        return ANY_NULL_SEQUENCE;
    }

    public static Expression blankNullSequence(Element head) {
        return Expression.of(BLANK_NULL_SEQUENCE, requireNonNull(head));
    }

    public static boolean isBlank(Element e) {
        return e instanceof Expression x && x.head().equals(BLANK);
    }

    public static boolean isBlankSequence(Element e) {
        return e instanceof Expression x && x.head().equals(BLANK_SEQUENCE);
    }

    public static boolean isBlankNullSequence(Element e) {
        return e instanceof Expression x && x.head().equals(BLANK_NULL_SEQUENCE);
    }

    public static boolean isAnyBlank(Element e) {
        return isBlank(e) || isSequenceBlank(e);
    }

    /** {@code BlankSequence} or {@code BlankNullSequence}: may stand for several elements. */
    public static boolean isSequenceBlank(Element e) {
        return isBlankSequence(e) || isBlankNullSequence(e);
    }

    public static Optional<Element> headConstraint(Expression blank) {
        if (!isAnyBlank(blank)) throw new IllegalArgumentException("Not a blank: " + blank);
        return blank.isEmpty() ? Optional.empty() : Optional.of(blank.get(0));
    }

    public static boolean matchesHead(Expression blank, Element e) {
        return headConstraint(blank).map(h -> e.head().equals(h)).orElse(true);
    }

    public static int minLength(Expression blank) {
        if (!isAnyBlank(blank)) throw new IllegalArgumentException("Not a blank: " + blank);
        return isBlankNullSequence(blank) ? 0 : 1;
    }

    public static int maxLength(Expression blank) {
        if (!isAnyBlank(blank)) throw new IllegalArgumentException("Not a blank: " + blank);
        return isBlank(blank) ? 1 : Integer.MAX_VALUE;
    }
}
