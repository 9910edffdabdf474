package dumb.symbolic.builtin;

import dumb.symbolic.Element;
import dumb.symbolic.Element.Atom;
import dumb.symbolic.Element.Atom.Complex;

import java.util.Optional;

/**
 * Machine arithmetic on numeric atoms. Integers stay exact until a long overflows, then the result
 * is a real; anything involving a complex is complex.
 */
enum Numbers {
    ;

    static boolean isNumber(Element e) {
        return e instanceof Atom a && a.isNumber();
    }

    static boolean isReal(Element e) {
        return e instanceof Atom a && (a.isInteger() || a.isReal());
    }

    static Atom zero() {
        return Atom.of(0L);
    }

    static Atom one() {
        return Atom.of(1L);
    }

    static boolean isZero(Atom a) {
        if (a.value() instanceof Complex z) return z.re() == 0 && z.im() == 0;
        return a.isInteger() ? a.longValue() == 0 : a.doubleValue() == 0;
    }

    static Atom plus(Atom a, Atom b) {
        if (a.isComplex() || b.isComplex()) {
            var z = complex(a).plus(complex(b));
            return Atom.complex(z.re(), z.im());
        }
        if (a.isInteger() && b.isInteger()) {
            try {
                return Atom.of(Math.addExact(a.longValue(), b.longValue()));
            } catch (ArithmeticException overflow) {
                return Atom.of((double) a.longValue() + b.longValue());
            }
        }
        return Atom.of(a.doubleValue() + b.doubleValue());
    }

    static Atom times(Atom a, Atom b) {
        if (a.isComplex() || b.isComplex()) {
            var z = complex(a).times(complex(b));
            return Atom.complex(z.re(), z.im());
        }
        if (a.isInteger() && b.isInteger()) {
            try {
                return Atom.of(Math.multiplyExact(a.longValue(), b.longValue()));
            } catch (ArithmeticException overflow) {
                return Atom.of((double) a.longValue() * b.longValue());
            }
        }
        return Atom.of(a.doubleValue() * b.doubleValue());
    }

    /** Real or integer power; empty for complex operands and undefined results such as 0^-1. */
    static Optional<Atom> power(Atom base, Atom exponent) {
        if (base.isComplex() || exponent.isComplex()) return Optional.empty();
        if (base.isInteger() && exponent.isInteger() && exponent.longValue() >= 0) {
            var b = base.longValue();
            var n = exponent.longValue();
            if (b == 0) return Optional.of(n == 0 ? one() : zero());
            if (b == 1) return Optional.of(one());
            if (b == -1) return Optional.of(Atom.of(n % 2 == 0 ? 1L : -1L));
            try {
                return Optional.of(Atom.of(exactPower(b, n)));
            } catch (ArithmeticException overflow) {
                var r = Math.pow(b, n);
                return Double.isFinite(r) ? Optional.of(Atom.of(r)) : Optional.empty();
            }
        }
        var r = Math.pow(base.doubleValue(), exponent.doubleValue());
        return Double.isFinite(r) ? Optional.of(Atom.of(r)) : Optional.empty();
    }

    /** Square-and-multiply; throws {@link ArithmeticException} on overflow. */
    private static long exactPower(long base, long exponent) {
        var result = 1L;
        var square = base;
        for (var e = exponent; e > 0; e >>= 1) {
            if ((e & 1) == 1) result = Math.multiplyExact(result, square);
            if (e > 1) square = Math.multiplyExact(square, square);
        }
        return result;
    }

    /** Exact when the division is, real otherwise; empty for a zero divisor. */
    static Optional<Atom> divide(Atom a, Atom b) {
        if (a.isComplex() || b.isComplex() || isZero(b)) return Optional.empty();
        if (a.isInteger() && b.isInteger() && a.longValue() % b.longValue() == 0) {
            if (a.longValue() == Long.MIN_VALUE && b.longValue() == -1)
                return Optional.of(Atom.of(-(double) Long.MIN_VALUE));
            return Optional.of(Atom.of(a.longValue() / b.longValue()));
        }
        return Optional.of(Atom.of(a.doubleValue() / b.doubleValue()));
    }

    static Atom toReal(Atom a) {
        return a.isInteger() ? Atom.of((double) a.longValue()) : a;
    }

    /** Numeric comparison of two real atoms. */
    static int compare(Atom a, Atom b) {
        if (a.isInteger() && b.isInteger()) return Long.compare(a.longValue(), b.longValue());
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    static boolean numericallyEqual(Atom a, Atom b) {
        if (a.isComplex() || b.isComplex()) return complex(a).equals(complex(b));
        return compare(a, b) == 0;
    }

    private static Complex complex(Atom a) {
        return a.value() instanceof Complex z ? z : new Complex(a.doubleValue(), 0);
    }
}
