package dumb.symbolic;

import dumb.symbolic.Element.Expression;
import dumb.symbolic.Element.Symbol;

import java.util.ArrayList;

/**
 * Non-evaluating replacement of bound pattern variables. A variable bound to {@code Sequence[...]}
 * in an argument position is spliced into the enclosing argument list; a literal {@code Sequence}
 * in the template is kept for the evaluator to deal with.
 */
public enum Substitution {
    ;

    public static Element substitute(Element e, Bindings bindings) {
        return bindings.isEmpty() ? e : substituteRecursive(e, bindings);
    }

    private static Element substituteRecursive(Element e, Bindings bindings) {
        if (e instanceof Symbol s) return bindings.get(s).orElse(s);
        if (!(e instanceof Expression x)) return e;

        var head = substituteRecursive(x.head(), bindings);
        var changed = head != x.head();
        var tail = new ArrayList<Element>(x.size());
        for (var arg : x.tail()) {
            var a = substituteRecursive(arg, bindings);
            if (a != arg) changed = true;
            if (arg instanceof Symbol && a != arg && Transforms.isSequence(a)) {
                tail.addAll(((Expression) a).tail());
                changed = true;
            } else tail.add(a);
        }
        return changed ? new Expression(head, tail, x.attributes()) : x;
    }
}
