package dumb.symbolic.builtin;

import dumb.symbolic.BuiltinRegistry;
import dumb.symbolic.Element.Atom;
import dumb.symbolic.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Installs the standard builtin set. */
public enum CoreBuiltins {
    ;

    private static final Logger logger = LoggerFactory.getLogger(CoreBuiltins.class);

    /**
     * Registers every builtin group in {@code registry} and records the defaults that optional
     * arguments of {@code Plus} and {@code Times} fall back to in {@code context}.
     */
    public static BuiltinRegistry install(BuiltinRegistry registry, EvaluationContext context) {
        Arithmetic.register(registry);
        Comparisons.register(registry);
        Control.register(registry);
        Definitions.register(registry);
        Structure.register(registry);

        context.defineDefaultValue(Arithmetic.PLUS, Atom.of(0L));
        context.defineDefaultValue(Arithmetic.TIMES, Atom.of(1L));

        logger.info("Installed {} builtins into {}", registry.size(), context.name());
        return registry;
    }

    public static BuiltinRegistry install(EvaluationContext context) {
        return install(new BuiltinRegistry(), context);
    }
}
