package dumb.symbolic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.symbolic.Element.Symbol;
import dumb.symbolic.builtin.CoreBuiltins;
import dumb.symbolic.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A ready-to-use kernel: a global context, the core builtins and an evaluator bound to both,
 * configured from {@code kernel.json} on the classpath when present.
 */
public class Kernel {

    public static final String CONFIG_RESOURCE = "kernel.json";
    public static final String DEFAULT_CONTEXT_NAME = "Global";

    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final EvaluationContext context;
    private final BuiltinRegistry builtins;
    private volatile Configuration configuration;
    private volatile Evaluator evaluator;

    public Kernel() {
        this(loadConfiguration(CONFIG_RESOURCE));
    }

    public Kernel(Configuration configuration) {
        this.configuration = requireNonNull(configuration);
        this.context = new EvaluationContext(configuration.contextName());
        this.builtins = CoreBuiltins.install(new BuiltinRegistry(), context);
        this.evaluator = new Evaluator(context, builtins, configuration.limits());
        logger.info("Kernel started: context={}, recursionLimit={}, iterationLimit={}",
                configuration.contextName(), configuration.recursionLimit(), configuration.iterationLimit());
    }

    /** Reads {@code resource} from the classpath; defaults when it is missing or unreadable. */
    public static Configuration loadConfiguration(String resource) {
        try (var in = Kernel.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on the classpath, using defaults", resource);
                return new Configuration();
            }
            return Json.obj(in, Configuration.class);
        } catch (IOException e) {
            logger.error("Failed to read {}: {}", resource, e.getMessage(), e);
            return new Configuration();
        }
    }

    public Element evaluate(Element expr) {
        return evaluator.evaluate(expr);
    }

    public Element tryEvaluate(Element expr, Element fallback) {
        return evaluator.tryEvaluate(expr, fallback);
    }

    public String format(Element expr) {
        return evaluator.format(expr);
    }

    public Matcher.MatchResult match(Element pattern, Element expr) {
        return evaluator.match(pattern, expr);
    }

    public void defineOwnValue(Symbol symbol, Element value) {
        context.defineOwnValue(symbol, value);
    }

    public void defineDownValue(Symbol symbol, Element pattern, Element replacement) {
        context.defineDownValue(symbol, pattern, replacement);
    }

    public void defineDownValue(Symbol symbol, Element pattern, Element replacement, Element condition) {
        context.defineDownValue(symbol, pattern, replacement, condition);
    }

    public void setAttributes(Symbol symbol, Set<Symbol> attributes) {
        context.setAttributes(symbol, attributes);
    }

    public EvaluationContext context() {
        return context;
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public Configuration configuration() {
        return configuration;
    }

    /**
     * Applies a JSON configuration update; absent keys fall back to the defaults.
     *
     * @throws IllegalArgumentException if the limits are out of range; nothing changes then
     */
    public void updateConfig(String json) throws JsonProcessingException {
        var c = Json.obj(json, Configuration.class);
        var limits = c.limits();
        if (!c.contextName().equals(context.name()))
            logger.warn("contextName {} ignored, the kernel keeps context {}", c.contextName(), context.name());
        configuration = new Configuration(context.name(), c.recursionLimit(), c.iterationLimit());
        evaluator = new Evaluator(context, builtins, limits);
        logger.info("Configuration updated: recursionLimit={}, iterationLimit={}", c.recursionLimit(), c.iterationLimit());
    }

    public JsonNode toJson() {
        var n = Json.node();
        n.set("configuration", Json.node(configuration));
        n.set("context", context.toJson());
        n.put("builtins", builtins.size());
        return n;
    }

    public record Configuration(
            @JsonProperty("contextName") String contextName,
            @JsonProperty("recursionLimit") int recursionLimit,
            @JsonProperty("iterationLimit") int iterationLimit
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("contextName") String contextName,
                @JsonProperty("recursionLimit") Integer recursionLimit,
                @JsonProperty("iterationLimit") Integer iterationLimit
        ) {
            this(
                    contextName != null ? contextName : DEFAULT_CONTEXT_NAME,
                    recursionLimit != null ? recursionLimit : Evaluator.Limits.DEFAULT_RECURSION_LIMIT,
                    iterationLimit != null ? iterationLimit : Evaluator.Limits.DEFAULT_ITERATION_LIMIT
            );
        }

        public Configuration() {
            this(DEFAULT_CONTEXT_NAME, Evaluator.Limits.DEFAULT_RECURSION_LIMIT, Evaluator.Limits.DEFAULT_ITERATION_LIMIT);
        }

        public Configuration(String contextName, int recursionLimit, int iterationLimit) {
            this.contextName = contextName;
            this.recursionLimit = recursionLimit;
            this.iterationLimit = iterationLimit;
        }

        /** @throws IllegalArgumentException for out-of-range limits */
        public Evaluator.Limits limits() {
            return new Evaluator.Limits(recursionLimit, iterationLimit);
        }
    }
}
