package org.pcc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pcc.compiler.backend.emit.JsonEscaping;
import org.pcc.compiler.optimizer.OptimizationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Typed view of the {@code pcc.compiler} configuration block.
 * <p>
 * Defaults live in {@code reference.conf}. {@link #load()} layers system properties
 * over {@code application.conf} over the defaults, so any key can be overridden with
 * {@code -Dpcc.compiler.<key>=<value>}.
 */
public final class CompilerOptions {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerOptions.class);
    private static final String ROOT = "pcc.compiler";

    private final int maxNestingDepth;
    private final Set<OptimizationPass> optimizationPasses;
    private final boolean descendIntoDefinitions;
    private final JsonEscaping jsonEscaping;

    private CompilerOptions(int maxNestingDepth, Set<OptimizationPass> optimizationPasses,
                            boolean descendIntoDefinitions, JsonEscaping jsonEscaping) {
        this.maxNestingDepth = maxNestingDepth;
        this.optimizationPasses = Collections.unmodifiableSet(optimizationPasses);
        this.descendIntoDefinitions = descendIntoDefinitions;
        this.jsonEscaping = jsonEscaping;
    }

    /**
     * Loads the options with the precedence system properties, application.conf, reference.conf.
     * @return The resolved options.
     */
    public static CompilerOptions load() {
        Config config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.load())
                .resolve();
        CompilerOptions options = from(config);
        LOG.info("Compiler options: maxNestingDepth={}, passes={}, descendIntoDefinitions={}, jsonEscaping={}",
                options.maxNestingDepth, options.optimizationPasses, options.descendIntoDefinitions, options.jsonEscaping);
        return options;
    }

    /**
     * @return The options defined by {@code reference.conf} alone.
     */
    public static CompilerOptions defaults() {
        return from(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options from an arbitrary config. Missing keys fall back to {@code reference.conf}.
     * @param config The config containing a {@code pcc.compiler} block.
     * @return The options.
     * @throws IllegalArgumentException if a value is missing, has the wrong type or names an unknown enum constant.
     */
    public static CompilerOptions from(Config config) {
        Config c = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        try {
            int depth = c.getInt("max-nesting-depth");
            if (depth < 1) {
                throw new IllegalArgumentException(ROOT + ".max-nesting-depth must be positive but was " + depth);
            }
            Set<OptimizationPass> passes = EnumSet.noneOf(OptimizationPass.class);
            passes.addAll(c.getEnumList(OptimizationPass.class, "optimizer.passes"));
            return new CompilerOptions(
                    depth,
                    passes,
                    c.getBoolean("optimizer.descend-into-definitions"),
                    c.getEnum(JsonEscaping.class, "codegen.json-escaping"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid compiler configuration: " + e.getMessage(), e);
        }
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    public Set<OptimizationPass> optimizationPasses() {
        return optimizationPasses;
    }

    public boolean descendIntoDefinitions() {
        return descendIntoDefinitions;
    }

    public JsonEscaping jsonEscaping() {
        return jsonEscaping;
    }

    private Set<OptimizationPass> copyPasses() {
        Set<OptimizationPass> copy = EnumSet.noneOf(OptimizationPass.class);
        copy.addAll(optimizationPasses);
        return copy;
    }

    /**
     * @return A copy of these options with a different escaping mode.
     */
    public CompilerOptions withJsonEscaping(JsonEscaping escaping) {
        return new CompilerOptions(maxNestingDepth, copyPasses(), descendIntoDefinitions, escaping);
    }

    /**
     * @return A copy of these options with a different optimizer coverage.
     */
    public CompilerOptions withDescendIntoDefinitions(boolean descend) {
        return new CompilerOptions(maxNestingDepth, copyPasses(), descend, jsonEscaping);
    }
}
