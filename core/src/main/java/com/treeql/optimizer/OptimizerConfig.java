package com.treeql.optimizer;

/**
 * Settings of the {@link QueryOptimizer}.
 *
 * <p>Values can be given explicitly or read from system properties:
 * <ul>
 *   <li>{@code treeql.optimizer.maxIterations}: upper bound on fixpoint iterations</li>
 *   <li>{@code treeql.optimizer.dumpTrees}: log the full tree after every change</li>
 * </ul>
 */
public final class OptimizerConfig {

    public static final String MAX_ITERATIONS_PROPERTY = "treeql.optimizer.maxIterations";
    public static final String DUMP_TREES_PROPERTY = "treeql.optimizer.dumpTrees";

    /** Default iteration bound */
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    /** Hard cap on iterations, so a pair of rules undoing each other cannot stall compilation */
    public static final int MAX_ITERATIONS_LIMIT = 1000;

    private static final OptimizerConfig DEFAULTS = new OptimizerConfig(DEFAULT_MAX_ITERATIONS, false);

    private final int maxIterations;
    private final boolean dumpTrees;

    /**
     * Creates a configuration. The iteration bound is normalized with
     * {@link #normalizeMaxIterations(int)}.
     *
     * @param maxIterations the requested iteration bound
     * @param dumpTrees whether to log tree dumps at DEBUG level
     */
    public OptimizerConfig(int maxIterations, boolean dumpTrees) {
        this.maxIterations = normalizeMaxIterations(maxIterations);
        this.dumpTrees = dumpTrees;
    }

    public static OptimizerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the configuration from system properties. Missing properties fall
     * back to the defaults.
     *
     * @return the configuration
     * @throws IllegalArgumentException if the iteration bound is not an integer
     */
    public static OptimizerConfig fromSystemProperties() {
        String iterations = System.getProperty(MAX_ITERATIONS_PROPERTY);
        int maxIterations = DEFAULT_MAX_ITERATIONS;
        if (iterations != null && !iterations.isBlank()) {
            try {
                maxIterations = Integer.parseInt(iterations.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for %s: '%s'".formatted(MAX_ITERATIONS_PROPERTY, iterations), e);
            }
        }
        boolean dumpTrees = Boolean.parseBoolean(System.getProperty(DUMP_TREES_PROPERTY, "false").trim());
        return new OptimizerConfig(maxIterations, dumpTrees);
    }

    /**
     * Validate and normalize an iteration bound.
     *
     * @param requested the requested bound
     * @return the default for non-positive requests, otherwise the request capped at {@link #MAX_ITERATIONS_LIMIT}
     */
    public static int normalizeMaxIterations(int requested) {
        if (requested <= 0) return DEFAULT_MAX_ITERATIONS;
        return Math.min(requested, MAX_ITERATIONS_LIMIT);
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean dumpTrees() {
        return dumpTrees;
    }

    public OptimizerConfig withMaxIterations(int newMaxIterations) {
        return new OptimizerConfig(newMaxIterations, dumpTrees);
    }

    public OptimizerConfig withDumpTrees(boolean newDumpTrees) {
        return new OptimizerConfig(maxIterations, newDumpTrees);
    }

    @Override
    public String toString() {
        return "OptimizerConfig(maxIterations=" + maxIterations + ", dumpTrees=" + dumpTrees + ")";
    }
}
