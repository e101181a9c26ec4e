package org.expbench.engine.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Run-level settings of a benchmark: target engine, timing and validation parameters.
 */
public record BenchmarkSettings(
        String engine,
        String target,
        Path outputDir,
        int warmupRuns,
        int timedRuns,
        int queryTimeoutSeconds,
        boolean approxQuantile,
        boolean tdigest,
        Tolerances tolerances) {

    public static final String DEFAULT_ENGINE = "duckdb";
    public static final String DEFAULT_TARGET = "jdbc:duckdb:";
    public static final Path DEFAULT_OUTPUT = Path.of("target", "expbench");

    public BenchmarkSettings {
        Objects.requireNonNull(engine, "Engine cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(outputDir, "Output directory cannot be null");
        Objects.requireNonNull(tolerances, "Tolerances cannot be null");
        if (warmupRuns < 0) {
            throw new ConfigException("warmup runs cannot be negative: " + warmupRuns);
        }
        if (timedRuns < 1) {
            throw new ConfigException("at least one timed run is required: " + timedRuns);
        }
        if (queryTimeoutSeconds < 0) {
            throw new ConfigException("query timeout cannot be negative: " + queryTimeoutSeconds);
        }
    }

    public static BenchmarkSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .engine(engine)
                .target(target)
                .outputDir(outputDir)
                .warmupRuns(warmupRuns)
                .timedRuns(timedRuns)
                .queryTimeoutSeconds(queryTimeoutSeconds)
                .approxQuantile(approxQuantile)
                .tdigest(tdigest)
                .tolerances(tolerances);
    }

    public static final class Builder {
        private String engine = DEFAULT_ENGINE;
        private String target = DEFAULT_TARGET;
        private Path outputDir = DEFAULT_OUTPUT;
        private int warmupRuns = 1;
        private int timedRuns = 3;
        private int queryTimeoutSeconds = 0;
        private boolean approxQuantile;
        private boolean tdigest;
        private Tolerances tolerances = Tolerances.DEFAULT;

        private Builder() {
        }

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder warmupRuns(int warmupRuns) {
            this.warmupRuns = warmupRuns;
            return this;
        }

        public Builder timedRuns(int timedRuns) {
            this.timedRuns = timedRuns;
            return this;
        }

        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        public Builder approxQuantile(boolean approxQuantile) {
            this.approxQuantile = approxQuantile;
            return this;
        }

        public Builder tdigest(boolean tdigest) {
            this.tdigest = tdigest;
            return this;
        }

        public Builder tolerances(Tolerances tolerances) {
            this.tolerances = tolerances;
            return this;
        }

        public BenchmarkSettings build() {
            return new BenchmarkSettings(engine, target, outputDir, warmupRuns, timedRuns,
                    queryTimeoutSeconds, approxQuantile, tdigest, tolerances);
        }
    }
}
