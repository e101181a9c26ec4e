package org.expbench.engine.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a pipeline build.
 *
 * @param timings Seconds spent per shared table, in build order
 * @param failure The build failure, or null when every table was built
 */
public record PipelineResult(Map<String, Double> timings, PipelineException failure) {

    public PipelineResult {
        timings = Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }

    public boolean succeeded() {
        return failure == null;
    }

    public double totalSeconds() {
        return timings.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
