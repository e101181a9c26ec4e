package org.expbench.engine.benchmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.expbench.engine.assembly.RenderSkip;
import org.expbench.engine.validation.ValidationReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a benchmark run produced, serialized as one JSON document.
 *
 * @param engine          Engine id
 * @param pipelineTimings Seconds per shared table, in build order
 * @param pipelineError   Pipeline failure, null when the pipeline was built or not needed
 * @param skipped         Combinations without a rendering
 * @param queries         Timings in execution order
 * @param summary         Totals and speedups
 * @param validation      Equivalence summary, null when validation was not requested
 */
public record BenchmarkReport(
        String engine,
        Map<String, Double> pipelineTimings,
        String pipelineError,
        List<RenderSkip> skipped,
        List<QueryTiming> queries,
        BenchmarkSummary summary,
        ValidationReport validation) {

    static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public BenchmarkReport {
        pipelineTimings = Collections.unmodifiableMap(new LinkedHashMap<>(pipelineTimings));
        skipped = List.copyOf(skipped);
        queries = List.copyOf(queries);
    }

    /**
     * True when a query or the pipeline failed, or a comparison did not pass.
     */
    public boolean hasFailures() {
        return pipelineError != null
                || summary.failedQueries() > 0
                || (validation != null && validation.hasFailures());
    }

    public void write(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writeValue(file.toFile(), this);
    }

    public String toJson() throws IOException {
        return JSON.writeValueAsString(this);
    }
}
