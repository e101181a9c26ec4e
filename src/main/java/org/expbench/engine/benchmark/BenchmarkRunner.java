package org.expbench.engine.benchmark;

import org.expbench.engine.assembly.QueryKey;
import org.expbench.engine.assembly.RenderBatch;
import org.expbench.engine.assembly.RenderedQuery;
import org.expbench.engine.config.BenchmarkSettings;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.execution.QueryExecutor;
import org.expbench.engine.execution.RelationResult;
import org.expbench.engine.pipeline.PipelineBuilder;
import org.expbench.engine.pipeline.PipelineResult;
import org.expbench.engine.pipeline.PipelineStatement;
import org.expbench.engine.validation.EquivalenceValidator;
import org.expbench.engine.validation.ValidationReport;
import org.expbench.engine.validation.ValidationResult;
import org.expbench.engine.window.Approach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a rendered suite sequentially against one executor: the pipeline first, then
 * every query with warmup and timed runs, then (optionally) the equivalence checks.
 *
 * <p>A failing query is recorded and the run continues. When the pipeline fails, every
 * pre-agg query is recorded as failed without being executed.</p>
 */
public final class BenchmarkRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BenchmarkRunner.class);

    static final int PROGRESS_INTERVAL = 50;

    private final QueryExecutor executor;
    private final BenchmarkSettings settings;

    public BenchmarkRunner(QueryExecutor executor, BenchmarkSettings settings) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    public BenchmarkReport run(ExperimentSuite suite, RenderBatch batch,
                               List<PipelineStatement> pipeline, boolean validate) {
        boolean needsPipeline = batch.queries().stream()
                .anyMatch(q -> q.key().approach() == Approach.PREAGG);
        PipelineResult pipelineResult = needsPipeline && !pipeline.isEmpty()
                ? new PipelineBuilder(executor).build(pipeline)
                : new PipelineResult(Map.of(), null);

        Map<QueryKey, RelationResult> results = new LinkedHashMap<>();
        List<QueryTiming> timings = new ArrayList<>();
        int total = batch.queries().size();
        for (int i = 0; i < total; i++) {
            RenderedQuery query = batch.queries().get(i);
            QueryTiming timing;
            if (query.key().approach() == Approach.PREAGG && !pipelineResult.succeeded()) {
                timing = QueryTiming.failed(query.key(),
                        "Pipeline precondition failed: " + pipelineResult.failure().getMessage());
            } else {
                timing = time(query, results);
            }
            timings.add(timing);
            if (i == 0 || (i + 1) % PROGRESS_INTERVAL == 0 || i + 1 == total) {
                LOG.info("[{}/{}] {}: {}", i + 1, total, query.key(),
                        timing.succeeded() ? String.format("%.4f s", timing.medianSeconds()) : "failed");
            }
        }

        ValidationReport validation = validate ? validate(suite, batch, results) : null;
        if (validation != null) {
            LOG.info("Validation: {} compared, {} passed, {} mismatched, {} incomplete",
                    validation.totalComparisons(), validation.passed(),
                    validation.mismatched(), validation.incomplete());
        }

        return new BenchmarkReport(
                settings.engine(),
                pipelineResult.timings(),
                pipelineResult.succeeded() ? null : pipelineResult.failure().getMessage(),
                batch.skips(),
                timings,
                BenchmarkSummary.of(timings, pipelineResult.timings()),
                validation);
    }

    private QueryTiming time(RenderedQuery query, Map<QueryKey, RelationResult> results) {
        QueryKey key = query.key();
        for (int w = 0; w < settings.warmupRuns(); w++) {
            try {
                executor.executeQuery(query.sql());
            } catch (SQLException e) {
                LOG.debug("Warmup of {} failed: {}", key, e.getMessage());
                break;
            }
        }

        List<Double> runs = new ArrayList<>();
        List<Double> successful = new ArrayList<>();
        RelationResult last = null;
        String error = null;
        boolean timedOut = false;
        for (int r = 0; r < settings.timedRuns(); r++) {
            long start = System.nanoTime();
            try {
                last = executor.executeQuery(query.sql());
                double seconds = (System.nanoTime() - start) / 1e9;
                runs.add(seconds);
                successful.add(seconds);
            } catch (SQLTimeoutException e) {
                runs.add(-1.0);
                timedOut = true;
                error = "Timed out after " + settings.queryTimeoutSeconds() + " s";
                LOG.warn("{} timed out", key);
            } catch (SQLException e) {
                runs.add(-1.0);
                error = e.getMessage();
                LOG.warn("{} failed: {}", key, e.getMessage());
            }
        }

        if (last == null) {
            return new QueryTiming(key.experimentId(), key.metricId(), key.approach().key(), key.variant().key(),
                    -1, runs, 0, List.of(), error, timedOut);
        }
        results.put(key, last);
        double median = BenchmarkSummary.median(successful.stream().mapToDouble(Double::doubleValue).toArray());
        return new QueryTiming(key.experimentId(), key.metricId(), key.approach().key(), key.variant().key(),
                median, runs, last.rowCount(), firstRows(last), error, timedOut);
    }

    private ValidationReport validate(ExperimentSuite suite, RenderBatch batch, Map<QueryKey, RelationResult> results) {
        EquivalenceValidator validator = new EquivalenceValidator(settings.tolerances(), suite.metrics());
        List<ValidationResult> comparisons = new ArrayList<>();
        for (RenderedQuery query : batch.queries()) {
            QueryKey key = query.key();
            if (key.approach() != Approach.PREAGG) {
                continue;
            }
            comparisons.add(validator.validate(key,
                    suite.experiment(key.experimentId()),
                    suite.metrics().get(key.metricId()),
                    results.get(key.reference()),
                    results.get(key)));
        }
        return ValidationReport.of(comparisons);
    }

    private static List<Map<String, Object>> firstRows(RelationResult result) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : result.toMaps()) {
            if (rows.size() == QueryTiming.KEPT_ROWS) {
                break;
            }
            Map<String, Object> kept = new LinkedHashMap<>();
            row.forEach((column, value) -> kept.put(column, reportable(value)));
            rows.add(kept);
        }
        return rows;
    }

    private static Object reportable(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Integer || value instanceof Double) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value.toString();
    }
}
