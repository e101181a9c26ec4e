package org.expbench.engine.benchmark;

import org.expbench.engine.assembly.QueryKey;
import org.expbench.engine.assembly.RenderBatch;
import org.expbench.engine.assembly.RenderSkip;
import org.expbench.engine.assembly.RenderedQuery;
import org.expbench.engine.assembly.Variant;
import org.expbench.engine.config.BenchmarkSettings;
import org.expbench.engine.config.ConfigLoader;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.execution.RelationResult;
import org.expbench.engine.execution.ScriptedQueryExecutor;
import org.expbench.engine.pipeline.PipelineStatement;
import org.expbench.engine.validation.Verdict;
import org.expbench.engine.window.Approach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runner tests against a scripted executor: no database is involved.
 */
class BenchmarkRunnerTest {

    private static final String EXPERIMENTS = """
            experiments:
              - id: exp
                start_date: "2022-01-01"
                end_date: "2022-01-11"
            """;

    private static final String METRICS = """
            metrics:
              - id: revenue
                type: count
                table: orders
                value: amount
            """;

    private static final QueryKey ONDEMAND = new QueryKey("exp", "revenue", Approach.ONDEMAND, Variant.STANDARD);
    private static final QueryKey UNWEIGHTED = new QueryKey("exp", "revenue", Approach.PREAGG, Variant.UNWEIGHTED);

    private static final List<PipelineStatement> PIPELINE = List.of(
            new PipelineStatement("shared_metrics_daily", List.of("DROP daily", "CREATE daily")));

    private ExperimentSuite suite;
    private BenchmarkSettings settings;
    private RenderBatch batch;

    @BeforeEach
    void setUp() {
        suite = ConfigLoader.parse(EXPERIMENTS, METRICS);
        settings = BenchmarkSettings.builder().warmupRuns(1).timedRuns(3).queryTimeoutSeconds(5).build();
        batch = new RenderBatch(
                List.of(new RenderedQuery(ONDEMAND, "SELECT ondemand"), new RenderedQuery(UNWEIGHTED, "SELECT preagg")),
                List.of(new RenderSkip(new QueryKey("exp", "revenue", Approach.PREAGG, Variant.WEIGHTED), "not needed")));
    }

    private static RelationResult revenue(double sum) {
        return new RelationResult(
                List.of(new RelationResult.Column("variation", "VARCHAR"),
                        new RelationResult.Column("users", "BIGINT"),
                        new RelationResult.Column("main_sum", "DECIMAL")),
                List.of(new RelationResult.Row(List.of("0", 10L, BigDecimal.valueOf(sum)))));
    }

    @Nested
    @DisplayName("Timing")
    class Timing {

        @Test
        @DisplayName("Each query gets warmups, timed runs and a median")
        void testTimedRuns() {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor().returnByDefault(revenue(100.0));

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, false);

            // GIVEN 1 warmup and 3 timed runs per query, plus two pipeline statements
            assertEquals(2 + 2 * 4, executor.executed().size());
            assertEquals(2, report.queries().size());
            QueryTiming timing = report.queries().get(0);
            assertTrue(timing.succeeded());
            assertEquals(3, timing.timings().size());
            assertEquals(1, timing.rowCount());
            // decimals are reported as plain numbers
            assertEquals(100.0, timing.rows().get(0).get("main_sum"));
            assertEquals(1, report.skipped().size());
            assertNull(report.validation());
            assertFalse(report.hasFailures());
        }

        @Test
        @DisplayName("Timeouts are recorded per run and the run continues")
        void testTimeout() {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
                    .returnByDefault(revenue(100.0))
                    .failOn("SELECT ondemand", new SQLTimeoutException("canceled"));

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, false);

            QueryTiming timedOut = report.queries().get(0);
            assertTrue(timedOut.timedOut());
            assertEquals("Timed out after 5 s", timedOut.error());
            assertEquals(List.of(-1.0, -1.0, -1.0), timedOut.timings());
            assertEquals(-1.0, timedOut.medianSeconds());
            assertTrue(report.queries().get(1).succeeded());
            assertEquals(1, report.summary().failedQueries());
            assertTrue(report.hasFailures());
        }

        @Test
        @DisplayName("Only five result rows are kept")
        void testKeptRows() {
            List<RelationResult.Row> rows = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                rows.add(new RelationResult.Row(List.of(String.valueOf(i))));
            }
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor().returnByDefault(
                    new RelationResult(List.of(new RelationResult.Column("variation", "VARCHAR")), rows));

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, false);

            assertEquals(8, report.queries().get(0).rowCount());
            assertEquals(QueryTiming.KEPT_ROWS, report.queries().get(0).rows().size());
        }
    }

    @Nested
    @DisplayName("Pipeline and validation")
    class PipelineAndValidation {

        @Test
        @DisplayName("A failed pipeline fails every pre-agg query without running it")
        void testPipelineFailure() {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
                    .returnByDefault(revenue(100.0))
                    .failOn("CREATE daily", new SQLException("no such table: orders"));

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, true);

            assertTrue(report.pipelineError().contains("shared_metrics_daily"));
            assertTrue(report.queries().get(0).succeeded());
            QueryTiming preagg = report.queries().get(1);
            assertTrue(preagg.error().startsWith("Pipeline precondition failed"));
            assertFalse(executor.executed().contains("SELECT preagg"));
            assertEquals(Verdict.INCOMPLETE, report.validation().failures().get(0).verdict());
            assertTrue(report.hasFailures());
        }

        @Test
        @DisplayName("On-demand-only runs skip the pipeline")
        void testNoPipelineNeeded() {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor().returnByDefault(revenue(100.0));
            RenderBatch onDemandOnly = new RenderBatch(List.of(new RenderedQuery(ONDEMAND, "SELECT ondemand")), List.of());

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, onDemandOnly, PIPELINE, false);

            assertTrue(report.pipelineTimings().isEmpty());
            assertFalse(executor.executed().contains("CREATE daily"));
        }

        @Test
        @DisplayName("Pre-agg results are validated against the on-demand result")
        void testValidation() {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor()
                    .returnOn("ondemand", revenue(100.0))
                    .returnOn("preagg", revenue(150.0));

            BenchmarkReport report = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, true);

            assertEquals(1, report.validation().totalComparisons());
            assertEquals(1, report.validation().mismatched());
            assertEquals(1, report.validation().farAbove10Pct());
            assertTrue(report.hasFailures());
        }

        @Test
        @DisplayName("The report serializes to JSON")
        void testJson() throws IOException {
            ScriptedQueryExecutor executor = new ScriptedQueryExecutor().returnByDefault(revenue(100.0));

            String json = new BenchmarkRunner(executor, settings).run(suite, batch, PIPELINE, true).toJson();

            assertTrue(json.contains("\"engine\" : \"duckdb\""));
            assertTrue(json.contains("\"speedupAnalysisOnly\""));
            assertTrue(json.contains("\"shared_metrics_daily\""));
        }
    }

    @Test
    @DisplayName("Medians of even-sized samples average the middle pair")
    void testMedian() {
        assertEquals(0.0, BenchmarkSummary.median(new double[0]));
        assertEquals(2.0, BenchmarkSummary.median(new double[]{3.0, 1.0, 2.0}));
        assertEquals(2.5, BenchmarkSummary.median(new double[]{4.0, 1.0, 2.0, 3.0}));
    }
}
