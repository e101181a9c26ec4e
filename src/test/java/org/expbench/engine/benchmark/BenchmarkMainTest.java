package org.expbench.engine.benchmark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.expbench.engine.assembly.QueryKey;
import org.expbench.engine.assembly.Variant;
import org.expbench.engine.execution.JdbcQueryExecutor;
import org.expbench.engine.window.Approach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkMainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private int run(String... args) {
        return BenchmarkMain.run(args, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    // ==================== Usage ====================

    @Nested
    @DisplayName("Usage errors")
    class Usage {

        @Test
        @DisplayName("A missing command prints usage and exits with 2")
        void testNoCommand() {
            assertEquals(BenchmarkMain.EXIT_USAGE, run());
            assertTrue(output().contains("Usage: expbench"));
        }

        @Test
        @DisplayName("Unknown commands and options exit with 2")
        void testUnknown() {
            assertEquals(BenchmarkMain.EXIT_USAGE, run("explain"));
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--verbose"));
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--runs", "many"));
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--output"));
        }

        @Test
        @DisplayName("Configuration errors exit with 2")
        void testConfigurationErrors(@TempDir Path dir) {
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--engine", "oracle"));
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--experiments", "missing"));
            assertEquals(BenchmarkMain.EXIT_USAGE, run("render", "--tdigest"));
            assertEquals(BenchmarkMain.EXIT_USAGE,
                    run("render", "--experiments-file", dir.resolve("absent.yaml").toString()));
            assertTrue(output().contains("Configuration error"));
        }

        @Test
        @DisplayName("Help exits with 0")
        void testHelp() {
            assertEquals(BenchmarkMain.EXIT_OK, run("--help"));
            assertTrue(output().contains("--approach <ondemand|preagg|both>"));
        }
    }

    // ==================== Commands ====================

    @Test
    @DisplayName("render writes one file per query, the manifest and the pipeline script")
    void testRender(@TempDir Path dir) throws IOException {
        int exit = run("render", "--output", dir.toString(), "--experiments", "base,dimension_browser");

        assertEquals(BenchmarkMain.EXIT_OK, exit);
        assertTrue(Files.exists(dir.resolve("ondemand/base/revenue.sql")));
        assertTrue(Files.exists(dir.resolve("preagg/dimension_browser/revenue__weighted.sql")));
        assertFalse(Files.exists(dir.resolve("preagg/base/order_amount_p90__weighted.sql")));
        assertTrue(Files.readString(dir.resolve(SqlArtifactWriter.PIPELINE_SCRIPT)).contains("-- shared_exposures"));

        JsonNode manifest = new ObjectMapper().readTree(dir.resolve(SqlArtifactWriter.MANIFEST).toFile());
        assertTrue(manifest.isArray());
        assertEquals("base", manifest.get(0).get("experiment").asText());
        assertTrue(output().contains("skipped"));
    }

    @Test
    @DisplayName("render can be restricted to one approach")
    void testRenderOneApproach(@TempDir Path dir) {
        assertEquals(BenchmarkMain.EXIT_OK,
                run("render", "--output", dir.toString(), "--experiments", "base", "--approach", "ondemand"));

        assertTrue(Files.exists(dir.resolve("ondemand/base/purchased.sql")));
        assertFalse(Files.exists(dir.resolve("preagg")));
    }

    @Test
    @DisplayName("pipeline prints the build script")
    void testPipelineScript() {
        assertEquals(BenchmarkMain.EXIT_OK, run("pipeline", "--engine", "postgres", "--tdigest"));

        assertTrue(output().contains("CREATE TABLE \"shared_exposures\" AS"));
        assertTrue(output().contains("CREATE EXTENSION IF NOT EXISTS tdigest;"));
    }

    @Test
    @DisplayName("Artifact paths encode approach, experiment, metric and variant")
    void testRelativePath() {
        assertEquals("ondemand/base/revenue.sql",
                SqlArtifactWriter.relativePath(new QueryKey("base", "revenue", Approach.ONDEMAND, Variant.STANDARD)));
        assertEquals("preagg/base/revenue__unweighted.sql",
                SqlArtifactWriter.relativePath(new QueryKey("base", "revenue", Approach.PREAGG, Variant.UNWEIGHTED)));
    }

    @Test
    @DisplayName("run builds the pipeline, times every query and writes the report")
    void testRun(@TempDir Path dir) throws SQLException, IOException {
        // GIVEN a DuckDB file with two users whose orders fall mid-window
        Path database = dir.resolve("bench.duckdb");
        try (JdbcQueryExecutor executor = JdbcQueryExecutor.connect(database.toString(), 0)) {
            executor.execute("""
                    CREATE TABLE viewed_experiment (
                      user_id VARCHAR, anonymous_id VARCHAR, "timestamp" TIMESTAMP,
                      experiment_id VARCHAR, variation_id VARCHAR)
                    """);
            executor.execute("""
                    INSERT INTO viewed_experiment VALUES
                      ('u1', 'a1', TIMESTAMP '2022-01-02 00:00:00', 'exp', '0'),
                      ('u2', 'a2', TIMESTAMP '2022-01-03 00:00:00', 'exp', '1')
                    """);
            executor.execute("CREATE TABLE orders (user_id VARCHAR, \"timestamp\" TIMESTAMP, amount INTEGER)");
            executor.execute("""
                    INSERT INTO orders VALUES
                      ('u1', TIMESTAMP '2022-01-03 10:00:00', 20),
                      ('u2', TIMESTAMP '2022-01-04 10:00:00', 35)
                    """);
        }
        Path experiments = Files.writeString(dir.resolve("experiments.yaml"), """
                experiments:
                  - id: exp
                    start_date: "2022-01-01"
                    end_date: "2022-01-11"
                """);
        Path metrics = Files.writeString(dir.resolve("metrics.yaml"), """
                metrics:
                  - id: purchased
                    type: binomial
                    table: orders
                  - id: revenue
                    type: count
                    table: orders
                    value: amount
                """);
        Path output = dir.resolve("out");

        // WHEN
        int exit = run("run", "--target", database.toString(), "--output", output.toString(),
                "--experiments-file", experiments.toString(), "--metrics-file", metrics.toString(),
                "--warmup", "0", "--runs", "1", "--validate");

        // THEN every query ran and every pre-agg result matched
        assertEquals(BenchmarkMain.EXIT_OK, exit, output());
        JsonNode report = new ObjectMapper().readTree(output.resolve(BenchmarkMain.REPORT_FILE).toFile());
        assertEquals(6, report.get("queries").size());
        assertEquals(0, report.get("summary").get("failedQueries").asInt());
        assertEquals(4, report.get("validation").get("passed").asInt());
        assertTrue(output().contains("Benchmark summary (duckdb)"));
    }
}
