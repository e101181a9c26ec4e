package org.expbench.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private static final String METRICS = """
            metrics:
              - id: purchased
                type: binomial
                table: orders
            """;

    private static ExperimentSuite experiments(String yaml) {
        return ConfigLoader.parse(yaml, METRICS);
    }

    // ==================== Bundled configuration ====================

    @Nested
    @DisplayName("Bundled configuration")
    class Bundled {

        @Test
        @DisplayName("Loads every experiment and metric from the classpath")
        void testLoadDefault() {
            ExperimentSuite suite = ConfigLoader.loadDefault();

            assertEquals(22, suite.experiments().size());
            assertEquals(33, suite.metrics().size());
        }

        @Test
        @DisplayName("Entries inherit the defaults block")
        void testDefaultsInherited() {
            ExperimentSuite suite = ConfigLoader.loadDefault();
            ExperimentConfig window = suite.experiment("window_24h");

            assertEquals("checkout-layout", window.experimentId());
            assertEquals(24, window.conversionWindowHours());
            assertEquals(LocalDateTime.of(2021, 10, 1, 0, 0), window.startDate());
            assertEquals(Attribution.FIRST_EXPOSURE, window.attribution());
            assertEquals(72, suite.experiment("base").conversionWindowHours());
        }

        @Test
        @DisplayName("Filtering by metric keeps ratio and threshold dependencies")
        void testFilterKeepsDependencies() {
            ExperimentSuite filtered = ConfigLoader.loadDefault()
                    .filter(List.of("base"), List.of("revenue_per_order", "big_spender"));

            assertEquals(1, filtered.experiments().size());
            assertTrue(filtered.metrics().contains("revenue"));
            assertTrue(filtered.metrics().contains("order_count"));
            assertFalse(filtered.metrics().contains("purchased"));
        }

        @Test
        @DisplayName("Unknown experiment ids are rejected")
        void testUnknownExperiment() {
            ExperimentSuite suite = ConfigLoader.loadDefault();
            assertThrows(ConfigException.class, () -> suite.filter(List.of("nope"), List.of()));
        }
    }

    // ==================== Experiments ====================

    @Nested
    @DisplayName("Experiment validation")
    class Experiments {

        @Test
        @DisplayName("Delay and lookback cannot be combined")
        void testDelayWithLookback() {
            ConfigException e = assertThrows(ConfigException.class, () -> experiments("""
                    experiments:
                      - id: bad
                        start_date: "2022-01-01"
                        end_date: "2022-01-11"
                        delay_hours: 6
                        lookback_hours: 48
                    """));
            assertTrue(e.getMessage().contains("bad"));
        }

        @Test
        @DisplayName("End must follow start")
        void testEndBeforeStart() {
            assertThrows(ConfigException.class, () -> experiments("""
                    experiments:
                      - id: bad
                        start_date: "2022-01-11"
                        end_date: "2022-01-01"
                    """));
        }

        @Test
        @DisplayName("Timestamps with a time of day are parsed")
        void testTimestampBounds() {
            ExperimentConfig experiment = experiments("""
                    experiments:
                      - id: mid_day
                        start_date: "2022-01-01 06:00:00"
                        end_date: "2022-01-10T18:00:00"
                    """).experiment("mid_day");

            assertEquals(LocalDateTime.of(2022, 1, 1, 6, 0), experiment.startDate());
            assertEquals(LocalDateTime.of(2022, 1, 10, 18, 0), experiment.endDate());
        }

        @Test
        @DisplayName("Activation dimensions need an activation")
        void testActivationDimensionWithoutActivation() {
            assertThrows(ConfigException.class, () -> experiments("""
                    experiments:
                      - id: bad
                        start_date: "2022-01-01"
                        end_date: "2022-01-11"
                        dimension:
                          type: activation
                    """));
        }

        @Test
        @DisplayName("Segments, activations and dimensions are parsed")
        void testOptionalBlocks() {
            ExperimentConfig experiment = experiments("""
                    experiments:
                      - id: full
                        exposure_id: anonymous_id
                        start_date: "2022-01-01"
                        end_date: "2022-01-11"
                        skip_partial_data: true
                        segment:
                          name: chrome
                          table: viewed_experiment
                          where: "browser = 'Chrome'"
                        activation:
                          name: carted
                          table: events
                          where: "event = 'Add to Cart'"
                        dimension:
                          type: attribute
                          table: sessions
                          column: browser
                    """).experiment("full");

            assertFalse(experiment.keyedByUser());
            assertTrue(experiment.populationIsApproximate());
            assertEquals("user_id", experiment.segment().idColumn());
            assertEquals("timestamp", experiment.activation().timestampColumn());
            assertEquals(DimensionType.ATTRIBUTE, experiment.dimension().type());
        }

        @Test
        @DisplayName("Duplicate experiment ids are rejected")
        void testDuplicateIds() {
            assertThrows(ConfigException.class, () -> experiments("""
                    experiments:
                      - id: twice
                        start_date: "2022-01-01"
                        end_date: "2022-01-11"
                      - id: twice
                        start_date: "2022-01-01"
                        end_date: "2022-01-11"
                    """));
        }
    }

    // ==================== Metrics ====================

    @Nested
    @DisplayName("Metric validation")
    class Metrics {

        private static final String EXPERIMENTS = """
                experiments:
                  - id: exp
                    start_date: "2022-01-01"
                    end_date: "2022-01-11"
                """;

        @Test
        @DisplayName("Ratios must reference known metrics")
        void testUnknownRatioComponent() {
            ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.parse(EXPERIMENTS, """
                    metrics:
                      - id: purchased
                        type: binomial
                        table: orders
                      - id: broken_ratio
                        type: ratio
                        numerator: purchased
                        denominator: missing
                    """));
            assertTrue(e.getMessage().contains("missing"));
        }

        @Test
        @DisplayName("Unknown metric types list the allowed values")
        void testUnknownType() {
            ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.parse(EXPERIMENTS, """
                    metrics:
                      - id: odd
                        type: histogram
                        table: orders
                    """));
            assertTrue(e.getMessage().contains("binomial"));
        }

        @Test
        @DisplayName("Capping percentile must lie strictly between 0 and 1")
        void testCapRange() {
            assertThrows(ConfigException.class, () -> ConfigLoader.parse(EXPERIMENTS, """
                    metrics:
                      - id: revenue
                        type: count
                        table: orders
                        value: amount
                        capping:
                          percentile: 1.5
                    """));
        }

        @Test
        @DisplayName("Quantile metrics require a quantile")
        void testQuantileRequired() {
            assertThrows(ConfigException.class, () -> ConfigLoader.parse(EXPERIMENTS, """
                    metrics:
                      - id: p
                        type: quantile
                        table: orders
                        value: amount
                    """));
        }

        @Test
        @DisplayName("CUPED defaults to a four-day lookback")
        void testCupedDefaults() {
            MetricCatalog catalog = ConfigLoader.parse(EXPERIMENTS, """
                    metrics:
                      - id: revenue
                        type: count
                        table: orders
                        value: amount
                        cuped:
                          enabled: true
                    """).metrics();

            assertEquals(CupedSpec.DEFAULT_LOOKBACK_DAYS, catalog.get("revenue").cuped().lookbackDays());
            assertEquals(Rollup.SUM, catalog.get("revenue").effectiveRollup());
        }
    }

    // ==================== Settings ====================

    @Test
    @DisplayName("Settings files override defaults")
    void testLoadSettings(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("settings.yaml");
        Files.writeString(file, """
                engine: postgres
                target: "postgresql://bench@localhost/bench"
                timed_runs: 5
                query_timeout_seconds: 30
                tolerances:
                  weighted: 0.02
                """);

        BenchmarkSettings settings = ConfigLoader.loadSettings(file);

        assertEquals("postgres", settings.engine());
        assertEquals(5, settings.timedRuns());
        assertEquals(1, settings.warmupRuns());
        assertEquals(30, settings.queryTimeoutSeconds());
        assertEquals(0.02, settings.tolerances().weighted());
        assertEquals(Tolerances.DEFAULT.unweighted(), settings.tolerances().unweighted());
    }

    @Test
    @DisplayName("Missing settings files are reported")
    void testMissingSettings(@TempDir Path dir) {
        assertThrows(ConfigException.class, () -> ConfigLoader.loadSettings(dir.resolve("absent.yaml")));
    }
}
