package org.expbench.engine.window;

import org.expbench.engine.config.Attribution;
import org.expbench.engine.config.CupedSpec;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.transpiler.DuckDBDialect;
import org.expbench.engine.transpiler.SQLGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class WindowResolverTest {

    private static final LocalDateTime START = LocalDateTime.of(2022, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2022, 1, 11, 0, 0);

    private final SQLGenerator sql = new SQLGenerator(DuckDBDialect.INSTANCE);
    private final Expression exposure = ColumnReference.of("u", "first_exposure");

    private static ExperimentConfig experiment(Attribution attribution, int windowHours, int delayHours,
                                               Integer lookbackHours, boolean skipPartial, LocalDateTime end) {
        return new ExperimentConfig("exp", "exp", "viewed_experiment", ExperimentConfig.USER_ID,
                START, end, attribution, windowHours, delayHours, lookbackHours, skipPartial, null, null, null);
    }

    private static WindowResolver resolver(int windowHours, int delayHours) {
        return new WindowResolver(experiment(Attribution.FIRST_EXPOSURE, windowHours, delayHours, null, false, END));
    }

    // ==================== Day rounding ====================

    @ParameterizedTest(name = "delay {0}h -> {1} days")
    @CsvSource({"0, 0", "6, 1", "24, 1", "25, 2", "-12, -1", "-24, -1", "-36, -2"})
    @DisplayName("Delays round away from zero to whole days")
    void testDelayDays(int delayHours, long expectedDays) {
        assertEquals(expectedDays, resolver(72, delayHours).delayDays());
    }

    @ParameterizedTest(name = "window {0}h -> {1} days")
    @CsvSource({"24, 1", "48, 2", "72, 3", "6, 1", "30, 2", "168, 7"})
    @DisplayName("Window lengths round up to whole days")
    void testWindowDays(int windowHours, long expectedDays) {
        assertEquals(expectedDays, resolver(windowHours, 0).windowDays());
    }

    @Test
    @DisplayName("A midnight end date makes the previous day the last day")
    void testLastDay() {
        assertEquals(LocalDate.of(2022, 1, 10), resolver(72, 0).lastDay());

        WindowResolver midDay = new WindowResolver(experiment(Attribution.FIRST_EXPOSURE, 72, 0, null, false,
                LocalDateTime.of(2022, 1, 10, 12, 0)));
        assertEquals(LocalDate.of(2022, 1, 10), midDay.lastDay());
    }

    // ==================== Main windows ====================

    @Nested
    @DisplayName("On-demand windows")
    class OnDemand {

        @Test
        @DisplayName("First exposure window is [exposure + delay, exposure + delay + window)")
        void testFirstExposure() {
            WindowBounds bounds = resolver(72, 6).resolve(Approach.ONDEMAND, exposure);

            assertFalse(bounds.weightable());
            assertEquals("(u.\"first_exposure\" + INTERVAL 6 HOUR)", sql.generate(bounds.start()));
            assertEquals("(u.\"first_exposure\" + INTERVAL 78 HOUR)", sql.generate(bounds.end()));
        }

        @Test
        @DisplayName("Experiment duration windows end at the experiment end")
        void testExperimentDuration() {
            WindowBounds bounds = new WindowResolver(
                    experiment(Attribution.EXPERIMENT_DURATION, 72, 0, null, false, END))
                    .resolve(Approach.ONDEMAND, exposure);

            assertEquals("u.\"first_exposure\"", sql.generate(bounds.start()));
            assertEquals("TIMESTAMP '2022-01-11 00:00:00'", sql.generate(bounds.end()));
        }

        @Test
        @DisplayName("Lookback windows are fixed for every unit")
        void testLookback() {
            WindowBounds bounds = new WindowResolver(
                    experiment(Attribution.FIRST_EXPOSURE, 72, 0, 36, false, END))
                    .resolve(Approach.ONDEMAND, exposure);

            assertEquals("TIMESTAMP '2022-01-09 12:00:00'", sql.generate(bounds.start()));
            assertEquals("TIMESTAMP '2022-01-11 00:00:00'", sql.generate(bounds.end()));
        }

        @Test
        @DisplayName("Membership is half-open")
        void testContains() {
            WindowBounds bounds = resolver(24, 0).resolve(Approach.ONDEMAND, exposure);
            String condition = sql.generate(bounds.contains(ColumnReference.of("r", "timestamp")));

            assertEquals("(r.\"timestamp\" >= u.\"first_exposure\""
                    + " AND r.\"timestamp\" < (u.\"first_exposure\" + INTERVAL 24 HOUR))", condition);
        }
    }

    @Nested
    @DisplayName("Pre-aggregated windows")
    class PreAgg {

        @Test
        @DisplayName("Day windows start on the exposure day and carry a first-day fraction")
        void testFirstExposure() {
            WindowBounds bounds = resolver(72, 0).resolve(Approach.PREAGG, exposure);

            assertTrue(bounds.weightable());
            assertEquals("CAST(u.\"first_exposure\" AS DATE)", sql.generate(bounds.start()));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) + 3)", sql.generate(bounds.end()));
            assertEquals("((24 - EXTRACT(HOUR FROM u.\"first_exposure\")) / 24.0)",
                    sql.generate(bounds.firstDayFraction()));
        }

        @Test
        @DisplayName("Negative delays shift the start to an earlier day")
        void testNegativeDelay() {
            WindowBounds bounds = resolver(72, -12).resolve(Approach.PREAGG, exposure);

            assertEquals("(CAST(u.\"first_exposure\" AS DATE) - 1)", sql.generate(bounds.start()));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) + 2)", sql.generate(bounds.end()));
        }

        @Test
        @DisplayName("Lookback fraction is derived from the lookback start hour")
        void testLookbackFraction() {
            WindowBounds bounds = new WindowResolver(
                    experiment(Attribution.FIRST_EXPOSURE, 72, 0, 36, false, END))
                    .resolve(Approach.PREAGG, exposure);

            assertEquals("DATE '2022-01-09'", sql.generate(bounds.start()));
            assertEquals("DATE '2022-01-10'", sql.generate(bounds.end()));
            assertEquals("0.5", sql.generate(bounds.firstDayFraction()));
        }

        @Test
        @DisplayName("Membership is inclusive of the last day and weights only the first day")
        void testContainsAndWeight() {
            WindowBounds bounds = resolver(24, 0).resolve(Approach.PREAGG, exposure);
            ColumnReference day = ColumnReference.of("d", "metric_date");

            assertEquals("(d.\"metric_date\" >= CAST(u.\"first_exposure\" AS DATE)"
                            + " AND d.\"metric_date\" <= (CAST(u.\"first_exposure\" AS DATE) + 1))",
                    sql.generate(bounds.contains(day)));
            assertEquals("CASE WHEN d.\"metric_date\" = CAST(u.\"first_exposure\" AS DATE)"
                            + " THEN ((24 - EXTRACT(HOUR FROM u.\"first_exposure\")) / 24.0) ELSE 1.0 END",
                    sql.generate(bounds.firstDayWeight(day)));
        }
    }

    // ==================== Auxiliary windows ====================

    @Nested
    @DisplayName("Covariate, activation and completeness")
    class Auxiliary {

        @Test
        @DisplayName("Covariate windows end just before the exposure")
        void testCovariate() {
            WindowResolver resolver = resolver(72, 0);
            CupedSpec cuped = new CupedSpec(4);

            WindowBounds timestamps = resolver.covariate(Approach.ONDEMAND, exposure, cuped);
            assertEquals("(u.\"first_exposure\" - INTERVAL 96 HOUR)", sql.generate(timestamps.start()));
            assertEquals("u.\"first_exposure\"", sql.generate(timestamps.end()));

            WindowBounds days = resolver.covariate(Approach.PREAGG, exposure, cuped);
            assertFalse(days.weightable());
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) - 4)", sql.generate(days.start()));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) - 1)", sql.generate(days.end()));
        }

        @Test
        @DisplayName("Activation windows run from exposure to the experiment end")
        void testActivation() {
            WindowBounds bounds = resolver(72, 0).activation(Approach.PREAGG, exposure);

            assertEquals("CAST(u.\"first_exposure\" AS DATE)", sql.generate(bounds.start()));
            assertEquals("DATE '2022-01-10'", sql.generate(bounds.end()));
        }

        @Test
        @DisplayName("Skip-partial keeps only units whose window ends by the experiment end")
        void testCompleteWindowFilter() {
            WindowResolver skipping = new WindowResolver(
                    experiment(Attribution.FIRST_EXPOSURE, 72, 0, null, true, END));

            assertEquals("(u.\"first_exposure\" + INTERVAL 72 HOUR) <= TIMESTAMP '2022-01-11 00:00:00'",
                    sql.generate(skipping.completeWindowFilter(Approach.ONDEMAND, exposure)));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) + 3) <= DATE '2022-01-10'",
                    sql.generate(skipping.completeWindowFilter(Approach.PREAGG, exposure)));
        }

        @Test
        @DisplayName("No completeness filter without skip-partial or under duration attribution")
        void testNoCompleteWindowFilter() {
            assertNull(resolver(72, 0).completeWindowFilter(Approach.ONDEMAND, exposure));

            WindowResolver duration = new WindowResolver(
                    experiment(Attribution.EXPERIMENT_DURATION, 72, 0, null, true, END));
            assertNull(duration.completeWindowFilter(Approach.PREAGG, exposure));
        }
    }
}
