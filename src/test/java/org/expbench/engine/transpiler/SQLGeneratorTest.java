package org.expbench.engine.transpiler;

import org.expbench.engine.plan.AggregateExpression;
import org.expbench.engine.plan.ArithmeticExpression;
import org.expbench.engine.plan.CaseExpression;
import org.expbench.engine.plan.CastExpression;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.DateAdjustExpression;
import org.expbench.engine.plan.DatePartExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.plan.LogicalExpression;
import org.expbench.engine.plan.PercentileExpression;
import org.expbench.engine.plan.RawSqlExpression;
import org.expbench.engine.plan.SqlFunctionCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SQLGenerator and the dialect fragments it delegates to.
 */
class SQLGeneratorTest {

    private SQLGenerator duckdb;
    private SQLGenerator postgres;

    private final Expression timestamp = ColumnReference.of("u", "first_exposure");

    @BeforeEach
    void setUp() {
        duckdb = new SQLGenerator(DuckDBDialect.INSTANCE);
        postgres = new SQLGenerator(PostgresDialect.INSTANCE);
    }

    // ==================== Expressions ====================

    @Test
    @DisplayName("Column references quote the column but not the alias")
    void testColumnReference() {
        assertEquals("u.\"unit_id\"", duckdb.generate(ColumnReference.of("u", "unit_id")));
        assertEquals("\"variation\"", duckdb.generate(ColumnReference.of("variation")));
    }

    @Test
    @DisplayName("Literals render with typed prefixes and plain decimals")
    void testLiterals() {
        assertEquals("'it''s'", duckdb.generate(Literal.string("it's")));
        assertEquals("24.0", duckdb.generate(Literal.decimal(24.0)));
        assertEquals("0.9", duckdb.generate(Literal.decimal(0.9)));
        assertEquals("TRUE", duckdb.generate(Literal.bool(true)));
        assertEquals("NULL", postgres.generate(Literal.nullValue()));
        assertEquals("DATE '2022-01-10'", duckdb.generate(Literal.date(LocalDate.of(2022, 1, 10))));
        assertEquals("TIMESTAMP '2022-01-11 00:00:00'",
                duckdb.generate(Literal.timestamp(LocalDateTime.of(2022, 1, 11, 0, 0))));
    }

    @Test
    @DisplayName("Window membership renders as a half-open range")
    void testRangeCondition() {
        Expression point = ColumnReference.of("r", "event_timestamp");
        Expression condition = LogicalExpression.and(
                ComparisonExpression.greaterThanOrEquals(point, timestamp),
                ComparisonExpression.lessThan(point, DateAdjustExpression.hours(timestamp, 72)));

        assertEquals("(r.\"event_timestamp\" >= u.\"first_exposure\""
                        + " AND r.\"event_timestamp\" < (u.\"first_exposure\" + INTERVAL 72 HOUR))",
                duckdb.generate(condition));
        assertThrows(IllegalArgumentException.class, () -> LogicalExpression.and(point));
        assertEquals(point, LogicalExpression.allOf(List.of(point)));
    }

    @Test
    @DisplayName("CASE without ELSE leaves out-of-window rows NULL")
    void testCaseWithoutElse() {
        Expression when = CaseExpression.when(RawSqlExpression.of("event = 'Search'"), Literal.integer(1));

        assertEquals("CASE WHEN (event = 'Search') THEN 1 END", duckdb.generate(when));
        assertEquals("MAX(CASE WHEN (event = 'Search') THEN 1 END)",
                duckdb.generate(AggregateExpression.max(when)));
    }

    @Test
    @DisplayName("Aggregates: COUNT DISTINCT and custom templates")
    void testAggregates() {
        Expression value = ColumnReference.of("r", "value");

        assertEquals("COUNT(DISTINCT r.\"value\")", duckdb.generate(
                AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT_DISTINCT, value)));
        assertEquals("MAX(r.\"value\")", duckdb.generate(AggregateExpression.custom("MAX({value})", value)));
        assertEquals("MIN(r.\"value\")", duckdb.generate(AggregateExpression.min(value)));
        assertEquals("r.\"value\" IS NOT NULL", duckdb.generate(ComparisonExpression.isNotNull(value)));
        assertEquals("COALESCE(SUM(r.\"value\"), 0)", duckdb.generate(
                SqlFunctionCall.coalesce(AggregateExpression.sum(value), Literal.integer(0))));
    }

    @Test
    @DisplayName("Custom aggregate templates must contain the value placeholder")
    void testCustomTemplateValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> AggregateExpression.custom("MAX(x)", ColumnReference.of("x")));
    }

    @Test
    @DisplayName("First-day fraction uses the dialect's hour extraction")
    void testFirstDayFraction() {
        Expression fraction = ArithmeticExpression.divide(
                ArithmeticExpression.subtract(Literal.integer(24), DatePartExpression.hour(timestamp)),
                Literal.decimal(24.0));

        assertEquals("((24 - EXTRACT(HOUR FROM u.\"first_exposure\")) / 24.0)", duckdb.generate(fraction));
    }

    // ==================== Dialect fragments ====================

    @Nested
    @DisplayName("Date arithmetic")
    class DateArithmetic {

        @Test
        @DisplayName("Zero offsets leave the expression unchanged")
        void testZeroOffset() {
            assertSame(timestamp, DateAdjustExpression.hours(timestamp, 0));
            assertSame(timestamp, DateAdjustExpression.days(timestamp, 0));
        }

        @Test
        @DisplayName("DuckDB shifts dates by integers and timestamps by intervals")
        void testDuckDB() {
            Expression day = CastExpression.toDate(timestamp);
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) + 3)",
                    duckdb.generate(DateAdjustExpression.days(day, 3)));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) - 4)",
                    duckdb.generate(DateAdjustExpression.days(day, -4)));
            assertEquals("(u.\"first_exposure\" - INTERVAL 96 HOUR)",
                    duckdb.generate(DateAdjustExpression.hours(timestamp, -96)));
        }

        @Test
        @DisplayName("Postgres quotes interval literals")
        void testPostgres() {
            assertEquals("(u.\"first_exposure\" + INTERVAL '72 hours')",
                    postgres.generate(DateAdjustExpression.hours(timestamp, 72)));
            assertEquals("(CAST(u.\"first_exposure\" AS DATE) + 1)",
                    postgres.generate(DateAdjustExpression.days(CastExpression.toDate(timestamp), 1)));
        }
    }

    @Nested
    @DisplayName("Percentiles and casts")
    class Percentiles {

        private final Expression value = ColumnReference.of("value");

        @Test
        @DisplayName("Exact percentiles")
        void testExact() {
            assertEquals("QUANTILE_CONT(\"value\", 0.9)", duckdb.generate(PercentileExpression.exact(value, 0.9)));
            assertEquals("PERCENTILE_CONT(0.9) WITHIN GROUP (ORDER BY \"value\")",
                    postgres.generate(PercentileExpression.exact(value, 0.9)));
        }

        @Test
        @DisplayName("Approximate percentiles")
        void testApproximate() {
            assertEquals("APPROX_QUANTILE(\"value\", 0.5)",
                    duckdb.generate(new PercentileExpression(value, 0.5, true)));
            assertTrue(postgres.generate(new PercentileExpression(value, 0.5, true))
                    .startsWith("tdigest_percentile(CAST(\"value\" AS DOUBLE PRECISION)"));
        }

        @Test
        @DisplayName("DOUBLE casts use the dialect's double type")
        void testDoubleCast() {
            assertEquals("CAST(\"value\" AS DOUBLE)", duckdb.generate(CastExpression.toDouble(value)));
            assertEquals("CAST(\"value\" AS DOUBLE PRECISION)", postgres.generate(CastExpression.toDouble(value)));
        }
    }

    @Nested
    @DisplayName("Sketch syntax")
    class Sketches {

        @Test
        @DisplayName("Array aggregation is ordered and filtered")
        void testArrayAgg() {
            assertEquals("ARRAY_AGG(v ORDER BY v) FILTER (WHERE v IS NOT NULL)",
                    DuckDBDialect.INSTANCE.arrayAgg("v", "v IS NOT NULL"));
            assertEquals("UNNEST(s.\"x_values\")", DuckDBDialect.INSTANCE.unnest("s.\"x_values\""));
        }

        @Test
        @DisplayName("Only Postgres builds t-digests")
        void testTdigestSupport() {
            assertFalse(DuckDBDialect.INSTANCE.supportsTdigest());
            assertThrows(UnsupportedOperationException.class, () -> DuckDBDialect.INSTANCE.tdigestAgg("v", "TRUE"));

            assertTrue(PostgresDialect.INSTANCE.supportsTdigest());
            assertEquals("tdigest_percentile(s.\"x_digest\", 0.9)",
                    PostgresDialect.INSTANCE.tdigestPercentile("s.\"x_digest\"", "0.9"));
            assertEquals("CREATE EXTENSION IF NOT EXISTS tdigest", PostgresDialect.INSTANCE.tdigestSetup());
        }

        @Test
        @DisplayName("Drops cascade")
        void testDrop() {
            assertEquals("DROP TABLE IF EXISTS \"shared_exposures\" CASCADE",
                    DuckDBDialect.INSTANCE.dropTableIfExists("shared_exposures"));
        }
    }

    @Nested
    @DisplayName("DialectRegistry")
    class Registry {

        @ParameterizedTest
        @ValueSource(strings = {"duckdb", "DuckDB", "DUCKDB"})
        @DisplayName("Engine lookup is case-insensitive")
        void testLookup(String engine) {
            assertSame(DuckDBDialect.INSTANCE, DialectRegistry.forEngine(engine));
        }

        @Test
        @DisplayName("Unknown engines are rejected with the supported list")
        void testUnknownEngine() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> DialectRegistry.forEngine("oracle"));
            assertTrue(e.getMessage().contains("duckdb"));
            assertEquals(List.of("duckdb", "postgres"), DialectRegistry.supportedEngines());
        }
    }
}
