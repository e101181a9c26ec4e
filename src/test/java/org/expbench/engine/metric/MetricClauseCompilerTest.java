package org.expbench.engine.metric;

import org.eclipse.collections.api.list.ImmutableList;
import org.expbench.engine.config.ConfigLoader;
import org.expbench.engine.config.MetricCatalog;
import org.expbench.engine.config.QuantileSpec;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.transpiler.DuckDBDialect;
import org.expbench.engine.transpiler.SQLGenerator;
import org.expbench.engine.window.Approach;
import org.expbench.engine.window.WindowBounds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricClauseCompilerTest {

    private static final String EXPERIMENTS = """
            experiments:
              - id: exp
                start_date: "2022-01-01"
                end_date: "2022-01-11"
            """;

    private static final String METRICS = """
            metrics:
              - id: purchased
                type: binomial
                table: orders
              - id: revenue
                type: count
                table: orders
                value: amount
              - id: revenue_capped
                type: count
                table: orders
                value: amount
                capping:
                  percentile: 0.9
              - id: event_value
                type: count
                table: events
                value: value
                preserve_nulls: true
              - id: distinct_paths
                type: count
                table: events
                value: path
                aggregation: count_distinct
              - id: max_order
                type: count
                table: orders
                value: amount
                aggregation: custom
                aggregate: "MAX({value})"
                rollup: max
              - id: big_spender
                type: binomial
                threshold_of: revenue
                threshold: 100
              - id: revenue_per_order
                type: ratio
                numerator: revenue
                denominator: purchased
                cuped:
                  enabled: true
                  lookback_days: 7
              - id: order_p90
                type: quantile
                table: orders
                value: amount
                quantile: 0.9
                ignore_zeros: true
            """;

    private final SQLGenerator sql = new SQLGenerator(DuckDBDialect.INSTANCE);

    private final Expression point = ColumnReference.of("r", "timestamp");
    private final WindowBounds window = WindowBounds.timestamps(
            ColumnReference.of("u", "window_start"), ColumnReference.of("u", "window_end"));

    private MetricCatalog catalog;
    private MetricClauseCompiler compiler;

    @BeforeEach
    void setUp() {
        catalog = ConfigLoader.parse(EXPERIMENTS, METRICS).metrics();
        compiler = new MetricClauseCompiler(catalog);
    }

    private String onDemandValue(String metricId) {
        MetricComponent component = compiler.components(catalog.get(metricId)).get(0);
        Expression rowValue = compiler.rowValue(component.source());
        return sql.generate(compiler.perUserValue(component, Approach.ONDEMAND, rowValue, point, window, false));
    }

    // ==================== Components ====================

    @Nested
    @DisplayName("Components")
    class Components {

        @Test
        @DisplayName("A ratio splits into numerator and denominator sharing the ratio's CUPED settings")
        void testRatioComponents() {
            ImmutableList<MetricComponent> components = compiler.components(catalog.get("revenue_per_order"));

            assertEquals(2, components.size());
            assertEquals(MetricRole.MAIN, components.get(0).role());
            assertEquals("revenue", components.get(0).metric().id());
            assertEquals(MetricRole.DENOMINATOR, components.get(1).role());
            assertEquals("purchased", components.get(1).metric().id());
            assertEquals("denominator", components.get(1).prefix());
            assertTrue(components.allSatisfy(MetricComponent::hasCovariate));
            assertEquals(7, components.get(1).cuped().lookbackDays());
        }

        @Test
        @DisplayName("A threshold metric reads its base metric's rows")
        void testThresholdSource() {
            MetricComponent component = compiler.components(catalog.get("big_spender")).get(0);

            assertEquals("big_spender", component.metric().id());
            assertEquals("revenue", component.source().id());
            assertFalse(component.hasCovariate());
        }
    }

    // ==================== Per-user values ====================

    @Nested
    @DisplayName("Per-user values")
    class PerUserValues {

        private static final String IN_WINDOW =
                "CASE WHEN (r.\"timestamp\" >= u.\"window_start\" AND r.\"timestamp\" < u.\"window_end\")";

        @Test
        @DisplayName("Binomial metrics take the MAX of a windowed 1")
        void testBinomial() {
            assertEquals("COALESCE(MAX(" + IN_WINDOW + " THEN 1 END), 0)", onDemandValue("purchased"));
        }

        @Test
        @DisplayName("Count metrics sum the windowed value")
        void testSum() {
            assertEquals("COALESCE(SUM(" + IN_WINDOW + " THEN (amount) END), 0)", onDemandValue("revenue"));
        }

        @Test
        @DisplayName("preserve_nulls keeps users without rows NULL")
        void testPreserveNulls() {
            assertEquals("SUM(" + IN_WINDOW + " THEN (value) END)", onDemandValue("event_value"));
        }

        @Test
        @DisplayName("COUNT DISTINCT and custom templates wrap the windowed value")
        void testCountDistinctAndCustom() {
            assertEquals("COALESCE(COUNT(DISTINCT " + IN_WINDOW + " THEN (path) END), 0)",
                    onDemandValue("distinct_paths"));
            assertEquals("COALESCE(MAX(" + IN_WINDOW + " THEN (amount) END), 0)", onDemandValue("max_order"));
        }

        @Test
        @DisplayName("Threshold metrics compare the base value against the threshold")
        void testThreshold() {
            assertEquals("CASE WHEN COALESCE(SUM(" + IN_WINDOW + " THEN (amount) END), 0) >= 100.0 THEN 1 ELSE 0 END",
                    onDemandValue("big_spender"));
        }

        @Test
        @DisplayName("Pre-agg values roll daily columns up and weight the first day")
        void testPreAggWeighted() {
            MetricComponent component = compiler.components(catalog.get("max_order")).get(0);
            Expression day = ColumnReference.of("d", "metric_date");
            WindowBounds days = WindowBounds.days(ColumnReference.of("u", "start_day"),
                    ColumnReference.of("u", "end_day"), Literal.decimal(0.5));

            String value = sql.generate(compiler.perUserValue(component, Approach.PREAGG,
                    ColumnReference.of("d", "max_order"), day, days, true));

            assertEquals("COALESCE(MAX(CASE WHEN (d.\"metric_date\" >= u.\"start_day\""
                    + " AND d.\"metric_date\" <= u.\"end_day\")"
                    + " THEN (d.\"max_order\" * CASE WHEN d.\"metric_date\" = u.\"start_day\" THEN 0.5 ELSE 1.0 END)"
                    + " END), 0)", value);
        }

        @Test
        @DisplayName("Pre-agg distinct counts count the unnested daily values instead of rolling up")
        void testPreAggDistinct() {
            MetricComponent component = compiler.components(catalog.get("distinct_paths")).get(0);
            Expression day = ColumnReference.of("d", "metric_date");
            WindowBounds days = WindowBounds.days(ColumnReference.of("u", "start_day"),
                    ColumnReference.of("u", "end_day"), Literal.decimal(1.0));

            String value = sql.generate(compiler.perUserValue(component, Approach.PREAGG,
                    ColumnReference.of("d", "value"), day, days, false));

            assertEquals("COALESCE(COUNT(DISTINCT CASE WHEN (d.\"metric_date\" >= u.\"start_day\""
                    + " AND d.\"metric_date\" <= u.\"end_day\") THEN d.\"value\" END), 0)", value);
        }

        @Test
        @DisplayName("Covariates are compiled only for CUPED components")
        void testCovariate() {
            WindowBounds covariate = WindowBounds.timestamps(
                    ColumnReference.of("u", "pre_start"), ColumnReference.of("u", "first_exposure"));

            MetricComponent plain = compiler.components(catalog.get("revenue")).get(0);
            assertFalse(compiler.compile(plain, Approach.ONDEMAND, compiler.rowValue(plain.source()),
                    point, window, covariate, false).hasCovariate());

            MetricComponent cuped = compiler.components(catalog.get("revenue_per_order")).get(0);
            MetricClause clause = compiler.compile(cuped, Approach.ONDEMAND, compiler.rowValue(cuped.source()),
                    point, window, covariate, false);
            assertTrue(clause.hasCovariate());
            assertTrue(sql.generate(clause.covariate()).contains("r.\"timestamp\" < u.\"first_exposure\""));
        }
    }

    // ==================== Caps and quantiles ====================

    @Nested
    @DisplayName("Caps and quantiles")
    class CapsAndQuantiles {

        @Test
        @DisplayName("Cap threshold is an exact percentile of per-user values")
        void testCapThreshold() {
            Expression values = ColumnReference.of("main_users", "value");

            assertEquals("QUANTILE_CONT(main_users.\"value\", 0.9)",
                    sql.generate(compiler.capThreshold(catalog.get("revenue_capped"), values)));
            assertThrows(IllegalArgumentException.class,
                    () -> compiler.capThreshold(catalog.get("revenue"), values));
        }

        @Test
        @DisplayName("Capped values are clamped from above")
        void testCapped() {
            Expression value = ColumnReference.of("value");
            Expression cap = ColumnReference.of("c", "cap_value");

            assertEquals("CASE WHEN \"value\" > c.\"cap_value\" THEN c.\"cap_value\" ELSE \"value\" END",
                    sql.generate(compiler.capped(value, cap)));
        }

        @Test
        @DisplayName("Quantiles honour ignore_zeros and approximation")
        void testQuantile() {
            QuantileSpec spec = catalog.get("order_p90").quantile();
            Expression value = ColumnReference.of("value");

            assertEquals("\"value\" <> 0", sql.generate(compiler.nonZero(spec, value)));
            assertEquals("APPROX_QUANTILE(\"value\", 0.9)", sql.generate(compiler.quantile(spec, value, true)));
            assertNull(compiler.nonZero(new QuantileSpec(0.5, spec.level(), false), value));
        }
    }
}
