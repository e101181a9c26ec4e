package org.expbench.engine.pipeline;

import org.eclipse.collections.api.list.MutableList;
import org.expbench.engine.config.ActivationSpec;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.config.MetricShape;
import org.expbench.engine.plan.AggregateExpression;
import org.expbench.engine.plan.CaseExpression;
import org.expbench.engine.plan.CastExpression;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.plan.LogicalExpression;
import org.expbench.engine.plan.RawSqlExpression;
import org.expbench.engine.plan.SqlFunctionCall;
import org.expbench.engine.transpiler.CteQuery;
import org.expbench.engine.transpiler.SQLDialect;
import org.expbench.engine.transpiler.SQLGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles the shared-table build statements, in dependency order:
 * exposures, daily metrics, activations, value arrays and (optionally) t-digests.
 *
 * <p>Tables with several source tables are built per source and merged on
 * (user, day) keys, so each column keeps its source's native type.</p>
 */
public final class PipelineCompiler {

    private static final String RAW_TIMESTAMP = "timestamp";

    private final SQLDialect dialect;
    private final SQLGenerator generator;
    private final boolean tdigest;

    public PipelineCompiler(SQLDialect dialect, boolean tdigest) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.generator = new SQLGenerator(dialect);
        if (tdigest && !dialect.supportsTdigest()) {
            throw new IllegalArgumentException(dialect.name() + " does not support t-digest sketches");
        }
        this.tdigest = tdigest;
    }

    public List<PipelineStatement> compile(SharedTableLayout layout) {
        List<PipelineStatement> statements = new ArrayList<>();
        statements.add(rebuild(SharedTables.EXPOSURES, exposures(layout)));
        if (!layout.dailyMetrics().isEmpty()) {
            statements.add(rebuild(SharedTables.METRICS_DAILY, metricsDaily(layout.dailyMetrics())));
        }
        if (!layout.activations().isEmpty()) {
            statements.add(rebuild(SharedTables.ACTIVATIONS, activations(layout.activations())));
        }
        if (!layout.quantileMetrics().isEmpty() || !layout.distinctMetrics().isEmpty()) {
            statements.add(rebuild(SharedTables.SKETCHES_ARRAY, sketchesArray(layout)));
        }
        if (!layout.quantileMetrics().isEmpty()) {
            if (tdigest) {
                statements.add(new PipelineStatement(SharedTables.SKETCHES_TDIGEST, List.of(
                        dialect.tdigestSetup(),
                        dialect.dropTableIfExists(SharedTables.SKETCHES_TDIGEST),
                        create(SharedTables.SKETCHES_TDIGEST, sketchesTdigest(layout)))));
            }
        }
        return statements;
    }

    private PipelineStatement rebuild(String table, String select) {
        return new PipelineStatement(table, List.of(dialect.dropTableIfExists(table), create(table, select)));
    }

    private String create(String table, String select) {
        return "CREATE TABLE " + q(table) + " AS\n" + select;
    }

    // ==================== shared_exposures ====================

    private String exposures(SharedTableLayout layout) {
        List<String> branches = new ArrayList<>();
        for (String table : layout.exposureTables()) {
            Expression exposureDate = CastExpression.toDate(col("e", RAW_TIMESTAMP));
            List<String> keys = new ArrayList<>();
            for (String id : layout.idColumns()) {
                keys.add(generator.generate(col("e", id)));
            }
            keys.add(generator.generate(col("e", SharedTables.EXPERIMENT_ID)));
            keys.add(generator.generate(col("e", SharedTables.VARIATION_ID)));

            List<String> select = new ArrayList<>();
            select.add(generator.generate(Literal.string(table)) + " AS " + q(SharedTables.EXPOSURE_SOURCE));
            select.addAll(keys);
            select.add(generator.generate(exposureDate) + " AS " + q(SharedTables.EXPOSURE_DATE));
            select.add(generator.generate(AggregateExpression.min(col("e", RAW_TIMESTAMP))) + " AS "
                    + q(SharedTables.FIRST_EXPOSURE_TIMESTAMP));
            select.add(generator.generate(AggregateExpression.max(col("e", RAW_TIMESTAMP))) + " AS "
                    + q(SharedTables.LAST_EXPOSURE_TIMESTAMP));
            for (String dimension : layout.dimensionColumns()) {
                select.add(generator.generate(AggregateExpression.min(col("e", dimension))) + " AS " + q(dimension));
            }
            keys.add(generator.generate(exposureDate));
            branches.add("SELECT " + String.join(",\n  ", select)
                    + "\nFROM " + q(table) + " e"
                    + "\nGROUP BY " + String.join(", ", keys));
        }
        return String.join("\nUNION ALL\n", branches);
    }

    // ==================== shared_metrics_daily ====================

    private String metricsDaily(MutableList<MetricConfig> metrics) {
        Map<SourceKey, List<DailyColumn>> bySource = new LinkedHashMap<>();
        for (MetricConfig metric : metrics) {
            bySource.computeIfAbsent(new SourceKey(metric.table(), metric.timestampColumn()), k -> new ArrayList<>())
                    .add(dailyColumn(metric));
        }
        return mergeSources(bySource);
    }

    private DailyColumn dailyColumn(MetricConfig metric) {
        Expression filter = metric.where() == null ? null : RawSqlExpression.of(metric.where());
        Expression value = metric.shape() == MetricShape.BINOMIAL
                ? Literal.integer(1)
                : RawSqlExpression.of(metric.value());
        Expression row = filter == null ? value : CaseExpression.when(filter, value);

        if (metric.shape() == MetricShape.BINOMIAL) {
            return dailyColumnOf(metric.id(),
                    SqlFunctionCall.coalesce(AggregateExpression.max(row), Literal.integer(0)), true);
        }
        return switch (metric.aggregation()) {
            case SUM -> metric.preserveNulls()
                    ? dailyColumnOf(metric.id(), AggregateExpression.sum(row), false)
                    : dailyColumnOf(metric.id(),
                            SqlFunctionCall.coalesce(AggregateExpression.sum(row), Literal.integer(0)), true);
            case COUNT -> dailyColumnOf(metric.id(),
                    AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT, row), true);
            case COUNT_DISTINCT -> throw new IllegalStateException(
                    "Distinct count " + metric.id() + " is kept as per-day value sets, not a daily total");
            case CUSTOM -> dailyColumnOf(metric.id(),
                    AggregateExpression.custom(metric.aggregateTemplate(), row), false);
        };
    }

    // ==================== shared_activations ====================

    private String activations(List<ActivationSpec> activations) {
        List<String> branches = new ArrayList<>();
        for (ActivationSpec activation : activations) {
            Expression timestamp = col("x", activation.timestampColumn());
            Expression day = CastExpression.toDate(timestamp);
            branches.add("SELECT " + generator.generate(col("x", SharedTables.USER_ID)) + ", "
                    + generator.generate(Literal.string(activation.name())) + " AS " + q(SharedTables.ACTIVATION) + ", "
                    + generator.generate(day) + " AS " + q(SharedTables.ACTIVATION_DATE) + ", "
                    + generator.generate(AggregateExpression.min(timestamp)) + " AS "
                    + q(SharedTables.FIRST_ACTIVATION_TIMESTAMP)
                    + "\nFROM " + q(activation.table()) + " x"
                    + "\nWHERE " + generator.generate(ComparisonExpression.isNotNull(col("x", SharedTables.USER_ID)))
                    + " AND " + generator.generate(RawSqlExpression.of(activation.where()))
                    + "\nGROUP BY " + generator.generate(col("x", SharedTables.USER_ID)) + ", " + generator.generate(day));
        }
        return String.join("\nUNION ALL\n", branches);
    }

    // ==================== sketches ====================

    private String sketchesArray(SharedTableLayout layout) {
        Map<SourceKey, List<DailyColumn>> bySource = new LinkedHashMap<>();
        for (MetricConfig metric : layout.quantileMetrics()) {
            SharedColumn column = layout.arrayColumn(metric);
            Expression value = RawSqlExpression.of(metric.value());
            String v = generator.generate(value);
            List<DailyColumn> columns = bySource.computeIfAbsent(
                    new SourceKey(metric.table(), metric.timestampColumn()), k -> new ArrayList<>());
            columns.add(new DailyColumn(column.column(), dialect.arrayAgg(v, valueFilter(metric, value, false)), false));
            columns.add(new DailyColumn(column.column(true), dialect.arrayAgg(v, valueFilter(metric, value, true)), false));
        }
        // distinct counts keep the day's values
        for (MetricConfig metric : layout.distinctMetrics()) {
            SharedColumn column = layout.distinctColumn(metric);
            Expression value = RawSqlExpression.of(metric.value());
            bySource.computeIfAbsent(new SourceKey(metric.table(), metric.timestampColumn()), k -> new ArrayList<>())
                    .add(new DailyColumn(column.column(),
                            dialect.arrayAggDistinct(generator.generate(value), valueFilter(metric, value, false)),
                            false));
        }
        return mergeSources(bySource);
    }

    private String sketchesTdigest(SharedTableLayout layout) {
        Map<SourceKey, List<DailyColumn>> bySource = new LinkedHashMap<>();
        for (MetricConfig metric : layout.quantileMetrics()) {
            SharedColumn column = layout.digestColumn(metric);
            Expression value = RawSqlExpression.of(metric.value());
            String v = generator.generate(value);
            List<DailyColumn> columns = bySource.computeIfAbsent(
                    new SourceKey(metric.table(), metric.timestampColumn()), k -> new ArrayList<>());
            columns.add(new DailyColumn(column.column(), dialect.tdigestAgg(v, valueFilter(metric, value, false)), false));
            columns.add(new DailyColumn(column.column(true), dialect.tdigestAgg(v, valueFilter(metric, value, true)), false));
        }
        return mergeSources(bySource);
    }

    private String valueFilter(MetricConfig metric, Expression value, boolean nonZero) {
        List<Expression> conditions = new ArrayList<>();
        conditions.add(ComparisonExpression.isNotNull(value));
        if (nonZero) {
            conditions.add(ComparisonExpression.notEquals(value, Literal.integer(0)));
        }
        if (metric.where() != null) {
            conditions.add(RawSqlExpression.of(metric.where()));
        }
        return generator.generate(LogicalExpression.allOf(conditions));
    }

    // ==================== per-source merge ====================

    /**
     * Aggregates every source per (user, day), then joins the per-source results onto
     * the union of their keys.
     */
    private String mergeSources(Map<SourceKey, List<DailyColumn>> bySource) {
        CteQuery query = new CteQuery();
        List<String> stages = new ArrayList<>();
        for (Map.Entry<SourceKey, List<DailyColumn>> entry : bySource.entrySet()) {
            String stage = "src_" + (stages.size() + 1);
            stages.add(stage);
            query.with(stage, sourceStage(entry.getKey(), entry.getValue()));
        }

        List<String> keys = new ArrayList<>();
        for (String stage : stages) {
            keys.add("SELECT " + q(SharedTables.USER_ID) + ", " + q(SharedTables.METRIC_DATE) + " FROM " + stage);
        }
        query.with("day_keys", String.join("\nUNION\n", keys));

        List<String> select = new ArrayList<>();
        select.add(generator.generate(col("k", SharedTables.USER_ID)));
        select.add(generator.generate(col("k", SharedTables.METRIC_DATE)));
        StringBuilder joins = new StringBuilder();
        int i = 0;
        for (List<DailyColumn> columns : bySource.values()) {
            String alias = "s" + (i + 1);
            for (DailyColumn column : columns) {
                Expression ref = col(alias, column.name());
                Expression projected = column.zeroWhenMissing()
                        ? SqlFunctionCall.coalesce(ref, Literal.integer(0))
                        : ref;
                select.add(generator.generate(projected) + " AS " + q(column.name()));
            }
            joins.append("\nLEFT JOIN ").append(stages.get(i)).append(' ').append(alias)
                    .append(" ON ").append(generator.generate(col(alias, SharedTables.USER_ID)))
                    .append(" = ").append(generator.generate(col("k", SharedTables.USER_ID)))
                    .append(" AND ").append(generator.generate(col(alias, SharedTables.METRIC_DATE)))
                    .append(" = ").append(generator.generate(col("k", SharedTables.METRIC_DATE)));
            i++;
        }
        return query.select("SELECT " + String.join(",\n  ", select)
                + "\nFROM day_keys k"
                + joins);
    }

    private String sourceStage(SourceKey source, List<DailyColumn> columns) {
        Expression user = col("r", SharedTables.USER_ID);
        Expression day = CastExpression.toDate(col("r", source.timestampColumn()));
        List<String> select = new ArrayList<>();
        select.add(generator.generate(user) + " AS " + q(SharedTables.USER_ID));
        select.add(generator.generate(day) + " AS " + q(SharedTables.METRIC_DATE));
        for (DailyColumn column : columns) {
            select.add(column.aggregate() + " AS " + q(column.name()));
        }
        return "SELECT " + String.join(",\n  ", select)
                + "\nFROM " + q(source.table()) + " r"
                + "\nWHERE " + generator.generate(ComparisonExpression.isNotNull(user))
                + "\nGROUP BY " + generator.generate(user) + ", " + generator.generate(day);
    }

    private String q(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    private static ColumnReference col(String alias, String column) {
        return ColumnReference.of(alias, column);
    }

    private record SourceKey(String table, String timestampColumn) {
    }

    private record DailyColumn(String name, String aggregate, boolean zeroWhenMissing) {
    }

    private DailyColumn dailyColumnOf(String name, Expression aggregate, boolean zeroWhenMissing) {
        return new DailyColumn(name, generator.generate(aggregate), zeroWhenMissing);
    }
}
