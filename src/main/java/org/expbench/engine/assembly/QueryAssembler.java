package org.expbench.engine.assembly;

import org.eclipse.collections.api.list.ImmutableList;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.config.MetricCatalog;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.config.MetricShape;
import org.expbench.engine.config.QuantileLevel;
import org.expbench.engine.config.QuantileSpec;
import org.expbench.engine.metric.MetricClause;
import org.expbench.engine.metric.MetricClauseCompiler;
import org.expbench.engine.metric.MetricComponent;
import org.expbench.engine.metric.MetricRole;
import org.expbench.engine.pipeline.SharedColumn;
import org.expbench.engine.pipeline.SharedTableLayout;
import org.expbench.engine.pipeline.SharedTables;
import org.expbench.engine.plan.AggregateExpression;
import org.expbench.engine.plan.ArithmeticExpression;
import org.expbench.engine.plan.CastExpression;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.transpiler.CteQuery;
import org.expbench.engine.transpiler.SQLDialect;
import org.expbench.engine.transpiler.SQLGenerator;
import org.expbench.engine.window.Approach;
import org.expbench.engine.window.WindowBounds;
import org.expbench.engine.window.WindowResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.expbench.engine.assembly.UnitResolver.DIMENSION;
import static org.expbench.engine.assembly.UnitResolver.METRIC_UNIT_ID;
import static org.expbench.engine.assembly.UnitResolver.UNITS_FINAL;
import static org.expbench.engine.assembly.UnitResolver.UNIT_ID;
import static org.expbench.engine.assembly.UnitResolver.VARIATION;

/**
 * Composes unit resolution, window bounds and metric clauses into one complete
 * query per (experiment, metric, approach, weighting mode).
 *
 * <p>Rendering is a pure function of its inputs: the same configuration always
 * yields byte-identical SQL for a given dialect.</p>
 *
 * Output columns of binomial, count and ratio metrics:
 * <pre>
 * variation [, dimension], users, main_sum, main_sum_squares
 *   [, denominator_sum, denominator_sum_squares, main_denominator_sum_product]
 *   [, covariate_sum, covariate_sum_squares, main_covariate_sum_product]
 *   [, denominator_covariate_sum, denominator_covariate_sum_squares, denominator_covariate_sum_product,
 *      covariate_denominator_covariate_sum_product]
 *   [, main_cap_value] [, denominator_cap_value]
 * </pre>
 * Quantile metrics return {@code variation [, dimension], users, quantile_n, quantile_value}.
 */
public final class QueryAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(QueryAssembler.class);

    static final String USERS = "users";
    static final String QUANTILE_N = "quantile_n";
    static final String QUANTILE_VALUE = "quantile_value";

    private static final String VALUE = "value";
    private static final String COVARIATE = "covariate";
    private static final String CAP_VALUE = "cap_value";
    private static final String COVARIATE_CAP_VALUE = "covariate_cap_value";
    private static final String EVENT_TIMESTAMP = "event_timestamp";

    private final SQLDialect dialect;
    private final SqlText text;
    private final MetricClauseCompiler compiler;
    private final SharedTableLayout layout;
    private final RenderOptions options;

    public QueryAssembler(SQLDialect dialect, MetricCatalog catalog, SharedTableLayout layout, RenderOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.text = new SqlText(new SQLGenerator(dialect));
        this.compiler = new MetricClauseCompiler(catalog);
        this.layout = Objects.requireNonNull(layout, "Layout cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    public static QueryAssembler forSuite(SQLDialect dialect, ExperimentSuite suite, RenderOptions options) {
        return new QueryAssembler(dialect, suite.metrics(), SharedTableLayout.of(suite), options);
    }

    /**
     * Renders one combination.
     *
     * @throws RenderException if the combination has no compilation rule
     */
    public RenderedQuery render(ExperimentConfig experiment, MetricConfig metric, Approach approach, Variant variant) {
        QueryKey key = new QueryKey(experiment.id(), metric.id(), approach, variant);
        ImmutableList<MetricComponent> components = compiler.components(metric);
        checkSupported(experiment, metric, components, approach, variant);

        WindowResolver windows = new WindowResolver(experiment);
        UnitResolver units = new UnitResolver(experiment, windows, text);
        CteQuery query = new CteQuery();
        units.addUnitStages(query, approach);

        List<String> idTypes = new ArrayList<>();
        for (MetricComponent component : components) {
            idTypes.add(component.source().idType());
        }
        Map<String, String> identities = units.addIdentityStages(query, approach, idTypes);

        Stages stages = new Stages(query, units, windows, identities, approach, variant);
        String sql = metric.shape() == MetricShape.QUANTILE
                ? quantileQuery(stages, components.get(0), metric.quantile())
                : aggregateQuery(stages, components);
        LOG.debug("Rendered {}:\n{}", key, sql);
        return new RenderedQuery(key, sql);
    }

    private void checkSupported(ExperimentConfig experiment, MetricConfig metric,
                                ImmutableList<MetricComponent> components, Approach approach, Variant variant) {
        if (metric.shape() == MetricShape.QUANTILE) {
            if (metric.isCuped()) {
                throw new RenderException("CUPED is not defined for quantile metrics");
            }
            if (metric.isCapped()) {
                throw new RenderException("percentile capping is not defined for quantile metrics");
            }
            if (variant == Variant.WEIGHTED) {
                throw new RenderException("quantile metrics support only the unweighted pre-agg rendering");
            }
            if (approach == Approach.PREAGG && options.tdigest()) {
                if (!dialect.supportsTdigest()) {
                    throw new RenderException(dialect.name() + " has no t-digest sketches");
                }
                if (metric.quantile().level() == QuantileLevel.UNIT) {
                    throw new RenderException("unit-level quantiles cannot be computed from t-digest sketches");
                }
            }
        }
        if (approach == Approach.PREAGG) {
            for (MetricComponent component : components) {
                if (!SharedTables.USER_ID.equals(component.source().idType())) {
                    throw new RenderException("shared tables are keyed by " + SharedTables.USER_ID
                            + ", metric " + component.source().id() + " uses " + component.source().idType());
                }
                if (variant == Variant.WEIGHTED && layout.isDistinct(component.metric())) {
                    throw new RenderException("distinct counts have no partial-day weighting, metric "
                            + component.source().id());
                }
            }
            if (experiment.hasActivation() && !experiment.keyedByUser()) {
                throw new RenderException("shared activations are keyed by " + SharedTables.USER_ID
                        + ", experiment units use " + experiment.exposureId());
            }
        }
    }

    // ==================== Binomial / count / ratio ====================

    private String aggregateQuery(Stages stages, ImmutableList<MetricComponent> components) {
        for (MetricComponent component : components) {
            addUserStage(stages, component);
            if (component.isCapped()) {
                addCapStage(stages, component);
            }
        }
        stages.query.with("user_values", userValues(stages, components));

        List<String> select = new ArrayList<>(stages.units.groupColumns("v"));
        select.add(text.as("COUNT(*)", USERS));
        for (MetricComponent component : components) {
            String p = component.prefix();
            select.add(text.as(sum(p + "_value"), p + "_sum"));
            select.add(text.as(sumProduct(p + "_value", p + "_value"), p + "_sum_squares"));
        }
        if (components.size() > 1) {
            select.add(text.as(sumProduct("main_value", "denominator_value"), "main_denominator_sum_product"));
        }
        for (MetricComponent component : components) {
            if (!component.hasCovariate()) {
                continue;
            }
            String p = component.prefix();
            String out = component.role() == MetricRole.MAIN ? "covariate" : p + "_covariate";
            select.add(text.as(sum(p + "_covariate"), out + "_sum"));
            select.add(text.as(sumProduct(p + "_covariate", p + "_covariate"), out + "_sum_squares"));
            select.add(text.as(sumProduct(p + "_value", p + "_covariate"), p + "_covariate_sum_product"));
        }
        if (components.size() > 1 && components.get(0).hasCovariate()) {
            select.add(text.as(sumProduct("main_covariate", "denominator_covariate"),
                    "covariate_denominator_covariate_sum_product"));
        }
        for (MetricComponent component : components) {
            if (component.isCapped()) {
                String column = component.prefix() + "_" + CAP_VALUE;
                select.add(text.as("MAX(" + text.col("v", column) + ")", column));
            }
        }

        String groups = SqlText.list(stages.units.groupColumns("v"));
        return stages.query.select("SELECT " + String.join(",\n  ", select)
                + "\nFROM user_values v"
                + "\nGROUP BY " + groups
                + "\nORDER BY " + groups);
    }

    private void addUserStage(Stages stages, MetricComponent component) {
        String p = component.prefix();
        Expression rowValue;
        Expression point;
        String source;
        if (stages.approach == Approach.ONDEMAND) {
            stages.query.with(p + "_rows", rowsStage(component.source()));
            rowValue = ColumnReference.of("r", VALUE);
            point = ColumnReference.of("r", EVENT_TIMESTAMP);
            source = "LEFT JOIN " + p + "_rows r ON " + text.col("r", METRIC_UNIT_ID) + " = ";
        } else if (layout.isDistinct(component.metric())) {
            SharedColumn column = layout.distinctColumn(component.metric());
            rowValue = ColumnReference.of("d", VALUE);
            point = ColumnReference.of("d", SharedTables.METRIC_DATE);
            source = "LEFT JOIN (" + unnestedValues(column.column(), column.table()) + ") d ON "
                    + text.col("d", SharedTables.USER_ID) + " = ";
        } else {
            SharedColumn column = layout.dailyColumn(component.metric());
            rowValue = ColumnReference.of("d", column.column());
            point = ColumnReference.of("d", SharedTables.METRIC_DATE);
            source = "LEFT JOIN " + text.table(column.table(), "d") + " ON "
                    + text.col("d", SharedTables.USER_ID) + " = ";
        }

        Expression firstExposure = UnitResolver.firstExposure("u");
        WindowBounds window = stages.windows.resolve(stages.approach, firstExposure);
        WindowBounds covariate = component.hasCovariate()
                ? stages.windows.covariate(stages.approach, firstExposure, component.cuped())
                : null;
        MetricClause clause = compiler.compile(component, stages.approach, rowValue, point, window, covariate,
                stages.variant == Variant.WEIGHTED);

        List<String> select = new ArrayList<>();
        select.add(text.col("u", UNIT_ID));
        select.add(text.as(clause.value(), VALUE));
        if (clause.hasCovariate()) {
            select.add(text.as(clause.covariate(), COVARIATE));
        }
        stages.query.with(p + "_users", "SELECT " + String.join(",\n  ", select)
                + "\nFROM " + UNITS_FINAL + " u"
                + stages.identityJoin(component)
                + "\n" + source + stages.unitKey(component)
                + "\nGROUP BY " + text.col("u", UNIT_ID));
    }

    private String rowsStage(MetricConfig source) {
        String rows = "SELECT " + text.as(text.col("r", source.idType()), METRIC_UNIT_ID) + ", "
                + text.as(text.col("r", source.timestampColumn()), EVENT_TIMESTAMP) + ", "
                + text.as(compiler.rowValue(source), VALUE)
                + "\nFROM " + text.table(source.table(), "r");
        Expression filter = compiler.rowFilter(source);
        return filter == null ? rows : rows + "\nWHERE " + text.sql(filter);
    }

    private void addCapStage(Stages stages, MetricComponent component) {
        List<String> select = new ArrayList<>();
        select.add(text.as(compiler.capThreshold(component.metric(), ColumnReference.of(VALUE)), CAP_VALUE));
        if (component.hasCovariate()) {
            select.add(text.as(compiler.capThreshold(component.metric(), ColumnReference.of(COVARIATE)),
                    COVARIATE_CAP_VALUE));
        }
        stages.query.with(component.prefix() + "_cap", "SELECT " + SqlText.list(select)
                + "\nFROM " + component.prefix() + "_users");
    }

    private String userValues(Stages stages, ImmutableList<MetricComponent> components) {
        List<String> select = new ArrayList<>();
        select.add(text.col("u", UNIT_ID));
        select.add(text.col("u", VARIATION));
        if (stages.units.hasDimension()) {
            select.add(text.col("u", DIMENSION));
        }
        StringBuilder from = new StringBuilder("\nFROM " + UNITS_FINAL + " u");
        for (MetricComponent component : components) {
            String p = component.prefix();
            String users = alias(component.role(), "u");
            String cap = alias(component.role(), "c");
            Expression value = ColumnReference.of(users, VALUE);
            Expression covariate = ColumnReference.of(users, COVARIATE);
            if (component.isCapped()) {
                value = compiler.capped(value, ColumnReference.of(cap, CAP_VALUE));
                covariate = compiler.capped(covariate, ColumnReference.of(cap, COVARIATE_CAP_VALUE));
            }
            select.add(text.as(CastExpression.toDouble(value), p + "_value"));
            if (component.hasCovariate()) {
                select.add(text.as(CastExpression.toDouble(covariate), p + "_covariate"));
            }
            if (component.isCapped()) {
                select.add(text.as(text.col(cap, CAP_VALUE), p + "_" + CAP_VALUE));
            }
            from.append("\nINNER JOIN ").append(p).append("_users ").append(users)
                    .append(" ON ").append(text.col(users, UNIT_ID)).append(" = ").append(text.col("u", UNIT_ID));
            if (component.isCapped()) {
                from.append("\nCROSS JOIN ").append(p).append("_cap ").append(cap);
            }
        }
        return "SELECT " + String.join(",\n  ", select) + from;
    }

    private static String alias(MetricRole role, String suffix) {
        return (role == MetricRole.MAIN ? "m" : "d") + suffix;
    }

    private String sum(String column) {
        return text.sql(AggregateExpression.sum(ColumnReference.of("v", column)));
    }

    private String sumProduct(String left, String right) {
        return text.sql(AggregateExpression.sum(ArithmeticExpression.multiply(
                ColumnReference.of("v", left), ColumnReference.of("v", right))));
    }

    // ==================== Quantile ====================

    private String quantileQuery(Stages stages, MetricComponent component, QuantileSpec spec) {
        boolean digest = stages.approach == Approach.PREAGG && options.tdigest();
        if (digest) {
            stages.query.with("quantiles", digestQuantiles(stages, component, spec));
        } else {
            stages.query.with("quantile_values", spec.level() == QuantileLevel.EVENT
                    ? eventValues(stages, component, spec)
                    : unitValues(stages, component, spec));
            List<String> select = new ArrayList<>(groupColumns(stages, ""));
            select.add(text.as("COUNT(*)", QUANTILE_N));
            select.add(text.as(compiler.quantile(spec, ColumnReference.of(VALUE), options.approxQuantile()),
                    QUANTILE_VALUE));
            stages.query.with("quantiles", "SELECT " + SqlText.list(select)
                    + "\nFROM quantile_values"
                    + "\nGROUP BY " + SqlText.list(groupColumns(stages, "")));
        }

        List<String> counts = new ArrayList<>(groupColumns(stages, ""));
        counts.add(text.as("COUNT(*)", USERS));
        stages.query.with("unit_counts", "SELECT " + SqlText.list(counts)
                + "\nFROM " + UNITS_FINAL
                + "\nGROUP BY " + SqlText.list(groupColumns(stages, "")));

        List<String> select = new ArrayList<>(stages.units.groupColumns("c"));
        select.add(text.col("c", USERS));
        if (!digest) {
            select.add(text.col("q", QUANTILE_N));
        }
        select.add(text.col("q", QUANTILE_VALUE));
        String on = text.col("q", VARIATION) + " = " + text.col("c", VARIATION);
        if (stages.units.hasDimension()) {
            on += " AND " + text.col("q", DIMENSION) + " IS NOT DISTINCT FROM " + text.col("c", DIMENSION);
        }
        return stages.query.select("SELECT " + SqlText.list(select)
                + "\nFROM unit_counts c"
                + "\nLEFT JOIN quantiles q ON " + on
                + "\nORDER BY " + SqlText.list(stages.units.groupColumns("c")));
    }

    private List<String> groupColumns(Stages stages, String alias) {
        if (alias.isEmpty()) {
            List<String> columns = new ArrayList<>();
            columns.add(text.id(VARIATION));
            if (stages.units.hasDimension()) {
                columns.add(text.id(DIMENSION));
            }
            return columns;
        }
        return stages.units.groupColumns(alias);
    }

    private String eventValues(Stages stages, MetricComponent component, QuantileSpec spec) {
        Expression firstExposure = UnitResolver.firstExposure("u");
        WindowBounds window = stages.windows.resolve(stages.approach, firstExposure);
        List<String> select = new ArrayList<>(stages.units.groupColumns("u"));
        List<String> where = new ArrayList<>();

        String join;
        if (stages.approach == Approach.ONDEMAND) {
            stages.query.with("main_rows", rowsStage(component.source()));
            Expression value = ColumnReference.of("r", VALUE);
            select.add(text.as(value, VALUE));
            join = "INNER JOIN main_rows r ON " + text.col("r", METRIC_UNIT_ID) + " = ";
            where.add(text.sql(window.contains(ColumnReference.of("r", EVENT_TIMESTAMP))));
            where.add(text.sql(ComparisonExpression.isNotNull(value)));
            Expression nonZero = compiler.nonZero(spec, value);
            if (nonZero != null) {
                where.add(text.sql(nonZero));
            }
        } else {
            SharedColumn column = layout.arrayColumn(component.metric());
            select.add(text.as(dialect.unnest(text.col("s", column.column(spec.ignoreZeros()))), VALUE));
            join = "INNER JOIN " + text.table(column.table(), "s") + " ON " + text.col("s", SharedTables.USER_ID) + " = ";
            where.add(text.sql(window.contains(ColumnReference.of("s", SharedTables.METRIC_DATE))));
        }
        return "SELECT " + SqlText.list(select)
                + "\nFROM " + UNITS_FINAL + " u"
                + stages.identityJoin(component)
                + "\n" + join + stages.unitKey(component)
                + SqlText.where(where);
    }

    private String unitValues(Stages stages, MetricComponent component, QuantileSpec spec) {
        Expression firstExposure = UnitResolver.firstExposure("u");
        WindowBounds window = stages.windows.resolve(stages.approach, firstExposure);

        String source;
        Expression rowValue;
        Expression point;
        if (stages.approach == Approach.ONDEMAND) {
            stages.query.with("main_rows", rowsStage(component.source()));
            source = "LEFT JOIN main_rows r ON " + text.col("r", METRIC_UNIT_ID) + " = ";
            rowValue = ColumnReference.of("r", VALUE);
            point = ColumnReference.of("r", EVENT_TIMESTAMP);
        } else {
            SharedColumn column = layout.arrayColumn(component.metric());
            source = "LEFT JOIN (" + unnestedValues(column.column(false), column.table()) + ") r ON " + text.col("r", SharedTables.USER_ID) + " = ";
            rowValue = ColumnReference.of("r", VALUE);
            point = ColumnReference.of("r", SharedTables.METRIC_DATE);
        }
        Expression perUser = compiler.perUserValue(component, stages.approach, rowValue, point, window, false);
        stages.query.with("main_users", "SELECT " + text.col("u", UNIT_ID) + ", " + text.as(perUser, VALUE)
                + "\nFROM " + UNITS_FINAL + " u"
                + stages.identityJoin(component)
                + "\n" + source + stages.unitKey(component)
                + "\nGROUP BY " + text.col("u", UNIT_ID));

        List<String> select = new ArrayList<>(stages.units.groupColumns("u"));
        select.add(text.as(ColumnReference.of("mu", VALUE), VALUE));
        List<String> where = new ArrayList<>();
        Expression nonZero = compiler.nonZero(spec, ColumnReference.of("mu", VALUE));
        if (nonZero != null) {
            where.add(text.sql(nonZero));
        }
        return "SELECT " + SqlText.list(select)
                + "\nFROM " + UNITS_FINAL + " u"
                + "\nINNER JOIN main_users mu ON " + text.col("mu", UNIT_ID) + " = " + text.col("u", UNIT_ID)
                + SqlText.where(where);
    }

    /**
     * One row per element of a per-day array column: (user_id, metric_date, value).
     */
    private String unnestedValues(String arrayColumn, String table) {
        return "SELECT " + text.col("s", SharedTables.USER_ID) + ", "
                + text.col("s", SharedTables.METRIC_DATE) + ", "
                + text.as(dialect.unnest(text.col("s", arrayColumn)), VALUE)
                + " FROM " + text.table(table, "s");
    }

        private String digestQuantiles(Stages stages, MetricComponent component, QuantileSpec spec) {
        Expression firstExposure = UnitResolver.firstExposure("u");
        WindowBounds window = stages.windows.resolve(stages.approach, firstExposure);
        SharedColumn column = layout.digestColumn(component.metric());

        List<String> select = new ArrayList<>(stages.units.groupColumns("u"));
        String quantile = text.sql(Literal.decimal(spec.quantile()));
        select.add(text.as(dialect.tdigestPercentile(text.col("s", column.column(spec.ignoreZeros())), quantile),
                QUANTILE_VALUE));
        return "SELECT " + SqlText.list(select)
                + "\nFROM " + UNITS_FINAL + " u"
                + stages.identityJoin(component)
                + "\nINNER JOIN " + text.table(column.table(), "s") + " ON "
                + text.col("s", SharedTables.USER_ID) + " = " + stages.unitKey(component)
                + "\nWHERE " + text.sql(window.contains(ColumnReference.of("s", SharedTables.METRIC_DATE)))
                + "\nGROUP BY " + SqlText.list(stages.units.groupColumns("u"));
    }

    /**
     * Per-render state shared by the stage builders.
     */
    private final class Stages {
        final CteQuery query;
        final UnitResolver units;
        final WindowResolver windows;
        final Map<String, String> identities;
        final Approach approach;
        final Variant variant;

        Stages(CteQuery query, UnitResolver units, WindowResolver windows, Map<String, String> identities,
               Approach approach, Variant variant) {
            this.query = query;
            this.units = units;
            this.windows = windows;
            this.identities = identities;
            this.approach = approach;
            this.variant = variant;
        }

        String identityJoin(MetricComponent component) {
            String stage = identities.get(component.source().idType());
            if (stage == null) {
                return "";
            }
            return "\nLEFT JOIN " + stage + " i" + component.prefix().charAt(0)
                    + " ON " + text.col("i" + component.prefix().charAt(0), UNIT_ID) + " = " + text.col("u", UNIT_ID);
        }

        String unitKey(MetricComponent component) {
            if (identities.containsKey(component.source().idType())) {
                return text.col("i" + component.prefix().charAt(0), METRIC_UNIT_ID);
            }
            return text.col("u", UNIT_ID);
        }
    }
}
