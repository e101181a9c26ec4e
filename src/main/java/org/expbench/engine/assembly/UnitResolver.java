package org.expbench.engine.assembly;

import org.expbench.engine.config.ActivationSpec;
import org.expbench.engine.config.DimensionSpec;
import org.expbench.engine.config.DimensionType;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.config.SegmentSpec;
import org.expbench.engine.pipeline.SharedTables;
import org.expbench.engine.plan.CaseExpression;
import org.expbench.engine.plan.CastExpression;
import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.plan.RawSqlExpression;
import org.expbench.engine.plan.SqlFunctionCall;
import org.expbench.engine.transpiler.CteQuery;
import org.expbench.engine.window.Approach;
import org.expbench.engine.window.WindowBounds;
import org.expbench.engine.window.WindowResolver;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the unit-resolution stages shared by every metric of an experiment:
 * exposures, one row per unit with its variation and first exposure, the segment
 * and activation filters, the dimension column, and identity mappings to metric id types.
 *
 * <p>The resulting {@code units_final} stage has columns {@code unit_id},
 * {@code variation}, {@code first_exposure} and, when a dimension is configured,
 * {@code dimension}.</p>
 */
final class UnitResolver {

    static final String UNITS_FINAL = "units_final";
    static final String UNIT_ID = "unit_id";
    static final String VARIATION = "variation";
    static final String FIRST_EXPOSURE = "first_exposure";
    static final String DIMENSION = "dimension";
    static final String METRIC_UNIT_ID = "metric_unit_id";

    static final String ACTIVATED = "Activated";
    static final String NOT_ACTIVATED = "Not Activated";

    private static final String EXPOSURE_TIMESTAMP = "exposure_timestamp";
    private static final String DIMENSION_SOURCE = "dimension_source";
    private static final String DIMENSION_VALUE = "dimension_value";
    private static final String ATTRIBUTE_VALUE = "attribute_value";
    private static final String FIRST_ACTIVATION = "first_activation";
    private static final String ACTIVATION_TIMESTAMP = "activation_timestamp";
    private static final String RAW_TIMESTAMP = "timestamp";

    private final ExperimentConfig experiment;
    private final WindowResolver windows;
    private final SqlText text;

    UnitResolver(ExperimentConfig experiment, WindowResolver windows, SqlText text) {
        this.experiment = experiment;
        this.windows = windows;
        this.text = text;
    }

    static Expression firstExposure(String alias) {
        return ColumnReference.of(alias, FIRST_EXPOSURE);
    }

    boolean hasDimension() {
        return experiment.hasDimension();
    }

    /**
     * Group-by columns of the final aggregate, qualified by the given alias.
     */
    List<String> groupColumns(String alias) {
        List<String> columns = new ArrayList<>();
        columns.add(text.col(alias, VARIATION));
        if (hasDimension()) {
            columns.add(text.col(alias, DIMENSION));
        }
        return columns;
    }

    void addUnitStages(CteQuery query, Approach approach) {
        query.with("exposures", approach == Approach.ONDEMAND ? rawExposures() : sharedExposures());
        query.with("units", units());
        if (experiment.hasSegment()) {
            query.with("segment", segment(experiment.segment()));
        }
        if (experiment.hasActivation()) {
            query.with("activations", approach == Approach.ONDEMAND
                    ? rawActivations(experiment.activation())
                    : sharedActivations(experiment.activation()));
        }
        if (hasDimension() && experiment.dimension().type() == DimensionType.ATTRIBUTE) {
            query.with("attributes", attributes(experiment.dimension()));
        }
        query.with(UNITS_FINAL, unitsFinal(approach));
    }

    private String rawExposures() {
        String e = "e";
        List<String> select = new ArrayList<>();
        select.add(text.as(text.col(e, experiment.exposureId()), UNIT_ID));
        select.add(text.as(text.col(e, SharedTables.VARIATION_ID), SharedTables.VARIATION_ID));
        select.add(text.as(text.col(e, RAW_TIMESTAMP), EXPOSURE_TIMESTAMP));
        if (exposureDimension() != null) {
            select.add(text.as(text.col(e, exposureDimension()), DIMENSION_SOURCE));
        }

        List<String> where = new ArrayList<>();
        where.add(text.col(e, SharedTables.EXPERIMENT_ID) + " = " + text.string(experiment.experimentId()));
        where.add(text.col(e, experiment.exposureId()) + " IS NOT NULL");
        WindowBounds period = windows.exposurePeriod(Approach.ONDEMAND);
        where.add(text.sql(ComparisonExpression.greaterThanOrEquals(ColumnReference.of(e, RAW_TIMESTAMP), period.start())));
        where.add(text.sql(ComparisonExpression.lessThan(ColumnReference.of(e, RAW_TIMESTAMP), period.end())));

        return "SELECT " + SqlText.list(select)
                + "\nFROM " + text.table(experiment.exposureTable(), e)
                + SqlText.where(where);
    }

    private String sharedExposures() {
        String e = "e";
        List<String> select = new ArrayList<>();
        select.add(text.as(text.col(e, experiment.exposureId()), UNIT_ID));
        select.add(text.as(text.col(e, SharedTables.VARIATION_ID), SharedTables.VARIATION_ID));
        WindowBounds period = windows.exposurePeriod(Approach.ONDEMAND);
        Expression first = ColumnReference.of(e, SharedTables.FIRST_EXPOSURE_TIMESTAMP);
        Expression last = ColumnReference.of(e, SharedTables.LAST_EXPOSURE_TIMESTAMP);
        // a start-day row may open before a mid-day start
        Expression exposure = experiment.startDate().toLocalTime().equals(LocalTime.MIDNIGHT)
                ? first
                : SqlFunctionCall.of("GREATEST", first, period.start());
        select.add(text.as(exposure, EXPOSURE_TIMESTAMP));
        if (exposureDimension() != null) {
            select.add(text.as(text.col(e, exposureDimension()), DIMENSION_SOURCE));
        }

        List<String> where = new ArrayList<>();
        where.add(text.col(e, SharedTables.EXPOSURE_SOURCE) + " = " + text.string(experiment.exposureTable()));
        where.add(text.col(e, SharedTables.EXPERIMENT_ID) + " = " + text.string(experiment.experimentId()));
        where.add(text.col(e, experiment.exposureId()) + " IS NOT NULL");
        WindowBounds days = windows.exposurePeriod(Approach.PREAGG);
        Expression exposureDate = ColumnReference.of(e, SharedTables.EXPOSURE_DATE);
        where.add(text.sql(ComparisonExpression.greaterThanOrEquals(exposureDate, days.start())));
        where.add(text.sql(ComparisonExpression.lessThanOrEquals(exposureDate, days.end())));
        // a day row belongs to the period when one of its exposures does
        where.add(text.sql(ComparisonExpression.greaterThanOrEquals(last, period.start())));
        where.add(text.sql(ComparisonExpression.lessThan(first, period.end())));

        return "SELECT " + SqlText.list(select)
                + "\nFROM " + text.table(SharedTables.EXPOSURES, e)
                + SqlText.where(where);
    }

    private String exposureDimension() {
        DimensionSpec dimension = experiment.dimension();
        return dimension != null && dimension.type() == DimensionType.EXPOSURE ? dimension.column() : null;
    }

    private String units() {
        List<String> select = new ArrayList<>();
        select.add(text.id(UNIT_ID));
        select.add(text.as("MIN(" + text.id(SharedTables.VARIATION_ID) + ")", VARIATION));
        select.add(text.as("MIN(" + text.id(EXPOSURE_TIMESTAMP) + ")", FIRST_EXPOSURE));
        if (exposureDimension() != null) {
            select.add(text.as("MIN(" + text.id(DIMENSION_SOURCE) + ")", DIMENSION_VALUE));
        }
        // units exposed to several variations are dropped
        return "SELECT " + SqlText.list(select)
                + "\nFROM exposures"
                + "\nGROUP BY " + text.id(UNIT_ID)
                + "\nHAVING COUNT(DISTINCT " + text.id(SharedTables.VARIATION_ID) + ") = 1";
    }

    private String segment(SegmentSpec segment) {
        return "SELECT DISTINCT " + text.as(text.col("s", segment.idColumn()), UNIT_ID)
                + "\nFROM " + text.table(segment.table(), "s")
                + "\nWHERE " + text.sql(RawSqlExpression.of(segment.where()));
    }

    private String rawActivations(ActivationSpec activation) {
        String source = "SELECT " + text.as(text.col("x", experiment.exposureId()), UNIT_ID) + ", "
                + text.as(text.col("x", activation.timestampColumn()), ACTIVATION_TIMESTAMP)
                + " FROM " + text.table(activation.table(), "x")
                + " WHERE " + text.sql(RawSqlExpression.of(activation.where()));
        WindowBounds window = windows.activation(Approach.ONDEMAND, firstExposure("u"));
        return "SELECT " + text.col("u", UNIT_ID) + ", "
                + text.as("MIN(" + text.col("a", ACTIVATION_TIMESTAMP) + ")", FIRST_ACTIVATION)
                + "\nFROM units u"
                + "\nINNER JOIN (" + source + ") a ON " + text.col("a", UNIT_ID) + " = " + text.col("u", UNIT_ID)
                + "\nWHERE " + text.sql(window.contains(ColumnReference.of("a", ACTIVATION_TIMESTAMP)))
                + "\nGROUP BY " + text.col("u", UNIT_ID);
    }

    private String sharedActivations(ActivationSpec activation) {
        WindowBounds window = windows.activation(Approach.PREAGG, firstExposure("u"));
        List<String> where = new ArrayList<>();
        where.add(text.col("a", SharedTables.ACTIVATION) + " = " + text.string(activation.name()));
        where.add(text.sql(window.contains(ColumnReference.of("a", SharedTables.ACTIVATION_DATE))));
        return "SELECT " + text.col("u", UNIT_ID) + ", "
                + text.as("MIN(" + text.col("a", SharedTables.FIRST_ACTIVATION_TIMESTAMP) + ")", FIRST_ACTIVATION)
                + "\nFROM units u"
                + "\nINNER JOIN " + text.table(SharedTables.ACTIVATIONS, "a")
                + " ON " + text.col("a", SharedTables.USER_ID) + " = " + text.col("u", UNIT_ID)
                + SqlText.where(where)
                + "\nGROUP BY " + text.col("u", UNIT_ID);
    }

    private String attributes(DimensionSpec dimension) {
        return "SELECT " + text.as(text.col("x", experiment.exposureId()), UNIT_ID) + ", "
                + text.as("MIN(" + text.col("x", dimension.column()) + ")", ATTRIBUTE_VALUE)
                + "\nFROM " + text.table(dimension.table(), "x")
                + "\nGROUP BY " + text.col("x", experiment.exposureId());
    }

    private String unitsFinal(Approach approach) {
        List<String> select = new ArrayList<>();
        select.add(text.col("u", UNIT_ID));
        select.add(text.col("u", VARIATION));
        select.add(text.col("u", FIRST_EXPOSURE));
        if (hasDimension()) {
            select.add(text.as(dimensionExpression(), DIMENSION));
        }

        StringBuilder from = new StringBuilder("\nFROM units u");
        if (experiment.hasSegment()) {
            from.append("\nINNER JOIN segment s ON ").append(joinOnUnit("s"));
        }
        if (experiment.hasActivation()) {
            boolean activationIsDimension = hasDimension()
                    && experiment.dimension().type() == DimensionType.ACTIVATION;
            from.append(activationIsDimension ? "\nLEFT JOIN" : "\nINNER JOIN")
                    .append(" activations a ON ").append(joinOnUnit("a"));
        }
        if (hasDimension() && experiment.dimension().type() == DimensionType.ATTRIBUTE) {
            from.append("\nLEFT JOIN attributes t ON ").append(joinOnUnit("t"));
        }

        List<String> where = new ArrayList<>();
        Expression complete = windows.completeWindowFilter(approach, firstExposure("u"));
        if (complete != null) {
            where.add(text.sql(complete));
        }
        return "SELECT " + SqlText.list(select) + from + SqlText.where(where);
    }

    private String joinOnUnit(String alias) {
        return text.col(alias, UNIT_ID) + " = " + text.col("u", UNIT_ID);
    }

    private Expression dimensionExpression() {
        return switch (experiment.dimension().type()) {
            case DATE -> CastExpression.toDate(firstExposure("u"));
            case EXPOSURE -> ColumnReference.of("u", DIMENSION_VALUE);
            case ATTRIBUTE -> ColumnReference.of("t", ATTRIBUTE_VALUE);
            case ACTIVATION -> CaseExpression.of(
                    ComparisonExpression.isNotNull(ColumnReference.of("a", UNIT_ID)),
                    Literal.string(ACTIVATED),
                    Literal.string(NOT_ACTIVATED));
        };
    }

    /**
     * Adds one identity mapping stage per metric id type that differs from the exposure id.
     *
     * @return Stage name per id type
     */
    Map<String, String> addIdentityStages(CteQuery query, Approach approach, List<String> idTypes) {
        Map<String, String> stages = new LinkedHashMap<>();
        for (String idType : idTypes) {
            if (idType.equals(experiment.exposureId()) || stages.containsKey(idType)) {
                continue;
            }
            String name = "identities_" + idType.replaceAll("[^A-Za-z0-9_]", "_");
            query.with(name, identities(approach, idType));
            stages.put(idType, name);
        }
        return stages;
    }

    private String identities(Approach approach, String idType) {
        String e = "e";
        List<String> where = new ArrayList<>();
        String from;
        if (approach == Approach.ONDEMAND) {
            from = text.table(experiment.exposureTable(), e);
        } else {
            from = text.table(SharedTables.EXPOSURES, e);
            where.add(text.col(e, SharedTables.EXPOSURE_SOURCE) + " = " + text.string(experiment.exposureTable()));
        }
        where.add(text.col(e, SharedTables.EXPERIMENT_ID) + " = " + text.string(experiment.experimentId()));
        where.add(text.col(e, experiment.exposureId()) + " IS NOT NULL");
        where.add(text.col(e, idType) + " IS NOT NULL");
        return "SELECT DISTINCT " + text.as(text.col(e, experiment.exposureId()), UNIT_ID) + ", "
                + text.as(text.col(e, idType), METRIC_UNIT_ID)
                + "\nFROM " + from
                + SqlText.where(where);
    }
}
