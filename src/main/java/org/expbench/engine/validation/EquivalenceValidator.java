package org.expbench.engine.validation;

import org.expbench.engine.assembly.QueryKey;
import org.expbench.engine.assembly.Variant;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.config.MetricCatalog;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.config.MetricShape;
import org.expbench.engine.config.Tolerances;
import org.expbench.engine.execution.RelationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares a pre-agg result with the on-demand result of the same (experiment, metric).
 *
 * <p>Rows are aligned by variation and dimension value. {@code users} must match
 * exactly unless the experiment's population is only approximately reproducible at
 * day precision; sums, sums of squares and cross products must match within the
 * relative tolerance of the variant. Quantile values use the quantile tolerance;
 * capped metrics never use less than the capped tolerance.</p>
 */
public final class EquivalenceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(EquivalenceValidator.class);

    static final String VARIATION = "variation";
    static final String DIMENSION = "dimension";
    static final String USERS = "users";
    static final String QUANTILE_VALUE = "quantile_value";

    private final Tolerances tolerances;
    private final MetricCatalog catalog;

    public EquivalenceValidator(Tolerances tolerances, MetricCatalog catalog) {
        this.tolerances = Objects.requireNonNull(tolerances, "Tolerances cannot be null");
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
    }

    public ValidationResult validate(QueryKey key, ExperimentConfig experiment, MetricConfig metric,
                                     RelationResult expected, RelationResult actual) {
        if (expected == null || actual == null) {
            return ValidationResult.incomplete(key,
                    (expected == null ? "on-demand" : "pre-agg") + " result is missing");
        }
        double tolerance = toleranceFor(key.variant(), metric);
        double usersTolerance = experiment.populationIsApproximate() ? tolerance : 0.0;

        Map<String, Integer> expectedRows = index(expected);
        Map<String, Integer> actualRows = index(actual);
        Set<String> groups = new LinkedHashSet<>(expectedRows.keySet());
        groups.addAll(actualRows.keySet());

        List<String> fields = comparedFields(expected, actual);
        List<FieldDelta> deltas = new ArrayList<>();
        for (String group : groups) {
            Integer e = expectedRows.get(group);
            Integer a = actualRows.get(group);
            for (String field : fields) {
                double fieldTolerance = USERS.equals(field) ? usersTolerance : tolerance;
                deltas.add(FieldDelta.of(group, field,
                        value(expected, e, field), value(actual, a, field), fieldTolerance));
            }
        }

        boolean pass = deltas.stream().allMatch(FieldDelta::withinTolerance);
        ValidationResult result = new ValidationResult(key, pass ? Verdict.PASS : Verdict.MISMATCH, deltas, null);
        if (!pass) {
            LOG.warn("Mismatch {}: {}", key, describe(result.failures()));
        }
        return result;
    }

    double toleranceFor(Variant variant, MetricConfig metric) {
        double tolerance;
        if (metric.shape() == MetricShape.QUANTILE) {
            tolerance = tolerances.quantile();
        } else if (variant == Variant.WEIGHTED) {
            tolerance = tolerances.weighted();
        } else {
            tolerance = tolerances.unweighted();
        }
        return involvesCap(metric) ? Math.max(tolerance, tolerances.capped()) : tolerance;
    }

    private boolean involvesCap(MetricConfig metric) {
        if (metric.shape() == MetricShape.RATIO) {
            return catalog.get(metric.numerator()).isCapped() || catalog.get(metric.denominator()).isCapped();
        }
        return metric.isCapped();
    }

    private static Map<String, Integer> index(RelationResult result) {
        Map<String, Integer> rows = new LinkedHashMap<>();
        boolean dimension = result.hasColumn(DIMENSION);
        for (int i = 0; i < result.rowCount(); i++) {
            String group = String.valueOf(result.getValue(i, VARIATION));
            if (dimension) {
                group += " / " + result.getValue(i, DIMENSION);
            }
            rows.put(group, i);
        }
        return rows;
    }

    /**
     * The statistics columns present in both results.
     */
    private static List<String> comparedFields(RelationResult expected, RelationResult actual) {
        List<String> fields = new ArrayList<>();
        for (String column : expected.columnNames()) {
            if (actual.hasColumn(column) && isCompared(column)) {
                fields.add(column);
            }
        }
        return fields;
    }

    private static boolean isCompared(String column) {
        return USERS.equals(column)
                || QUANTILE_VALUE.equals(column)
                || column.endsWith("_sum")
                || column.endsWith("_sum_squares")
                || column.endsWith("_sum_product");
    }

    private static double value(RelationResult result, Integer row, String field) {
        if (row == null) {
            return Double.NaN;
        }
        Double value = result.getDouble(row, field);
        return value == null ? 0.0 : value;
    }

    private static String describe(List<FieldDelta> failures) {
        StringBuilder sb = new StringBuilder();
        for (FieldDelta delta : failures) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(delta.group()).append(' ').append(delta.field())
                    .append(" expected ").append(delta.expected())
                    .append(" actual ").append(delta.actual())
                    .append(String.format(" (%.2f%%)", delta.relativeDiff() * 100));
        }
        return sb.toString();
    }
}
