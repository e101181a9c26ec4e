package org.expbench.engine.validation;

/**
 * One compared value of one result row.
 *
 * @param group        Variation, plus dimension value when grouped by dimension
 * @param field        Result column
 * @param expected     On-demand value (NaN when the row is missing)
 * @param actual       Pre-agg value (NaN when the row is missing)
 * @param relativeDiff |expected - actual| / max(|expected|, |actual|)
 * @param tolerance    Accepted relative difference; 0 for exact fields
 */
public record FieldDelta(
        String group,
        String field,
        double expected,
        double actual,
        double relativeDiff,
        double tolerance) {

    public static FieldDelta of(String group, String field, double expected, double actual, double tolerance) {
        return new FieldDelta(group, field, expected, actual, relativeDiff(expected, actual), tolerance);
    }

    public boolean withinTolerance() {
        return relativeDiff <= tolerance;
    }

    /**
     * Symmetric relative difference; 0 when both are 0, 1 when either side is missing.
     */
    public static double relativeDiff(double a, double b) {
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return Double.isNaN(a) && Double.isNaN(b) ? 0.0 : 1.0;
        }
        double denominator = Math.max(Math.abs(a), Math.abs(b));
        return denominator == 0.0 ? 0.0 : Math.abs(a - b) / denominator;
    }
}
