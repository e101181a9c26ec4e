package org.expbench.engine.validation;

import java.util.Comparator;
import java.util.List;

/**
 * Summary of every comparison of a run.
 *
 * <p>Comparisons are bucketed by their largest relative difference: exact (below 1%),
 * close (1% to 10%, the expected cost of day granularity) and far (10% or more).</p>
 */
public record ValidationReport(
        int totalComparisons,
        int passed,
        int mismatched,
        int incomplete,
        int exactBelow1Pct,
        int close1To10Pct,
        int farAbove10Pct,
        DiffStats diffStats,
        List<Outlier> topOutliers,
        List<ValidationResult> failures) {

    static final double EXACT = 0.01;
    static final double CLOSE = 0.10;
    static final int TOP_OUTLIERS = 10;

    /**
     * Distribution of the per-comparison maximum relative difference, in percent.
     */
    public record DiffStats(double medianPct, double p95Pct, double maxPct) {
        static final DiffStats EMPTY = new DiffStats(0.0, 0.0, 0.0);
    }

    public record Outlier(String key, double maxDiffPct, List<FieldDelta> deltas) {
    }

    public static ValidationReport of(List<ValidationResult> results) {
        List<ValidationResult> compared = results.stream()
                .filter(r -> r.verdict() != Verdict.INCOMPLETE)
                .toList();
        int passed = (int) results.stream().filter(ValidationResult::passed).count();
        int mismatched = (int) results.stream().filter(r -> r.verdict() == Verdict.MISMATCH).count();

        int exact = 0;
        int close = 0;
        int far = 0;
        for (ValidationResult result : compared) {
            double diff = result.maxRelativeDiff();
            if (diff < EXACT) {
                exact++;
            } else if (diff < CLOSE) {
                close++;
            } else {
                far++;
            }
        }

        List<Outlier> outliers = compared.stream()
                .filter(r -> r.maxRelativeDiff() >= EXACT)
                .sorted(Comparator.comparingDouble(ValidationResult::maxRelativeDiff).reversed())
                .limit(TOP_OUTLIERS)
                .map(r -> new Outlier(r.key().toString(), percent(r.maxRelativeDiff()),
                        r.deltas().stream().filter(d -> d.relativeDiff() >= EXACT).toList()))
                .toList();

        List<ValidationResult> failures = results.stream()
                .filter(r -> !r.passed())
                .toList();

        return new ValidationReport(compared.size(), passed, mismatched, results.size() - compared.size(),
                exact, close, far, diffStats(compared), outliers, failures);
    }

    public boolean hasFailures() {
        return mismatched > 0 || incomplete > 0;
    }

    private static DiffStats diffStats(List<ValidationResult> compared) {
        if (compared.isEmpty()) {
            return DiffStats.EMPTY;
        }
        double[] diffs = compared.stream().mapToDouble(ValidationResult::maxRelativeDiff).sorted().toArray();
        int p95 = Math.min((int) (diffs.length * 0.95), diffs.length - 1);
        return new DiffStats(percent(diffs[diffs.length / 2]), percent(diffs[p95]), percent(diffs[diffs.length - 1]));
    }

    private static double percent(double ratio) {
        return Math.round(ratio * 10000.0) / 100.0;
    }
}
