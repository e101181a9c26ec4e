package org.expbench.engine.validation;

import org.expbench.engine.assembly.QueryKey;

import java.util.List;
import java.util.Objects;

/**
 * Comparison of one pre-agg rendering against the on-demand reference.
 *
 * @param key     The pre-agg rendering
 * @param verdict Pass, mismatch or incomplete
 * @param deltas  Every compared value
 * @param message Reason for an incomplete comparison, null otherwise
 */
public record ValidationResult(QueryKey key, Verdict verdict, List<FieldDelta> deltas, String message) {

    public ValidationResult {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(verdict, "Verdict cannot be null");
        deltas = List.copyOf(deltas);
    }

    public static ValidationResult incomplete(QueryKey key, String message) {
        return new ValidationResult(key, Verdict.INCOMPLETE, List.of(), message);
    }

    public boolean passed() {
        return verdict == Verdict.PASS;
    }

    public double maxRelativeDiff() {
        double max = 0.0;
        for (FieldDelta delta : deltas) {
            max = Math.max(max, delta.relativeDiff());
        }
        return max;
    }

    public List<FieldDelta> failures() {
        return deltas.stream().filter(d -> !d.withinTolerance()).toList();
    }
}
