package org.expbench.engine.benchmark;

import org.expbench.engine.assembly.QueryKey;

import java.util.List;
import java.util.Map;

/**
 * Timed execution of one rendered query.
 *
 * @param experiment    Experiment id
 * @param metric        Metric id
 * @param approach      Approach key
 * @param variant       Variant key
 * @param medianSeconds Median of the successful timed runs, -1 when none succeeded
 * @param timings       Every timed run in seconds, -1 for a failed run
 * @param rowCount      Rows returned by the last successful run
 * @param rows          First rows of the last successful run
 * @param error         Failure message, null on success
 * @param timedOut      True when a run exceeded the query timeout
 */
public record QueryTiming(
        String experiment,
        String metric,
        String approach,
        String variant,
        double medianSeconds,
        List<Double> timings,
        int rowCount,
        List<Map<String, Object>> rows,
        String error,
        boolean timedOut) {

    public static final int KEPT_ROWS = 5;

    public QueryTiming {
        timings = List.copyOf(timings);
        rows = List.copyOf(rows);
    }

    public static QueryTiming failed(QueryKey key, String error) {
        return new QueryTiming(key.experimentId(), key.metricId(), key.approach().key(), key.variant().key(),
                -1, List.of(), 0, List.of(), error, false);
    }

    public boolean succeeded() {
        return error == null;
    }
}
