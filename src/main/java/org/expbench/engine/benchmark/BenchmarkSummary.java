package org.expbench.engine.benchmark;

import org.expbench.engine.window.Approach;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Totals and speedups of a run. Speedups are null when the pre-agg side took no time.
 */
public record BenchmarkSummary(
        int ondemandQueryCount,
        double ondemandTotalSeconds,
        double ondemandMedianPerQuery,
        int preaggQueryCount,
        double preaggTotalSeconds,
        double preaggMedianPerQuery,
        double pipelineTotalSeconds,
        double pipelineAmortizedPerExperiment,
        double preaggTotalWithPipeline,
        Double speedupAnalysisOnly,
        Double speedupIncludingPipeline,
        int failedQueries) {

    public static BenchmarkSummary of(List<QueryTiming> timings, Map<String, Double> pipelineTimings) {
        double[] ondemand = successfulTimes(timings, Approach.ONDEMAND);
        double[] preagg = successfulTimes(timings, Approach.PREAGG);
        double pipelineTotal = pipelineTimings.values().stream().mapToDouble(Double::doubleValue).sum();
        long experiments = timings.stream().map(QueryTiming::experiment).distinct().count();

        double ondemandTotal = Arrays.stream(ondemand).sum();
        double preaggTotal = Arrays.stream(preagg).sum();
        int failed = (int) timings.stream().filter(t -> !t.succeeded()).count();

        return new BenchmarkSummary(
                ondemand.length,
                ondemandTotal,
                median(ondemand),
                preagg.length,
                preaggTotal,
                median(preagg),
                pipelineTotal,
                experiments == 0 ? 0.0 : pipelineTotal / experiments,
                preaggTotal + pipelineTotal,
                preaggTotal > 0 ? ondemandTotal / preaggTotal : null,
                preaggTotal + pipelineTotal > 0 ? ondemandTotal / (preaggTotal + pipelineTotal) : null,
                failed);
    }

    private static double[] successfulTimes(List<QueryTiming> timings, Approach approach) {
        return timings.stream()
                .filter(t -> t.approach().equals(approach.key()) && t.medianSeconds() > 0)
                .mapToDouble(QueryTiming::medianSeconds)
                .toArray();
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
