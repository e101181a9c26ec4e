package org.expbench.engine.config;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a benchmark renders: experiments crossed with metrics.
 */
public record ExperimentSuite(ImmutableList<ExperimentConfig> experiments, MetricCatalog metrics) {

    public ExperimentSuite {
        Set<String> seen = new HashSet<>();
        for (ExperimentConfig experiment : experiments) {
            if (!seen.add(experiment.id())) {
                throw new ConfigException("Duplicate experiment id: " + experiment.id());
            }
        }
    }

    public static ExperimentSuite of(List<ExperimentConfig> experiments, MetricCatalog metrics) {
        return new ExperimentSuite(Lists.immutable.withAll(experiments), metrics);
    }

    public ExperimentConfig experiment(String id) {
        return experiments.detectOptional(e -> e.id().equals(id))
                .orElseThrow(() -> new ConfigException("Unknown experiment: " + id));
    }

    /**
     * Restricts the suite to the given ids; an empty list keeps everything.
     */
    public ExperimentSuite filter(List<String> experimentIds, List<String> metricIds) {
        ImmutableList<ExperimentConfig> keptExperiments = experimentIds.isEmpty()
                ? experiments
                : Lists.immutable.withAll(experimentIds).collect(this::experiment);
        MetricCatalog keptMetrics = metricIds.isEmpty()
                ? metrics
                : new MetricCatalog(withDependencies(metricIds));
        return new ExperimentSuite(keptExperiments, keptMetrics);
    }

    private List<MetricConfig> withDependencies(List<String> metricIds) {
        Set<String> wanted = new HashSet<>(metricIds);
        for (String id : metricIds) {
            MetricConfig metric = metrics.get(id);
            if (metric.shape() == MetricShape.RATIO) {
                wanted.add(metric.numerator());
                wanted.add(metric.denominator());
                wanted.add(metrics.sourceOf(metrics.get(metric.numerator())).id());
                wanted.add(metrics.sourceOf(metrics.get(metric.denominator())).id());
            }
            if (metric.isDerived()) {
                wanted.add(metric.thresholdOf());
            }
        }
        return metrics.all().select(m -> wanted.contains(m.id())).castToList();
    }
}
