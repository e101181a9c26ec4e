package org.expbench.engine.config;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metric definitions in declaration order, with cross-references checked.
 */
public final class MetricCatalog {

    private final Map<String, MetricConfig> byId = new LinkedHashMap<>();

    public MetricCatalog(List<MetricConfig> metrics) {
        for (MetricConfig metric : metrics) {
            if (byId.putIfAbsent(metric.id(), metric) != null) {
                throw new ConfigException("Duplicate metric id: " + metric.id());
            }
        }
        for (MetricConfig metric : metrics) {
            if (metric.shape() == MetricShape.RATIO) {
                requireComponent(metric, metric.numerator(), "numerator");
                requireComponent(metric, metric.denominator(), "denominator");
            }
            if (metric.isDerived()) {
                MetricConfig base = byId.get(metric.thresholdOf());
                if (base == null) {
                    throw new ConfigException(metric.id() + ": threshold_of references unknown metric "
                            + metric.thresholdOf());
                }
                if (base.shape() != MetricShape.COUNT || base.isDerived()) {
                    throw new ConfigException(metric.id() + ": threshold_of must reference a count metric");
                }
            }
        }
    }

    private void requireComponent(MetricConfig ratio, String componentId, String role) {
        MetricConfig component = byId.get(componentId);
        if (component == null) {
            throw new ConfigException(ratio.id() + ": unknown " + role + " metric " + componentId);
        }
        if (component.shape() != MetricShape.BINOMIAL && component.shape() != MetricShape.COUNT) {
            throw new ConfigException(ratio.id() + ": " + role + " " + componentId
                    + " must be a binomial or count metric");
        }
    }

    public MetricConfig get(String id) {
        MetricConfig metric = byId.get(id);
        if (metric == null) {
            throw new ConfigException("Unknown metric: " + id);
        }
        return metric;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public ImmutableList<MetricConfig> all() {
        return Lists.immutable.withAll(byId.values());
    }

    /**
     * Metrics that carry their own source data (binomial/count with a table, quantile).
     */
    public MutableList<MetricConfig> sourceMetrics() {
        return Lists.mutable.withAll(byId.values())
                .select(m -> m.shape() != MetricShape.RATIO && !m.isDerived());
    }

    /**
     * Resolves the metric whose per-row data a metric reads: itself, or the base of a threshold metric.
     */
    public MetricConfig sourceOf(MetricConfig metric) {
        return metric.isDerived() ? get(metric.thresholdOf()) : metric;
    }

    public MutableList<MetricConfig> select(List<String> ids) {
        MutableList<MetricConfig> selected = Lists.mutable.empty();
        for (String id : ids) {
            selected.add(get(id));
        }
        return selected;
    }

    public int size() {
        return byId.size();
    }
}
