package org.expbench.engine.pipeline;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.expbench.engine.config.ActivationSpec;
import org.expbench.engine.config.Aggregation;
import org.expbench.engine.config.ConfigException;
import org.expbench.engine.config.DimensionType;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.config.MetricCatalog;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.config.MetricShape;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Which shared table and column holds each metric, plus everything the shared
 * exposure and activation tables must carry for the configured experiments.
 *
 * <p>Every binomial and count metric with its own source gets one column of
 * {@code shared_metrics_daily}, except distinct counts, which keep each day's distinct
 * values in {@code shared_sketches_array}; every quantile metric gets one array column
 * pair there (and a digest pair when t-digests are enabled). Threshold metrics resolve
 * to their base metric's column; ratios have no column. Metrics keyed by anything but
 * {@code user_id} have no pre-aggregated data.</p>
 */
public final class SharedTableLayout {

    private static final Set<String> RESERVED_COLUMNS = Set.of(
            SharedTables.USER_ID, SharedTables.ANONYMOUS_ID, SharedTables.METRIC_DATE);

    private final MetricCatalog metrics;
    private final Map<String, SharedColumn> arrayColumns = new LinkedHashMap<>();
    private final Map<String, SharedColumn> digestColumns = new LinkedHashMap<>();
    private final Map<String, SharedColumn> dailyColumns = new LinkedHashMap<>();
    private final Map<String, SharedColumn> distinctColumns = new LinkedHashMap<>();
    private final SortedSet<String> exposureTables = new TreeSet<>();
    private final SortedSet<String> idColumns = new TreeSet<>();
    private final SortedSet<String> dimensionColumns = new TreeSet<>();
    private final SortedMap<String, ActivationSpec> activations = new TreeMap<>();

    private SharedTableLayout(MetricCatalog metrics) {
        this.metrics = metrics;
    }

    public static SharedTableLayout of(ExperimentSuite suite) {
        SharedTableLayout layout = new SharedTableLayout(suite.metrics());
        layout.idColumns.add(SharedTables.USER_ID);
        layout.idColumns.add(SharedTables.ANONYMOUS_ID);

        for (MetricConfig metric : suite.metrics().sourceMetrics()) {
            if (RESERVED_COLUMNS.contains(metric.id())) {
                throw new ConfigException("Metric id collides with a shared key column: " + metric.id());
            }
            if (!SharedTables.USER_ID.equals(metric.idType())) {
                // pre-agg renderings of these metrics are skipped
                continue;
            }
            if (metric.shape() == MetricShape.COUNT && metric.aggregation() == Aggregation.COUNT_DISTINCT) {
                layout.distinctColumns.put(metric.id(), new SharedColumn(SharedTables.SKETCHES_ARRAY,
                        metric.id() + SharedTables.DISTINCT_SUFFIX, null));
            } else if (metric.shape() == MetricShape.QUANTILE) {
                layout.arrayColumns.put(metric.id(), new SharedColumn(SharedTables.SKETCHES_ARRAY,
                        metric.id() + SharedTables.VALUES_SUFFIX,
                        metric.id() + SharedTables.VALUES_SUFFIX + SharedTables.NONZERO_SUFFIX));
                layout.digestColumns.put(metric.id(), new SharedColumn(SharedTables.SKETCHES_TDIGEST,
                        metric.id() + SharedTables.DIGEST_SUFFIX,
                        metric.id() + SharedTables.DIGEST_SUFFIX + SharedTables.NONZERO_SUFFIX));
            } else {
                layout.dailyColumns.put(metric.id(), SharedColumn.daily(metric.id()));
            }
        }

        for (ExperimentConfig experiment : suite.experiments()) {
            layout.exposureTables.add(experiment.exposureTable());
            layout.idColumns.add(experiment.exposureId());
            if (experiment.hasDimension() && experiment.dimension().type() == DimensionType.EXPOSURE) {
                String column = experiment.dimension().column();
                if (!layout.idColumns.contains(column)) {
                    layout.dimensionColumns.add(column);
                }
            }
            if (experiment.hasActivation()) {
                ActivationSpec activation = experiment.activation();
                ActivationSpec existing = layout.activations.putIfAbsent(activation.name(), activation);
                if (existing != null && !existing.equals(activation)) {
                    throw new ConfigException("Activation " + activation.name()
                            + " is defined differently by several experiments");
                }
            }
        }
        return layout;
    }

    /**
     * Daily column of a binomial or count metric (threshold metrics resolve to their base).
     */
    public SharedColumn dailyColumn(MetricConfig metric) {
        MetricConfig source = metrics.sourceOf(metric);
        SharedColumn column = dailyColumns.get(source.id());
        if (column == null) {
            throw new IllegalArgumentException("No daily column for metric " + metric.id());
        }
        return column;
    }

    /**
     * True when the metric's source is a distinct count, kept as per-day value sets.
     */
    public boolean isDistinct(MetricConfig metric) {
        return distinctColumns.containsKey(metrics.sourceOf(metric).id());
    }

    /**
     * Per-day distinct value array of a distinct-count metric (threshold metrics resolve to their base).
     */
    public SharedColumn distinctColumn(MetricConfig metric) {
        SharedColumn column = distinctColumns.get(metrics.sourceOf(metric).id());
        if (column == null) {
            throw new IllegalArgumentException("No distinct value column for metric " + metric.id());
        }
        return column;
    }

    public SharedColumn arrayColumn(MetricConfig metric) {
        SharedColumn column = arrayColumns.get(metric.id());
        if (column == null) {
            throw new IllegalArgumentException("No sketch column for metric " + metric.id());
        }
        return column;
    }

    public SharedColumn digestColumn(MetricConfig metric) {
        SharedColumn column = digestColumns.get(metric.id());
        if (column == null) {
            throw new IllegalArgumentException("No digest column for metric " + metric.id());
        }
        return column;
    }

    public MutableList<MetricConfig> dailyMetrics() {
        return Lists.mutable.withAll(dailyColumns.keySet()).collect(metrics::get);
    }

    public MutableList<MetricConfig> quantileMetrics() {
        return Lists.mutable.withAll(arrayColumns.keySet()).collect(metrics::get);
    }

    public MutableList<MetricConfig> distinctMetrics() {
        return Lists.mutable.withAll(distinctColumns.keySet()).collect(metrics::get);
    }

    public List<String> exposureTables() {
        return List.copyOf(exposureTables);
    }

    public List<String> idColumns() {
        return List.copyOf(idColumns);
    }

    public List<String> dimensionColumns() {
        return List.copyOf(dimensionColumns);
    }

    public List<ActivationSpec> activations() {
        return List.copyOf(activations.values());
    }
}
