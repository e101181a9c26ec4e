package org.expbench.engine.pipeline;

/**
 * Names of the shared pre-aggregated tables and their key columns.
 */
public final class SharedTables {

    public static final String EXPOSURES = "shared_exposures";
    public static final String METRICS_DAILY = "shared_metrics_daily";
    public static final String ACTIVATIONS = "shared_activations";
    public static final String SKETCHES_ARRAY = "shared_sketches_array";
    public static final String SKETCHES_TDIGEST = "shared_sketches_tdigest";

    // shared_exposures
    public static final String EXPOSURE_SOURCE = "exposure_source";
    public static final String EXPERIMENT_ID = "experiment_id";
    public static final String VARIATION_ID = "variation_id";
    public static final String EXPOSURE_DATE = "exposure_date";
    public static final String FIRST_EXPOSURE_TIMESTAMP = "first_exposure_timestamp";
    public static final String LAST_EXPOSURE_TIMESTAMP = "last_exposure_timestamp";

    // every table is keyed by user
    public static final String USER_ID = "user_id";
    public static final String ANONYMOUS_ID = "anonymous_id";

    // shared_metrics_daily and sketches
    public static final String METRIC_DATE = "metric_date";

    // shared_activations
    public static final String ACTIVATION = "activation";
    public static final String ACTIVATION_DATE = "activation_date";
    public static final String FIRST_ACTIVATION_TIMESTAMP = "first_activation_timestamp";

    public static final String VALUES_SUFFIX = "_values";
    public static final String NONZERO_SUFFIX = "_nonzero";
    public static final String DISTINCT_SUFFIX = "_distinct_values";
    public static final String DIGEST_SUFFIX = "_digest";

    private SharedTables() {
    }
}
