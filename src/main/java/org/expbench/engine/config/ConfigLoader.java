package org.expbench.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads experiment, metric and benchmark settings from YAML.
 *
 * Lookup order for experiments and metrics:
 * 1) explicit file passed by the caller
 * 2) classpath resources {@code configs/experiments.yaml} and {@code configs/metrics.yaml}
 */
public final class ConfigLoader {

    public static final String DEFAULT_EXPERIMENTS_RESOURCE = "configs/experiments.yaml";
    public static final String DEFAULT_METRICS_RESOURCE = "configs/metrics.yaml";

    static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static ExperimentSuite loadDefault() {
        return ExperimentSuite.of(
                parseExperiments(readClasspath(DEFAULT_EXPERIMENTS_RESOURCE)),
                parseMetrics(readClasspath(DEFAULT_METRICS_RESOURCE)));
    }

    /**
     * Loads a suite, falling back to the bundled configuration for a null path.
     */
    public static ExperimentSuite load(Path experimentsFile, Path metricsFile) {
        JsonNode experiments = experimentsFile != null
                ? readFile(experimentsFile)
                : readClasspath(DEFAULT_EXPERIMENTS_RESOURCE);
        JsonNode metrics = metricsFile != null
                ? readFile(metricsFile)
                : readClasspath(DEFAULT_METRICS_RESOURCE);
        ExperimentSuite suite = ExperimentSuite.of(parseExperiments(experiments), parseMetrics(metrics));
        LOG.info("Loaded {} experiments and {} metrics", suite.experiments().size(), suite.metrics().size());
        return suite;
    }

    /**
     * Parses a suite from YAML documents held in memory.
     */
    public static ExperimentSuite parse(String experimentsYaml, String metricsYaml) {
        try {
            return ExperimentSuite.of(
                    parseExperiments(YAML.readTree(experimentsYaml)),
                    parseMetrics(YAML.readTree(metricsYaml)));
        } catch (IOException ex) {
            throw new ConfigException("Failed to parse configuration: " + ex.getMessage(), ex);
        }
    }

    public static BenchmarkSettings loadSettings(Path settingsFile) {
        return parseSettings(readFile(settingsFile), BenchmarkSettings.builder());
    }

    static JsonNode readClasspath(String resourcePath) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ConfigException("Configuration resource not found on classpath: " + resourcePath);
            }
            return YAML.readTree(in);
        } catch (IOException ex) {
            throw new ConfigException("Failed to read configuration resource: " + resourcePath, ex);
        }
    }

    static JsonNode readFile(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        try {
            JsonNode root = YAML.readTree(path.toFile());
            LOG.debug("Read configuration {}", path);
            return root;
        } catch (IOException ex) {
            throw new ConfigException("Failed to read configuration file: " + path, ex);
        }
    }

    // ==================== Experiments ====================

    static List<ExperimentConfig> parseExperiments(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("Experiment configuration is not a mapping");
        }
        JsonNode defaults = root.path("defaults");
        JsonNode experiments = root.path("experiments");
        if (!experiments.isArray()) {
            throw new ConfigException("Experiment configuration missing experiments list");
        }

        List<ExperimentConfig> parsed = new ArrayList<>();
        for (JsonNode node : experiments) {
            if (!node.isObject()) {
                throw new ConfigException("Experiment entry is not a mapping: " + node);
            }
            ObjectNode merged = YAML.createObjectNode();
            if (defaults.isObject()) {
                merged.setAll((ObjectNode) defaults);
            }
            merged.setAll((ObjectNode) node);
            parsed.add(parseExperiment(merged));
        }
        return parsed;
    }

    static ExperimentConfig parseExperiment(JsonNode node) {
        String id = requiredText(node, "id", "experiment");
        Integer lookback = node.hasNonNull("lookback_hours") ? node.get("lookback_hours").asInt() : null;
        return new ExperimentConfig(
                id,
                text(node, "experiment_id", id),
                text(node, "exposure_table", "viewed_experiment"),
                text(node, "exposure_id", ExperimentConfig.USER_ID),
                timestamp(node, "start_date", id),
                timestamp(node, "end_date", id),
                Attribution.fromKey(text(node, "attribution", Attribution.FIRST_EXPOSURE.key())),
                node.path("conversion_window_hours").asInt(72),
                node.path("delay_hours").asInt(0),
                lookback,
                node.path("skip_partial_data").asBoolean(false),
                parseActivation(node.path("activation"), id),
                parseSegment(node.path("segment"), id),
                parseDimension(node.path("dimension")));
    }

    private static ActivationSpec parseActivation(JsonNode node, String experimentId) {
        if (!node.isObject()) {
            return null;
        }
        return new ActivationSpec(
                requiredText(node, "name", experimentId + " activation"),
                requiredText(node, "table", experimentId + " activation"),
                requiredText(node, "where", experimentId + " activation"),
                text(node, "timestamp_column", "timestamp"));
    }

    private static SegmentSpec parseSegment(JsonNode node, String experimentId) {
        if (!node.isObject()) {
            return null;
        }
        return new SegmentSpec(
                requiredText(node, "name", experimentId + " segment"),
                requiredText(node, "table", experimentId + " segment"),
                requiredText(node, "where", experimentId + " segment"),
                text(node, "id_column", ExperimentConfig.USER_ID));
    }

    private static DimensionSpec parseDimension(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        return new DimensionSpec(
                DimensionType.fromKey(text(node, "type", null)),
                text(node, "column", null),
                text(node, "table", null));
    }

    // ==================== Metrics ====================

    static MetricCatalog parseMetrics(JsonNode root) {
        JsonNode metrics = root == null ? null : root.path("metrics");
        if (metrics == null || !metrics.isArray()) {
            throw new ConfigException("Metric configuration missing metrics list");
        }
        List<MetricConfig> parsed = new ArrayList<>();
        for (JsonNode node : metrics) {
            parsed.add(parseMetric(node));
        }
        return new MetricCatalog(parsed);
    }

    static MetricConfig parseMetric(JsonNode node) {
        String id = requiredText(node, "id", "metric");
        MetricShape shape = MetricShape.fromKey(requiredText(node, "type", id));

        JsonNode capping = node.path("capping");
        Double capPercentile = capping.hasNonNull("percentile") ? capping.get("percentile").asDouble() : null;

        JsonNode cupedNode = node.path("cuped");
        CupedSpec cuped = cupedNode.path("enabled").asBoolean(false)
                ? new CupedSpec(cupedNode.path("lookback_days").asInt(CupedSpec.DEFAULT_LOOKBACK_DAYS))
                : null;

        QuantileSpec quantile = null;
        if (shape == MetricShape.QUANTILE) {
            if (!node.hasNonNull("quantile")) {
                throw new ConfigException(id + ": quantile metric requires a quantile");
            }
            quantile = new QuantileSpec(
                    node.get("quantile").asDouble(),
                    QuantileLevel.fromKey(text(node, "level", "event")),
                    node.path("ignore_zeros").asBoolean(false));
        }

        String rollup = text(node, "rollup", null);
        return new MetricConfig(
                id,
                shape,
                text(node, "table", null),
                text(node, "timestamp_column", "timestamp"),
                text(node, "id_type", ExperimentConfig.USER_ID),
                text(node, "value", "1"),
                text(node, "where", null),
                Aggregation.fromKey(text(node, "aggregation", "sum")),
                text(node, "aggregate", null),
                rollup == null ? null : Rollup.fromKey(rollup),
                node.path("preserve_nulls").asBoolean(false),
                capPercentile,
                cuped,
                text(node, "numerator", null),
                text(node, "denominator", null),
                quantile,
                text(node, "threshold_of", null),
                node.hasNonNull("threshold") ? node.get("threshold").asDouble() : null);
    }

    // ==================== Settings ====================

    static BenchmarkSettings parseSettings(JsonNode root, BenchmarkSettings.Builder builder) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("Settings file is not a mapping");
        }
        if (root.hasNonNull("engine")) {
            builder.engine(root.get("engine").asText());
        }
        if (root.hasNonNull("target")) {
            builder.target(root.get("target").asText());
        }
        if (root.hasNonNull("output")) {
            builder.outputDir(Path.of(root.get("output").asText()));
        }
        if (root.hasNonNull("warmup_runs")) {
            builder.warmupRuns(root.get("warmup_runs").asInt());
        }
        if (root.hasNonNull("timed_runs")) {
            builder.timedRuns(root.get("timed_runs").asInt());
        }
        if (root.hasNonNull("query_timeout_seconds")) {
            builder.queryTimeoutSeconds(root.get("query_timeout_seconds").asInt());
        }
        builder.approxQuantile(root.path("approx_quantile").asBoolean(false));
        builder.tdigest(root.path("tdigest").asBoolean(false));

        JsonNode tolerances = root.path("tolerances");
        if (tolerances.isObject()) {
            Tolerances d = Tolerances.DEFAULT;
            builder.tolerances(new Tolerances(
                    tolerances.path("unweighted").asDouble(d.unweighted()),
                    tolerances.path("weighted").asDouble(d.weighted()),
                    tolerances.path("quantile").asDouble(d.quantile()),
                    tolerances.path("capped").asDouble(d.capped())));
        }
        return builder.build();
    }

    // ==================== Helpers ====================

    private static String text(JsonNode node, String key, String fallback) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        String text = value.asText().strip();
        return text.isEmpty() ? fallback : text;
    }

    private static String requiredText(JsonNode node, String key, String owner) {
        String value = text(node, key, null);
        if (value == null) {
            throw new ConfigException(owner + ": missing required key '" + key + "'");
        }
        return value;
    }

    private static LocalDateTime timestamp(JsonNode node, String key, String owner) {
        String value = requiredText(node, key, owner);
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            return LocalDateTime.parse(value.replace(' ', 'T'));
        } catch (DateTimeParseException ex) {
            throw new ConfigException(owner + ": invalid " + key + " '" + value + "'", ex);
        }
    }
}
