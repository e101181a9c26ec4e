package org.expbench.engine.benchmark;

import org.expbench.engine.assembly.QueryAssembler;
import org.expbench.engine.assembly.QueryRenderer;
import org.expbench.engine.assembly.RenderBatch;
import org.expbench.engine.assembly.RenderOptions;
import org.expbench.engine.config.BenchmarkSettings;
import org.expbench.engine.config.ConfigException;
import org.expbench.engine.config.ConfigLoader;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.execution.JdbcQueryExecutor;
import org.expbench.engine.pipeline.PipelineBuilder;
import org.expbench.engine.pipeline.PipelineCompiler;
import org.expbench.engine.pipeline.PipelineResult;
import org.expbench.engine.pipeline.PipelineStatement;
import org.expbench.engine.pipeline.SharedTableLayout;
import org.expbench.engine.transpiler.DialectRegistry;
import org.expbench.engine.transpiler.SQLDialect;
import org.expbench.engine.validation.FieldDelta;
import org.expbench.engine.validation.ValidationReport;
import org.expbench.engine.validation.ValidationResult;
import org.expbench.engine.window.Approach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * render   [options]             write rendered SQL, the pipeline script and manifest.json
 * pipeline [options] [--execute] print the pipeline statements, or build the shared tables
 * run      [options] [--validate] build the pipeline, time every query, write the JSON report
 * </pre>
 *
 * Exit status: 0 on success, 1 when a query, the pipeline or a comparison failed,
 * 2 on usage or configuration errors.
 */
public final class BenchmarkMain {

    private static final Logger LOG = LoggerFactory.getLogger(BenchmarkMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    static final String REPORT_FILE = "benchmark_results.json";

    private BenchmarkMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println(usage());
            return EXIT_USAGE;
        }
        if (options.help) {
            out.println(usage());
            return EXIT_OK;
        }

        try {
            BenchmarkSettings settings = options.settings();
            SQLDialect dialect = DialectRegistry.forEngine(settings.engine());
            ExperimentSuite suite = ConfigLoader.load(options.experimentsFile, options.metricsFile)
                    .filter(options.experiments, options.metrics);
            RenderOptions renderOptions = new RenderOptions(settings.approxQuantile(), settings.tdigest());
            List<PipelineStatement> pipeline = new PipelineCompiler(dialect, settings.tdigest())
                    .compile(SharedTableLayout.of(suite));

            switch (options.command) {
                case "render" -> {
                    RenderBatch batch = render(dialect, suite, renderOptions, options.approaches);
                    Path root = new SqlArtifactWriter(settings.outputDir()).write(batch, pipeline);
                    out.println("Rendered " + batch.queries().size() + " queries ("
                            + batch.skips().size() + " skipped) to " + root);
                    return EXIT_OK;
                }
                case "pipeline" -> {
                    if (!options.execute) {
                        pipeline.forEach(statement -> out.print(statement.script()));
                        return EXIT_OK;
                    }
                    try (JdbcQueryExecutor executor =
                                 JdbcQueryExecutor.connect(settings.target(), settings.queryTimeoutSeconds())) {
                        PipelineResult result = new PipelineBuilder(executor).build(pipeline);
                        result.timings().forEach((table, seconds) ->
                                out.printf("%-28s %8.3f s%n", table, seconds));
                        if (!result.succeeded()) {
                            out.println(result.failure().getMessage());
                            return EXIT_FAILURES;
                        }
                        return EXIT_OK;
                    }
                }
                default -> {
                    RenderBatch batch = render(dialect, suite, renderOptions, options.approaches);
                    new SqlArtifactWriter(settings.outputDir()).write(batch, pipeline);
                    BenchmarkReport report;
                    try (JdbcQueryExecutor executor =
                                 JdbcQueryExecutor.connect(settings.target(), settings.queryTimeoutSeconds())) {
                        report = new BenchmarkRunner(executor, settings).run(suite, batch, pipeline, options.validate);
                    }
                    Path file = settings.outputDir().resolve(REPORT_FILE);
                    report.write(file);
                    printSummary(report, out);
                    out.println("Report written to " + file);
                    return report.hasFailures() ? EXIT_FAILURES : EXIT_OK;
                }
            }
        } catch (ConfigException | IllegalArgumentException e) {
            out.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (SQLException e) {
            LOG.error("Database error", e);
            out.println("Database error: " + e.getMessage());
            return EXIT_FAILURES;
        } catch (IOException e) {
            LOG.error("Failed to write output", e);
            out.println("Failed to write output: " + e.getMessage());
            return EXIT_FAILURES;
        }
    }

    private static RenderBatch render(SQLDialect dialect, ExperimentSuite suite, RenderOptions options,
                                      List<Approach> approaches) {
        QueryAssembler assembler = QueryAssembler.forSuite(dialect, suite, options);
        return new QueryRenderer(assembler).renderAll(suite, approaches);
    }

    static void printSummary(BenchmarkReport report, PrintStream out) {
        BenchmarkSummary s = report.summary();
        out.println();
        out.println("======================================");
        out.println("  Benchmark summary (" + report.engine() + ")");
        out.println("======================================");
        out.printf("  On-demand: %d queries, %.3f s total, median %.4f s%n",
                s.ondemandQueryCount(), s.ondemandTotalSeconds(), s.ondemandMedianPerQuery());
        out.printf("  Pre-agg:   %d queries, %.3f s total, median %.4f s%n",
                s.preaggQueryCount(), s.preaggTotalSeconds(), s.preaggMedianPerQuery());
        out.printf("  Pipeline:  %.3f s (%.3f s per experiment)%n",
                s.pipelineTotalSeconds(), s.pipelineAmortizedPerExperiment());
        out.println("  Speedup (analysis only):     " + speedup(s.speedupAnalysisOnly()));
        out.println("  Speedup (including pipeline): " + speedup(s.speedupIncludingPipeline()));
        if (report.pipelineError() != null) {
            out.println("  Pipeline FAILED: " + report.pipelineError());
        }
        for (QueryTiming timing : report.queries()) {
            if (!timing.succeeded()) {
                out.println("  FAILED " + timing.approach() + "/" + timing.experiment() + "/" + timing.metric()
                        + " [" + timing.variant() + "]: " + timing.error());
            }
        }
        if (report.validation() != null) {
            ValidationReport v = report.validation();
            out.printf("  Validation: %d compared, exact (<1%%) %d, close (1-10%%) %d, far (>=10%%) %d%n",
                    v.totalComparisons(), v.exactBelow1Pct(), v.close1To10Pct(), v.farAbove10Pct());
            out.printf("  Max relative diff: median %.2f%%, p95 %.2f%%, max %.2f%%%n",
                    v.diffStats().medianPct(), v.diffStats().p95Pct(), v.diffStats().maxPct());
            for (ValidationResult failure : v.failures()) {
                out.println("  " + failure.verdict() + " " + failure.key()
                        + (failure.message() != null ? ": " + failure.message() : ""));
                for (FieldDelta d : failure.failures()) {
                    out.printf("    %s %s: expected %s, actual %s (%.2f%%)%n",
                            d.group(), d.field(), d.expected(), d.actual(), d.relativeDiff() * 100);
                }
            }
        }
    }

    private static String speedup(Double value) {
        return value == null ? "N/A" : String.format("%.1fx", value);
    }

    static String usage() {
        return String.join("\n",
                "Usage: expbench <render|pipeline|run> [options]",
                "  --engine <duckdb|postgres>   engine dialect (default duckdb)",
                "  --target <jdbc-url|path>     database to connect to",
                "  --experiments <id,...>       restrict to these experiments",
                "  --metrics <id,...>           restrict to these metrics",
                "  --approach <ondemand|preagg|both>",
                "  --output <dir>               output directory",
                "  --warmup <n>                 warmup runs per query",
                "  --runs <n>                   timed runs per query",
                "  --timeout <seconds>          per-query timeout (0 disables)",
                "  --approx-quantile            use approximate percentiles",
                "  --tdigest                    read pre-agg quantiles from t-digest sketches",
                "  --validate                   compare pre-agg against on-demand results (run)",
                "  --execute                    build the shared tables (pipeline)",
                "  --settings <file>            YAML settings file",
                "  --experiments-file <file>    experiments YAML (default: bundled)",
                "  --metrics-file <file>        metrics YAML (default: bundled)");
    }

    /**
     * Parsed command line.
     */
    static final class Options {
        String command;
        boolean help;
        Path settingsFile;
        Path experimentsFile;
        Path metricsFile;
        List<String> experiments = List.of();
        List<String> metrics = List.of();
        List<Approach> approaches = List.of(Approach.ONDEMAND, Approach.PREAGG);
        boolean validate;
        boolean execute;

        String engine;
        String target;
        Path output;
        Integer warmup;
        Integer runs;
        Integer timeout;
        boolean approxQuantile;
        boolean tdigest;

        static Options parse(String[] args) {
            Options options = new Options();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> options.help = true;
                    case "--validate" -> options.validate = true;
                    case "--execute" -> options.execute = true;
                    case "--approx-quantile" -> options.approxQuantile = true;
                    case "--tdigest" -> options.tdigest = true;
                    case "--engine" -> options.engine = value(args, ++i, arg);
                    case "--target" -> options.target = value(args, ++i, arg);
                    case "--output" -> options.output = Path.of(value(args, ++i, arg));
                    case "--settings" -> options.settingsFile = Path.of(value(args, ++i, arg));
                    case "--experiments-file" -> options.experimentsFile = Path.of(value(args, ++i, arg));
                    case "--metrics-file" -> options.metricsFile = Path.of(value(args, ++i, arg));
                    case "--experiments" -> options.experiments = list(value(args, ++i, arg));
                    case "--metrics" -> options.metrics = list(value(args, ++i, arg));
                    case "--approach" -> options.approaches = approaches(value(args, ++i, arg));
                    case "--warmup" -> options.warmup = integer(value(args, ++i, arg), arg);
                    case "--runs" -> options.runs = integer(value(args, ++i, arg), arg);
                    case "--timeout" -> options.timeout = integer(value(args, ++i, arg), arg);
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        positional.add(arg);
                    }
                }
            }
            if (options.help) {
                return options;
            }
            if (positional.size() != 1) {
                throw new IllegalArgumentException("Expected exactly one command");
            }
            options.command = positional.get(0);
            if (!List.of("render", "pipeline", "run").contains(options.command)) {
                throw new IllegalArgumentException("Unknown command: " + options.command);
            }
            return options;
        }

        /**
         * Settings file (if any) overridden by flags.
         */
        BenchmarkSettings settings() {
            BenchmarkSettings.Builder builder = settingsFile != null
                    ? ConfigLoader.loadSettings(settingsFile).toBuilder()
                    : BenchmarkSettings.builder();
            if (engine != null) {
                builder.engine(engine);
            }
            if (target != null) {
                builder.target(target);
            }
            if (output != null) {
                builder.outputDir(output);
            }
            if (warmup != null) {
                builder.warmupRuns(warmup);
            }
            if (runs != null) {
                builder.timedRuns(runs);
            }
            if (timeout != null) {
                builder.queryTimeoutSeconds(timeout);
            }
            BenchmarkSettings base = builder.build();
            return base.toBuilder()
                    .approxQuantile(base.approxQuantile() || approxQuantile)
                    .tdigest(base.tdigest() || tdigest)
                    .build();
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException(flag + " requires a value");
            }
            return args[index];
        }

        private static List<String> list(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        private static Integer integer(String value, String flag) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects an integer: " + value);
            }
        }

        private static List<Approach> approaches(String value) {
            if ("both".equalsIgnoreCase(value)) {
                return List.of(Approach.ONDEMAND, Approach.PREAGG);
            }
            return List.of(Approach.fromKey(value));
        }
    }
}
