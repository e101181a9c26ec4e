package org.expbench.engine.benchmark;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.expbench.engine.assembly.QueryKey;
import org.expbench.engine.assembly.RenderBatch;
import org.expbench.engine.assembly.RenderedQuery;
import org.expbench.engine.pipeline.PipelineStatement;
import org.expbench.engine.window.Approach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes rendered SQL as one file per rendering, organized by approach, then experiment,
 * then metric, with a {@code manifest.json} listing them and the pipeline script.
 *
 * <pre>
 * ondemand/&lt;experiment&gt;/&lt;metric&gt;.sql
 * preagg/&lt;experiment&gt;/&lt;metric&gt;__&lt;variant&gt;.sql
 * pipeline.sql
 * manifest.json
 * </pre>
 */
public final class SqlArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlArtifactWriter.class);

    public static final String MANIFEST = "manifest.json";
    public static final String PIPELINE_SCRIPT = "pipeline.sql";

    private final Path root;

    public SqlArtifactWriter(Path root) {
        this.root = Objects.requireNonNull(root, "Output directory cannot be null");
    }

    public static String relativePath(QueryKey key) {
        String file = key.approach() == Approach.ONDEMAND
                ? key.metricId() + ".sql"
                : key.metricId() + "__" + key.variant().key() + ".sql";
        return key.approach().key() + "/" + key.experimentId() + "/" + file;
    }

    public Path write(RenderBatch batch, List<PipelineStatement> pipeline) throws IOException {
        Files.createDirectories(root);
        ArrayNode manifest = BenchmarkReport.JSON.createArrayNode();
        for (RenderedQuery query : batch.queries()) {
            String relative = relativePath(query.key());
            Path file = root.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, query.sql() + "\n", StandardCharsets.UTF_8);

            ObjectNode entry = manifest.addObject();
            entry.put("file", relative);
            entry.put("experiment", query.key().experimentId());
            entry.put("metric", query.key().metricId());
            entry.put("approach", query.key().approach().key());
            entry.put("variant", query.key().variant().key());
        }
        BenchmarkReport.JSON.writeValue(root.resolve(MANIFEST).toFile(), manifest);

        if (!pipeline.isEmpty()) {
            StringBuilder script = new StringBuilder();
            for (PipelineStatement statement : pipeline) {
                script.append("-- ").append(statement.table()).append('\n').append(statement.script()).append('\n');
            }
            Files.writeString(root.resolve(PIPELINE_SCRIPT), script.toString(), StandardCharsets.UTF_8);
        }
        LOG.info("Wrote {} queries to {}", batch.queries().size(), root);
        return root;
    }
}
