package org.expbench.engine.assembly;

import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.config.ExperimentSuite;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.window.Approach;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders every (experiment, metric, approach, variant) combination of a suite.
 * Combinations without a compilation rule are recorded as skips; rendering continues.
 */
public final class QueryRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(QueryRenderer.class);

    private final QueryAssembler assembler;

    public QueryRenderer(QueryAssembler assembler) {
        this.assembler = Objects.requireNonNull(assembler, "Assembler cannot be null");
    }

    public RenderBatch renderAll(ExperimentSuite suite, List<Approach> approaches) {
        List<RenderedQuery> queries = new ArrayList<>();
        List<RenderSkip> skips = new ArrayList<>();
        for (ExperimentConfig experiment : suite.experiments()) {
            for (MetricConfig metric : suite.metrics().all()) {
                for (Approach approach : approaches) {
                    for (Variant variant : Variant.forApproach(approach)) {
                        try {
                            queries.add(assembler.render(experiment, metric, approach, variant));
                        } catch (RenderException e) {
                            QueryKey key = new QueryKey(experiment.id(), metric.id(), approach, variant);
                            LOG.warn("Skipping {}: {}", key, e.getMessage());
                            skips.add(new RenderSkip(key, e.getMessage()));
                        }
                    }
                }
            }
        }
        LOG.info("Rendered {} queries ({} skipped)", queries.size(), skips.size());
        return new RenderBatch(queries, skips);
    }
}
