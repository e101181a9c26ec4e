package org.expbench.engine.assembly;

import java.util.List;

/**
 * Output of rendering a whole suite: the queries, in render order, and the skipped combinations.
 */
public record RenderBatch(List<RenderedQuery> queries, List<RenderSkip> skips) {

    public RenderBatch {
        queries = List.copyOf(queries);
        skips = List.copyOf(skips);
    }
}
