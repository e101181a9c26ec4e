package org.expbench.engine.assembly;

/**
 * A combination that could not be rendered, with the reason.
 */
public record RenderSkip(QueryKey key, String reason) {
}
