package org.expbench.engine.assembly;

import org.expbench.engine.window.Approach;

import java.util.List;

/**
 * Weighting mode of a rendering.
 */
public enum Variant {
    /** The single on-demand rendering. */
    STANDARD("standard"),
    /** Pre-agg without partial-day correction. */
    UNWEIGHTED("unweighted"),
    /** Pre-agg with the first day of each window weighted by its covered fraction. */
    WEIGHTED("weighted");

    private final String key;

    Variant(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static List<Variant> forApproach(Approach approach) {
        return approach == Approach.ONDEMAND
                ? List.of(STANDARD)
                : List.of(UNWEIGHTED, WEIGHTED);
    }

    public boolean appliesTo(Approach approach) {
        return forApproach(approach).contains(this);
    }
}
