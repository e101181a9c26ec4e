package org.expbench.engine.config;

import java.util.Objects;

/**
 * Population filter: only units with at least one row of {@code table}
 * matching {@code where} are analysed.
 */
public record SegmentSpec(String name, String table, String where, String idColumn) {

    public SegmentSpec {
        Objects.requireNonNull(name, "Segment name cannot be null");
        Objects.requireNonNull(table, "Segment table cannot be null");
        Objects.requireNonNull(where, "Segment predicate cannot be null");
        Objects.requireNonNull(idColumn, "Segment id column cannot be null");
    }
}
