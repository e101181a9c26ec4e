package org.expbench.engine.config;

import java.util.Objects;

/**
 * Activation event: a unit only counts once it produced a row of {@code table}
 * matching {@code where}, at or after its first exposure.
 */
public record ActivationSpec(String name, String table, String where, String timestampColumn) {

    public ActivationSpec {
        Objects.requireNonNull(name, "Activation name cannot be null");
        Objects.requireNonNull(table, "Activation table cannot be null");
        Objects.requireNonNull(where, "Activation predicate cannot be null");
        Objects.requireNonNull(timestampColumn, "Activation timestamp column cannot be null");
    }
}
