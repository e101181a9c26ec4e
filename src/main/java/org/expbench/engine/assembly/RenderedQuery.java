package org.expbench.engine.assembly;

import java.util.Objects;

public record RenderedQuery(QueryKey key, String sql) {

    public RenderedQuery {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(sql, "SQL cannot be null");
    }
}
