package org.expbench.engine.transpiler;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Capability table of supported engines, keyed by engine identifier.
 * A new backend is added by registering its dialect here and providing a JDBC target.
 */
public final class DialectRegistry {

    private static final Map<String, SQLDialect> DIALECTS = List.of(DuckDBDialect.INSTANCE, PostgresDialect.INSTANCE)
            .stream()
            .collect(Collectors.toUnmodifiableMap(SQLDialect::engineId, Function.identity()));

    private DialectRegistry() {
    }

    /**
     * Resolves the dialect for an engine identifier (case-insensitive).
     *
     * @throws IllegalArgumentException if the engine is unknown
     */
    public static SQLDialect forEngine(String engineId) {
        SQLDialect dialect = DIALECTS.get(engineId.toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown engine: " + engineId + " (supported: " + supportedEngines() + ")");
        }
        return dialect;
    }

    public static List<String> supportedEngines() {
        return DIALECTS.keySet().stream().sorted().toList();
    }
}
