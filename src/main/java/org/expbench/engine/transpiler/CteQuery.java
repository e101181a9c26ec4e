package org.expbench.engine.transpiler;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates named stages and renders them as a single WITH query.
 * Stage bodies are indented under their name; the final SELECT follows the last stage.
 */
public final class CteQuery {

    private static final String INDENT = "  ";

    private final List<String> names = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();

    public CteQuery with(String name, String body) {
        if (names.contains(name)) {
            throw new IllegalStateException("Stage already defined: " + name);
        }
        names.add(name);
        bodies.add(body);
        return this;
    }

    public String select(String finalSelect) {
        if (names.isEmpty()) {
            return finalSelect;
        }
        StringBuilder sb = new StringBuilder("WITH ");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append(",\n");
            }
            sb.append(names.get(i)).append(" AS (\n");
            sb.append(indent(bodies.get(i)));
            sb.append("\n)");
        }
        sb.append("\n").append(finalSelect);
        return sb.toString();
    }

    private static String indent(String body) {
        return body.lines().map(line -> INDENT + line).collect(Collectors.joining("\n"));
    }
}
