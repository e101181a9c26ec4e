package org.expbench.engine.metric;

/**
 * Position of a compiled component within a metric's output tuple.
 * The role name prefixes the stage names and output columns of the component.
 */
public enum MetricRole {
    MAIN("main"),
    DENOMINATOR("denominator");

    private final String prefix;

    MetricRole(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
