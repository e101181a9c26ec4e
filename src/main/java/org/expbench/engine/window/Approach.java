package org.expbench.engine.window;

/**
 * Analysis strategy a query is rendered for.
 */
public enum Approach {
    /** Rescans raw event tables at timestamp precision. */
    ONDEMAND("ondemand"),
    /** Reads the shared pre-aggregated tables at calendar-day precision. */
    PREAGG("preagg");

    private final String key;

    Approach(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Approach fromKey(String key) {
        for (Approach approach : values()) {
            if (approach.key.equalsIgnoreCase(key)) {
                return approach;
            }
        }
        throw new IllegalArgumentException("Unknown approach: " + key);
    }
}
