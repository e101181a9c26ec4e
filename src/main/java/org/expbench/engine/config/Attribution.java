package org.expbench.engine.config;

/**
 * Rule deciding when a user's conversion window ends.
 */
public enum Attribution {
    /** Window spans a fixed number of hours after the (delayed) first exposure. */
    FIRST_EXPOSURE("first_exposure"),
    /** Window runs from the (delayed) first exposure to the experiment end. */
    EXPERIMENT_DURATION("experiment_duration");

    private final String key;

    Attribution(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Attribution fromKey(String key) {
        for (Attribution attribution : values()) {
            if (attribution.key.equalsIgnoreCase(key)) {
                return attribution;
            }
        }
        throw new ConfigException("Unknown attribution: " + key);
    }
}
