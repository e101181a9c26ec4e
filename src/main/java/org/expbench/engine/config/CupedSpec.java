package org.expbench.engine.config;

/**
 * Pre-exposure covariate: the same metric measured over
 * [first exposure - lookbackDays, first exposure).
 */
public record CupedSpec(int lookbackDays) {

    public static final int DEFAULT_LOOKBACK_DAYS = 4;

    public CupedSpec {
        if (lookbackDays <= 0) {
            throw new ConfigException("CUPED lookback_days must be positive: " + lookbackDays);
        }
    }

    public long lookbackHours() {
        return lookbackDays * 24L;
    }
}
