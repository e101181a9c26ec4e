package org.expbench.engine.config;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Resolved definition of one experiment analysis.
 *
 * @param id                    Analysis identifier (artifact and report key)
 * @param experimentId          Tracking key stored in the exposure table
 * @param exposureTable         Raw exposure source
 * @param exposureId            Id column units are keyed by ({@code user_id} or {@code anonymous_id})
 * @param startDate             Inclusive start of the exposure period
 * @param endDate               Exclusive end of the exposure period and of every window
 * @param attribution           Window end rule
 * @param conversionWindowHours Window length for first-exposure attribution
 * @param delayHours            Signed offset of the window start from first exposure
 * @param lookbackHours         When set, the window is [end - lookback, end) for everyone
 * @param skipPartialData       Drop users whose window would end after the experiment end
 * @param activation            Optional activation requirement
 * @param segment               Optional population filter
 * @param dimension             Optional breakdown
 */
public record ExperimentConfig(
        String id,
        String experimentId,
        String exposureTable,
        String exposureId,
        LocalDateTime startDate,
        LocalDateTime endDate,
        Attribution attribution,
        int conversionWindowHours,
        int delayHours,
        Integer lookbackHours,
        boolean skipPartialData,
        ActivationSpec activation,
        SegmentSpec segment,
        DimensionSpec dimension) {

    public static final String USER_ID = "user_id";

    public ExperimentConfig {
        Objects.requireNonNull(id, "Experiment id cannot be null");
        Objects.requireNonNull(experimentId, "Tracking key cannot be null");
        Objects.requireNonNull(exposureTable, "Exposure table cannot be null");
        Objects.requireNonNull(exposureId, "Exposure id column cannot be null");
        Objects.requireNonNull(startDate, "Start date cannot be null");
        Objects.requireNonNull(endDate, "End date cannot be null");
        Objects.requireNonNull(attribution, "Attribution cannot be null");

        if (!endDate.isAfter(startDate)) {
            throw new ConfigException(id + ": end_date must be after start_date");
        }
        if (conversionWindowHours <= 0) {
            throw new ConfigException(id + ": conversion_window_hours must be positive");
        }
        if (lookbackHours != null) {
            if (lookbackHours <= 0) {
                throw new ConfigException(id + ": lookback_hours must be positive");
            }
            if (delayHours != 0) {
                throw new ConfigException(id + ": delay_hours and lookback_hours cannot be set together");
            }
        }
        if (dimension != null && dimension.type() == DimensionType.ACTIVATION && activation == null) {
            throw new ConfigException(id + ": activation dimension requires an activation definition");
        }
    }

    public boolean hasLookback() {
        return lookbackHours != null;
    }

    public boolean hasActivation() {
        return activation != null;
    }

    public boolean hasSegment() {
        return segment != null;
    }

    public boolean hasDimension() {
        return dimension != null;
    }

    public boolean keyedByUser() {
        return USER_ID.equals(exposureId);
    }

    /**
     * True when the analysed population may legitimately differ between a
     * timestamp-precision and a day-precision rendering.
     */
    public boolean populationIsApproximate() {
        return hasActivation() || skipPartialData;
    }
}
