package org.expbench.engine.window;

import org.expbench.engine.config.Attribution;
import org.expbench.engine.config.CupedSpec;
import org.expbench.engine.config.ExperimentConfig;
import org.expbench.engine.plan.ArithmeticExpression;
import org.expbench.engine.plan.CastExpression;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.DateAdjustExpression;
import org.expbench.engine.plan.DatePartExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Turns an experiment's attribution, delay, lookback and skip-partial settings into
 * window boundary expressions for either approach.
 *
 * <p>Timestamp windows are exact. Day windows floor every bound to a calendar date:
 * the delay rounds away from zero to whole days, the window length rounds up, and
 * the experiment end maps to its last fully or partially covered day. The first
 * day of a day window may cover only part of the timestamp window; its covered
 * fraction is exposed for weighting.</p>
 */
public final class WindowResolver {

    private static final int HOURS_PER_DAY = 24;

    private final ExperimentConfig experiment;

    public WindowResolver(ExperimentConfig experiment) {
        this.experiment = Objects.requireNonNull(experiment, "Experiment cannot be null");
    }

    /**
     * Resolves the main conversion window of a unit.
     *
     * @param approach      Precision to resolve at
     * @param firstExposure Timestamp expression of the unit's first exposure
     */
    public WindowBounds resolve(Approach approach, Expression firstExposure) {
        return approach == Approach.ONDEMAND
                ? resolveTimestamps(firstExposure)
                : resolveDays(firstExposure);
    }

    private WindowBounds resolveTimestamps(Expression firstExposure) {
        Expression experimentEnd = Literal.timestamp(experiment.endDate());
        if (experiment.hasLookback()) {
            LocalDateTime lookbackStart = experiment.endDate().minusHours(experiment.lookbackHours());
            return WindowBounds.timestamps(Literal.timestamp(lookbackStart), experimentEnd);
        }
        Expression start = DateAdjustExpression.hours(firstExposure, experiment.delayHours());
        if (experiment.attribution() == Attribution.EXPERIMENT_DURATION) {
            return WindowBounds.timestamps(start, experimentEnd);
        }
        return WindowBounds.timestamps(start, timestampWindowEnd(firstExposure));
    }

    private WindowBounds resolveDays(Expression firstExposure) {
        Expression lastDay = Literal.date(lastDay());
        if (experiment.hasLookback()) {
            LocalDateTime lookbackStart = experiment.endDate().minusHours(experiment.lookbackHours());
            double fraction = (HOURS_PER_DAY - lookbackStart.getHour()) / (double) HOURS_PER_DAY;
            return WindowBounds.days(Literal.date(lookbackStart.toLocalDate()), lastDay, Literal.decimal(fraction));
        }
        Expression start = DateAdjustExpression.days(CastExpression.toDate(firstExposure), delayDays());
        Expression fraction = ArithmeticExpression.divide(
                ArithmeticExpression.subtract(Literal.integer(HOURS_PER_DAY), DatePartExpression.hour(firstExposure)),
                Literal.decimal(HOURS_PER_DAY));
        if (experiment.attribution() == Attribution.EXPERIMENT_DURATION) {
            return WindowBounds.days(start, lastDay, fraction);
        }
        return WindowBounds.days(start, dayWindowEnd(firstExposure), fraction);
    }

    /**
     * Covariate window for CUPED: {@code [exposure - lookback, exposure)}, never overlapping
     * a main window that starts at the exposure. Day windows end on the day before exposure
     * and are not weighted.
     */
    public WindowBounds covariate(Approach approach, Expression firstExposure, CupedSpec cuped) {
        if (approach == Approach.ONDEMAND) {
            return WindowBounds.timestamps(
                    DateAdjustExpression.hours(firstExposure, -cuped.lookbackHours()),
                    firstExposure);
        }
        Expression exposureDay = CastExpression.toDate(firstExposure);
        return WindowBounds.days(
                DateAdjustExpression.days(exposureDay, -cuped.lookbackDays()),
                DateAdjustExpression.days(exposureDay, -1),
                null);
    }

    /**
     * Window in which an activation event must occur: from first exposure to the experiment end.
     */
    public WindowBounds activation(Approach approach, Expression firstExposure) {
        if (approach == Approach.ONDEMAND) {
            return WindowBounds.timestamps(firstExposure, Literal.timestamp(experiment.endDate()));
        }
        return WindowBounds.days(CastExpression.toDate(firstExposure), Literal.date(lastDay()), null);
    }

    /**
     * Condition a unit must satisfy to be kept under skip-partial-data, or null when every
     * unit is kept. Only a first-exposure window can end after the experiment end.
     */
    public Expression completeWindowFilter(Approach approach, Expression firstExposure) {
        if (!experiment.skipPartialData()
                || experiment.hasLookback()
                || experiment.attribution() != Attribution.FIRST_EXPOSURE) {
            return null;
        }
        if (approach == Approach.ONDEMAND) {
            return ComparisonExpression.lessThanOrEquals(
                    timestampWindowEnd(firstExposure), Literal.timestamp(experiment.endDate()));
        }
        return ComparisonExpression.lessThanOrEquals(dayWindowEnd(firstExposure), Literal.date(lastDay()));
    }

    /**
     * Exposure period as a timestamp interval {@code [start, end)}.
     */
    public WindowBounds exposurePeriod(Approach approach) {
        if (approach == Approach.ONDEMAND) {
            return WindowBounds.timestamps(
                    Literal.timestamp(experiment.startDate()), Literal.timestamp(experiment.endDate()));
        }
        return WindowBounds.days(Literal.date(experiment.startDate().toLocalDate()), Literal.date(lastDay()), null);
    }

    private Expression timestampWindowEnd(Expression firstExposure) {
        return DateAdjustExpression.hours(firstExposure,
                (long) experiment.delayHours() + experiment.conversionWindowHours());
    }

    private Expression dayWindowEnd(Expression firstExposure) {
        return DateAdjustExpression.days(CastExpression.toDate(firstExposure), delayDays() + windowDays());
    }

    /**
     * Delay in whole days, rounded away from zero.
     */
    public long delayDays() {
        int delay = experiment.delayHours();
        return delay < 0
                ? Math.floorDiv(delay, HOURS_PER_DAY)
                : -Math.floorDiv(-delay, HOURS_PER_DAY);
    }

    /**
     * Window length in whole days, rounded up.
     */
    public long windowDays() {
        return -Math.floorDiv(-experiment.conversionWindowHours(), HOURS_PER_DAY);
    }

    /**
     * Last calendar day that holds events before the (exclusive) experiment end.
     */
    public LocalDate lastDay() {
        LocalDateTime end = experiment.endDate();
        return end.toLocalTime().equals(LocalTime.MIDNIGHT)
                ? end.toLocalDate().minusDays(1)
                : end.toLocalDate();
    }
}
