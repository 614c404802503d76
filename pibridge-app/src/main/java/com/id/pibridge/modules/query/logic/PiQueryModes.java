package com.id.pibridge.modules.query.logic;

import com.id.pibridge.modules.query.model.PiQuery;
import com.id.pibridge.modules.query.model.PiQueryOptions;
import com.id.pibridge.modules.query.model.PiQuerySummary;
import com.id.pibridge.modules.query.model.PiToggle;

/**
 * Mode predicates and parameter fallbacks for a query. Missing nested objects read as "not enabled".
 */
public final class PiQueryModes {

    private PiQueryModes() {
    }

    public static PiQueryOptions options(PiQuery query) {
        return query.getPi() == null ? new PiQueryOptions() : query.getPi();
    }

    public static boolean isExpression(PiQueryOptions options) {
        return options.getExpression() != null && !options.getExpression().isEmpty();
    }

    /**
     * A summary is configured when it has a basis and at least one summary type.
     */
    public static boolean isSummary(PiQueryOptions options) {
        PiQuerySummary summary = options.getSummary();
        return summary != null
               && summary.getBasis() != null && !summary.getBasis().isEmpty()
               && summary.getTypes() != null && !summary.getTypes().isEmpty();
    }

    public static boolean isInterpolated(PiQueryOptions options) {
        return enabled(options.getInterpolate());
    }

    public static boolean isRecordedValues(PiQueryOptions options) {
        return options.getRecordedValues() != null && options.getRecordedValues().isEnable();
    }

    public static boolean isDigitalStates(PiQueryOptions options) {
        return enabled(options.getDigitalStates());
    }

    public static boolean isStreamingEnabled(PiQueryOptions options) {
        return enabled(options.getEnableStreaming());
    }

    /**
     * Calculations are never streamed.
     */
    public static boolean isStreamable(PiQuery query) {
        var options = options(query);
        return !isExpression(options) && isStreamingEnabled(options);
    }

    /**
     * Query override when non-zero, otherwise the host polling interval.
     */
    public static long getIntervalTime(PiQuery query) {
        long intervalTime = options(query).getIntervalMs();
        if (intervalTime == 0) {
            intervalTime = query.getIntervalMs();
        }
        return intervalTime;
    }

    /**
     * Query override when non-zero, otherwise the host max data points hint.
     */
    public static int getMaxDataPoints(PiQuery query) {
        int maxDataPoints = options(query).getMaxDataPoints();
        if (maxDataPoints == 0) {
            maxDataPoints = query.getMaxDataPoints();
        }
        return maxDataPoints;
    }

    private static boolean enabled(PiToggle toggle) {
        return toggle != null && toggle.isEnable();
    }
}
