package com.id.pibridge.modules.query.logic;

import com.id.pibridge.modules.query.model.PiLabeledValue;
import com.id.pibridge.modules.query.model.PiQuery;
import com.id.pibridge.modules.query.model.PiQueryOptions;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static com.id.pibridge.modules.query.logic.PiQueryModes.*;

/**
 * Maps a query to the PI Web API resource that serves it.
 * <p>
 * Calculations go to {@code /calculation/summary} or {@code /calculation/intervals}. Everything else goes to
 * {@code /streamsets}, picking the first of summary, interpolated, recorded and plot that applies.
 */
public final class QueryUriBuilder {

    public static final String DEFAULT_SUMMARY_DURATION = "30s";

    private QueryUriBuilder() {
    }

    /**
     * Full sub-request resource for one resolved target.
     */
    public static String buildResource(String baseUrl, PiQuery query, String webId) {
        return baseUrl + buildQueryUri(query) + "&webid=" + webId;
    }

    public static String buildQueryUri(PiQuery query) {
        var options = options(query);
        var uri = new StringBuilder();

        if (isExpression(options)) {
            uri.append("/calculation");
            if (isSummary(options)) {
                uri.append("/summary").append(getTimeRangeUriComponent(query));
                if (isInterpolated(options)) {
                    uri.append("&sampleType=Interval&sampleInterval=%dms".formatted(getIntervalTime(query)));
                }
            } else {
                uri.append("/intervals").append(getTimeRangeUriComponent(query));
                uri.append("&sampleInterval=%dms".formatted(getIntervalTime(query)));
            }
            uri.append("&expression=").append(escape(options.getExpression()));
            return uri.toString();
        }

        uri.append("/streamsets");
        if (isSummary(options)) {
            uri.append("/summary").append(getTimeRangeUriComponent(query))
                    .append("&intervals=%d".formatted(getMaxDataPoints(query)))
                    .append(getSummaryUriComponent(options));
        } else if (isInterpolated(options)) {
            uri.append("/interpolated").append(getTimeRangeUriComponent(query))
                    .append("&interval=%d".formatted(getIntervalTime(query)));
        } else if (isRecordedValues(options)) {
            uri.append("/recorded").append(getTimeRangeUriComponent(query))
                    .append("&maxCount=%d".formatted(getMaxDataPoints(query)));
        } else {
            uri.append("/plot").append(getTimeRangeUriComponent(query))
                    .append("&intervals=%d".formatted(getMaxDataPoints(query)));
        }
        return uri.toString();
    }

    /**
     * {@code ?startTime=..&endTime=..} in UTC RFC-3339, second precision.
     */
    public static String getTimeRangeUriComponent(PiQuery query) {
        var range = query.getTimeRange();
        if (range == null || range.getFrom() == null || range.getTo() == null) {
            throw new IllegalArgumentException("Query %s has no time range".formatted(query.getRefId()));
        }
        return "?startTime=" + format(range.getFrom()) + "&endTime=" + format(range.getTo());
    }

    /**
     * Summary types, basis and duration. Empty for calculations, which take only the summary time range.
     */
    public static String getSummaryUriComponent(PiQueryOptions options) {
        if (isExpression(options)) {
            return "";
        }
        var uri = new StringBuilder();
        for (PiLabeledValue type : options.getSummary().getTypes()) {
            uri.append("&summaryType=").append(escape(summaryTypeName(type)));
        }
        uri.append("&summaryBasis=").append(escape(options.getSummary().getBasis()));
        uri.append("&summaryDuration=").append(escape(getSummaryDuration(options)));
        return uri.toString();
    }

    public static String getSummaryDuration(PiQueryOptions options) {
        var interval = options.getSummary() == null ? null : options.getSummary().getInterval();
        if (interval == null || interval.isEmpty()) {
            return DEFAULT_SUMMARY_DURATION;
        }
        return interval;
    }

    private static String summaryTypeName(PiLabeledValue type) {
        if (type.getValue() != null && type.getValue().getValue() != null) {
            return type.getValue().getValue();
        }
        return type.getLabel() == null ? "" : type.getLabel();
    }

    private static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    /**
     * Query-component escaping: everything except {@code A-Z a-z 0-9 - _ . ~} is percent-encoded and spaces
     * become {@code +}.
     */
    public static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
