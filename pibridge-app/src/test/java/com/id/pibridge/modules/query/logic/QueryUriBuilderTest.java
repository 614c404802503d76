package com.id.pibridge.modules.query.logic;

import com.id.pibridge.modules.query.model.PiLabeledValue;
import com.id.pibridge.modules.query.model.PiQuery;
import com.id.pibridge.modules.query.model.PiQueryOptions;
import com.id.pibridge.modules.query.model.PiQuerySummary;
import com.id.pibridge.modules.query.model.PiRecordedValues;
import com.id.pibridge.modules.query.model.PiTimeRange;
import com.id.pibridge.modules.query.model.PiToggle;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class QueryUriBuilderTest {

    private static final String RANGE = "?startTime=2024-01-01T00:00:00Z&endTime=2024-01-01T06:00:00Z";

    private static PiQuery query(PiQueryOptions options) {
        return PiQuery.builder()
                .refId("A")
                .maxDataPoints(500)
                .intervalMs(30000)
                .timeRange(new PiTimeRange(
                        Instant.parse("2024-01-01T00:00:00.250Z"),
                        Instant.parse("2024-01-01T06:00:00Z")))
                .pi(options)
                .build();
    }

    private static PiQuerySummary summary(String interval, String... types) {
        return PiQuerySummary.builder()
                .basis("TimeWeighted")
                .interval(interval)
                .types(Stream.of(types).map(PiLabeledValue::of).toList())
                .build();
    }

    @Test
    void shouldBuildPlotByDefault() {
        var uri = QueryUriBuilder.buildQueryUri(query(new PiQueryOptions()));

        assertEquals("/streamsets/plot" + RANGE + "&intervals=500", uri);
    }

    @Test
    void shouldPreferQueryMaxDataPointsOverride() {
        var uri = QueryUriBuilder.buildQueryUri(query(PiQueryOptions.builder().maxDataPoints(42).build()));

        assertEquals("/streamsets/plot" + RANGE + "&intervals=42", uri);
    }

    @Test
    void shouldBuildRecorded() {
        var options = PiQueryOptions.builder()
                .recordedValues(PiRecordedValues.builder().enable(true).build())
                .build();

        assertEquals("/streamsets/recorded" + RANGE + "&maxCount=500", QueryUriBuilder.buildQueryUri(query(options)));
    }

    @Test
    void shouldBuildInterpolatedAheadOfRecorded() {
        var options = PiQueryOptions.builder()
                .interpolate(PiToggle.on())
                .recordedValues(PiRecordedValues.builder().enable(true).build())
                .intervalMs(1000)
                .build();

        assertEquals("/streamsets/interpolated" + RANGE + "&interval=1000", QueryUriBuilder.buildQueryUri(query(options)));
    }

    @Test
    void shouldBuildSummaryAheadOfEverythingElse() {
        var options = PiQueryOptions.builder()
                .interpolate(PiToggle.on())
                .recordedValues(PiRecordedValues.builder().enable(true).build())
                .summary(summary("1h", "Average", "Maximum"))
                .build();

        var uri = QueryUriBuilder.buildQueryUri(query(options));

        assertEquals("/streamsets/summary" + RANGE + "&intervals=500"
                     + "&summaryType=Average&summaryType=Maximum&summaryBasis=TimeWeighted&summaryDuration=1h", uri);
    }

    @Test
    void shouldDefaultSummaryDuration() {
        var options = PiQueryOptions.builder().summary(summary("", "Total")).build();

        var uri = QueryUriBuilder.buildQueryUri(query(options));

        assertTrue(uri.endsWith("&summaryType=Total&summaryBasis=TimeWeighted&summaryDuration=30s"), uri);
    }

    @Test
    void shouldNotTreatSummaryWithoutTypesAsSummary() {
        var options = PiQueryOptions.builder()
                .summary(PiQuerySummary.builder().basis("TimeWeighted").types(List.of()).build())
                .build();

        assertTrue(QueryUriBuilder.buildQueryUri(query(options)).startsWith("/streamsets/plot?"));
    }

    @Test
    void shouldSelectExactlyOneStreamsetMode() {
        List<PiQueryOptions> variants = List.of(
                new PiQueryOptions(),
                PiQueryOptions.builder().interpolate(PiToggle.on()).build(),
                PiQueryOptions.builder().recordedValues(PiRecordedValues.builder().enable(true).build()).build(),
                PiQueryOptions.builder().summary(summary(null, "Average")).interpolate(PiToggle.on()).build()
        );
        for (PiQueryOptions options : variants) {
            var uri = QueryUriBuilder.buildQueryUri(query(options));
            long modes = Stream.of("/plot", "/interpolated", "/recorded", "/summary").filter(uri::contains).count();
            assertEquals(1, modes, uri);
        }
    }

    @Test
    void shouldBuildCalculationIntervalsWithEscapedExpression() {
        var options = PiQueryOptions.builder()
                .expression("'sinusoid' * 2 + 'cdt158'/3")
                .intervalMs(60000)
                .build();

        var uri = QueryUriBuilder.buildQueryUri(query(options));

        assertEquals("/calculation/intervals" + RANGE + "&sampleInterval=60000ms"
                     + "&expression=%27sinusoid%27+%2A+2+%2B+%27cdt158%27%2F3", uri);
    }

    @Test
    void shouldEscapeLikeQueryComponent() {
        assertEquals("%27a%27+%2A+2+~+x", QueryUriBuilder.escape("'a' * 2 ~ x"));
        assertEquals("A-z_0.9~", QueryUriBuilder.escape("A-z_0.9~"));
        assertEquals("%5C%5Cserver%5Csinusoid%7Cx", QueryUriBuilder.escape("\\\\server\\sinusoid|x"));
    }

    @Test
    void shouldFallBackToHostIntervalForCalculation() {
        var uri = QueryUriBuilder.buildQueryUri(query(PiQueryOptions.builder().expression("1").build()));

        assertTrue(uri.contains("&sampleInterval=30000ms&expression=1"), uri);
    }

    @Test
    void shouldBuildCalculationSummaryWithoutSummaryTypes() {
        var options = PiQueryOptions.builder()
                .expression("'tag'")
                .summary(summary("1h", "Average"))
                .build();

        var uri = QueryUriBuilder.buildQueryUri(query(options));

        assertEquals("/calculation/summary" + RANGE + "&expression=%27tag%27", uri);
        assertFalse(uri.contains("summaryType"));
    }

    @Test
    void shouldAddSampleIntervalToInterpolatedCalculationSummary() {
        var options = PiQueryOptions.builder()
                .expression("'tag'")
                .summary(summary("1h", "Average"))
                .interpolate(PiToggle.on())
                .intervalMs(5000)
                .build();

        var uri = QueryUriBuilder.buildQueryUri(query(options));

        assertEquals("/calculation/summary" + RANGE + "&sampleType=Interval&sampleInterval=5000ms&expression=%27tag%27", uri);
    }

    @Test
    void shouldResolveIntervalFromOverrideOrHost() {
        long[][] cases = {
                {0, 0, 0},
                {0, 1500, 1500},
                {250, 0, 250},
                {250, 1500, 250},
        };
        for (long[] c : cases) {
            var query = query(PiQueryOptions.builder().intervalMs((int) c[0]).build());
            query.setIntervalMs(c[1]);
            assertEquals(c[2], PiQueryModes.getIntervalTime(query));
            assertEquals(c[2], PiQueryModes.getIntervalTime(query));
        }
    }

    @Test
    void shouldAppendWebIdToResource() {
        var resource = QueryUriBuilder.buildResource("https://pi/piwebapi", query(new PiQueryOptions()), "F1DPabc");

        assertEquals("https://pi/piwebapi/streamsets/plot" + RANGE + "&intervals=500&webid=F1DPabc", resource);
    }

    @Test
    void shouldRejectQueryWithoutTimeRange() {
        var query = query(new PiQueryOptions());
        query.setTimeRange(null);

        assertThrows(IllegalArgumentException.class, () -> QueryUriBuilder.buildQueryUri(query));
    }
}
