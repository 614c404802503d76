package com.id.pibridge.modules.frame.logic;

import com.id.pibridge.model.PiDataFrame;
import com.id.pibridge.model.PiDataValue;
import com.id.pibridge.modules.batch.model.ErrorContent;
import com.id.pibridge.modules.batch.model.PiBatchContent;
import com.id.pibridge.modules.batch.model.PiBatchContentItem;
import com.id.pibridge.modules.query.model.ProcessedQuery;
import com.id.pibridge.modules.stream.service.StreamChannelRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns processed queries into frames, one per entry and in submission order. Entries that failed still get a
 * frame, carrying the failure as a notice.
 */
@Component
public class FrameAssembler {

    private final StreamChannelRegistry streamChannelRegistry;

    public FrameAssembler(StreamChannelRegistry streamChannelRegistry) {
        this.streamChannelRegistry = streamChannelRegistry;
    }

    public List<PiDataFrame> assemble(String refId, List<ProcessedQuery> processed) {
        List<PiDataFrame> frames = new ArrayList<>(processed.size());
        for (ProcessedQuery query : processed) {
            frames.add(toFrame(refId, query));
        }
        return frames;
    }

    public PiDataFrame toFrame(String refId, ProcessedQuery query) {
        var content = contentOf(query);
        var frame = PiDataFrame.builder()
                .name(query.getLabel())
                .refId(refId)
                .units(content.units())
                .executedQueryString(query.getBatchRequest() == null ? null : query.getBatchRequest().getResource())
                .build();

        if (content instanceof ErrorContent error) {
            frame.getNotices().addAll(error.errors());
        }
        for (PiBatchContentItem item : content.items()) {
            frame.getValues().add(toValue(item, content.units(), query.isDigitalStates()));
        }

        if (query.isStreamable() && query.getWebId() != null) {
            frame.setChannel(streamChannelRegistry.register(
                    query.getDatasourceUid(),
                    query.getWebId(),
                    query.getIntervalNanoSeconds()
            ));
        }
        return frame;
    }

    private static PiBatchContent contentOf(ProcessedQuery query) {
        if (query.getResponse() != null && query.getResponse().content() != null) {
            return query.getResponse().content();
        }
        return ErrorContent.unresolved(query.getFailure());
    }

    private static PiDataValue toValue(PiBatchContentItem item, String contentUnits, boolean digitalStates) {
        var units = item.getUnitsAbbreviation() == null || item.getUnitsAbbreviation().isEmpty()
                ? contentUnits
                : item.getUnitsAbbreviation();
        return PiDataValue.builder()
                .timestamp(item.getTimestamp())
                .value(digitalStates ? digitalStateName(item.getValue()) : item.getValue())
                .units(units)
                .good(item.isGood())
                .questionable(item.isQuestionable())
                .substituted(item.isSubstituted())
                .annotated(item.isAnnotated())
                .build();
    }

    // Digital states arrive as {"Name": "...", "Value": n}
    private static Object digitalStateName(Object value) {
        if (value instanceof Map<?, ?> state && state.get("Name") != null) {
            return state.get("Name");
        }
        return value;
    }
}
